package com.rtbhouse.rangesets.api;

import java.util.Map;
import java.util.Properties;
import java.util.function.Supplier;

import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Suppliers;
import com.rtbhouse.rangesets.api.range.RangeSet;

/**
 * Library-wide settings of range-sets.
 */
public class RangeSetsConfig extends AbstractConfig {

    private static final Logger logger = LoggerFactory.getLogger(RangeSetsConfig.class);

    /**
     * Prefix shared by all range-sets properties.
     */
    public static final String PREFIX = "rangesets.";

    /**
     * Whether {@link RangeSet} verifies its interval list after every mutation.
     */
    public static final String INVARIANTS_CHECK = PREFIX + "invariants.check";
    private static final String INVARIANTS_CHECK_DOC = "Whether RangeSet verifies its interval list (ascending, non-empty," +
            " non-adjacent intervals) after every mutation.";
    private static final boolean INVARIANTS_CHECK_DEFAULT = RangeSet.class.desiredAssertionStatus();

    private static final ConfigDef CONFIG;

    static {
        CONFIG = new ConfigDef()
                .define(INVARIANTS_CHECK,
                        Type.BOOLEAN,
                        INVARIANTS_CHECK_DEFAULT,
                        Importance.LOW,
                        INVARIANTS_CHECK_DOC);
    }

    private static final Supplier<RangeSetsConfig> GLOBAL =
            Suppliers.memoize(RangeSetsConfig::fromSystemProperties);

    public RangeSetsConfig(Map<?, ?> props) {
        super(CONFIG, props, false);
    }

    public RangeSetsConfig(Properties props) {
        this((Map<?, ?>) props);
    }

    public static RangeSetsConfig fromSystemProperties() {
        RangeSetsConfig config = new RangeSetsConfig(System.getProperties());
        logger.debug("resolved range-sets config from system properties: {}", config);
        return config;
    }

    /**
     * The configuration resolved once from the system properties and used by the library itself.
     */
    public static RangeSetsConfig global() {
        return GLOBAL.get();
    }

    public static ConfigDef configDef() {
        return new ConfigDef(CONFIG);
    }

    public boolean isInvariantsCheckEnabled() {
        return getBoolean(INVARIANTS_CHECK);
    }

    @Override
    public String toString() {
        return "RangeSetsConfig{" +
                INVARIANTS_CHECK + "=" + isInvariantsCheckEnabled() +
                '}';
    }
}
