package com.rtbhouse.rangesets.impl.range;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rtbhouse.rangesets.api.range.IndexRange;
import com.rtbhouse.rangesets.impl.errors.InvariantViolationException;

/**
 * Structural checks of the interval list backing a range set: no interval is empty, intervals are ascending and no
 * two consecutive intervals overlap or touch.
 */
public class RangeSetInvariants {

    private static final Logger logger = LoggerFactory.getLogger(RangeSetInvariants.class);

    public static <B extends Comparable<? super B>> boolean holdFor(List<IndexRange<B>> ranges) {
        return findViolation(ranges) == null;
    }

    public static <B extends Comparable<? super B>> void check(List<IndexRange<B>> ranges) {
        String violation = findViolation(ranges);
        if (violation != null) {
            logger.error("range set invariant violated: {} in {}", violation, ranges);
            throw new InvariantViolationException(violation);
        }
    }

    private static <B extends Comparable<? super B>> String findViolation(List<IndexRange<B>> ranges) {
        IndexRange<B> previous = null;
        for (IndexRange<B> range : ranges) {
            if (range.isEmpty()) {
                return String.format("empty range %s", range);
            }
            if (previous != null && previous.upperBound().compareTo(range.lowerBound()) >= 0) {
                return String.format("condition not met [previous.upperBound() < range.lowerBound()]: %s, %s", previous, range);
            }
            previous = range;
        }
        return null;
    }
}
