package com.rtbhouse.rangesets.api.range;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

import com.rtbhouse.rangesets.api.sequence.Sequence;

/**
 * Half-open interval {@code [lowerBound, upperBound)} of positions.
 *
 * @param <B> bound type
 */
public final class IndexRange<B extends Comparable<? super B>> implements RangeExpression<B> {

    private final B lowerBound;
    private final B upperBound;

    private IndexRange(B lowerBound, B upperBound) {
        checkNotNull(lowerBound);
        checkNotNull(upperBound);
        checkArgument(lowerBound.compareTo(upperBound) <= 0,
                "condition not met [lowerBound <= upperBound]: %s, %s", lowerBound, upperBound);
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public static <B extends Comparable<? super B>> IndexRange<B> range(B lowerBound, B upperBound) {
        return new IndexRange<>(lowerBound, upperBound);
    }

    public static <B extends Comparable<? super B>> IndexRange<B> empty(B at) {
        return new IndexRange<>(at, at);
    }

    public B lowerBound() {
        return lowerBound;
    }

    public B upperBound() {
        return upperBound;
    }

    public boolean isEmpty() {
        return lowerBound.compareTo(upperBound) == 0;
    }

    public boolean contains(B bound) {
        return lowerBound.compareTo(bound) <= 0 && bound.compareTo(upperBound) < 0;
    }

    public boolean overlaps(IndexRange<B> other) {
        return !isEmpty() && !other.isEmpty()
                && lowerBound.compareTo(other.upperBound) < 0
                && other.lowerBound.compareTo(upperBound) < 0;
    }

    public boolean encloses(IndexRange<B> other) {
        return lowerBound.compareTo(other.lowerBound) <= 0 && other.upperBound.compareTo(upperBound) <= 0;
    }

    @Override
    public IndexRange<B> relativeTo(Sequence<B, ?> sequence) {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexRange)) {
            return false;
        }
        IndexRange<?> that = (IndexRange<?>) o;
        return lowerBound.equals(that.lowerBound) && upperBound.equals(that.upperBound);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowerBound, upperBound);
    }

    @Override
    public String toString() {
        return lowerBound + "..<" + upperBound;
    }
}
