package com.rtbhouse.rangesets.api.range;

import static com.google.common.base.Preconditions.checkNotNull;

import com.rtbhouse.rangesets.api.sequence.Sequence;

/**
 * A description of positions that becomes a concrete {@link IndexRange} once the sequence it refers to is known.
 */
public interface RangeExpression<B extends Comparable<? super B>> {

    /**
     * {@code ..<upperBound}
     */
    static <B extends Comparable<? super B>> RangeExpression<B> upTo(B upperBound) {
        checkNotNull(upperBound);
        return sequence -> IndexRange.range(sequence.startIndex(), upperBound);
    }

    /**
     * {@code ...last}, the element at {@code last} included.
     */
    static <B extends Comparable<? super B>> RangeExpression<B> through(B last) {
        checkNotNull(last);
        return sequence -> IndexRange.range(sequence.startIndex(), sequence.indexAfter(last));
    }

    /**
     * {@code lowerBound...}
     */
    static <B extends Comparable<? super B>> RangeExpression<B> from(B lowerBound) {
        checkNotNull(lowerBound);
        return sequence -> IndexRange.range(lowerBound, sequence.endIndex());
    }

    /**
     * {@code first...last}, both elements included.
     */
    static <B extends Comparable<? super B>> RangeExpression<B> closed(B first, B last) {
        checkNotNull(first);
        checkNotNull(last);
        return sequence -> IndexRange.range(first, sequence.indexAfter(last));
    }

    static <B extends Comparable<? super B>> RangeExpression<B> all() {
        return sequence -> IndexRange.range(sequence.startIndex(), sequence.endIndex());
    }

    IndexRange<B> relativeTo(Sequence<B, ?> sequence);
}
