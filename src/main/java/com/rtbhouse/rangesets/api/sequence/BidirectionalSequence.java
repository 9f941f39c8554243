package com.rtbhouse.rangesets.api.sequence;

/**
 * A {@link Sequence} that can also be walked backwards.
 */
public interface BidirectionalSequence<I extends Comparable<? super I>, E> extends Sequence<I, E> {

    /**
     * Returns the position immediately before {@code index}, which must not be {@link #startIndex()}.
     */
    I indexBefore(I index);
}
