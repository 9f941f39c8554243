package com.rtbhouse.rangesets.api.sequence;

/**
 * A {@link Sequence} that can grow and shrink.
 */
public interface RangeReplaceableSequence<I extends Comparable<? super I>, E> extends Sequence<I, E> {

    /**
     * Removes the elements at {@code [from, to)}. Positions at or after {@code from} are invalidated.
     */
    void removeSubrange(I from, I to);

    void append(E element);

    void clear();

    default void appendAll(Iterable<? extends E> elements) {
        for (E element : elements) {
            append(element);
        }
    }
}
