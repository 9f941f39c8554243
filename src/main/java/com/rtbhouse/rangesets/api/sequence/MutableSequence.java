package com.rtbhouse.rangesets.api.sequence;

/**
 * A {@link Sequence} whose elements can be replaced in place.
 */
public interface MutableSequence<I extends Comparable<? super I>, E> extends Sequence<I, E> {

    void set(I index, E element);

    default void swap(I i, I j) {
        if (i.compareTo(j) == 0) {
            return;
        }
        E element = get(i);
        set(i, get(j));
        set(j, element);
    }
}
