package com.rtbhouse.rangesets.api.sequence;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.rtbhouse.rangesets.impl.errors.BadIndexException;

/**
 * Read access to an ordered sequence whose positions are comparable values.
 * <p>
 * Valid positions of a sequence are {@link #startIndex()}, every position reachable from it with
 * {@link #indexAfter(Comparable)}, and {@link #endIndex()}, which is one past the last element.
 *
 * @param <I> position type
 * @param <E> element type
 */
public interface Sequence<I extends Comparable<? super I>, E> {

    I startIndex();

    I endIndex();

    /**
     * Returns the position immediately after {@code index}, which must not be {@link #endIndex()}.
     */
    I indexAfter(I index);

    E get(I index);

    default boolean isEmpty() {
        return startIndex().compareTo(endIndex()) == 0;
    }

    /**
     * Returns the number of elements in {@code [from, to)}.
     * <p>
     * Walks the positions one by one, implementations with random access should override it.
     */
    default int distance(I from, I to) {
        checkArgument(from.compareTo(to) <= 0, "condition not met [from <= to]: %s, %s", from, to);
        int distance = 0;
        I index = from;
        while (index.compareTo(to) != 0) {
            index = indexAfter(index);
            distance++;
        }
        return distance;
    }

    /**
     * Returns the position {@code distance} elements after {@code index}.
     */
    default I offset(I index, int distance) {
        checkArgument(distance >= 0, "negative distance: %s", distance);
        I result = index;
        for (int i = 0; i < distance; i++) {
            result = indexAfter(result);
        }
        return result;
    }

    /**
     * Checks that {@code index} lies within {@code [startIndex, endIndex]}.
     */
    default I checkPosition(I index) {
        checkNotNull(index);
        if (index.compareTo(startIndex()) < 0 || index.compareTo(endIndex()) > 0) {
            throw new BadIndexException(String.format("Position: %s is out of bounds [%s, %s]",
                    index, startIndex(), endIndex()));
        }
        return index;
    }

    /**
     * Checks that {@code index} lies within {@code [startIndex, endIndex)}, i.e. refers to an element.
     */
    default I checkElementIndex(I index) {
        checkNotNull(index);
        if (index.compareTo(startIndex()) < 0 || index.compareTo(endIndex()) >= 0) {
            throw new BadIndexException(String.format("Index: %s does not refer to an element of [%s, %s)",
                    index, startIndex(), endIndex()));
        }
        return index;
    }
}
