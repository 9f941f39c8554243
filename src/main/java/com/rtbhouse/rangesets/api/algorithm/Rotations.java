package com.rtbhouse.rangesets.api.algorithm;

import com.rtbhouse.rangesets.api.sequence.MutableSequence;
import com.rtbhouse.rangesets.impl.errors.BadIndexException;

/**
 * In-place rotation of a block of a {@link MutableSequence}.
 */
public class Rotations {

    /**
     * Rotates the whole sequence so that the element at {@code newFirst} ends up first.
     *
     * @return the new position of the element that was first before the rotation
     */
    public static <I extends Comparable<? super I>, E> I rotate(MutableSequence<I, E> sequence, I newFirst) {
        return rotate(sequence, sequence.startIndex(), sequence.endIndex(), newFirst);
    }

    /**
     * Rotates {@code [from, to)} so that the element at {@code newFirst} ends up at {@code from}. Both blocks
     * {@code [from, newFirst)} and {@code [newFirst, to)} keep their internal order.
     * <p>
     * Runs in O(n) swaps with O(1) extra space.
     *
     * @return the new position of the element that was at {@code from}, which is {@code to} if {@code newFirst == from}
     * and {@code from} if {@code newFirst == to}
     */
    public static <I extends Comparable<? super I>, E> I rotate(MutableSequence<I, E> sequence, I from, I to, I newFirst) {
        sequence.checkPosition(from);
        sequence.checkPosition(to);
        sequence.checkPosition(newFirst);
        if (from.compareTo(newFirst) > 0 || newFirst.compareTo(to) > 0) {
            throw new BadIndexException(String.format("condition not met [from <= newFirst <= to]: %s, %s, %s",
                    from, newFirst, to));
        }
        return rotateInRange(sequence, from, to, newFirst);
    }

    static <I extends Comparable<? super I>, E> I rotateInRange(MutableSequence<I, E> sequence, I from, I to, I newFirst) {
        I start = from;
        I middle = newFirst;
        I end = to;

        if (same(start, middle)) {
            return end;
        }
        if (same(middle, end)) {
            return start;
        }

        // [start, middle) and [middle, end) are exchanged by swapping their leading elements pairwise, which
        // leaves a smaller rotation of the same shape behind
        I result = null;
        while (true) {
            I leftStop = start;
            I rightStop = middle;
            do {
                sequence.swap(leftStop, rightStop);
                leftStop = sequence.indexAfter(leftStop);
                rightStop = sequence.indexAfter(rightStop);
            } while (!same(leftStop, middle) && !same(rightStop, end));

            if (same(rightStop, end)) {
                // the element that was last has reached its final place, leftStop is right after it
                if (result == null) {
                    result = leftStop;
                }
                if (same(leftStop, middle)) {
                    break;
                }
            }

            start = leftStop;
            if (same(start, middle)) {
                middle = rightStop;
            }
        }
        return result;
    }

    private static <I extends Comparable<? super I>> boolean same(I a, I b) {
        return a.compareTo(b) == 0;
    }
}
