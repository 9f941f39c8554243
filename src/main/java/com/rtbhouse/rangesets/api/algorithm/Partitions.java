package com.rtbhouse.rangesets.api.algorithm;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import com.rtbhouse.rangesets.api.sequence.MutableSequence;
import com.rtbhouse.rangesets.api.sequence.Sequence;
import com.rtbhouse.rangesets.impl.errors.BadIndexException;

/**
 * Partitioning of a block of a sequence by a predicate. Elements for which the predicate holds belong to the second
 * partition and end up at the back of the block.
 */
public class Partitions {

    public static <I extends Comparable<? super I>, E> I halfStablePartition(MutableSequence<I, E> sequence,
                                                                             Predicate<? super E> belongsInSecondPartition) {
        return halfStablePartition(sequence, sequence.startIndex(), sequence.endIndex(), belongsInSecondPartition);
    }

    /**
     * Moves the elements of {@code [from, to)} for which the predicate holds behind the others. Only the elements of
     * the first partition keep their relative order.
     * <p>
     * Runs in O(n) with O(1) extra space.
     *
     * @return the start of the second partition, {@code to} if it is empty
     */
    public static <I extends Comparable<? super I>, E> I halfStablePartition(MutableSequence<I, E> sequence, I from, I to,
                                                                             Predicate<? super E> belongsInSecondPartition) {
        checkSubrange(sequence, from, to);
        checkNotNull(belongsInSecondPartition);

        I i = from;
        while (i.compareTo(to) != 0 && !belongsInSecondPartition.test(sequence.get(i))) {
            i = sequence.indexAfter(i);
        }
        if (i.compareTo(to) == 0) {
            return to;
        }

        I j = sequence.indexAfter(i);
        while (j.compareTo(to) != 0) {
            if (!belongsInSecondPartition.test(sequence.get(j))) {
                sequence.swap(i, j);
                i = sequence.indexAfter(i);
            }
            j = sequence.indexAfter(j);
        }
        return i;
    }

    public static <I extends Comparable<? super I>, E> I stablePartition(MutableSequence<I, E> sequence,
                                                                         Predicate<? super E> belongsInSecondPartition) {
        return stablePartition(sequence, sequence.startIndex(), sequence.endIndex(), belongsInSecondPartition);
    }

    /**
     * Moves the elements of {@code [from, to)} for which the predicate holds behind the others, both partitions keep
     * their relative order.
     * <p>
     * Runs in O(n log n) swaps with O(1) extra space (apart from the O(log n) recursion).
     *
     * @return the start of the second partition, {@code to} if it is empty
     */
    public static <I extends Comparable<? super I>, E> I stablePartition(MutableSequence<I, E> sequence, I from, I to,
                                                                         Predicate<? super E> belongsInSecondPartition) {
        checkSubrange(sequence, from, to);
        checkNotNull(belongsInSecondPartition);
        return stablePartition(sequence, sequence.distance(from, to), from, to,
                index -> belongsInSecondPartition.test(sequence.get(index)));
    }

    /**
     * {@link #stablePartition(MutableSequence, Comparable, Comparable, Predicate)} with a predicate on the position of
     * an element instead of its value. Every position is tested exactly once, before any element is moved into it.
     */
    public static <I extends Comparable<? super I>, E> I indexedStablePartition(MutableSequence<I, E> sequence, I from, I to,
                                                                                Predicate<? super I> belongsInSecondPartition) {
        checkSubrange(sequence, from, to);
        checkNotNull(belongsInSecondPartition);
        return stablePartition(sequence, sequence.distance(from, to), from, to, belongsInSecondPartition);
    }

    static <I extends Comparable<? super I>, E> I stablePartition(MutableSequence<I, E> sequence, int count, I from, I to,
                                                                  Predicate<? super I> belongsInSecondPartition) {
        if (count == 0) {
            return from;
        }
        if (count == 1) {
            return belongsInSecondPartition.test(from) ? from : to;
        }

        int half = count / 2;
        I middle = sequence.offset(from, half);
        I secondOfLeft = stablePartition(sequence, half, from, middle, belongsInSecondPartition);
        I secondOfRight = stablePartition(sequence, count - half, middle, to, belongsInSecondPartition);
        // [first of left | second of left | first of right | second of right]: swap the two blocks in the middle
        return Rotations.rotateInRange(sequence, secondOfLeft, secondOfRight, middle);
    }

    /**
     * Copying counterpart of {@link #stablePartition(MutableSequence, Predicate)}.
     */
    public static <E> Partitioned<E> stablyPartitioned(Iterable<? extends E> elements,
                                                       Predicate<? super E> belongsInSecondPartition) {
        checkNotNull(belongsInSecondPartition);
        List<E> partitioned = new ArrayList<>();
        List<E> second = new ArrayList<>();
        int partitioningIndex = 0;
        for (E element : elements) {
            if (belongsInSecondPartition.test(element)) {
                second.add(element);
            } else {
                partitioned.add(element);
                partitioningIndex++;
            }
        }
        partitioned.addAll(second);
        return new Partitioned<>(partitioned, partitioningIndex);
    }

    /**
     * Returns the first position in {@code [from, to)} whose element satisfies the predicate, or {@code to}. The block
     * must already be partitioned by the predicate.
     * <p>
     * Runs in O(log n) predicate calls.
     */
    public static <I extends Comparable<? super I>, E> I partitioningIndex(Sequence<I, E> sequence, I from, I to,
                                                                           Predicate<? super E> predicate) {
        checkSubrange(sequence, from, to);
        int count = sequence.distance(from, to);
        I low = from;
        while (count > 0) {
            int half = count / 2;
            I middle = sequence.offset(low, half);
            if (predicate.test(sequence.get(middle))) {
                count = half;
            } else {
                low = sequence.indexAfter(middle);
                count -= half + 1;
            }
        }
        return low;
    }

    static <I extends Comparable<? super I>> void checkSubrange(Sequence<I, ?> sequence, I from, I to) {
        sequence.checkPosition(from);
        sequence.checkPosition(to);
        if (from.compareTo(to) > 0) {
            throw new BadIndexException(String.format("condition not met [from <= to]: %s, %s", from, to));
        }
    }
}
