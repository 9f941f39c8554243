package com.rtbhouse.rangesets.api.algorithm;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.rtbhouse.rangesets.api.range.IndexRange.range;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.rtbhouse.rangesets.api.range.IndexRange;
import com.rtbhouse.rangesets.api.range.RangeExpression;
import com.rtbhouse.rangesets.api.range.RangeSet;
import com.rtbhouse.rangesets.api.sequence.MutableSequence;
import com.rtbhouse.rangesets.api.sequence.RangeReplaceableSequence;
import com.rtbhouse.rangesets.api.sequence.Sequence;
import com.rtbhouse.rangesets.api.view.IndexingView;

/**
 * Edits of a sequence at many positions at once, driven by a {@link RangeSet} of positions or by a predicate.
 * <p>
 * Gathering and shifting take an insertion point: the moved elements end up right before the element that was at
 * that position, or at the end of the sequence for {@code endIndex}.
 */
public class BatchEdits {

    private static final Logger logger = LoggerFactory.getLogger(BatchEdits.class);

    /**
     * Returns the positions of the elements satisfying {@code predicate}.
     */
    public static <I extends Comparable<? super I>, E> RangeSet<I> indicesWhere(Sequence<I, E> sequence,
                                                                            Predicate<? super E> predicate) {
        checkNotNull(predicate);
        RangeSet.Builder<I> indices = RangeSet.builder();
        I end = sequence.endIndex();
        for (I index = sequence.startIndex(); index.compareTo(end) != 0; ) {
            I next = sequence.indexAfter(index);
            if (predicate.test(sequence.get(index))) {
                indices.add(range(index, next));
            }
            index = next;
        }
        return indices.build();
    }

    public static <I extends Comparable<? super I>, E> RangeSet<I> indicesOf(Sequence<I, E> sequence, Object element) {
        return indicesWhere(sequence, e -> Objects.equals(e, element));
    }

    /**
     * Returns the elements of {@code sequence} at {@code positions}. No element is copied.
     */
    public static <I extends Comparable<? super I>, E> IndexingView<I, E> view(Sequence<I, E> sequence,
                                                                          RangeSet<I> positions) {
        return IndexingView.of(sequence, positions);
    }

    /**
     * Writes {@code values}, in order, to the positions of {@code positions}. There must be exactly one value per
     * position.
     */
    public static <I extends Comparable<? super I>, E> void assign(MutableSequence<I, E> sequence, RangeSet<I> positions,
                                                                   Iterable<? extends E> values) {
        IndexingView<I, E> view = IndexingView.of(sequence, positions);
        List<E> newValues = Lists.newArrayList(values);
        int count = view.count();
        checkArgument(count == newValues.size(), "condition not met [positions count == values count]: %s, %s",
                count, newValues.size());

        IndexingView.Index<I> index = view.startIndex();
        for (E value : newValues) {
            view.set(index, value);
            index = view.indexAfter(index);
        }
    }

    /**
     * Removes the elements at {@code positions}, keeping the order of the remaining ones.
     * <p>
     * A sequence that is also a {@link MutableSequence} is compacted in place with O(n) swaps and truncated once,
     * any other sequence is cleared and refilled with the remaining elements.
     */
    public static <I extends Comparable<? super I>, E> void removeAll(RangeReplaceableSequence<I, E> sequence,
                                                                      RangeSet<I> positions) {
        checkNotNull(positions);
        if (positions.isEmpty()) {
            return;
        }
        checkBounds(sequence, positions);

        if (sequence instanceof MutableSequence) {
            I endOfKept = compact(asMutable(sequence), positions);
            sequence.removeSubrange(endOfKept, sequence.endIndex());
        } else {
            List<E> kept = removingAll(sequence, positions).toMutableList();
            sequence.clear();
            sequence.appendAll(kept);
        }
        logger.debug("removed elements at {}", positions);
    }

    /**
     * Returns the elements of {@code sequence} that are not at {@code positions}, leaving the sequence untouched.
     */
    public static <I extends Comparable<? super I>, E> IndexingView<I, E> removingAll(Sequence<I, E> sequence,
                                                                                 RangeSet<I> positions) {
        checkBounds(sequence, positions);
        return IndexingView.of(sequence, positions.inverted(sequence));
    }

    /**
     * Moves the elements at {@code positions} right before {@code insertionPoint}, keeping the order of both the moved
     * and the other elements.
     * <p>
     * Runs in O(n log n) swaps.
     *
     * @return the range occupied by the moved elements
     */
    public static <I extends Comparable<? super I>, E> IndexRange<I> gather(MutableSequence<I, E> sequence,
                                                                           RangeSet<I> positions, I insertionPoint) {
        checkBounds(sequence, positions);
        sequence.checkPosition(insertionPoint);
        RangeSet<I> members = positions.copy();

        I lower = Partitions.indexedStablePartition(sequence, sequence.startIndex(), insertionPoint, members::contains);
        I upper = Partitions.indexedStablePartition(sequence, insertionPoint, sequence.endIndex(),
                index -> !members.contains(index));
        IndexRange<I> gathered = range(lower, upper);
        logger.debug("gathered elements at {} into {}", members, gathered);
        return gathered;
    }

    /**
     * Moves the elements satisfying {@code predicate} right before {@code insertionPoint}, keeping the order of both
     * the moved and the other elements.
     *
     * @return the range occupied by the moved elements
     */
    public static <I extends Comparable<? super I>, E> IndexRange<I> gather(MutableSequence<I, E> sequence, I insertionPoint,
                                                                           Predicate<? super E> predicate) {
        checkNotNull(predicate);
        sequence.checkPosition(insertionPoint);

        I lower = Partitions.stablePartition(sequence, sequence.startIndex(), insertionPoint, predicate);
        I upper = Partitions.stablePartition(sequence, insertionPoint, sequence.endIndex(), e -> !predicate.test(e));
        IndexRange<I> gathered = range(lower, upper);
        logger.debug("gathered matching elements into {}", gathered);
        return gathered;
    }

    /**
     * Moves the contiguous block {@code source} right before {@code insertionPoint}. An insertion point inside the
     * block, or at either of its bounds, leaves the sequence unchanged.
     * <p>
     * Runs in O(distance) swaps.
     *
     * @return the range occupied by the moved block
     */
    public static <I extends Comparable<? super I>, E> IndexRange<I> shift(MutableSequence<I, E> sequence,
                                                                          RangeExpression<I> source, I insertionPoint) {
        IndexRange<I> moved = checkNotNull(source).relativeTo(sequence);
        sequence.checkPosition(moved.lowerBound());
        sequence.checkPosition(moved.upperBound());
        sequence.checkPosition(insertionPoint);

        if (insertionPoint.compareTo(moved.lowerBound()) < 0) {
            I end = Rotations.rotateInRange(sequence, insertionPoint, moved.upperBound(), moved.lowerBound());
            return range(insertionPoint, end);
        }
        if (insertionPoint.compareTo(moved.upperBound()) > 0) {
            I start = Rotations.rotateInRange(sequence, moved.lowerBound(), insertionPoint, moved.upperBound());
            return range(start, insertionPoint);
        }
        return moved;
    }

    /**
     * Moves the single element at {@code source} right before {@code insertionPoint}.
     *
     * @return the new position of the moved element
     */
    public static <I extends Comparable<? super I>, E> I shift(MutableSequence<I, E> sequence, I source, I insertionPoint) {
        sequence.checkElementIndex(source);
        sequence.checkPosition(insertionPoint);

        int order = source.compareTo(insertionPoint);
        if (order == 0) {
            return source;
        }
        I afterSource = sequence.indexAfter(source);
        if (order < 0) {
            return Rotations.rotateInRange(sequence, source, insertionPoint, afterSource);
        }
        Rotations.rotateInRange(sequence, insertionPoint, afterSource, source);
        return insertionPoint;
    }

    /**
     * Swaps the kept elements towards the front, over the removed ones. The sequence is split into kept, removed and
     * not yet visited elements, the first removed element moves as the kept block grows.
     *
     * @return the position after the last kept element
     */
    private static <I extends Comparable<? super I>, E> I compact(MutableSequence<I, E> sequence, RangeSet<I> positions) {
        I endOfKept = positions.rangeAt(0).lowerBound();
        for (int i = 0; i < positions.rangeCount(); i++) {
            I gapEnd = i + 1 < positions.rangeCount() ? positions.rangeAt(i + 1).lowerBound() : sequence.endIndex();
            for (I index = positions.rangeAt(i).upperBound(); index.compareTo(gapEnd) != 0; ) {
                sequence.swap(endOfKept, index);
                endOfKept = sequence.indexAfter(endOfKept);
                index = sequence.indexAfter(index);
            }
        }
        return endOfKept;
    }

    private static <I extends Comparable<? super I>, E> MutableSequence<I, E> asMutable(Sequence<I, E> sequence) {
        return (MutableSequence<I, E>) sequence;
    }

    private static <I extends Comparable<? super I>> void checkBounds(Sequence<I, ?> sequence, RangeSet<I> positions) {
        checkNotNull(positions);
        if (!positions.isEmpty()) {
            sequence.checkPosition(positions.rangeAt(0).lowerBound());
            sequence.checkPosition(positions.rangeAt(positions.rangeCount() - 1).upperBound());
        }
    }
}
