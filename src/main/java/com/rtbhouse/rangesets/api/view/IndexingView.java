package com.rtbhouse.rangesets.api.view;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;
import com.rtbhouse.rangesets.api.range.IndexRange;
import com.rtbhouse.rangesets.api.range.RangeSet;
import com.rtbhouse.rangesets.api.sequence.BidirectionalSequence;
import com.rtbhouse.rangesets.api.sequence.MutableSequence;
import com.rtbhouse.rangesets.api.sequence.Sequence;
import com.rtbhouse.rangesets.impl.errors.BadIndexException;

/**
 * The elements of a base sequence at the positions of a {@link RangeSet}, in ascending position order.
 * <p>
 * Creating a view copies the range set but no elements. Reads and writes go to the base sequence; stepping backwards
 * needs a {@link BidirectionalSequence} base and writing needs a {@link MutableSequence} base, otherwise those
 * operations throw {@link UnsupportedOperationException}.
 *
 * @param <I> position type of the base sequence
 * @param <E> element type
 */
public class IndexingView<I extends Comparable<? super I>, E>
        implements BidirectionalSequence<IndexingView.Index<I>, E>, MutableSequence<IndexingView.Index<I>, E>, Iterable<E> {

    private final Sequence<I, E> base;
    private final RangeSet<I> ranges;

    private IndexingView(Sequence<I, E> base, RangeSet<I> ranges) {
        this.base = checkNotNull(base);
        this.ranges = ranges.copy();
        if (!this.ranges.isEmpty()) {
            base.checkPosition(this.ranges.rangeAt(0).lowerBound());
            base.checkPosition(this.ranges.rangeAt(this.ranges.rangeCount() - 1).upperBound());
        }
    }

    public static <I extends Comparable<? super I>, E> IndexingView<I, E> of(Sequence<I, E> base, RangeSet<I> ranges) {
        return new IndexingView<>(base, checkNotNull(ranges));
    }

    public Sequence<I, E> base() {
        return base;
    }

    public RangeSet<I> ranges() {
        return ranges.copy();
    }

    @Override
    public Index<I> startIndex() {
        return ranges.isEmpty() ? endIndex() : new Index<>(0, ranges.rangeAt(0).lowerBound());
    }

    @Override
    public Index<I> endIndex() {
        return new Index<>(ranges.rangeCount(), base.endIndex());
    }

    @Override
    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    @Override
    public Index<I> indexAfter(Index<I> index) {
        checkElementIndex(index);
        I next = base.indexAfter(index.base);
        if (ranges.rangeAt(index.rangeOffset).contains(next)) {
            return new Index<>(index.rangeOffset, next);
        }

        int nextOffset = index.rangeOffset + 1;
        if (nextOffset < ranges.rangeCount()) {
            return new Index<>(nextOffset, ranges.rangeAt(nextOffset).lowerBound());
        }
        return endIndex();
    }

    @Override
    public Index<I> indexBefore(Index<I> index) {
        BidirectionalSequence<I, E> bidirectionalBase = bidirectionalBase();
        if (index.compareTo(startIndex()) <= 0) {
            throw new BadIndexException(String.format("No position before: %s in %s", index, ranges));
        }

        if (index.rangeOffset == ranges.rangeCount()
                || index.base.compareTo(ranges.rangeAt(index.rangeOffset).lowerBound()) == 0) {
            int offset = index.rangeOffset - 1;
            return new Index<>(offset, bidirectionalBase.indexBefore(ranges.rangeAt(offset).upperBound()));
        }
        return new Index<>(index.rangeOffset, bidirectionalBase.indexBefore(index.base));
    }

    @Override
    public E get(Index<I> index) {
        return base.get(checkElementIndex(index).base);
    }

    @Override
    public void set(Index<I> index, E element) {
        mutableBase().set(checkElementIndex(index).base, element);
    }

    @Override
    public void swap(Index<I> i, Index<I> j) {
        mutableBase().swap(checkElementIndex(i).base, checkElementIndex(j).base);
    }

    /**
     * Number of elements in the view. Runs in O(k) distance computations of the base, where k is the number of ranges.
     */
    public int count() {
        int count = 0;
        for (IndexRange<I> range : ranges.ranges()) {
            count += base.distance(range.lowerBound(), range.upperBound());
        }
        return count;
    }

    @Override
    public Index<I> checkElementIndex(Index<I> index) {
        checkNotNull(index);
        if (index.rangeOffset < 0 || index.rangeOffset >= ranges.rangeCount()
                || !ranges.rangeAt(index.rangeOffset).contains(index.base)) {
            throw new BadIndexException(String.format("Index: %s does not refer to an element of %s", index, ranges));
        }
        return index;
    }

    @Override
    public Iterator<E> iterator() {
        return new Iterator<E>() {
            private Index<I> next = startIndex();
            private final Index<I> end = endIndex();

            @Override
            public boolean hasNext() {
                return next.compareTo(end) != 0;
            }

            @Override
            public E next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                E element = get(next);
                next = indexAfter(next);
                return element;
            }
        };
    }

    /**
     * Copies the viewed elements, which must not be null.
     */
    public ImmutableList<E> toList() {
        return ImmutableList.copyOf(this);
    }

    public List<E> toMutableList() {
        List<E> list = new ArrayList<>();
        forEach(list::add);
        return list;
    }

    @Override
    public String toString() {
        return toMutableList().toString();
    }

    private BidirectionalSequence<I, E> bidirectionalBase() {
        if (!(base instanceof BidirectionalSequence)) {
            throw new UnsupportedOperationException("base sequence cannot step backwards: " + base.getClass().getName());
        }
        return (BidirectionalSequence<I, E>) base;
    }

    private MutableSequence<I, E> mutableBase() {
        if (!(base instanceof MutableSequence)) {
            throw new UnsupportedOperationException("base sequence is read-only: " + base.getClass().getName());
        }
        return (MutableSequence<I, E>) base;
    }

    /**
     * Position in an {@link IndexingView}: the offset of the range holding it and the position in the base sequence.
     * Positions compare by their base position alone.
     */
    public static final class Index<I extends Comparable<? super I>> implements Comparable<Index<I>> {
        private final int rangeOffset;
        private final I base;

        Index(int rangeOffset, I base) {
            this.rangeOffset = rangeOffset;
            this.base = checkNotNull(base);
        }

        public I base() {
            return base;
        }

        @Override
        public int compareTo(Index<I> other) {
            return base.compareTo(other.base);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Index)) {
                return false;
            }
            return base.equals(((Index<?>) o).base);
        }

        @Override
        public int hashCode() {
            return base.hashCode();
        }

        @Override
        public String toString() {
            return "Index{" + rangeOffset + ", " + base + "}";
        }
    }
}
