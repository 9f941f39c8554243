package com.rtbhouse.rangesets.api.range;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndex;

import java.util.AbstractSequentialList;
import java.util.ListIterator;
import java.util.NoSuchElementException;

import com.google.common.collect.DiscreteDomain;
import com.google.common.primitives.Ints;

/**
 * Read-only list of the individual elements covered by a range set.
 */
class RangeSetElements<B extends Comparable<? super B>> extends AbstractSequentialList<B> {

    private final RangeSet<B> rangeSet;
    private final DiscreteDomain<B> domain;

    RangeSetElements(RangeSet<B> rangeSet, DiscreteDomain<B> domain) {
        this.rangeSet = rangeSet;
        this.domain = checkNotNull(domain);
    }

    @Override
    public int size() {
        long size = 0;
        for (int i = 0; i < rangeSet.rangeCount(); i++) {
            IndexRange<B> range = rangeSet.rangeAt(i);
            size += domain.distance(range.lowerBound(), range.upperBound());
        }
        return Ints.saturatedCast(size);
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean contains(Object o) {
        if (o == null) {
            return false;
        }
        try {
            return rangeSet.contains((B) o);
        } catch (ClassCastException e) {
            return false;
        }
    }

    @Override
    public ListIterator<B> listIterator(int index) {
        checkPositionIndex(index, size());
        ElementsIterator iterator = new ElementsIterator();
        for (int i = 0; i < index; i++) {
            iterator.next();
        }
        return iterator;
    }

    private final class ElementsIterator implements ListIterator<B> {
        // range holding the element at the cursor, rangeCount() once past the end
        private int rangeIndex;
        // element at the cursor, null once past the end
        private B cursor;
        private int cursorIndex;

        ElementsIterator() {
            this.rangeIndex = 0;
            this.cursor = rangeSet.isEmpty() ? null : rangeSet.rangeAt(0).lowerBound();
            this.cursorIndex = 0;
        }

        @Override
        public boolean hasNext() {
            return cursor != null;
        }

        @Override
        public B next() {
            if (cursor == null) {
                throw new NoSuchElementException();
            }
            B result = cursor;
            B after = domain.next(result);
            if (after != null && after.compareTo(rangeSet.rangeAt(rangeIndex).upperBound()) < 0) {
                cursor = after;
            } else {
                rangeIndex++;
                cursor = rangeIndex < rangeSet.rangeCount() ? rangeSet.rangeAt(rangeIndex).lowerBound() : null;
            }
            cursorIndex++;
            return result;
        }

        @Override
        public boolean hasPrevious() {
            return cursorIndex > 0;
        }

        @Override
        public B previous() {
            if (cursorIndex == 0) {
                throw new NoSuchElementException();
            }
            if (cursor != null && cursor.compareTo(rangeSet.rangeAt(rangeIndex).lowerBound()) > 0) {
                cursor = domain.previous(cursor);
            } else {
                rangeIndex--;
                cursor = domain.previous(rangeSet.rangeAt(rangeIndex).upperBound());
            }
            cursorIndex--;
            return cursor;
        }

        @Override
        public int nextIndex() {
            return cursorIndex;
        }

        @Override
        public int previousIndex() {
            return cursorIndex - 1;
        }

        @Override
        public void remove() {
            throw new UnsupportedOperationException("elements of a range set are read-only");
        }

        @Override
        public void set(B element) {
            throw new UnsupportedOperationException("elements of a range set are read-only");
        }

        @Override
        public void add(B element) {
            throw new UnsupportedOperationException("elements of a range set are read-only");
        }
    }
}
