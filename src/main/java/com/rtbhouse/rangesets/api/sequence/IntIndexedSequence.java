package com.rtbhouse.rangesets.api.sequence;

import com.rtbhouse.rangesets.impl.errors.BadIndexException;

/**
 * Position arithmetic shared by the sequences addressed by {@code 0 .. size()}.
 */
abstract class IntIndexedSequence<E> implements BidirectionalSequence<Integer, E>, MutableSequence<Integer, E>,
        RangeReplaceableSequence<Integer, E> {

    abstract int size();

    @Override
    public Integer startIndex() {
        return 0;
    }

    @Override
    public Integer endIndex() {
        return size();
    }

    @Override
    public Integer indexAfter(Integer index) {
        return checkElementIndex(index) + 1;
    }

    @Override
    public Integer indexBefore(Integer index) {
        if (index <= 0 || index > size()) {
            throw new BadIndexException(String.format("No position before: %s in [0, %s]", index, size()));
        }
        return index - 1;
    }

    @Override
    public int distance(Integer from, Integer to) {
        checkPosition(from);
        checkPosition(to);
        return to - from;
    }

    @Override
    public Integer offset(Integer index, int distance) {
        checkPosition(index);
        return checkPosition(index + distance);
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    void checkSubrange(Integer from, Integer to) {
        checkPosition(from);
        checkPosition(to);
        if (from > to) {
            throw new BadIndexException(String.format("Subrange bounds out of order: %s, %s", from, to));
        }
    }
}
