package com.rtbhouse.rangesets.test.utils;

import java.util.ArrayList;
import java.util.Collection;

/**
 * An {@link ArrayList} counting the operations that copy or rebuild its whole content. Single element reads, writes
 * and range removals are not counted.
 */
public class CopyCountingList<E> extends ArrayList<E> {

    private static final long serialVersionUID = 1L;

    private int bulkCopies;

    public CopyCountingList(Collection<? extends E> elements) {
        super(elements);
    }

    public int bulkCopies() {
        return bulkCopies;
    }

    @Override
    public Object[] toArray() {
        bulkCopies++;
        return super.toArray();
    }

    @Override
    public <T> T[] toArray(T[] a) {
        bulkCopies++;
        return super.toArray(a);
    }

    @Override
    public boolean addAll(Collection<? extends E> c) {
        bulkCopies++;
        return super.addAll(c);
    }

    @Override
    public boolean addAll(int index, Collection<? extends E> c) {
        bulkCopies++;
        return super.addAll(index, c);
    }

    @Override
    public void clear() {
        bulkCopies++;
        super.clear();
    }

    @Override
    public Object clone() {
        bulkCopies++;
        return super.clone();
    }
}
