package com.rtbhouse.rangesets.api.sequence;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

/**
 * {@link java.util.List} adapter, positions are the list indices.
 * <p>
 * Writes go straight to the wrapped list.
 */
public class ListSequence<E> extends IntIndexedSequence<E> {

    private final List<E> list;

    private ListSequence(List<E> list) {
        this.list = checkNotNull(list);
    }

    /**
     * Wraps {@code list} without copying it.
     */
    public static <E> ListSequence<E> wrap(List<E> list) {
        return new ListSequence<>(list);
    }

    public static <E> ListSequence<E> copyOf(Iterable<? extends E> elements) {
        return new ListSequence<>(Lists.newArrayList(elements));
    }

    @SafeVarargs
    public static <E> ListSequence<E> of(E... elements) {
        return new ListSequence<>(new ArrayList<>(Arrays.asList(elements)));
    }

    public List<E> list() {
        return list;
    }

    @Override
    int size() {
        return list.size();
    }

    @Override
    public E get(Integer index) {
        return list.get(checkElementIndex(index));
    }

    @Override
    public void set(Integer index, E element) {
        list.set(checkElementIndex(index), element);
    }

    @Override
    public void swap(Integer i, Integer j) {
        Collections.swap(list, checkElementIndex(i), checkElementIndex(j));
    }

    @Override
    public void removeSubrange(Integer from, Integer to) {
        checkSubrange(from, to);
        list.subList(from, to).clear();
    }

    @Override
    public void append(E element) {
        list.add(element);
    }

    @Override
    public void clear() {
        list.clear();
    }

    @Override
    public String toString() {
        return list.toString();
    }
}
