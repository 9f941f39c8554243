package com.rtbhouse.rangesets.api.sequence;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The characters of a {@link StringBuilder}, positions are the char indices.
 */
public class StringBuilderSequence extends IntIndexedSequence<Character> {

    private final StringBuilder builder;

    private StringBuilderSequence(StringBuilder builder) {
        this.builder = checkNotNull(builder);
    }

    public static StringBuilderSequence wrap(StringBuilder builder) {
        return new StringBuilderSequence(builder);
    }

    public static StringBuilderSequence of(CharSequence chars) {
        return new StringBuilderSequence(new StringBuilder(chars));
    }

    @Override
    int size() {
        return builder.length();
    }

    @Override
    public Character get(Integer index) {
        return builder.charAt(checkElementIndex(index));
    }

    @Override
    public void set(Integer index, Character element) {
        builder.setCharAt(checkElementIndex(index), checkNotNull(element));
    }

    @Override
    public void removeSubrange(Integer from, Integer to) {
        checkSubrange(from, to);
        builder.delete(from, to);
    }

    @Override
    public void append(Character element) {
        builder.append(checkNotNull(element).charValue());
    }

    @Override
    public void clear() {
        builder.setLength(0);
    }

    @Override
    public String toString() {
        return builder.toString();
    }
}
