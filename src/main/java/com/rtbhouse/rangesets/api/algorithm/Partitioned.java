package com.rtbhouse.rangesets.api.algorithm;

import static com.google.common.base.Preconditions.checkPositionIndex;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of {@link Partitions#stablyPartitioned}: the partitioned elements and the index where the second
 * partition starts. The elements may contain nulls.
 */
public final class Partitioned<E> {
    private final List<E> elements;
    private final int partitioningIndex;

    Partitioned(List<E> elements, int partitioningIndex) {
        checkPositionIndex(partitioningIndex, elements.size());
        this.elements = Collections.unmodifiableList(elements);
        this.partitioningIndex = partitioningIndex;
    }

    public List<E> elements() {
        return elements;
    }

    public int partitioningIndex() {
        return partitioningIndex;
    }

    public List<E> firstPartition() {
        return elements.subList(0, partitioningIndex);
    }

    public List<E> secondPartition() {
        return elements.subList(partitioningIndex, elements.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Partitioned)) {
            return false;
        }
        Partitioned<?> that = (Partitioned<?>) o;
        return partitioningIndex == that.partitioningIndex && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements, partitioningIndex);
    }

    @Override
    public String toString() {
        return "Partitioned{" +
                "first=" + firstPartition() +
                ", second=" + secondPartition() +
                '}';
    }
}
