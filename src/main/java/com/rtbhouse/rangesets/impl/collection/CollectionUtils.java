package com.rtbhouse.rangesets.impl.collection;

import static com.google.common.base.Preconditions.checkPositionIndexes;

import java.util.List;
import java.util.RandomAccess;
import java.util.function.Predicate;

public class CollectionUtils {

    /**
     * Returns the index of the first element in the list for which the predicate holds, or the list size if there is no such element.
     * The predicate must be false for some prefix of the list and true for the rest of it.
     */
    public static <E, L extends List<E> & RandomAccess> int partitioningIndex(L elements, Predicate<? super E> predicate) {
        return partitioningIndex(elements, 0, elements.size(), predicate);
    }

    /**
     * Returns the index in [fromIndex, toIndex] of the first element for which the predicate holds, or toIndex if there is no such element.
     * The predicate must be false for some prefix of the sublist and true for the rest of it.
     */
    public static <E, L extends List<E> & RandomAccess> int partitioningIndex(L elements, int fromIndex, int toIndex,
                                                                              Predicate<? super E> predicate) {
        checkPositionIndexes(fromIndex, toIndex, elements.size());
        int low = fromIndex;
        int high = toIndex;

        while (low < high) {
            int mid = (low + high) >>> 1;
            if (predicate.test(elements.get(mid))) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }

        return low;
    }

    /**
     * Returns the least element in this sorted list for which the predicate holds, or null if there is no such element.
     */
    public static <E, L extends List<E> & RandomAccess> E ceilingBinarySearch(L elements, Predicate<? super E> isAtLeast) {
        int index = partitioningIndex(elements, isAtLeast);
        return index < elements.size() ? elements.get(index) : null;
    }
}
