package com.rtbhouse.rangesets.api.range;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.rtbhouse.rangesets.api.range.IndexRange.range;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.Comparators;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.rtbhouse.rangesets.api.RangeSetsConfig;
import com.rtbhouse.rangesets.api.sequence.Sequence;
import com.rtbhouse.rangesets.impl.collection.CollectionUtils;
import com.rtbhouse.rangesets.impl.range.RangeSetInvariants;

/**
 * A set of positions stored as sorted, non-overlapping and non-adjacent half-open ranges.
 * <p>
 * Ranges that touch are always merged: {@code [0..<5, 5..<10]} is never stored, {@code [0..<10]} is.
 * Membership tests run in O(log k), where k is the number of ranges.
 * <p>
 * Instances are mutable but never share their range list: {@link #copy()}, the set algebra results and
 * every consumer that keeps a range set hold their own copy.
 *
 * @param <B> bound type
 */
public final class RangeSet<B extends Comparable<? super B>> {

    private static final boolean CHECK_INVARIANTS = RangeSetsConfig.global().isInvariantsCheckEnabled();

    private final ArrayList<IndexRange<B>> ranges;

    public RangeSet() {
        this.ranges = new ArrayList<>();
    }

    private RangeSet(ArrayList<IndexRange<B>> ranges) {
        this.ranges = ranges;
        checkInvariants();
    }

    public static <B extends Comparable<? super B>> RangeSet<B> of() {
        return new RangeSet<>();
    }

    public static <B extends Comparable<? super B>> RangeSet<B> of(IndexRange<B> range) {
        RangeSet<B> set = new RangeSet<>();
        set.insert(range);
        return set;
    }

    @SafeVarargs
    public static <B extends Comparable<? super B>> RangeSet<B> of(IndexRange<B>... ranges) {
        return copyOf(Arrays.asList(ranges));
    }

    /**
     * Creates a range set from ranges in any order, inserting them one by one.
     */
    public static <B extends Comparable<? super B>> RangeSet<B> copyOf(Iterable<IndexRange<B>> ranges) {
        RangeSet<B> set = new RangeSet<>();
        for (IndexRange<B> range : ranges) {
            set.insert(range);
        }
        return set;
    }

    public static <B extends Comparable<? super B>> RangeSet<B> ofElements(Iterable<B> elements, DiscreteDomain<B> domain) {
        RangeSet<B> set = new RangeSet<>();
        for (B element : elements) {
            set.insert(element, domain);
        }
        return set;
    }

    /**
     * Creates a range set holding the single element position {@code index} of {@code sequence}.
     */
    public static <B extends Comparable<? super B>> RangeSet<B> of(B index, Sequence<B, ?> within) {
        return of(range(index, within.indexAfter(index)));
    }

    public static <B extends Comparable<? super B>> RangeSet<B> of(RangeExpression<B> expression, Sequence<B, ?> within) {
        return of(expression.relativeTo(within));
    }

    public static <B extends Comparable<? super B>> Builder<B> builder() {
        return new Builder<>();
    }

    public RangeSet<B> copy() {
        return new RangeSet<>(new ArrayList<>(ranges));
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /**
     * Returns the ranges making up this set, in ascending order.
     */
    public List<IndexRange<B>> ranges() {
        return ImmutableList.copyOf(ranges);
    }

    public int rangeCount() {
        return ranges.size();
    }

    public IndexRange<B> rangeAt(int index) {
        checkElementIndex(index, ranges.size());
        return ranges.get(index);
    }

    /**
     * @return true if {@code element} lies in one of the ranges of this set
     */
    public boolean contains(B element) {
        checkNotNull(element);
        IndexRange<B> candidate = CollectionUtils.ceilingBinarySearch(ranges, r -> r.upperBound().compareTo(element) > 0);
        return candidate != null && candidate.lowerBound().compareTo(element) <= 0;
    }

    /**
     * @return true if at least one position of {@code range} belongs to this set
     */
    public boolean intersects(IndexRange<B> range) {
        checkNotNull(range);
        if (range.isEmpty()) {
            return false;
        }
        IndexRange<B> candidate = CollectionUtils.ceilingBinarySearch(ranges,
                r -> r.upperBound().compareTo(range.lowerBound()) > 0);
        return candidate != null && candidate.lowerBound().compareTo(range.upperBound()) < 0;
    }

    public void insert(IndexRange<B> range) {
        checkNotNull(range);
        if (range.isEmpty()) {
            return;
        }
        if (ranges.isEmpty()) {
            ranges.add(range);
            return;
        }
        if (range.lowerBound().compareTo(last().upperBound()) >= 0) {
            appendAscending(range);
            checkInvariants();
            return;
        }
        if (range.upperBound().compareTo(first().lowerBound()) < 0) {
            ranges.add(0, range);
            checkInvariants();
            return;
        }

        int begin = firstTouching(range);
        int end = endOfTouching(begin, range);

        if (begin == end) {
            ranges.add(begin, range);
        } else {
            B newLowerBound = Comparators.min(ranges.get(begin).lowerBound(), range.lowerBound());
            B newUpperBound = Comparators.max(ranges.get(end - 1).upperBound(), range.upperBound());
            replaceRanges(begin, end, range(newLowerBound, newUpperBound), null);
        }
        checkInvariants();
    }

    public void remove(IndexRange<B> range) {
        checkNotNull(range);
        if (range.isEmpty()
                || ranges.isEmpty()
                || range.lowerBound().compareTo(last().upperBound()) >= 0
                || range.upperBound().compareTo(first().lowerBound()) < 0) {
            return;
        }

        int begin = firstTouching(range);
        int end = endOfTouching(begin, range);
        if (begin == end) {
            return;
        }

        IndexRange<B> firstAffected = ranges.get(begin);
        IndexRange<B> lastAffected = ranges.get(end - 1);
        boolean keepsLowerPart = range.lowerBound().compareTo(firstAffected.lowerBound()) > 0;
        boolean keepsUpperPart = range.upperBound().compareTo(lastAffected.upperBound()) < 0;

        if (keepsLowerPart && keepsUpperPart) {
            replaceRanges(begin, end,
                    range(firstAffected.lowerBound(), range.lowerBound()),
                    range(range.upperBound(), lastAffected.upperBound()));
        } else if (keepsLowerPart) {
            replaceRanges(begin, end, range(firstAffected.lowerBound(), range.lowerBound()), null);
        } else if (keepsUpperPart) {
            replaceRanges(begin, end, range(range.upperBound(), lastAffected.upperBound()), null);
        } else {
            replaceRanges(begin, end, null, null);
        }
        checkInvariants();
    }

    /**
     * Inserts a single element.
     *
     * @return true if the element was not in the set before
     */
    public boolean insert(B element, DiscreteDomain<B> domain) {
        if (contains(element)) {
            return false;
        }
        insert(unitRange(element, domain));
        return true;
    }

    /**
     * Removes a single element.
     *
     * @return true if the element was in the set before
     */
    public boolean remove(B element, DiscreteDomain<B> domain) {
        if (!contains(element)) {
            return false;
        }
        remove(unitRange(element, domain));
        return true;
    }

    public void insert(B index, Sequence<B, ?> within) {
        insert(range(index, within.indexAfter(index)));
    }

    public void insert(RangeExpression<B> expression, Sequence<B, ?> within) {
        insert(expression.relativeTo(within));
    }

    public void remove(B index, Sequence<B, ?> within) {
        remove(range(index, within.indexAfter(index)));
    }

    public void remove(RangeExpression<B> expression, Sequence<B, ?> within) {
        remove(expression.relativeTo(within));
    }

    /**
     * Returns the positions of {@code within} that are not in this set.
     */
    public RangeSet<B> inverted(Sequence<B, ?> within) {
        Builder<B> inverted = builder();
        B low = within.startIndex();
        for (IndexRange<B> range : ranges) {
            inverted.add(range(low, range.lowerBound()));
            low = range.upperBound();
        }
        inverted.add(range(low, within.endIndex()));
        return inverted.build();
    }

    /**
     * Returns every element covered by this set, in ascending order. The list is a view: it reflects later changes of this set.
     */
    public List<B> elements(DiscreteDomain<B> domain) {
        return new RangeSetElements<>(this, domain);
    }

    public void formUnion(RangeSet<B> other) {
        for (IndexRange<B> range : other.ranges()) {
            insert(range);
        }
    }

    public void formIntersection(RangeSet<B> other) {
        replaceAllRanges(intersection(other));
    }

    public void formSymmetricDifference(RangeSet<B> other) {
        replaceAllRanges(symmetricDifference(other));
    }

    public void subtract(RangeSet<B> other) {
        for (IndexRange<B> range : other.ranges()) {
            remove(range);
        }
    }

    public RangeSet<B> union(RangeSet<B> other) {
        RangeSet<B> result = copy();
        result.formUnion(other);
        return result;
    }

    public RangeSet<B> intersection(RangeSet<B> other) {
        Builder<B> result = builder();
        List<IndexRange<B>> otherRanges = other.ranges;
        int otherIndex = 0;

        for (IndexRange<B> current : ranges) {
            // skip the ranges of other that end before the current one starts
            while (otherIndex < otherRanges.size()
                    && otherRanges.get(otherIndex).upperBound().compareTo(current.lowerBound()) <= 0) {
                otherIndex++;
            }

            while (otherIndex < otherRanges.size()
                    && otherRanges.get(otherIndex).lowerBound().compareTo(current.upperBound()) < 0) {
                IndexRange<B> overlapping = otherRanges.get(otherIndex);
                result.add(range(
                        Comparators.max(overlapping.lowerBound(), current.lowerBound()),
                        Comparators.min(overlapping.upperBound(), current.upperBound())));

                // a range of other reaching past the current one may overlap the next one as well
                if (current.upperBound().compareTo(overlapping.upperBound()) <= 0) {
                    break;
                }
                otherIndex++;
            }
        }

        return result.build();
    }

    public RangeSet<B> symmetricDifference(RangeSet<B> other) {
        return union(other).subtracting(intersection(other));
    }

    public RangeSet<B> subtracting(RangeSet<B> other) {
        RangeSet<B> result = copy();
        result.subtract(other);
        return result;
    }

    public boolean isSubsetOf(RangeSet<B> other) {
        return intersection(other).equals(this);
    }

    public boolean isSupersetOf(RangeSet<B> other) {
        return other.isSubsetOf(this);
    }

    public boolean isStrictSubsetOf(RangeSet<B> other) {
        return !equals(other) && isSubsetOf(other);
    }

    public boolean isStrictSupersetOf(RangeSet<B> other) {
        return other.isStrictSubsetOf(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeSet)) {
            return false;
        }
        return ranges.equals(((RangeSet<?>) o).ranges);
    }

    @Override
    public int hashCode() {
        return ranges.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RangeSet(");
        for (int i = 0; i < ranges.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(ranges.get(i));
        }
        return sb.append(')').toString();
    }

    private IndexRange<B> first() {
        return ranges.get(0);
    }

    private IndexRange<B> last() {
        return ranges.get(ranges.size() - 1);
    }

    /**
     * Index of the first range that overlaps or touches {@code range} from below, the range there may still lie entirely above it.
     */
    private int firstTouching(IndexRange<B> range) {
        return CollectionUtils.partitioningIndex(ranges, r -> r.upperBound().compareTo(range.lowerBound()) >= 0);
    }

    /**
     * Index one past the last range that overlaps or touches {@code range}, searching from {@code begin}.
     */
    private int endOfTouching(int begin, IndexRange<B> range) {
        return CollectionUtils.partitioningIndex(ranges, begin, ranges.size(),
                r -> r.lowerBound().compareTo(range.upperBound()) > 0);
    }

    /**
     * Inserts a range that is not below any range of this set.
     */
    private void appendAscending(IndexRange<B> range) {
        if (range.isEmpty()) {
            return;
        }
        if (ranges.isEmpty()) {
            ranges.add(range);
            return;
        }
        IndexRange<B> last = last();
        checkArgument(last.upperBound().compareTo(range.lowerBound()) <= 0,
                "condition not met [lastRange.upperBound() <= range.lowerBound()]: lastRange [%s], range [%s]", last, range);
        if (last.upperBound().compareTo(range.lowerBound()) == 0) {
            ranges.set(ranges.size() - 1, range(last.lowerBound(), range.upperBound()));
        } else {
            ranges.add(range);
        }
    }

    /**
     * Replaces {@code ranges[fromIndex, toIndex)} with up to two ranges, null ones are skipped.
     * Slots of the replaced span are overwritten in place, so no intermediate collection is allocated.
     */
    private void replaceRanges(int fromIndex, int toIndex, IndexRange<B> first, IndexRange<B> second) {
        int end = toIndex;
        int index = fromIndex;
        if (first != null) {
            end = placeRange(index++, end, first);
        }
        if (second != null) {
            end = placeRange(index++, end, second);
        }
        if (index < end) {
            ranges.subList(index, end).clear();
        }
    }

    private int placeRange(int index, int end, IndexRange<B> range) {
        if (index < end) {
            ranges.set(index, range);
            return end;
        }
        ranges.add(index, range);
        return end + 1;
    }

    private void replaceAllRanges(RangeSet<B> other) {
        ranges.clear();
        ranges.addAll(other.ranges);
        checkInvariants();
    }

    private static <B extends Comparable<? super B>> IndexRange<B> unitRange(B element, DiscreteDomain<B> domain) {
        B next = domain.next(element);
        checkArgument(next != null, "no successor of %s in %s", element, domain);
        return range(element, next);
    }

    private void checkInvariants() {
        if (CHECK_INVARIANTS) {
            RangeSetInvariants.check(ranges);
        }
    }

    /**
     * Collects ranges given in ascending order into a range set, merging ranges that touch.
     */
    public static final class Builder<B extends Comparable<? super B>> {
        private final RangeSet<B> set = new RangeSet<>();

        private Builder() {
        }

        /**
         * Appends a range that is not below any range added so far. Empty ranges are skipped.
         */
        public Builder<B> add(IndexRange<B> range) {
            checkNotNull(range);
            set.appendAscending(range);
            return this;
        }

        public RangeSet<B> build() {
            return set.copy();
        }
    }
}
