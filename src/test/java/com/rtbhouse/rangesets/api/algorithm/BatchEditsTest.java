package com.rtbhouse.rangesets.api.algorithm;

import static com.rtbhouse.rangesets.api.algorithm.RotationsTest.numbers;
import static com.rtbhouse.rangesets.api.range.IndexRange.range;
import static junitparams.JUnitParamsRunner.$;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mockito;

import com.google.common.collect.ImmutableList;
import com.rtbhouse.rangesets.api.range.IndexRange;
import com.rtbhouse.rangesets.api.range.RangeExpression;
import com.rtbhouse.rangesets.api.range.RangeSet;
import com.rtbhouse.rangesets.api.sequence.ListSequence;
import com.rtbhouse.rangesets.api.sequence.StringBuilderSequence;
import com.rtbhouse.rangesets.impl.errors.BadIndexException;
import com.rtbhouse.rangesets.test.utils.AppendOnlySequence;
import com.rtbhouse.rangesets.test.utils.CopyCountingList;
import com.rtbhouse.rangesets.test.utils.RandomRangeSets;

import junitparams.JUnitParamsRunner;
import junitparams.Parameters;

@RunWith(JUnitParamsRunner.class)
public class BatchEditsTest {

    private static final List<Integer> THREES = ImmutableList.of(1, 2, 3, 4, 3, 3, 4, 5, 3, 4, 3, 3, 3);

    private static List<Integer> oneThroughTwenty() {
        return numbers(20).stream().map(number -> number + 1).collect(Collectors.toList());
    }

    private static List<String> letters() {
        return ImmutableList.of("A", "B", "C", "D", "E", "F");
    }

    @Test
    public void shouldFindIndicesOfElement() {
        //given
        ListSequence<Integer> sequence = ListSequence.copyOf(THREES);

        //when
        RangeSet<Integer> threes = BatchEdits.indicesOf(sequence, 3);

        //then
        assertThat(threes.ranges()).containsExactly(range(2, 3), range(4, 6), range(8, 9), range(10, 13));
        assertThat(BatchEdits.view(sequence, threes).count()).isEqualTo(7);
        assertThat(BatchEdits.indicesOf(sequence, 7).isEmpty()).isTrue();
    }

    @Test
    public void shouldRemoveElementsAtIndices() {
        //given
        CopyCountingList<Integer> list = new CopyCountingList<>(THREES);
        ListSequence<Integer> sequence = ListSequence.wrap(list);

        //when
        BatchEdits.removeAll(sequence, BatchEdits.indicesOf(sequence, 3));

        //then
        assertThat(list.bulkCopies()).isZero();
        assertThat(list).containsExactly(1, 2, 4, 4, 5, 4);
    }

    @Test
    public void shouldRemoveRangesInPlace() {
        //given
        List<Integer> list = Mockito.spy(new ArrayList<>(oneThroughTwenty()));
        ListSequence<Integer> sequence = ListSequence.wrap(list);

        //when
        BatchEdits.removeAll(sequence, RangeSet.of(range(2, 5), range(10, 15), range(18, 20)));

        //then
        verify(list, never()).clear();
        verify(list, never()).add(any());
        verify(list, never()).addAll(anyCollection());
        verify(list, never()).addAll(anyInt(), anyCollection());
        assertThat(list).containsExactly(1, 2, 6, 7, 8, 9, 10, 16, 17, 18);
    }

    @Test
    public void shouldRebuildSequenceWithoutPositionalWrites() {
        //given
        AppendOnlySequence<Integer> sequence = Mockito.spy(new AppendOnlySequence<>());
        sequence.appendAll(THREES);
        RangeSet<Integer> threes = BatchEdits.indicesOf(sequence, 3);

        //when
        BatchEdits.removeAll(sequence, threes);

        //then
        verify(sequence).clear();
        verify(sequence, never()).removeSubrange(any(), any());
        assertThat(sequence.elements()).containsExactly(1, 2, 4, 4, 5, 4);
    }

    @Test
    public void shouldNotRemoveAnythingForEmptySet() {
        //given
        ListSequence<Integer> sequence = ListSequence.copyOf(THREES);

        //when
        BatchEdits.removeAll(sequence, new RangeSet<>());

        //then
        assertThat(sequence.list()).isEqualTo(THREES);
    }

    @Test
    public void shouldNotRemovePositionsOutsideSequence() {
        //given
        ListSequence<Integer> sequence = ListSequence.copyOf(THREES);

        //then
        assertThatThrownBy(() -> BatchEdits.removeAll(sequence, RangeSet.of(range(10, 14))))
                .isInstanceOf(BadIndexException.class)
                .hasMessage("Position: 14 is out of bounds [0, 13]");
        assertThat(sequence.list()).isEqualTo(THREES);
    }

    private Object[] parametersForShouldRemoveSameElementsAsReference() {
        return $($(21L), $(22L), $(23L), $(24L), $(25L));
    }

    @Test
    @Parameters
    public void shouldRemoveSameElementsAsReference(long seed) {
        RandomRangeSets randomRangeSets = new RandomRangeSets(seed, 40);
        for (int i = 0; i < 50; i++) {
            //given
            RangeSet<Integer> positions = randomRangeSets.nextRangeSet(6);
            List<Integer> expected = numbers(40).stream()
                    .filter(number -> !positions.contains(number))
                    .collect(Collectors.toList());
            ListSequence<Integer> inPlace = ListSequence.copyOf(numbers(40));
            AppendOnlySequence<Integer> rebuilt = new AppendOnlySequence<>();
            rebuilt.appendAll(numbers(40));

            //when
            List<Integer> removing = BatchEdits.removingAll(inPlace, positions).toMutableList();
            BatchEdits.removeAll(inPlace, positions);
            BatchEdits.removeAll(rebuilt, positions);

            //then
            assertThat(removing).isEqualTo(expected);
            assertThat(inPlace.list()).isEqualTo(expected);
            assertThat(rebuilt.elements()).isEqualTo(expected);
        }
    }

    @Test
    public void shouldViewRemainingElementsWithoutRemoving() {
        //given
        ListSequence<Integer> sequence = ListSequence.copyOf(THREES);

        //when
        List<Integer> remaining = BatchEdits.removingAll(sequence, BatchEdits.indicesOf(sequence, 3)).toList();

        //then
        assertThat(remaining).containsExactly(1, 2, 4, 4, 5, 4);
        assertThat(sequence.list()).isEqualTo(THREES);
    }

    private Object[] parametersForShouldGatherElementsAtIndices() {
        return $(
                $(4, range(4, 11), ImmutableList.of(1, 2, 3, 4, 11, 12, 13, 14, 15, 19, 20, 5, 6, 7, 8, 9, 10, 16, 17, 18)),
                $(0, range(0, 7), ImmutableList.of(11, 12, 13, 14, 15, 19, 20, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 16, 17, 18)),
                $(20, range(13, 20), ImmutableList.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 16, 17, 18, 11, 12, 13, 14, 15, 19, 20)),
                $(14, range(10, 17), ImmutableList.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 19, 20, 16, 17, 18))
        );
    }

    @Test
    @Parameters
    public void shouldGatherElementsAtIndices(int insertionPoint, IndexRange<Integer> expectedRange, List<Integer> expected) {
        //given
        CopyCountingList<Integer> list = new CopyCountingList<>(oneThroughTwenty());

        //when
        IndexRange<Integer> gathered = BatchEdits.gather(ListSequence.wrap(list),
                RangeSet.of(range(10, 15), range(18, 20)), insertionPoint);

        //then
        assertThat(list.bulkCopies()).isZero();
        assertThat(gathered).isEqualTo(expectedRange);
        assertThat(list).isEqualTo(expected);
    }

    @Test
    public void shouldGatherNothingForEmptySet() {
        //given
        ListSequence<Integer> sequence = ListSequence.copyOf(oneThroughTwenty());

        //when
        IndexRange<Integer> gathered = BatchEdits.gather(sequence, new RangeSet<>(), 10);

        //then
        assertThat(gathered).isEqualTo(range(10, 10));
        assertThat(sequence.list()).isEqualTo(oneThroughTwenty());
    }

    private Object[] parametersForShouldGatherSameElementsAsReference() {
        return $($(31L), $(32L), $(33L), $(34L), $(35L));
    }

    @Test
    @Parameters
    public void shouldGatherSameElementsAsReference(long seed) {
        RandomRangeSets randomRangeSets = new RandomRangeSets(seed, 40);
        for (int i = 0; i < 50; i++) {
            //given
            RangeSet<Integer> positions = randomRangeSets.nextRangeSet(6);
            int insertionPoint = randomRangeSets.nextPosition();
            List<Integer> before = numbers(insertionPoint).stream()
                    .filter(number -> !positions.contains(number))
                    .collect(Collectors.toList());
            List<Integer> moved = numbers(40).stream()
                    .filter(positions::contains)
                    .collect(Collectors.toList());
            List<Integer> expected = new ArrayList<>(before);
            expected.addAll(moved);
            numbers(40).stream()
                    .filter(number -> number >= insertionPoint && !positions.contains(number))
                    .forEach(expected::add);
            ListSequence<Integer> sequence = ListSequence.copyOf(numbers(40));

            //when
            IndexRange<Integer> gathered = BatchEdits.gather(sequence, positions, insertionPoint);

            //then
            assertThat(sequence.list()).as("gather %s before %s", positions, insertionPoint).isEqualTo(expected);
            assertThat(gathered).isEqualTo(range(before.size(), before.size() + moved.size()));
        }
    }

    @Test
    public void shouldGatherMatchingElements() {
        //given
        ListSequence<Integer> sequence = ListSequence.copyOf(oneThroughTwenty());

        //when
        IndexRange<Integer> gathered = BatchEdits.gather(sequence, 4, number -> number % 5 == 0);

        //then
        assertThat(gathered).isEqualTo(range(4, 8));
        assertThat(sequence.list())
                .containsExactly(1, 2, 3, 4, 5, 10, 15, 20, 6, 7, 8, 9, 11, 12, 13, 14, 16, 17, 18, 19);
    }

    @Test
    public void shouldGatherLettersAroundInsertionPoint() {
        //given
        StringBuilderSequence letters = StringBuilderSequence.of("ABCdefGHIjklMNOpqrStUvWxyz");

        //when
        IndexRange<Integer> gathered = BatchEdits.gather(letters, 13, Character::isLowerCase);

        //then
        assertThat(gathered).isEqualTo(range(7, 21));
        assertThat(letters).hasToString("ABCGHIMdefjklpqrtvxyzNOSUW");
    }

    private Object[] parametersForShouldShiftRange() {
        return $(
                $(RangeExpression.closed(2, 3), 1, range(1, 3), ImmutableList.of("A", "C", "D", "B", "E", "F")),
                $(range(1, 3), 5, range(3, 5), ImmutableList.of("A", "D", "E", "B", "C", "F")),
                $(range(0, 2), 6, range(4, 6), ImmutableList.of("C", "D", "E", "F", "A", "B")),
                $(RangeExpression.from(4), 0, range(0, 2), ImmutableList.of("E", "F", "A", "B", "C", "D")),
                $(range(1, 4), 2, range(1, 4), ImmutableList.of("A", "B", "C", "D", "E", "F")),
                $(range(1, 4), 4, range(1, 4), ImmutableList.of("A", "B", "C", "D", "E", "F"))
        );
    }

    @Test
    @Parameters
    public void shouldShiftRange(RangeExpression<Integer> source, int insertionPoint, IndexRange<Integer> expectedRange,
                                 List<String> expected) {
        //given
        ListSequence<String> sequence = ListSequence.copyOf(letters());

        //when
        IndexRange<Integer> shifted = BatchEdits.shift(sequence, source, insertionPoint);

        //then
        assertThat(shifted).isEqualTo(expectedRange);
        assertThat(sequence.list()).isEqualTo(expected);
    }

    private Object[] parametersForShouldShiftSingleElement() {
        return $(
                $(0, 3, 2, ImmutableList.of("B", "C", "A", "D", "E", "F")),
                $(4, 1, 1, ImmutableList.of("A", "E", "B", "C", "D", "F")),
                $(2, 2, 2, ImmutableList.of("A", "B", "C", "D", "E", "F")),
                $(2, 3, 2, ImmutableList.of("A", "B", "C", "D", "E", "F")),
                $(0, 6, 5, ImmutableList.of("B", "C", "D", "E", "F", "A"))
        );
    }

    @Test
    @Parameters
    public void shouldShiftSingleElement(int source, int insertionPoint, int expectedPosition, List<String> expected) {
        //given
        ListSequence<String> sequence = ListSequence.copyOf(letters());

        //when
        int position = BatchEdits.shift(sequence, source, insertionPoint);

        //then
        assertThat(position).isEqualTo(expectedPosition);
        assertThat(sequence.list()).isEqualTo(expected);
    }

    @Test
    public void shouldShiftLikeGatheringSingleRange() {
        int size = 8;
        for (int from = 0; from <= size; from++) {
            for (int to = from; to <= size; to++) {
                for (int insertionPoint = 0; insertionPoint <= size; insertionPoint++) {
                    //given
                    ListSequence<Integer> shifted = ListSequence.copyOf(numbers(size));
                    ListSequence<Integer> gathered = ListSequence.copyOf(numbers(size));

                    //when
                    IndexRange<Integer> shiftedRange = BatchEdits.shift(shifted, range(from, to), insertionPoint);
                    IndexRange<Integer> gatheredRange = BatchEdits.gather(gathered, RangeSet.of(range(from, to)), insertionPoint);

                    //then
                    assertThat(shiftedRange).as("shift [%s, %s) to %s", from, to, insertionPoint).isEqualTo(gatheredRange);
                    assertThat(shifted.list()).isEqualTo(gathered.list());
                }
            }
        }
    }

    @Test
    public void shouldNotShiftToPositionOutsideSequence() {
        //given
        ListSequence<String> sequence = ListSequence.copyOf(letters());

        //then
        assertThatThrownBy(() -> BatchEdits.shift(sequence, 6, 0))
                .isInstanceOf(BadIndexException.class)
                .hasMessage("Index: 6 does not refer to an element of [0, 6)");
        assertThatThrownBy(() -> BatchEdits.shift(sequence, range(1, 2), 7))
                .isInstanceOf(BadIndexException.class)
                .hasMessage("Position: 7 is out of bounds [0, 6]");
    }

    @Test
    public void shouldAssignValuesAtIndices() {
        //given
        StringBuilderSequence letters = StringBuilderSequence.of("ABCdefGHI");
        RangeSet<Integer> uppercase = BatchEdits.indicesWhere(letters, Character::isUpperCase);

        //when
        BatchEdits.assign(letters, uppercase, ImmutableList.of('a', 'b', 'c', 'g', 'h', 'i'));

        //then
        assertThat(letters).hasToString("abcdefghi");
    }

    @Test
    public void shouldNotAssignWrongNumberOfValues() {
        //given
        ListSequence<String> sequence = ListSequence.copyOf(letters());

        //then
        assertThatThrownBy(() -> BatchEdits.assign(sequence, RangeSet.of(range(1, 3)), ImmutableList.of("x", "y", "z")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("condition not met [positions count == values count]: 2, 3");
        assertThat(sequence.list()).isEqualTo(letters());
    }
}
