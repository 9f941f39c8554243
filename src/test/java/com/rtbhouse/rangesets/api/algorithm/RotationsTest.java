package com.rtbhouse.rangesets.api.algorithm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.Test;

import com.rtbhouse.rangesets.api.sequence.ListSequence;
import com.rtbhouse.rangesets.api.sequence.StringBuilderSequence;
import com.rtbhouse.rangesets.impl.errors.BadIndexException;
import com.rtbhouse.rangesets.test.utils.CopyCountingList;

public class RotationsTest {

    @Test
    public void shouldRotateWholeSequence() {
        //given
        ListSequence<String> letters = ListSequence.of("A", "B", "C", "D", "E", "F");

        //when
        int oldFirst = Rotations.rotate(letters, 2);

        //then
        assertThat(letters.list()).containsExactly("C", "D", "E", "F", "A", "B");
        assertThat(oldFirst).isEqualTo(4);
    }

    @Test
    public void shouldRotateSubrange() {
        //given
        StringBuilderSequence letters = StringBuilderSequence.of("ABCDEFGH");

        //when
        int oldFirst = Rotations.rotate(letters, 1, 6, 4);

        //then
        assertThat(letters).hasToString("AEFBCDGH");
        assertThat(oldFirst).isEqualTo(3);
    }

    @Test
    public void shouldReturnBoundsForTrivialRotations() {
        //given
        ListSequence<String> letters = ListSequence.of("A", "B", "C", "D");

        //then
        assertThat(Rotations.rotate(letters, 1, 3, 1)).isEqualTo(3);
        assertThat(Rotations.rotate(letters, 1, 3, 3)).isEqualTo(1);
        assertThat(Rotations.rotate(letters, 2, 2, 2)).isEqualTo(2);
        assertThat(letters.list()).containsExactly("A", "B", "C", "D");
    }

    @Test
    public void shouldRotateEveryBlockOfEverySplit() {
        for (int size = 0; size <= 9; size++) {
            for (int from = 0; from <= size; from++) {
                for (int to = from; to <= size; to++) {
                    for (int newFirst = from; newFirst <= to; newFirst++) {
                        //given
                        List<Integer> numbers = numbers(size);
                        List<Integer> expected = new ArrayList<>(numbers);
                        Collections.rotate(expected.subList(from, to), to - newFirst);
                        CopyCountingList<Integer> list = new CopyCountingList<>(numbers);

                        //when
                        int oldFirst = Rotations.rotate(ListSequence.wrap(list), from, to, newFirst);

                        //then
                        assertThat(list.bulkCopies()).isZero();
                        assertThat(list).as("rotate [%s, %s) at %s", from, to, newFirst).isEqualTo(expected);
                        assertThat(oldFirst).isEqualTo(from + (to - newFirst));

                        //when
                        Rotations.rotate(ListSequence.wrap(list), from, to, oldFirst);

                        //then
                        assertThat(list).isEqualTo(numbers);
                    }
                }
            }
        }
    }

    @Test
    public void shouldNotRotateAroundPositionOutsideBlock() {
        //given
        ListSequence<String> letters = ListSequence.of("A", "B", "C", "D", "E", "F");

        //then
        assertThatThrownBy(() -> Rotations.rotate(letters, 1, 3, 4))
                .isInstanceOf(BadIndexException.class)
                .hasMessage("condition not met [from <= newFirst <= to]: 1, 4, 3");
        assertThatThrownBy(() -> Rotations.rotate(letters, 0, 7, 2))
                .isInstanceOf(BadIndexException.class)
                .hasMessage("Position: 7 is out of bounds [0, 6]");
    }

    static List<Integer> numbers(int size) {
        return IntStream.range(0, size).boxed().collect(Collectors.toList());
    }
}
