package io.avery.transducer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SequencesTest {

    @Nested
    class ZipTest {

        @Test
        void shouldStopAtTheShorterSequence() {
            CountingSource longer = new CountingSource(10);

            List<Map.Entry<String, Integer>> pairs = Sequences.zip(List.of("a", "b"), longer);

            assertThat(pairs).containsExactly(entry("a", 1), entry("b", 2));
            assertThat(longer.pulled()).isEqualTo(2);
        }

        @Test
        void shouldCombineWithFunction() {
            List<String> combined = Sequences.zipWith(List.of(1, 2, 3), List.of("x", "y", "z"), (n, s) -> s.repeat(n));

            assertThat(combined).containsExactly("x", "yy", "zzz");
        }

        @Test
        void shouldPadTheShorterSequence() {
            assertThat(Sequences.zipLongest(List.of(1, 2, 3), List.of("a"), 0, "-"))
                .containsExactly(entry(1, "a"), entry(2, "-"), entry(3, "-"));
            assertThat(Sequences.zipLongest(List.of(1), List.of("a", "b"), null, null))
                .containsExactly(entry(1, "a"), entry(null, "b"));
        }

        @Test
        void shouldPairEveryCombination() {
            assertThat(Sequences.cartesianProduct(List.of(1, 2), List.of("a", "b")))
                .containsExactly(entry(1, "a"), entry(1, "b"), entry(2, "a"), entry(2, "b"));
            assertThat(Sequences.cartesianProduct(List.of(1, 2), List.of())).isEmpty();
        }
    }

    @Nested
    class MergeTest {

        @Test
        void shouldInterleaveRoundRobin() {
            List<Integer> merged = Sequences.merge(List.of(List.of(1, 4), List.of(2), List.of(3, 5, 6)));

            assertThat(merged).containsExactly(1, 2, 3, 4, 5, 6);
        }

        @Test
        void shouldHandleNoSources() {
            assertThat(Sequences.<Integer>merge(List.of())).isEmpty();
            assertThat(Sequences.<Integer>merge(List.of(List.of(), List.of(7)))).containsExactly(7);
        }

        @Test
        void shouldRejectNullSource() {
            assertThatThrownBy(() -> Sequences.merge(Arrays.asList(List.of(1), null)))
                .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    class SetOperationsTest {

        @Test
        void shouldKeepOrderAndDuplicatesOfFirstInIntersection() {
            assertThat(Sequences.intersection(List.of(3, 1, 2, 1, 4), List.of(1, 3)))
                .containsExactly(3, 1, 1);
        }

        @Test
        void shouldKeepOrderAndDuplicatesOfFirstInDifference() {
            assertThat(Sequences.difference(List.of(3, 1, 2, 1, 4), List.of(1, 3)))
                .containsExactly(2, 4);
        }

        @Test
        void shouldUnionDistinctElementsInFirstSeenOrder() {
            assertThat(Sequences.union(List.of(2, 1, 2), List.of(3, 1, 4, 3)))
                .containsExactly(2, 1, 3, 4);
        }

        @Test
        void shouldKeepElementsInExactlyOneSequence() {
            assertThat(Sequences.symmetricDifference(List.of(1, 2, 2, 3), List.of(3, 4, 4)))
                .containsExactly(1, 2, 4);
            assertThat(Sequences.symmetricDifference(List.of(1, 2), List.of(2, 1))).isEmpty();
        }
    }

    @Nested
    class GeneratorsTest {

        @ParameterizedTest
        @CsvSource({
            "0, 5, 1, '0,1,2,3,4'",
            "2, 9, 3, '2,5,8'",
            "10, 0, -3, '10,7,4,1'",
            "3, 3, 1, ''",
            "5, 0, 1, ''",
            "0, 5, -1, ''"
        })
        void shouldCountFromStartTowardEnd(int start, int end, int step, String expected) {
            Iterable<Integer> range = Sequences.range(start, end, step);

            List<Integer> numbers = Reductions.toList(Transducers.<Integer>identity(), range);

            assertThat(numbers).isEqualTo(expected.isEmpty()
                ? List.of()
                : Arrays.stream(expected.split(",")).map(Integer::valueOf).toList());
        }

        @Test
        void shouldNotOverflowNearIntegerBounds() {
            Iterable<Integer> top = Sequences.range(Integer.MAX_VALUE - 2, Integer.MAX_VALUE, 2);

            assertThat(Reductions.toList(Transducers.<Integer>identity(), top)).containsExactly(Integer.MAX_VALUE - 2);
        }

        @Test
        void shouldRejectZeroStep() {
            assertThatThrownBy(() -> Sequences.range(0, 5, 0)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRepeatValueAndAllowNull() {
            assertThat(Sequences.repeat("x", 3)).containsExactly("x", "x", "x");
            assertThat(Sequences.repeat(null, 2)).containsExactly(null, null);
            assertThat(Sequences.repeat("x", 0)).isEmpty();
            assertThatThrownBy(() -> Sequences.repeat("x", -1)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldCycleLazilyUntilTakeStops() {
            Iterable<Integer> cycled = Sequences.cycle(List.of(1, 2));

            assertThat(Reductions.toList(Transducers.<Integer>take(5), cycled)).containsExactly(1, 2, 1, 2, 1);
            assertThat(Reductions.toList(Transducers.<Integer>take(3), cycled)).containsExactly(1, 2, 1);
        }

        @Test
        void shouldEndCycleOfEmptySource() {
            assertThat(Sequences.cycle(List.of())).isEmpty();
        }

        @Test
        void shouldReiterateSourceOnEachPass() {
            CountingSource source = new CountingSource(3);

            Reductions.toList(Transducers.<Integer>take(7), Sequences.cycle(source));

            assertThat(source.pulled()).isEqualTo(7);
        }

        @Test
        void shouldUnfoldUntilStepEnds() {
            Iterable<Integer> powers = Sequences.<Integer, Integer>unfold(1, n -> n > 100
                ? Optional.empty()
                : Optional.of(Map.entry(n, n * 2)));

            assertThat(Reductions.toList(Transducers.<Integer>identity(), powers))
                .containsExactly(1, 2, 4, 8, 16, 32, 64);
            assertThat(powers).as("starts over from the seed").startsWith(1, 2, 4);
        }

        @Test
        void shouldUnfoldInfiniteSequenceLazily() {
            AtomicInteger steps = new AtomicInteger();
            Iterable<Long> fibonacci = Sequences.<Long, long[]>unfold(new long[] { 0, 1 }, pair -> {
                steps.incrementAndGet();
                return Optional.of(Map.entry(pair[0], new long[] { pair[1], pair[0] + pair[1] }));
            });

            List<Long> first = Reductions.toList(Transducers.<Long>take(8), fibonacci);

            assertThat(first).containsExactly(0L, 1L, 1L, 2L, 3L, 5L, 8L, 13L);
            assertThat(steps).hasValue(8);
        }
    }
}
