package io.avery.transducer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class PipelineTest {

    @Test
    void shouldRunStagesInOrder() {
        List<String> result = Pipeline.<Integer>start()
            .filter(i -> i % 2 == 1)
            .map(i -> "#" + i)
            .take(2)
            .toList(List.of(1, 2, 3, 4, 5));

        assertThat(result).containsExactly("#1", "#3");
    }

    @Test
    void shouldOutputSourceUnchangedWhenEmpty() {
        assertThat(Pipeline.<Integer>start().toList(List.of(3, 1, 2))).containsExactly(3, 1, 2);
    }

    @Test
    void shouldLeaveReceiverUnchanged() {
        Pipeline<Integer, Integer> evens = Pipeline.<Integer>start().filter(i -> i % 2 == 0);
        Pipeline<Integer, Integer> bigEvens = evens.dropWhile(i -> i < 4);
        Pipeline<Integer, Integer> withoutTwo = evens.reject(i -> i == 2);
        List<Integer> source = List.of(1, 2, 3, 4, 5, 6);

        assertThat(evens.toList(source)).containsExactly(2, 4, 6);
        assertThat(bigEvens.toList(source)).containsExactly(4, 6);
        assertThat(withoutTwo.toList(source)).containsExactly(4, 6);
    }

    @Test
    void shouldInvokeEachStageOncePerEvaluatedElement() {
        AtomicInteger mapped = new AtomicInteger();
        List<Integer> tapped = new ArrayList<>();
        CountingSource source = new CountingSource(1_000);

        List<Integer> result = Pipeline.<Integer>start()
            .map(i -> {
                mapped.incrementAndGet();
                return i * i;
            })
            .tap(tapped::add)
            .takeWhile(i -> i < 20)
            .toList(source);

        assertThat(result).containsExactly(1, 4, 9, 16);
        assertThat(mapped).hasValue(5);
        assertThat(tapped).containsExactly(1, 4, 9, 16, 25);
        assertThat(source.pulled()).isEqualTo(5);
    }

    @Test
    void shouldCombineRemainingStages() {
        List<List<Integer>> result = Pipeline.<Integer>start()
            .flatMap(i -> List.of(i, i))
            .unique()
            .drop(1)
            .scan(0, Integer::sum)
            .uniqueBy(i -> i % 5)
            .chunk(2)
            .toList(List.of(1, 2, 3, 4, 5, 6));

        // 2, 3, 4, 5, 6 -> 2, 5, 9, 14, 20 -> 2, 5, 9 (14 and 20 repeat keys 4 and 0)
        assertThat(result).containsExactly(List.of(2, 5));
    }

    @Test
    void shouldAppendArbitraryTransducers() {
        List<List<Integer>> windows = Pipeline.of(Transducers.<Integer>take(4))
            .then(Transducers.<Integer>aperture(2))
            .toList(List.of(1, 2, 3, 4, 5));

        assertThat(windows).containsExactly(List.of(1, 2), List.of(2, 3), List.of(3, 4));
    }

    @Test
    void shouldFoldWithExternalReducer() {
        int sum = Pipeline.<Integer>start()
            .map(i -> i * 2)
            .take(3)
            .reduce(List.of(1, 2, 3, 4), 0, Integer::sum);

        assertThat(sum).isEqualTo(12);
    }

    @Test
    void shouldExposeComposedTransducer() {
        Transducer<Integer, Integer> transducer = Pipeline.<Integer>start().take(1).transducer();

        assertThat(Reductions.toList(transducer, List.of(7, 8))).containsExactly(7);
    }

    @Test
    void shouldRejectInvalidStages() {
        assertThatThrownBy(() -> Pipeline.<Integer>start().take(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Pipeline.<Integer>start().chunk(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Pipeline.of(null)).isInstanceOf(NullPointerException.class);
    }
}
