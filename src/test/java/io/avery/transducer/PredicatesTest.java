package io.avery.transducer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PredicatesTest {

    private static final Predicate<Integer> POSITIVE = x -> x > 0;
    private static final Predicate<Integer> EVEN = x -> x % 2 == 0;

    @ParameterizedTest(name = "x={0}")
    @CsvSource({
        "4, true, true, false",
        "3, false, true, false",
        "-2, false, true, true",
        "-3, false, false, true"
    })
    void shouldCombineTwoPredicates(int x, boolean both, boolean either, boolean notPositive) {
        assertThat(Predicates.both(POSITIVE, EVEN).test(x)).isEqualTo(both);
        assertThat(Predicates.either(POSITIVE, EVEN).test(x)).isEqualTo(either);
        assertThat(Predicates.complement(POSITIVE).test(x)).isEqualTo(notPositive);
    }

    @Test
    void shouldShortCircuitLeftToRight() {
        AtomicInteger calls = new AtomicInteger();
        Predicate<Integer> counted = x -> {
            calls.incrementAndGet();
            return true;
        };

        Predicates.both(POSITIVE, counted).test(-1);
        Predicates.either(POSITIVE, counted).test(1);
        Predicates.allPass(List.of(POSITIVE, counted)).test(-1);
        Predicates.anyPass(List.of(POSITIVE, counted)).test(1);

        assertThat(calls).hasValue(0);
    }

    @Test
    void shouldCombineManyPredicates() {
        Predicate<Integer> all = Predicates.allPass(List.of(POSITIVE, EVEN, x -> x < 10));
        Predicate<Integer> any = Predicates.anyPass(List.of(POSITIVE, EVEN));

        assertThat(all.test(4)).isTrue();
        assertThat(all.test(12)).isFalse();
        assertThat(any.test(-3)).isFalse();
        assertThat(any.test(-4)).isTrue();
    }

    @Test
    void shouldTreatEmptyListsAsIdentities() {
        assertThat(Predicates.<Integer>allPass(List.of()).test(1)).isTrue();
        assertThat(Predicates.<Integer>anyPass(List.of()).test(1)).isFalse();
    }

    @Test
    void shouldWorkAsTransducerPredicates() {
        List<Integer> result = Reductions.toList(
            Transducers.<Integer>filter(Predicates.both(POSITIVE, EVEN)),
            List.of(-2, 1, 2, 3, 4)
        );

        assertThat(result).containsExactly(2, 4);
    }
}
