package io.avery.transducer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class StepTest {

    private static final List<Function<Integer, Step<Integer>>> FUNCTIONS = List.of(
        x -> Step.cont(x + 1),
        x -> Step.stop(x * 2),
        x -> x % 2 == 0 ? Step.cont(x / 2) : Step.stop(x),
        Step::cont
    );

    static Stream<Arguments> steps() {
        return Stream.of(
            Arguments.of(Step.cont(0)),
            Arguments.of(Step.cont(7)),
            Arguments.of(Step.stop(4)),
            Arguments.of(Step.stop(-3))
        );
    }

    static Stream<Arguments> valuesAndFunctions() {
        return Stream.of(-2, 0, 3, 10)
            .flatMap(x -> FUNCTIONS.stream().map(f -> Arguments.of(x, f)));
    }

    static Stream<Arguments> stepsAndFunctionPairs() {
        return steps()
            .flatMap(m -> FUNCTIONS.stream()
                .flatMap(f -> FUNCTIONS.stream().map(g -> Arguments.of(m.get()[0], f, g))));
    }

    @Test
    void shouldTagContinueAndStop() {
        Step<String> cont = Step.cont("a");
        Step<String> stop = Step.stop("b");

        assertThat(cont.isContinue()).isTrue();
        assertThat(cont.isStop()).isFalse();
        assertThat(cont.unwrap()).isEqualTo("a");
        assertThat(stop.isContinue()).isFalse();
        assertThat(stop.isStop()).isTrue();
        assertThat(stop.unwrap()).isEqualTo("b");
    }

    @Test
    void shouldAllowNullPayload() {
        Step<Object> step = Step.stop(null);

        assertThat(step.unwrap()).isNull();
        assertThat(step).isEqualTo(Step.stop(null));
        assertThat(step.toString()).isEqualTo("Stop(null)");
    }

    @Test
    void shouldExposeContinueValueOnlyForContinue() {
        assertThat(Step.cont(5).continueValue()).contains(5);
        assertThat(Step.stop(5).continueValue()).isEmpty();
        assertThat(Step.cont(null).continueValue()).isEqualTo(Optional.empty());
    }

    @Test
    void shouldConvertToStopKeepingPayload() {
        Step<Integer> stop = Step.stop(1);

        assertThat(Step.cont(1).asStop()).isEqualTo(stop);
        assertThat(stop.asStop()).isSameAs(stop);
    }

    @Test
    void shouldMapPayloadAndKeepTag() {
        assertThat(Step.cont(3).map(x -> "v" + x)).isEqualTo(Step.cont("v3"));
        assertThat(Step.stop(3).map(x -> "v" + x)).isEqualTo(Step.stop("v3"));
    }

    @Test
    void shouldShortCircuitFlatMapOnStop() {
        Step<Integer> stop = Step.stop(9);

        Step<Integer> result = stop.flatMap(x -> {
            throw new AssertionError("mapper must not run on stop");
        });

        assertThat(result).isSameAs(stop);
    }

    @Test
    void shouldRejectNullFromFlatMapper() {
        assertThatThrownBy(() -> Step.cont(1).flatMap(x -> null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldHaveValueEquality() {
        assertThat(Step.cont(1)).isEqualTo(Step.cont(1)).hasSameHashCodeAs(Step.cont(1));
        assertThat(Step.cont(1)).isNotEqualTo(Step.stop(1));
        assertThat(Step.cont(1)).isNotEqualTo(Step.cont(2));
        assertThat(Step.cont("x").toString()).isEqualTo("Continue(x)");
    }

    @Nested
    class MonadLawsTest {

        @ParameterizedTest
        @MethodSource("io.avery.transducer.StepTest#valuesAndFunctions")
        void shouldSatisfyLeftIdentity(int x, Function<Integer, Step<Integer>> f) {
            assertThat(Step.cont(x).flatMap(f)).isEqualTo(f.apply(x));
        }

        @ParameterizedTest
        @MethodSource("io.avery.transducer.StepTest#steps")
        void shouldSatisfyRightIdentity(Step<Integer> m) {
            assertThat(m.flatMap(Step::cont)).isEqualTo(m);
        }

        @ParameterizedTest
        @MethodSource("io.avery.transducer.StepTest#stepsAndFunctionPairs")
        void shouldSatisfyAssociativity(Step<Integer> m,
                                        Function<Integer, Step<Integer>> f,
                                        Function<Integer, Step<Integer>> g) {
            assertThat(m.flatMap(f).flatMap(g)).isEqualTo(m.flatMap(x -> f.apply(x).flatMap(g)));
        }
    }
}
