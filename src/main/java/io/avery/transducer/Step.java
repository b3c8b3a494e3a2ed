package io.avery.transducer;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The result of one call to a {@link Reducer Reducer}: the next accumulator, tagged with whether the reduction should
 * continue or stop.
 *
 * <p>A step is either "continue" or "stop", and always carries exactly one payload. The tag is a pure control signal.
 * A stop step is not an error; it tells the driver that the accumulator it carries is final, and that no further
 * elements should be offered.
 *
 * <p>Steps form a monad under {@link #cont cont} and {@link #flatMap flatMap}:
 * <ul>
 *     <li>Left identity: {@code Step.cont(x).flatMap(f)} equals {@code f.apply(x)}
 *     <li>Right identity: {@code m.flatMap(Step::cont)} equals {@code m}
 *     <li>Associativity: {@code m.flatMap(f).flatMap(g)} equals {@code m.flatMap(x -> f.apply(x).flatMap(g))}
 * </ul>
 *
 * @param <T> the payload type
 */
public final class Step<T> {
    private final boolean isStop;
    private final T val;
    
    private Step(boolean isStop, T val) {
        this.isStop = isStop;
        this.val = val;
    }
    
    /**
     * Returns a step that continues the reduction with the given accumulator.
     *
     * @param value the accumulator
     * @return a continue step
     * @param <T> the payload type
     */
    public static <T> Step<T> cont(T value) {
        return new Step<>(false, value);
    }
    
    /**
     * Returns a step that ends the reduction with the given accumulator.
     *
     * @param value the final accumulator
     * @return a stop step
     * @param <T> the payload type
     */
    public static <T> Step<T> stop(T value) {
        return new Step<>(true, value);
    }
    
    public boolean isContinue() {
        return !isStop;
    }
    
    public boolean isStop() {
        return isStop;
    }
    
    /**
     * Returns the payload, regardless of whether this step continues or stops.
     *
     * @return the payload
     */
    public T unwrap() {
        return val;
    }
    
    /**
     * Returns the payload if this step continues, or an empty {@code Optional} if it stops (or the payload is null).
     *
     * @return the payload of a continue step
     */
    public Optional<T> continueValue() {
        return isStop ? Optional.empty() : Optional.ofNullable(val);
    }
    
    /**
     * Returns a stop step with the same payload. If this step already stops, it is returned as-is.
     *
     * @return a stop step with this step's payload
     */
    public Step<T> asStop() {
        return isStop ? this : new Step<>(true, val);
    }
    
    /**
     * Applies the {@code mapper} to the payload, keeping the continue/stop tag.
     *
     * @param mapper the function to apply to the payload
     * @return a step with the same tag and the mapped payload
     * @param <U> the mapped payload type
     * @throws NullPointerException if mapper is null
     */
    public <U> Step<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper);
        return new Step<>(isStop, mapper.apply(val));
    }
    
    /**
     * Monadic bind. If this step continues, returns the result of applying the {@code mapper} to the payload.
     * Otherwise, short-circuits and returns this (stop) step without calling the {@code mapper}.
     *
     * <p>Since a stop step passes through unchanged, the {@code mapper} must produce steps of the same payload type.
     *
     * @param mapper the function producing the next step
     * @return the next step, or this step if it stops
     * @throws NullPointerException if mapper is null, or if it returns null
     */
    @SuppressWarnings("unchecked")
    public Step<T> flatMap(Function<? super T, ? extends Step<? extends T>> mapper) {
        Objects.requireNonNull(mapper);
        if (isStop) {
            return this;
        }
        return (Step<T>) Objects.requireNonNull(mapper.apply(val));
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Step)) {
            return false;
        }
        Step<?> other = (Step<?>) o;
        return isStop == other.isStop && Objects.equals(val, other.val);
    }
    
    @Override
    public int hashCode() {
        return 31 * Boolean.hashCode(isStop) + Objects.hashCode(val);
    }
    
    @Override
    public String toString() {
        return (isStop ? "Stop(" : "Continue(") + val + ")";
    }
}
