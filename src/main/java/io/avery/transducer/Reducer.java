package io.avery.transducer;

/**
 * A reducing function: folds one element into an accumulator, and signals whether the reduction should continue.
 *
 * <p>Reducers returned by {@link Transducer#apply Transducer.apply} may hold private mutable state (counters, buffers,
 * previously seen values) that persists across calls. Such a reducer represents a single run, and should be driven by
 * one thread, over one source, at most once.
 *
 * <p>This is a functional interface whose functional method is {@link #apply(Object, Object)}.
 *
 * @param <A> the accumulator type
 * @param <T> the element type
 */
@FunctionalInterface
public interface Reducer<A, T> {
    /**
     * Folds the {@code element} into the {@code acc}.
     *
     * @param acc the current accumulator
     * @param element the next element
     * @return the next accumulator, as a step that continues or stops the reduction
     */
    Step<A> apply(A acc, T element);
}
