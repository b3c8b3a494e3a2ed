package io.avery.transducer;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A fluent, immutable builder over a composed {@link Transducer Transducer}. Each stage method returns a new pipeline
 * with the stage appended downstream; the receiver is unchanged, so a pipeline prefix can be shared and extended in
 * several directions.
 *
 * <p>Example:
 * <pre>{@code
 * List<String> result = Pipeline.<Integer>start()
 *     .filter(i -> i % 2 == 1)
 *     .map(i -> "#" + i)
 *     .take(2)
 *     .toList(List.of(1, 2, 3, 4, 5));
 * System.out.println(result);
 * // Prints: [#1, #3]
 * }</pre>
 *
 * @param <In> the source element type
 * @param <Out> the output element type
 */
public final class Pipeline<In, Out> {
    private final Transducer<In, Out> transducer;
    
    private Pipeline(Transducer<In, Out> transducer) {
        this.transducer = transducer;
    }
    
    /**
     * Returns an empty pipeline, which outputs its source elements unchanged.
     *
     * @return an empty pipeline
     * @param <T> the source element type
     */
    public static <T> Pipeline<T, T> start() {
        return new Pipeline<>(Transducers.identity());
    }
    
    /**
     * Returns a pipeline with the given transducer as its only stage.
     *
     * @param transducer the transducer
     * @return a pipeline running the transducer
     * @param <T> the source element type
     * @param <U> the output element type
     * @throws NullPointerException if transducer is null
     */
    public static <T, U> Pipeline<T, U> of(Transducer<T, U> transducer) {
        return new Pipeline<>(Objects.requireNonNull(transducer));
    }
    
    /**
     * Returns the composed transducer of all stages in this pipeline.
     *
     * @return the composed transducer
     */
    public Transducer<In, Out> transducer() {
        return transducer;
    }
    
    /**
     * Appends the given transducer as the next stage.
     *
     * @param next the transducer
     * @return a new pipeline ending with the transducer
     * @param <V> the new output element type
     * @throws NullPointerException if next is null
     */
    public <V> Pipeline<In, V> then(Transducer<? super Out, ? extends V> next) {
        return new Pipeline<>(transducer.andThen(next));
    }
    
    public <V> Pipeline<In, V> map(Function<? super Out, ? extends V> mapper) {
        return then(Transducers.<Out, V>map(mapper));
    }
    
    public Pipeline<In, Out> filter(Predicate<? super Out> predicate) {
        return then(Transducers.<Out>filter(predicate));
    }
    
    public Pipeline<In, Out> reject(Predicate<? super Out> predicate) {
        return then(Transducers.<Out>reject(predicate));
    }
    
    public <V> Pipeline<In, V> flatMap(Function<? super Out, ? extends Iterable<? extends V>> mapper) {
        return then(Transducers.<Out, V>flatMap(mapper));
    }
    
    public Pipeline<In, Out> take(long n) {
        return then(Transducers.<Out>take(n));
    }
    
    public Pipeline<In, Out> takeWhile(Predicate<? super Out> predicate) {
        return then(Transducers.<Out>takeWhile(predicate));
    }
    
    public Pipeline<In, Out> drop(long n) {
        return then(Transducers.<Out>drop(n));
    }
    
    public Pipeline<In, Out> dropWhile(Predicate<? super Out> predicate) {
        return then(Transducers.<Out>dropWhile(predicate));
    }
    
    public Pipeline<In, Out> tap(Consumer<? super Out> action) {
        return then(Transducers.<Out>tap(action));
    }
    
    public Pipeline<In, Out> unique() {
        return then(Transducers.<Out>unique());
    }
    
    public <K> Pipeline<In, Out> uniqueBy(Function<? super Out, ? extends K> keyMapper) {
        return then(Transducers.<Out, K>uniqueBy(keyMapper));
    }
    
    public <S> Pipeline<In, S> scan(S seed, BiFunction<? super S, ? super Out, ? extends S> accumulator) {
        return then(Transducers.<Out, S>scan(seed, accumulator));
    }
    
    public Pipeline<In, List<Out>> chunk(int size) {
        return then(Transducers.<Out>chunk(size));
    }
    
    /**
     * Runs the {@code source} through this pipeline, collecting the output into a new list.
     *
     * @param source the source of elements
     * @return a list of the output
     * @throws NullPointerException if source is null
     */
    public List<Out> toList(Iterable<? extends In> source) {
        return Reductions.toList(transducer, source);
    }
    
    /**
     * Runs the {@code source} through this pipeline, folding the output with the {@code accumulator}. The fold itself
     * never stops the run; only the pipeline's own stages can end it early.
     *
     * @param source the source of elements
     * @param initial the initial accumulated value
     * @param accumulator a function folding each output element into the accumulated value
     * @return the accumulated value
     * @param <R> the accumulated value type
     * @throws NullPointerException if source or accumulator is null
     */
    public <R> R reduce(Iterable<? extends In> source,
                        R initial,
                        BiFunction<? super R, ? super Out, ? extends R> accumulator) {
        Objects.requireNonNull(accumulator);
        return Reductions.reduce(transducer, source, initial,
                                 (acc, element) -> Step.<R>cont(accumulator.apply(acc, element)));
    }
}
