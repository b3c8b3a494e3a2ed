package io.avery.transducer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Implementations of various useful {@link Transducer Transducers}.
 *
 * <p>Every transducer here is immutable and can be applied any number of times. Transducers that need state while
 * driving (such as {@link #take take}, {@link #scan scan}, or {@link #chunk chunk}) create that state on each
 * {@link Transducer#apply apply}, so each resulting reducer starts fresh and keeps its state for as long as it is
 * driven.
 *
 * <p>Invalid configuration (such as a negative count) is rejected when the transducer is created, never while it is
 * being driven. Exceptions thrown by user-supplied functions propagate to the caller of the reducer unchanged.
 */
public class Transducers {
    private Transducers() {} // Utility
    
    /**
     * Returns a transducer that passes elements through unchanged. Applying it to a reducer returns that same reducer.
     *
     * @return the identity transducer
     * @param <T> the element type
     */
    @SuppressWarnings("unchecked")
    public static <T> Transducer<T, T> identity() {
        return (Transducer<T, T>) Identity.INSTANCE;
    }
    
    /**
     * Returns a transducer that passes elements through {@code first}, then {@code second}. Applying the result to a
     * reducer applies {@code second} to the reducer, then applies {@code first} to that.
     *
     * @param first the upstream transducer
     * @param second the downstream transducer
     * @return the composed transducer
     * @param <T> the upstream element type
     * @param <U> the intermediate element type
     * @param <V> the downstream element type
     * @throws NullPointerException if first or second is null
     */
    public static <T, U, V> Transducer<T, V> compose(Transducer<T, U> first,
                                                     Transducer<? super U, ? extends V> second) {
        return Objects.requireNonNull(first).andThen(second);
    }
    
    /**
     * Returns a transducer that applies the {@code mapper} to each element, and passes the result downstream.
     *
     * <p>Consecutive maps fuse: {@code map(f).andThen(map(g))} behaves as {@code map(f.andThen(g))}.
     *
     * @param mapper the function to apply to each element
     * @return a mapping transducer
     * @param <T> the upstream element type
     * @param <U> the downstream element type
     * @throws NullPointerException if mapper is null
     */
    public static <T, U> Transducer<T, U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper);
        
        class Mapping implements Transducer<T, U> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super U> downstream) {
                Objects.requireNonNull(downstream);
                return (acc, element) -> downstream.apply(acc, mapper.apply(element));
            }
        }
        
        return new Mapping();
    }
    
    /**
     * Returns a transducer that passes an element downstream only if it matches the {@code predicate}. A rejected
     * element leaves the accumulator unchanged, and does not stop the reduction.
     *
     * <p>Consecutive filters fuse: {@code filter(p).andThen(filter(q))} behaves as {@code filter(p.and(q))}.
     *
     * @param predicate the predicate elements must match
     * @return a filtering transducer
     * @param <T> the element type
     * @throws NullPointerException if predicate is null
     */
    public static <T> Transducer<T, T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        
        class Filter implements Transducer<T, T> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super T> downstream) {
                Objects.requireNonNull(downstream);
                return (acc, element) -> predicate.test(element) ? downstream.apply(acc, element) : Step.cont(acc);
            }
        }
        
        return new Filter();
    }
    
    /**
     * Returns a transducer that passes an element downstream only if it does <em>not</em> match the
     * {@code predicate}. Equivalent to {@code filter(predicate.negate())}.
     *
     * @param predicate the predicate elements must not match
     * @return a rejecting transducer
     * @param <T> the element type
     * @throws NullPointerException if predicate is null
     */
    public static <T> Transducer<T, T> reject(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        return Transducers.<T>filter(predicate.negate());
    }
    
    /**
     * Returns a transducer that passes the first {@code n} elements downstream, then stops. The step returned for the
     * {@code n}-th element is a stop step, so a driver consumes no more than {@code n} elements. If {@code n} is zero,
     * the first element stops the reduction without being passed downstream.
     *
     * <p>Example:
     * <pre>{@code
     * Iterable<Integer> source = () -> IntStream.rangeClosed(1, 1_000_000).iterator();
     * List<Integer> list = Reductions.toList(Transducers.take(3), source);
     * System.out.println(list);
     * // Prints: [1, 2, 3]
     * }</pre>
     *
     * @param n the number of elements to pass downstream
     * @return a truncating transducer
     * @param <T> the element type
     * @throws IllegalArgumentException if n is negative
     */
    public static <T> Transducer<T, T> take(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative: " + n);
        }
        
        class Take implements Transducer<T, T> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super T> downstream) {
                Objects.requireNonNull(downstream);
                return new Reducer<A, T>() {
                    long taken = 0;
                    
                    @Override
                    public Step<A> apply(A acc, T element) {
                        if (taken >= n) {
                            return Step.stop(acc);
                        }
                        Step<A> step = downstream.apply(acc, element);
                        return ++taken >= n ? step.asStop() : step;
                    }
                };
            }
        }
        
        return new Take();
    }
    
    /**
     * Returns a transducer that passes elements downstream while they match the {@code predicate}. The first element
     * that does not match stops the reduction, and is not passed downstream.
     *
     * @param predicate the predicate elements must match to be passed downstream
     * @return a truncating transducer
     * @param <T> the element type
     * @throws NullPointerException if predicate is null
     */
    public static <T> Transducer<T, T> takeWhile(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        
        class TakeWhile implements Transducer<T, T> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super T> downstream) {
                Objects.requireNonNull(downstream);
                return (acc, element) -> predicate.test(element) ? downstream.apply(acc, element) : Step.stop(acc);
            }
        }
        
        return new TakeWhile();
    }
    
    /**
     * Returns a transducer that discards the first {@code n} elements, and passes the rest downstream.
     *
     * @param n the number of elements to discard
     * @return a skipping transducer
     * @param <T> the element type
     * @throws IllegalArgumentException if n is negative
     */
    public static <T> Transducer<T, T> drop(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative: " + n);
        }
        
        class Drop implements Transducer<T, T> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super T> downstream) {
                Objects.requireNonNull(downstream);
                return new Reducer<A, T>() {
                    long dropped = 0;
                    
                    @Override
                    public Step<A> apply(A acc, T element) {
                        if (dropped < n) {
                            dropped++;
                            return Step.cont(acc);
                        }
                        return downstream.apply(acc, element);
                    }
                };
            }
        }
        
        return new Drop();
    }
    
    /**
     * Returns a transducer that discards elements while they match the {@code predicate}. Once an element does not
     * match, it and every later element are passed downstream; the predicate is not consulted again, even if later
     * elements would match it.
     *
     * @param predicate the predicate elements must match to be discarded
     * @return a skipping transducer
     * @param <T> the element type
     * @throws NullPointerException if predicate is null
     */
    public static <T> Transducer<T, T> dropWhile(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        
        class DropWhile implements Transducer<T, T> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super T> downstream) {
                Objects.requireNonNull(downstream);
                return new Reducer<A, T>() {
                    boolean dropping = true;
                    
                    @Override
                    public Step<A> apply(A acc, T element) {
                        if (dropping) {
                            if (predicate.test(element)) {
                                return Step.cont(acc);
                            }
                            dropping = false;
                        }
                        return downstream.apply(acc, element);
                    }
                };
            }
        }
        
        return new DropWhile();
    }
    
    /**
     * Returns a transducer that discards an element if it {@link Objects#equals equals} the element passed downstream
     * just before it. Only consecutive repeats are removed; an element equal to an earlier, non-adjacent element is
     * passed downstream again. The first element is always passed downstream.
     *
     * <p>Example:
     * <pre>{@code
     * List<Integer> list = Reductions.toList(Transducers.unique(), List.of(1, 1, 2, 2, 3, 3, 2, 1));
     * System.out.println(list);
     * // Prints: [1, 2, 3, 2, 1]
     * }</pre>
     *
     * @return a deduplicating transducer
     * @param <T> the element type
     * @see #uniqueBy(Function)
     */
    public static <T> Transducer<T, T> unique() {
        class Unique implements Transducer<T, T> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super T> downstream) {
                Objects.requireNonNull(downstream);
                return new Reducer<A, T>() {
                    boolean first = true;
                    T last = null;
                    
                    @Override
                    public Step<A> apply(A acc, T element) {
                        if (!first && Objects.equals(last, element)) {
                            return Step.cont(acc);
                        }
                        first = false;
                        last = element;
                        return downstream.apply(acc, element);
                    }
                };
            }
        }
        
        return new Unique();
    }
    
    /**
     * Returns a transducer that passes an element downstream only if no earlier element had the same key. Unlike
     * {@link #unique()}, repeats are removed wherever they occur. Keys are compared by {@code equals} and
     * {@code hashCode}, and every distinct key is retained for as long as the reducer is driven.
     *
     * @param keyMapper a function computing the key of each element
     * @return a deduplicating transducer
     * @param <T> the element type
     * @param <K> the key type
     * @throws NullPointerException if keyMapper is null
     */
    public static <T, K> Transducer<T, T> uniqueBy(Function<? super T, ? extends K> keyMapper) {
        Objects.requireNonNull(keyMapper);
        
        class UniqueBy implements Transducer<T, T> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super T> downstream) {
                Objects.requireNonNull(downstream);
                Set<K> seen = new HashSet<>();
                return (acc, element) -> seen.add(keyMapper.apply(element))
                    ? downstream.apply(acc, element)
                    : Step.cont(acc);
            }
        }
        
        return new UniqueBy();
    }
    
    /**
     * Returns a transducer that folds each element into a running state using the {@code accumulator}, and passes each
     * new state downstream. The state starts at {@code seed} each time the transducer is applied.
     *
     * <p>Example:
     * <pre>{@code
     * List<Integer> list = Reductions.toList(Transducers.scan(0, Integer::sum), List.of(1, 2, 3, 4, 5));
     * System.out.println(list);
     * // Prints: [1, 3, 6, 10, 15]
     * }</pre>
     *
     * @param seed the initial state
     * @param accumulator a function folding an element into the state
     * @return a scanning transducer
     * @param <T> the upstream element type
     * @param <S> the state type, and downstream element type
     * @throws NullPointerException if accumulator is null
     */
    public static <T, S> Transducer<T, S> scan(S seed, BiFunction<? super S, ? super T, ? extends S> accumulator) {
        Objects.requireNonNull(accumulator);
        
        class Scan implements Transducer<T, S> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super S> downstream) {
                Objects.requireNonNull(downstream);
                return new Reducer<A, T>() {
                    S state = seed;
                    
                    @Override
                    public Step<A> apply(A acc, T element) {
                        state = accumulator.apply(state, element);
                        return downstream.apply(acc, state);
                    }
                };
            }
        }
        
        return new Scan();
    }
    
    /**
     * Returns a transducer that calls the {@code action} on each element, then passes the element downstream
     * unchanged.
     *
     * @param action the action to perform on each element
     * @return a peeking transducer
     * @param <T> the element type
     * @throws NullPointerException if action is null
     */
    public static <T> Transducer<T, T> tap(Consumer<? super T> action) {
        Objects.requireNonNull(action);
        
        class Tap implements Transducer<T, T> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super T> downstream) {
                Objects.requireNonNull(downstream);
                return (acc, element) -> {
                    action.accept(element);
                    return downstream.apply(acc, element);
                };
            }
        }
        
        return new Tap();
    }
    
    /**
     * Returns a transducer that applies the {@code mapper} to each element, and passes each element of the resulting
     * iterable downstream, in order. If the {@code mapper} returns null, nothing is passed downstream.
     *
     * <p>If the downstream reducer stops while the iterable is being traversed, traversal ends immediately: the
     * remaining elements of the iterable are not requested, and the stop step is returned.
     *
     * @param mapper a function producing the elements to pass downstream for each element
     * @return a flat-mapping transducer
     * @param <T> the upstream element type
     * @param <U> the downstream element type
     * @throws NullPointerException if mapper is null
     */
    public static <T, U> Transducer<T, U> flatMap(Function<? super T, ? extends Iterable<? extends U>> mapper) {
        Objects.requireNonNull(mapper);
        
        class FlatMap implements Transducer<T, U> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super U> downstream) {
                Objects.requireNonNull(downstream);
                return (acc, element) -> {
                    Iterable<? extends U> items = mapper.apply(element);
                    if (items == null) {
                        return Step.cont(acc);
                    }
                    A next = acc;
                    for (U item : items) {
                        Step<A> step = downstream.apply(next, item);
                        if (step.isStop()) {
                            return step;
                        }
                        next = step.unwrap();
                    }
                    return Step.cont(next);
                };
            }
        }
        
        return new FlatMap();
    }
    
    /**
     * Returns a transducer that buffers elements into lists of {@code size}, passing each list downstream when it is
     * full. A trailing partial list is discarded. Each list passed downstream is unmodifiable and not reused.
     *
     * @param size the number of elements per list
     * @return a chunking transducer
     * @param <T> the element type
     * @throws IllegalArgumentException if size is less than 1
     */
    public static <T> Transducer<T, List<T>> chunk(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        
        class Chunk implements Transducer<T, List<T>> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super List<T>> downstream) {
                Objects.requireNonNull(downstream);
                return new Reducer<A, T>() {
                    List<T> buffer = new ArrayList<>(size);
                    
                    @Override
                    public Step<A> apply(A acc, T element) {
                        buffer.add(element);
                        if (buffer.size() < size) {
                            return Step.cont(acc);
                        }
                        List<T> full = buffer;
                        buffer = new ArrayList<>(size);
                        return downstream.apply(acc, Collections.unmodifiableList(full));
                    }
                };
            }
        }
        
        return new Chunk();
    }
    
    /**
     * Returns a transducer that passes the {@code separator} downstream between consecutive elements. If the downstream
     * reducer stops on a separator, the element after it is not passed downstream.
     *
     * @param separator the element to insert between elements
     * @return an interposing transducer
     * @param <T> the element type
     */
    public static <T> Transducer<T, T> interpose(T separator) {
        class Interpose implements Transducer<T, T> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super T> downstream) {
                Objects.requireNonNull(downstream);
                return new Reducer<A, T>() {
                    boolean first = true;
                    
                    @Override
                    public Step<A> apply(A acc, T element) {
                        if (first) {
                            first = false;
                            return downstream.apply(acc, element);
                        }
                        return downstream.apply(acc, separator).flatMap(next -> downstream.apply(next, element));
                    }
                };
            }
        }
        
        return new Interpose();
    }
    
    /**
     * Returns a transducer that passes each element downstream {@code n} times. If {@code n} is zero, nothing is passed
     * downstream. If the downstream reducer stops partway through the repeats, the remaining repeats are skipped.
     *
     * @param n the number of times to pass each element
     * @return a repeating transducer
     * @param <T> the element type
     * @throws IllegalArgumentException if n is negative
     */
    public static <T> Transducer<T, T> repeatEach(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative: " + n);
        }
        
        class RepeatEach implements Transducer<T, T> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super T> downstream) {
                Objects.requireNonNull(downstream);
                return (acc, element) -> {
                    A next = acc;
                    for (long i = 0; i < n; i++) {
                        Step<A> step = downstream.apply(next, element);
                        if (step.isStop()) {
                            return step;
                        }
                        next = step.unwrap();
                    }
                    return Step.cont(next);
                };
            }
        }
        
        return new RepeatEach();
    }
    
    /**
     * Returns a transducer that passes sliding windows of {@code size} consecutive elements downstream, advancing one
     * element at a time. No window is passed until {@code size} elements have arrived. Each window is an unmodifiable
     * list.
     *
     * <p>Example:
     * <pre>{@code
     * List<List<Integer>> list = Reductions.toList(Transducers.aperture(3), List.of(1, 2, 3, 4, 5));
     * System.out.println(list);
     * // Prints: [[1, 2, 3], [2, 3, 4], [3, 4, 5]]
     * }</pre>
     *
     * @param size the number of elements per window
     * @return a windowing transducer
     * @param <T> the element type
     * @throws IllegalArgumentException if size is less than 1
     */
    public static <T> Transducer<T, List<T>> aperture(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        
        class Aperture implements Transducer<T, List<T>> {
            @Override
            public <A> Reducer<A, T> apply(Reducer<A, ? super List<T>> downstream) {
                Objects.requireNonNull(downstream);
                return new Reducer<A, T>() {
                    // Ring buffer that admits nulls. Oldest element at 'next' once full.
                    final Object[] ring = new Object[size];
                    int next = 0;
                    int filled = 0;
                    
                    @Override
                    public Step<A> apply(A acc, T element) {
                        ring[next] = element;
                        next = (next + 1) % size;
                        if (filled < size && ++filled < size) {
                            return Step.cont(acc);
                        }
                        List<T> window = new ArrayList<>(size);
                        for (int i = 0; i < size; i++) {
                            @SuppressWarnings("unchecked")
                            T t = (T) ring[(next + i) % size];
                            window.add(t);
                        }
                        return downstream.apply(acc, Collections.unmodifiableList(window));
                    }
                };
            }
        }
        
        return new Aperture();
    }
    
    /**
     * Returns a transducer that applies the {@code mapper} to elements that match the {@code predicate}, and passes
     * other elements downstream unchanged.
     *
     * @param predicate the predicate selecting elements to transform
     * @param mapper the transformation
     * @return a conditionally mapping transducer
     * @param <T> the element type
     * @throws NullPointerException if predicate or mapper is null
     */
    public static <T> Transducer<T, T> when(Predicate<? super T> predicate, Function<? super T, ? extends T> mapper) {
        return Transducers.<T, T>ifElse(predicate, mapper, Function.identity());
    }
    
    /**
     * Returns a transducer that applies the {@code mapper} to elements that do <em>not</em> match the
     * {@code predicate}, and passes other elements downstream unchanged.
     *
     * @param predicate the predicate selecting elements to leave unchanged
     * @param mapper the transformation
     * @return a conditionally mapping transducer
     * @param <T> the element type
     * @throws NullPointerException if predicate or mapper is null
     */
    public static <T> Transducer<T, T> unless(Predicate<? super T> predicate, Function<? super T, ? extends T> mapper) {
        return Transducers.<T, T>ifElse(predicate, Function.identity(), mapper);
    }
    
    /**
     * Returns a transducer that passes {@code ifTrue} applied to elements that match the {@code predicate}, and
     * {@code ifFalse} applied to the rest.
     *
     * @param predicate the predicate choosing the transformation
     * @param ifTrue the transformation for matching elements
     * @param ifFalse the transformation for other elements
     * @return a branching transducer
     * @param <T> the upstream element type
     * @param <U> the downstream element type
     * @throws NullPointerException if any argument is null
     */
    public static <T, U> Transducer<T, U> ifElse(Predicate<? super T> predicate,
                                                 Function<? super T, ? extends U> ifTrue,
                                                 Function<? super T, ? extends U> ifFalse) {
        Objects.requireNonNull(predicate);
        Objects.requireNonNull(ifTrue);
        Objects.requireNonNull(ifFalse);
        return Transducers.<T, U>map(element -> predicate.test(element)
            ? ifTrue.apply(element)
            : ifFalse.apply(element));
    }
    
    static final class Identity<T> implements Transducer<T, T> {
        static final Identity<?> INSTANCE = new Identity<>();
        
        private Identity() {}
        
        @Override
        @SuppressWarnings("unchecked")
        public <A> Reducer<A, T> apply(Reducer<A, ? super T> downstream) {
            return (Reducer<A, T>) Objects.requireNonNull(downstream);
        }
    }
    
    static final class Chain<In, Mid, Out> implements Transducer<In, Out> {
        final Transducer<In, Mid> upstream;
        final Transducer<Mid, Out> downstream;
        
        Chain(Transducer<In, Mid> upstream, Transducer<Mid, Out> downstream) {
            this.upstream = Objects.requireNonNull(upstream);
            this.downstream = Objects.requireNonNull(downstream);
        }
        
        @Override
        public <A> Reducer<A, In> apply(Reducer<A, ? super Out> reducer) {
            return upstream.apply(downstream.apply(reducer));
        }
    }
}
