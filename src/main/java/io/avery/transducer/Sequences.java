package io.avery.transducer;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Eager operations over two or more sequences, and lazy generators of sequences. The eager operations fall outside the
 * single-input model of {@link Transducer Transducer}, and return new, mutable lists. The generators return
 * {@code Iterable}s that produce elements only as they are pulled, so an infinite generator is safe to reduce with a
 * transducer that stops.
 *
 * <p>Pairs are represented as immutable {@link Map.Entry Map.Entry} instances, which permit null keys and values.
 * Set-like operations compare elements with {@code equals} and {@code hashCode}.
 */
public class Sequences {
    private Sequences() {} // Utility
    
    /**
     * Pairs up elements of {@code a} and {@code b} by position. Stops when either sequence is exhausted; the longer
     * sequence is not iterated past the length of the shorter.
     *
     * <p>Example:
     * <pre>{@code
     * System.out.println(Sequences.zip(List.of(1, 2, 3), List.of("a", "b")));
     * // Prints: [1=a, 2=b]
     * }</pre>
     *
     * @param a the first sequence
     * @param b the second sequence
     * @return the pairs, in order
     * @param <A> the first sequence's element type
     * @param <B> the second sequence's element type
     * @throws NullPointerException if a or b is null
     */
    public static <A, B> List<Map.Entry<A, B>> zip(Iterable<? extends A> a, Iterable<? extends B> b) {
        return zipWith(a, b, AbstractMap.SimpleImmutableEntry<A, B>::new);
    }
    
    /**
     * Combines elements of {@code a} and {@code b} by position, using the {@code combiner}. Stops when either sequence
     * is exhausted.
     *
     * @param a the first sequence
     * @param b the second sequence
     * @param combiner a function used to combine elements from each sequence
     * @return the combined elements, in order
     * @param <A> the first sequence's element type
     * @param <B> the second sequence's element type
     * @param <T> the combined element type
     * @throws NullPointerException if any argument is null
     */
    public static <A, B, T> List<T> zipWith(Iterable<? extends A> a,
                                            Iterable<? extends B> b,
                                            BiFunction<? super A, ? super B, ? extends T> combiner) {
        Objects.requireNonNull(a);
        Objects.requireNonNull(b);
        Objects.requireNonNull(combiner);
        
        Iterator<? extends A> iterA = a.iterator();
        Iterator<? extends B> iterB = b.iterator();
        List<T> result = new ArrayList<>();
        while (iterA.hasNext() && iterB.hasNext()) {
            result.add(combiner.apply(iterA.next(), iterB.next()));
        }
        return result;
    }
    
    /**
     * Pairs up elements of {@code a} and {@code b} by position, until both sequences are exhausted. Once one sequence
     * is exhausted, its side of each remaining pair is filled with the corresponding fill value.
     *
     * @param a the first sequence
     * @param b the second sequence
     * @param fillA the value standing in for elements of {@code a} after it is exhausted
     * @param fillB the value standing in for elements of {@code b} after it is exhausted
     * @return the pairs, in order
     * @param <A> the first sequence's element type
     * @param <B> the second sequence's element type
     * @throws NullPointerException if a or b is null
     */
    public static <A, B> List<Map.Entry<A, B>> zipLongest(Iterable<? extends A> a,
                                                         Iterable<? extends B> b,
                                                         A fillA,
                                                         B fillB) {
        Objects.requireNonNull(a);
        Objects.requireNonNull(b);
        
        Iterator<? extends A> iterA = a.iterator();
        Iterator<? extends B> iterB = b.iterator();
        List<Map.Entry<A, B>> result = new ArrayList<>();
        while (iterA.hasNext() || iterB.hasNext()) {
            A left = iterA.hasNext() ? iterA.next() : fillA;
            B right = iterB.hasNext() ? iterB.next() : fillB;
            result.add(new AbstractMap.SimpleImmutableEntry<>(left, right));
        }
        return result;
    }
    
    /**
     * Interleaves the {@code sources} round-robin: the first element of each source in turn, then the second of each,
     * and so on. Exhausted sources are skipped, until all are exhausted.
     *
     * <p>Example:
     * <pre>{@code
     * System.out.println(Sequences.merge(List.of(List.of(1, 4), List.of(2), List.of(3, 5, 6))));
     * // Prints: [1, 2, 3, 4, 5, 6]
     * }</pre>
     *
     * @param sources the sequences to interleave
     * @return the interleaved elements
     * @param <T> the element type
     * @throws NullPointerException if sources or any source is null
     */
    public static <T> List<T> merge(List<? extends Iterable<? extends T>> sources) {
        Objects.requireNonNull(sources);
        List<Iterator<? extends T>> live = new ArrayList<>(sources.size());
        for (Iterable<? extends T> source : sources) {
            live.add(Objects.requireNonNull(source).iterator());
        }
        
        List<T> result = new ArrayList<>();
        while (!live.isEmpty()) {
            for (Iterator<Iterator<? extends T>> round = live.iterator(); round.hasNext(); ) {
                Iterator<? extends T> iter = round.next();
                if (iter.hasNext()) {
                    result.add(iter.next());
                } else {
                    round.remove();
                }
            }
        }
        return result;
    }
    
    /**
     * Returns the elements of {@code a} that are present in {@code b}, keeping the order and duplicates of {@code a}.
     *
     * @param a the sequence to filter
     * @param b the sequence of elements to keep
     * @return the elements of {@code a} present in {@code b}
     * @param <T> the element type
     * @throws NullPointerException if a or b is null
     */
    public static <T> List<T> intersection(Iterable<? extends T> a, Iterable<?> b) {
        Set<Object> keep = toSet(b);
        List<T> result = new ArrayList<>();
        for (T element : Objects.requireNonNull(a)) {
            if (keep.contains(element)) {
                result.add(element);
            }
        }
        return result;
    }
    
    /**
     * Returns the elements of {@code a} that are absent from {@code b}, keeping the order and duplicates of {@code a}.
     *
     * @param a the sequence to filter
     * @param b the sequence of elements to remove
     * @return the elements of {@code a} absent from {@code b}
     * @param <T> the element type
     * @throws NullPointerException if a or b is null
     */
    public static <T> List<T> difference(Iterable<? extends T> a, Iterable<?> b) {
        Set<Object> remove = toSet(b);
        List<T> result = new ArrayList<>();
        for (T element : Objects.requireNonNull(a)) {
            if (!remove.contains(element)) {
                result.add(element);
            }
        }
        return result;
    }
    
    /**
     * Returns the distinct elements of {@code a}, followed by the distinct elements of {@code b} that are not in
     * {@code a}, each in first-seen order.
     *
     * @param a the first sequence
     * @param b the second sequence
     * @return the distinct elements of both sequences
     * @param <T> the element type
     * @throws NullPointerException if a or b is null
     */
    public static <T> List<T> union(Iterable<? extends T> a, Iterable<? extends T> b) {
        Objects.requireNonNull(a);
        Objects.requireNonNull(b);
        Set<T> seen = new LinkedHashSet<>();
        a.forEach(seen::add);
        b.forEach(seen::add);
        return new ArrayList<>(seen);
    }
    
    /**
     * Returns the distinct elements of {@code a} that are not in {@code b}, followed by the distinct elements of
     * {@code b} that are not in {@code a}, each in first-seen order.
     *
     * <p>Example:
     * <pre>{@code
     * System.out.println(Sequences.symmetricDifference(List.of(1, 2, 2, 3), List.of(3, 4, 4)));
     * // Prints: [1, 2, 4]
     * }</pre>
     *
     * @param a the first sequence
     * @param b the second sequence
     * @return the distinct elements in exactly one of the sequences
     * @param <T> the element type
     * @throws NullPointerException if a or b is null
     */
    public static <T> List<T> symmetricDifference(Iterable<? extends T> a, Iterable<? extends T> b) {
        Objects.requireNonNull(a);
        Objects.requireNonNull(b);
        Set<T> onlyA = new LinkedHashSet<>();
        a.forEach(onlyA::add);
        Set<T> onlyB = new LinkedHashSet<>();
        b.forEach(onlyB::add);
        
        List<T> result = new ArrayList<>();
        for (T element : onlyA) {
            if (!onlyB.contains(element)) {
                result.add(element);
            }
        }
        for (T element : onlyB) {
            if (!onlyA.contains(element)) {
                result.add(element);
            }
        }
        return result;
    }
    
    /**
     * Returns every pair of an element of {@code a} with an element of {@code b}. Pairs are ordered by position in
     * {@code a} first, then by position in {@code b}. {@code b} is iterated once.
     *
     * @param a the first sequence
     * @param b the second sequence
     * @return all pairs
     * @param <A> the first sequence's element type
     * @param <B> the second sequence's element type
     * @throws NullPointerException if a or b is null
     */
    public static <A, B> List<Map.Entry<A, B>> cartesianProduct(Iterable<? extends A> a, Iterable<? extends B> b) {
        Objects.requireNonNull(a);
        Objects.requireNonNull(b);
        List<B> right = new ArrayList<>();
        b.forEach(right::add);
        
        List<Map.Entry<A, B>> result = new ArrayList<>();
        for (A left : a) {
            for (B element : right) {
                result.add(new AbstractMap.SimpleImmutableEntry<>(left, element));
            }
        }
        return result;
    }
    
    /**
     * Returns the integers from {@code start} (inclusive) to {@code end} (exclusive), counting by 1. Empty if
     * {@code end <= start}.
     *
     * @param start the first integer
     * @param end the bound, not included
     * @return a lazy, re-iterable sequence of integers
     */
    public static Iterable<Integer> range(int start, int end) {
        return range(start, end, 1);
    }
    
    /**
     * Returns the integers from {@code start} (inclusive) toward {@code end} (exclusive), counting by {@code step}.
     * A negative step counts down. Empty if {@code start} is already at or past {@code end} in the step's direction.
     *
     * <p>Example:
     * <pre>{@code
     * System.out.println(Reductions.toList(Transducers.identity(), Sequences.range(10, 0, -3)));
     * // Prints: [10, 7, 4, 1]
     * }</pre>
     *
     * @param start the first integer
     * @param end the bound, not included
     * @param step the difference between consecutive integers
     * @return a lazy, re-iterable sequence of integers
     * @throws IllegalArgumentException if step is zero
     */
    public static Iterable<Integer> range(int start, int end, int step) {
        if (step == 0) {
            throw new IllegalArgumentException("step must not be zero");
        }
        
        class Range implements Iterator<Integer> {
            long next = start;
            
            @Override
            public boolean hasNext() {
                return step > 0 ? next < end : next > end;
            }
            
            @Override
            public Integer next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int current = (int) next;
                next += step;
                return current;
            }
        }
        
        return Range::new;
    }
    
    /**
     * Returns the {@code value}, repeated {@code times} times.
     *
     * @param value the value to repeat
     * @param times the number of repetitions
     * @return a lazy, re-iterable sequence of the value
     * @param <T> the element type
     * @throws IllegalArgumentException if times is negative
     */
    public static <T> Iterable<T> repeat(T value, long times) {
        if (times < 0) {
            throw new IllegalArgumentException("times must be non-negative: " + times);
        }
        
        class Repeat implements Iterator<T> {
            long remaining = times;
            
            @Override
            public boolean hasNext() {
                return remaining > 0;
            }
            
            @Override
            public T next() {
                if (remaining <= 0) {
                    throw new NoSuchElementException();
                }
                remaining--;
                return value;
            }
        }
        
        return Repeat::new;
    }
    
    /**
     * Returns the elements of {@code source}, over and over. The source is iterated anew on each pass. The sequence is
     * infinite unless a pass produces no elements, in which case it ends; pair it with a transducer that stops, such as
     * {@link Transducers#take take}.
     *
     * <p>Example:
     * <pre>{@code
     * System.out.println(Reductions.toList(Transducers.take(5), Sequences.cycle(List.of(1, 2))));
     * // Prints: [1, 2, 1, 2, 1]
     * }</pre>
     *
     * @param source the elements to cycle through
     * @return a lazy, re-iterable, usually infinite sequence
     * @param <T> the element type
     * @throws NullPointerException if source is null
     */
    public static <T> Iterable<T> cycle(Iterable<? extends T> source) {
        Objects.requireNonNull(source);
        
        class Cycle implements Iterator<T> {
            Iterator<? extends T> pass = source.iterator();
            boolean emptyPass = true;
            
            @Override
            public boolean hasNext() {
                if (pass.hasNext()) {
                    return true;
                }
                if (emptyPass) {
                    return false;
                }
                pass = source.iterator();
                emptyPass = true;
                return pass.hasNext();
            }
            
            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                emptyPass = false;
                return pass.next();
            }
        }
        
        return Cycle::new;
    }
    
    /**
     * Returns the sequence generated from {@code seed} by repeatedly applying {@code step}. Each application either
     * yields an element and the next state, as a {@link Map.Entry Map.Entry}, or an empty {@code Optional} to end the
     * sequence. The step is applied lazily, once per element pulled, plus once to find the end.
     *
     * <p>Example:
     * <pre>{@code
     * Iterable<Integer> powers = Sequences.<Integer, Integer>unfold(1, n -> n > 100
     *     ? Optional.empty()
     *     : Optional.of(Map.entry(n, n * 2)));
     * System.out.println(Reductions.toList(Transducers.identity(), powers));
     * // Prints: [1, 2, 4, 8, 16, 32, 64]
     * }</pre>
     *
     * @param seed the initial state
     * @param step a function producing the next element and state from the current state
     * @return a lazy, re-iterable sequence, starting over from the seed on each iteration
     * @param <T> the element type
     * @param <S> the state type
     * @throws NullPointerException if step is null, or if it returns null
     */
    public static <T, S> Iterable<T> unfold(S seed, Function<? super S, Optional<Map.Entry<T, S>>> step) {
        Objects.requireNonNull(step);
        
        class Unfold implements Iterator<T> {
            S state = seed;
            Map.Entry<T, S> pending = null;
            boolean done = false;
            
            @Override
            public boolean hasNext() {
                if (pending != null) {
                    return true;
                }
                if (done) {
                    return false;
                }
                Optional<Map.Entry<T, S>> produced = step.apply(state);
                if (produced.isEmpty()) {
                    done = true;
                    return false;
                }
                pending = produced.get();
                return true;
            }
            
            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T element = pending.getKey();
                state = pending.getValue();
                pending = null;
                return element;
            }
        }
        
        return Unfold::new;
    }
    
    private static Set<Object> toSet(Iterable<?> elements) {
        Set<Object> set = new HashSet<>();
        Objects.requireNonNull(elements).forEach(set::add);
        return set;
    }
}
