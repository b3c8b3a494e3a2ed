package io.avery.transducer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Terminal operations that drive a source through a {@link Transducer Transducer} to produce a result.
 *
 * <p>Each operation applies the transducer to a reducer of its own, then offers the source's elements to the resulting
 * reducer in iteration order. Iteration ends when the source is exhausted, or as soon as the reducer returns a
 * {@link Step#isStop() stop} step, in which case no further elements are requested from the source. Every operation
 * here is {@link #reduce reduce} with a particular seed and reducer.
 *
 * <p>Operations that return an {@code Optional} element throw {@link NullPointerException} if the selected element is
 * null.
 */
public class Reductions {
    private Reductions() {} // Utility
    
    private static final Logger logger = Logger.getLogger(Reductions.class.getName());
    
    /**
     * Drives the {@code source} through the {@code transducer} into the {@code reducer}, starting from the
     * {@code initial} accumulator. Returns the accumulator of the last step: either the step that stopped the
     * reduction, or the step for the last element of the source.
     *
     * <p>Example:
     * <pre>{@code
     * int sum = Reductions.reduce(
     *     Transducers.map((Integer i) -> i * 2),
     *     List.of(1, 2, 3),
     *     0,
     *     (acc, i) -> Step.cont(acc + i)
     * );
     * System.out.println(sum);
     * // Prints: 12
     * }</pre>
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param initial the initial accumulator
     * @param reducer the reducer receiving the transducer's output
     * @return the final accumulator
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @param <A> the accumulator type
     * @throws NullPointerException if transducer, source, or reducer is null
     */
    public static <T, U, A> A reduce(Transducer<T, U> transducer,
                                     Iterable<? extends T> source,
                                     A initial,
                                     Reducer<A, ? super U> reducer) {
        Objects.requireNonNull(transducer);
        Objects.requireNonNull(source);
        Objects.requireNonNull(reducer);
        
        Reducer<A, T> driver = transducer.apply(reducer);
        A acc = initial;
        long consumed = 0;
        for (T element : source) {
            consumed++;
            Step<A> step = driver.apply(acc, element);
            acc = step.unwrap();
            if (step.isStop()) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Reduction stopped after " + consumed + " source elements");
                }
                break;
            }
        }
        return acc;
    }
    
    /**
     * Collects the transducer's output into a new, mutable list, in order.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @return a list of the transducer's output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if transducer or source is null
     */
    public static <T, U> List<U> toList(Transducer<T, U> transducer, Iterable<? extends T> source) {
        List<U> list = new ArrayList<>();
        return reduce(transducer, source, list, (acc, element) -> {
            acc.add(element);
            return Step.cont(acc);
        });
    }
    
    /**
     * Sums the transducer's output using the given {@code zero} and {@code adder}.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param zero the additive identity
     * @param adder the addition
     * @return the sum, or {@code zero} if there was no output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if transducer, source, or adder is null
     */
    public static <T, U> U sum(Transducer<T, U> transducer,
                               Iterable<? extends T> source,
                               U zero,
                               BinaryOperator<U> adder) {
        Objects.requireNonNull(adder);
        return reduce(transducer, source, zero, (acc, element) -> Step.cont(adder.apply(acc, element)));
    }
    
    public static <T> int sumInt(Transducer<T, Integer> transducer, Iterable<? extends T> source) {
        return sum(transducer, source, 0, Integer::sum);
    }
    
    public static <T> long sumLong(Transducer<T, Long> transducer, Iterable<? extends T> source) {
        return sum(transducer, source, 0L, Long::sum);
    }
    
    public static <T> double sumDouble(Transducer<T, Double> transducer, Iterable<? extends T> source) {
        return sum(transducer, source, 0.0, Double::sum);
    }
    
    /**
     * Counts the transducer's output.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @return the number of elements output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if transducer or source is null
     */
    public static <T, U> long count(Transducer<T, U> transducer, Iterable<? extends T> source) {
        return reduce(transducer, source, 0L, (acc, element) -> Step.cont(acc + 1));
    }
    
    /**
     * Returns the first element output by the transducer. The reduction stops as soon as that element is output.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @return the first output element, or an empty {@code Optional} if there was no output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if transducer or source is null, or if the first output element is null
     */
    public static <T, U> Optional<U> first(Transducer<T, U> transducer, Iterable<? extends T> source) {
        return reduce(transducer, source, Optional.<U>empty(), (acc, element) -> Step.stop(Optional.of(element)));
    }
    
    /**
     * Returns the last element output by the transducer.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @return the last output element, or an empty {@code Optional} if there was no output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if transducer or source is null, or if the last output element is null
     */
    public static <T, U> Optional<U> last(Transducer<T, U> transducer, Iterable<? extends T> source) {
        return reduce(transducer, source, Optional.<U>empty(), (acc, element) -> Step.cont(Optional.of(element)));
    }
    
    /**
     * Returns whether every element output by the transducer matches the {@code predicate}. The reduction stops at the
     * first element that does not match. Returns {@code true} if there was no output.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param predicate the predicate
     * @return {@code true} if no output element fails the predicate
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if any argument is null
     */
    public static <T, U> boolean every(Transducer<T, U> transducer,
                                       Iterable<? extends T> source,
                                       Predicate<? super U> predicate) {
        Objects.requireNonNull(predicate);
        return reduce(transducer, source, true,
                      (acc, element) -> predicate.test(element) ? Step.cont(true) : Step.stop(false));
    }
    
    /**
     * Returns whether any element output by the transducer matches the {@code predicate}. The reduction stops at the
     * first element that matches. Returns {@code false} if there was no output.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param predicate the predicate
     * @return {@code true} if some output element matches the predicate
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if any argument is null
     */
    public static <T, U> boolean some(Transducer<T, U> transducer,
                                      Iterable<? extends T> source,
                                      Predicate<? super U> predicate) {
        Objects.requireNonNull(predicate);
        return reduce(transducer, source, false,
                      (acc, element) -> predicate.test(element) ? Step.stop(true) : Step.cont(false));
    }
    
    /**
     * Returns whether no element output by the transducer matches the {@code predicate}. The reduction stops at the
     * first element that matches. Returns {@code true} if there was no output.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param predicate the predicate
     * @return {@code true} if no output element matches the predicate
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if any argument is null
     */
    public static <T, U> boolean none(Transducer<T, U> transducer,
                                      Iterable<? extends T> source,
                                      Predicate<? super U> predicate) {
        Objects.requireNonNull(predicate);
        return reduce(transducer, source, true,
                      (acc, element) -> predicate.test(element) ? Step.stop(false) : Step.cont(true));
    }
    
    /**
     * Returns whether the transducer outputs an element {@link Objects#equals equal} to the {@code target}. The
     * reduction stops at the first equal element.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param target the element to look for
     * @return {@code true} if an equal element was output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if transducer or source is null
     */
    public static <T, U> boolean contains(Transducer<T, U> transducer, Iterable<? extends T> source, Object target) {
        return reduce(transducer, source, false,
                      (acc, element) -> Objects.equals(element, target) ? Step.stop(true) : Step.cont(false));
    }
    
    /**
     * Returns the first element output by the transducer that matches the {@code predicate}. The reduction stops at
     * that element.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param predicate the predicate
     * @return the first matching element, or an empty {@code Optional} if none matched
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if any argument is null, or if the matching element is null
     */
    public static <T, U> Optional<U> find(Transducer<T, U> transducer,
                                          Iterable<? extends T> source,
                                          Predicate<? super U> predicate) {
        Objects.requireNonNull(predicate);
        return reduce(transducer, source, Optional.<U>empty(),
                      (acc, element) -> predicate.test(element) ? Step.stop(Optional.of(element)) : Step.cont(acc));
    }
    
    /**
     * Splits the transducer's output into elements that match the {@code predicate} and elements that do not. Both
     * sides keep output order.
     *
     * <p>Example:
     * <pre>{@code
     * Reductions.Partition<Integer> p =
     *     Reductions.partition(Transducers.identity(), List.of(1, 2, 3, 4, 5), i -> i % 2 == 0);
     * System.out.println(p.pass() + " " + p.fail());
     * // Prints: [2, 4] [1, 3, 5]
     * }</pre>
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param predicate the predicate
     * @return the matching and non-matching output elements
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if any argument is null
     */
    public static <T, U> Partition<U> partition(Transducer<T, U> transducer,
                                                Iterable<? extends T> source,
                                                Predicate<? super U> predicate) {
        Objects.requireNonNull(predicate);
        return reduce(transducer, source, new Partition<U>(new ArrayList<>(), new ArrayList<>()), (acc, element) -> {
            (predicate.test(element) ? acc.pass : acc.fail).add(element);
            return Step.cont(acc);
        });
    }
    
    /**
     * Groups the transducer's output by the key computed by the {@code classifier}. The returned map iterates keys in
     * the order they were first seen, and each group keeps output order.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param classifier a function computing the key of each element
     * @return a map from each key to the elements with that key
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @param <K> the key type
     * @throws NullPointerException if any argument is null
     */
    public static <T, U, K> Map<K, List<U>> groupBy(Transducer<T, U> transducer,
                                                    Iterable<? extends T> source,
                                                    Function<? super U, ? extends K> classifier) {
        Objects.requireNonNull(classifier);
        Map<K, List<U>> groups = new LinkedHashMap<>();
        return reduce(transducer, source, groups, (acc, element) -> {
            acc.computeIfAbsent(classifier.apply(element), k -> new ArrayList<>()).add(element);
            return Step.cont(acc);
        });
    }
    
    /**
     * Splits the transducer's output into runs of consecutive elements with {@link Objects#equals equal} keys. Unlike
     * {@link #groupBy groupBy}, elements with the same key that are not adjacent land in different runs.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param classifier a function computing the key of each element
     * @return the runs, in output order
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if any argument is null
     */
    public static <T, U> List<List<U>> partitionBy(Transducer<T, U> transducer,
                                                   Iterable<? extends T> source,
                                                   Function<? super U, ?> classifier) {
        Objects.requireNonNull(classifier);
        
        class Runs {
            final List<List<U>> runs = new ArrayList<>();
            Object lastKey = null;
        }
        
        return reduce(transducer, source, new Runs(), (acc, element) -> {
            Object key = classifier.apply(element);
            if (acc.runs.isEmpty() || !Objects.equals(acc.lastKey, key)) {
                acc.runs.add(new ArrayList<>());
                acc.lastKey = key;
            }
            acc.runs.get(acc.runs.size() - 1).add(element);
            return Step.cont(acc);
        }).runs;
    }
    
    /**
     * Counts occurrences of each distinct element output by the transducer. The returned map iterates elements in the
     * order they were first seen.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @return a map from each distinct element to its number of occurrences
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if transducer or source is null
     */
    public static <T, U> Map<U, Long> frequencies(Transducer<T, U> transducer, Iterable<? extends T> source) {
        Map<U, Long> counts = new LinkedHashMap<>();
        return reduce(transducer, source, counts, (acc, element) -> {
            acc.merge(element, 1L, Long::sum);
            return Step.cont(acc);
        });
    }
    
    /**
     * Returns the {@code k} greatest elements output by the transducer according to the {@code comparator}, greatest
     * first. Of elements that compare equal, earlier ones are kept in preference to later ones, and come first in the
     * result. Retains at most {@code k} elements while driving.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param k the number of elements to return
     * @param comparator the ordering
     * @return up to {@code k} elements, in descending order
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws IllegalArgumentException if k is negative
     * @throws NullPointerException if transducer, source, or comparator is null
     */
    public static <T, U> List<U> topK(Transducer<T, U> transducer,
                                      Iterable<? extends T> source,
                                      int k,
                                      Comparator<? super U> comparator) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be non-negative: " + k);
        }
        Objects.requireNonNull(comparator);
        
        class Ranked {
            final U element;
            final long arrival;
            
            Ranked(U element, long arrival) {
                this.element = element;
                this.arrival = arrival;
            }
        }
        
        class Heap {
            // Orders by element, then earlier arrivals above later ones
            final Comparator<Ranked> rank = Comparator.<Ranked, U>comparing(r -> r.element, comparator)
                .<Long>thenComparing(r -> r.arrival, Comparator.reverseOrder());
            // Min-heap of the greatest k seen so far; its head is the first to be evicted
            final PriorityQueue<Ranked> queue = new PriorityQueue<>(Math.max(1, k), rank);
            long arrivals = 0;
        }
        
        Heap heap = reduce(transducer, source, new Heap(), (acc, element) -> {
            Ranked ranked = new Ranked(element, acc.arrivals++);
            if (acc.queue.size() < k) {
                acc.queue.add(ranked);
            } else if (k > 0 && acc.rank.compare(ranked, acc.queue.peek()) > 0) {
                acc.queue.poll();
                acc.queue.add(ranked);
            }
            return Step.cont(acc);
        });
        List<Ranked> ranked = new ArrayList<>(heap.queue);
        ranked.sort(heap.rank.reversed());
        List<U> result = new ArrayList<>(ranked.size());
        for (Ranked r : ranked) {
            result.add(r.element);
        }
        return result;
    }
    
    public static <T, U extends Comparable<? super U>> List<U> topK(Transducer<T, U> transducer,
                                                                    Iterable<? extends T> source,
                                                                    int k) {
        return topK(transducer, source, k, Comparator.naturalOrder());
    }
    
    /**
     * Returns the least element output by the transducer according to the {@code comparator}. Of several least
     * elements, the first is returned.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param comparator the ordering
     * @return the least element, or an empty {@code Optional} if there was no output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if any argument is null, or if the least element is null
     */
    public static <T, U> Optional<U> minBy(Transducer<T, U> transducer,
                                           Iterable<? extends T> source,
                                           Comparator<? super U> comparator) {
        Objects.requireNonNull(comparator);
        return reduce(transducer, source, Optional.<U>empty(), (acc, element) ->
            acc.isEmpty() || comparator.compare(element, acc.get()) < 0
                ? Step.cont(Optional.of(element))
                : Step.cont(acc)
        );
    }
    
    /**
     * Returns the greatest element output by the transducer according to the {@code comparator}. Of several greatest
     * elements, the first is returned.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param comparator the ordering
     * @return the greatest element, or an empty {@code Optional} if there was no output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if any argument is null, or if the greatest element is null
     */
    public static <T, U> Optional<U> maxBy(Transducer<T, U> transducer,
                                           Iterable<? extends T> source,
                                           Comparator<? super U> comparator) {
        Objects.requireNonNull(comparator);
        return reduce(transducer, source, Optional.<U>empty(), (acc, element) ->
            acc.isEmpty() || comparator.compare(element, acc.get()) > 0
                ? Step.cont(Optional.of(element))
                : Step.cont(acc)
        );
    }
    
    /**
     * Returns the last {@code n} elements output by the transducer, in output order. Retains at most {@code n}
     * elements while driving.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param n the number of elements to return
     * @return up to {@code n} trailing elements
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws IllegalArgumentException if n is negative
     * @throws NullPointerException if transducer or source is null
     */
    public static <T, U> List<U> takeLast(Transducer<T, U> transducer, Iterable<? extends T> source, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative: " + n);
        }
        LinkedList<U> window = new LinkedList<>();
        reduce(transducer, source, window, (acc, element) -> {
            acc.addLast(element);
            if (acc.size() > n) {
                acc.removeFirst();
            }
            return Step.cont(acc);
        });
        return new ArrayList<>(window);
    }
    
    /**
     * Returns all but the last {@code n} elements output by the transducer, in output order. Holds back at most
     * {@code n} elements while driving.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param n the number of trailing elements to leave out
     * @return the output elements, except the last {@code n}
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws IllegalArgumentException if n is negative
     * @throws NullPointerException if transducer or source is null
     */
    public static <T, U> List<U> dropLast(Transducer<T, U> transducer, Iterable<? extends T> source, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative: " + n);
        }
        LinkedList<U> held = new LinkedList<>();
        List<U> result = new ArrayList<>();
        reduce(transducer, source, result, (acc, element) -> {
            held.addLast(element);
            if (held.size() > n) {
                acc.add(held.removeFirst());
            }
            return Step.cont(acc);
        });
        return result;
    }
    
    /**
     * Returns a uniformly random sample of {@code k} elements output by the transducer, or all of them if there are
     * fewer than {@code k}. Retains at most {@code k} elements while driving (reservoir sampling).
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param k the sample size
     * @param random the source of randomness
     * @return the sample
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws IllegalArgumentException if k is negative
     * @throws NullPointerException if transducer, source, or random is null
     */
    public static <T, U> List<U> reservoirSample(Transducer<T, U> transducer,
                                                 Iterable<? extends T> source,
                                                 int k,
                                                 Random random) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be non-negative: " + k);
        }
        Objects.requireNonNull(random);
        
        class Reservoir {
            final List<U> sample = new ArrayList<>(k);
            long seen = 0;
        }
        
        return reduce(transducer, source, new Reservoir(), (acc, element) -> {
            acc.seen++;
            if (acc.sample.size() < k) {
                acc.sample.add(element);
            } else if (k > 0) {
                long j = random.nextLong(acc.seen);
                if (j < k) {
                    acc.sample.set((int) j, element);
                }
            }
            return Step.cont(acc);
        }).sample;
    }
    
    /**
     * Multiplies the transducer's output using the given {@code one} and {@code multiplier}.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param one the multiplicative identity
     * @param multiplier the multiplication
     * @return the product, or {@code one} if there was no output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if transducer, source, or multiplier is null
     */
    public static <T, U> U product(Transducer<T, U> transducer,
                                   Iterable<? extends T> source,
                                   U one,
                                   BinaryOperator<U> multiplier) {
        Objects.requireNonNull(multiplier);
        return reduce(transducer, source, one, (acc, element) -> Step.cont(multiplier.apply(acc, element)));
    }
    
    public static <T> int productInt(Transducer<T, Integer> transducer, Iterable<? extends T> source) {
        return product(transducer, source, 1, (a, b) -> a * b);
    }
    
    public static <T> long productLong(Transducer<T, Long> transducer, Iterable<? extends T> source) {
        return product(transducer, source, 1L, (a, b) -> a * b);
    }
    
    public static <T> double productDouble(Transducer<T, Double> transducer, Iterable<? extends T> source) {
        return product(transducer, source, 1.0, (a, b) -> a * b);
    }
    
    public static <T, U extends Comparable<? super U>> Optional<U> min(Transducer<T, U> transducer,
                                                                      Iterable<? extends T> source) {
        return minBy(transducer, source, Comparator.naturalOrder());
    }
    
    public static <T, U extends Comparable<? super U>> Optional<U> max(Transducer<T, U> transducer,
                                                                      Iterable<? extends T> source) {
        return maxBy(transducer, source, Comparator.naturalOrder());
    }
    
    /**
     * Returns the arithmetic mean of the transducer's output.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @return the mean, or an empty {@code OptionalDouble} if there was no output
     * @param <T> the source element type
     * @throws NullPointerException if transducer or source is null, or if an output element is null
     */
    public static <T> OptionalDouble mean(Transducer<T, ? extends Number> transducer, Iterable<? extends T> source) {
        Moments moments = moments(transducer, source);
        return moments.count == 0 ? OptionalDouble.empty() : OptionalDouble.of(moments.mean);
    }
    
    /**
     * Returns the population variance of the transducer's output: the mean squared distance from the mean. Computed in
     * one pass with Welford's method.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @return the variance, or an empty {@code OptionalDouble} if there was no output
     * @param <T> the source element type
     * @throws NullPointerException if transducer or source is null, or if an output element is null
     */
    public static <T> OptionalDouble variance(Transducer<T, ? extends Number> transducer,
                                              Iterable<? extends T> source) {
        Moments moments = moments(transducer, source);
        return moments.count == 0 ? OptionalDouble.empty() : OptionalDouble.of(moments.squaredDistance / moments.count);
    }
    
    /**
     * Returns the population standard deviation of the transducer's output, the square root of its
     * {@link #variance variance}.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @return the standard deviation, or an empty {@code OptionalDouble} if there was no output
     * @param <T> the source element type
     * @throws NullPointerException if transducer or source is null, or if an output element is null
     */
    public static <T> OptionalDouble stdDev(Transducer<T, ? extends Number> transducer, Iterable<? extends T> source) {
        OptionalDouble variance = variance(transducer, source);
        return variance.isPresent() ? OptionalDouble.of(Math.sqrt(variance.getAsDouble())) : variance;
    }
    
    private static final class Moments {
        long count = 0;
        double mean = 0.0;
        double squaredDistance = 0.0;
    }
    
    private static <T> Moments moments(Transducer<T, ? extends Number> transducer, Iterable<? extends T> source) {
        return reduce(transducer, source, new Moments(), (acc, element) -> {
            double x = element.doubleValue();
            acc.count++;
            double delta = x - acc.mean;
            acc.mean += delta / acc.count;
            acc.squaredDistance += delta * (x - acc.mean);
            return Step.cont(acc);
        });
    }
    
    /**
     * Returns the median of the transducer's output. For an even number of elements, this is the mean of the two
     * middle elements. Equivalent to {@code quantile(transducer, source, 0.5)}.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @return the median, or an empty {@code OptionalDouble} if there was no output
     * @param <T> the source element type
     * @throws NullPointerException if transducer or source is null, or if an output element is null
     */
    public static <T> OptionalDouble median(Transducer<T, ? extends Number> transducer, Iterable<? extends T> source) {
        return quantile(transducer, source, 0.5);
    }
    
    /**
     * Returns the {@code p}-quantile of the transducer's output, interpolating linearly between the two closest ranks.
     * For sorted output {@code x} of size {@code n}, the position {@code h = (n - 1) * p} gives
     * {@code x[floor(h)] + (h - floor(h)) * (x[ceil(h)] - x[floor(h)])}. So {@code p = 0} is the minimum, and
     * {@code p = 1} the maximum.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param p the quantile, between 0 and 1 inclusive
     * @return the quantile, or an empty {@code OptionalDouble} if there was no output
     * @param <T> the source element type
     * @throws IllegalArgumentException if p is not between 0 and 1
     * @throws NullPointerException if transducer or source is null, or if an output element is null
     */
    public static <T> OptionalDouble quantile(Transducer<T, ? extends Number> transducer,
                                              Iterable<? extends T> source,
                                              double p) {
        if (!(p >= 0.0 && p <= 1.0)) {
            throw new IllegalArgumentException("p must be between 0 and 1: " + p);
        }
        List<Double> values = new ArrayList<>();
        reduce(transducer, source, values, (acc, element) -> {
            acc.add(element.doubleValue());
            return Step.cont(acc);
        });
        if (values.isEmpty()) {
            return OptionalDouble.empty();
        }
        values.sort(null);
        double h = (values.size() - 1) * p;
        int lower = (int) Math.floor(h);
        int upper = (int) Math.ceil(h);
        double low = values.get(lower);
        return OptionalDouble.of(low + (h - lower) * (values.get(upper) - low));
    }
    
    /**
     * Returns the most frequent element output by the transducer. Of several equally frequent elements, the one seen
     * first is returned.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @return the most frequent element, or an empty {@code Optional} if there was no output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if transducer or source is null, or if the most frequent element is null
     */
    public static <T, U> Optional<U> mode(Transducer<T, U> transducer, Iterable<? extends T> source) {
        U best = null;
        long bestCount = 0;
        for (Map.Entry<U, Long> entry : frequencies(transducer, source).entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return bestCount == 0 ? Optional.empty() : Optional.of(best);
    }
    
    /**
     * Collects the transducer's output into a new list, sorted by the key computed by the {@code keyMapper}. The sort
     * is stable: elements with equal keys keep output order.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param keyMapper a function computing the sort key of each element
     * @return the sorted output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @param <K> the sort key type
     * @throws NullPointerException if any argument is null
     */
    public static <T, U, K extends Comparable<? super K>> List<U> sortBy(Transducer<T, U> transducer,
                                                                         Iterable<? extends T> source,
                                                                         Function<? super U, ? extends K> keyMapper) {
        Objects.requireNonNull(keyMapper);
        return sortWith(transducer, source, Comparator.comparing(keyMapper));
    }
    
    /**
     * Collects the transducer's output into a new list, sorted by the {@code comparator}. The sort is stable: elements
     * that compare equal keep output order.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @param comparator the ordering
     * @return the sorted output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if any argument is null
     */
    public static <T, U> List<U> sortWith(Transducer<T, U> transducer,
                                          Iterable<? extends T> source,
                                          Comparator<? super U> comparator) {
        Objects.requireNonNull(comparator);
        List<U> list = toList(transducer, source);
        list.sort(comparator);
        return list;
    }
    
    /**
     * Collects the transducer's output into a new list, in reverse output order.
     *
     * @param transducer the transducer
     * @param source the source of elements
     * @return the reversed output
     * @param <T> the source element type
     * @param <U> the transducer's output type
     * @throws NullPointerException if transducer or source is null
     */
    public static <T, U> List<U> reverse(Transducer<T, U> transducer, Iterable<? extends T> source) {
        LinkedList<U> reversed = new LinkedList<>();
        reduce(transducer, source, reversed, (acc, element) -> {
            acc.addFirst(element);
            return Step.cont(acc);
        });
        return new ArrayList<>(reversed);
    }
    
    /**
     * The result of {@link #partition partition}: the elements that matched, and the elements that did not.
     *
     * @param <T> the element type
     */
    public static final class Partition<T> {
        final List<T> pass;
        final List<T> fail;
        
        Partition(List<T> pass, List<T> fail) {
            this.pass = pass;
            this.fail = fail;
        }
        
        public List<T> pass() {
            return pass;
        }
        
        public List<T> fail() {
            return fail;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Partition)) {
                return false;
            }
            Partition<?> other = (Partition<?>) o;
            return pass.equals(other.pass) && fail.equals(other.fail);
        }
        
        @Override
        public int hashCode() {
            return 31 * pass.hashCode() + fail.hashCode();
        }
        
        @Override
        public String toString() {
            return "Partition[pass=" + pass + ", fail=" + fail + "]";
        }
    }
}
