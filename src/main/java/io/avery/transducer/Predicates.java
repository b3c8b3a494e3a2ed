package io.avery.transducer;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Combinators for building the predicates passed to {@link Transducers#filter filter},
 * {@link Transducers#takeWhile takeWhile} and friends. All combined predicates short-circuit, left to right.
 */
public class Predicates {
    private Predicates() {} // Utility
    
    /**
     * Returns a predicate that matches when both {@code first} and {@code second} match. {@code second} is not
     * tested if {@code first} does not match.
     *
     * @param first the first predicate
     * @param second the second predicate
     * @return the conjunction
     * @param <T> the element type
     * @throws NullPointerException if first or second is null
     */
    public static <T> Predicate<T> both(Predicate<? super T> first, Predicate<? super T> second) {
        Objects.requireNonNull(first);
        Objects.requireNonNull(second);
        return t -> first.test(t) && second.test(t);
    }
    
    /**
     * Returns a predicate that matches when either {@code first} or {@code second} matches. {@code second} is not
     * tested if {@code first} matches.
     *
     * @param first the first predicate
     * @param second the second predicate
     * @return the disjunction
     * @param <T> the element type
     * @throws NullPointerException if first or second is null
     */
    public static <T> Predicate<T> either(Predicate<? super T> first, Predicate<? super T> second) {
        Objects.requireNonNull(first);
        Objects.requireNonNull(second);
        return t -> first.test(t) || second.test(t);
    }
    
    public static <T> Predicate<T> complement(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        return t -> !predicate.test(t);
    }
    
    /**
     * Returns a predicate that matches when every one of the {@code predicates} matches. Testing stops at the first
     * predicate that does not match. If there are no predicates, the result matches everything.
     *
     * @param predicates the predicates
     * @return the conjunction of all predicates
     * @param <T> the element type
     * @throws NullPointerException if predicates or any predicate is null
     */
    public static <T> Predicate<T> allPass(List<? extends Predicate<? super T>> predicates) {
        List<? extends Predicate<? super T>> copy = List.copyOf(predicates);
        return t -> {
            for (Predicate<? super T> predicate : copy) {
                if (!predicate.test(t)) {
                    return false;
                }
            }
            return true;
        };
    }
    
    /**
     * Returns a predicate that matches when any one of the {@code predicates} matches. Testing stops at the first
     * predicate that matches. If there are no predicates, the result matches nothing.
     *
     * @param predicates the predicates
     * @return the disjunction of all predicates
     * @param <T> the element type
     * @throws NullPointerException if predicates or any predicate is null
     */
    public static <T> Predicate<T> anyPass(List<? extends Predicate<? super T>> predicates) {
        List<? extends Predicate<? super T>> copy = List.copyOf(predicates);
        return t -> {
            for (Predicate<? super T> predicate : copy) {
                if (predicate.test(t)) {
                    return true;
                }
            }
            return false;
        };
    }
}
