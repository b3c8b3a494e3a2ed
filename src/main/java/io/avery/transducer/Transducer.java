package io.avery.transducer;

import java.util.Objects;

/**
 * Represents an operation on a downstream {@link Reducer Reducer} that produces an upstream {@code Reducer}. A
 * transducer describes a transformation (mapping, filtering, truncating, ...) independently of both the source of
 * elements and the accumulation at the end, so that it can be composed with other transducers and driven in a single
 * pass, without intermediate collections.
 *
 * <p>Note that methods on this interface are named according to the direction of data flow, not the direction of
 * function application. Methods named "andThen" take an argument that applies downstream of this transducer. Methods
 * named "compose" take an argument that applies upstream of this transducer.
 *
 * <p>Composition is associative, and {@link Transducers#identity() identity} is its unit:
 * <pre>{@code
 * a.andThen(b).andThen(c)  // behaves as a.andThen(b.andThen(c))
 * Transducers.identity().andThen(t)  // behaves as t
 * t.andThen(Transducers.identity())  // behaves as t
 * }</pre>
 *
 * <p>Implementations are immutable. Any state needed while driving (a counter, a buffer) is created afresh on each
 * call to {@link #apply apply}, and belongs to the returned reducer.
 *
 * @param <In> the upstream element type
 * @param <Out> the downstream element type
 */
public interface Transducer<In, Out> {
    /**
     * Connects the {@code downstream} reducer after this transducer. Returns an upstream reducer.
     *
     * @implSpec The upstream reducer is expected to internally delegate to the downstream reducer in some way, and to
     * return any stop step it receives from the downstream reducer as a stop step. Building the upstream reducer should
     * take constant time and allocation.
     *
     * @param downstream the downstream reducer
     * @return the upstream reducer
     * @param <A> the accumulator type
     * @throws NullPointerException if downstream is null
     */
    <A> Reducer<A, In> apply(Reducer<A, ? super Out> downstream);
    
    /**
     * Connects the {@code downstream} transducer after this transducer. Returns a composed transducer that applies this
     * transducer to the result of the {@code downstream} transducer. Elements flow through this transducer first.
     *
     * @param downstream the downstream transducer
     * @return a composed transducer
     * @param <V> the downstream element type
     * @throws NullPointerException if downstream is null
     */
    @SuppressWarnings("unchecked")
    default <V> Transducer<In, V> andThen(Transducer<? super Out, ? extends V> downstream) {
        Objects.requireNonNull(downstream);
        return new Transducers.Chain<>(this, (Transducer<Out, V>) downstream);
    }
    
    /**
     * Connects the {@code upstream} transducer before this transducer. Returns a composed transducer that applies the
     * {@code upstream} transducer to the result of this transducer. Elements flow through the {@code upstream}
     * transducer first.
     *
     * @param upstream the upstream transducer
     * @return a composed transducer
     * @param <V> the upstream element type
     * @throws NullPointerException if upstream is null
     */
    @SuppressWarnings("unchecked")
    default <V> Transducer<V, Out> compose(Transducer<? super V, ? extends In> upstream) {
        Objects.requireNonNull(upstream);
        return new Transducers.Chain<>((Transducer<V, In>) upstream, this);
    }
}
