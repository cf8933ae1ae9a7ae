package com.questrail.harness.middleware;

import java.util.Objects;

/**
 * Composition of {@link Middleware}s.
 *
 * <p>Chains are listed outermost first: in {@code compose(x, y)}, {@code x}
 * sees the author's scenario and {@code y} hands the final scenario to the
 * runner. {@code compose} is associative and {@link #unit()} is its identity
 * on both sides.</p>
 */
public final class Middlewares
{
    private Middlewares() {
    }

    /**
     * The no-op middleware: runs the scenario as given.
     */
    public static <A> Middleware<A, A> unit()
    {
        return (run, f) -> run.run(f);
    }

    public static <A, B, C> Middleware<A, C> compose(Middleware<A, B> x, Middleware<B, C> y)
    {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
        return (run, f) -> x.apply(g -> y.apply(run, g), f);
    }

    public static <A, B, C, D> Middleware<A, D> compose3(Middleware<A, B> a,
                                                         Middleware<B, C> b,
                                                         Middleware<C, D> c)
    {
        return compose(compose(a, b), c);
    }

    public static <A, B, C, D, E> Middleware<A, E> compose4(Middleware<A, B> a,
                                                            Middleware<B, C> b,
                                                            Middleware<C, D> c,
                                                            Middleware<D, E> d)
    {
        return compose(compose3(a, b, c), d);
    }

    public static <A, B, C, D, E, F> Middleware<A, F> compose5(Middleware<A, B> a,
                                                               Middleware<B, C> b,
                                                               Middleware<C, D> c,
                                                               Middleware<D, E> d,
                                                               Middleware<E, F> e)
    {
        return compose(compose4(a, b, c, d), e);
    }

    /**
     * Left-to-right reduction by {@link #compose} without type checking
     * between neighbours. A mismatched chain fails with
     * {@link ClassCastException} when a scenario runs.
     *
     * @throws IllegalArgumentException if no middleware is given
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static <A, B> Middleware<A, B> combine(Middleware<?, ?>... middlewares)
    {
        if (middlewares.length == 0) {
            throw new IllegalArgumentException("combine needs at least one middleware");
        }
        Middleware chain = middlewares[0];
        for (int i = 1; i < middlewares.length; i++) {
            chain = compose(chain, (Middleware) middlewares[i]);
        }
        return (Middleware<A, B>) chain;
    }
}
