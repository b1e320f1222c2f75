package com.skylarkarms.cell;

/**
 * Three-argument counterpart of {@link java.util.function.BiFunction}.
 * */
@FunctionalInterface
public interface TriFunction<A, B, C, R> {
    R apply(A a, B b, C c);
}
