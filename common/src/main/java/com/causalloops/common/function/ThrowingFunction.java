package com.causalloops.common.function;

@FunctionalInterface
public interface ThrowingFunction<A, T> {
    T apply(A a) throws Exception;
}
