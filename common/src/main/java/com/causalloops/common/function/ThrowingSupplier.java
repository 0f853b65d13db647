package com.causalloops.common.function;

@FunctionalInterface
public interface ThrowingSupplier<T> {
    T get() throws Exception;
}
