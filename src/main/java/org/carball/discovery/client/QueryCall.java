package org.carball.discovery.client;

@FunctionalInterface
public interface QueryCall<T> {
    T call() throws QueryException;
}
