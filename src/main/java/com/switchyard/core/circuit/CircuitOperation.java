package com.switchyard.core.circuit;

/**
 * An operation against an unreliable dependency.
 */
@FunctionalInterface
public interface CircuitOperation<T> {
    T execute() throws Exception;
}
