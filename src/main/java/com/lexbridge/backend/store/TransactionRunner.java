package com.lexbridge.backend.store;

import java.util.function.Supplier;

/**
 * Runs a group of store writes as one unit: either all of them become visible
 * or none do.
 */
public interface TransactionRunner {

    <T> T inTransaction(Supplier<T> work);
}
