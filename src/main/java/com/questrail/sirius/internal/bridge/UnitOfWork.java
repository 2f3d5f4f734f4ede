package com.questrail.sirius.internal.bridge;

import java.util.concurrent.CompletionStage;

/**
 * A deferred transport operation run on the bridge worker.
 *
 * <p>{@link #begin()} is invoked on the worker thread. It may start several
 * asynchronous transport calls and return a stage that completes when all of
 * them have; the bridge waits for that stage before running the next unit.</p>
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface UnitOfWork<T>
{
    CompletionStage<T> begin() throws Exception;
}
