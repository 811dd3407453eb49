package com.github.mwbot.batch;

import java.util.concurrent.CompletionStage;

/**
 * Unit of asynchronous work applied to every item of a bulk operation.
 *
 * @param <T> item type
 */
@FunctionalInterface
public interface BatchWorker<T> {
    /**
     * @param item the current item
     * @param index position of the item in the input list
     * @return a stage that settles when the work is done, never {@code null}
     */
    CompletionStage<?> apply(T item, int index);
}
