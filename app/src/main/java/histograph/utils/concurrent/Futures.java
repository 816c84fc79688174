package histograph.utils.concurrent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.BiFunction;

import histograph.exceptions.StoreException;

/**
 * Joins for batches of {@link CompletableFuture}s with all-or-nothing semantics.
 *
 * A joined future fails as soon as any of its inputs fails, carrying that first
 * failure. The remaining inputs are left running: they are not cancelled and may
 * still complete their work.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Returns a future of the results of all {@code futures}, in input order.
     * Completes exceptionally with the first failure among the inputs.
     */
    public static <T> CompletableFuture<List<T>> allAsList(List<CompletableFuture<T>> futures) {
        CompletableFuture<List<T>> result = new CompletableFuture<>();

        for (CompletableFuture<T> future : futures) {
            future.whenComplete((value, failure) -> {
                if (failure != null) {
                    result.completeExceptionally(unwrap(failure));
                }
            });
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenRun(() -> {
                    List<T> values = new ArrayList<>(futures.size());
                    for (CompletableFuture<T> future : futures) {
                        values.add(future.join());
                    }
                    result.complete(values);
                });

        return result;
    }

    /**
     * Combines two independent futures. Unlike
     * {@link CompletableFuture#thenCombine}, the result fails as soon as either
     * input fails instead of waiting for the other one.
     */
    public static <A, B, R> CompletableFuture<R> combine(
            CompletableFuture<A> first,
            CompletableFuture<B> second,
            BiFunction<? super A, ? super B, ? extends R> combiner) {
        CompletableFuture<R> result = new CompletableFuture<>();

        first.whenComplete((value, failure) -> {
            if (failure != null) {
                result.completeExceptionally(unwrap(failure));
            }
        });
        second.whenComplete((value, failure) -> {
            if (failure != null) {
                result.completeExceptionally(unwrap(failure));
            }
        });

        first.thenCombine(second, combiner).whenComplete((value, failure) -> {
            if (failure != null) {
                result.completeExceptionally(unwrap(failure));
            } else {
                result.complete(value);
            }
        });

        return result;
    }

    /**
     * Waits for {@code future} and returns its value, rethrowing a failure as
     * the {@link StoreException} it carried. Unchecked failures are rethrown
     * as they are.
     */
    public static <T> T await(CompletableFuture<T> future) throws StoreException {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw asStoreException(e.getCause());
        } catch (CancellationException e) {
            throw new StoreException("Operation was cancelled", e);
        }
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException}
     * wrappers that the future machinery puts around a failure.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static StoreException asStoreException(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof StoreException) {
            return (StoreException) cause;
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new StoreException(String.valueOf(cause.getMessage()), cause);
    }
}
