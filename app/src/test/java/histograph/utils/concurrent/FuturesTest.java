package histograph.utils.concurrent;

import histograph.exceptions.ObjectNotFoundException;
import histograph.exceptions.StoreException;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class FuturesTest {

    @Test
    void all_as_list_keeps_input_order() throws Exception {
        CompletableFuture<String> a = new CompletableFuture<>();
        CompletableFuture<String> b = new CompletableFuture<>();
        CompletableFuture<String> c = new CompletableFuture<>();

        CompletableFuture<List<String>> all = Futures.allAsList(List.of(a, b, c));
        c.complete("c");
        a.complete("a");
        assertFalse(all.isDone());
        b.complete("b");

        assertEquals(List.of("a", "b", "c"), Futures.await(all));
    }

    @Test
    void all_as_list_of_nothing_is_done_immediately() throws Exception {
        assertEquals(List.of(), Futures.await(Futures.<String>allAsList(List.of())));
    }

    @Test
    void all_as_list_fails_on_first_failure_without_cancelling_the_rest() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        CompletableFuture<String> failing = new CompletableFuture<>();

        CompletableFuture<List<String>> all = Futures.allAsList(List.of(pending, failing));
        StoreException failure = new StoreException("boom");
        failing.completeExceptionally(failure);

        assertTrue(all.isCompletedExceptionally());
        assertFalse(pending.isDone());
        StoreException thrown = assertThrows(StoreException.class, () -> Futures.await(all));
        assertSame(failure, thrown);

        pending.complete("late");
        assertFalse(pending.isCancelled());
    }

    @Test
    void combine_fails_without_waiting_for_the_other_side() {
        CompletableFuture<Integer> pending = new CompletableFuture<>();
        CompletableFuture<Integer> failing = new CompletableFuture<>();

        CompletableFuture<Integer> sum = Futures.combine(pending, failing, Integer::sum);
        failing.completeExceptionally(new CompletionException(new ObjectNotFoundException("gone", Paths.get("x"))));

        assertTrue(sum.isCompletedExceptionally());
        assertThrows(ObjectNotFoundException.class, () -> Futures.await(sum));
    }

    @Test
    void combine_applies_the_combiner_on_success() throws Exception {
        CompletableFuture<Integer> sum = Futures.combine(
                CompletableFuture.completedFuture(2), CompletableFuture.completedFuture(3), Integer::sum);

        assertEquals(5, Futures.await(sum));
    }

    @Test
    void await_rethrows_unchecked_failures_unchanged() {
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> {
            throw new IllegalStateException("bad");
        });

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Futures.await(future));
        assertEquals("bad", e.getMessage());
    }

    @Test
    void unwrap_strips_completion_wrappers() {
        StoreException cause = new StoreException("x");

        assertSame(cause, Futures.unwrap(new CompletionException(new CompletionException(cause))));
        assertSame(cause, Futures.unwrap(cause));
    }
}
