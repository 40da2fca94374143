package fr.lapetina.agentnetwork.orchestration;

import fr.lapetina.agentnetwork.domain.model.AgentNetworkException;
import fr.lapetina.agentnetwork.domain.model.ErrorType;
import fr.lapetina.agentnetwork.domain.model.Instance;
import fr.lapetina.agentnetwork.domain.model.WorkerOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Concurrent fan-out of routed messages.
 *
 * Messages for different instances run in parallel, at most {@code maxConcurrency} model calls
 * at a time. Messages for the same instance run one after the other in the order given.
 * Each call has its own timeout, counted once it holds a concurrency permit; the whole batch is
 * bounded by the turn deadline. Calls that do not settle in time are abandoned: they keep running
 * and hold their permit until they return, but their result is ignored. Calls queued behind an
 * abandoned call to the same instance wait for it to return.
 */
public final class WorkerDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerDispatcher.class);

    /**
     * One routed message.
     */
    public record Assignment(Instance target, String message) {
        public Assignment {
            Objects.requireNonNull(target, "Target is required");
            Objects.requireNonNull(message, "Message is required");
        }
    }

    /**
     * Produces the text for one assignment. The list holds outputs the same instance
     * produced earlier in this batch, oldest first.
     */
    @FunctionalInterface
    public interface WorkerCall {
        String execute(Assignment assignment, List<String> earlierOutputs);
    }

    private final ExecutorService executor;
    private final Semaphore permits;
    private final int maxConcurrency;
    private final Duration callTimeout;

    public WorkerDispatcher(int maxConcurrency, Duration callTimeout) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive: " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        this.callTimeout = Objects.requireNonNull(callTimeout);
        this.permits = new Semaphore(maxConcurrency, true);

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "worker-dispatch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Dispatches every assignment and waits until all settle or the deadline passes.
     *
     * @return one output per assignment, in assignment order
     */
    public List<WorkerOutput> dispatch(List<Assignment> assignments, WorkerCall call, Instant deadline) {
        if (assignments.isEmpty()) {
            return List.of();
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Map<String, CompletableFuture<Void>> tails = new HashMap<>();
        Map<String, List<String>> batchOutputs = new HashMap<>();
        List<CompletableFuture<String>> futures = new ArrayList<>(assignments.size());

        for (Assignment assignment : assignments) {
            String instanceId = assignment.target().getId();
            List<String> earlier = batchOutputs.computeIfAbsent(instanceId,
                    id -> Collections.synchronizedList(new ArrayList<>()));

            CompletableFuture<String> result = new CompletableFuture<>();
            CompletableFuture<Void> finished = new CompletableFuture<>();
            // A call starts once the previous call to the same instance has returned, even if it was abandoned
            CompletableFuture<Void> previous = tails.getOrDefault(instanceId, CompletableFuture.completedFuture(null));
            previous.whenComplete((ignored, error) -> submit(assignment, call, earlier, mdc, result, finished));

            tails.put(instanceId, finished);
            futures.add(result);
        }

        log.info("Worker calls dispatched: calls={}, instances={}, maxConcurrency={}",
                futures.size(), tails.size(), maxConcurrency);

        awaitAll(futures, deadline);

        List<WorkerOutput> outputs = new ArrayList<>(assignments.size());
        for (int i = 0; i < assignments.size(); i++) {
            outputs.add(settle(assignments.get(i).target(), futures.get(i)));
        }
        return outputs;
    }

    /**
     * Runs a single call on the dispatch pool with a timeout, outside the concurrency limit.
     *
     * @throws AgentNetworkException classified failure, {@code TIMEOUT} when the timeout elapses
     */
    public <T> T callWithTimeout(Supplier<T> call, Duration timeout) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        CompletableFuture<T> future = CompletableFuture
                .supplyAsync(withMdc(mdc, call), executor)
                .orTimeout(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            throw classify(e);
        }
    }

    private void submit(
            Assignment assignment,
            WorkerCall call,
            List<String> earlier,
            Map<String, String> mdc,
            CompletableFuture<String> result,
            CompletableFuture<Void> finished
    ) {
        Runnable task = () -> {
            try {
                run(assignment, call, earlier, result);
            } finally {
                finished.complete(null);
            }
        };
        try {
            executor.execute(withMdc(mdc, task));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(
                    new AgentNetworkException(ErrorType.INTERNAL_ERROR, "Worker dispatch pool is closed", e));
            finished.complete(null);
        }
    }

    private void run(Assignment assignment, WorkerCall call, List<String> earlier, CompletableFuture<String> result) {
        String instanceId = assignment.target().getId();
        if (result.isDone()) {
            log.debug("Worker call abandoned before it started: instanceId={}", instanceId);
            return;
        }
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.completeExceptionally(
                    new AgentNetworkException(ErrorType.INTERNAL_ERROR, "Interrupted before calling " + instanceId, e));
            return;
        }
        try {
            if (result.isDone()) {
                log.debug("Worker call abandoned while waiting for a permit: instanceId={}", instanceId);
                return;
            }
            // The call timeout counts from the moment a permit is held
            result.orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            List<String> snapshot;
            synchronized (earlier) {
                snapshot = List.copyOf(earlier);
            }
            String output = call.execute(assignment, snapshot);
            if (result.complete(output)) {
                earlier.add(output);
            } else {
                log.debug("Late worker result discarded: instanceId={}", instanceId);
            }
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        } finally {
            permits.release();
        }
    }

    private void awaitAll(List<CompletableFuture<String>> futures, Instant deadline) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        long remainingNanos = Math.max(0, Duration.between(Instant.now(), deadline).toNanos());
        try {
            all.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            long pending = futures.stream().filter(f -> !f.isDone()).count();
            log.warn("Turn deadline reached, abandoning worker calls: pending={}", pending);
        } catch (ExecutionException e) {
            log.debug("Worker batch settled with failures: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for worker calls");
        }
    }

    private WorkerOutput settle(Instance target, CompletableFuture<String> future) {
        if (future.completeExceptionally(new AgentNetworkException(ErrorType.TIMEOUT, "Turn deadline exceeded"))) {
            return WorkerOutput.failure(target.getRole(), target.getId(), ErrorType.TIMEOUT,
                    "Turn deadline exceeded");
        }
        try {
            return WorkerOutput.success(target.getRole(), target.getId(), future.join());
        } catch (CompletionException | CancellationException e) {
            AgentNetworkException failure = classify(e);
            log.warn("Worker call failed: instanceId={}, role={}, errorType={}, error={}",
                    target.getId(), target.getRole(), failure.getErrorType(), failure.getMessage());
            return WorkerOutput.failure(target.getRole(), target.getId(), failure.getErrorType(), failure.getMessage());
        }
    }

    static AgentNetworkException classify(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof AgentNetworkException) {
            return (AgentNetworkException) cause;
        }
        if (cause instanceof TimeoutException) {
            return new AgentNetworkException(ErrorType.TIMEOUT, "Call timed out", cause);
        }
        if (cause instanceof CancellationException) {
            return new AgentNetworkException(ErrorType.TIMEOUT, "Call abandoned", cause);
        }
        return new AgentNetworkException(ErrorType.INTERNAL_ERROR,
                "Unexpected failure: " + cause.getClass().getSimpleName(), cause);
    }

    private static Runnable withMdc(Map<String, String> mdc, Runnable task) {
        return () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                task.run();
            } finally {
                MDC.clear();
            }
        };
    }

    private static <T> Supplier<T> withMdc(Map<String, String> mdc, Supplier<T> task) {
        return () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return task.get();
            } finally {
                MDC.clear();
            }
        };
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker dispatch pool did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
