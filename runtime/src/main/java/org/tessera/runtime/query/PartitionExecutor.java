package org.tessera.runtime.query;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.tessera.runtime.cluster.Cluster;
import org.tessera.runtime.cluster.NodeFeature;
import org.tessera.runtime.exceptions.ClusterException;
import org.tessera.runtime.exceptions.OperationTerminatedException;
import org.tessera.runtime.exceptions.ResultCode;
import org.tessera.runtime.exceptions.unrecoverable.UnrecoverableTesseraInterruptedError;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs a scan or query over a partition range, one round after another, until the
 * {@link PartitionTracker} reports every partition complete.
 *
 * <p>Units of a round run on a bounded worker pool, at most
 * {@link ScanPolicy#getMaxConcurrentNodes()} at a time. The first error that is not retried
 * cancels the token seen by every other unit, and is rethrown once all started units returned.
 */
@Slf4j
public class PartitionExecutor<T> {

    private final Cluster cluster;

    private final ExecutorService workers;

    private final ScanPolicy policy;

    private final OperationType type;

    private final String namespace;

    private final PartitionTracker tracker;

    private final PartitionCommand<T> command;

    private final RecordSink<T> sink;

    @Getter
    private final CancellationToken token;

    @Builder
    private PartitionExecutor(@NonNull Cluster cluster, @NonNull ExecutorService workers, ScanPolicy policy,
                              OperationType type, @NonNull String namespace, @NonNull PartitionTracker tracker,
                              @NonNull PartitionCommand<T> command, @NonNull RecordSink<T> sink,
                              CancellationToken token) {
        this.cluster = cluster;
        this.workers = workers;
        this.policy = policy == null ? ScanPolicy.defaults() : policy;
        this.type = type == null ? OperationType.SCAN : type;
        this.namespace = namespace;
        this.tracker = tracker;
        this.command = command;
        this.sink = sink;
        this.token = token == null ? new CancellationToken() : token;
    }

    /**
     * A worker pool for partition units, shared between operations. The caller owns it.
     */
    public static ExecutorService newWorkerPool(int threads) {
        return Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("partition-worker-%d")
                .build());
    }

    /**
     * Run every round on the calling thread. Units run on the worker pool.
     *
     * @throws OperationTerminatedException if the operation was cancelled.
     * @throws ClusterException             on the first error that is not retried.
     */
    public void execute() {
        try {
            runRounds();
        } catch (RuntimeException e) {
            tracker.partitionError();
            sink.onFailure(e);
            throw e;
        }
        sink.onSuccess();
    }

    /**
     * Run every round on the given executor, typically feeding a {@link RecordSet}.
     */
    public CompletableFuture<Void> executeAsync(Executor executor) {
        return CompletableFuture.runAsync(this::execute, executor);
    }

    public void cancel() {
        token.cancel();
    }

    private void runRounds() {
        NodeFeature partitionFeature = type.getPartitionFeature();

        while (true) {
            token.throwIfCancelled(type.getTerminatedCode());

            List<NodePartitions> list = tracker.assignPartitionsToNodes(cluster, namespace);

            int maxConcurrent = policy.getMaxConcurrentNodes() == 0 || policy.getMaxConcurrentNodes() >= list.size()
                    ? list.size() : policy.getMaxConcurrentNodes();

            log.debug("execute[{}]: Round {} over {} units, {} concurrent", namespace,
                    tracker.getIteration(), list.size(), maxConcurrent);

            runUnits(list, maxConcurrent);

            if (tracker.isComplete(cluster.hasFeature(partitionFeature), policy)) {
                return;
            }

            long sleep = policy.getSleepBetweenRetries().toMillis();
            if (sleep > 0) {
                try {
                    if (token.await(sleep, TimeUnit.MILLISECONDS)) {
                        throw new OperationTerminatedException(type.getTerminatedCode());
                    }
                } catch (InterruptedException ie) {
                    token.cancel();
                    throw new UnrecoverableTesseraInterruptedError(ie);
                }
            }
        }
    }

    /**
     * Run the units of one round, keeping at most {@code maxConcurrent} in flight, and wait
     * for all of them.
     */
    private void runUnits(List<NodePartitions> list, int maxConcurrent) {
        CompletionService<Void> completion = new ExecutorCompletionService<>(workers);
        List<Future<Void>> futures = new ArrayList<>(list.size());
        RuntimeException first = null;
        int next = 0;
        int running = 0;

        while (next < maxConcurrent) {
            futures.add(completion.submit(unit(list.get(next++))));
            running++;
        }

        while (running > 0) {
            Future<Void> done;
            try {
                done = completion.take();
            } catch (InterruptedException ie) {
                token.cancel();
                futures.forEach(f -> f.cancel(true));
                throw new UnrecoverableTesseraInterruptedError(ie);
            }
            running--;

            try {
                done.get();
            } catch (ExecutionException ee) {
                if (first == null) {
                    first = toRuntimeException(ee.getCause());
                    log.debug("execute[{}]: Unit failed, cancelling the rest: {}", namespace, first.getMessage());
                    token.cancel();
                }
            } catch (CancellationException | InterruptedException e) {
                if (first == null) {
                    first = new OperationTerminatedException(type.getTerminatedCode(), e);
                    token.cancel();
                }
            }

            if (first == null && next < list.size() && !token.isCancelled()) {
                futures.add(completion.submit(unit(list.get(next++))));
                running++;
            }
        }

        if (first != null) {
            throw first;
        }
        token.throwIfCancelled(type.getTerminatedCode());
    }

    private Callable<Void> unit(NodePartitions np) {
        return () -> {
            PartitionTask<T> task = new PartitionTask<>(np, tracker, sink, token, type);
            try {
                task.checkCancelled();

                if (!np.getNode().isActive()) {
                    throw new ClusterException(ResultCode.SERVER_NOT_AVAILABLE, "Node inactive: " + np.getNode());
                }
                command.execute(task);
            } catch (ClusterException e) {
                if (token.isCancelled() || !tracker.shouldRetry(np, e)) {
                    throw e;
                }
                log.debug("execute[{}]: Retrying {} next round: {}", namespace, np, e.getMessage());
            }
            return null;
        };
    }

    private static RuntimeException toRuntimeException(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new ClusterException(ResultCode.CLIENT_ERROR, cause);
    }
}
