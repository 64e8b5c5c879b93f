package com.ryuqq.kernelmonitor.adapter.inmemory.host;

import com.ryuqq.kernelmonitor.core.config.HostDiagnostics;
import com.ryuqq.kernelmonitor.core.outcome.ExecutionOutcome;
import com.ryuqq.kernelmonitor.core.outcome.Failed;
import com.ryuqq.kernelmonitor.core.spi.ExecutionHost;
import com.ryuqq.kernelmonitor.core.spi.ExecutionLifecycleListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link ExecutionHost} SPI for testing and reference purposes.
 *
 * <p>Cells run one at a time on a single dedicated execution thread, which plays the role
 * of a kernel's main thread. Every cell fires the lifecycle hooks in this order:</p>
 * <pre>
 * pre_run_cell → pre_execute → [cell body] → post_execute → post_run_cell
 * </pre>
 *
 * <p><strong>Interruption:</strong></p>
 * <ul>
 *   <li>{@link #interruptCurrentExecution()} interrupts the execution thread only while a cell body runs</li>
 *   <li>A request arriving after the body finished is a no-op and returns false</li>
 *   <li>The interrupt flag is cleared before {@code post_execute}, so it never leaks into the next cell</li>
 * </ul>
 *
 * <p><strong>Outcome classification:</strong></p>
 * <ul>
 *   <li>{@link InterruptedException} or {@link CellInterruptedException} → {@code Failed("Interrupted")}</li>
 *   <li>any other throwable → {@code Failed(<simple class name>)}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (InMemoryExecutionHost host = new InMemoryExecutionHost()) {
 *     host.register(listener);
 *     ExecutionOutcome outcome = host.execute("cell-1", "train(model)", () -&gt; {
 *         while (training) {
 *             CellTask.checkpoint();
 *             step();
 *         }
 *     });
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryExecutionHost implements ExecutionHost, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExecutionHost.class);

    /**
     * Name of the dedicated execution thread.
     */
    public static final String EXECUTION_THREAD_NAME = "kernel-execution";

    private static final long CLOSE_TIMEOUT_SECONDS = 5L;

    private final List<ExecutionLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService executionThread;
    private final HostDiagnostics diagnostics;
    private final AtomicLong executionCount = new AtomicLong();

    /**
     * Guards {@link #runningThread}.
     */
    private final ReentrantLock runningLock = new ReentrantLock();

    /**
     * Thread currently running a cell body, or null between cells.
     */
    private Thread runningThread;

    /**
     * Creates a host with transport diagnostics disabled.
     */
    public InMemoryExecutionHost() {
        this(HostDiagnostics.none());
    }

    /**
     * Creates a host.
     *
     * @param diagnostics transport diagnostics flags
     * @throws IllegalArgumentException if diagnostics is null
     */
    public InMemoryExecutionHost(HostDiagnostics diagnostics) {
        if (diagnostics == null) {
            throw new IllegalArgumentException("diagnostics cannot be null");
        }
        this.diagnostics = diagnostics;
        this.executionThread = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, EXECUTION_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void register(ExecutionLifecycleListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    @Override
    public void unregister(ExecutionLifecycleListener listener) {
        listeners.remove(listener);
    }

    @Override
    public boolean interruptCurrentExecution() {
        runningLock.lock();
        try {
            if (runningThread == null) {
                log.debug("Interrupt requested while no cell is running, ignoring");
                return false;
            }
            runningThread.interrupt();
            log.info("Interrupt delivered to {}", runningThread.getName());
            return true;
        } finally {
            runningLock.unlock();
        }
    }

    /**
     * Submits a cell for execution on the execution thread.
     *
     * @param cellId external cell identifier (may be null)
     * @param source source text of the cell (may be null)
     * @param task cell body
     * @return future completed with the classified outcome
     * @throws IllegalArgumentException if task is null
     * @throws java.util.concurrent.RejectedExecutionException if the host is closed
     */
    public Future<ExecutionOutcome> submit(String cellId, String source, CellTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (diagnostics.logTransportMessages()) {
            log.debug("execute_request | cell_id={} | source_length={}", cellId, source == null ? 0 : source.length());
        }
        return executionThread.submit(() -> runCell(cellId, source, task));
    }

    /**
     * Runs a cell and waits for its outcome.
     *
     * @param cellId external cell identifier (may be null)
     * @param source source text of the cell (may be null)
     * @param task cell body
     * @return classified outcome
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public ExecutionOutcome execute(String cellId, String source, CellTask task) throws InterruptedException {
        try {
            return submit(cellId, source, task).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Cell runner failed unexpectedly", e.getCause());
        }
    }

    /**
     * Returns whether a cell body is currently running.
     *
     * @return true while a cell body runs
     */
    public boolean isExecuting() {
        runningLock.lock();
        try {
            return runningThread != null;
        } finally {
            runningLock.unlock();
        }
    }

    /**
     * Returns the number of cells completed so far.
     *
     * @return completed cell count
     */
    public long executionCount() {
        return executionCount.get();
    }

    /**
     * Returns the number of registered listeners.
     *
     * @return listener count
     */
    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Stops the execution thread, waiting briefly for a running cell.
     */
    @Override
    public void close() {
        executionThread.shutdown();
        try {
            if (!executionThread.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executionThread.shutdownNow();
            }
        } catch (InterruptedException e) {
            executionThread.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ExecutionOutcome runCell(String cellId, String source, CellTask task) {
        dispatch("pre_run_cell", listener -> listener.onPreRunCell(source));
        dispatch("pre_execute", listener -> listener.onPreExecute(cellId, source));

        ExecutionOutcome outcome = runBody(task);

        dispatch("post_execute", listener -> listener.onPostExecute(outcome));
        long count = executionCount.incrementAndGet();
        dispatch("post_run_cell", listener -> listener.onPostRunCell(count));

        if (diagnostics.logTransportMessages()) {
            log.debug("execute_reply | exec_count={} | status={}", count, outcome.isSuccess() ? "ok" : "error");
        }
        return outcome;
    }

    private ExecutionOutcome runBody(CellTask task) {
        setRunningThread(Thread.currentThread());
        try {
            task.run();
            return ExecutionOutcome.success();
        } catch (InterruptedException | CellInterruptedException e) {
            return Failed.interrupted();
        } catch (Throwable e) {
            log.debug("Cell raised {}", e.getClass().getName(), e);
            return Failed.from(e);
        } finally {
            setRunningThread(null);
            // drop an interrupt that raced with the end of the body
            Thread.interrupted();
        }
    }

    private void setRunningThread(Thread thread) {
        runningLock.lock();
        try {
            runningThread = thread;
        } finally {
            runningLock.unlock();
        }
    }

    private void dispatch(String hook, Consumer<ExecutionLifecycleListener> action) {
        if (diagnostics.debugTransportLogging()) {
            log.debug("Dispatching {} to {} listener(s)", hook, listeners.size());
        }
        for (ExecutionLifecycleListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                log.error("Listener {} failed in {} hook", listener.getClass().getSimpleName(), hook, e);
            }
        }
    }
}
