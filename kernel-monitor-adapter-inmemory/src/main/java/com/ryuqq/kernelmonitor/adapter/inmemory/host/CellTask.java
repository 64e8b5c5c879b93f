package com.ryuqq.kernelmonitor.adapter.inmemory.host;

/**
 * A unit of user code run by {@link InMemoryExecutionHost}.
 *
 * <p>Interruption is cooperative: a long-running task should call {@link #checkpoint()}
 * (or any blocking method that honours {@link Thread#interrupt()}) so that an interrupt
 * request can actually stop it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CellTask {

    /**
     * Runs the cell body.
     *
     * @throws Exception any failure raised by user code
     */
    void run() throws Exception;

    /**
     * Cooperative interruption point.
     *
     * <p>Clears the calling thread's interrupt flag and throws if it was set.</p>
     *
     * @throws CellInterruptedException if the execution thread has been interrupted
     */
    static void checkpoint() {
        if (Thread.interrupted()) {
            throw new CellInterruptedException("Cell execution interrupted");
        }
    }
}
