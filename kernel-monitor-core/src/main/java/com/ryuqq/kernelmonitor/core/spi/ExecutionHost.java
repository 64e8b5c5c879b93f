package com.ryuqq.kernelmonitor.core.spi;

/**
 * Execution Host SPI (the Event Source).
 *
 * <p>An execution host is a long-lived, interactive process (a "kernel") that runs
 * discrete units of user code one at a time on a single execution thread. The monitor
 * subscribes to its lifecycle hooks and, when auto-interrupt is enabled, asks it to
 * cancel the running unit.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Dispatching lifecycle hooks to registered listeners in registration order</li>
 *   <li>Isolating listener faults from the running code</li>
 *   <li>Delivering a cooperative cancellation condition to the running unit on request</li>
 * </ul>
 *
 * <p><strong>Interrupt Contract:</strong></p>
 * <ul>
 *   <li>Delivery is best-effort and cooperative: the running code observes it at its next
 *       interruption-checkable point (blocking I/O, sleep, explicit checkpoint)</li>
 *   <li>Code that masks or ignores the signal, e.g. a tight loop without checkpoints,
 *       cannot be preempted</li>
 *   <li>The signal must only be delivered while a unit is executing. Once the unit has
 *       returned, and before {@code post-execute} is dispatched, a late request must be a
 *       no-op so it cannot leak into the next unit</li>
 *   <li>The resulting failure is indistinguishable from a user-initiated interrupt</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ExecutionHost {

    /**
     * Registers a lifecycle listener.
     *
     * @param listener the listener to register
     * @throws IllegalArgumentException if listener is null
     */
    void register(ExecutionLifecycleListener listener);

    /**
     * Unregisters a previously registered listener. Unknown listeners are ignored.
     *
     * @param listener the listener to remove
     */
    void unregister(ExecutionLifecycleListener listener);

    /**
     * Requests cancellation of whatever unit is currently running.
     *
     * <p>This method is called from a timer thread, never from the execution thread.</p>
     *
     * @return true if a signal was delivered to a running unit, false if nothing was running
     * @throws RuntimeException if the host failed to deliver the signal
     */
    boolean interruptCurrentExecution();
}
