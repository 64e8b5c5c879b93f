package com.ryuqq.kernelmonitor.adapter.inmemory.host;

/**
 * Raised inside a cell when an interrupt request reaches a {@link CellTask#checkpoint()}.
 *
 * <p>The host classifies it the same way as {@link InterruptedException}: the outcome is
 * indistinguishable from a user-initiated interrupt.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CellInterruptedException extends RuntimeException {

    public CellInterruptedException(String message) {
        super(message);
    }
}
