/**
 * In-memory execution host package.
 *
 * <p>Provides a reference {@link com.ryuqq.kernelmonitor.core.spi.ExecutionHost} that runs cells
 * on a single dedicated thread, so the monitor can be exercised end-to-end without a real kernel.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Interruption is cooperative ({@link java.lang.Thread#interrupt()})</li>
 *   <li>A cell that ignores interrupts cannot be stopped</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @see com.ryuqq.kernelmonitor.core.spi.ExecutionHost
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.kernelmonitor.adapter.inmemory.host;
