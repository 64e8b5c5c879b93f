/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces through which the monitor talks to its host
 * environment. The monitor never reaches for ambient global state: the host and the
 * presentation channel are handed to it at construction time.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernelmonitor.core.spi.ExecutionHost} - lifecycle hooks and interrupt capability</li>
 *   <li>{@link com.ryuqq.kernelmonitor.core.spi.ExecutionLifecycleListener} - receiver of the hooks</li>
 *   <li>{@link com.ryuqq.kernelmonitor.core.spi.MetadataSink} - out-of-band presentation channel</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., kernel-monitor-adapter-inmemory) provide concrete implementations.
 * A production deployment binds them to the real kernel and its display channel.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.kernelmonitor.core.spi;
