/**
 * Execution model package.
 *
 * <p>This package defines the immutable values the monitor produces while observing
 * execution units:</p>
 *
 * <h2>Values</h2>
 * <ul>
 *   <li>{@link com.ryuqq.kernelmonitor.core.model.ExecutionRecord} - one record per execution unit (open, then sealed)</li>
 *   <li>{@link com.ryuqq.kernelmonitor.core.model.ExecutionNotice} - long-execution warning/timeout notice</li>
 *   <li>{@link com.ryuqq.kernelmonitor.core.model.SourcePreview} - bounded, log-safe source previews</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> sealing a record returns a new instance</li>
 *   <li><strong>Validation:</strong> constructors reject negative durations and inconsistent outcomes</li>
 *   <li><strong>Pure Java:</strong> no external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.kernelmonitor.core.model;
