/**
 * Resolved configuration snapshots consumed by the monitor and the host.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.kernelmonitor.core.config;
