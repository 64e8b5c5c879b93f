/**
 * In-memory presentation channel package.
 *
 * @see com.ryuqq.kernelmonitor.core.spi.MetadataSink
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.kernelmonitor.adapter.inmemory.sink;
