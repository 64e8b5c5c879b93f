package com.ryuqq.kernelmonitor.core.spi;

/**
 * Out-of-band presentation channel SPI.
 *
 * <p>The sink carries structured payloads to a downstream viewer alongside the
 * ordinary output of an execution. Each payload is tagged with a content type so
 * the viewer can recognize and render it distinctly.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: notices are published from timer threads</li>
 *   <li>Non-blocking or bounded: callers run on the execution thread</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MetadataSink {

    /**
     * Publishes one payload.
     *
     * @param contentType fixed content-type tag of the payload
     * @param json serialized payload
     * @throws IllegalStateException if the channel is closed
     */
    void publish(String contentType, String json);
}
