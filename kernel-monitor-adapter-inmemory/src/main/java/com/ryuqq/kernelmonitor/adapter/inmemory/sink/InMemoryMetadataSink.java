package com.ryuqq.kernelmonitor.adapter.inmemory.sink;

import com.ryuqq.kernelmonitor.core.spi.MetadataSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link MetadataSink} SPI for testing and reference purposes.
 *
 * <p>Published messages are kept in a {@link CopyOnWriteArrayList}, so they can be read from
 * the test thread while the execution and timer threads publish.</p>
 *
 * <p>{@link #setClosed(boolean)} simulates a closed presentation channel: while closed,
 * {@link #publish(String, String)} throws {@link IllegalStateException}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMetadataSink implements MetadataSink {

    private final List<PublishedMessage> messages = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    @Override
    public void publish(String contentType, String json) {
        if (closed) {
            throw new IllegalStateException("Presentation channel is closed");
        }
        messages.add(new PublishedMessage(contentType, json));
    }

    /**
     * Opens or closes the simulated channel.
     *
     * @param closed true to reject further publishes
     */
    public void setClosed(boolean closed) {
        this.closed = closed;
    }

    /**
     * Returns a snapshot of all published messages in publish order.
     *
     * @return published messages
     */
    public List<PublishedMessage> messages() {
        return List.copyOf(messages);
    }

    /**
     * Returns the payloads published under the given content type.
     *
     * @param contentType content type to filter by
     * @return JSON payloads in publish order
     */
    public List<String> payloadsOf(String contentType) {
        return messages.stream()
            .filter(message -> message.contentType().equals(contentType))
            .map(PublishedMessage::json)
            .collect(Collectors.toList());
    }

    public void clear() {
        messages.clear();
    }

    /**
     * A message handed to the presentation channel.
     *
     * @param contentType content type tag
     * @param json JSON payload
     */
    public record PublishedMessage(String contentType, String json) {
    }
}
