package io.hermes.transport.jsonrpc.streaming;

import java.util.Queue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.hermes.server.events.StreamConnection;
import io.hermes.server.events.StreamFilter;
import io.hermes.spec.Event;
import io.hermes.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams events to a WebSocket session as text frames carrying the canonical JSON envelope.
 * <p>
 * One frame is written at a time; the next one is sent when the previous write completes. At most
 * {@code bufferSize} frames may be waiting, beyond that {@link #offer(Event)} refuses. A failed
 * write closes the connection.
 */
public class WebSocketStreamConnection implements StreamConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketStreamConnection.class);

    private final WebSocketSession session;
    private final StreamFilter filter;
    private final boolean verifiesSignatures;
    private final int bufferSize;
    private final Queue<String> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingCount = new AtomicInteger();
    private final AtomicBoolean writing = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    public WebSocketStreamConnection(WebSocketSession session, StreamFilter filter, boolean verifiesSignatures,
                                     int bufferSize) {
        Assert.isTrue(bufferSize > 0, "bufferSize must be positive");
        this.session = Assert.checkNotNullParam("session", session);
        this.filter = Assert.checkNotNullParam("filter", filter);
        this.verifiesSignatures = verifiesSignatures;
        this.bufferSize = bufferSize;
    }

    @Override
    public String id() {
        return session.id();
    }

    @Override
    public StreamFilter filter() {
        return filter;
    }

    @Override
    public boolean verifiesSignatures() {
        return verifiesSignatures;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public boolean offer(Event event) {
        return offerText(SseEventFormatter.envelope(event));
    }

    /**
     * Queues an arbitrary text frame, such as a JSON-RPC response, behind the pending events.
     */
    public boolean offerText(String text) {
        if (closed.get()) {
            return false;
        }
        if (pendingCount.incrementAndGet() > bufferSize) {
            pendingCount.decrementAndGet();
            LOGGER.debug("WebSocket connection {} is full ({} frames)", id(), bufferSize);
            return false;
        }
        pending.add(text);
        writeNext();
        return true;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        pending.clear();
        pendingCount.set(0);
        try {
            session.close();
        } catch (RuntimeException e) {
            LOGGER.debug("Closing WebSocket session {} failed", id(), e);
        }
        LOGGER.debug("WebSocket connection {} closed", id());
    }

    private void writeNext() {
        if (closed.get() || !writing.compareAndSet(false, true)) {
            return;
        }
        String frame = pending.poll();
        if (frame == null) {
            writing.set(false);
            // a frame may have been queued between poll and reset
            if (!pending.isEmpty()) {
                writeNext();
            }
            return;
        }
        pendingCount.decrementAndGet();
        CompletionStage<?> write;
        try {
            write = session.sendText(frame);
        } catch (RuntimeException e) {
            writing.set(false);
            LOGGER.warn("Write to WebSocket session {} failed, closing it", id(), e);
            close();
            return;
        }
        write.whenComplete((ignored, failure) -> {
            writing.set(false);
            if (failure != null) {
                LOGGER.warn("Write to WebSocket session {} failed, closing it", id(), failure);
                close();
                return;
            }
            writeNext();
        });
    }
}
