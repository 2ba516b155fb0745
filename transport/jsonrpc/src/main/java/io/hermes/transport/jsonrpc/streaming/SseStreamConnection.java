package io.hermes.transport.jsonrpc.streaming;

import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

import io.hermes.server.events.StreamConnection;
import io.hermes.server.events.StreamFilter;
import io.hermes.spec.Event;
import io.hermes.util.Assert;
import mutiny.zero.BackpressureStrategy;
import mutiny.zero.Tube;
import mutiny.zero.TubeConfiguration;
import mutiny.zero.ZeroPublisher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An SSE response exposed as a {@link Flow.Publisher} of frames.
 * <p>
 * Frames offered by the streamer wait in a bounded buffer until the HTTP layer requests them.
 * When the buffer is full {@link #offer(Event)} returns {@code false}, after which the streamer
 * closes the connection. The publisher accepts a single subscriber; cancelling the subscription
 * closes the connection.
 */
public class SseStreamConnection implements StreamConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(SseStreamConnection.class);

    private final String id;
    private final StreamFilter filter;
    private final boolean verifiesSignatures;
    private final int bufferSize;
    private final Queue<String> buffer;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Flow.Publisher<String> publisher;
    private @Nullable Tube<String> tube;

    public SseStreamConnection(StreamFilter filter, boolean verifiesSignatures, int bufferSize) {
        Assert.isTrue(bufferSize > 0, "bufferSize must be positive");
        this.id = UUID.randomUUID().toString();
        this.filter = Assert.checkNotNullParam("filter", filter);
        this.verifiesSignatures = verifiesSignatures;
        this.bufferSize = bufferSize;
        this.buffer = new ArrayBlockingQueue<>(bufferSize);
        TubeConfiguration configuration = new TubeConfiguration()
                .withBackpressureStrategy(BackpressureStrategy.BUFFER)
                .withBufferSize(bufferSize);
        this.publisher = ZeroPublisher.create(configuration, this::attach);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public StreamFilter filter() {
        return filter;
    }

    @Override
    public boolean verifiesSignatures() {
        return verifiesSignatures;
    }

    /**
     * The frames of this connection, to be written to the HTTP response in order.
     */
    public Flow.Publisher<String> frames() {
        return publisher;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public boolean offer(Event event) {
        if (closed.get()) {
            return false;
        }
        if (!buffer.offer(SseEventFormatter.format(event))) {
            LOGGER.debug("SSE connection {} is full ({} frames)", id, bufferSize);
            return false;
        }
        drain();
        return true;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Tube<String> current;
        synchronized (this) {
            current = tube;
        }
        if (current != null) {
            current.complete();
        }
        LOGGER.debug("SSE connection {} closed", id);
    }

    private void attach(Tube<String> newTube) {
        synchronized (this) {
            if (tube != null) {
                newTube.fail(new IllegalStateException("SSE connection " + id + " already has a subscriber"));
                return;
            }
            tube = newTube;
        }
        newTube.whenRequested(n -> drain());
        newTube.whenCancelled(this::close);
        if (closed.get()) {
            drain();
            newTube.complete();
        }
    }

    private synchronized void drain() {
        if (tube == null) {
            return;
        }
        while (tube.outstandingRequests() > 0) {
            String frame = buffer.poll();
            if (frame == null) {
                return;
            }
            tube.send(frame);
        }
    }
}
