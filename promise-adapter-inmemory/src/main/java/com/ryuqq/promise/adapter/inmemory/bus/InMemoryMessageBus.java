package com.ryuqq.promise.adapter.inmemory.bus;

import com.ryuqq.promise.core.contract.RelayEnvelope;
import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.MessageId;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.spi.MessageQueue;
import com.ryuqq.promise.core.spi.Messenger;
import com.ryuqq.promise.core.spi.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory cross-chain transport shared by every chain in a test.
 *
 * <p>Each chain sends through its own {@link Messenger} obtained from
 * {@link #messengerFor(ChainId)}; the relay consumes the same bus as a {@link MessageQueue}.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Main Queue:</strong> LinkedBlockingDeque&lt;RelayEnvelope&gt; - FIFO in send order</li>
 *   <li><strong>In-Flight Tracking:</strong> ConcurrentHashMap&lt;MessageId, RelayEnvelope&gt;</li>
 *   <li><strong>Dead Letter Queue:</strong> CopyOnWriteArrayList&lt;DeadLetter&gt;</li>
 * </ul>
 *
 * <p>A single FIFO preserves send order for every (source, destination) pair.
 * {@link #nack(RelayEnvelope)} appends the envelope to the tail, so a nacked message is
 * retried after everything already queued.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMessageBus implements MessageQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final LinkedBlockingDeque<RelayEnvelope> queue = new LinkedBlockingDeque<>();
    private final ConcurrentHashMap<MessageId, RelayEnvelope> inFlight = new ConcurrentHashMap<>();
    private final List<DeadLetter> deadLetters = new CopyOnWriteArrayList<>();
    private final List<RelayEnvelope> sent = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final MonotonicClock clock;

    /**
     * Creates a bus stamping envelopes with the system clock.
     */
    public InMemoryMessageBus() {
        this(MonotonicClock.system());
    }

    /**
     * Creates a bus stamping envelopes with the given clock.
     *
     * @param clock the clock used for {@link RelayEnvelope#sentAt()}
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryMessageBus(MonotonicClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * Returns a messenger that sends from the given chain.
     *
     * @param source the sending chain
     * @return messenger bound to source
     * @throws IllegalArgumentException if source is null
     */
    public Messenger messengerFor(ChainId source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return (destination, target, body) -> publish(source, destination, target, body);
    }

    private MessageId publish(ChainId source, ChainId destination, Address target, Payload body) {
        if (destination == null || target == null || body == null) {
            throw new IllegalArgumentException("destination, target and body cannot be null");
        }
        MessageId messageId = MessageId.of("msg-" + sequence.incrementAndGet());
        RelayEnvelope envelope = new RelayEnvelope(messageId, source, destination, target, body, clock.nowMillis());
        queue.addLast(envelope);
        sent.add(envelope);
        log.debug("Queued {} {} → {} ({} bytes)", messageId.getValue(), source.getValue(),
            destination.getValue(), body.size());
        return messageId;
    }

    @Override
    public List<RelayEnvelope> dequeue(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        List<RelayEnvelope> result = new ArrayList<>();
        for (int i = 0; i < batchSize; i++) {
            RelayEnvelope envelope = queue.pollFirst();
            if (envelope == null) {
                break;
            }
            inFlight.put(envelope.messageId(), envelope);
            result.add(envelope);
        }
        return result;
    }

    @Override
    public void ack(RelayEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        inFlight.remove(envelope.messageId());
    }

    @Override
    public void nack(RelayEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (inFlight.remove(envelope.messageId()) != null) {
            queue.addLast(envelope);
        }
    }

    @Override
    public void publishToDeadLetter(RelayEnvelope envelope, String reason) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        inFlight.remove(envelope.messageId());
        deadLetters.add(new DeadLetter(envelope, reason, clock.nowMillis()));
        log.warn("Dead-lettered {}: {}", envelope.messageId().getValue(), reason);
    }

    /**
     * Removes a queued envelope without delivering it. Used to simulate message loss in tests.
     *
     * @param messageId the message to drop
     * @return true if the envelope was queued and has been dropped
     */
    public boolean drop(MessageId messageId) {
        return queue.removeIf(envelope -> envelope.messageId().equals(messageId));
    }

    /**
     * Returns the number of queued envelopes (not in flight). Used for test assertions.
     *
     * @return queue size
     */
    public int queueSize() {
        return queue.size();
    }

    public int inFlightSize() {
        return inFlight.size();
    }

    public int deadLetterSize() {
        return deadLetters.size();
    }

    public List<DeadLetter> getDeadLetters() {
        return new ArrayList<>(deadLetters);
    }

    /**
     * Returns every envelope ever sent, in send order. Used for test assertions.
     *
     * @return sent envelopes
     */
    public List<RelayEnvelope> sentEnvelopes() {
        return new ArrayList<>(sent);
    }

    /**
     * Dead letter entry with failure metadata.
     */
    public static class DeadLetter {
        private final RelayEnvelope envelope;
        private final String reason;
        private final long timestamp;

        DeadLetter(RelayEnvelope envelope, String reason, long timestamp) {
            this.envelope = envelope;
            this.reason = reason;
            this.timestamp = timestamp;
        }

        public RelayEnvelope getEnvelope() {
            return envelope;
        }

        public String getReason() {
            return reason;
        }

        public long getTimestamp() {
            return timestamp;
        }
    }
}
