package com.ryuqq.promise.adapter.inmemory.bus;

import com.ryuqq.promise.core.contract.RelayEnvelope;
import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.MessageId;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.spi.Messenger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryMessageBus 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryMessageBusTest {

    private static final ChainId CHAIN_A = ChainId.of(901L);
    private static final ChainId CHAIN_B = ChainId.of(902L);
    private static final Address ENGINE = Address.of("promise-engine");

    private InMemoryMessageBus bus;
    private Messenger fromA;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus(() -> 1_000L);
        fromA = bus.messengerFor(CHAIN_A);
    }

    @Test
    void send_StampsSourceAndPreservesOrder() {
        // when
        MessageId first = fromA.send(CHAIN_B, ENGINE, Payload.ofUtf8("setup"));
        MessageId second = fromA.send(CHAIN_B, ENGINE, Payload.ofUtf8("execute"));

        // then
        List<RelayEnvelope> batch = bus.dequeue(10);
        assertThat(batch).extracting(RelayEnvelope::messageId).containsExactly(first, second);
        assertThat(batch.get(0).source()).isEqualTo(CHAIN_A);
        assertThat(batch.get(0).destination()).isEqualTo(CHAIN_B);
        assertThat(batch.get(0).sentAt()).isEqualTo(1_000L);
        assertThat(bus.inFlightSize()).isEqualTo(2);
    }

    @Test
    void dequeue_RespectsBatchSize() {
        // given
        fromA.send(CHAIN_B, ENGINE, Payload.ofUtf8("1"));
        fromA.send(CHAIN_B, ENGINE, Payload.ofUtf8("2"));

        // when
        List<RelayEnvelope> batch = bus.dequeue(1);

        // then
        assertThat(batch).hasSize(1);
        assertThat(bus.queueSize()).isEqualTo(1);
        assertThatThrownBy(() -> bus.dequeue(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ack_RemovesInFlight() {
        // given
        fromA.send(CHAIN_B, ENGINE, Payload.ofUtf8("1"));
        RelayEnvelope envelope = bus.dequeue(1).get(0);

        // when
        bus.ack(envelope);
        bus.ack(envelope);

        // then
        assertThat(bus.inFlightSize()).isZero();
        assertThat(bus.queueSize()).isZero();
    }

    @Test
    void nack_RequeuesAtTail() {
        // given
        MessageId first = fromA.send(CHAIN_B, ENGINE, Payload.ofUtf8("1"));
        RelayEnvelope envelope = bus.dequeue(1).get(0);
        MessageId second = fromA.send(CHAIN_B, ENGINE, Payload.ofUtf8("2"));

        // when
        bus.nack(envelope);

        // then
        assertThat(bus.dequeue(10)).extracting(RelayEnvelope::messageId).containsExactly(second, first);
    }

    @Test
    void publishToDeadLetter_RecordsReason() {
        // given
        fromA.send(CHAIN_B, ENGINE, Payload.ofUtf8("1"));
        RelayEnvelope envelope = bus.dequeue(1).get(0);

        // when
        bus.publishToDeadLetter(envelope, "UNAUTHORIZED");

        // then
        assertThat(bus.deadLetterSize()).isEqualTo(1);
        assertThat(bus.getDeadLetters().get(0).getReason()).isEqualTo("UNAUTHORIZED");
        assertThat(bus.inFlightSize()).isZero();
    }

    @Test
    void drop_RemovesQueuedEnvelope() {
        // given
        MessageId id = fromA.send(CHAIN_B, ENGINE, Payload.ofUtf8("lost"));

        // when
        boolean dropped = bus.drop(id);

        // then
        assertThat(dropped).isTrue();
        assertThat(bus.queueSize()).isZero();
        assertThat(bus.sentEnvelopes()).hasSize(1);
    }
}
