package com.ryuqq.promise.adapter.inmemory.store;

import com.ryuqq.promise.core.error.PromiseErrorCode;
import com.ryuqq.promise.core.error.PromiseException;
import com.ryuqq.promise.core.model.Address;
import com.ryuqq.promise.core.model.ChainId;
import com.ryuqq.promise.core.model.LocalOrigin;
import com.ryuqq.promise.core.model.Payload;
import com.ryuqq.promise.core.model.PromiseId;
import com.ryuqq.promise.core.model.PromiseIds;
import com.ryuqq.promise.core.model.PromiseRecord;
import com.ryuqq.promise.core.statemachine.PromiseStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryPromiseStore 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryPromiseStoreTest {

    private static final Address ALICE = Address.of("alice");
    private static final PromiseId ID = PromiseIds.forCreate(ChainId.of(1L), ALICE, 0);

    private InMemoryPromiseStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryPromiseStore();
    }

    @Test
    void insert_ThenGet_ReturnsRecord() {
        // given
        PromiseRecord record = PromiseRecord.pending(ID, ALICE, LocalOrigin.instance());

        // when
        store.insert(record);

        // then
        assertThat(store.get(ID)).isEqualTo(record);
        assertThat(store.exists(ID)).isTrue();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void insert_Duplicate_Throws() {
        // given
        store.insert(PromiseRecord.pending(ID, ALICE, LocalOrigin.instance()));

        // when & then
        assertThatThrownBy(() -> store.insert(PromiseRecord.pending(ID, ALICE, LocalOrigin.instance())))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void update_ReplacesRecord() {
        // given
        PromiseRecord record = PromiseRecord.pending(ID, ALICE, LocalOrigin.instance());
        store.insert(record);

        // when
        store.update(record.settle(PromiseStatus.RESOLVED, Payload.ofUtf8("v")));

        // then
        assertThat(store.get(ID).status()).isEqualTo(PromiseStatus.RESOLVED);
    }

    @Test
    void update_Missing_Throws() {
        // when & then
        assertThatThrownBy(() -> store.update(PromiseRecord.pending(ID, ALICE, LocalOrigin.instance())))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void get_Unknown_ThrowsUnknownPromise() {
        // when & then
        assertThatThrownBy(() -> store.get(ID))
            .isInstanceOf(PromiseException.class)
            .hasFieldOrPropertyWithValue("errorCode", PromiseErrorCode.UNKNOWN_PROMISE);
        assertThat(store.find(ID)).isEmpty();
    }
}
