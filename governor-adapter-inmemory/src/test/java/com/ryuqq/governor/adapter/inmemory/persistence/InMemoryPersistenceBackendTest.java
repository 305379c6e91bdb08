package com.ryuqq.governor.adapter.inmemory.persistence;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryPersistenceBackendTest {

    @Test
    void write_ThenRead_ReturnsCopy() {
        // given
        InMemoryPersistenceBackend backend = new InMemoryPersistenceBackend();
        byte[] payload = {1, 2, 3};

        // when
        backend.write("a", payload);
        payload[0] = 9;

        // then
        assertThat(backend.read("a")).hasValueSatisfying(bytes -> assertThat(bytes).containsExactly(1, 2, 3));
    }

    @Test
    void delete_AbsentKey_IsTolerated() {
        InMemoryPersistenceBackend backend = new InMemoryPersistenceBackend();

        backend.delete("missing");

        assertThat(backend.size()).isZero();
    }

    @Test
    void clear_RemovesEverything() {
        // given
        InMemoryPersistenceBackend backend = new InMemoryPersistenceBackend();
        backend.write("a", new byte[]{1});
        backend.write("b", new byte[]{2});

        // when
        backend.clear();

        // then
        assertThat(backend.keys()).isEmpty();
    }
}
