package com.apex.guardian.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryFastStateStoreTest {

    private final InMemoryFastStateStore store = new InMemoryFastStateStore("t:");

    @Test
    void compareAndSetRequiresExpectedValue() {
        store.put("k", "v1", Duration.ofMinutes(1));

        assertThat(store.compareAndSet("k", "other", "v2", Duration.ofMinutes(1))).isFalse();
        assertThat(store.compareAndSet("k", "v1", "v2", Duration.ofMinutes(1))).isTrue();
        assertThat(store.get("k")).contains("v2");
    }

    @Test
    void nullExpectedMeansAbsent() {
        assertThat(store.compareAndSet("k", null, "v1", Duration.ofMinutes(1))).isTrue();
        assertThat(store.setIfAbsent("k", "v2", Duration.ofMinutes(1))).isFalse();
        assertThat(store.get("k")).contains("v1");
    }

    @Test
    void expiredEntriesAreAbsent() throws InterruptedException {
        store.put("k", "v1", Duration.ofMillis(20));
        Thread.sleep(50);

        assertThat(store.get("k")).isEmpty();
        assertThat(store.setIfAbsent("k", "v2", Duration.ofMinutes(1))).isTrue();
    }

    @Test
    void deleteRemovesKey() {
        store.put("k", "v1", null);
        store.delete("k");

        assertThat(store.get("k")).isEmpty();
    }
}
