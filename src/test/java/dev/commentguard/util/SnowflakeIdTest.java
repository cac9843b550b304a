package dev.commentguard.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnowflakeIdTest {

    @Test
    @DisplayName("Should generate increasing ids")
    void shouldGenerateIncreasingIds() {
        SnowflakeId generator = new SnowflakeId(1);
        long previous = generator.nextId();
        for (int i = 0; i < 10_000; i++) {
            long next = generator.nextId();
            assertThat(next).isGreaterThan(previous);
            previous = next;
        }
    }

    @Test
    @DisplayName("Should embed the node id and a current timestamp")
    void shouldEmbedNodeAndTime() {
        long before = System.currentTimeMillis();
        long id = new SnowflakeId(513).nextId();
        long after = System.currentTimeMillis();

        assertThat(SnowflakeId.extractNodeId(id)).isEqualTo(513);
        assertThat(SnowflakeId.extractTimestamp(id)).isBetween(before, after);
    }

    @Test
    @DisplayName("Should stay unique across threads")
    void shouldBeUniqueAcrossThreads() throws InterruptedException {
        SnowflakeId generator = new SnowflakeId(7);
        Set<Long> ids = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int t = 0; t < 4; t++) {
            pool.submit(() -> {
                Set<Long> local = new HashSet<>();
                for (int i = 0; i < 5_000; i++) {
                    local.add(generator.nextId());
                }
                ids.addAll(local);
            });
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(ids).hasSize(20_000);
    }

    @Test
    @DisplayName("Should refuse node ids out of range")
    void shouldRejectBadNodeId() {
        assertThatThrownBy(() -> new SnowflakeId(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SnowflakeId(SnowflakeId.MAX_NODE_ID + 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
