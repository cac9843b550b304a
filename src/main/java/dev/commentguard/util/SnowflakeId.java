package dev.commentguard.util;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Twitter-style 64-bit id generator:
 * <pre>
 * | 1 bit (unused) | 41 bits (timestamp) | 10 bits (node id) | 12 bits (sequence) |
 * </pre>
 * Ids are time-ordered, so sorting comments by id matches creation order.
 */
public final class SnowflakeId {

    // 2024-01-01T00:00:00Z
    private static final long CUSTOM_EPOCH = 1704067200000L;

    private static final int NODE_ID_BITS = 10;
    private static final int SEQUENCE_BITS = 12;

    public static final long MAX_NODE_ID = (1L << NODE_ID_BITS) - 1;
    private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    private static final int NODE_ID_SHIFT = SEQUENCE_BITS;
    private static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + NODE_ID_BITS;

    // Tolerated backwards clock drift in milliseconds
    private static final long MAX_DRIFT_MS = 5;

    private final long nodeId;
    private final AtomicLong lastState = new AtomicLong(0);

    public SnowflakeId(long nodeId) {
        if (nodeId < 0 || nodeId > MAX_NODE_ID) {
            throw new IllegalArgumentException(
                    "Node ID must be between 0 and " + MAX_NODE_ID + ", got: " + nodeId);
        }
        this.nodeId = nodeId;
    }

    /**
     * Lock-free; retries the CAS until it wins.
     *
     * @throws IllegalStateException if the clock moved backwards beyond the tolerated drift
     */
    public long nextId() {
        while (true) {
            long now = currentTimestamp();
            long oldState = lastState.get();
            long oldTimestamp = oldState >>> SEQUENCE_BITS;
            long oldSequence = oldState & MAX_SEQUENCE;

            long timestamp;
            long sequence;
            if (now > oldTimestamp) {
                timestamp = now;
                sequence = 0;
            } else if (oldTimestamp - now <= MAX_DRIFT_MS) {
                timestamp = oldTimestamp;
                sequence = (oldSequence + 1) & MAX_SEQUENCE;
                if (sequence == 0) {
                    // sequence exhausted in this millisecond
                    timestamp = waitNextMillis(oldTimestamp);
                }
            } else {
                throw new IllegalStateException(
                        "Clock moved backwards by " + (oldTimestamp - now) + "ms. Refusing to generate ID.");
            }

            long newState = (timestamp << SEQUENCE_BITS) | sequence;
            if (lastState.compareAndSet(oldState, newState)) {
                return (timestamp << TIMESTAMP_SHIFT) | (nodeId << NODE_ID_SHIFT) | sequence;
            }
        }
    }

    public static long extractTimestamp(long id) {
        return (id >>> TIMESTAMP_SHIFT) + CUSTOM_EPOCH;
    }

    public static int extractNodeId(long id) {
        return (int) ((id >>> NODE_ID_SHIFT) & MAX_NODE_ID);
    }

    private long currentTimestamp() {
        return System.currentTimeMillis() - CUSTOM_EPOCH;
    }

    private long waitNextMillis(long lastTimestamp) {
        long ts = currentTimestamp();
        while (ts <= lastTimestamp) {
            Thread.onSpinWait();
            ts = currentTimestamp();
        }
        return ts;
    }

    @Override
    public String toString() {
        return "SnowflakeId{nodeId=" + nodeId + "}";
    }
}
