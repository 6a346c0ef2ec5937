package com.umitunal.qcast.storage;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Key layout of the job store.
 *
 * <pre>
 *   j|&lt;id&gt;                  job record
 *   s|&lt;nextRunAt&gt;|&lt;id&gt;      schedule index entry, empty value
 * </pre>
 *
 * The schedule timestamp is epoch millis written big-endian with the sign bit
 * flipped, so RocksDB's bytewise ordering matches chronological ordering
 * (including instants before 1970).
 */
final class JobKeys {
    static final byte[] JOB_PREFIX = {'j', '|'};
    static final byte[] SCHEDULE_PREFIX = {'s', '|'};
    private static final byte SEPARATOR = '|';
    private static final int SCHEDULE_HEADER = SCHEDULE_PREFIX.length + Long.BYTES + 1;

    private JobKeys() {
    }

    static byte[] jobKey(String jobId) {
        byte[] id = jobId.getBytes(UTF_8);
        return ByteBuffer.allocate(JOB_PREFIX.length + id.length)
                .put(JOB_PREFIX)
                .put(id)
                .array();
    }

    static byte[] scheduleKey(Instant nextRunAt, String jobId) {
        byte[] id = jobId.getBytes(UTF_8);
        return ByteBuffer.allocate(SCHEDULE_HEADER + id.length)
                .put(SCHEDULE_PREFIX)
                .putLong(nextRunAt.toEpochMilli() ^ Long.MIN_VALUE)
                .put(SEPARATOR)
                .put(id)
                .array();
    }

    static boolean isJobKey(byte[] key) {
        return hasPrefix(key, JOB_PREFIX);
    }

    static boolean isScheduleKey(byte[] key) {
        return hasPrefix(key, SCHEDULE_PREFIX) && key.length > SCHEDULE_HEADER;
    }

    static long scheduleMillis(byte[] scheduleKey) {
        return ByteBuffer.wrap(scheduleKey, SCHEDULE_PREFIX.length, Long.BYTES).getLong() ^ Long.MIN_VALUE;
    }

    static String scheduleJobId(byte[] scheduleKey) {
        return new String(scheduleKey, SCHEDULE_HEADER, scheduleKey.length - SCHEDULE_HEADER, UTF_8);
    }

    private static boolean hasPrefix(byte[] key, byte[] prefix) {
        return key.length >= prefix.length
                && Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }
}
