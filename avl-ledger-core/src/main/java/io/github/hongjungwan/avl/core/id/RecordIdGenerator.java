package io.github.hongjungwan.avl.core.id;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 단조 증가 UUIDv7 생성기.
 *
 * <p>48비트 밀리초 타임스탬프 + 12비트 카운터(같은 밀리초 내 순서) + 62비트 난수.
 * 시계가 뒤로 가거나 카운터가 넘치면 논리 타임스탬프를 앞으로 밀어 문자열 정렬 순서와 생성 순서를 일치시킨다.</p>
 */
public final class RecordIdGenerator {

    private static final int MAX_COUNTER = 0xFFF;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final ReentrantLock lock = new ReentrantLock();

    private long lastMillis = -1;
    private int counter;

    public RecordIdGenerator() {
        this(Clock.systemUTC());
    }

    public RecordIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        long millis;
        int seq;
        lock.lock();
        try {
            long now = clock.millis();
            if (now > lastMillis) {
                lastMillis = now;
                counter = 0;
            } else if (counter < MAX_COUNTER) {
                counter++;
            } else {
                lastMillis++;
                counter = 0;
            }
            millis = lastMillis;
            seq = counter;
        } finally {
            lock.unlock();
        }

        long msb = (millis & 0xFFFF_FFFF_FFFFL) << 16
                | 0x7000L
                | seq;
        long lsb = (random.nextLong() & 0x3FFF_FFFF_FFFF_FFFFL) | 0x8000_0000_0000_0000L;
        return new UUID(msb, lsb).toString();
    }

    /** UUIDv7에 포함된 밀리초 타임스탬프 */
    public static long timestampOf(String recordId) {
        return UUID.fromString(recordId).getMostSignificantBits() >>> 16;
    }
}
