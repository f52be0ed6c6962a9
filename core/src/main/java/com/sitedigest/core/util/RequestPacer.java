package com.sitedigest.core.util;

import java.time.Duration;
import java.util.Objects;

/**
 * 요청 시작 간 최소 간격을 보장하는 페이서(여러 워커 공유).
 * 슬롯은 락 안에서 예약하고, 대기는 락 밖에서 한다.
 */
public final class RequestPacer {
    private final long intervalNanos;
    private final Sleeper sleeper;
    private long nextSlotNanos;

    public RequestPacer(Duration interval, Sleeper sleeper) {
        this.intervalNanos = Math.max(0, Objects.requireNonNull(interval, "interval").toNanos());
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.nextSlotNanos = System.nanoTime();
    }

    public void acquire() throws InterruptedException {
        long waitNanos;
        synchronized (this) {
            long now = System.nanoTime();
            long slot = Math.max(now, nextSlotNanos);
            nextSlotNanos = slot + intervalNanos;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) sleeper.sleep(Duration.ofNanos(waitNanos));
    }

    public Duration interval() { return Duration.ofNanos(intervalNanos); }
}
