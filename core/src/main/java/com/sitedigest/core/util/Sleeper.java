package com.sitedigest.core.util;

import java.time.Duration;

/** 재시도/페이싱 대기 추상화. 테스트에서는 실제로 자지 않고 기록만 한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
