package com.newsenricher.core.util;

import java.time.Duration;

/** 대기 추상화. 테스트에서는 가짜 구현으로 시간을 건너뛴다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
