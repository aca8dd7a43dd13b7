package com.newsenricher.core.util;

/** 밀리초 단위 시계. 레이트리미터/캐시 만료 계산에서 주입받아 사용. */
@FunctionalInterface
public interface MillisClock {
    long nowMillis();

    MillisClock SYSTEM = System::currentTimeMillis;
}
