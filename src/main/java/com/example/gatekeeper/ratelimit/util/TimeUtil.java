package com.example.gatekeeper.ratelimit.util;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * 시간 관련 유틸리티 클래스
 * 모든 계산은 epoch 초 단위이며, 현재 시각은 주입된 Clock 에서만 읽는다.
 */
public final class TimeUtil {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // 부동소수점 오차 보정값 (ceil 계산용)
    private static final double EPSILON = 1e-9;

    private TimeUtil() {
    }

    //현재 시간을 초로 반환
    public static long currentTimeSeconds(Clock clock) {
        return Math.floorDiv(clock.millis(), 1000L);
    }

    //고정 윈도우 버킷 번호 계산
    public static long windowIndex(long nowSeconds, long windowSeconds) {
        return Math.floorDiv(nowSeconds, windowSeconds);
    }

    //소수 초를 올림하여 정수 초로 변환 (0.9999999999 같은 오차는 1로 본다)
    public static long ceilSeconds(double seconds) {
        if (seconds <= 0) {
            return 0;
        }
        return (long) Math.ceil(seconds - EPSILON);
    }

    //epoch 초를 사람이 읽기 쉬운 형태로 변환 (UTC)
    public static String formatTimestamp(long epochSeconds) {
        LocalDateTime dateTime = LocalDateTime.ofInstant(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC);
        return dateTime.format(FORMATTER);
    }
}
