package com.chatpulse.ratelimit;

import java.time.Duration;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Admission windows, in the order they are evaluated. */
@Getter
@RequiredArgsConstructor
public enum RateWindowType {
    BURST(Duration.ofSeconds(1), "second"),
    MINUTE(Duration.ofMinutes(1), "minute"),
    HOUR(Duration.ofHours(1), "hour"),
    DAY(Duration.ofDays(1), "day");

    private final Duration size;
    private final String label;
}
