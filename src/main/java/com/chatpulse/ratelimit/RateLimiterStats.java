package com.chatpulse.ratelimit;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class RateLimiterStats {

    private final boolean enabled;
    private final int activeKeys;
    private final long admitted;
    private final long rejected;
}
