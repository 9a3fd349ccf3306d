package com.chatpulse.client;

import com.chatpulse.ratelimit.RateWindowType;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class RateLimitUsage {

    private final String identifier;
    private final String action;
    private final Map<RateWindowType, Integer> used;
    private final Map<RateWindowType, Integer> remaining;
}
