package com.chatpulse.config;

import com.chatpulse.event.EventPublisherHelper;
import java.time.Clock;
import java.time.Instant;
import lombok.Getter;
import org.springframework.scheduling.TaskScheduler;

/**
 * Runtime context handed to every client component at construction: the single scheduler
 * that drives all timers, its clock, the event publisher and the configuration.
 *
 * <p>Components read time only through {@link #now()} so a test scheduler with a manual
 * clock drives them deterministically.
 */
@Getter
public class ClientContext {

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final EventPublisherHelper events;
    private final ChatPulseProperties properties;

    public ClientContext(TaskScheduler scheduler, EventPublisherHelper events, ChatPulseProperties properties) {
        this.scheduler = scheduler;
        this.clock = scheduler.getClock();
        this.events = events;
        this.properties = properties;
    }

    public Instant now() {
        return clock.instant();
    }

    public long nowMillis() {
        return clock.millis();
    }
}
