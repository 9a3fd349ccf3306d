package com.chatpulse.queue;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class QueueStats {

    /** Queued operations per priority band (1..5). */
    private final Map<Integer, Integer> bandSizes;

    private final int inFlight;
    private final int awaitingRetry;
    private final int total;
    private final int maxSize;
    private final boolean paused;

    private final long processed;
    private final long failed;
    private final long retried;
    private final long dropped;
}
