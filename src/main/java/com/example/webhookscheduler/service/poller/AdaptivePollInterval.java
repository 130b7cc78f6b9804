package com.example.webhookscheduler.service.poller;

import com.example.webhookscheduler.config.WebhookSchedulerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delay before the next poller tick.
 * <p>
 * With adaptive polling on, every consecutive empty tick doubles the delay, starting at the
 * minimum and capped at the maximum; a tick that finds work resets it to the minimum.
 * Otherwise the delay is the fixed poll interval.
 */
@Component
@RequiredArgsConstructor
public class AdaptivePollInterval {

    private static final int MAX_DOUBLINGS = 20;

    private final WebhookSchedulerProperties properties;

    private final AtomicInteger consecutiveEmptyTicks = new AtomicInteger();

    public void recordTick(int candidates) {
        if (candidates > 0) {
            consecutiveEmptyTicks.set(0);
        } else {
            consecutiveEmptyTicks.updateAndGet(n -> Math.min(n + 1, MAX_DOUBLINGS));
        }
    }

    public Duration currentInterval() {
        var adaptive = properties.getAdaptivePolling();
        if (!adaptive.isEnabled()) {
            return Duration.ofSeconds(properties.getPollIntervalSeconds());
        }
        var seconds = adaptive.getMinIntervalSeconds() << consecutiveEmptyTicks.get();
        return Duration.ofSeconds(Math.min(seconds, adaptive.getMaxIntervalSeconds()));
    }

    int getConsecutiveEmptyTicks() {
        return consecutiveEmptyTicks.get();
    }
}
