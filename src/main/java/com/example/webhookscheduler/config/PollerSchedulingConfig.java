package com.example.webhookscheduler.config;

import com.example.webhookscheduler.service.poller.AdaptivePollInterval;
import com.example.webhookscheduler.service.poller.DueSchedulePoller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Clock;

/**
 * Registers the due-schedule poller with a trigger that re-reads the poll interval after
 * every tick, so adaptive polling can stretch or shrink it.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "webhook-scheduler", name = "poller-enabled", havingValue = "true", matchIfMissing = true)
public class PollerSchedulingConfig implements SchedulingConfigurer {

    private final DueSchedulePoller dueSchedulePoller;
    private final AdaptivePollInterval adaptivePollInterval;
    private final Clock clock;

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        log.info("Registering due-schedule poller, initial interval {}", adaptivePollInterval.currentInterval());
        taskRegistrar.addTriggerTask(dueSchedulePoller::tick, triggerContext -> {
            var lastCompletion = triggerContext.lastCompletion();
            var base = lastCompletion != null ? lastCompletion : clock.instant();
            return base.plus(adaptivePollInterval.currentInterval());
        });
    }
}
