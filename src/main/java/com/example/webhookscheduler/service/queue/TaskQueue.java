package com.example.webhookscheduler.service.queue;

import com.example.webhookscheduler.exception.DispatchException;

import java.time.Duration;
import java.util.List;

/**
 * Hand-off point between the scheduling core and the webhook workers.
 */
public interface TaskQueue {

    /**
     * Make the task deliverable after {@code delay}.
     *
     * @throws DispatchException when the queue cannot accept the task
     */
    void enqueue(QueuedTask task, Duration delay);

    /**
     * Atomically claim up to {@code max} tasks whose delay has elapsed
     */
    List<QueuedTask> poll(int max);

    /**
     * Number of tasks waiting, due or not
     */
    long size();
}
