package com.project.image.anvil.config;

import com.project.image.anvil.service.JobScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the scheduler workers with the Spring context and stops them on shutdown.
 */
public class JobSchedulerLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;
    private volatile boolean running = false;

    public JobSchedulerLifecycle(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
