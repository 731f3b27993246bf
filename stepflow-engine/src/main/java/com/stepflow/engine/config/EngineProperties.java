package com.stepflow.engine.config;

import com.stepflow.core.model.state.TaskSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the interpreter, bound from {@code stepflow.engine.*}.
 */
@ConfigurationProperties(prefix = "stepflow.engine")
public class EngineProperties {

    /**
     * Threads driving interpreter loops.
     */
    private int workerThreads = 8;

    /**
     * Threads firing Wait and Retry timers.
     */
    private int timerThreads = 2;

    /**
     * Threads running synchronous resource handlers.
     */
    private int resourceThreads = 10;

    /**
     * Bound on concurrent Map iterations when MaxConcurrency is 0 or absent.
     */
    private int defaultMapConcurrency = 40;

    /**
     * Timeout of Task states that declare none.
     */
    private int defaultTaskTimeoutSeconds = TaskSpec.DEFAULT_TIMEOUT_SECONDS;

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int getTimerThreads() {
        return timerThreads;
    }

    public void setTimerThreads(int timerThreads) {
        this.timerThreads = timerThreads;
    }

    public int getResourceThreads() {
        return resourceThreads;
    }

    public void setResourceThreads(int resourceThreads) {
        this.resourceThreads = resourceThreads;
    }

    public int getDefaultMapConcurrency() {
        return defaultMapConcurrency;
    }

    public void setDefaultMapConcurrency(int defaultMapConcurrency) {
        this.defaultMapConcurrency = defaultMapConcurrency;
    }

    public int getDefaultTaskTimeoutSeconds() {
        return defaultTaskTimeoutSeconds;
    }

    public void setDefaultTaskTimeoutSeconds(int defaultTaskTimeoutSeconds) {
        this.defaultTaskTimeoutSeconds = defaultTaskTimeoutSeconds;
    }
}
