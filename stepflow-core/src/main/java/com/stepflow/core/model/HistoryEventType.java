package com.stepflow.core.model;

/**
 * Types of events recorded in an execution history.
 * Events are immutable facts appended in order.
 */
public enum HistoryEventType {
    // Execution lifecycle events
    EXECUTION_STARTED,
    EXECUTION_SUCCEEDED,
    EXECUTION_FAILED,
    EXECUTION_ABORTED,
    EXECUTION_TIMED_OUT,

    // State lifecycle events
    STATE_ENTERED,
    STATE_EXITED,
    STATE_FAILED,

    // Task events
    TASK_SCHEDULED,
    TASK_SUCCEEDED,
    TASK_FAILED,
    TASK_TIMED_OUT,

    // Choice events
    CHOICE_SELECTED,

    // Timer events
    WAIT_SCHEDULED,
    TIMER_FIRED,

    // Recovery events
    RETRY_SCHEDULED,
    ERROR_CAUGHT,

    // Parallel events
    PARALLEL_STARTED,
    PARALLEL_SUCCEEDED,
    PARALLEL_FAILED,

    // Map events
    MAP_STARTED,
    MAP_ITERATION_STARTED,
    MAP_ITERATION_SUCCEEDED,
    MAP_ITERATION_FAILED,
    MAP_SUCCEEDED,
    MAP_FAILED
}
