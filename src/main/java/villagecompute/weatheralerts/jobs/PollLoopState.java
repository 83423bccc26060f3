/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.jobs;

/**
 * Lifecycle state of the alert poll loop.
 *
 * <p>
 * The loop is {@link #IDLE} between cycles and {@link #RUNNING} for the duration of exactly one cycle. A trigger that
 * arrives while the loop is running is skipped.
 */
public enum PollLoopState {
    IDLE, RUNNING
}
