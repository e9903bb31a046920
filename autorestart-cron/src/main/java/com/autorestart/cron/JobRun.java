package com.autorestart.cron;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One firing of a scheduled job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRun {
    private String jobName;
    private String trigger;
    private Instant scheduledFor;
    private Instant startedAt;
    private Instant finishedAt;
    private long durationMs;
    private boolean success;
    private String error;
}
