package com.autorestart.cron;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded in-memory history of job firings, newest last.
 */
public class JobRunLog {

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Deque<JobRun> runs = new ArrayDeque<>();

    public JobRunLog() {
        this(DEFAULT_CAPACITY);
    }

    public JobRunLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public synchronized void record(JobRun run) {
        runs.addLast(run);
        while (runs.size() > capacity) {
            runs.removeFirst();
        }
    }

    /**
     * Most recent runs of a job, newest first.
     */
    public synchronized List<JobRun> recent(String jobName, int limit) {
        List<JobRun> result = new ArrayList<>();
        Iterator<JobRun> it = runs.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            JobRun run = it.next();
            if (run.getJobName().equals(jobName)) {
                result.add(run);
            }
        }
        return result;
    }

    public Optional<JobRun> last(String jobName) {
        List<JobRun> latest = recent(jobName, 1);
        return latest.isEmpty() ? Optional.empty() : Optional.of(latest.get(0));
    }

    public synchronized int size() {
        return runs.size();
    }
}
