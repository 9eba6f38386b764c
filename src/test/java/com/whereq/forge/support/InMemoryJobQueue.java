package com.whereq.forge.support;

import com.whereq.forge.model.QueuedJob;
import com.whereq.forge.queue.JobQueue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link JobQueue} over a blocking deque, with optional injected pop and push failures
 */
public class InMemoryJobQueue implements JobQueue {

    private final LinkedBlockingDeque<QueuedJob> entries = new LinkedBlockingDeque<>();
    private final AtomicInteger failingPops = new AtomicInteger();
    private final AtomicInteger failingEnqueues = new AtomicInteger();
    private final AtomicInteger failingPushBacks = new AtomicInteger();
    private volatile boolean healthy = true;

    @Override
    public long enqueue(QueuedJob job) {
        if (failingEnqueues.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IllegalStateException("broker refused RPUSH");
        }
        entries.addLast(job);
        return entries.size();
    }

    @Override
    public void pushBack(QueuedJob job) {
        if (failingPushBacks.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IllegalStateException("broker refused LPUSH");
        }
        entries.addFirst(job);
    }

    @Override
    public Optional<QueuedJob> pop(Duration timeout) {
        if (failingPops.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IllegalStateException("broker connection reset");
        }
        try {
            return Optional.ofNullable(entries.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public long size() {
        return entries.size();
    }

    @Override
    public boolean ping() {
        return healthy;
    }

    public void failNextPops(int count) {
        failingPops.set(count);
    }

    public void failNextEnqueues(int count) {
        failingEnqueues.set(count);
    }

    public void failNextPushBacks(int count) {
        failingPushBacks.set(count);
    }

    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    public List<QueuedJob> snapshot() {
        return new ArrayList<>(entries);
    }
}
