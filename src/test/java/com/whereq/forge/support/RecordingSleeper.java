package com.whereq.forge.support;

import com.whereq.forge.worker.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that returns at once and records what it was asked to wait.
 * An optional hook runs inside the sleep; if it interrupts the sleeping thread the sleep
 * ends with {@link InterruptedException}, like a real one would.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private volatile Runnable onSleep;

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        sleeps.add(duration);
        Runnable hook = onSleep;
        if (hook != null) {
            hook.run();
        }
        if (Thread.interrupted()) {
            throw new InterruptedException("sleep interrupted");
        }
    }

    public void onSleep(Runnable hook) {
        this.onSleep = hook;
    }

    public List<Duration> sleeps() {
        return sleeps;
    }
}
