package com.cellgraph.app.services;

import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Default {@link Sleeper}: blocks the calling thread.
 */
@Component
public class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(double seconds) throws InterruptedException {
        TimeUnit.NANOSECONDS.sleep((long) (seconds * 1_000_000_000L));
    }
}
