package com.sortableid.application.port.out;

import java.time.Duration;

/**
 * Port for pausing the calling thread while waiting for the next time bucket.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

    void sleep(Duration duration) throws InterruptedException;
}
