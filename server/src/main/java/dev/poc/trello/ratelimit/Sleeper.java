package dev.poc.trello.ratelimit;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Suspends the calling thread. Abstracted so waiting can be observed in tests.
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper THREAD = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

	void sleep(Duration duration) throws InterruptedException;

}
