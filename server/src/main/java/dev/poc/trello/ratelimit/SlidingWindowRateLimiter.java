package dev.poc.trello.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding window log limiter guarding outbound Trello calls. Every admitted call is recorded; once
 * {@code maxCalls} timestamps fall inside the trailing window, callers wait until the oldest one
 * leaves the window. Calls are delayed, never rejected.
 * <p>
 * Thread-safety: prune, check and append happen under the instance monitor. Waiting happens outside
 * of it so a delayed caller does not hold up the bookkeeping of others.
 */
public final class SlidingWindowRateLimiter {

	private static final Logger logger = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

	private static final Duration MINIMUM_WAIT = Duration.ofMillis(1);

	private final Clock clock;

	private final Sleeper sleeper;

	private final int maxCalls;

	private final Duration window;

	private final ArrayDeque<Instant> admitted = new ArrayDeque<>();

	public SlidingWindowRateLimiter(Clock clock, Sleeper sleeper, int maxCalls, Duration window) {
		if (maxCalls <= 0) {
			throw new IllegalArgumentException("maxCalls <= 0");
		}
		if (window == null || window.isZero() || window.isNegative()) {
			throw new IllegalArgumentException("window must be positive");
		}
		this.clock = Objects.requireNonNull(clock, "clock");
		this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
		this.maxCalls = maxCalls;
		this.window = window;
	}

	/**
	 * Block until one more outbound call fits in the quota, then record it.
	 * @throws InterruptedException if the thread is interrupted while waiting; no call is recorded
	 */
	public void admit() throws InterruptedException {
		while (true) {
			Duration wait = tryAdmit();
			if (wait == null) {
				return;
			}
			logger.warn("Rate limit of {} calls per {} reached, waiting {} ms", this.maxCalls, this.window,
					wait.toMillis());
			this.sleeper.sleep(wait);
		}
	}

	/**
	 * Number of admissions currently inside the window.
	 * @return admitted calls in the trailing window
	 */
	public synchronized int inFlightWindowSize() {
		prune(this.clock.instant());
		return this.admitted.size();
	}

	public int maxCalls() {
		return this.maxCalls;
	}

	public Duration window() {
		return this.window;
	}

	/**
	 * Admit the call if it fits, otherwise report how long to wait before the next attempt.
	 * @return {@code null} when admitted, the wait otherwise
	 */
	private synchronized Duration tryAdmit() {
		Instant now = this.clock.instant();
		prune(now);
		if (this.admitted.size() < this.maxCalls) {
			this.admitted.addLast(now);
			return null;
		}
		Instant oldest = this.admitted.peekFirst();
		Duration wait = Duration.between(now, oldest.plus(this.window));
		return wait.compareTo(MINIMUM_WAIT) < 0 ? MINIMUM_WAIT : wait;
	}

	private void prune(Instant now) {
		Instant cutoff = now.minus(this.window);
		while (!this.admitted.isEmpty() && !this.admitted.peekFirst().isAfter(cutoff)) {
			this.admitted.removeFirst();
		}
	}

}
