package com.github.cowwoc.ratelimit;

import com.github.cowwoc.ratelimit.internal.SystemClock;

import java.time.Duration;
import java.time.Instant;

/**
 * The source of time used by a {@link Bucket}.
 * <p>
 * The bucket's accounting never reads the time on its own. Only the public methods of {@code Bucket} consult a
 * clock, which makes it possible to drive a bucket through time deterministically.
 */
public interface Clock
{
	/**
	 * Returns a clock backed by the system time.
	 *
	 * @return a clock backed by the system time
	 */
	static Clock system()
	{
		return SystemClock.INSTANCE;
	}

	/**
	 * Returns the current time.
	 *
	 * @return the current time
	 */
	Instant now();

	/**
	 * Suspends the current thread.
	 *
	 * @param duration the amount of time to sleep
	 * @throws NullPointerException if {@code duration} is null
	 * @throws InterruptedException if the thread is interrupted while sleeping
	 */
	void sleep(Duration duration) throws InterruptedException;
}
