package com.github.cowwoc.ratelimit.internal;

import com.github.cowwoc.ratelimit.Clock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * A clock backed by the system time.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public enum SystemClock implements Clock
{
	INSTANCE;

	@Override
	public Instant now()
	{
		return Instant.now();
	}

	@Override
	public void sleep(Duration duration) throws InterruptedException
	{
		// Durations longer than Long.MAX_VALUE nanoseconds (~292 years) are slept in chunks
		Duration timeLeft = duration;
		while (timeLeft.compareTo(Duration.ZERO) > 0)
		{
			long nanos = SaturatedMath.toNanos(timeLeft);
			TimeUnit.NANOSECONDS.sleep(nanos);
			timeLeft = timeLeft.minusNanos(nanos);
		}
	}

	@Override
	public String toString()
	{
		return "SystemClock";
	}
}
