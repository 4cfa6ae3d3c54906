package com.github.cowwoc.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A clock that only moves when told to. Sleeping advances the time instead of blocking.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
final class FakeClock implements Clock
{
	private Instant now;
	private final List<Duration> sleeps = new ArrayList<>();

	/**
	 * @param now the initial time
	 */
	FakeClock(Instant now)
	{
		this.now = now;
	}

	FakeClock()
	{
		this(Instant.parse("2020-01-01T00:00:00Z"));
	}

	@Override
	public synchronized Instant now()
	{
		return now;
	}

	@Override
	public synchronized void sleep(Duration duration)
	{
		sleeps.add(duration);
		now = now.plus(duration);
	}

	/**
	 * Moves the clock forward.
	 *
	 * @param duration the amount of time to advance by
	 */
	public synchronized void advance(Duration duration)
	{
		now = now.plus(duration);
	}

	/**
	 * @return the durations passed to {@link #sleep(Duration)}, in order
	 */
	public synchronized List<Duration> getSleeps()
	{
		return List.copyOf(sleeps);
	}
}
