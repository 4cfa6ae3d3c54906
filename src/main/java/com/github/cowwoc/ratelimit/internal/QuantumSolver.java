package com.github.cowwoc.ratelimit.internal;

import com.github.cowwoc.requirements.java.DefaultJavaRequirements;
import com.github.cowwoc.requirements.java.JavaRequirements;

import java.time.Duration;

/**
 * Approximates a fractional rate using an integer number of tokens added every fill interval.
 * <p>
 * A fill interval cannot be shorter than one nanosecond, so high rates require more than one token per
 * interval. Low rates are represented using a single token and a long interval.
 */
public final class QuantumSolver
{
	/**
	 * The maximum relative error between the requested rate and the rate of the solution.
	 */
	public static final double RATE_MARGIN = 0.01;
	/**
	 * The quantum at which the search gives up.
	 */
	private static final long MAXIMUM_QUANTUM = 1L << 50;
	private static final double NANOS_PER_SECOND = 1e9;
	private static final JavaRequirements REQUIREMENTS = new DefaultJavaRequirements();

	/**
	 * Prevent construction.
	 */
	private QuantumSolver()
	{
	}

	/**
	 * Finds the smallest quantum (and its associated fill interval) whose rate is within {@link #RATE_MARGIN}
	 * of {@code rate}.
	 *
	 * @param rate the number of tokens per second
	 * @return the solution
	 * @throws IllegalArgumentException if {@code rate} is not a positive finite number, or if no solution
	 *                                  could be found
	 */
	public static Solution solve(double rate)
	{
		REQUIREMENTS.requireThat(rate, "rate").isFinite().isPositive();
		for (long quantum = 1; quantum < MAXIMUM_QUANTUM; quantum = nextQuantum(quantum))
		{
			long fillIntervalNanos = Math.round(NANOS_PER_SECOND * quantum / rate);
			if (fillIntervalNanos <= 0)
				continue;
			double actualRate = getRate(quantum, fillIntervalNanos);
			if (Math.abs(actualRate - rate) / rate <= RATE_MARGIN)
				return new Solution(quantum, Duration.ofNanos(fillIntervalNanos));
		}
		throw new IllegalArgumentException("cannot find suitable quantum for rate " + rate);
	}

	/**
	 * Returns the number of tokens added per second.
	 *
	 * @param quantum           the number of tokens added every fill interval
	 * @param fillIntervalNanos the number of nanoseconds between fills
	 * @return the number of tokens added per second
	 */
	public static double getRate(long quantum, long fillIntervalNanos)
	{
		return NANOS_PER_SECOND * quantum / fillIntervalNanos;
	}

	/**
	 * @param quantum the current quantum
	 * @return the next quantum to try, roughly 10% larger than {@code quantum}
	 */
	private static long nextQuantum(long quantum)
	{
		long result = quantum * 11 / 10;
		if (result == quantum)
			++result;
		return result;
	}

	/**
	 * A quantum and the fill interval that approximate a rate.
	 */
	public static final class Solution
	{
		private final long quantum;
		private final Duration fillInterval;

		/**
		 * @param quantum      the number of tokens added every {@code fillInterval}
		 * @param fillInterval the time between fills
		 */
		Solution(long quantum, Duration fillInterval)
		{
			this.quantum = quantum;
			this.fillInterval = fillInterval;
		}

		/**
		 * Returns the number of tokens added every fill interval.
		 *
		 * @return the number of tokens added every fill interval
		 */
		public long getQuantum()
		{
			return quantum;
		}

		/**
		 * Returns the time between fills.
		 *
		 * @return the time between fills
		 */
		public Duration getFillInterval()
		{
			return fillInterval;
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Solution.class).
				add("quantum", quantum).
				add("fillInterval", fillInterval).
				toString();
		}
	}
}
