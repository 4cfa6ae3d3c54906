package com.github.cowwoc.ratelimit.internal;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * Arithmetic that clamps to the minimum or maximum value of a type instead of wrapping around or throwing
 * an exception.
 */
public final class SaturatedMath
{
	/**
	 * The longest duration that can be represented.
	 */
	public static final Duration MAXIMUM_DURATION = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);
	/**
	 * The most negative duration that can be represented.
	 */
	public static final Duration MINIMUM_DURATION = Duration.ofSeconds(Long.MIN_VALUE);

	/**
	 * Prevent construction.
	 */
	private SaturatedMath()
	{
	}

	/**
	 * Adds two numbers, returning {@code Long.MAX_VALUE} or {@code Long.MIN_VALUE} if the sum would
	 * overflow or underflow, respectively.
	 *
	 * @param first  the first number
	 * @param second the second number
	 * @return the sum
	 */
	public static long add(long first, long second)
	{
		long result = first + second;
		if (second >= 0)
		{
			if (result >= first)
				return result;
			return Long.MAX_VALUE;
		}
		if (result < first)
			return result;
		return Long.MIN_VALUE;
	}

	/**
	 * Subtracts two numbers, returning {@code Long.MAX_VALUE} or {@code Long.MIN_VALUE} if the difference
	 * would overflow or underflow, respectively.
	 *
	 * @param first  the number to subtract from
	 * @param second the number to subtract
	 * @return the difference
	 */
	public static long subtract(long first, long second)
	{
		long result = first - second;
		if (second >= 0)
		{
			if (result <= first)
				return result;
			return Long.MIN_VALUE;
		}
		if (result > first)
			return result;
		return Long.MAX_VALUE;
	}

	/**
	 * Multiplies two numbers, returning {@code Long.MAX_VALUE} or {@code Long.MIN_VALUE} if the product
	 * would overflow or underflow, respectively.
	 *
	 * @param first  the first number
	 * @param second the second number
	 * @return the product
	 */
	public static long multiply(long first, long second)
	{
		long high = Math.multiplyHigh(first, second);
		long low = first * second;
		// The product fits in a long if the high word is the sign extension of the low word
		if ((high == 0 && low >= 0) || (high == -1 && low < 0))
			return low;
		if ((first < 0) == (second < 0))
			return Long.MAX_VALUE;
		return Long.MIN_VALUE;
	}

	/**
	 * Returns the number of nanoseconds from {@code start} to {@code end}.
	 *
	 * @param start the start of the period
	 * @param end   the end of the period
	 * @return the number of nanoseconds (negative if {@code end} is before {@code start})
	 * @throws NullPointerException if any of the arguments are null
	 */
	public static long nanosBetween(Instant start, Instant end)
	{
		return toNanos(Duration.between(start, end));
	}

	/**
	 * Converts a duration to nanoseconds.
	 *
	 * @param duration a duration
	 * @return the number of nanoseconds in {@code duration}
	 * @throws NullPointerException if {@code duration} is null
	 */
	public static long toNanos(Duration duration)
	{
		try
		{
			return duration.toNanos();
		}
		catch (ArithmeticException e)
		{
			if (duration.isNegative())
				return Long.MIN_VALUE;
			return Long.MAX_VALUE;
		}
	}

	/**
	 * Multiplies a duration, returning {@link #MAXIMUM_DURATION} or {@link #MINIMUM_DURATION} if the product
	 * would overflow or underflow, respectively.
	 *
	 * @param duration     a duration
	 * @param multiplicand the value to multiply by
	 * @return the product
	 * @throws NullPointerException if {@code duration} is null
	 */
	public static Duration multiply(Duration duration, long multiplicand)
	{
		try
		{
			return duration.multipliedBy(multiplicand);
		}
		catch (ArithmeticException e)
		{
			if (duration.isNegative() == (multiplicand < 0))
				return MAXIMUM_DURATION;
			return MINIMUM_DURATION;
		}
	}

	/**
	 * Adds a duration to an instant, returning {@link Instant#MAX} or {@link Instant#MIN} if the result would
	 * fall outside the supported range of instants.
	 *
	 * @param instant  an instant
	 * @param duration the duration to add
	 * @return the sum
	 * @throws NullPointerException if any of the arguments are null
	 */
	public static Instant plus(Instant instant, Duration duration)
	{
		try
		{
			return instant.plus(duration);
		}
		catch (DateTimeException | ArithmeticException e)
		{
			if (duration.isNegative())
				return Instant.MIN;
			return Instant.MAX;
		}
	}
}
