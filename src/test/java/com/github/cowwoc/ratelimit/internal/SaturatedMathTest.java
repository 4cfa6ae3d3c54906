package com.github.cowwoc.ratelimit.internal;

import com.github.cowwoc.requirements.java.DefaultJavaRequirements;
import com.github.cowwoc.requirements.java.JavaRequirements;
import org.testng.annotations.Test;

import java.time.Duration;
import java.time.Instant;

public final class SaturatedMathTest
{
	private static final JavaRequirements REQUIREMENTS = new DefaultJavaRequirements();

	@Test
	public void add()
	{
		REQUIREMENTS.requireThat(SaturatedMath.add(2, 3), "add(2, 3)").isEqualTo(5L);
		REQUIREMENTS.requireThat(SaturatedMath.add(Long.MAX_VALUE, 1), "add(MAX, 1)").isEqualTo(Long.MAX_VALUE);
		REQUIREMENTS.requireThat(SaturatedMath.add(Long.MIN_VALUE, -1), "add(MIN, -1)").
			isEqualTo(Long.MIN_VALUE);
		REQUIREMENTS.requireThat(SaturatedMath.add(Long.MAX_VALUE, Long.MIN_VALUE), "add(MAX, MIN)").
			isEqualTo(-1L);
	}

	@Test
	public void subtract()
	{
		REQUIREMENTS.requireThat(SaturatedMath.subtract(2, 3), "subtract(2, 3)").isEqualTo(-1L);
		REQUIREMENTS.requireThat(SaturatedMath.subtract(Long.MIN_VALUE, 1), "subtract(MIN, 1)").
			isEqualTo(Long.MIN_VALUE);
		REQUIREMENTS.requireThat(SaturatedMath.subtract(0, Long.MIN_VALUE), "subtract(0, MIN)").
			isEqualTo(Long.MAX_VALUE);
		REQUIREMENTS.requireThat(SaturatedMath.subtract(-1, Long.MIN_VALUE), "subtract(-1, MIN)").
			isEqualTo(Long.MAX_VALUE);
		REQUIREMENTS.requireThat(SaturatedMath.subtract(-Long.MAX_VALUE, Long.MAX_VALUE), "subtract(-MAX, MAX)").
			isEqualTo(Long.MIN_VALUE);
	}

	@Test
	public void multiply()
	{
		REQUIREMENTS.requireThat(SaturatedMath.multiply(6, 7), "multiply(6, 7)").isEqualTo(42L);
		REQUIREMENTS.requireThat(SaturatedMath.multiply(-6, 7), "multiply(-6, 7)").isEqualTo(-42L);
		REQUIREMENTS.requireThat(SaturatedMath.multiply(1L << 62, 2), "multiply(2^62, 2)").
			isEqualTo(Long.MAX_VALUE);
		REQUIREMENTS.requireThat(SaturatedMath.multiply(1L << 62, -2), "multiply(2^62, -2)").
			isEqualTo(Long.MIN_VALUE);
		REQUIREMENTS.requireThat(SaturatedMath.multiply(-(1L << 62), -4), "multiply(-2^62, -4)").
			isEqualTo(Long.MAX_VALUE);
		REQUIREMENTS.requireThat(SaturatedMath.multiply(Long.MAX_VALUE, 1), "multiply(MAX, 1)").
			isEqualTo(Long.MAX_VALUE);
	}

	@Test
	public void nanosBetween()
	{
		Instant start = Instant.parse("2020-01-01T00:00:00Z");
		REQUIREMENTS.requireThat(SaturatedMath.nanosBetween(start, start.plusMillis(3)), "nanosBetween()").
			isEqualTo(3_000_000L);
		REQUIREMENTS.requireThat(SaturatedMath.nanosBetween(start, start.minusNanos(5)), "nanosBetween()").
			isEqualTo(-5L);
		REQUIREMENTS.requireThat(SaturatedMath.nanosBetween(start, start.plus(Duration.ofDays(365 * 1000))),
			"nanosBetween()").isEqualTo(Long.MAX_VALUE);
		REQUIREMENTS.requireThat(SaturatedMath.nanosBetween(start, start.minus(Duration.ofDays(365 * 1000))),
			"nanosBetween()").isEqualTo(Long.MIN_VALUE);
	}

	@Test
	public void multiplyDuration()
	{
		Duration day = Duration.ofDays(1);
		REQUIREMENTS.requireThat(SaturatedMath.multiply(day, 200_000), "multiply(day, 200_000)").
			isEqualTo(Duration.ofDays(200_000));
		REQUIREMENTS.requireThat(SaturatedMath.multiply(day, Long.MAX_VALUE), "multiply(day, MAX)").
			isEqualTo(SaturatedMath.MAXIMUM_DURATION);
		REQUIREMENTS.requireThat(SaturatedMath.multiply(day, Long.MIN_VALUE), "multiply(day, MIN)").
			isEqualTo(SaturatedMath.MINIMUM_DURATION);
		REQUIREMENTS.requireThat(SaturatedMath.multiply(day.negated(), Long.MIN_VALUE), "multiply(-day, MIN)").
			isEqualTo(SaturatedMath.MAXIMUM_DURATION);
	}

	@Test
	public void plusInstant()
	{
		Instant start = Instant.parse("2020-01-01T00:00:00Z");
		REQUIREMENTS.requireThat(SaturatedMath.plus(start, Duration.ofDays(1)), "plus(start, day)").
			isEqualTo(Instant.parse("2020-01-02T00:00:00Z"));
		REQUIREMENTS.requireThat(SaturatedMath.plus(start, SaturatedMath.MAXIMUM_DURATION), "plus(start, MAX)").
			isEqualTo(Instant.MAX);
		REQUIREMENTS.requireThat(SaturatedMath.plus(start, Duration.ofSeconds(Instant.MAX.getEpochSecond())),
			"plus(start, Instant.MAX)").isEqualTo(Instant.MAX);
		REQUIREMENTS.requireThat(SaturatedMath.plus(start, SaturatedMath.MINIMUM_DURATION), "plus(start, MIN)").
			isEqualTo(Instant.MIN);
	}
}
