package com.github.cowwoc.ratelimit.internal;

import com.github.cowwoc.requirements.java.DefaultJavaRequirements;
import com.github.cowwoc.requirements.java.JavaRequirements;
import org.testng.annotations.Test;

import java.time.Duration;

public final class QuantumSolverTest
{
	private static final JavaRequirements REQUIREMENTS = new DefaultJavaRequirements();

	@Test
	public void lowRateUsesSingleToken()
	{
		QuantumSolver.Solution solution = QuantumSolver.solve(0.5);
		REQUIREMENTS.requireThat(solution.getQuantum(), "solution.getQuantum()").isEqualTo(1L);
		REQUIREMENTS.requireThat(solution.getFillInterval(), "solution.getFillInterval()").
			isEqualTo(Duration.ofSeconds(2));
	}

	@Test
	public void highRateUsesLargerQuantum()
	{
		QuantumSolver.Solution solution = QuantumSolver.solve(4e18);
		REQUIREMENTS.requireThat(solution.getQuantum(), "solution.getQuantum()").isGreaterThan(1L);
		REQUIREMENTS.requireThat(solution.getFillInterval(), "solution.getFillInterval()").
			isGreaterThan(Duration.ZERO);
		double rate = QuantumSolver.getRate(solution.getQuantum(), solution.getFillInterval().toNanos());
		REQUIREMENTS.requireThat(Math.abs(rate - 4e18) / 4e18, "relativeError").
			isLessThanOrEqualTo(QuantumSolver.RATE_MARGIN);
	}

	@Test
	public void rateThatRoundsToOneNanosecond()
	{
		QuantumSolver.Solution solution = QuantumSolver.solve(1e9);
		REQUIREMENTS.requireThat(solution.getQuantum(), "solution.getQuantum()").isEqualTo(1L);
		REQUIREMENTS.requireThat(solution.getFillInterval(), "solution.getFillInterval()").
			isEqualTo(Duration.ofNanos(1));
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void negativeRate()
	{
		QuantumSolver.solve(-1);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void infiniteRate()
	{
		QuantumSolver.solve(Double.POSITIVE_INFINITY);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void rateTooLowToRepresent()
	{
		// Even a single token per Long.MAX_VALUE nanoseconds is too fast
		QuantumSolver.solve(1e-30);
	}
}
