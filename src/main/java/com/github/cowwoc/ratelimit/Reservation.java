package com.github.cowwoc.ratelimit;

import com.github.cowwoc.ratelimit.internal.ToStringBuilder;
import com.github.cowwoc.requirements.java.DefaultJavaRequirements;
import com.github.cowwoc.requirements.java.JavaRequirements;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The result of an attempt to reserve tokens.
 * <p>
 * A successful reservation has already removed the tokens from the bucket. The caller must wait
 * {@link #getWaitTime()} before using them. An unsuccessful reservation did not modify the bucket.
 */
public final class Reservation
{
	private static final JavaRequirements REQUIREMENTS = new DefaultJavaRequirements();
	private final Bucket bucket;
	private final long tokensRequested;
	private final Instant requestedAt;
	private final Instant availableAt;
	private final boolean successful;

	/**
	 * Creates the result of a request to reserve tokens.
	 *
	 * @param bucket          the bucket that the tokens were requested from
	 * @param tokensRequested the number of tokens that were requested
	 * @param requestedAt     the time at which the tokens were requested
	 * @param availableAt     the time at which the requested tokens become available. If the reservation was
	 *                        unsuccessful, the time at which they would have become available.
	 * @param successful      true if the tokens were reserved
	 * @throws NullPointerException     if any of the arguments are null
	 * @throws IllegalArgumentException if {@code tokensRequested} is negative. If
	 *                                  {@code requestedAt > availableAt}.
	 */
	Reservation(Bucket bucket, long tokensRequested, Instant requestedAt, Instant availableAt,
	            boolean successful)
	{
		if (REQUIREMENTS.assertionsAreEnabled())
		{
			REQUIREMENTS.requireThat(bucket, "bucket").isNotNull();
			REQUIREMENTS.requireThat(tokensRequested, "tokensRequested").isNotNegative();
			REQUIREMENTS.requireThat(requestedAt, "requestedAt").isNotNull();
			REQUIREMENTS.requireThat(availableAt, "availableAt").
				isGreaterThanOrEqualTo(requestedAt, "requestedAt");
		}
		this.bucket = bucket;
		this.tokensRequested = tokensRequested;
		this.requestedAt = requestedAt;
		this.availableAt = availableAt;
		this.successful = successful;
	}

	/**
	 * Returns the bucket that the tokens were requested from.
	 *
	 * @return the bucket that the tokens were requested from
	 */
	public Bucket getBucket()
	{
		return bucket;
	}

	/**
	 * Returns the number of tokens that were requested.
	 *
	 * @return the number of tokens that were requested
	 */
	public long getTokensRequested()
	{
		return tokensRequested;
	}

	/**
	 * Returns true if the tokens were reserved.
	 *
	 * @return false if the tokens would not have become available within the maximum waiting time
	 */
	public boolean isSuccessful()
	{
		return successful;
	}

	/**
	 * Returns the time at which the tokens were requested.
	 *
	 * @return the time at which the tokens were requested
	 */
	public Instant getRequestedAt()
	{
		return requestedAt;
	}

	/**
	 * Returns the time at which the requested tokens become available. If the reservation was unsuccessful,
	 * returns the time at which they would have become available had the request been allowed to wait.
	 *
	 * @return the time at which the requested tokens become available
	 */
	public Instant getAvailableAt()
	{
		return availableAt;
	}

	/**
	 * Returns the amount of time that the caller must wait before using the reserved tokens.
	 *
	 * @return {@code Duration.ZERO} if the reservation was unsuccessful
	 */
	public Duration getWaitTime()
	{
		if (!successful)
			return Duration.ZERO;
		return getAvailableIn();
	}

	/**
	 * Returns the amount of time between the request and the time that the tokens become available, whether
	 * or not the reservation was successful.
	 *
	 * @return the amount of time until the requested number of tokens become available
	 */
	public Duration getAvailableIn()
	{
		return Duration.between(requestedAt, availableAt);
	}

	@Override
	public boolean equals(Object o)
	{
		if (!(o instanceof Reservation other))
			return false;
		return other.bucket == bucket && other.tokensRequested == tokensRequested &&
			other.successful == successful && other.requestedAt.equals(requestedAt) &&
			other.availableAt.equals(availableAt);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(System.identityHashCode(bucket), tokensRequested, requestedAt, availableAt,
			successful);
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(Reservation.class).
			add("successful", successful).
			add("tokensRequested", tokensRequested).
			add("requestedAt", requestedAt).
			add("availableAt", availableAt).
			add("waitTime", getWaitTime()).
			toString();
	}
}
