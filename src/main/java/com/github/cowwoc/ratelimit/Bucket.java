package com.github.cowwoc.ratelimit;

import com.github.cowwoc.ratelimit.internal.CloseableLock;
import com.github.cowwoc.ratelimit.internal.ExclusiveLock;
import com.github.cowwoc.ratelimit.internal.QuantumSolver;
import com.github.cowwoc.ratelimit.internal.QuantumSolver.Solution;
import com.github.cowwoc.ratelimit.internal.SaturatedMath;
import com.github.cowwoc.ratelimit.internal.ToStringBuilder;
import com.github.cowwoc.requirements.annotation.CheckReturnValue;
import com.github.cowwoc.requirements.java.DefaultJavaRequirements;
import com.github.cowwoc.requirements.java.JavaRequirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A token bucket that fills at a fixed rate up to a maximum capacity.
 * <p>
 * Every {@code fillInterval}, {@code quantum} tokens are added to the bucket. Tokens that would exceed the
 * bucket's capacity are discarded. Tokens may be reserved before they are added, in which case the bucket goes
 * into debt and the caller is told how long to wait before using them.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class Bucket
{
	/**
	 * A maximum waiting time that never causes a reservation to fail.
	 */
	public static final Duration UNBOUNDED = SaturatedMath.MAXIMUM_DURATION;
	private static final JavaRequirements REQUIREMENTS = new DefaultJavaRequirements();

	private final Instant startTime;
	private final long capacity;
	private final long quantum;
	private final Duration fillInterval;
	private final long fillIntervalNanos;
	private final Clock clock;
	private final List<BucketListener> listeners;
	/**
	 * The number of tokens in the bucket as of {@code latestTick}. Negative values indicate that tokens have
	 * been reserved before they were added.
	 */
	long availableTokens;
	/**
	 * The number of fill intervals between {@code startTime} and the last time that {@code availableTokens}
	 * was updated.
	 */
	long latestTick;
	/**
	 * A lock over this object's state. See the {@link com.github.cowwoc.ratelimit.internal locking policy}
	 * for more details.
	 */
	private final ExclusiveLock lock = new ExclusiveLock();
	private final Logger log = LoggerFactory.getLogger(Bucket.class);

	/**
	 * Creates a bucket that adds one token every {@code fillInterval}.
	 *
	 * @param fillInterval the amount of time between fills
	 * @param capacity     the maximum number of tokens that the bucket may hold
	 * @return a new bucket that is initially full
	 * @throws NullPointerException     if {@code fillInterval} is null
	 * @throws IllegalArgumentException if {@code fillInterval} or {@code capacity} are negative or zero
	 */
	public static Bucket newLimiter(Duration fillInterval, long capacity)
	{
		return newLimiterWithQuantum(fillInterval, 1, capacity, Clock.system());
	}

	/**
	 * Creates a bucket that adds one token every {@code fillInterval}.
	 *
	 * @param fillInterval the amount of time between fills
	 * @param capacity     the maximum number of tokens that the bucket may hold
	 * @param clock        the source of time
	 * @return a new bucket that is initially full
	 * @throws NullPointerException     if {@code fillInterval} or {@code clock} are null
	 * @throws IllegalArgumentException if {@code fillInterval} or {@code capacity} are negative or zero
	 */
	public static Bucket newLimiter(Duration fillInterval, long capacity, Clock clock)
	{
		return newLimiterWithQuantum(fillInterval, 1, capacity, clock);
	}

	/**
	 * Creates a bucket that adds {@code quantum} tokens every {@code fillInterval}.
	 *
	 * @param fillInterval the amount of time between fills
	 * @param quantum      the number of tokens to add every {@code fillInterval}
	 * @param capacity     the maximum number of tokens that the bucket may hold
	 * @return a new bucket that is initially full
	 * @throws NullPointerException     if {@code fillInterval} is null
	 * @throws IllegalArgumentException if any of the arguments are negative or zero
	 */
	public static Bucket newLimiterWithQuantum(Duration fillInterval, long quantum, long capacity)
	{
		return newLimiterWithQuantum(fillInterval, quantum, capacity, Clock.system());
	}

	/**
	 * Creates a bucket that adds {@code quantum} tokens every {@code fillInterval}.
	 *
	 * @param fillInterval the amount of time between fills
	 * @param quantum      the number of tokens to add every {@code fillInterval}
	 * @param capacity     the maximum number of tokens that the bucket may hold
	 * @param clock        the source of time
	 * @return a new bucket that is initially full
	 * @throws NullPointerException     if {@code fillInterval} or {@code clock} are null
	 * @throws IllegalArgumentException if any of the numeric arguments are negative or zero
	 */
	public static Bucket newLimiterWithQuantum(Duration fillInterval, long quantum, long capacity, Clock clock)
	{
		return builder().
			fillInterval(fillInterval).
			quantum(quantum).
			capacity(capacity).
			clock(clock).
			build();
	}

	/**
	 * Creates a bucket that fills at approximately {@code rate} tokens per second. The actual rate is within
	 * 1% of the requested rate.
	 *
	 * @param rate     the number of tokens to add per second
	 * @param capacity the maximum number of tokens that the bucket may hold
	 * @return a new bucket that is initially full
	 * @throws IllegalArgumentException if {@code rate} is not a positive finite number, or it cannot be
	 *                                  approximated. If {@code capacity} is negative or zero.
	 */
	public static Bucket newLimiterWithRate(double rate, long capacity)
	{
		return newLimiterWithRate(rate, capacity, Clock.system());
	}

	/**
	 * Creates a bucket that fills at approximately {@code rate} tokens per second. The actual rate is within
	 * 1% of the requested rate.
	 *
	 * @param rate     the number of tokens to add per second
	 * @param capacity the maximum number of tokens that the bucket may hold
	 * @param clock    the source of time
	 * @return a new bucket that is initially full
	 * @throws NullPointerException     if {@code clock} is null
	 * @throws IllegalArgumentException if {@code rate} is not a positive finite number, or it cannot be
	 *                                  approximated. If {@code capacity} is negative or zero.
	 */
	public static Bucket newLimiterWithRate(double rate, long capacity, Clock clock)
	{
		return builder().
			rate(rate).
			capacity(capacity).
			clock(clock).
			build();
	}

	/**
	 * Builds a new bucket.
	 *
	 * @return a Bucket builder
	 */
	@CheckReturnValue
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new bucket that is initially full.
	 *
	 * @param fillInterval the amount of time between fills
	 * @param quantum      the number of tokens to add every {@code fillInterval}
	 * @param capacity     the maximum number of tokens that the bucket may hold
	 * @param clock        the source of time
	 * @param listeners    the event listeners associated with this bucket
	 */
	private Bucket(Duration fillInterval, long quantum, long capacity, Clock clock,
	               List<BucketListener> listeners)
	{
		// Assume that all preconditions are enforced by Builder
		this.fillInterval = fillInterval;
		this.fillIntervalNanos = SaturatedMath.toNanos(fillInterval);
		this.quantum = quantum;
		this.capacity = capacity;
		this.clock = clock;
		this.listeners = List.copyOf(listeners);
		this.startTime = clock.now();
		this.availableTokens = capacity;
		this.latestTick = 0;
	}

	/**
	 * Returns the time that the bucket was created. Fill intervals are measured relative to this time.
	 *
	 * @return the time that the bucket was created
	 */
	public Instant getStartTime()
	{
		return startTime;
	}

	/**
	 * Returns the maximum number of tokens that the bucket may hold.
	 *
	 * @return the maximum number of tokens that the bucket may hold
	 */
	public long getCapacity()
	{
		return capacity;
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
	 * Returns the amount of time between fills.
	 *
	 * @return the amount of time between fills
	 */
	public Duration getFillInterval()
	{
		return fillInterval;
	}

	/**
	 * Returns the rate at which tokens are added to the bucket, regardless of the number of tokens that are
	 * currently available.
	 *
	 * @return the number of tokens added per second
	 */
	public double getRate()
	{
		return QuantumSolver.getRate(quantum, fillIntervalNanos);
	}

	/**
	 * Returns the source of time used by this bucket.
	 *
	 * @return the source of time used by this bucket
	 */
	public Clock getClock()
	{
		return clock;
	}

	/**
	 * Returns the event listeners associated with this bucket.
	 *
	 * @return an unmodifiable list
	 */
	public List<BucketListener> getListeners()
	{
		return listeners;
	}

	/**
	 * Returns the number of tokens that are available. The value is negative if tokens were reserved before
	 * being added to the bucket.
	 *
	 * @return the number of available tokens
	 */
	public long available()
	{
		return available(clock.now());
	}

	/**
	 * Reserves tokens, waiting as long as necessary for them to become available. The tokens are removed from
	 * the bucket immediately, but the caller must wait for the returned duration before using them.
	 *
	 * @param count the number of tokens to reserve
	 * @return the amount of time to wait before the tokens may be used
	 * @throws IllegalArgumentException if {@code count} is negative
	 */
	@CheckReturnValue
	public Duration take(long count)
	{
		return reserve(clock.now(), count, UNBOUNDED).getWaitTime();
	}

	/**
	 * Reserves tokens, only if they become available within {@code maxWait}. If the tokens would not become
	 * available in time, the bucket is left unchanged.
	 *
	 * @param count   the number of tokens to reserve
	 * @param maxWait the maximum amount of time that the caller is willing to wait
	 * @return the result of the operation
	 * @throws NullPointerException     if {@code maxWait} is null
	 * @throws IllegalArgumentException if {@code count} or {@code maxWait} are negative
	 */
	@CheckReturnValue
	public Reservation takeMaxDuration(long count, Duration maxWait)
	{
		return reserve(clock.now(), count, maxWait);
	}

	/**
	 * Consumes up to {@code count} tokens that are available at the time of invocation, without waiting.
	 *
	 * @param count the maximum number of tokens to consume
	 * @return the number of tokens that were consumed ({@code 0} to {@code count})
	 * @throws IllegalArgumentException if {@code count} is negative
	 */
	@CheckReturnValue
	public long takeAvailable(long count)
	{
		return consumeAvailable(clock.now(), count);
	}

	/**
	 * Reserves tokens and blocks until they become available.
	 *
	 * @param count the number of tokens to consume
	 * @throws IllegalArgumentException if {@code count} is negative
	 * @throws InterruptedException     if the thread is interrupted while waiting for tokens to become
	 *                                  available. The tokens remain reserved.
	 */
	public void waitFor(long count) throws InterruptedException
	{
		Reservation reservation = reserve(clock.now(), count, UNBOUNDED);
		sleepUntilAvailable(reservation);
	}

	/**
	 * Reserves tokens and blocks until they become available, only if they become available within
	 * {@code maxWait}. If the tokens would not become available in time, returns immediately without modifying
	 * the bucket.
	 *
	 * @param count   the number of tokens to consume
	 * @param maxWait the maximum amount of time that the caller is willing to wait
	 * @return true if the tokens were consumed
	 * @throws NullPointerException     if {@code maxWait} is null
	 * @throws IllegalArgumentException if {@code count} or {@code maxWait} are negative
	 * @throws InterruptedException     if the thread is interrupted while waiting for tokens to become
	 *                                  available. The tokens remain reserved.
	 */
	public boolean waitForMaxDuration(long count, Duration maxWait) throws InterruptedException
	{
		Reservation reservation = reserve(clock.now(), count, maxWait);
		if (!reservation.isSuccessful())
			return false;
		sleepUntilAvailable(reservation);
		return true;
	}

	/**
	 * Sleeps until reserved tokens become available.
	 *
	 * @param reservation a successful reservation
	 * @throws InterruptedException if the thread is interrupted while sleeping
	 */
	private void sleepUntilAvailable(Reservation reservation) throws InterruptedException
	{
		if (REQUIREMENTS.assertionsAreEnabled())
			REQUIREMENTS.requireThat(lock.isHeldByCurrentThread(), "lock.isHeldByCurrentThread()").isFalse();
		Duration waitTime = reservation.getWaitTime();
		if (waitTime.isZero())
			return;
		for (BucketListener listener : listeners)
		{
			listener.beforeSleep(this, reservation.getTokensRequested(), reservation.getRequestedAt(),
				reservation.getAvailableAt());
		}
		log.debug("Sleeping {}. State before sleep: {}", waitTime, this);
		clock.sleep(waitTime);
	}

	/**
	 * Returns the number of fill intervals that have elapsed since the bucket was created.
	 *
	 * @param now the current time
	 * @return the number of whole fill intervals between {@code startTime} and {@code now} (negative if
	 * {@code now} is before {@code startTime})
	 */
	long currentTick(Instant now)
	{
		return Math.floorDiv(SaturatedMath.nanosBetween(startTime, now), fillIntervalNanos);
	}

	/**
	 * Adds the tokens that were filled between {@code latestTick} and {@code tick}. Tokens that do not fit
	 * into the bucket are discarded.
	 *
	 * @param tick the current tick
	 */
	void adjust(long tick)
	{
		if (REQUIREMENTS.assertionsAreEnabled())
			REQUIREMENTS.requireThat(lock.isHeldByCurrentThread(), "lock.isHeldByCurrentThread()").isTrue();
		if (tick <= latestTick)
			return;
		long ticksElapsed = tick - latestTick;
		latestTick = tick;
		if (availableTokens >= capacity)
			return;
		long tokensToAdd = SaturatedMath.multiply(ticksElapsed, quantum);
		availableTokens = Math.min(capacity, SaturatedMath.add(availableTokens, tokensToAdd));
	}

	/**
	 * Returns the number of available tokens at a point in time.
	 *
	 * @param now the current time
	 * @return the number of available tokens (negative if tokens were reserved before being added)
	 * @throws NullPointerException if {@code now} is null
	 */
	long available(Instant now)
	{
		REQUIREMENTS.requireThat(now, "now").isNotNull();
		try (CloseableLock ignored = lock.lock())
		{
			adjust(currentTick(now));
			return availableTokens;
		}
	}

	/**
	 * Reserves tokens at a point in time.
	 *
	 * @param now     the current time
	 * @param count   the number of tokens to reserve
	 * @param maxWait the maximum amount of time that the caller is willing to wait
	 * @return the result of the operation
	 * @throws NullPointerException     if {@code now} or {@code maxWait} are null
	 * @throws IllegalArgumentException if {@code count} or {@code maxWait} are negative
	 */
	Reservation reserve(Instant now, long count, Duration maxWait)
	{
		REQUIREMENTS.requireThat(now, "now").isNotNull();
		REQUIREMENTS.requireThat(count, "count").isNotNegative();
		REQUIREMENTS.requireThat(maxWait, "maxWait").isGreaterThanOrEqualTo(Duration.ZERO);
		if (count == 0)
			return new Reservation(this, count, now, now, true);
		try (CloseableLock ignored = lock.lock())
		{
			long tick = currentTick(now);
			adjust(tick);
			long tokensLeft = SaturatedMath.subtract(availableTokens, count);
			if (tokensLeft >= 0)
			{
				availableTokens = tokensLeft;
				return new Reservation(this, count, now, now, true);
			}
			long tokensNeeded = SaturatedMath.subtract(0, tokensLeft);
			long ticksNeeded = (tokensNeeded - 1) / quantum + 1;
			long availableTick = SaturatedMath.add(tick, ticksNeeded);
			Duration fillTime = SaturatedMath.multiply(fillInterval, availableTick);
			Instant availableAt = SaturatedMath.plus(startTime, fillTime);
			Duration waitTime = Duration.between(now, availableAt);
			if (waitTime.compareTo(maxWait) > 0)
			{
				log.debug("Reservation of {} tokens would wait {}, exceeding maxWait: {}", count, waitTime, maxWait);
				return new Reservation(this, count, now, availableAt, false);
			}
			availableTokens = tokensLeft;
			log.debug("Reserved {} tokens, available in {}. availableTokens: {}", count, waitTime, tokensLeft);
			return new Reservation(this, count, now, availableAt, true);
		}
	}

	/**
	 * Consumes up to {@code count} tokens that are available at a point in time.
	 *
	 * @param now   the current time
	 * @param count the maximum number of tokens to consume
	 * @return the number of tokens that were consumed ({@code 0} to {@code count})
	 * @throws NullPointerException     if {@code now} is null
	 * @throws IllegalArgumentException if {@code count} is negative
	 */
	long consumeAvailable(Instant now, long count)
	{
		REQUIREMENTS.requireThat(now, "now").isNotNull();
		REQUIREMENTS.requireThat(count, "count").isNotNegative();
		if (count == 0)
			return 0;
		try (CloseableLock ignored = lock.lock())
		{
			adjust(currentTick(now));
			long tokensConsumed = Math.min(count, Math.max(availableTokens, 0));
			availableTokens -= tokensConsumed;
			return tokensConsumed;
		}
	}

	@Override
	public String toString()
	{
		ToStringBuilder builder = new ToStringBuilder(Bucket.class).
			add("fillInterval", fillInterval).
			add("quantum", quantum).
			add("capacity", capacity).
			add("rate", getRate());
		if (log.isDebugEnabled())
		{
			try (CloseableLock ignored = lock.lock())
			{
				builder.
					add("startTime", startTime).
					add("latestTick", latestTick).
					add("availableTokens", availableTokens);
			}
		}
		return builder.toString();
	}

	/**
	 * Builds a bucket.
	 */
	public static final class Builder
	{
		private Duration fillInterval = Duration.ofSeconds(1);
		private long quantum = 1;
		private long capacity = 1;
		private Clock clock = Clock.system();
		private final List<BucketListener> listeners = new ArrayList<>();

		/**
		 * Prevent construction.
		 */
		Builder()
		{
		}

		/**
		 * Returns the amount of time between fills. The default is {@code 1 second}.
		 *
		 * @return the amount of time between fills
		 */
		@CheckReturnValue
		public Duration fillInterval()
		{
			return fillInterval;
		}

		/**
		 * Sets the amount of time between fills.
		 *
		 * @param fillInterval the amount of time between fills
		 * @return this
		 * @throws NullPointerException     if {@code fillInterval} is null
		 * @throws IllegalArgumentException if {@code fillInterval} is negative or zero
		 */
		@CheckReturnValue
		public Builder fillInterval(Duration fillInterval)
		{
			REQUIREMENTS.requireThat(fillInterval, "fillInterval").isGreaterThan(Duration.ZERO);
			this.fillInterval = fillInterval;
			return this;
		}

		/**
		 * Returns the number of tokens to add every {@code fillInterval}. The default is {@code 1}.
		 *
		 * @return the number of tokens to add every {@code fillInterval}
		 */
		@CheckReturnValue
		public long quantum()
		{
			return quantum;
		}

		/**
		 * Sets the number of tokens to add every {@code fillInterval}.
		 *
		 * @param quantum the number of tokens to add every {@code fillInterval}
		 * @return this
		 * @throws IllegalArgumentException if {@code quantum} is negative or zero
		 */
		@CheckReturnValue
		public Builder quantum(long quantum)
		{
			REQUIREMENTS.requireThat(quantum, "quantum").isPositive();
			this.quantum = quantum;
			return this;
		}

		/**
		 * Returns the rate implied by the current {@code quantum} and {@code fillInterval}.
		 *
		 * @return the number of tokens added per second
		 */
		@CheckReturnValue
		public double rate()
		{
			return QuantumSolver.getRate(quantum, SaturatedMath.toNanos(fillInterval));
		}

		/**
		 * Sets the {@code quantum} and {@code fillInterval} that approximate {@code rate} within 1%.
		 *
		 * @param rate the number of tokens to add per second
		 * @return this
		 * @throws IllegalArgumentException if {@code rate} is not a positive finite number, or it cannot be
		 *                                  approximated
		 */
		@CheckReturnValue
		public Builder rate(double rate)
		{
			Solution solution = QuantumSolver.solve(rate);
			this.quantum = solution.getQuantum();
			this.fillInterval = solution.getFillInterval();
			return this;
		}

		/**
		 * Returns the maximum number of tokens that the bucket may hold. The default is {@code 1}.
		 *
		 * @return the maximum number of tokens that the bucket may hold
		 */
		@CheckReturnValue
		public long capacity()
		{
			return capacity;
		}

		/**
		 * Sets the maximum number of tokens that the bucket may hold. The bucket starts out full.
		 *
		 * @param capacity the maximum number of tokens that the bucket may hold
		 * @return this
		 * @throws IllegalArgumentException if {@code capacity} is negative or zero
		 */
		@CheckReturnValue
		public Builder capacity(long capacity)
		{
			REQUIREMENTS.requireThat(capacity, "capacity").isPositive();
			this.capacity = capacity;
			return this;
		}

		/**
		 * Returns the source of time. The default is {@link Clock#system()}.
		 *
		 * @return the source of time
		 */
		@CheckReturnValue
		public Clock clock()
		{
			return clock;
		}

		/**
		 * Sets the source of time.
		 *
		 * @param clock the source of time
		 * @return this
		 * @throws NullPointerException if {@code clock} is null
		 */
		@CheckReturnValue
		public Builder clock(Clock clock)
		{
			REQUIREMENTS.requireThat(clock, "clock").isNotNull();
			this.clock = clock;
			return this;
		}

		/**
		 * Returns the event listeners associated with the bucket.
		 *
		 * @return the event listeners
		 */
		@CheckReturnValue
		public List<BucketListener> listeners()
		{
			return listeners;
		}

		/**
		 * Adds an event listener to the bucket.
		 *
		 * @param listener a listener
		 * @return this
		 * @throws NullPointerException if {@code listener} is null
		 */
		@CheckReturnValue
		public Builder addListener(BucketListener listener)
		{
			REQUIREMENTS.requireThat(listener, "listener").isNotNull();
			listeners.add(listener);
			return this;
		}

		/**
		 * Builds a new bucket.
		 *
		 * @return a new bucket that is initially full
		 */
		public Bucket build()
		{
			return new Bucket(fillInterval, quantum, capacity, clock, listeners);
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("fillInterval", fillInterval).
				add("quantum", quantum).
				add("capacity", capacity).
				add("clock", clock).
				toString();
		}
	}
}
