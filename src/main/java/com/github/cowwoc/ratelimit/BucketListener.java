package com.github.cowwoc.ratelimit;

import java.time.Instant;

/**
 * Listens for bucket events.
 * <p>
 * Listeners are invoked without holding the bucket's lock.
 */
public interface BucketListener
{
	/**
	 * Invoked after tokens were reserved, before sleeping until they become available.
	 * <p>
	 * The tokens remain reserved even if this method throws an exception.
	 *
	 * @param bucket      the bucket the thread is waiting on
	 * @param tokens      the number of tokens that were reserved
	 * @param requestedAt the time at which the tokens were requested
	 * @param availableAt the time at which the reserved tokens become available
	 * @throws InterruptedException if the thread should not sleep
	 */
	default void beforeSleep(Bucket bucket, long tokens, Instant requestedAt, Instant availableAt)
		throws InterruptedException
	{
	}
}
