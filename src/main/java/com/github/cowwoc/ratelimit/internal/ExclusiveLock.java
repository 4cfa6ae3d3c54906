package com.github.cowwoc.ratelimit.internal;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Enables the use of try-with-resources with a mutually exclusive lock.
 */
public final class ExclusiveLock
{
	private final ReentrantLock lock = new ReentrantLock();

	/**
	 * Creates a new lock.
	 */
	public ExclusiveLock()
	{
	}

	/**
	 * Acquires the lock.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock lock()
	{
		lock.lock();
		return lock::unlock;
	}

	/**
	 * Indicates if the current thread holds the lock.
	 *
	 * @return true if the current thread holds the lock
	 */
	public boolean isHeldByCurrentThread()
	{
		return lock.isHeldByCurrentThread();
	}
}
