package com.github.cowwoc.ratelimit.internal;

/**
 * A lock that is released by {@code close()}, for use with try-with-resources. Releasing the lock does not
 * throw any exceptions.
 */
public interface CloseableLock extends AutoCloseable
{
	@Override
	void close();
}
