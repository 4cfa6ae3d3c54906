package com.github.cowwoc.ratelimit;

import com.github.cowwoc.requirements.java.DefaultJavaRequirements;
import com.github.cowwoc.requirements.java.JavaRequirements;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;

/**
 * An InputStream that consumes one token per byte read.
 * <p>
 * Bytes are read before waiting for their tokens, so a reader that stops after a large read pays for it on
 * the following read.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe.
 */
public final class RateLimitedInputStream extends FilterInputStream
{
	private static final JavaRequirements REQUIREMENTS = new DefaultJavaRequirements();
	private final Bucket bucket;

	/**
	 * Creates a new stream.
	 *
	 * @param in     the stream to read from
	 * @param bucket the bucket to consume tokens from
	 * @throws NullPointerException if any of the arguments are null
	 */
	public RateLimitedInputStream(InputStream in, Bucket bucket)
	{
		super(in);
		REQUIREMENTS.requireThat(in, "in").isNotNull();
		REQUIREMENTS.requireThat(bucket, "bucket").isNotNull();
		this.bucket = bucket;
	}

	/**
	 * Returns the bucket that tokens are consumed from.
	 *
	 * @return the bucket that tokens are consumed from
	 */
	public Bucket getBucket()
	{
		return bucket;
	}

	@Override
	public int read() throws IOException
	{
		int result = super.read();
		if (result != -1)
			waitFor(1);
		return result;
	}

	@Override
	public int read(byte[] b, int off, int len) throws IOException
	{
		int bytesRead = super.read(b, off, len);
		if (bytesRead > 0)
			waitFor(bytesRead);
		return bytesRead;
	}

	@Override
	public long skip(long n) throws IOException
	{
		long bytesSkipped = super.skip(n);
		if (bytesSkipped > 0)
			waitFor(bytesSkipped);
		return bytesSkipped;
	}

	@Override
	public boolean markSupported()
	{
		return false;
	}

	/**
	 * @param tokens the number of tokens to consume
	 * @throws InterruptedIOException if the thread is interrupted while waiting for tokens
	 */
	private void waitFor(long tokens) throws InterruptedIOException
	{
		try
		{
			bucket.waitFor(tokens);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			InterruptedIOException exception = new InterruptedIOException("Interrupted while waiting for " +
				tokens + " tokens");
			exception.initCause(e);
			throw exception;
		}
	}
}
