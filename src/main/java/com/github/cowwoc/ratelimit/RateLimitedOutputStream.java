package com.github.cowwoc.ratelimit;

import com.github.cowwoc.requirements.java.DefaultJavaRequirements;
import com.github.cowwoc.requirements.java.JavaRequirements;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * An OutputStream that consumes one token per byte written. Writes block until their tokens become
 * available.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe.
 */
public final class RateLimitedOutputStream extends FilterOutputStream
{
	private static final JavaRequirements REQUIREMENTS = new DefaultJavaRequirements();
	private final Bucket bucket;

	/**
	 * Creates a new stream.
	 *
	 * @param out    the stream to write to
	 * @param bucket the bucket to consume tokens from
	 * @throws NullPointerException if any of the arguments are null
	 */
	public RateLimitedOutputStream(OutputStream out, Bucket bucket)
	{
		super(out);
		REQUIREMENTS.requireThat(out, "out").isNotNull();
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
	public void write(int b) throws IOException
	{
		waitFor(1);
		out.write(b);
	}

	@Override
	public void write(byte[] b, int off, int len) throws IOException
	{
		Objects.checkFromIndexSize(off, len, b.length);
		if (len > 0)
			waitFor(len);
		// FilterOutputStream writes one byte at a time
		out.write(b, off, len);
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
