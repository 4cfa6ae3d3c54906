/**
 * A rate limiter based on the <a href="https://en.wikipedia.org/wiki/Token_bucket">Token bucket
 * algorithm</a>.
 * <p>
 * Tokens are added at discrete ticks computed from the elapsed time, so buckets require no background
 * threads. Requests that cannot be satisfied immediately put the bucket into debt and are told how long to
 * wait.
 * <p>
 * <b>Thread safety</b>: Classes are not thread-safe unless indicated otherwise (e.g.
 * {@link com.github.cowwoc.ratelimit.Bucket}).
 */
package com.github.cowwoc.ratelimit;
