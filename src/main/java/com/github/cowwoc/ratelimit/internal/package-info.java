/**
 * Classes that are not meant to be used outside of the library.
 * <h1>Locking policy</h1>
 * <p>
 * A bucket's mutable state is guarded by a single {@link com.github.cowwoc.ratelimit.internal.ExclusiveLock}.
 * Public methods acquire it on behalf of the non-public methods that they invoke, and release it before
 * sleeping or notifying listeners.
 */
package com.github.cowwoc.ratelimit.internal;
