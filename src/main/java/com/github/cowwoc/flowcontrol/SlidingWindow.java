package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.internal.LockAsResource;

import java.time.Duration;

/**
 * A window log whose blocked callers sleep one millisecond past the expiry of the oldest call.
 */
final class SlidingWindow extends FixedWindow
{
	private static final Duration GUARD = Duration.ofMillis(1);

	/**
	 * @param maxCalls the maximum number of calls per window
	 * @param window   the length of a window
	 * @param lock     the lock over the rate limiter's state
	 */
	SlidingWindow(int maxCalls, Duration window, LockAsResource lock)
	{
		super(maxCalls, window, lock);
	}

	@Override
	protected Duration getGuard()
	{
		return GUARD;
	}
}
