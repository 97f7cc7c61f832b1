package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.internal.LockAsResource;
import com.github.cowwoc.flowcontrol.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Remembers the time of each admitted call, admitting a new call only if fewer than {@code maxCalls} calls
 * were admitted within the past window.
 */
class FixedWindow extends PollingAlgorithm
{
	/**
	 * The times at which calls were admitted, oldest first.
	 */
	private final Deque<Instant> timestamps = new ArrayDeque<>();
	private final Logger log = LoggerFactory.getLogger(FixedWindow.class);

	/**
	 * @param maxCalls the maximum number of calls per window
	 * @param window   the length of a window
	 * @param lock     the lock over the rate limiter's state
	 */
	FixedWindow(int maxCalls, Duration window, LockAsResource lock)
	{
		super(maxCalls, window, lock);
	}

	/**
	 * @return the amount of time that blocked callers sleep past the expiry of the oldest call
	 */
	protected Duration getGuard()
	{
		return Duration.ZERO;
	}

	/**
	 * Discards calls that are at least one window old.
	 *
	 * @param now the current time
	 */
	private void trim(Instant now)
	{
		while (!timestamps.isEmpty() && Duration.between(timestamps.peekFirst(), now).compareTo(window) >= 0)
			timestamps.removeFirst();
	}

	@Override
	Duration tryAcquire(Instant now)
	{
		trim(now);
		if (timestamps.size() < maxCalls)
		{
			timestamps.addLast(now);
			return Duration.ZERO;
		}
		Instant oldestExpiresAt = timestamps.peekFirst().plus(window);
		return Duration.between(now, oldestExpiresAt).plus(getGuard());
	}

	@Override
	int getAvailableCalls(Instant now)
	{
		trim(now);
		return maxCalls - timestamps.size();
	}

	@Override
	void reset(Instant now)
	{
		timestamps.clear();
		super.reset(now);
	}

	@Override
	protected Logger getLogger()
	{
		return log;
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(getClass()).
			add("calls", timestamps.size()).
			add("maxCalls", maxCalls).
			add("window", window).
			add("guard", getGuard()).
			toString();
	}
}
