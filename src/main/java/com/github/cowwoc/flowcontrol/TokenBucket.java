package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.internal.LockAsResource;
import com.github.cowwoc.flowcontrol.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * A bucket of {@code maxCalls} tokens that is refilled in full once per window.
 */
final class TokenBucket extends PollingAlgorithm
{
	private long tokens;
	private Instant lastRefill;
	private final Logger log = LoggerFactory.getLogger(TokenBucket.class);

	/**
	 * @param maxCalls the maximum number of calls per window
	 * @param window   the length of a window
	 * @param lock     the lock over the rate limiter's state
	 * @param now      the current time
	 */
	TokenBucket(int maxCalls, Duration window, LockAsResource lock, Instant now)
	{
		super(maxCalls, window, lock);
		this.tokens = maxCalls;
		this.lastRefill = now;
	}

	/**
	 * Refills the bucket if at least one window has elapsed since the last refill. The refill time advances
	 * by whole windows so that refills stay aligned with the original schedule.
	 *
	 * @param now the current time
	 */
	private void refill(Instant now)
	{
		Duration elapsed = Duration.between(lastRefill, now);
		if (elapsed.compareTo(window) < 0)
			return;
		long windows = elapsed.toNanos() / window.toNanos();
		tokens = maxCalls;
		lastRefill = lastRefill.plus(window.multipliedBy(windows));
		log.debug("Refilled {} tokens. lastRefill: {}", maxCalls, lastRefill);
	}

	@Override
	Duration tryAcquire(Instant now)
	{
		refill(now);
		if (tokens > 0)
		{
			--tokens;
			return Duration.ZERO;
		}
		return Duration.between(now, lastRefill.plus(window));
	}

	@Override
	int getAvailableCalls(Instant now)
	{
		refill(now);
		return (int) tokens;
	}

	@Override
	void reset(Instant now)
	{
		tokens = maxCalls;
		lastRefill = now;
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
		return new ToStringBuilder(TokenBucket.class).
			add("tokens", tokens).
			add("maxCalls", maxCalls).
			add("window", window).
			add("lastRefill", lastRefill).
			toString();
	}
}
