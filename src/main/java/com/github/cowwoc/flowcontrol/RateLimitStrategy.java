package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.internal.LockAsResource;

import java.time.Duration;
import java.time.Instant;

/**
 * The algorithm that a {@link RateLimiter} uses to admit calls.
 */
public enum RateLimitStrategy
{
	/**
	 * Up to {@code maxCalls} tokens are available at once. The bucket is refilled in full at the end of each
	 * window. Bursts of up to {@code maxCalls} calls are admitted immediately.
	 *
	 * @see <a href="https://en.wikipedia.org/wiki/Token_bucket">Token bucket</a>
	 */
	TOKEN_BUCKET
		{
			@Override
			RateLimitAlgorithm createAlgorithm(int maxCalls, Duration window, LockAsResource lock, Instant now)
			{
				return new TokenBucket(maxCalls, window, lock, now);
			}
		},
	/**
	 * Calls are admitted one at a time, every {@code window / maxCalls}, in arrival order. Every call waits
	 * for its turn, even when the bucket is idle.
	 *
	 * @see <a href="https://en.wikipedia.org/wiki/Leaky_bucket">Leaky bucket</a>
	 */
	LEAKY_BUCKET
		{
			@Override
			RateLimitAlgorithm createAlgorithm(int maxCalls, Duration window, LockAsResource lock, Instant now)
			{
				return new LeakyBucket(maxCalls, window, lock);
			}
		},
	/**
	 * At most {@code maxCalls} calls are admitted within any {@code window}, measured from the oldest
	 * admitted call.
	 */
	FIXED_WINDOW
		{
			@Override
			RateLimitAlgorithm createAlgorithm(int maxCalls, Duration window, LockAsResource lock, Instant now)
			{
				return new FixedWindow(maxCalls, window, lock);
			}
		},
	/**
	 * Same as {@link #FIXED_WINDOW} except that blocked callers sleep an extra millisecond past the expiry
	 * of the oldest call, so they never wake up a moment too early.
	 */
	SLIDING_WINDOW
		{
			@Override
			RateLimitAlgorithm createAlgorithm(int maxCalls, Duration window, LockAsResource lock, Instant now)
			{
				return new SlidingWindow(maxCalls, window, lock);
			}
		};

	/**
	 * @param maxCalls the maximum number of calls per window
	 * @param window   the length of a window
	 * @param lock     the lock over the rate limiter's state
	 * @param now      the current time
	 * @return a new algorithm that implements this strategy
	 */
	abstract RateLimitAlgorithm createAlgorithm(int maxCalls, Duration window, LockAsResource lock,
	                                            Instant now);
}
