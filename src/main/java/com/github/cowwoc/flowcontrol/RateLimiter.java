package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.annotation.CheckReturnValue;
import com.github.cowwoc.flowcontrol.internal.CloseableLock;
import com.github.cowwoc.flowcontrol.internal.Deadline;
import com.github.cowwoc.flowcontrol.internal.LockAsResource;
import com.github.cowwoc.flowcontrol.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Limits the number of calls that may start within a window of time.
 * <p>
 * Rate limiters that use {@link RateLimitStrategy#LEAKY_BUCKET LEAKY_BUCKET} own a background thread and
 * must be {@link #close() closed} when they are no longer needed.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class RateLimiter implements FlowController, AutoCloseable
{
	private final int maxCalls;
	private final Duration window;
	private final RateLimitStrategy strategy;
	private final Duration timeout;
	private final LockAsResource lock = new LockAsResource();
	private final RateLimitAlgorithm algorithm;
	private final Logger log = LoggerFactory.getLogger(RateLimiter.class);

	/**
	 * Builds a new rate limiter.
	 *
	 * @return a RateLimiter builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new rate limiter.
	 *
	 * @param maxCalls the maximum number of calls per window
	 * @param window   the length of a window
	 * @param strategy the algorithm used to admit calls
	 * @param timeout  the maximum amount of time that {@link #acquire()} waits ({@code null} to wait
	 *                 indefinitely)
	 * @param now      the current time
	 */
	private RateLimiter(int maxCalls, Duration window, RateLimitStrategy strategy, Duration timeout,
	                    Instant now)
	{
		this.maxCalls = maxCalls;
		this.window = window;
		this.strategy = strategy;
		this.timeout = timeout;
		this.algorithm = strategy.createAlgorithm(maxCalls, window, lock, now);
	}

	/**
	 * @return the maximum number of calls per window
	 */
	public int getMaxCalls()
	{
		return maxCalls;
	}

	/**
	 * @return the length of a window
	 */
	public Duration getWindow()
	{
		return window;
	}

	/**
	 * @return the algorithm used to admit calls
	 */
	public RateLimitStrategy getStrategy()
	{
		return strategy;
	}

	/**
	 * @return the maximum amount of time that {@link #acquire()} waits ({@code null} if callers wait
	 * indefinitely)
	 */
	public Duration getTimeout()
	{
		return timeout;
	}

	/**
	 * @return the number of calls that would be admitted without waiting
	 */
	public int getAvailableCalls()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return algorithm.getAvailableCalls(Instant.now());
		}
	}

	/**
	 * @return the number of callers waiting to be admitted
	 */
	public int getQueueLength()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return algorithm.getQueueLength();
		}
	}

	/**
	 * Blocks until a call is admitted, for up to the rate limiter's default timeout.
	 *
	 * @throws IllegalStateException                      if the rate limiter is closed
	 * @throws java.util.concurrent.CancellationException if the rate limiter is reset or closed while
	 *                                                    waiting in a leaky bucket
	 * @throws InterruptedException                       if the thread is interrupted while waiting
	 * @throws TimeoutException                           if the timeout elapses before the call is admitted
	 */
	public void acquire() throws InterruptedException, TimeoutException
	{
		acquire(timeout);
	}

	/**
	 * Blocks until a call is admitted.
	 *
	 * @param timeout the maximum amount of time to wait ({@code null} to wait indefinitely)
	 * @throws IllegalArgumentException                   if {@code timeout} is negative
	 * @throws IllegalStateException                      if the rate limiter is closed
	 * @throws java.util.concurrent.CancellationException if the rate limiter is reset or closed while
	 *                                                    waiting in a leaky bucket
	 * @throws InterruptedException                       if the thread is interrupted while waiting
	 * @throws TimeoutException                           if the timeout elapses before the call is admitted
	 */
	public void acquire(Duration timeout) throws InterruptedException, TimeoutException
	{
		if (timeout != null)
			requireThat(timeout, "timeout").isGreaterThanOrEqualTo(Duration.ZERO);
		Deadline deadline = Deadline.after(timeout);
		try (CloseableLock ignored = lock.lock())
		{
			algorithm.acquire(deadline, timeout);
		}
	}

	/**
	 * Runs a task once the rate limit allows it.
	 *
	 * @throws TimeoutException if the default timeout elapses before the call is admitted
	 */
	@Override
	public <V> V execute(Callable<V> task) throws Exception
	{
		requireThat(task, "task").isNotNull();
		acquire();
		return task.call();
	}

	/**
	 * Restores the state that the rate limiter had at construction time. Callers queued in a leaky bucket
	 * fail with {@link java.util.concurrent.CancellationException}. Other blocked callers try again
	 * immediately.
	 */
	public void reset()
	{
		try (CloseableLock ignored = lock.lock())
		{
			algorithm.reset(Instant.now());
			log.debug("Reset {}", strategy);
		}
	}

	/**
	 * Stops any background activity. Queued callers fail with
	 * {@link java.util.concurrent.CancellationException} and subsequent calls fail with
	 * {@link IllegalStateException}. Closing a closed rate limiter has no effect.
	 */
	@Override
	public void close()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (algorithm.isClosed())
				return;
			algorithm.close();
		}
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return new ToStringBuilder(RateLimiter.class).
				add("strategy", strategy).
				add("maxCalls", maxCalls).
				add("window", window).
				add("algorithm", algorithm).
				toString();
		}
	}

	/**
	 * Builds a rate limiter.
	 */
	public static final class Builder
	{
		private int maxCalls = 1;
		private Duration window = Duration.ofSeconds(1);
		private RateLimitStrategy strategy = RateLimitStrategy.TOKEN_BUCKET;
		private Duration timeout;

		/**
		 * Prevent construction.
		 */
		Builder()
		{
		}

		/**
		 * Returns the maximum number of calls per window. The default is {@code 1}.
		 *
		 * @return the maximum number of calls per window
		 */
		@CheckReturnValue
		public int maxCalls()
		{
			return maxCalls;
		}

		/**
		 * Sets the maximum number of calls per window.
		 *
		 * @param maxCalls the maximum number of calls per window
		 * @return this
		 * @throws IllegalArgumentException if {@code maxCalls} is negative or zero
		 */
		@CheckReturnValue
		public Builder maxCalls(int maxCalls)
		{
			requireThat(maxCalls, "maxCalls").isPositive();
			this.maxCalls = maxCalls;
			return this;
		}

		/**
		 * Returns the length of a window. The default is {@code 1 second}.
		 *
		 * @return the length of a window
		 */
		@CheckReturnValue
		public Duration window()
		{
			return window;
		}

		/**
		 * Sets the length of a window.
		 *
		 * @param window the length of a window
		 * @return this
		 * @throws NullPointerException     if {@code window} is null
		 * @throws IllegalArgumentException if {@code window} is negative or zero
		 */
		@CheckReturnValue
		public Builder window(Duration window)
		{
			requireThat(window, "window").isGreaterThan(Duration.ZERO);
			this.window = window;
			return this;
		}

		/**
		 * Returns the algorithm used to admit calls. The default is
		 * {@link RateLimitStrategy#TOKEN_BUCKET TOKEN_BUCKET}.
		 *
		 * @return the algorithm used to admit calls
		 */
		@CheckReturnValue
		public RateLimitStrategy strategy()
		{
			return strategy;
		}

		/**
		 * Sets the algorithm used to admit calls.
		 *
		 * @param strategy the algorithm used to admit calls
		 * @return this
		 * @throws NullPointerException if {@code strategy} is null
		 */
		@CheckReturnValue
		public Builder strategy(RateLimitStrategy strategy)
		{
			requireThat(strategy, "strategy").isNotNull();
			this.strategy = strategy;
			return this;
		}

		/**
		 * Returns the maximum amount of time to wait for admission. The default is {@code null}.
		 *
		 * @return {@code null} if callers wait indefinitely
		 */
		@CheckReturnValue
		public Duration timeout()
		{
			return timeout;
		}

		/**
		 * Sets the maximum amount of time to wait for admission.
		 *
		 * @param timeout the maximum amount of time to wait ({@code null} to wait indefinitely)
		 * @return this
		 * @throws IllegalArgumentException if {@code timeout} is negative or zero
		 */
		@CheckReturnValue
		public Builder timeout(Duration timeout)
		{
			if (timeout != null)
				requireThat(timeout, "timeout").isGreaterThan(Duration.ZERO);
			this.timeout = timeout;
			return this;
		}

		/**
		 * Builds a new RateLimiter.
		 *
		 * @return a new RateLimiter
		 * @throws IllegalArgumentException if the strategy is {@code LEAKY_BUCKET} and {@code window / maxCalls}
		 *                                  is shorter than a millisecond
		 */
		public RateLimiter build()
		{
			if (strategy == RateLimitStrategy.LEAKY_BUCKET)
			{
				requireThat(window.dividedBy(maxCalls), "window / maxCalls").
					isGreaterThanOrEqualTo(Duration.ofMillis(1));
			}
			return new RateLimiter(maxCalls, window, strategy, timeout, Instant.now());
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("maxCalls", maxCalls).
				add("window", window).
				add("strategy", strategy).
				add("timeout", timeout).
				toString();
		}
	}
}
