package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.internal.Deadline;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * The state of a rate limiter.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe. Methods must be invoked while holding the rate
 * limiter's lock.
 */
abstract class RateLimitAlgorithm
{
	protected final int maxCalls;
	protected final Duration window;
	private boolean closed;

	/**
	 * @param maxCalls the maximum number of calls per window
	 * @param window   the length of a window
	 */
	protected RateLimitAlgorithm(int maxCalls, Duration window)
	{
		this.maxCalls = maxCalls;
		this.window = window;
	}

	/**
	 * Blocks until a call is admitted.
	 *
	 * @param deadline the time at which to give up
	 * @param timeout  the timeout that {@code deadline} was derived from
	 * @throws IllegalStateException                      if the rate limiter is closed
	 * @throws java.util.concurrent.CancellationException if the rate limiter is reset or closed while
	 *                                                    waiting
	 * @throws InterruptedException                       if the thread is interrupted while waiting
	 * @throws TimeoutException                           if the deadline expires before the call is
	 *                                                    admitted
	 */
	abstract void acquire(Deadline deadline, Duration timeout) throws InterruptedException, TimeoutException;

	/**
	 * @param now the current time
	 * @return the number of calls that would be admitted without waiting
	 */
	abstract int getAvailableCalls(Instant now);

	/**
	 * @return the number of threads waiting to be admitted
	 */
	abstract int getQueueLength();

	/**
	 * Restores the state that the algorithm had at construction time.
	 *
	 * @param now the current time
	 */
	abstract void reset(Instant now);

	/**
	 * Releases any resources held by the algorithm. Subsequent calls are rejected.
	 */
	void close()
	{
		closed = true;
	}

	/**
	 * @throws IllegalStateException if the rate limiter is closed
	 */
	protected void ensureOpen()
	{
		if (closed)
			throw new IllegalStateException("The rate limiter is closed");
	}

	/**
	 * @return true if the rate limiter is closed
	 */
	boolean isClosed()
	{
		return closed;
	}

	/**
	 * @param timeout the timeout that elapsed
	 * @return the exception to throw
	 */
	protected static TimeoutException timeoutException(Duration timeout)
	{
		return new TimeoutException("Timed out after " + timeout + " waiting for the rate limiter");
	}
}
