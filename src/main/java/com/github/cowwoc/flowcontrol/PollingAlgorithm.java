package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.internal.Conditions;
import com.github.cowwoc.flowcontrol.internal.Deadline;
import com.github.cowwoc.flowcontrol.internal.LockAsResource;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;

/**
 * An algorithm that computes how long a blocked caller must sleep before it tries again.
 */
abstract class PollingAlgorithm extends RateLimitAlgorithm
{
	/**
	 * Signalled when the state changes in a way that may admit sleeping callers early.
	 */
	private final Condition stateChanged;
	private int sleepers;

	/**
	 * @param maxCalls the maximum number of calls per window
	 * @param window   the length of a window
	 * @param lock     the lock over the rate limiter's state
	 */
	protected PollingAlgorithm(int maxCalls, Duration window, LockAsResource lock)
	{
		super(maxCalls, window);
		this.stateChanged = lock.newCondition();
	}

	/**
	 * Admits a call, only if it is allowed at the time of invocation.
	 *
	 * @param now the current time
	 * @return {@code Duration.ZERO} if the call was admitted, otherwise the amount of time to wait before
	 * trying again
	 */
	abstract Duration tryAcquire(Instant now);

	/**
	 * @return the logger of the subclass
	 */
	protected abstract Logger getLogger();

	@Override
	void acquire(Deadline deadline, Duration timeout) throws InterruptedException, TimeoutException
	{
		Logger log = getLogger();
		while (true)
		{
			ensureOpen();
			Duration delay = tryAcquire(Instant.now());
			if (delay.isZero())
				return;
			long nanosLeft = deadline.getNanosLeft();
			if (nanosLeft <= 0)
				throw timeoutException(timeout);
			if (delay.toNanos() > nanosLeft)
				delay = Duration.ofNanos(nanosLeft);
			log.debug("Sleeping {}. State before sleep: {}", delay, this);
			++sleepers;
			try
			{
				Conditions.await(stateChanged, delay);
			}
			finally
			{
				--sleepers;
			}
		}
	}

	@Override
	int getQueueLength()
	{
		return sleepers;
	}

	@Override
	void reset(Instant now)
	{
		stateChanged.signalAll();
	}

	@Override
	void close()
	{
		super.close();
		stateChanged.signalAll();
	}
}
