package com.github.cowwoc.flowcontrol.internal;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;

/**
 * Condition helper functions.
 */
public final class Conditions
{
	/**
	 * Prevent construction.
	 */
	private Conditions()
	{
	}

	/**
	 * Waits for a condition to get signalled or a deadline to expire. Spurious wakeups are possible, so
	 * callers must re-check their state in a loop.
	 *
	 * @param condition the condition
	 * @param deadline  the time at which to stop waiting
	 * @return false if the deadline expired before the method was invoked, else true
	 * @throws InterruptedException if the current thread is interrupted
	 */
	public static boolean await(Condition condition, Deadline deadline) throws InterruptedException
	{
		if (deadline.isInfinite())
		{
			condition.await();
			return true;
		}
		long nanosLeft = deadline.getNanosLeft();
		if (nanosLeft <= 0)
			return false;
		condition.awaitNanos(nanosLeft);
		return true;
	}

	/**
	 * Waits for a condition to get signalled or a timeout to occur.
	 *
	 * @param condition the condition
	 * @param duration  the duration to sleep
	 * @throws InterruptedException if the current thread is interrupted
	 */
	public static void await(Condition condition, Duration duration) throws InterruptedException
	{
		try
		{
			condition.awaitNanos(duration.toNanos());
		}
		catch (ArithmeticException e)
		{
			condition.await(duration.toMillis(), TimeUnit.MILLISECONDS);
		}
	}
}
