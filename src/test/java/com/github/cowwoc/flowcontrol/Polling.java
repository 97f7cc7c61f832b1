package com.github.cowwoc.flowcontrol;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Test helpers that wait for other threads to reach a known state.
 */
public final class Polling
{
	private static final Duration TIMEOUT = Duration.ofSeconds(10);

	/**
	 * Prevent construction.
	 */
	private Polling()
	{
	}

	/**
	 * Blocks until a condition is true.
	 *
	 * @param condition the condition
	 * @param message   describes the condition
	 * @throws AssertionError       if the condition is not true within 10 seconds
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	public static void waitUntil(BooleanSupplier condition, String message) throws InterruptedException
	{
		long deadline = System.nanoTime() + TIMEOUT.toNanos();
		while (!condition.getAsBoolean())
		{
			if (System.nanoTime() - deadline > 0)
				throw new AssertionError("Timed out waiting for: " + message);
			Thread.sleep(5);
		}
	}
}
