package com.github.cowwoc.flowcontrol;

/**
 * Listens for bulkhead events.
 */
public interface BulkheadListener
{
	/**
	 * Invoked when a task fails to run, or throws an exception, before the exception is propagated to the
	 * caller.
	 *
	 * @param bulkhead the bulkhead
	 * @param cause    the exception that will be thrown
	 */
	default void onIsolationFailure(Bulkhead bulkhead, Throwable cause)
	{
	}
}
