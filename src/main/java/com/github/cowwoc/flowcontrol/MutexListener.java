package com.github.cowwoc.flowcontrol;

/**
 * Listens for mutex events.
 * <p>
 * The listener is invoked while holding a lock, so special care must be taken to avoid deadlocks.
 */
public interface MutexListener
{
	/**
	 * Invoked when a caller finds the mutex locked and is about to block.
	 *
	 * @param mutex the mutex
	 */
	default void onBlocked(Mutex mutex)
	{
	}
}
