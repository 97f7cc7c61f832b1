package com.github.cowwoc.flowcontrol;

/**
 * Listens for semaphore events.
 * <p>
 * The listener is invoked while holding a lock, so special care must be taken to avoid deadlocks.
 */
public interface SemaphoreListener
{
	/**
	 * Invoked after a caller joins the wait queue, before it blocks.
	 *
	 * @param semaphore the semaphore the caller is waiting on
	 * @param position  the 1-based position of the caller in the queue
	 */
	default void onWaiting(Semaphore semaphore, int position)
	{
	}
}
