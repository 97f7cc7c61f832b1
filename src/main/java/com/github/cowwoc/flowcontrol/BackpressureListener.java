package com.github.cowwoc.flowcontrol;

/**
 * Listens for backpressure events.
 * <p>
 * The listener is invoked while holding a lock, so special care must be taken to avoid deadlocks.
 */
public interface BackpressureListener
{
	/**
	 * Invoked when a task is rejected or evicted because every execution slot is busy.
	 *
	 * @param controller the controller
	 */
	default void onOverflow(BackpressureController controller)
	{
	}

	/**
	 * Invoked when a task is rejected because the buffer is full.
	 *
	 * @param controller the controller
	 */
	default void onBufferFull(BackpressureController controller)
	{
	}
}
