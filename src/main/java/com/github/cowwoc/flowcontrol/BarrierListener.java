package com.github.cowwoc.flowcontrol;

/**
 * Listens for barrier events.
 * <p>
 * The listener is invoked while holding a lock, so special care must be taken to avoid deadlocks.
 */
public interface BarrierListener
{
	/**
	 * Invoked when a party times out waiting for the others, breaking the barrier.
	 *
	 * @param barrier the barrier
	 */
	default void onTimeout(Barrier barrier)
	{
	}
}
