package com.github.cowwoc.flowcontrol;

/**
 * Listens for priority queue events.
 * <p>
 * The listener is invoked while holding a lock, so special care must be taken to avoid deadlocks.
 *
 * @param <P> the type of items in the queue
 */
public interface PriorityQueueListener<P>
{
	/**
	 * Invoked when an item is dropped because the queue is full.
	 *
	 * @param executor the executor
	 * @param item     the item that was dropped
	 */
	default void onItemDropped(PriorityQueueExecutor<P> executor, P item)
	{
	}

	/**
	 * Invoked when the priority of an item is boosted because it waited too long.
	 *
	 * @param executor the executor
	 * @param item     the item whose priority was boosted
	 */
	default void onStarvationPrevention(PriorityQueueExecutor<P> executor, P item)
	{
	}
}
