package com.github.cowwoc.flowcontrol;

/**
 * Determines what a {@link PriorityQueueExecutor} does with an item that arrives while its queue is full.
 */
public enum QueueFullPolicy
{
	/**
	 * If the new item has a strictly higher priority than the lowest-priority queued item, the queued item
	 * is cancelled to make room. Otherwise the new item is rejected.
	 */
	DROP_LOWEST_PRIORITY,
	/**
	 * Rejects the new item, notifying the listener.
	 */
	DROP_NEW,
	/**
	 * Rejects the new item.
	 */
	ERROR,
	/**
	 * Blocks the caller until there is room in the queue.
	 */
	WAIT_FOR_SPACE
}
