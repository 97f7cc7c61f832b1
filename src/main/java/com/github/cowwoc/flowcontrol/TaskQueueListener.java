package com.github.cowwoc.flowcontrol;

/**
 * Listens for task queue events.
 * <p>
 * The listener is invoked while holding a lock, so special care must be taken to avoid deadlocks.
 */
public interface TaskQueueListener
{
	/**
	 * Invoked after a task joins or leaves the queue.
	 *
	 * @param queue       the task queue
	 * @param queueLength the number of tasks waiting in the queue
	 */
	default void onQueueChange(TaskQueue<?> queue, int queueLength)
	{
	}
}
