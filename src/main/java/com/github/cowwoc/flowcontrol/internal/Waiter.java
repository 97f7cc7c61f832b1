package com.github.cowwoc.flowcontrol.internal;

import java.time.Instant;
import java.util.concurrent.locks.Condition;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A thread that is blocked waiting for a resource.
 * <p>
 * The thread that grants the resource updates the waiter's state on its behalf and signals its condition,
 * so the waiter never has to compete for the resource after waking up.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe. Its state must only be accessed while holding the
 * lock that owns {@code condition}.
 */
public class Waiter
{
	private final Condition condition;
	private final Instant enqueuedAt;
	private double priority;
	private long sequence;
	private boolean done;
	private RuntimeException failure;

	/**
	 * Creates a new waiter.
	 *
	 * @param condition the condition that the waiting thread blocks on
	 * @param priority  the priority of the waiter (ignored unless the queue is priority-ordered)
	 * @param now       the time at which the thread started waiting
	 * @throws NullPointerException if {@code condition} or {@code now} are null
	 */
	public Waiter(Condition condition, double priority, Instant now)
	{
		requireThat(condition, "condition").isNotNull();
		requireThat(now, "now").isNotNull();
		this.condition = condition;
		this.priority = priority;
		this.enqueuedAt = now;
	}

	/**
	 * @return the priority of the waiter
	 */
	public double getPriority()
	{
		return priority;
	}

	/**
	 * Sets the priority of the waiter. The caller is responsible for reordering the queue.
	 *
	 * @param priority the priority of the waiter
	 */
	public void setPriority(double priority)
	{
		this.priority = priority;
	}

	/**
	 * @return the arrival order of the waiter within its queue
	 */
	public long getSequence()
	{
		return sequence;
	}

	/**
	 * @param sequence the arrival order of the waiter within its queue
	 */
	void setSequence(long sequence)
	{
		this.sequence = sequence;
	}

	/**
	 * @return the time at which the thread started waiting
	 */
	public Instant getEnqueuedAt()
	{
		return enqueuedAt;
	}

	/**
	 * @return true if the waiter was resumed or failed
	 */
	public boolean isDone()
	{
		return done;
	}

	/**
	 * @return the exception that the waiter must throw ({@code null} if the waiter was resumed normally)
	 */
	public RuntimeException getFailure()
	{
		return failure;
	}

	/**
	 * Grants the resource to the waiting thread and wakes it up.
	 */
	public void resume()
	{
		done = true;
		condition.signal();
	}

	/**
	 * Wakes up the waiting thread, instructing it to throw an exception.
	 *
	 * @param failure the exception to throw
	 * @throws NullPointerException if {@code failure} is null
	 */
	public void fail(RuntimeException failure)
	{
		requireThat(failure, "failure").isNotNull();
		this.failure = failure;
		resume();
	}

	/**
	 * Blocks until the waiter is done or the deadline expires.
	 * <p>
	 * If the thread is interrupted after the waiter is done, the interrupt flag is restored and the method
	 * returns normally.
	 *
	 * @param deadline the time at which to stop waiting
	 * @return false if the deadline expired before the waiter was done
	 * @throws NullPointerException if {@code deadline} is null
	 * @throws InterruptedException if the thread is interrupted before the waiter is done. The caller is
	 *                              responsible for removing the waiter from its queue.
	 */
	public boolean await(Deadline deadline) throws InterruptedException
	{
		try
		{
			while (!done)
			{
				if (!Conditions.await(condition, deadline))
					return false;
			}
			return true;
		}
		catch (InterruptedException e)
		{
			if (!done)
				throw e;
			Thread.currentThread().interrupt();
			return true;
		}
	}

	/**
	 * Blocks until the waiter is done, ignoring interrupts.
	 */
	public void awaitUninterruptibly()
	{
		while (!done)
			condition.awaitUninterruptibly();
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(Waiter.class).
			add("priority", priority).
			add("sequence", sequence).
			add("enqueuedAt", enqueuedAt).
			add("done", done).
			add("failure", failure).
			toString();
	}
}
