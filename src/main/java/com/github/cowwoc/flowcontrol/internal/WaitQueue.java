package com.github.cowwoc.flowcontrol.internal;

import com.github.cowwoc.flowcontrol.QueueMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Threads waiting for a resource, in the order in which they will receive it.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe.
 *
 * @param <W> the type of waiters in the queue
 */
public final class WaitQueue<W extends Waiter> implements Iterable<W>
{
	/**
	 * Highest priority first. Ties are broken by arrival order.
	 */
	private static final Comparator<Waiter> BY_PRIORITY = Comparator.comparingDouble(Waiter::getPriority).
		reversed().
		thenComparingLong(Waiter::getSequence);
	private final QueueMode mode;
	private final List<W> waiters = new ArrayList<>();
	private long nextSequence;

	/**
	 * Creates a new queue.
	 *
	 * @param mode the order in which waiters are dequeued
	 * @throws NullPointerException if {@code mode} is null
	 */
	public WaitQueue(QueueMode mode)
	{
		requireThat(mode, "mode").isNotNull();
		this.mode = mode;
	}

	/**
	 * Adds a waiter to the queue.
	 *
	 * @param waiter the waiter
	 * @return the 1-based position of the waiter in the queue
	 * @throws NullPointerException if {@code waiter} is null
	 */
	public int add(W waiter)
	{
		requireThat(waiter, "waiter").isNotNull();
		waiter.setSequence(nextSequence++);
		switch (mode)
		{
			case FIFO ->
			{
				waiters.add(waiter);
				return waiters.size();
			}
			case LIFO ->
			{
				waiters.add(0, waiter);
				return 1;
			}
			case PRIORITY ->
			{
				int index = Collections.binarySearch(waiters, waiter, BY_PRIORITY);
				// Sequence numbers are unique so the waiter is never found
				int insertionPoint = -(index + 1);
				waiters.add(insertionPoint, waiter);
				return insertionPoint + 1;
			}
			default -> throw new AssertionError(mode.name());
		}
	}

	/**
	 * @return the waiter at the head of the queue, or {@code null} if the queue is empty
	 */
	public W peek()
	{
		if (waiters.isEmpty())
			return null;
		return waiters.get(0);
	}

	/**
	 * Removes the waiter at the head of the queue.
	 *
	 * @return the waiter, or {@code null} if the queue is empty
	 */
	public W poll()
	{
		if (waiters.isEmpty())
			return null;
		return waiters.remove(0);
	}

	/**
	 * @return the waiter at the tail of the queue, or {@code null} if the queue is empty
	 */
	public W peekLast()
	{
		if (waiters.isEmpty())
			return null;
		return waiters.get(waiters.size() - 1);
	}

	/**
	 * Removes the waiter at the tail of the queue.
	 *
	 * @return the waiter, or {@code null} if the queue is empty
	 */
	public W pollLast()
	{
		if (waiters.isEmpty())
			return null;
		return waiters.remove(waiters.size() - 1);
	}

	/**
	 * Removes a waiter from the queue.
	 *
	 * @param waiter the waiter
	 * @return true if the waiter was in the queue
	 */
	public boolean remove(W waiter)
	{
		return waiters.remove(waiter);
	}

	/**
	 * Restores the queue order after waiter priorities have changed.
	 */
	public void reorder()
	{
		if (mode == QueueMode.PRIORITY)
			waiters.sort(BY_PRIORITY);
	}

	/**
	 * @return the number of waiters in the queue
	 */
	public int size()
	{
		return waiters.size();
	}

	/**
	 * @return true if the queue is empty
	 */
	public boolean isEmpty()
	{
		return waiters.isEmpty();
	}

	/**
	 * Removes all waiters from the queue, instructing them to throw an exception.
	 *
	 * @param failure returns the exception that each waiter should throw
	 * @return the number of waiters that were removed
	 */
	public int failAll(Supplier<? extends RuntimeException> failure)
	{
		int count = waiters.size();
		for (W waiter : waiters)
			waiter.fail(failure.get());
		waiters.clear();
		return count;
	}

	@Override
	public Iterator<W> iterator()
	{
		return Collections.unmodifiableList(waiters).iterator();
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(WaitQueue.class).
			add("mode", mode).
			add("waiters", waiters.size()).
			toString();
	}
}
