package com.github.cowwoc.flowcontrol.internal;

import com.github.cowwoc.flowcontrol.QueueMode;
import org.testng.annotations.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class WaitQueueTest
{
	private final ReentrantLock lock = new ReentrantLock();

	private Waiter newWaiter(double priority)
	{
		return new Waiter(lock.newCondition(), priority, Instant.now());
	}

	private static List<Double> drain(WaitQueue<Waiter> queue)
	{
		List<Double> priorities = new ArrayList<>();
		while (!queue.isEmpty())
			priorities.add(queue.poll().getPriority());
		return priorities;
	}

	@Test
	public void fifo()
	{
		WaitQueue<Waiter> queue = new WaitQueue<>(QueueMode.FIFO);
		requireThat(queue.add(newWaiter(1)), "position").isEqualTo(1);
		requireThat(queue.add(newWaiter(2)), "position").isEqualTo(2);
		requireThat(queue.add(newWaiter(3)), "position").isEqualTo(3);
		requireThat(drain(queue), "drain(queue)").isEqualTo(List.of(1.0, 2.0, 3.0));
	}

	@Test
	public void lifo()
	{
		WaitQueue<Waiter> queue = new WaitQueue<>(QueueMode.LIFO);
		queue.add(newWaiter(1));
		queue.add(newWaiter(2));
		requireThat(queue.add(newWaiter(3)), "position").isEqualTo(1);
		requireThat(drain(queue), "drain(queue)").isEqualTo(List.of(3.0, 2.0, 1.0));
	}

	@Test
	public void priorityDescending()
	{
		WaitQueue<Waiter> queue = new WaitQueue<>(QueueMode.PRIORITY);
		queue.add(newWaiter(1));
		queue.add(newWaiter(5));
		requireThat(queue.add(newWaiter(3)), "position").isEqualTo(2);
		requireThat(drain(queue), "drain(queue)").isEqualTo(List.of(5.0, 3.0, 1.0));
	}

	@Test
	public void priorityTiesInArrivalOrder()
	{
		WaitQueue<Waiter> queue = new WaitQueue<>(QueueMode.PRIORITY);
		Waiter first = newWaiter(2);
		Waiter second = newWaiter(2);
		Waiter third = newWaiter(7);
		queue.add(first);
		queue.add(second);
		queue.add(third);
		requireThat(queue.poll(), "queue.poll()").isSameObjectAs(third, "third");
		requireThat(queue.poll(), "queue.poll()").isSameObjectAs(first, "first");
		requireThat(queue.poll(), "queue.poll()").isSameObjectAs(second, "second");
	}

	@Test
	public void reorderAfterPriorityChange()
	{
		WaitQueue<Waiter> queue = new WaitQueue<>(QueueMode.PRIORITY);
		Waiter low = newWaiter(1);
		Waiter high = newWaiter(5);
		queue.add(low);
		queue.add(high);
		low.setPriority(10);
		queue.reorder();
		requireThat(queue.peek(), "queue.peek()").isSameObjectAs(low, "low");
		requireThat(queue.peekLast(), "queue.peekLast()").isSameObjectAs(high, "high");
	}

	@Test
	public void failAll()
	{
		WaitQueue<Waiter> queue = new WaitQueue<>(QueueMode.FIFO);
		Waiter first = newWaiter(0);
		Waiter second = newWaiter(0);
		queue.add(first);
		queue.add(second);
		lock.lock();
		try
		{
			int failed = queue.failAll(() -> new CancellationException("reset"));
			requireThat(failed, "failed").isEqualTo(2);
		}
		finally
		{
			lock.unlock();
		}
		requireThat(queue.isEmpty(), "queue.isEmpty()").isTrue();
		requireThat(first.isDone(), "first.isDone()").isTrue();
		requireThat(second.getFailure(), "second.getFailure()").isInstanceOf(CancellationException.class);
	}
}
