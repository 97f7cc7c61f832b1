package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.annotation.CheckReturnValue;
import com.github.cowwoc.flowcontrol.internal.CloseableLock;
import com.github.cowwoc.flowcontrol.internal.Conditions;
import com.github.cowwoc.flowcontrol.internal.Deadline;
import com.github.cowwoc.flowcontrol.internal.LockAsResource;
import com.github.cowwoc.flowcontrol.internal.ToStringBuilder;
import com.github.cowwoc.flowcontrol.internal.WaitQueue;
import com.github.cowwoc.flowcontrol.internal.Waiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.function.BiFunction;
import java.util.function.ToDoubleFunction;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Runs items in priority order, at most {@code maxConcurrent} at a time.
 * <p>
 * Items with a higher priority run first. Items with the same priority run in arrival order. If starvation
 * prevention is enabled, an item that waits longer than {@code starvationThreshold} has its priority
 * boosted, once, by the number of whole seconds it has waited.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 *
 * @param <P> the type of items
 */
public final class PriorityQueueExecutor<P>
{
	private final ToDoubleFunction<? super P> priorityFunction;
	private final int maxQueueSize;
	private final int maxConcurrent;
	private final boolean starvationPrevention;
	private final Duration starvationThreshold;
	private final QueueFullPolicy queueFullPolicy;
	private final Duration timeout;
	private final PriorityQueueListener<P> listener;
	private final LockAsResource lock = new LockAsResource();
	private final WaitQueue<Item<P>> queue = new WaitQueue<>(QueueMode.PRIORITY);
	/**
	 * Signalled when an item leaves the queue.
	 */
	private final Condition spaceAvailable = lock.newCondition();
	private int activeCount;
	private final Logger log = LoggerFactory.getLogger(PriorityQueueExecutor.class);

	/**
	 * Builds a new executor.
	 *
	 * @param <P>              the type of items
	 * @param priorityFunction returns the priority of an item
	 * @return a PriorityQueueExecutor builder
	 * @throws NullPointerException if {@code priorityFunction} is null
	 */
	public static <P> Builder<P> builder(ToDoubleFunction<? super P> priorityFunction)
	{
		return new Builder<>(priorityFunction);
	}

	/**
	 * Creates a new executor.
	 *
	 * @param builder the executor's configuration
	 */
	private PriorityQueueExecutor(Builder<P> builder)
	{
		this.priorityFunction = builder.priorityFunction;
		this.maxQueueSize = builder.maxQueueSize;
		this.maxConcurrent = builder.maxConcurrent;
		this.starvationPrevention = builder.starvationPrevention;
		this.starvationThreshold = builder.starvationThreshold;
		this.queueFullPolicy = builder.queueFullPolicy;
		this.timeout = builder.timeout;
		this.listener = builder.listener;
	}

	/**
	 * @return the maximum number of items that may wait in the queue
	 */
	public int getMaxQueueSize()
	{
		return maxQueueSize;
	}

	/**
	 * @return the maximum number of items that may run concurrently
	 */
	public int getMaxConcurrent()
	{
		return maxConcurrent;
	}

	/**
	 * @return true if the priority of items that wait too long is boosted
	 */
	public boolean isStarvationPrevention()
	{
		return starvationPrevention;
	}

	/**
	 * @return the handling of items that arrive while the queue is full
	 */
	public QueueFullPolicy getQueueFullPolicy()
	{
		return queueFullPolicy;
	}

	/**
	 * @return the number of items waiting to run
	 */
	public int getQueueLength()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return queue.size();
		}
	}

	/**
	 * @return the number of items that are running
	 */
	public int getActiveCount()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return activeCount;
		}
	}

	/**
	 * Runs a task once the item reaches the head of the queue.
	 *
	 * @param <V>  the type of value returned by the task
	 * @param item the item
	 * @param task the task to run on the item
	 * @return the value returned by the task
	 * @throws NullPointerException      if {@code task} is null
	 * @throws CapacityExceededException if the queue is full and the item is rejected
	 * @throws CancellationException     if the item is dropped to make room for a higher priority item
	 * @throws TimeoutException          if the default timeout elapses before the item runs
	 * @throws Exception                 if the task throws an exception
	 */
	public <V> V execute(P item, Callable1<? super P, V> task) throws Exception
	{
		requireThat(task, "task").isNotNull();
		acquire(item);
		try
		{
			return task.call(item);
		}
		finally
		{
			release();
		}
	}

	/**
	 * Wraps a task that takes one argument.
	 *
	 * @param <V>  the type of value returned by the task
	 * @param task the task
	 * @return a task that queues its argument before running {@code task}
	 * @throws NullPointerException if {@code task} is null
	 */
	@CheckReturnValue
	public <V> Callable1<P, V> wrap(Callable1<? super P, V> task)
	{
		requireThat(task, "task").isNotNull();
		return item -> execute(item, task);
	}

	/**
	 * Wraps a task that takes two arguments. The arguments are combined into the item that is queued, so
	 * the executor's priority function sees both of them.
	 *
	 * @param <A>    the type of the first argument
	 * @param <B>    the type of the second argument
	 * @param <V>    the type of value returned by the task
	 * @param toItem combines the arguments into an item
	 * @param task   the task
	 * @return a task that queues its arguments before running {@code task}
	 * @throws NullPointerException if any of the arguments are null
	 */
	@CheckReturnValue
	public <A, B, V> Callable2<A, B, V> wrap(BiFunction<? super A, ? super B, ? extends P> toItem,
	                                         Callable2<? super A, ? super B, V> task)
	{
		requireThat(toItem, "toItem").isNotNull();
		requireThat(task, "task").isNotNull();
		return (first, second) -> execute(toItem.apply(first, second), item -> task.call(first, second));
	}

	/**
	 * Blocks until the item is dispatched.
	 *
	 * @param payload the item
	 * @throws CapacityExceededException if the queue is full and the item is rejected
	 * @throws CancellationException     if the item is dropped to make room for a higher priority item
	 * @throws InterruptedException      if the thread is interrupted while waiting
	 * @throws TimeoutException          if the default timeout elapses before the item is dispatched
	 */
	private void acquire(P payload) throws InterruptedException, TimeoutException
	{
		Deadline deadline = Deadline.after(timeout);
		try (CloseableLock ignored = lock.lock())
		{
			double priority = priorityFunction.applyAsDouble(payload);
			if (queue.size() >= maxQueueSize)
				makeRoom(payload, priority, deadline);
			Item<P> item = new Item<>(lock.newCondition(), priority, Instant.now(), payload);
			queue.add(item);
			dispatch();

			boolean dispatched;
			try
			{
				dispatched = item.await(deadline);
			}
			catch (InterruptedException e)
			{
				queue.remove(item);
				spaceAvailable.signalAll();
				throw e;
			}
			if (!dispatched)
			{
				queue.remove(item);
				spaceAvailable.signalAll();
				throw new TimeoutException("Timed out after " + timeout + " waiting for the item to run");
			}
			RuntimeException failure = item.getFailure();
			if (failure != null)
				throw failure;
		}
	}

	/**
	 * Applies the queue-full policy.
	 *
	 * @param payload  the new item
	 * @param priority the priority of the new item
	 * @param deadline the time at which to give up waiting for room
	 * @throws CapacityExceededException if the new item is rejected
	 * @throws InterruptedException      if the thread is interrupted while waiting for room
	 * @throws TimeoutException          if the deadline expires while waiting for room
	 */
	private void makeRoom(P payload, double priority, Deadline deadline)
		throws InterruptedException, TimeoutException
	{
		switch (queueFullPolicy)
		{
			case DROP_LOWEST_PRIORITY ->
			{
				Item<P> lowest = queue.peekLast();
				if (priority > lowest.getPriority())
				{
					queue.pollLast();
					lowest.fail(new CancellationException("Dropped to make room for a higher priority item"));
					log.debug("Dropped item with priority {} in favor of priority {}", lowest.getPriority(),
						priority);
					listener.onItemDropped(this, lowest.payload);
					return;
				}
				listener.onItemDropped(this, payload);
				throw new CapacityExceededException("The queue is full and the item's priority (" + priority +
					") does not exceed the lowest queued priority (" + lowest.getPriority() + ")");
			}
			case DROP_NEW ->
			{
				listener.onItemDropped(this, payload);
				throw new CapacityExceededException("The queue is full. maxQueueSize: " + maxQueueSize);
			}
			case ERROR -> throw new CapacityExceededException("The queue is full. maxQueueSize: " + maxQueueSize);
			case WAIT_FOR_SPACE ->
			{
				while (queue.size() >= maxQueueSize)
				{
					if (!Conditions.await(spaceAvailable, deadline))
					{
						throw new TimeoutException("Timed out after " + timeout + " waiting for room in the " +
							"queue");
					}
				}
			}
			default -> throw new AssertionError(queueFullPolicy.name());
		}
	}

	/**
	 * Signals that an item finished running.
	 */
	private void release()
	{
		try (CloseableLock ignored = lock.lock())
		{
			--activeCount;
			dispatch();
		}
	}

	/**
	 * Starts items from the head of the queue while execution slots are available.
	 */
	private void dispatch()
	{
		if (starvationPrevention && activeCount < maxConcurrent)
			preventStarvation(Instant.now());
		while (activeCount < maxConcurrent && !queue.isEmpty())
		{
			++activeCount;
			queue.poll().resume();
			spaceAvailable.signalAll();
		}
	}

	/**
	 * Boosts the priority of items that have waited longer than {@code starvationThreshold}. Each item is
	 * boosted at most once.
	 *
	 * @param now the current time
	 */
	void preventStarvation(Instant now)
	{
		try (CloseableLock ignored = lock.lock())
		{
			boolean boosted = false;
			for (Item<P> item : queue)
			{
				if (item.boosted)
					continue;
				Duration waited = Duration.between(item.getEnqueuedAt(), now);
				if (waited.compareTo(starvationThreshold) <= 0)
					continue;
				double boost = waited.toSeconds();
				item.setPriority(item.getPriority() + boost);
				item.boosted = true;
				boosted = true;
				log.debug("Boosted priority by {} after waiting {}", boost, waited);
				listener.onStarvationPrevention(this, item.payload);
			}
			if (boosted)
				queue.reorder();
		}
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return new ToStringBuilder(PriorityQueueExecutor.class).
				add("queueLength", queue.size()).
				add("activeCount", activeCount).
				add("maxQueueSize", maxQueueSize).
				add("maxConcurrent", maxConcurrent).
				add("queueFullPolicy", queueFullPolicy).
				add("starvationPrevention", starvationPrevention).
				toString();
		}
	}

	/**
	 * An item waiting to run.
	 *
	 * @param <P> the type of the item
	 */
	private static final class Item<P> extends Waiter
	{
		final P payload;
		boolean boosted;

		/**
		 * @param condition  the condition that the waiting thread blocks on
		 * @param priority   the priority of the item
		 * @param enqueuedAt the time at which the item was queued
		 * @param payload    the item
		 */
		Item(Condition condition, double priority, Instant enqueuedAt, P payload)
		{
			super(condition, priority, enqueuedAt);
			this.payload = payload;
		}
	}

	/**
	 * Builds an executor.
	 *
	 * @param <P> the type of items
	 */
	public static final class Builder<P>
	{
		private final ToDoubleFunction<? super P> priorityFunction;
		private int maxQueueSize = 1000;
		private int maxConcurrent = 1;
		private boolean starvationPrevention = true;
		private Duration starvationThreshold = Duration.ofSeconds(5);
		private QueueFullPolicy queueFullPolicy = QueueFullPolicy.ERROR;
		private Duration timeout;
		private PriorityQueueListener<P> listener = new PriorityQueueListener<>()
		{
		};

		/**
		 * @param priorityFunction returns the priority of an item
		 * @throws NullPointerException if {@code priorityFunction} is null
		 */
		Builder(ToDoubleFunction<? super P> priorityFunction)
		{
			requireThat(priorityFunction, "priorityFunction").isNotNull();
			this.priorityFunction = priorityFunction;
		}

		/**
		 * Returns the maximum number of items that may wait in the queue. The default is {@code 1000}.
		 *
		 * @return the maximum number of items that may wait in the queue
		 */
		@CheckReturnValue
		public int maxQueueSize()
		{
			return maxQueueSize;
		}

		/**
		 * Sets the maximum number of items that may wait in the queue.
		 *
		 * @param maxQueueSize the maximum number of items that may wait in the queue
		 * @return this
		 * @throws IllegalArgumentException if {@code maxQueueSize} is negative or zero
		 */
		@CheckReturnValue
		public Builder<P> maxQueueSize(int maxQueueSize)
		{
			requireThat(maxQueueSize, "maxQueueSize").isPositive();
			this.maxQueueSize = maxQueueSize;
			return this;
		}

		/**
		 * Returns the maximum number of items that may run concurrently. The default is {@code 1}.
		 *
		 * @return the maximum number of items that may run concurrently
		 */
		@CheckReturnValue
		public int maxConcurrent()
		{
			return maxConcurrent;
		}

		/**
		 * Sets the maximum number of items that may run concurrently.
		 *
		 * @param maxConcurrent the maximum number of items that may run concurrently
		 * @return this
		 * @throws IllegalArgumentException if {@code maxConcurrent} is negative or zero
		 */
		@CheckReturnValue
		public Builder<P> maxConcurrent(int maxConcurrent)
		{
			requireThat(maxConcurrent, "maxConcurrent").isPositive();
			this.maxConcurrent = maxConcurrent;
			return this;
		}

		/**
		 * Indicates if the priority of items that wait too long is boosted. The default is {@code true}.
		 *
		 * @return true if the priority of items that wait too long is boosted
		 */
		@CheckReturnValue
		public boolean starvationPrevention()
		{
			return starvationPrevention;
		}

		/**
		 * Indicates if the priority of items that wait too long is boosted.
		 *
		 * @param starvationPrevention true if the priority of items that wait too long is boosted
		 * @return this
		 */
		@CheckReturnValue
		public Builder<P> starvationPrevention(boolean starvationPrevention)
		{
			this.starvationPrevention = starvationPrevention;
			return this;
		}

		/**
		 * Returns the amount of time that an item may wait before its priority is boosted. The default is
		 * {@code 5 seconds}.
		 *
		 * @return the amount of time that an item may wait before its priority is boosted
		 */
		@CheckReturnValue
		public Duration starvationThreshold()
		{
			return starvationThreshold;
		}

		/**
		 * Sets the amount of time that an item may wait before its priority is boosted.
		 *
		 * @param starvationThreshold the amount of time that an item may wait before its priority is boosted
		 * @return this
		 * @throws NullPointerException     if {@code starvationThreshold} is null
		 * @throws IllegalArgumentException if {@code starvationThreshold} is negative
		 */
		@CheckReturnValue
		public Builder<P> starvationThreshold(Duration starvationThreshold)
		{
			requireThat(starvationThreshold, "starvationThreshold").isGreaterThanOrEqualTo(Duration.ZERO);
			this.starvationThreshold = starvationThreshold;
			return this;
		}

		/**
		 * Returns the handling of items that arrive while the queue is full. The default is
		 * {@link QueueFullPolicy#ERROR ERROR}.
		 *
		 * @return the queue-full policy
		 */
		@CheckReturnValue
		public QueueFullPolicy queueFullPolicy()
		{
			return queueFullPolicy;
		}

		/**
		 * Sets the handling of items that arrive while the queue is full.
		 *
		 * @param queueFullPolicy the queue-full policy
		 * @return this
		 * @throws NullPointerException if {@code queueFullPolicy} is null
		 */
		@CheckReturnValue
		public Builder<P> queueFullPolicy(QueueFullPolicy queueFullPolicy)
		{
			requireThat(queueFullPolicy, "queueFullPolicy").isNotNull();
			this.queueFullPolicy = queueFullPolicy;
			return this;
		}

		/**
		 * Returns the maximum amount of time that an item may wait to run. The default is {@code null}.
		 *
		 * @return {@code null} if items wait indefinitely
		 */
		@CheckReturnValue
		public Duration timeout()
		{
			return timeout;
		}

		/**
		 * Sets the maximum amount of time that an item may wait to run, including time spent waiting for
		 * room in the queue.
		 *
		 * @param timeout the maximum amount of time to wait ({@code null} to wait indefinitely)
		 * @return this
		 * @throws IllegalArgumentException if {@code timeout} is negative or zero
		 */
		@CheckReturnValue
		public Builder<P> timeout(Duration timeout)
		{
			if (timeout != null)
				requireThat(timeout, "timeout").isGreaterThan(Duration.ZERO);
			this.timeout = timeout;
			return this;
		}

		/**
		 * Returns the event listener.
		 *
		 * @return the event listener
		 */
		@CheckReturnValue
		public PriorityQueueListener<P> listener()
		{
			return listener;
		}

		/**
		 * Sets the event listener.
		 *
		 * @param listener the event listener
		 * @return this
		 * @throws NullPointerException if {@code listener} is null
		 */
		@CheckReturnValue
		public Builder<P> listener(PriorityQueueListener<P> listener)
		{
			requireThat(listener, "listener").isNotNull();
			this.listener = listener;
			return this;
		}

		/**
		 * Builds a new PriorityQueueExecutor.
		 *
		 * @return a new PriorityQueueExecutor
		 */
		public PriorityQueueExecutor<P> build()
		{
			return new PriorityQueueExecutor<>(this);
		}
	}
}
