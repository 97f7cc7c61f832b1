package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.annotation.CheckReturnValue;
import com.github.cowwoc.flowcontrol.internal.CloseableLock;
import com.github.cowwoc.flowcontrol.internal.Deadline;
import com.github.cowwoc.flowcontrol.internal.LockAsResource;
import com.github.cowwoc.flowcontrol.internal.ToStringBuilder;
import com.github.cowwoc.flowcontrol.internal.WaitQueue;
import com.github.cowwoc.flowcontrol.internal.Waiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.function.ToDoubleFunction;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Runs at most {@code concurrency} tasks at a time. Other tasks wait in a queue that is ordered by
 * {@link QueueMode}.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 *
 * @param <T> the type of arguments passed to tasks
 */
public final class TaskQueue<T> implements FlowController
{
	private final int concurrency;
	private final QueueMode queueMode;
	private final ToDoubleFunction<? super T> priorityFunction;
	private final int maxQueueSize;
	private final TaskQueueListener listener;
	private final LockAsResource lock = new LockAsResource();
	private final WaitQueue<Waiter> queue;
	private int runningTasks;
	private final Logger log = LoggerFactory.getLogger(TaskQueue.class);

	/**
	 * Builds a new queue.
	 *
	 * @param <T> the type of arguments passed to tasks
	 * @return a TaskQueue builder
	 */
	public static <T> Builder<T> builder()
	{
		return new Builder<>();
	}

	/**
	 * Creates a new queue.
	 *
	 * @param builder the queue's configuration
	 */
	private TaskQueue(Builder<T> builder)
	{
		this.concurrency = builder.concurrency;
		this.queueMode = builder.queueMode;
		this.priorityFunction = builder.priorityFunction;
		this.maxQueueSize = builder.maxQueueSize;
		this.listener = builder.listener;
		this.queue = new WaitQueue<>(queueMode);
	}

	/**
	 * @return the maximum number of tasks that may run concurrently
	 */
	public int getConcurrency()
	{
		return concurrency;
	}

	/**
	 * @return the order in which queued tasks run
	 */
	public QueueMode getQueueMode()
	{
		return queueMode;
	}

	/**
	 * @return the number of tasks waiting in the queue
	 */
	public int getQueueLength()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return queue.size();
		}
	}

	/**
	 * @return the number of tasks that are running
	 */
	public int getRunningTasks()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return runningTasks;
		}
	}

	/**
	 * Runs a task with a priority of {@code 0}.
	 *
	 * @throws CapacityExceededException if the queue is full
	 */
	@Override
	public <V> V execute(Callable<V> task) throws Exception
	{
		requireThat(task, "task").isNotNull();
		acquire(0);
		try
		{
			return task.call();
		}
		finally
		{
			release();
		}
	}

	/**
	 * Runs a task once the queue allows it.
	 *
	 * @param <V>      the type of value returned by the task
	 * @param argument the argument to pass to the task, which also determines its priority
	 * @param task     the task
	 * @return the value returned by the task
	 * @throws NullPointerException      if {@code task} is null
	 * @throws CapacityExceededException if the queue is full
	 * @throws Exception                 if the task throws an exception
	 */
	public <V> V execute(T argument, Callable1<? super T, V> task) throws Exception
	{
		requireThat(task, "task").isNotNull();
		acquire(priorityFunction.applyAsDouble(argument));
		try
		{
			return task.call(argument);
		}
		finally
		{
			release();
		}
	}

	/**
	 * Blocks until the caller may run.
	 *
	 * @param priority the priority of the task
	 * @throws CapacityExceededException if the queue is full
	 * @throws InterruptedException      if the thread is interrupted while waiting
	 */
	private void acquire(double priority) throws InterruptedException
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (runningTasks < concurrency)
			{
				++runningTasks;
				return;
			}
			if (queue.size() >= maxQueueSize)
				throw new CapacityExceededException("The queue is full. maxQueueSize: " + maxQueueSize);
			Waiter waiter = new Waiter(lock.newCondition(), priority, Instant.now());
			queue.add(waiter);
			log.debug("Queued task. queueLength: {}", queue.size());
			listener.onQueueChange(this, queue.size());
			try
			{
				boolean started = waiter.await(Deadline.never());
				assert (started);
			}
			catch (InterruptedException e)
			{
				queue.remove(waiter);
				listener.onQueueChange(this, queue.size());
				throw e;
			}
		}
	}

	/**
	 * Hands the caller's execution slot to the next queued task.
	 */
	private void release()
	{
		try (CloseableLock ignored = lock.lock())
		{
			Waiter next = queue.poll();
			if (next == null)
			{
				--runningTasks;
				return;
			}
			next.resume();
			listener.onQueueChange(this, queue.size());
		}
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return new ToStringBuilder(TaskQueue.class).
				add("concurrency", concurrency).
				add("runningTasks", runningTasks).
				add("queueMode", queueMode).
				add("queueLength", queue.size()).
				add("maxQueueSize", maxQueueSize).
				toString();
		}
	}

	/**
	 * Builds a task queue.
	 *
	 * @param <T> the type of arguments passed to tasks
	 */
	public static final class Builder<T>
	{
		private int concurrency = 1;
		private QueueMode queueMode = QueueMode.FIFO;
		private ToDoubleFunction<? super T> priorityFunction = argument -> 0;
		private int maxQueueSize = Integer.MAX_VALUE;
		private TaskQueueListener listener = new TaskQueueListener()
		{
		};

		/**
		 * Prevent construction.
		 */
		Builder()
		{
		}

		/**
		 * Returns the maximum number of tasks that may run concurrently. The default is {@code 1}.
		 *
		 * @return the maximum number of tasks that may run concurrently
		 */
		@CheckReturnValue
		public int concurrency()
		{
			return concurrency;
		}

		/**
		 * Sets the maximum number of tasks that may run concurrently.
		 *
		 * @param concurrency the maximum number of tasks that may run concurrently
		 * @return this
		 * @throws IllegalArgumentException if {@code concurrency} is negative or zero
		 */
		@CheckReturnValue
		public Builder<T> concurrency(int concurrency)
		{
			requireThat(concurrency, "concurrency").isPositive();
			this.concurrency = concurrency;
			return this;
		}

		/**
		 * Returns the order in which queued tasks run. The default is {@link QueueMode#FIFO FIFO}.
		 *
		 * @return the order in which queued tasks run
		 */
		@CheckReturnValue
		public QueueMode queueMode()
		{
			return queueMode;
		}

		/**
		 * Sets the order in which queued tasks run.
		 *
		 * @param queueMode the order in which queued tasks run
		 * @return this
		 * @throws NullPointerException if {@code queueMode} is null
		 */
		@CheckReturnValue
		public Builder<T> queueMode(QueueMode queueMode)
		{
			requireThat(queueMode, "queueMode").isNotNull();
			this.queueMode = queueMode;
			return this;
		}

		/**
		 * Returns the function that calculates the priority of a task from its argument. The default returns
		 * {@code 0}.
		 *
		 * @return the priority function
		 */
		@CheckReturnValue
		public ToDoubleFunction<? super T> priorityFunction()
		{
			return priorityFunction;
		}

		/**
		 * Sets the function that calculates the priority of a task from its argument. Priorities are ignored
		 * unless the queue mode is {@link QueueMode#PRIORITY PRIORITY}.
		 *
		 * @param priorityFunction the priority function
		 * @return this
		 * @throws NullPointerException if {@code priorityFunction} is null
		 */
		@CheckReturnValue
		public Builder<T> priorityFunction(ToDoubleFunction<? super T> priorityFunction)
		{
			requireThat(priorityFunction, "priorityFunction").isNotNull();
			this.priorityFunction = priorityFunction;
			return this;
		}

		/**
		 * Returns the maximum number of tasks that may wait in the queue. The default is
		 * {@code Integer.MAX_VALUE}.
		 *
		 * @return the maximum number of tasks that may wait in the queue
		 */
		@CheckReturnValue
		public int maxQueueSize()
		{
			return maxQueueSize;
		}

		/**
		 * Sets the maximum number of tasks that may wait in the queue.
		 *
		 * @param maxQueueSize the maximum number of tasks that may wait in the queue
		 * @return this
		 * @throws IllegalArgumentException if {@code maxQueueSize} is negative
		 */
		@CheckReturnValue
		public Builder<T> maxQueueSize(int maxQueueSize)
		{
			requireThat(maxQueueSize, "maxQueueSize").isNotNegative();
			this.maxQueueSize = maxQueueSize;
			return this;
		}

		/**
		 * Returns the event listener.
		 *
		 * @return the event listener
		 */
		@CheckReturnValue
		public TaskQueueListener listener()
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
		public Builder<T> listener(TaskQueueListener listener)
		{
			requireThat(listener, "listener").isNotNull();
			this.listener = listener;
			return this;
		}

		/**
		 * Builds a new TaskQueue.
		 *
		 * @return a new TaskQueue
		 */
		public TaskQueue<T> build()
		{
			return new TaskQueue<>(this);
		}
	}
}
