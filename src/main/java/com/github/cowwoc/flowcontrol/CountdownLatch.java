package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.annotation.CheckReturnValue;
import com.github.cowwoc.flowcontrol.internal.CloseableLock;
import com.github.cowwoc.flowcontrol.internal.Conditions;
import com.github.cowwoc.flowcontrol.internal.Deadline;
import com.github.cowwoc.flowcontrol.internal.LockAsResource;
import com.github.cowwoc.flowcontrol.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.Condition;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Blocks threads until a count reaches zero.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class CountdownLatch implements FlowController
{
	private final int initialCount;
	private final Runnable onComplete;
	private final LockAsResource lock = new LockAsResource();
	private final Condition completed = lock.newCondition();
	private int count;
	private int waitingCount;
	private final Logger log = LoggerFactory.getLogger(CountdownLatch.class);

	/**
	 * Builds a new latch.
	 *
	 * @return a CountdownLatch builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new latch.
	 *
	 * @param count      the number of times that {@link #countDown()} must be invoked before waiting threads
	 *                   are released
	 * @param onComplete the action to run when the count reaches zero
	 */
	private CountdownLatch(int count, Runnable onComplete)
	{
		this.initialCount = count;
		this.count = count;
		this.onComplete = onComplete;
	}

	/**
	 * @return the current count
	 */
	public int getCount()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return count;
		}
	}

	/**
	 * @return true if the count has reached zero
	 */
	public boolean isComplete()
	{
		return getCount() == 0;
	}

	/**
	 * @return the number of threads waiting for the count to reach zero
	 */
	public int getWaitingCount()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return waitingCount;
		}
	}

	/**
	 * Decrements the count. When the count reaches zero the completion action runs, and then waiting
	 * threads are released.
	 *
	 * @throws IllegalStateException if the count is already zero
	 */
	public void countDown()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (count == 0)
				throw new IllegalStateException("The count is already zero");
			--count;
			log.debug("count: {}", count);
			if (count > 0)
				return;
			try
			{
				onComplete.run();
			}
			finally
			{
				completed.signalAll();
			}
		}
	}

	/**
	 * Waits for the count to reach zero.
	 *
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	public void await() throws InterruptedException
	{
		boolean reachedZero = await(null);
		assert (reachedZero);
	}

	/**
	 * Waits for the count to reach zero.
	 *
	 * @param timeout the maximum amount of time to wait ({@code null} to wait indefinitely)
	 * @return false if the timeout elapsed before the count reached zero
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws InterruptedException     if the thread is interrupted while waiting
	 */
	public boolean await(Duration timeout) throws InterruptedException
	{
		if (timeout != null)
			requireThat(timeout, "timeout").isGreaterThanOrEqualTo(Duration.ZERO);
		Deadline deadline = Deadline.after(timeout);
		try (CloseableLock ignored = lock.lock())
		{
			++waitingCount;
			try
			{
				while (count > 0)
				{
					if (!Conditions.await(completed, deadline))
						return false;
				}
				return true;
			}
			finally
			{
				--waitingCount;
			}
		}
	}

	/**
	 * Restores the initial count. Threads that are waiting keep waiting for the new count to reach zero.
	 */
	public void reset()
	{
		try (CloseableLock ignored = lock.lock())
		{
			count = initialCount;
		}
	}

	/**
	 * Runs a task and then decrements the count, even if the task throws an exception.
	 *
	 * @throws IllegalStateException if the count is already zero when the task completes
	 */
	@Override
	public <V> V execute(Callable<V> task) throws Exception
	{
		requireThat(task, "task").isNotNull();
		try
		{
			return task.call();
		}
		finally
		{
			countDown();
		}
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return new ToStringBuilder(CountdownLatch.class).
				add("count", count).
				add("initialCount", initialCount).
				add("waitingCount", waitingCount).
				toString();
		}
	}

	/**
	 * Builds a latch.
	 */
	public static final class Builder
	{
		private int count = 1;
		private Runnable onComplete = () ->
		{
		};

		/**
		 * Prevent construction.
		 */
		Builder()
		{
		}

		/**
		 * Returns the initial count. The default is {@code 1}.
		 *
		 * @return the initial count
		 */
		@CheckReturnValue
		public int count()
		{
			return count;
		}

		/**
		 * Sets the initial count.
		 *
		 * @param count the initial count
		 * @return this
		 * @throws IllegalArgumentException if {@code count} is negative
		 */
		@CheckReturnValue
		public Builder count(int count)
		{
			requireThat(count, "count").isNotNegative();
			this.count = count;
			return this;
		}

		/**
		 * Returns the action to run when the count reaches zero. The default does nothing.
		 *
		 * @return the completion action
		 */
		@CheckReturnValue
		public Runnable onComplete()
		{
			return onComplete;
		}

		/**
		 * Sets the action to run when the count reaches zero.
		 *
		 * @param onComplete the completion action
		 * @return this
		 * @throws NullPointerException if {@code onComplete} is null
		 */
		@CheckReturnValue
		public Builder onComplete(Runnable onComplete)
		{
			requireThat(onComplete, "onComplete").isNotNull();
			this.onComplete = onComplete;
			return this;
		}

		/**
		 * Builds a new CountdownLatch.
		 *
		 * @return a new CountdownLatch
		 */
		public CountdownLatch build()
		{
			return new CountdownLatch(count, onComplete);
		}
	}
}
