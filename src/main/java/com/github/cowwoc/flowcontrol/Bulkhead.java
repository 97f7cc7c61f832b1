package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.annotation.CheckReturnValue;
import com.github.cowwoc.flowcontrol.internal.CloseableLock;
import com.github.cowwoc.flowcontrol.internal.LockAsResource;
import com.github.cowwoc.flowcontrol.internal.PoolSelector;
import com.github.cowwoc.flowcontrol.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Isolates tasks into independent single-slot pools.
 * <p>
 * Each task is assigned to a pool according to the {@link SelectionPolicy}, without regard to how busy the
 * pool is. A pool runs one task at a time, so a slow task only delays the tasks queued in its own pool.
 * <p>
 * {@code queueSize} is advisory: tasks queued beyond it are logged but never rejected.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class Bulkhead implements FlowController
{
	private final List<Semaphore> pools;
	private final int queueSize;
	private final Duration timeout;
	private final BulkheadListener listener;
	private final LockAsResource lock = new LockAsResource();
	private final PoolSelector<Semaphore> selector;
	private final Logger log = LoggerFactory.getLogger(Bulkhead.class);

	/**
	 * Builds a new bulkhead.
	 *
	 * @return a Bulkhead builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new bulkhead.
	 *
	 * @param poolSize        the number of pools
	 * @param queueSize       the number of tasks that may wait on a pool before a warning is logged
	 * @param timeout         the maximum amount of time that {@link #execute(Callable)} waits for a pool
	 *                        ({@code null} to wait indefinitely)
	 * @param selectionPolicy selects the pool that runs the next task
	 * @param listener        the event listener
	 */
	private Bulkhead(int poolSize, int queueSize, Duration timeout, SelectionPolicy selectionPolicy,
	                 BulkheadListener listener)
	{
		List<Semaphore> pools = new ArrayList<>(poolSize);
		for (int i = 0; i < poolSize; ++i)
			pools.add(Semaphore.builder().capacity(1).build());
		this.pools = List.copyOf(pools);
		this.queueSize = queueSize;
		this.timeout = timeout;
		this.listener = listener;
		this.selector = selectionPolicy.createSelector();
	}

	/**
	 * @return the number of pools
	 */
	public int getPoolSize()
	{
		return pools.size();
	}

	/**
	 * @return the number of tasks that may wait on a pool before a warning is logged
	 */
	public int getQueueSize()
	{
		return queueSize;
	}

	/**
	 * @return the number of pools that are not running a task
	 */
	public int getAvailablePools()
	{
		int result = 0;
		for (Semaphore pool : pools)
			result += pool.getAvailablePermits();
		return result;
	}

	/**
	 * @return the number of tasks waiting for a pool, across all pools
	 */
	public int getQueueLength()
	{
		int result = 0;
		for (Semaphore pool : pools)
			result += pool.getQueueLength();
		return result;
	}

	/**
	 * Runs a task in the next pool, blocking for up to the bulkhead's default timeout.
	 *
	 * @throws java.util.concurrent.TimeoutException if the timeout elapses before the pool is free
	 */
	@Override
	public <V> V execute(Callable<V> task) throws Exception
	{
		return execute(task, timeout);
	}

	/**
	 * Runs a task in the next pool.
	 *
	 * @param <V>     the type of value returned by the task
	 * @param task    the task
	 * @param timeout the maximum amount of time to wait for the pool ({@code null} to wait indefinitely)
	 * @return the value returned by the task
	 * @throws NullPointerException                   if {@code task} is null
	 * @throws IllegalArgumentException               if {@code timeout} is negative
	 * @throws java.util.concurrent.TimeoutException if the timeout elapses before the pool is free
	 * @throws Exception                              if the task throws an exception
	 */
	public <V> V execute(Callable<V> task, Duration timeout) throws Exception
	{
		requireThat(task, "task").isNotNull();
		Semaphore pool;
		int index;
		try (CloseableLock ignored = lock.lock())
		{
			pool = selector.nextPool(pools);
			index = pools.indexOf(pool);
		}
		int queueLength = pool.getQueueLength();
		if (queueLength >= queueSize)
		{
			log.warn("Pool {} has {} queued tasks, exceeding the queue size of {}", index, queueLength + 1,
				queueSize);
		}
		try
		{
			pool.acquire(timeout);
		}
		catch (Exception e)
		{
			listener.onIsolationFailure(this, e);
			throw e;
		}
		try
		{
			return task.call();
		}
		catch (Exception e)
		{
			listener.onIsolationFailure(this, e);
			throw e;
		}
		finally
		{
			pool.release();
		}
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(Bulkhead.class).
			add("poolSize", pools.size()).
			add("availablePools", getAvailablePools()).
			add("queueLength", getQueueLength()).
			add("queueSize", queueSize).
			toString();
	}

	/**
	 * Builds a bulkhead.
	 */
	public static final class Builder
	{
		private int poolSize = 1;
		private int queueSize = 100;
		private Duration timeout;
		private SelectionPolicy selectionPolicy = SelectionPolicy.ROUND_ROBIN;
		private BulkheadListener listener = new BulkheadListener()
		{
		};

		/**
		 * Prevent construction.
		 */
		Builder()
		{
		}

		/**
		 * Returns the number of pools. The default is {@code 1}.
		 *
		 * @return the number of pools
		 */
		@CheckReturnValue
		public int poolSize()
		{
			return poolSize;
		}

		/**
		 * Sets the number of pools.
		 *
		 * @param poolSize the number of pools
		 * @return this
		 * @throws IllegalArgumentException if {@code poolSize} is negative or zero
		 */
		@CheckReturnValue
		public Builder poolSize(int poolSize)
		{
			requireThat(poolSize, "poolSize").isPositive();
			this.poolSize = poolSize;
			return this;
		}

		/**
		 * Returns the number of tasks that may wait on a pool before a warning is logged. The default is
		 * {@code 100}.
		 *
		 * @return the advisory queue size of each pool
		 */
		@CheckReturnValue
		public int queueSize()
		{
			return queueSize;
		}

		/**
		 * Sets the number of tasks that may wait on a pool before a warning is logged.
		 *
		 * @param queueSize the advisory queue size of each pool
		 * @return this
		 * @throws IllegalArgumentException if {@code queueSize} is negative
		 */
		@CheckReturnValue
		public Builder queueSize(int queueSize)
		{
			requireThat(queueSize, "queueSize").isNotNegative();
			this.queueSize = queueSize;
			return this;
		}

		/**
		 * Returns the maximum amount of time to wait for a pool. The default is {@code null}.
		 *
		 * @return {@code null} if callers wait indefinitely
		 */
		@CheckReturnValue
		public Duration timeout()
		{
			return timeout;
		}

		/**
		 * Sets the maximum amount of time to wait for a pool.
		 *
		 * @param timeout the maximum amount of time to wait ({@code null} to wait indefinitely)
		 * @return this
		 * @throws IllegalArgumentException if {@code timeout} is negative or zero
		 */
		@CheckReturnValue
		public Builder timeout(Duration timeout)
		{
			if (timeout != null)
				requireThat(timeout, "timeout").isGreaterThan(Duration.ZERO);
			this.timeout = timeout;
			return this;
		}

		/**
		 * Returns the policy that selects the pool that runs the next task. The default is
		 * {@link SelectionPolicy#ROUND_ROBIN ROUND_ROBIN}.
		 *
		 * @return the selection policy
		 */
		@CheckReturnValue
		public SelectionPolicy selectionPolicy()
		{
			return selectionPolicy;
		}

		/**
		 * Sets the policy that selects the pool that runs the next task.
		 *
		 * @param selectionPolicy the selection policy
		 * @return this
		 * @throws NullPointerException if {@code selectionPolicy} is null
		 */
		@CheckReturnValue
		public Builder selectionPolicy(SelectionPolicy selectionPolicy)
		{
			requireThat(selectionPolicy, "selectionPolicy").isNotNull();
			this.selectionPolicy = selectionPolicy;
			return this;
		}

		/**
		 * Returns the event listener.
		 *
		 * @return the event listener
		 */
		@CheckReturnValue
		public BulkheadListener listener()
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
		public Builder listener(BulkheadListener listener)
		{
			requireThat(listener, "listener").isNotNull();
			this.listener = listener;
			return this;
		}

		/**
		 * Builds a new Bulkhead.
		 *
		 * @return a new Bulkhead
		 */
		public Bulkhead build()
		{
			return new Bulkhead(poolSize, queueSize, timeout, selectionPolicy, listener);
		}
	}
}
