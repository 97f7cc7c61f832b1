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

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

import static com.github.cowwoc.requirements.DefaultRequirements.assertionsAreEnabled;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A counting semaphore with a configurable wait order.
 * <p>
 * A released permit is handed directly to the next waiter, so a thread that arrives while others are
 * queued cannot overtake them.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class Semaphore implements FlowController
{
	private final int capacity;
	private final QueueMode queueMode;
	private final Duration timeout;
	private final SemaphoreListener listener;
	private final LockAsResource lock = new LockAsResource();
	private final WaitQueue<Waiter> waiters;
	private int availablePermits;
	private final Logger log = LoggerFactory.getLogger(Semaphore.class);

	/**
	 * Builds a new semaphore.
	 *
	 * @return a Semaphore builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new semaphore.
	 *
	 * @param capacity  the number of permits
	 * @param queueMode the order in which blocked callers are granted permits
	 * @param timeout   the maximum amount of time that {@link #execute(Callable)} waits for a permit
	 *                  ({@code null} to wait indefinitely)
	 * @param listener  the event listener
	 */
	private Semaphore(int capacity, QueueMode queueMode, Duration timeout, SemaphoreListener listener)
	{
		this.capacity = capacity;
		this.queueMode = queueMode;
		this.timeout = timeout;
		this.listener = listener;
		this.waiters = new WaitQueue<>(queueMode);
		this.availablePermits = capacity;
	}

	/**
	 * Returns the total number of permits.
	 *
	 * @return the total number of permits
	 */
	public int getCapacity()
	{
		return capacity;
	}

	/**
	 * Returns the order in which blocked callers are granted permits.
	 *
	 * @return the order in which blocked callers are granted permits
	 */
	public QueueMode getQueueMode()
	{
		return queueMode;
	}

	/**
	 * Returns the maximum amount of time that {@link #execute(Callable)} waits for a permit.
	 *
	 * @return {@code null} if callers wait indefinitely
	 */
	public Duration getTimeout()
	{
		return timeout;
	}

	/**
	 * Returns the number of permits that may be acquired without blocking.
	 *
	 * @return the number of available permits
	 */
	public int getAvailablePermits()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return availablePermits;
		}
	}

	/**
	 * Returns the number of callers waiting for a permit.
	 *
	 * @return the number of blocked callers
	 */
	public int getQueueLength()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return waiters.size();
		}
	}

	/**
	 * Acquires a permit, blocking for up to the semaphore's default timeout.
	 *
	 * @throws InterruptedException if the thread is interrupted while waiting for a permit
	 * @throws TimeoutException     if the timeout elapses before a permit is acquired
	 */
	public void acquire() throws InterruptedException, TimeoutException
	{
		acquire(0, timeout);
	}

	/**
	 * Acquires a permit.
	 *
	 * @param timeout the maximum amount of time to wait ({@code null} to wait indefinitely)
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws InterruptedException     if the thread is interrupted while waiting for a permit
	 * @throws TimeoutException         if the timeout elapses before a permit is acquired
	 */
	public void acquire(Duration timeout) throws InterruptedException, TimeoutException
	{
		acquire(0, timeout);
	}

	/**
	 * Acquires a permit.
	 *
	 * @param priority the priority of the caller (ignored unless the queue mode is
	 *                 {@link QueueMode#PRIORITY PRIORITY})
	 * @param timeout  the maximum amount of time to wait ({@code null} to wait indefinitely)
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws InterruptedException     if the thread is interrupted while waiting for a permit
	 * @throws TimeoutException         if the timeout elapses before a permit is acquired
	 */
	public void acquire(double priority, Duration timeout) throws InterruptedException, TimeoutException
	{
		if (timeout != null)
			requireThat(timeout, "timeout").isGreaterThanOrEqualTo(Duration.ZERO);
		Deadline deadline = Deadline.after(timeout);
		try (CloseableLock ignored = lock.lock())
		{
			if (availablePermits > 0)
			{
				--availablePermits;
				return;
			}
			Waiter waiter = new Waiter(lock.newCondition(), priority, Instant.now());
			int position = waiters.add(waiter);
			log.debug("Waiting for a permit. position: {}, queueLength: {}", position, waiters.size());
			boolean acquired;
			try
			{
				listener.onWaiting(this, position);
				acquired = waiter.await(deadline);
			}
			catch (InterruptedException | RuntimeException e)
			{
				waiters.remove(waiter);
				throw e;
			}
			if (!acquired)
			{
				waiters.remove(waiter);
				throw new TimeoutException("Timed out after " + timeout + " waiting for a permit");
			}
		}
	}

	/**
	 * Acquires a permit, ignoring interrupts.
	 */
	public void acquireUninterruptibly()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (availablePermits > 0)
			{
				--availablePermits;
				return;
			}
			Waiter waiter = new Waiter(lock.newCondition(), 0, Instant.now());
			int position = waiters.add(waiter);
			try
			{
				listener.onWaiting(this, position);
			}
			catch (RuntimeException e)
			{
				waiters.remove(waiter);
				throw e;
			}
			waiter.awaitUninterruptibly();
		}
	}

	/**
	 * Acquires a permit, only if one is available at the time of invocation.
	 *
	 * @return true if a permit was acquired
	 */
	@CheckReturnValue
	public boolean tryAcquire()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (availablePermits == 0)
				return false;
			--availablePermits;
			return true;
		}
	}

	/**
	 * Releases a permit. If callers are waiting, the permit is handed to the next one in queue order.
	 * <p>
	 * Releasing a permit that was never acquired is not detected unless assertions are enabled.
	 */
	public void release()
	{
		try (CloseableLock ignored = lock.lock())
		{
			Waiter next = waiters.poll();
			if (next != null)
			{
				next.resume();
				return;
			}
			if (assertionsAreEnabled())
				requireThat(availablePermits, "availablePermits").isLessThan(capacity, "capacity");
			++availablePermits;
		}
	}

	/**
	 * Runs a task while holding a permit. The permit is released when the task completes, even if it
	 * throws an exception.
	 *
	 * @throws TimeoutException if the semaphore's default timeout elapses before a permit is acquired
	 */
	@Override
	public <V> V execute(Callable<V> task) throws Exception
	{
		requireThat(task, "task").isNotNull();
		acquire();
		try
		{
			return task.call();
		}
		finally
		{
			release();
		}
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return new ToStringBuilder(Semaphore.class).
				add("capacity", capacity).
				add("availablePermits", availablePermits).
				add("queueMode", queueMode).
				add("queueLength", waiters.size()).
				toString();
		}
	}

	/**
	 * Builds a semaphore.
	 */
	public static final class Builder
	{
		private int capacity = 1;
		private QueueMode queueMode = QueueMode.FIFO;
		private Duration timeout;
		private SemaphoreListener listener = new SemaphoreListener()
		{
		};

		/**
		 * Prevent construction.
		 */
		Builder()
		{
		}

		/**
		 * Returns the number of permits. The default is {@code 1}.
		 *
		 * @return the number of permits
		 */
		@CheckReturnValue
		public int capacity()
		{
			return capacity;
		}

		/**
		 * Sets the number of permits.
		 *
		 * @param capacity the number of permits
		 * @return this
		 * @throws IllegalArgumentException if {@code capacity} is negative or zero
		 */
		@CheckReturnValue
		public Builder capacity(int capacity)
		{
			requireThat(capacity, "capacity").isPositive();
			this.capacity = capacity;
			return this;
		}

		/**
		 * Returns the order in which blocked callers are granted permits. The default is
		 * {@link QueueMode#FIFO FIFO}.
		 *
		 * @return the order in which blocked callers are granted permits
		 */
		@CheckReturnValue
		public QueueMode queueMode()
		{
			return queueMode;
		}

		/**
		 * Sets the order in which blocked callers are granted permits.
		 *
		 * @param queueMode the order in which blocked callers are granted permits
		 * @return this
		 * @throws NullPointerException if {@code queueMode} is null
		 */
		@CheckReturnValue
		public Builder queueMode(QueueMode queueMode)
		{
			requireThat(queueMode, "queueMode").isNotNull();
			this.queueMode = queueMode;
			return this;
		}

		/**
		 * Returns the maximum amount of time that {@code acquire()} and {@code execute()} wait for a permit.
		 * The default is {@code null}.
		 *
		 * @return {@code null} if callers wait indefinitely
		 */
		@CheckReturnValue
		public Duration timeout()
		{
			return timeout;
		}

		/**
		 * Sets the maximum amount of time that {@code acquire()} and {@code execute()} wait for a permit.
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
		 * Returns the event listener.
		 *
		 * @return the event listener
		 */
		@CheckReturnValue
		public SemaphoreListener listener()
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
		public Builder listener(SemaphoreListener listener)
		{
			requireThat(listener, "listener").isNotNull();
			this.listener = listener;
			return this;
		}

		/**
		 * Builds a new Semaphore.
		 *
		 * @return a new Semaphore
		 */
		public Semaphore build()
		{
			return new Semaphore(capacity, queueMode, timeout, listener);
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("capacity", capacity).
				add("queueMode", queueMode).
				add("timeout", timeout).
				toString();
		}
	}
}
