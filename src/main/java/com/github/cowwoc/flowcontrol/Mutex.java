package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.annotation.CheckReturnValue;
import com.github.cowwoc.flowcontrol.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A mutual exclusion lock with FIFO fairness.
 * <p>
 * The mutex is not reentrant: a thread that locks it twice deadlocks, unless a timeout is specified.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class Mutex implements FlowController
{
	private final Semaphore semaphore;
	private final Duration timeout;
	private final boolean throwOnTimeout;
	/**
	 * The thread that holds the mutex ({@code null} if it is unlocked).
	 */
	private volatile Thread owner;
	private final Logger log = LoggerFactory.getLogger(Mutex.class);

	/**
	 * Builds a new mutex.
	 *
	 * @return a Mutex builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new mutex.
	 *
	 * @param timeout        the maximum amount of time that {@link #lock()} waits ({@code null} to wait
	 *                       indefinitely)
	 * @param throwOnTimeout false if {@link #execute(Callable)} should run the task without the lock after
	 *                       a timeout
	 * @param listener       the event listener
	 */
	private Mutex(Duration timeout, boolean throwOnTimeout, MutexListener listener)
	{
		this.timeout = timeout;
		this.throwOnTimeout = throwOnTimeout;
		this.semaphore = Semaphore.builder().
			timeout(timeout).
			listener(new SemaphoreListener()
			{
				@Override
				public void onWaiting(Semaphore semaphore, int position)
				{
					listener.onBlocked(Mutex.this);
				}
			}).
			build();
	}

	/**
	 * @return the maximum amount of time that {@link #lock()} waits ({@code null} if callers wait
	 * indefinitely)
	 */
	public Duration getTimeout()
	{
		return timeout;
	}

	/**
	 * @return false if {@link #execute(Callable)} runs the task without the lock after a timeout
	 */
	public boolean isThrowOnTimeout()
	{
		return throwOnTimeout;
	}

	/**
	 * @return true if a thread holds the mutex
	 */
	public boolean isLocked()
	{
		return semaphore.getAvailablePermits() == 0;
	}

	/**
	 * @return true if the current thread holds the mutex
	 */
	boolean isHeldByCurrentThread()
	{
		return owner == Thread.currentThread();
	}

	/**
	 * @return the number of threads waiting for the mutex
	 */
	public int getQueueLength()
	{
		return semaphore.getQueueLength();
	}

	/**
	 * Locks the mutex, blocking for up to the mutex's default timeout.
	 *
	 * @throws InterruptedException if the thread is interrupted while waiting
	 * @throws TimeoutException     if the timeout elapses before the mutex is locked
	 */
	public void lock() throws InterruptedException, TimeoutException
	{
		lock(timeout);
	}

	/**
	 * Locks the mutex.
	 *
	 * @param timeout the maximum amount of time to wait ({@code null} to wait indefinitely)
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws InterruptedException     if the thread is interrupted while waiting
	 * @throws TimeoutException         if the timeout elapses before the mutex is locked
	 */
	public void lock(Duration timeout) throws InterruptedException, TimeoutException
	{
		semaphore.acquire(timeout);
		owner = Thread.currentThread();
	}

	/**
	 * Locks the mutex, ignoring interrupts.
	 */
	void lockUninterruptibly()
	{
		semaphore.acquireUninterruptibly();
		owner = Thread.currentThread();
	}

	/**
	 * Locks the mutex, only if it is unlocked at the time of invocation.
	 *
	 * @return true if the mutex was locked
	 */
	@CheckReturnValue
	public boolean tryLock()
	{
		if (!semaphore.tryAcquire())
			return false;
		owner = Thread.currentThread();
		return true;
	}

	/**
	 * Unlocks the mutex, handing it to the longest-waiting thread.
	 */
	public void unlock()
	{
		owner = null;
		semaphore.release();
	}

	/**
	 * Runs a task while holding the mutex. The mutex is released when the task completes, even if it throws
	 * an exception.
	 *
	 * @param <V>  the type of value returned by the task
	 * @param task the task
	 * @return the value returned by the task
	 * @throws NullPointerException if {@code task} is null
	 * @throws TimeoutException     if the mutex's default timeout elapses before the mutex is locked
	 * @throws Exception            if the task throws an exception
	 */
	public <V> V synchronize(Callable<V> task) throws Exception
	{
		requireThat(task, "task").isNotNull();
		lock();
		try
		{
			return task.call();
		}
		finally
		{
			unlock();
		}
	}

	/**
	 * Runs a task while holding the mutex.
	 * <p>
	 * If the default timeout elapses and the mutex was built with {@code throwOnTimeout(false)}, the task
	 * runs <b>without</b> the mutex and concurrently with its owner.
	 *
	 * @throws TimeoutException if the timeout elapses and {@code throwOnTimeout} is true
	 */
	@Override
	public <V> V execute(Callable<V> task) throws Exception
	{
		requireThat(task, "task").isNotNull();
		boolean locked;
		try
		{
			lock();
			locked = true;
		}
		catch (TimeoutException e)
		{
			if (throwOnTimeout)
				throw e;
			log.warn("Timed out after {} waiting for the mutex. Running the task without mutual exclusion.",
				timeout);
			locked = false;
		}
		try
		{
			return task.call();
		}
		finally
		{
			if (locked)
				unlock();
		}
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(Mutex.class).
			add("locked", isLocked()).
			add("queueLength", getQueueLength()).
			add("timeout", timeout).
			add("throwOnTimeout", throwOnTimeout).
			toString();
	}

	/**
	 * Builds a mutex.
	 */
	public static final class Builder
	{
		private Duration timeout;
		private boolean throwOnTimeout = true;
		private MutexListener listener = new MutexListener()
		{
		};

		/**
		 * Prevent construction.
		 */
		Builder()
		{
		}

		/**
		 * Returns the maximum amount of time to wait for the mutex. The default is {@code null}.
		 *
		 * @return {@code null} if callers wait indefinitely
		 */
		@CheckReturnValue
		public Duration timeout()
		{
			return timeout;
		}

		/**
		 * Sets the maximum amount of time to wait for the mutex.
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
		 * Indicates if {@code execute()} throws an exception on timeout. The default is {@code true}.
		 *
		 * @return false if {@code execute()} runs the task without the mutex after a timeout
		 */
		@CheckReturnValue
		public boolean throwOnTimeout()
		{
			return throwOnTimeout;
		}

		/**
		 * Indicates if {@code execute()} throws an exception on timeout.
		 *
		 * @param throwOnTimeout false if {@code execute()} should run the task without the mutex after a
		 *                       timeout
		 * @return this
		 */
		@CheckReturnValue
		public Builder throwOnTimeout(boolean throwOnTimeout)
		{
			this.throwOnTimeout = throwOnTimeout;
			return this;
		}

		/**
		 * Returns the event listener.
		 *
		 * @return the event listener
		 */
		@CheckReturnValue
		public MutexListener listener()
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
		public Builder listener(MutexListener listener)
		{
			requireThat(listener, "listener").isNotNull();
			this.listener = listener;
			return this;
		}

		/**
		 * Builds a new Mutex.
		 *
		 * @return a new Mutex
		 */
		public Mutex build()
		{
			return new Mutex(timeout, throwOnTimeout, listener);
		}
	}
}
