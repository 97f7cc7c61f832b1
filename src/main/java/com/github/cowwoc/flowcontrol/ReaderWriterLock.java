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

import static com.github.cowwoc.requirements.DefaultRequirements.assertThat;
import static com.github.cowwoc.requirements.DefaultRequirements.assertionsAreEnabled;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A lock that allows many concurrent readers or a single writer.
 * <p>
 * When the lock is released, queued writers are admitted one at a time. Once no writer is queued, all
 * queued readers are admitted together. If {@code writerPriority} is enabled, new readers queue up behind
 * any waiting writer instead of joining the active readers.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class ReaderWriterLock
{
	private final boolean writerPriority;
	private final Duration timeout;
	private final LockAsResource lock = new LockAsResource();
	private final WaitQueue<Waiter> readQueue = new WaitQueue<>(QueueMode.FIFO);
	private final WaitQueue<Waiter> writeQueue = new WaitQueue<>(QueueMode.FIFO);
	private int readers;
	private boolean writing;
	private final Logger log = LoggerFactory.getLogger(ReaderWriterLock.class);

	/**
	 * Builds a new lock.
	 *
	 * @return a ReaderWriterLock builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new lock.
	 *
	 * @param writerPriority true if waiting writers block new readers
	 * @param timeout        the maximum amount of time that {@link #read(Callable)} and
	 *                       {@link #write(Callable)} wait ({@code null} to wait indefinitely)
	 */
	private ReaderWriterLock(boolean writerPriority, Duration timeout)
	{
		this.writerPriority = writerPriority;
		this.timeout = timeout;
	}

	/**
	 * @return true if waiting writers block new readers
	 */
	public boolean isWriterPriority()
	{
		return writerPriority;
	}

	/**
	 * @return the number of threads holding a read lock
	 */
	public int getReaderCount()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return readers;
		}
	}

	/**
	 * @return true if a thread holds the write lock
	 */
	public boolean isWriting()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return writing;
		}
	}

	/**
	 * @return the number of threads waiting for a read lock
	 */
	public int getReadQueueLength()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return readQueue.size();
		}
	}

	/**
	 * @return the number of threads waiting for the write lock
	 */
	public int getWriteQueueLength()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return writeQueue.size();
		}
	}

	/**
	 * Acquires a read lock.
	 *
	 * @param timeout the maximum amount of time to wait ({@code null} to wait indefinitely)
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws InterruptedException     if the thread is interrupted while waiting
	 * @throws TimeoutException         if the timeout elapses before the lock is acquired
	 */
	public void acquireRead(Duration timeout) throws InterruptedException, TimeoutException
	{
		if (timeout != null)
			requireThat(timeout, "timeout").isGreaterThanOrEqualTo(Duration.ZERO);
		Deadline deadline = Deadline.after(timeout);
		try (CloseableLock ignored = lock.lock())
		{
			if (!writing && !(writerPriority && !writeQueue.isEmpty()))
			{
				++readers;
				return;
			}
			log.debug("Reader waiting. writing: {}, queuedWriters: {}", writing, writeQueue.size());
			// The thread that releases the reader increments "readers" on its behalf
			await(readQueue, deadline, timeout, "read");
		}
	}

	/**
	 * Releases a read lock.
	 */
	public void releaseRead()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (assertionsAreEnabled())
				requireThat(readers, "readers").isPositive();
			--readers;
			if (readers == 0)
				processQueues();
		}
	}

	/**
	 * Acquires the write lock.
	 *
	 * @param timeout the maximum amount of time to wait ({@code null} to wait indefinitely)
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws InterruptedException     if the thread is interrupted while waiting
	 * @throws TimeoutException         if the timeout elapses before the lock is acquired
	 */
	public void acquireWrite(Duration timeout) throws InterruptedException, TimeoutException
	{
		if (timeout != null)
			requireThat(timeout, "timeout").isGreaterThanOrEqualTo(Duration.ZERO);
		Deadline deadline = Deadline.after(timeout);
		try (CloseableLock ignored = lock.lock())
		{
			if (readers == 0 && !writing && writeQueue.isEmpty())
			{
				writing = true;
				return;
			}
			log.debug("Writer waiting. readers: {}, writing: {}", readers, writing);
			// The thread that releases the writer sets "writing" on its behalf
			await(writeQueue, deadline, timeout, "write");
		}
	}

	/**
	 * Releases the write lock.
	 */
	public void releaseWrite()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (assertionsAreEnabled())
				requireThat(writing, "writing").isTrue();
			writing = false;
			processQueues();
		}
	}

	/**
	 * Blocks until a waiter is admitted. Must be invoked while holding {@code lock}.
	 *
	 * @param queue    the queue to wait in
	 * @param deadline the time at which to give up
	 * @param timeout  the timeout that {@code deadline} was derived from
	 * @param type     the type of lock being acquired
	 * @throws InterruptedException if the thread is interrupted while waiting
	 * @throws TimeoutException     if the deadline expires before the lock is acquired
	 */
	private void await(WaitQueue<Waiter> queue, Deadline deadline, Duration timeout, String type)
		throws InterruptedException, TimeoutException
	{
		Waiter waiter = new Waiter(lock.newCondition(), 0, Instant.now());
		queue.add(waiter);
		boolean admitted;
		try
		{
			admitted = waiter.await(deadline);
		}
		catch (InterruptedException e)
		{
			queue.remove(waiter);
			// Readers that were queued behind a writer may now proceed
			processQueues();
			throw e;
		}
		if (!admitted)
		{
			queue.remove(waiter);
			processQueues();
			throw new TimeoutException("Timed out after " + timeout + " waiting for the " + type + " lock");
		}
	}

	/**
	 * Admits waiting threads. Writers are admitted one at a time. Once no writer is waiting, all waiting
	 * readers are admitted.
	 */
	private void processQueues()
	{
		if (writing)
			return;
		if (!writeQueue.isEmpty())
		{
			if (readers == 0)
			{
				writing = true;
				writeQueue.poll().resume();
				return;
			}
			if (writerPriority)
				return;
		}
		int admitted = 0;
		while (!readQueue.isEmpty())
		{
			++readers;
			++admitted;
			readQueue.poll().resume();
		}
		if (admitted > 0)
			log.debug("Admitted {} readers", admitted);
		assertThat(r -> r.requireThat(writing && readers > 0, "writing && readers > 0").isFalse());
	}

	/**
	 * Runs a task while holding a read lock, blocking for up to the default timeout.
	 *
	 * @param <V>  the type of value returned by the task
	 * @param task the task
	 * @return the value returned by the task
	 * @throws NullPointerException if {@code task} is null
	 * @throws TimeoutException     if the timeout elapses before the lock is acquired
	 * @throws Exception            if the task throws an exception
	 */
	public <V> V read(Callable<V> task) throws Exception
	{
		requireThat(task, "task").isNotNull();
		acquireRead(timeout);
		try
		{
			return task.call();
		}
		finally
		{
			releaseRead();
		}
	}

	/**
	 * Runs a task while holding the write lock, blocking for up to the default timeout.
	 *
	 * @param <V>  the type of value returned by the task
	 * @param task the task
	 * @return the value returned by the task
	 * @throws NullPointerException if {@code task} is null
	 * @throws TimeoutException     if the timeout elapses before the lock is acquired
	 * @throws Exception            if the task throws an exception
	 */
	public <V> V write(Callable<V> task) throws Exception
	{
		requireThat(task, "task").isNotNull();
		acquireWrite(timeout);
		try
		{
			return task.call();
		}
		finally
		{
			releaseWrite();
		}
	}

	/**
	 * @return a controller that runs tasks under a read lock
	 */
	public FlowController reader()
	{
		return new FlowController()
		{
			@Override
			public <V> V execute(Callable<V> task) throws Exception
			{
				return read(task);
			}
		};
	}

	/**
	 * @return a controller that runs tasks under the write lock
	 */
	public FlowController writer()
	{
		return new FlowController()
		{
			@Override
			public <V> V execute(Callable<V> task) throws Exception
			{
				return write(task);
			}
		};
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return new ToStringBuilder(ReaderWriterLock.class).
				add("readers", readers).
				add("writing", writing).
				add("readQueue", readQueue.size()).
				add("writeQueue", writeQueue.size()).
				add("writerPriority", writerPriority).
				toString();
		}
	}

	/**
	 * Builds a lock.
	 */
	public static final class Builder
	{
		private boolean writerPriority;
		private Duration timeout;

		/**
		 * Prevent construction.
		 */
		Builder()
		{
		}

		/**
		 * Indicates if waiting writers block new readers. The default is {@code false}.
		 *
		 * @return true if waiting writers block new readers
		 */
		@CheckReturnValue
		public boolean writerPriority()
		{
			return writerPriority;
		}

		/**
		 * Indicates if waiting writers block new readers.
		 *
		 * @param writerPriority true if waiting writers block new readers
		 * @return this
		 */
		@CheckReturnValue
		public Builder writerPriority(boolean writerPriority)
		{
			this.writerPriority = writerPriority;
			return this;
		}

		/**
		 * Returns the maximum amount of time to wait for a lock. The default is {@code null}.
		 *
		 * @return {@code null} if callers wait indefinitely
		 */
		@CheckReturnValue
		public Duration timeout()
		{
			return timeout;
		}

		/**
		 * Sets the maximum amount of time to wait for a lock.
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
		 * Builds a new ReaderWriterLock.
		 *
		 * @return a new ReaderWriterLock
		 */
		public ReaderWriterLock build()
		{
			return new ReaderWriterLock(writerPriority, timeout);
		}
	}
}
