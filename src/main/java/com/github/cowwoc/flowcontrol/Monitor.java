package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.internal.CloseableLock;
import com.github.cowwoc.flowcontrol.internal.Deadline;
import com.github.cowwoc.flowcontrol.internal.LockAsResource;
import com.github.cowwoc.flowcontrol.internal.ToStringBuilder;
import com.github.cowwoc.flowcontrol.internal.Waiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A mutex combined with condition variables.
 * <p>
 * Threads that hold the monitor may wait for a predicate to change. Waiting releases the monitor, and
 * the monitor is re-acquired before the predicate is re-evaluated.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class Monitor implements FlowController
{
	private final Mutex mutex;
	/**
	 * Guards {@code waiters}.
	 */
	private final LockAsResource lock = new LockAsResource();
	/**
	 * Threads waiting to be notified, oldest first.
	 */
	private final List<Waiter> waiters = new ArrayList<>();
	private final Logger log = LoggerFactory.getLogger(Monitor.class);

	/**
	 * Creates a monitor whose callers wait indefinitely to acquire it.
	 */
	public Monitor()
	{
		this(null);
	}

	/**
	 * Creates a new monitor.
	 *
	 * @param timeout the maximum amount of time to wait to acquire the monitor ({@code null} to wait
	 *                indefinitely)
	 * @throws IllegalArgumentException if {@code timeout} is negative or zero
	 */
	public Monitor(Duration timeout)
	{
		this.mutex = Mutex.builder().timeout(timeout).build();
	}

	/**
	 * @return true if a thread holds the monitor
	 */
	public boolean isLocked()
	{
		return mutex.isLocked();
	}

	/**
	 * @return the number of threads waiting to be notified
	 */
	public int getWaitingCount()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return waiters.size();
		}
	}

	/**
	 * Runs a task while holding the monitor.
	 *
	 * @param <V>  the type of value returned by the task
	 * @param task the task
	 * @return the value returned by the task
	 * @throws NullPointerException                   if {@code task} is null
	 * @throws java.util.concurrent.TimeoutException if the monitor cannot be acquired in time
	 * @throws Exception                              if the task throws an exception
	 */
	public <V> V synchronize(Callable<V> task) throws Exception
	{
		return mutex.synchronize(task);
	}

	@Override
	public <V> V execute(Callable<V> task) throws Exception
	{
		return synchronize(task);
	}

	/**
	 * Blocks while {@code predicate} is true. Must be invoked while holding the monitor.
	 *
	 * @param predicate the condition to wait on
	 * @throws NullPointerException  if {@code predicate} is null
	 * @throws IllegalStateException if the monitor is not held
	 * @throws InterruptedException  if the thread is interrupted while waiting. The monitor is re-acquired
	 *                               before the exception is thrown.
	 */
	public void waitWhile(BooleanSupplier predicate) throws InterruptedException
	{
		waitWhile(predicate, null);
	}

	/**
	 * Blocks while {@code predicate} is true. Must be invoked while holding the monitor.
	 *
	 * @param predicate the condition to wait on
	 * @param timeout   the maximum amount of time to wait, across all wakeups ({@code null} to wait
	 *                  indefinitely)
	 * @return false if the timeout elapsed while {@code predicate} was still true
	 * @throws NullPointerException     if {@code predicate} is null
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws IllegalStateException    if the monitor is not held
	 * @throws InterruptedException     if the thread is interrupted while waiting. The monitor is
	 *                                  re-acquired before the exception is thrown.
	 */
	public boolean waitWhile(BooleanSupplier predicate, Duration timeout) throws InterruptedException
	{
		requireThat(predicate, "predicate").isNotNull();
		if (timeout != null)
			requireThat(timeout, "timeout").isGreaterThanOrEqualTo(Duration.ZERO);
		if (!mutex.isHeldByCurrentThread())
			throw new IllegalStateException("The current thread must hold the monitor while waiting");
		Deadline deadline = Deadline.after(timeout);
		while (predicate.getAsBoolean())
		{
			Waiter waiter;
			try (CloseableLock ignored = lock.lock())
			{
				// Register before releasing the monitor so that a notification cannot be missed
				waiter = new Waiter(lock.newCondition(), 0, Instant.now());
				waiters.add(waiter);
			}
			mutex.unlock();
			boolean notified;
			try (CloseableLock ignored = lock.lock())
			{
				try
				{
					notified = waiter.await(deadline);
				}
				catch (InterruptedException e)
				{
					waiters.remove(waiter);
					throw e;
				}
				if (!notified)
					waiters.remove(waiter);
			}
			finally
			{
				mutex.lockUninterruptibly();
			}
			if (!notified)
			{
				log.debug("Timed out after {} while waiting for predicate to change", timeout);
				return false;
			}
		}
		return true;
	}

	/**
	 * Blocks until {@code predicate} is true. Must be invoked while holding the monitor.
	 *
	 * @param predicate the condition to wait on
	 * @throws NullPointerException  if {@code predicate} is null
	 * @throws IllegalStateException if the monitor is not held
	 * @throws InterruptedException  if the thread is interrupted while waiting
	 */
	public void waitUntil(BooleanSupplier predicate) throws InterruptedException
	{
		waitUntil(predicate, null);
	}

	/**
	 * Blocks until {@code predicate} is true. Must be invoked while holding the monitor.
	 *
	 * @param predicate the condition to wait on
	 * @param timeout   the maximum amount of time to wait ({@code null} to wait indefinitely)
	 * @return false if the timeout elapsed while {@code predicate} was still false
	 * @throws NullPointerException     if {@code predicate} is null
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws IllegalStateException    if the monitor is not held
	 * @throws InterruptedException     if the thread is interrupted while waiting
	 */
	public boolean waitUntil(BooleanSupplier predicate, Duration timeout) throws InterruptedException
	{
		requireThat(predicate, "predicate").isNotNull();
		return waitWhile(() -> !predicate.getAsBoolean(), timeout);
	}

	/**
	 * Wakes up the longest-waiting thread, if any.
	 */
	public void notifyOne()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (!waiters.isEmpty())
				waiters.remove(0).resume();
		}
	}

	/**
	 * Wakes up all waiting threads.
	 */
	public void notifyAllWaiters()
	{
		try (CloseableLock ignored = lock.lock())
		{
			for (Waiter waiter : waiters)
				waiter.resume();
			waiters.clear();
		}
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(Monitor.class).
			add("locked", isLocked()).
			add("waitingCount", getWaitingCount()).
			toString();
	}
}
