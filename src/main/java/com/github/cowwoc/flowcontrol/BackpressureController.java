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
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;

import static com.github.cowwoc.requirements.DefaultRequirements.assertionsAreEnabled;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Limits the number of tasks that run concurrently, and decides what happens to tasks that arrive while
 * the limit is reached.
 * <p>
 * Buffered tasks wait in arrival order and run as execution slots free up.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class BackpressureController implements FlowController
{
	private final BackpressureStrategy strategy;
	private final int maxConcurrent;
	private final int maximumBufferSize;
	private final double sampleRate;
	private final Duration timeout;
	private final BackpressureListener listener;
	private final Random random;
	private final LockAsResource lock = new LockAsResource();
	/**
	 * Tasks waiting for an execution slot.
	 */
	private final WaitQueue<Waiter> buffer = new WaitQueue<>(QueueMode.FIFO);
	/**
	 * Throttled tasks waiting for room in the buffer.
	 */
	private final WaitQueue<SpaceWaiter> spaceWaiters = new WaitQueue<>(QueueMode.FIFO);
	private int activeExecutions;
	private final Logger log = LoggerFactory.getLogger(BackpressureController.class);

	/**
	 * Builds a new controller.
	 *
	 * @return a BackpressureController builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new controller.
	 *
	 * @param strategy          the handling of tasks that arrive while every slot is busy
	 * @param maxConcurrent     the maximum number of tasks that may run concurrently
	 * @param maximumBufferSize the maximum number of tasks that may wait for a slot
	 * @param sampleRate        the probability of buffering a task under the {@code SAMPLE} strategy
	 * @param timeout           the maximum amount of time that a buffered task waits ({@code null} to wait
	 *                          indefinitely)
	 * @param listener          the event listener
	 * @param random            the source of randomness for the {@code SAMPLE} strategy ({@code null} to
	 *                          use {@link ThreadLocalRandom})
	 */
	private BackpressureController(BackpressureStrategy strategy, int maxConcurrent, int maximumBufferSize,
	                               double sampleRate, Duration timeout, BackpressureListener listener,
	                               Random random)
	{
		this.strategy = strategy;
		this.maxConcurrent = maxConcurrent;
		this.maximumBufferSize = maximumBufferSize;
		this.sampleRate = sampleRate;
		this.timeout = timeout;
		this.listener = listener;
		this.random = random;
	}

	/**
	 * @return the handling of tasks that arrive while every slot is busy
	 */
	public BackpressureStrategy getStrategy()
	{
		return strategy;
	}

	/**
	 * @return the maximum number of tasks that may run concurrently
	 */
	public int getMaxConcurrent()
	{
		return maxConcurrent;
	}

	/**
	 * @return the maximum number of tasks that may wait for a slot
	 */
	public int getMaximumBufferSize()
	{
		return maximumBufferSize;
	}

	/**
	 * @return the probability of buffering a task under the {@code SAMPLE} strategy
	 */
	public double getSampleRate()
	{
		return sampleRate;
	}

	/**
	 * @return the number of tasks waiting for a slot
	 */
	public int getBufferSize()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return buffer.size();
		}
	}

	/**
	 * @return the number of tasks that are running
	 */
	public int getActiveExecutions()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return activeExecutions;
		}
	}

	/**
	 * @return true if every execution slot is busy
	 */
	public boolean isUnderPressure()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return activeExecutions >= maxConcurrent;
		}
	}

	/**
	 * Runs a task, subject to the backpressure strategy. Buffered tasks wait for up to the default timeout.
	 *
	 * @throws CapacityExceededException if the task is rejected
	 * @throws CancellationException     if the task is evicted from the buffer by a newer task
	 * @throws TimeoutException          if the timeout elapses while the task is waiting
	 */
	@Override
	public <V> V execute(Callable<V> task) throws Exception
	{
		return execute(task, timeout);
	}

	/**
	 * Runs a task, subject to the backpressure strategy.
	 *
	 * @param <V>     the type of value returned by the task
	 * @param task    the task
	 * @param timeout the maximum amount of time that the task may wait ({@code null} to wait indefinitely)
	 * @return the value returned by the task
	 * @throws NullPointerException      if {@code task} is null
	 * @throws IllegalArgumentException  if {@code timeout} is negative
	 * @throws CapacityExceededException if the task is rejected
	 * @throws CancellationException     if the task is evicted from the buffer by a newer task
	 * @throws TimeoutException          if the timeout elapses while the task is waiting
	 * @throws Exception                 if the task throws an exception
	 */
	public <V> V execute(Callable<V> task, Duration timeout) throws Exception
	{
		requireThat(task, "task").isNotNull();
		if (timeout != null)
			requireThat(timeout, "timeout").isGreaterThanOrEqualTo(Duration.ZERO);
		acquireSlot(Deadline.after(timeout), timeout);
		try
		{
			return task.call();
		}
		finally
		{
			releaseSlot();
		}
	}

	/**
	 * Blocks until the caller is granted an execution slot.
	 *
	 * @param deadline the time at which to give up
	 * @param timeout  the timeout that {@code deadline} was derived from
	 * @throws CapacityExceededException if the task is rejected
	 * @throws CancellationException     if the task is evicted from the buffer by a newer task
	 * @throws InterruptedException      if the thread is interrupted while waiting
	 * @throws TimeoutException          if the deadline expires while the task is waiting
	 */
	private void acquireSlot(Deadline deadline, Duration timeout) throws InterruptedException, TimeoutException
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (activeExecutions < maxConcurrent)
			{
				if (assertionsAreEnabled())
					requireThat(buffer.size(), "buffer.size()").isEqualTo(0);
				++activeExecutions;
				return;
			}
			Condition condition = lock.newCondition();
			Waiter waiter = new Waiter(condition, 0, Instant.now());
			switch (strategy)
			{
				case DROP, ERROR ->
				{
					listener.onOverflow(this);
					throw new CapacityExceededException("All " + maxConcurrent + " execution slots are busy");
				}
				case DROP_OLDEST ->
				{
					if (buffer.size() >= maximumBufferSize)
					{
						Waiter oldest = buffer.poll();
						oldest.fail(new CancellationException("Evicted from the buffer by a newer task"));
						log.debug("Evicted the oldest buffered task");
						listener.onOverflow(this);
					}
				}
				case BUFFER ->
				{
					if (buffer.size() >= maximumBufferSize)
					{
						listener.onBufferFull(this);
						throw new CapacityExceededException("The buffer is full. maximumBufferSize: " +
							maximumBufferSize);
					}
				}
				case SAMPLE ->
				{
					if (nextSample() >= sampleRate)
					{
						listener.onOverflow(this);
						throw new CapacityExceededException("The task was sampled out");
					}
					if (buffer.size() >= maximumBufferSize)
					{
						listener.onBufferFull(this);
						throw new CapacityExceededException("The buffer is full. maximumBufferSize: " +
							maximumBufferSize);
					}
				}
				case THROTTLE ->
				{
					if (buffer.size() >= maximumBufferSize)
					{
						awaitSpace(new SpaceWaiter(condition, waiter), deadline, timeout);
						awaitSlot(waiter, deadline, timeout);
						return;
					}
				}
				default -> throw new AssertionError(strategy.name());
			}
			buffer.add(waiter);
			log.debug("Buffered task. bufferSize: {}", buffer.size());
			awaitSlot(waiter, deadline, timeout);
		}
	}

	/**
	 * @return a random value between {@code 0.0} (inclusive) and {@code 1.0} (exclusive)
	 */
	private double nextSample()
	{
		if (random == null)
			return ThreadLocalRandom.current().nextDouble();
		return random.nextDouble();
	}

	/**
	 * Blocks until a throttled task is moved into the buffer.
	 *
	 * @param spaceWaiter the throttled task
	 * @param deadline    the time at which to give up
	 * @param timeout     the timeout that {@code deadline} was derived from
	 * @throws InterruptedException if the thread is interrupted while waiting
	 * @throws TimeoutException     if the deadline expires while the task is waiting
	 */
	private void awaitSpace(SpaceWaiter spaceWaiter, Deadline deadline, Duration timeout)
		throws InterruptedException, TimeoutException
	{
		spaceWaiters.add(spaceWaiter);
		log.debug("Throttling task. spaceWaiters: {}", spaceWaiters.size());
		boolean buffered;
		try
		{
			buffered = spaceWaiter.await(deadline);
		}
		catch (InterruptedException e)
		{
			spaceWaiters.remove(spaceWaiter);
			throw e;
		}
		if (!buffered)
		{
			spaceWaiters.remove(spaceWaiter);
			throw new TimeoutException("Timed out after " + timeout + " waiting for room in the buffer");
		}
	}

	/**
	 * Blocks until a buffered task is granted an execution slot.
	 *
	 * @param waiter   the buffered task
	 * @param deadline the time at which to give up
	 * @param timeout  the timeout that {@code deadline} was derived from
	 * @throws CancellationException if the task is evicted from the buffer by a newer task
	 * @throws InterruptedException  if the thread is interrupted while waiting
	 * @throws TimeoutException      if the deadline expires while the task is waiting
	 */
	private void awaitSlot(Waiter waiter, Deadline deadline, Duration timeout)
		throws InterruptedException, TimeoutException
	{
		boolean admitted;
		try
		{
			admitted = waiter.await(deadline);
		}
		catch (InterruptedException e)
		{
			buffer.remove(waiter);
			fillBuffer();
			throw e;
		}
		if (!admitted)
		{
			buffer.remove(waiter);
			fillBuffer();
			throw new TimeoutException("Timed out after " + timeout + " waiting for an execution slot");
		}
		RuntimeException failure = waiter.getFailure();
		if (failure != null)
			throw failure;
	}

	/**
	 * Releases an execution slot. If tasks are buffered, the slot is handed to the oldest one.
	 */
	private void releaseSlot()
	{
		try (CloseableLock ignored = lock.lock())
		{
			Waiter next = buffer.poll();
			if (next == null)
			{
				--activeExecutions;
				return;
			}
			next.resume();
			fillBuffer();
		}
	}

	/**
	 * Moves throttled tasks into the buffer while there is room.
	 */
	private void fillBuffer()
	{
		while (buffer.size() < maximumBufferSize && !spaceWaiters.isEmpty())
		{
			SpaceWaiter spaceWaiter = spaceWaiters.poll();
			buffer.add(spaceWaiter.slotWaiter);
			spaceWaiter.resume();
		}
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return new ToStringBuilder(BackpressureController.class).
				add("strategy", strategy).
				add("activeExecutions", activeExecutions).
				add("maxConcurrent", maxConcurrent).
				add("bufferSize", buffer.size()).
				add("maximumBufferSize", maximumBufferSize).
				add("sampleRate", sampleRate).
				toString();
		}
	}

	/**
	 * A throttled task waiting for room in the buffer. Once room frees up, {@code slotWaiter} is added to
	 * the buffer on the task's behalf.
	 */
	private static final class SpaceWaiter extends Waiter
	{
		final Waiter slotWaiter;

		/**
		 * @param condition  the condition that the waiting thread blocks on
		 * @param slotWaiter the waiter to add to the buffer
		 */
		SpaceWaiter(Condition condition, Waiter slotWaiter)
		{
			super(condition, 0, slotWaiter.getEnqueuedAt());
			this.slotWaiter = slotWaiter;
		}
	}

	/**
	 * Builds a controller.
	 */
	public static final class Builder
	{
		private BackpressureStrategy strategy = BackpressureStrategy.BUFFER;
		private int maxConcurrent = 10;
		private int bufferSize = 100;
		private double sampleRate = 0.1;
		private Duration timeout;
		private BackpressureListener listener = new BackpressureListener()
		{
		};
		private Random random;

		/**
		 * Prevent construction.
		 */
		Builder()
		{
		}

		/**
		 * Returns the handling of tasks that arrive while every slot is busy. The default is
		 * {@link BackpressureStrategy#BUFFER BUFFER}.
		 *
		 * @return the backpressure strategy
		 */
		@CheckReturnValue
		public BackpressureStrategy strategy()
		{
			return strategy;
		}

		/**
		 * Sets the handling of tasks that arrive while every slot is busy.
		 *
		 * @param strategy the backpressure strategy
		 * @return this
		 * @throws NullPointerException if {@code strategy} is null
		 */
		@CheckReturnValue
		public Builder strategy(BackpressureStrategy strategy)
		{
			requireThat(strategy, "strategy").isNotNull();
			this.strategy = strategy;
			return this;
		}

		/**
		 * Returns the maximum number of tasks that may run concurrently. The default is {@code 10}.
		 *
		 * @return the maximum number of tasks that may run concurrently
		 */
		@CheckReturnValue
		public int maxConcurrent()
		{
			return maxConcurrent;
		}

		/**
		 * Sets the maximum number of tasks that may run concurrently.
		 *
		 * @param maxConcurrent the maximum number of tasks that may run concurrently
		 * @return this
		 * @throws IllegalArgumentException if {@code maxConcurrent} is negative or zero
		 */
		@CheckReturnValue
		public Builder maxConcurrent(int maxConcurrent)
		{
			requireThat(maxConcurrent, "maxConcurrent").isPositive();
			this.maxConcurrent = maxConcurrent;
			return this;
		}

		/**
		 * Returns the maximum number of tasks that may wait for a slot. The default is {@code 100}.
		 *
		 * @return the maximum number of tasks that may wait for a slot
		 */
		@CheckReturnValue
		public int bufferSize()
		{
			return bufferSize;
		}

		/**
		 * Sets the maximum number of tasks that may wait for a slot.
		 *
		 * @param bufferSize the maximum number of tasks that may wait for a slot
		 * @return this
		 * @throws IllegalArgumentException if {@code bufferSize} is negative or zero
		 */
		@CheckReturnValue
		public Builder bufferSize(int bufferSize)
		{
			requireThat(bufferSize, "bufferSize").isPositive();
			this.bufferSize = bufferSize;
			return this;
		}

		/**
		 * Returns the probability of buffering a task under the {@code SAMPLE} strategy. The default is
		 * {@code 0.1}.
		 *
		 * @return a value between {@code 0.0} and {@code 1.0} (inclusive)
		 */
		@CheckReturnValue
		public double sampleRate()
		{
			return sampleRate;
		}

		/**
		 * Sets the probability of buffering a task under the {@code SAMPLE} strategy.
		 *
		 * @param sampleRate a value between {@code 0.0} and {@code 1.0} (inclusive)
		 * @return this
		 * @throws IllegalArgumentException if {@code sampleRate} is outside of {@code [0.0, 1.0]}
		 */
		@CheckReturnValue
		public Builder sampleRate(double sampleRate)
		{
			requireThat(sampleRate, "sampleRate").isGreaterThanOrEqualTo(0.0).isLessThanOrEqualTo(1.0);
			this.sampleRate = sampleRate;
			return this;
		}

		/**
		 * Returns the maximum amount of time that a task may wait. The default is {@code null}.
		 *
		 * @return {@code null} if tasks wait indefinitely
		 */
		@CheckReturnValue
		public Duration timeout()
		{
			return timeout;
		}

		/**
		 * Sets the maximum amount of time that a task may wait.
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
		public BackpressureListener listener()
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
		public Builder listener(BackpressureListener listener)
		{
			requireThat(listener, "listener").isNotNull();
			this.listener = listener;
			return this;
		}

		/**
		 * Sets the source of randomness for the {@code SAMPLE} strategy.
		 *
		 * @param random the source of randomness ({@code null} to use {@link ThreadLocalRandom})
		 * @return this
		 */
		@CheckReturnValue
		Builder random(Random random)
		{
			this.random = random;
			return this;
		}

		/**
		 * Builds a new BackpressureController.
		 *
		 * @return a new BackpressureController
		 */
		public BackpressureController build()
		{
			return new BackpressureController(strategy, maxConcurrent, bufferSize, sampleRate, timeout,
				listener, random);
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("strategy", strategy).
				add("maxConcurrent", maxConcurrent).
				add("bufferSize", bufferSize).
				add("sampleRate", sampleRate).
				add("timeout", timeout).
				toString();
		}
	}
}
