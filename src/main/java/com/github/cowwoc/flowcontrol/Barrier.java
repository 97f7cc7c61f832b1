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
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A rendezvous point for a fixed number of parties.
 * <p>
 * Parties block in {@link #await()} until the last one arrives. The last party runs the barrier action
 * and then releases the others. A cyclic barrier is reusable after a release. A non-cyclic barrier is
 * broken after its first release.
 * <p>
 * If a party times out or is interrupted, the barrier breaks and every other waiting party fails.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class Barrier implements FlowController
{
	private final int parties;
	private final boolean cyclic;
	private final Runnable action;
	private final Duration timeout;
	private final BarrierListener listener;
	private final LockAsResource lock = new LockAsResource();
	private Generation generation;
	private int arrived;
	private boolean broken;
	private final Logger log = LoggerFactory.getLogger(Barrier.class);

	/**
	 * Builds a new barrier.
	 *
	 * @return a Barrier builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new barrier.
	 *
	 * @param parties  the number of parties that must arrive before they are released
	 * @param cyclic   true if the barrier may be reused after a release
	 * @param action   the action to run before releasing the parties
	 * @param timeout  the maximum amount of time that {@link #await()} waits ({@code null} to wait
	 *                 indefinitely)
	 * @param listener the event listener
	 */
	private Barrier(int parties, boolean cyclic, Runnable action, Duration timeout, BarrierListener listener)
	{
		this.parties = parties;
		this.cyclic = cyclic;
		this.action = action;
		this.timeout = timeout;
		this.listener = listener;
		this.generation = new Generation(lock.newCondition());
	}

	/**
	 * @return the number of parties that must arrive before they are released
	 */
	public int getParties()
	{
		return parties;
	}

	/**
	 * @return true if the barrier may be reused after a release
	 */
	public boolean isCyclic()
	{
		return cyclic;
	}

	/**
	 * @return the number of parties currently waiting at the barrier
	 */
	public int getArrivedCount()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return arrived;
		}
	}

	/**
	 * @return true if the barrier is broken
	 */
	public boolean isBroken()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return broken;
		}
	}

	/**
	 * Waits for all parties to arrive, blocking for up to the barrier's default timeout.
	 *
	 * @throws BrokenBarrierException if the barrier is or becomes broken, or is reset while waiting
	 * @throws InterruptedException   if the thread is interrupted while waiting
	 * @throws TimeoutException       if this party, or another one, timed out while waiting
	 * @throws RuntimeException       if this party runs the barrier action and it throws an exception
	 */
	public void await() throws BrokenBarrierException, InterruptedException, TimeoutException
	{
		await(timeout);
	}

	/**
	 * Waits for all parties to arrive.
	 *
	 * @param timeout the maximum amount of time to wait ({@code null} to wait indefinitely)
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws BrokenBarrierException   if the barrier is or becomes broken, or is reset while waiting
	 * @throws InterruptedException     if the thread is interrupted while waiting
	 * @throws TimeoutException         if this party, or another one, timed out while waiting
	 * @throws RuntimeException         if this party runs the barrier action and it throws an exception
	 */
	public void await(Duration timeout) throws BrokenBarrierException, InterruptedException, TimeoutException
	{
		if (timeout != null)
			requireThat(timeout, "timeout").isGreaterThanOrEqualTo(Duration.ZERO);
		Deadline deadline = Deadline.after(timeout);
		try (CloseableLock ignored = lock.lock())
		{
			if (broken)
				throw new BrokenBarrierException();
			Generation current = generation;
			++arrived;
			if (arrived == parties)
			{
				release(current);
				return;
			}
			log.debug("Waiting at barrier. arrived: {}, parties: {}", arrived, parties);

			while (current.outcome == Outcome.PENDING)
			{
				try
				{
					if (!Conditions.await(current.released, deadline) && current.outcome == Outcome.PENDING)
					{
						log.debug("Timed out after {} waiting at barrier", timeout);
						breakBarrier(current, Outcome.TIMED_OUT);
						listener.onTimeout(this);
						break;
					}
				}
				catch (InterruptedException e)
				{
					if (current.outcome == Outcome.PENDING)
					{
						breakBarrier(current, Outcome.BROKEN);
						throw e;
					}
					Thread.currentThread().interrupt();
				}
			}
			switch (current.outcome)
			{
				case RELEASED ->
				{
				}
				case BROKEN -> throw new BrokenBarrierException();
				case TIMED_OUT -> throw new TimeoutException("A party timed out waiting at the barrier");
				default -> throw new AssertionError(current.outcome.name());
			}
		}
	}

	/**
	 * Runs the barrier action and releases the waiting parties.
	 *
	 * @param current the current generation
	 * @throws RuntimeException if the barrier action throws an exception. The barrier is broken.
	 */
	private void release(Generation current)
	{
		try
		{
			action.run();
		}
		catch (RuntimeException | Error e)
		{
			log.debug("Barrier action failed", e);
			breakBarrier(current, Outcome.BROKEN);
			throw e;
		}
		current.outcome = Outcome.RELEASED;
		current.released.signalAll();
		arrived = 0;
		if (cyclic)
			generation = new Generation(lock.newCondition());
		else
			broken = true;
		log.debug("Released {} parties", parties);
	}

	/**
	 * Breaks the barrier, failing any waiting parties.
	 *
	 * @param current the current generation
	 * @param outcome the reason the barrier broke
	 */
	private void breakBarrier(Generation current, Outcome outcome)
	{
		broken = true;
		arrived = 0;
		current.outcome = outcome;
		current.released.signalAll();
	}

	/**
	 * Restores the barrier to its initial state. Parties that are waiting fail with
	 * {@link BrokenBarrierException}.
	 */
	public void reset()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (generation.outcome == Outcome.PENDING && arrived > 0)
				breakBarrier(generation, Outcome.BROKEN);
			generation = new Generation(lock.newCondition());
			arrived = 0;
			broken = false;
		}
	}

	/**
	 * Runs a task and then waits at the barrier.
	 *
	 * @return the value returned by the task, once all parties have arrived
	 * @throws BrokenBarrierException if the barrier is or becomes broken, or is reset while waiting
	 * @throws TimeoutException       if a party timed out while waiting
	 */
	@Override
	public <V> V execute(Callable<V> task) throws Exception
	{
		requireThat(task, "task").isNotNull();
		V result = task.call();
		await();
		return result;
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return new ToStringBuilder(Barrier.class).
				add("parties", parties).
				add("arrived", arrived).
				add("cyclic", cyclic).
				add("broken", broken).
				toString();
		}
	}

	/**
	 * The ways in which a generation of parties may end.
	 */
	private enum Outcome
	{
		PENDING,
		RELEASED,
		BROKEN,
		TIMED_OUT
	}

	/**
	 * The parties that are waiting for the same release.
	 */
	private static final class Generation
	{
		final Condition released;
		Outcome outcome = Outcome.PENDING;

		/**
		 * @param released signalled when the generation ends
		 */
		Generation(Condition released)
		{
			this.released = released;
		}
	}

	/**
	 * Builds a barrier.
	 */
	public static final class Builder
	{
		private int parties = 2;
		private boolean cyclic;
		private Runnable action = () ->
		{
		};
		private Duration timeout;
		private BarrierListener listener = new BarrierListener()
		{
		};

		/**
		 * Prevent construction.
		 */
		Builder()
		{
		}

		/**
		 * Returns the number of parties that must arrive before they are released. The default is {@code 2}.
		 *
		 * @return the number of parties
		 */
		@CheckReturnValue
		public int parties()
		{
			return parties;
		}

		/**
		 * Sets the number of parties that must arrive before they are released.
		 *
		 * @param parties the number of parties
		 * @return this
		 * @throws IllegalArgumentException if {@code parties} is negative or zero
		 */
		@CheckReturnValue
		public Builder parties(int parties)
		{
			requireThat(parties, "parties").isPositive();
			this.parties = parties;
			return this;
		}

		/**
		 * Indicates if the barrier may be reused after a release. The default is {@code false}.
		 *
		 * @return true if the barrier may be reused after a release
		 */
		@CheckReturnValue
		public boolean cyclic()
		{
			return cyclic;
		}

		/**
		 * Indicates if the barrier may be reused after a release.
		 *
		 * @param cyclic true if the barrier may be reused after a release
		 * @return this
		 */
		@CheckReturnValue
		public Builder cyclic(boolean cyclic)
		{
			this.cyclic = cyclic;
			return this;
		}

		/**
		 * Returns the action that the last party runs before the parties are released. The default does
		 * nothing.
		 *
		 * @return the barrier action
		 */
		@CheckReturnValue
		public Runnable action()
		{
			return action;
		}

		/**
		 * Sets the action that the last party runs before the parties are released.
		 *
		 * @param action the barrier action
		 * @return this
		 * @throws NullPointerException if {@code action} is null
		 */
		@CheckReturnValue
		public Builder action(Runnable action)
		{
			requireThat(action, "action").isNotNull();
			this.action = action;
			return this;
		}

		/**
		 * Returns the maximum amount of time that parties wait. The default is {@code null}.
		 *
		 * @return {@code null} if parties wait indefinitely
		 */
		@CheckReturnValue
		public Duration timeout()
		{
			return timeout;
		}

		/**
		 * Sets the maximum amount of time that parties wait.
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
		public BarrierListener listener()
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
		public Builder listener(BarrierListener listener)
		{
			requireThat(listener, "listener").isNotNull();
			this.listener = listener;
			return this;
		}

		/**
		 * Builds a new Barrier.
		 *
		 * @return a new Barrier
		 */
		public Barrier build()
		{
			return new Barrier(parties, cyclic, action, timeout, listener);
		}
	}
}
