package com.github.cowwoc.flowcontrol;

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
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Queues every call and drains one call from the head of the queue every {@code window / maxCalls}.
 */
final class LeakyBucket extends RateLimitAlgorithm
{
	private final LockAsResource lock;
	private final WaitQueue<Waiter> queue = new WaitQueue<>(QueueMode.FIFO);
	private final Duration interval;
	private final ScheduledExecutorService scheduler;
	private final Logger log = LoggerFactory.getLogger(LeakyBucket.class);

	/**
	 * @param maxCalls the maximum number of calls per window
	 * @param window   the length of a window
	 * @param lock     the lock over the rate limiter's state
	 */
	LeakyBucket(int maxCalls, Duration window, LockAsResource lock)
	{
		super(maxCalls, window);
		this.lock = lock;
		this.interval = window.dividedBy(maxCalls);
		this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable ->
		{
			Thread thread = new Thread(runnable, "LeakyBucket");
			thread.setDaemon(true);
			return thread;
		});
		long nanos = interval.toNanos();
		scheduler.scheduleAtFixedRate(this::leak, nanos, nanos, TimeUnit.NANOSECONDS);
	}

	/**
	 * Admits the call at the head of the queue, if any.
	 */
	private void leak()
	{
		try (CloseableLock ignored = lock.lock())
		{
			Waiter next = queue.poll();
			if (next != null)
				next.resume();
		}
	}

	@Override
	void acquire(Deadline deadline, Duration timeout) throws InterruptedException, TimeoutException
	{
		ensureOpen();
		Waiter waiter = new Waiter(lock.newCondition(), 0, Instant.now());
		int position = queue.add(waiter);
		log.debug("Waiting to be drained. position: {}, interval: {}", position, interval);
		boolean drained;
		try
		{
			drained = waiter.await(deadline);
		}
		catch (InterruptedException e)
		{
			queue.remove(waiter);
			throw e;
		}
		if (!drained)
		{
			queue.remove(waiter);
			throw timeoutException(timeout);
		}
		RuntimeException failure = waiter.getFailure();
		if (failure != null)
			throw failure;
	}

	@Override
	int getAvailableCalls(Instant now)
	{
		// Every call waits for the next tick
		return 0;
	}

	@Override
	int getQueueLength()
	{
		return queue.size();
	}

	@Override
	void reset(Instant now)
	{
		int cancelled = queue.failAll(() -> new CancellationException("The rate limiter was reset"));
		if (cancelled > 0)
			log.debug("Cancelled {} queued calls", cancelled);
	}

	@Override
	void close()
	{
		super.close();
		scheduler.shutdownNow();
		queue.failAll(() -> new CancellationException("The rate limiter was closed"));
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(LeakyBucket.class).
			add("queueLength", queue.size()).
			add("interval", interval).
			add("closed", isClosed()).
			toString();
	}
}
