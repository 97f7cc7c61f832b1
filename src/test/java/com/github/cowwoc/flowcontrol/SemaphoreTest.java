package com.github.cowwoc.flowcontrol;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class SemaphoreTest
{
	@Test(expectedExceptions = IllegalArgumentException.class)
	public void zeroCapacity()
	{
		Semaphore.builder().capacity(0).build();
	}

	@Test(expectedExceptions = NullPointerException.class)
	public void nullQueueMode()
	{
		Semaphore.builder().queueMode(null).build();
	}

	@Test
	public void tryAcquireRespectsCapacity()
	{
		Semaphore semaphore = Semaphore.builder().capacity(2).build();
		requireThat(semaphore.tryAcquire(), "semaphore.tryAcquire()").isTrue();
		requireThat(semaphore.tryAcquire(), "semaphore.tryAcquire()").isTrue();
		requireThat(semaphore.tryAcquire(), "semaphore.tryAcquire()").isFalse();
		semaphore.release();
		requireThat(semaphore.getAvailablePermits(), "semaphore.getAvailablePermits()").isEqualTo(1);
	}

	@Test
	public void concurrencyNeverExceedsCapacity() throws Exception
	{
		int capacity = 3;
		Semaphore semaphore = Semaphore.builder().capacity(capacity).build();
		AtomicInteger active = new AtomicInteger();
		AtomicInteger maximum = new AtomicInteger();
		ExecutorService executor = Executors.newFixedThreadPool(10);
		try
		{
			List<Future<Integer>> futures = new ArrayList<>();
			for (int i = 0; i < 30; ++i)
			{
				futures.add(executor.submit(() -> semaphore.execute(() ->
				{
					int now = active.incrementAndGet();
					maximum.accumulateAndGet(now, Math::max);
					Thread.sleep(2);
					active.decrementAndGet();
					return now;
				})));
			}
			for (Future<Integer> future : futures)
				future.get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
		requireThat(maximum.get(), "maximum").isLessThanOrEqualTo(capacity);
		requireThat(semaphore.getAvailablePermits(), "semaphore.getAvailablePermits()").isEqualTo(capacity);
	}

	/**
	 * Queues one waiter per priority, releases the held permit and returns the order in which the waiters ran.
	 */
	private static List<Integer> grantOrder(QueueMode queueMode, int... priorities) throws Exception
	{
		Semaphore semaphore = Semaphore.builder().queueMode(queueMode).build();
		semaphore.acquire();
		List<Integer> order = Collections.synchronizedList(new ArrayList<>());
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			List<Future<?>> futures = new ArrayList<>();
			for (int i = 0; i < priorities.length; ++i)
			{
				int priority = priorities[i];
				futures.add(executor.submit((Callable<Void>) () ->
				{
					semaphore.acquire(priority, null);
					order.add(priority);
					semaphore.release();
					return null;
				}));
				int expectedLength = i + 1;
				Polling.waitUntil(() -> semaphore.getQueueLength() == expectedLength,
					"waiter " + expectedLength + " never queued");
			}
			semaphore.release();
			for (Future<?> future : futures)
				future.get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
		return order;
	}

	@Test
	public void fifoOrder() throws Exception
	{
		requireThat(grantOrder(QueueMode.FIFO, 1, 2, 3), "order").isEqualTo(List.of(1, 2, 3));
	}

	@Test
	public void lifoOrder() throws Exception
	{
		requireThat(grantOrder(QueueMode.LIFO, 1, 2, 3), "order").isEqualTo(List.of(3, 2, 1));
	}

	@Test
	public void priorityOrder() throws Exception
	{
		requireThat(grantOrder(QueueMode.PRIORITY, 1, 5, 3), "order").isEqualTo(List.of(5, 3, 1));
	}

	@Test(expectedExceptions = TimeoutException.class)
	public void acquireTimesOut() throws Exception
	{
		Semaphore semaphore = Semaphore.builder().build();
		semaphore.acquire();
		semaphore.acquire(Duration.ofMillis(50));
	}

	@Test
	public void timeoutRemovesWaiter() throws Exception
	{
		Semaphore semaphore = Semaphore.builder().build();
		semaphore.acquire();
		try
		{
			semaphore.acquire(Duration.ofMillis(20));
		}
		catch (TimeoutException e)
		{
			requireThat(semaphore.getQueueLength(), "semaphore.getQueueLength()").isZero();
			return;
		}
		throw new AssertionError("Expected a TimeoutException");
	}

	@Test(expectedExceptions = TimeoutException.class)
	public void executeUsesDefaultTimeout() throws Exception
	{
		Semaphore semaphore = Semaphore.builder().timeout(Duration.ofMillis(50)).build();
		semaphore.acquire();
		semaphore.execute(() -> "unreachable");
	}

	@Test
	public void listenerReportsPosition() throws Exception
	{
		List<Integer> positions = Collections.synchronizedList(new ArrayList<>());
		Semaphore semaphore = Semaphore.builder().
			listener(new SemaphoreListener()
			{
				@Override
				public void onWaiting(Semaphore semaphore, int position)
				{
					positions.add(position);
				}
			}).
			build();
		semaphore.acquire();
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			Future<?> first = executor.submit(() -> semaphore.execute(() -> null));
			Polling.waitUntil(() -> semaphore.getQueueLength() == 1, "first waiter never queued");
			Future<?> second = executor.submit(() -> semaphore.execute(() -> null));
			Polling.waitUntil(() -> semaphore.getQueueLength() == 2, "second waiter never queued");
			semaphore.release();
			first.get(10, TimeUnit.SECONDS);
			second.get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
		requireThat(positions, "positions").isEqualTo(List.of(1, 2));
	}

	@Test
	public void executeReleasesOnFailure() throws Exception
	{
		Semaphore semaphore = Semaphore.builder().build();
		try
		{
			semaphore.execute(() ->
			{
				throw new IllegalStateException("task failed");
			});
		}
		catch (IllegalStateException e)
		{
			requireThat(semaphore.getAvailablePermits(), "semaphore.getAvailablePermits()").isEqualTo(1);
			return;
		}
		throw new AssertionError("Expected an IllegalStateException");
	}

	@Test
	public void wrapPreservesArguments() throws Exception
	{
		Semaphore semaphore = Semaphore.builder().build();
		Callable<String> zero = semaphore.wrap(() -> "zero");
		Callable1<Integer, Integer> one = semaphore.wrap((Integer value) -> value * 2);
		Callable2<Integer, Integer, Integer> two = semaphore.wrap((Integer first, Integer second) ->
			first + second);
		requireThat(zero.call(), "zero.call()").isEqualTo("zero");
		requireThat(one.call(21), "one.call(21)").isEqualTo(42);
		requireThat(two.call(40, 2), "two.call(40, 2)").isEqualTo(42);
		requireThat(semaphore.getAvailablePermits(), "semaphore.getAvailablePermits()").isEqualTo(1);
	}

	@Test
	public void interruptedWaiterLeavesQueue() throws Exception
	{
		Semaphore semaphore = Semaphore.builder().build();
		semaphore.acquire();
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			Future<?> waiter = executor.submit((Callable<Void>) () ->
			{
				semaphore.acquire();
				return null;
			});
			Polling.waitUntil(() -> semaphore.getQueueLength() == 1, "waiter never queued");
			waiter.cancel(true);
			Polling.waitUntil(() -> semaphore.getQueueLength() == 0, "waiter never left the queue");
		}
		finally
		{
			executor.shutdownNow();
		}
		semaphore.release();
		requireThat(semaphore.getAvailablePermits(), "semaphore.getAvailablePermits()").isEqualTo(1);
	}
}
