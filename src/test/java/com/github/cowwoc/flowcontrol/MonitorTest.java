package com.github.cowwoc.flowcontrol;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class MonitorTest
{
	@Test(expectedExceptions = IllegalStateException.class)
	public void waitWithoutHoldingMonitor() throws InterruptedException
	{
		Monitor monitor = new Monitor();
		monitor.waitWhile(() -> true);
	}

	@Test
	public void waitWhileFalseReturnsImmediately() throws Exception
	{
		Monitor monitor = new Monitor();
		Boolean result = monitor.synchronize(() -> monitor.waitWhile(() -> false, Duration.ofMillis(1)));
		requireThat(result, "result").isEqualTo(true);
		requireThat(monitor.getWaitingCount(), "monitor.getWaitingCount()").isZero();
	}

	@Test
	public void waitTimesOutAndReacquiresMonitor() throws Exception
	{
		Monitor monitor = new Monitor();
		List<Boolean> lockedAfterWait = new ArrayList<>();
		Boolean result = monitor.synchronize(() ->
		{
			boolean satisfied = monitor.waitUntil(() -> false, Duration.ofMillis(30));
			lockedAfterWait.add(monitor.isLocked());
			return satisfied;
		});
		requireThat(result, "result").isEqualTo(false);
		requireThat(lockedAfterWait, "lockedAfterWait").isEqualTo(List.of(true));
		requireThat(monitor.isLocked(), "monitor.isLocked()").isFalse();
		requireThat(monitor.getWaitingCount(), "monitor.getWaitingCount()").isZero();
	}

	@Test
	public void producerConsumer() throws Exception
	{
		Monitor monitor = new Monitor();
		Deque<Integer> items = new ArrayDeque<>();
		List<Integer> consumed = Collections.synchronizedList(new ArrayList<>());
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			Future<Object> consumer = executor.submit(() ->
			{
				for (int i = 0; i < 3; ++i)
				{
					monitor.synchronize(() ->
					{
						monitor.waitWhile(items::isEmpty);
						consumed.add(items.removeFirst());
						return null;
					});
				}
				return null;
			});
			for (int i = 1; i <= 3; ++i)
			{
				int item = i;
				monitor.synchronize(() ->
				{
					items.addLast(item);
					monitor.notifyOne();
					return null;
				});
			}
			consumer.get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
		requireThat(consumed, "consumed").isEqualTo(List.of(1, 2, 3));
	}

	@Test
	public void notifyAllWakesEveryWaiter() throws Exception
	{
		Monitor monitor = new Monitor();
		boolean[] ready = new boolean[1];
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			List<Future<Object>> futures = new ArrayList<>();
			for (int i = 0; i < 3; ++i)
			{
				futures.add(executor.submit(() -> monitor.synchronize(() ->
				{
					monitor.waitUntil(() -> ready[0]);
					return null;
				})));
			}
			Polling.waitUntil(() -> monitor.getWaitingCount() == 3, "waiters never registered");
			monitor.synchronize(() ->
			{
				ready[0] = true;
				monitor.notifyAllWaiters();
				return null;
			});
			for (Future<Object> future : futures)
				future.get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
		requireThat(monitor.getWaitingCount(), "monitor.getWaitingCount()").isZero();
	}

	@Test
	public void waitByNonOwnerIsRejected() throws Exception
	{
		Monitor monitor = new Monitor();
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch leave = new CountDownLatch(1);
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			Future<Object> owner = executor.submit(() -> monitor.synchronize(() ->
			{
				entered.countDown();
				leave.await();
				return null;
			}));
			requireThat(entered.await(10, TimeUnit.SECONDS), "entered").isTrue();
			boolean rejected = false;
			try
			{
				monitor.waitWhile(() -> true, Duration.ofMillis(50));
			}
			catch (IllegalStateException unused)
			{
				rejected = true;
			}
			requireThat(rejected, "rejected").isTrue();
			// The owner must still hold the monitor
			requireThat(monitor.isLocked(), "monitor.isLocked()").isTrue();
			requireThat(monitor.getWaitingCount(), "monitor.getWaitingCount()").isZero();

			leave.countDown();
			owner.get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
		requireThat(monitor.isLocked(), "monitor.isLocked()").isFalse();
		Boolean reentered = monitor.synchronize(() -> monitor.isLocked());
		requireThat(reentered, "reentered").isEqualTo(true);
		requireThat(monitor.isLocked(), "monitor.isLocked()").isFalse();
	}

	@Test
	public void notifyOneWakesOldestWaiter() throws Exception
	{
		Monitor monitor = new Monitor();
		int[] permits = new int[1];
		List<Integer> woken = Collections.synchronizedList(new ArrayList<>());
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			List<Future<Object>> futures = new ArrayList<>();
			for (int i = 1; i <= 2; ++i)
			{
				int id = i;
				futures.add(executor.submit(() -> monitor.synchronize(() ->
				{
					monitor.waitWhile(() -> permits[0] == 0);
					--permits[0];
					woken.add(id);
					return null;
				})));
				Polling.waitUntil(() -> monitor.getWaitingCount() == id, "waiter " + id + " never registered");
			}
			monitor.synchronize(() ->
			{
				++permits[0];
				monitor.notifyOne();
				return null;
			});
			futures.get(0).get(10, TimeUnit.SECONDS);
			requireThat(woken, "woken").isEqualTo(List.of(1));
			requireThat(monitor.getWaitingCount(), "monitor.getWaitingCount()").isEqualTo(1);
			requireThat(futures.get(1).isDone(), "futures.get(1).isDone()").isFalse();

			monitor.synchronize(() ->
			{
				++permits[0];
				monitor.notifyOne();
				return null;
			});
			futures.get(1).get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
		requireThat(woken, "woken").isEqualTo(List.of(1, 2));
		requireThat(monitor.getWaitingCount(), "monitor.getWaitingCount()").isZero();
	}

	@Test
	public void notifyWithoutWaitersIsIgnored()
	{
		Monitor monitor = new Monitor();
		monitor.notifyOne();
		monitor.notifyAllWaiters();
		requireThat(monitor.getWaitingCount(), "monitor.getWaitingCount()").isZero();
	}
}
