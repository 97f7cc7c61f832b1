package com.github.cowwoc.flowcontrol;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class BulkheadTest
{
	@Test(expectedExceptions = IllegalArgumentException.class)
	public void zeroPools()
	{
		Bulkhead.builder().poolSize(0).build();
	}

	@Test
	public void poolsRunConcurrently() throws Exception
	{
		Bulkhead bulkhead = Bulkhead.builder().poolSize(2).build();
		CountDownLatch started = new CountDownLatch(2);
		CountDownLatch finish = new CountDownLatch(1);
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			List<Future<Object>> futures = new ArrayList<>();
			for (int i = 0; i < 2; ++i)
			{
				futures.add(executor.submit(() -> bulkhead.execute(() ->
				{
					started.countDown();
					finish.await();
					return null;
				})));
			}
			// Round-robin selection places the two tasks in different pools
			requireThat(started.await(10, TimeUnit.SECONDS), "started").isTrue();
			requireThat(bulkhead.getAvailablePools(), "bulkhead.getAvailablePools()").isZero();

			futures.add(executor.submit(() -> bulkhead.execute(() -> null)));
			Polling.waitUntil(() -> bulkhead.getQueueLength() == 1, "third task never queued");
			finish.countDown();
			for (Future<Object> future : futures)
				future.get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
		requireThat(bulkhead.getAvailablePools(), "bulkhead.getAvailablePools()").isEqualTo(2);
	}

	@Test
	public void timeoutNotifiesListener() throws Exception
	{
		List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
		Bulkhead bulkhead = Bulkhead.builder().
			poolSize(1).
			timeout(Duration.ofMillis(30)).
			listener(new BulkheadListener()
			{
				@Override
				public void onIsolationFailure(Bulkhead bulkhead, Throwable cause)
				{
					failures.add(cause);
				}
			}).
			build();
		CountDownLatch started = new CountDownLatch(1);
		CountDownLatch finish = new CountDownLatch(1);
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			Future<Object> blocker = executor.submit(() -> bulkhead.execute(() ->
			{
				started.countDown();
				finish.await();
				return null;
			}));
			requireThat(started.await(10, TimeUnit.SECONDS), "started").isTrue();
			try
			{
				bulkhead.execute(() -> "unreachable");
				throw new AssertionError("Expected a TimeoutException");
			}
			catch (TimeoutException e)
			{
				requireThat(failures.size(), "failures.size()").isEqualTo(1);
				requireThat(failures.get(0), "failures.get(0)").isInstanceOf(TimeoutException.class);
			}
			finish.countDown();
			blocker.get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	@Test
	public void taskFailureNotifiesListenerAndFreesPool() throws Exception
	{
		List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
		Bulkhead bulkhead = Bulkhead.builder().
			listener(new BulkheadListener()
			{
				@Override
				public void onIsolationFailure(Bulkhead bulkhead, Throwable cause)
				{
					failures.add(cause);
				}
			}).
			build();
		try
		{
			bulkhead.execute(() ->
			{
				throw new IllegalStateException("task failed");
			});
			throw new AssertionError("Expected an IllegalStateException");
		}
		catch (IllegalStateException e)
		{
			requireThat(failures.size(), "failures.size()").isEqualTo(1);
		}
		requireThat(bulkhead.getAvailablePools(), "bulkhead.getAvailablePools()").isEqualTo(1);
		requireThat(bulkhead.execute(() -> "ok"), "result").isEqualTo("ok");
	}
}
