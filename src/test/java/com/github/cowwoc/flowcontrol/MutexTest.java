package com.github.cowwoc.flowcontrol;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class MutexTest
{
	@Test
	public void mutualExclusion() throws Exception
	{
		Mutex mutex = Mutex.builder().build();
		AtomicInteger inside = new AtomicInteger();
		AtomicInteger overlaps = new AtomicInteger();
		ExecutorService executor = Executors.newFixedThreadPool(8);
		try
		{
			List<Future<Object>> futures = new ArrayList<>();
			for (int i = 0; i < 40; ++i)
			{
				futures.add(executor.submit(() -> mutex.execute(() ->
				{
					if (inside.incrementAndGet() > 1)
						overlaps.incrementAndGet();
					Thread.sleep(1);
					inside.decrementAndGet();
					return null;
				})));
			}
			for (Future<Object> future : futures)
				future.get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
		requireThat(overlaps.get(), "overlaps").isZero();
		requireThat(mutex.isLocked(), "mutex.isLocked()").isFalse();
	}

	@Test
	public void tryLock()
	{
		Mutex mutex = Mutex.builder().build();
		requireThat(mutex.tryLock(), "mutex.tryLock()").isTrue();
		requireThat(mutex.tryLock(), "mutex.tryLock()").isFalse();
		mutex.unlock();
		requireThat(mutex.isLocked(), "mutex.isLocked()").isFalse();
	}

	@Test(expectedExceptions = TimeoutException.class)
	public void lockTimesOut() throws Exception
	{
		Mutex mutex = Mutex.builder().build();
		mutex.lock();
		mutex.lock(Duration.ofMillis(30));
	}

	@Test(expectedExceptions = TimeoutException.class)
	public void executeThrowsOnTimeout() throws Exception
	{
		Mutex mutex = Mutex.builder().timeout(Duration.ofMillis(30)).build();
		mutex.lock();
		mutex.execute(() -> "unreachable");
	}

	@Test
	public void executeWithoutLockAfterTimeout() throws Exception
	{
		Mutex mutex = Mutex.builder().
			timeout(Duration.ofMillis(30)).
			throwOnTimeout(false).
			build();
		mutex.lock();
		String result = mutex.execute(() -> "ran");
		requireThat(result, "result").isEqualTo("ran");
		// The task must not release a lock it never acquired
		requireThat(mutex.isLocked(), "mutex.isLocked()").isTrue();
		mutex.unlock();
	}

	@Test(expectedExceptions = TimeoutException.class)
	public void synchronizeAlwaysThrowsOnTimeout() throws Exception
	{
		Mutex mutex = Mutex.builder().
			timeout(Duration.ofMillis(30)).
			throwOnTimeout(false).
			build();
		mutex.lock();
		mutex.synchronize(() -> "unreachable");
	}

	@Test
	public void listenerNotifiedWhenBlocked() throws Exception
	{
		AtomicInteger blocked = new AtomicInteger();
		Mutex mutex = Mutex.builder().
			listener(new MutexListener()
			{
				@Override
				public void onBlocked(Mutex mutex)
				{
					blocked.incrementAndGet();
				}
			}).
			build();
		mutex.execute(() -> null);
		requireThat(blocked.get(), "blocked").isZero();

		mutex.lock();
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			Future<Object> future = executor.submit(() -> mutex.execute(() -> null));
			Polling.waitUntil(() -> mutex.getQueueLength() == 1, "waiter never queued");
			mutex.unlock();
			future.get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
		requireThat(blocked.get(), "blocked").isEqualTo(1);
	}

	@Test
	public void releasedAfterFailure() throws Exception
	{
		Mutex mutex = Mutex.builder().build();
		try
		{
			mutex.execute(() ->
			{
				throw new IllegalStateException("task failed");
			});
		}
		catch (IllegalStateException e)
		{
			requireThat(mutex.isLocked(), "mutex.isLocked()").isFalse();
			return;
		}
		throw new AssertionError("Expected an IllegalStateException");
	}
}
