package com.github.cowwoc.flowcontrol;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class CountdownLatchTest
{
	@Test(expectedExceptions = IllegalArgumentException.class)
	public void negativeCount()
	{
		CountdownLatch.builder().count(-1).build();
	}

	@Test(expectedExceptions = IllegalStateException.class)
	public void countDownBelowZero()
	{
		CountdownLatch latch = CountdownLatch.builder().count(1).build();
		latch.countDown();
		latch.countDown();
	}

	@Test
	public void zeroCountIsComplete() throws InterruptedException
	{
		CountdownLatch latch = CountdownLatch.builder().count(0).build();
		requireThat(latch.isComplete(), "latch.isComplete()").isTrue();
		requireThat(latch.await(Duration.ZERO), "latch.await(Duration.ZERO)").isTrue();
	}

	@Test
	public void onCompleteRunsOnceAtZero()
	{
		AtomicInteger completions = new AtomicInteger();
		CountdownLatch latch = CountdownLatch.builder().
			count(3).
			onComplete(completions::incrementAndGet).
			build();
		latch.countDown();
		latch.countDown();
		requireThat(completions.get(), "completions").isZero();
		latch.countDown();
		requireThat(completions.get(), "completions").isEqualTo(1);
		requireThat(latch.getCount(), "latch.getCount()").isZero();
	}

	@Test
	public void awaitTimesOut() throws InterruptedException
	{
		CountdownLatch latch = CountdownLatch.builder().count(1).build();
		requireThat(latch.await(Duration.ofMillis(30)), "latch.await()").isFalse();
		requireThat(latch.getWaitingCount(), "latch.getWaitingCount()").isZero();
	}

	@Test
	public void waitersReleasedAtZero() throws Exception
	{
		CountdownLatch latch = CountdownLatch.builder().count(2).build();
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			Future<Boolean> first = executor.submit(() -> latch.await(null));
			Future<Boolean> second = executor.submit(() -> latch.await(null));
			Polling.waitUntil(() -> latch.getWaitingCount() == 2, "waiters never blocked");
			latch.countDown();
			requireThat(first.isDone(), "first.isDone()").isFalse();
			latch.countDown();
			requireThat(first.get(10, TimeUnit.SECONDS), "first").isTrue();
			requireThat(second.get(10, TimeUnit.SECONDS), "second").isTrue();
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	@Test
	public void resetRestoresInitialCount() throws InterruptedException
	{
		CountdownLatch latch = CountdownLatch.builder().count(2).build();
		latch.countDown();
		latch.countDown();
		requireThat(latch.isComplete(), "latch.isComplete()").isTrue();
		latch.reset();
		requireThat(latch.getCount(), "latch.getCount()").isEqualTo(2);
		requireThat(latch.await(Duration.ofMillis(10)), "latch.await()").isFalse();
	}

	@Test
	public void executeCountsDownOnFailure() throws Exception
	{
		CountdownLatch latch = CountdownLatch.builder().count(2).build();
		requireThat(latch.execute(() -> "first"), "result").isEqualTo("first");
		try
		{
			latch.execute(() ->
			{
				throw new IllegalStateException("task failed");
			});
			throw new AssertionError("Expected an IllegalStateException");
		}
		catch (IllegalStateException e)
		{
			requireThat(latch.isComplete(), "latch.isComplete()").isTrue();
		}
	}
}
