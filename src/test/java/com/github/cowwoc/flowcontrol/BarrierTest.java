package com.github.cowwoc.flowcontrol;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class BarrierTest
{
	@Test(expectedExceptions = IllegalArgumentException.class)
	public void zeroParties()
	{
		Barrier.builder().parties(0).build();
	}

	@Test
	public void actionRunsOncePerGeneration() throws Exception
	{
		AtomicInteger actions = new AtomicInteger();
		Barrier barrier = Barrier.builder().
			parties(3).
			cyclic(true).
			action(actions::incrementAndGet).
			build();
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			for (int generation = 1; generation <= 2; ++generation)
			{
				List<Future<Object>> futures = new ArrayList<>();
				for (int i = 0; i < 2; ++i)
				{
					futures.add(executor.submit(() ->
					{
						barrier.await();
						return null;
					}));
				}
				Polling.waitUntil(() -> barrier.getArrivedCount() == 2, "parties never arrived");
				requireThat(actions.get(), "actions").isEqualTo(generation - 1);
				barrier.await();
				for (Future<Object> future : futures)
					future.get(10, TimeUnit.SECONDS);
				requireThat(actions.get(), "actions").isEqualTo(generation);
				requireThat(barrier.getArrivedCount(), "barrier.getArrivedCount()").isZero();
			}
		}
		finally
		{
			executor.shutdownNow();
		}
		requireThat(barrier.isBroken(), "barrier.isBroken()").isFalse();
	}

	@Test
	public void timeoutBreaksBarrier() throws Exception
	{
		AtomicInteger timeouts = new AtomicInteger();
		Barrier barrier = Barrier.builder().
			parties(2).
			listener(new BarrierListener()
			{
				@Override
				public void onTimeout(Barrier barrier)
				{
					timeouts.incrementAndGet();
				}
			}).
			build();
		try
		{
			barrier.await(Duration.ofMillis(30));
			throw new AssertionError("Expected a TimeoutException");
		}
		catch (TimeoutException e)
		{
			requireThat(timeouts.get(), "timeouts").isEqualTo(1);
			requireThat(barrier.isBroken(), "barrier.isBroken()").isTrue();
		}
		try
		{
			barrier.await(Duration.ofMillis(30));
			throw new AssertionError("Expected a BrokenBarrierException");
		}
		catch (BrokenBarrierException e)
		{
			requireThat(timeouts.get(), "timeouts").isEqualTo(1);
		}
	}

	@Test
	public void timeoutFailsOtherParties() throws Exception
	{
		Barrier barrier = Barrier.builder().parties(3).build();
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			Future<Object> patient = executor.submit(() ->
			{
				barrier.await();
				return null;
			});
			Polling.waitUntil(() -> barrier.getArrivedCount() == 1, "patient party never arrived");
			try
			{
				barrier.await(Duration.ofMillis(30));
				throw new AssertionError("Expected a TimeoutException");
			}
			catch (TimeoutException e)
			{
				// expected
			}
			try
			{
				patient.get(10, TimeUnit.SECONDS);
				throw new AssertionError("Expected an ExecutionException");
			}
			catch (ExecutionException e)
			{
				requireThat(e.getCause(), "e.getCause()").isInstanceOf(TimeoutException.class);
			}
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	@Test
	public void resetFailsWaitersAndRestoresBarrier() throws Exception
	{
		Barrier barrier = Barrier.builder().parties(2).build();
		ExecutorService executor = Executors.newCachedThreadPool();
		try
		{
			Future<Object> waiting = executor.submit(() ->
			{
				barrier.await();
				return null;
			});
			Polling.waitUntil(() -> barrier.getArrivedCount() == 1, "party never arrived");
			barrier.reset();
			try
			{
				waiting.get(10, TimeUnit.SECONDS);
				throw new AssertionError("Expected an ExecutionException");
			}
			catch (ExecutionException e)
			{
				requireThat(e.getCause(), "e.getCause()").isInstanceOf(BrokenBarrierException.class);
			}
			requireThat(barrier.isBroken(), "barrier.isBroken()").isFalse();
			requireThat(barrier.getArrivedCount(), "barrier.getArrivedCount()").isZero();

			Future<Object> next = executor.submit(() ->
			{
				barrier.await();
				return null;
			});
			Polling.waitUntil(() -> barrier.getArrivedCount() == 1, "party never arrived");
			barrier.await();
			next.get(10, TimeUnit.SECONDS);
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	@Test(expectedExceptions = BrokenBarrierException.class)
	public void nonCyclicBarrierReleasesOnce() throws Exception
	{
		Barrier barrier = Barrier.builder().
			parties(1).
			cyclic(false).
			build();
		barrier.await();
		barrier.await();
	}

	@Test
	public void defaultBarrierReleasesOnce() throws Exception
	{
		Barrier barrier = Barrier.builder().parties(1).build();
		requireThat(barrier.isCyclic(), "barrier.isCyclic()").isFalse();
		barrier.await();
		requireThat(barrier.isBroken(), "barrier.isBroken()").isTrue();
		try
		{
			barrier.await();
			throw new AssertionError("Expected a BrokenBarrierException");
		}
		catch (BrokenBarrierException e)
		{
			// expected
		}
	}

	@Test
	public void actionFailureBreaksBarrier() throws Exception
	{
		Barrier barrier = Barrier.builder().
			parties(1).
			action(() ->
			{
				throw new IllegalStateException("action failed");
			}).
			build();
		try
		{
			barrier.await();
			throw new AssertionError("Expected an IllegalStateException");
		}
		catch (IllegalStateException e)
		{
			requireThat(barrier.isBroken(), "barrier.isBroken()").isTrue();
		}
	}

	@Test
	public void executeReturnsTaskResult() throws Exception
	{
		Barrier barrier = Barrier.builder().parties(1).build();
		String result = barrier.execute(() -> "done");
		requireThat(result, "result").isEqualTo("done");
	}
}
