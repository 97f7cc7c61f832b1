package com.github.cowwoc.flowcontrol.test;

import com.github.cowwoc.flowcontrol.BackpressureController;
import com.github.cowwoc.flowcontrol.BackpressureStrategy;
import com.github.cowwoc.flowcontrol.Bulkhead;
import com.github.cowwoc.flowcontrol.Callable1;
import com.github.cowwoc.flowcontrol.Callable2;
import com.github.cowwoc.flowcontrol.CapacityExceededException;
import com.github.cowwoc.flowcontrol.FlowController;
import com.github.cowwoc.flowcontrol.Mutex;
import com.github.cowwoc.flowcontrol.RateLimiter;
import com.github.cowwoc.flowcontrol.ReaderWriterLock;
import com.github.cowwoc.flowcontrol.Semaphore;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class FlowControllerTest
{
	@Test
	public void controllersCompose() throws Exception
	{
		try (RateLimiter limiter = RateLimiter.builder().
			maxCalls(10).
			window(Duration.ofMinutes(1)).
			build())
		{
			Semaphore semaphore = Semaphore.builder().capacity(2).build();
			Bulkhead bulkhead = Bulkhead.builder().poolSize(2).build();
			Callable2<Integer, Integer, Integer> add = limiter.wrap(
				semaphore.wrap(
					bulkhead.wrap((Integer first, Integer second) -> first + second)));
			requireThat(add.call(2, 3), "add.call(2, 3)").isEqualTo(5);
			requireThat(limiter.getAvailableCalls(), "limiter.getAvailableCalls()").isEqualTo(9);
			requireThat(semaphore.getAvailablePermits(), "semaphore.getAvailablePermits()").isEqualTo(2);
			requireThat(bulkhead.getAvailablePools(), "bulkhead.getAvailablePools()").isEqualTo(2);
		}
	}

	@Test
	public void everyControllerWrapsEveryArity() throws Exception
	{
		ReaderWriterLock readerWriterLock = ReaderWriterLock.builder().build();
		List<FlowController> controllers = List.of(
			Semaphore.builder().build(),
			Mutex.builder().build(),
			Bulkhead.builder().build(),
			BackpressureController.builder().build(),
			readerWriterLock.reader(),
			readerWriterLock.writer());
		for (FlowController controller : controllers)
		{
			Callable<String> zero = controller.wrap(() -> "zero");
			Callable1<String, String> one = controller.wrap((String value) -> value + "!");
			Callable2<String, String, String> two = controller.wrap((String first, String second) ->
				first + second);
			requireThat(zero.call(), "zero.call()").isEqualTo("zero");
			requireThat(one.call("one"), "one.call()").isEqualTo("one!");
			requireThat(two.call("tw", "o"), "two.call()").isEqualTo("two");
		}
	}

	@Test(expectedExceptions = RejectedExecutionException.class)
	public void capacityExceededIsARejection() throws Exception
	{
		BackpressureController controller = BackpressureController.builder().
			strategy(BackpressureStrategy.ERROR).
			maxConcurrent(1).
			build();
		controller.execute(() -> controller.execute(() -> "nested"));
	}

	@Test
	public void capacityExceededCarriesMessage()
	{
		CapacityExceededException e = new CapacityExceededException("full");
		requireThat(e.getMessage(), "e.getMessage()").isEqualTo("full");
	}
}
