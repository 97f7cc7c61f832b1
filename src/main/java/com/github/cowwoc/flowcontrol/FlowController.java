package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.annotation.CheckReturnValue;

import java.util.concurrent.Callable;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Controls when, and whether, a task may run.
 * <p>
 * Wrapping a task returns a task of the same arity whose invocations are routed through
 * {@link #execute(Callable)}. Exceptions thrown by the task propagate unchanged.
 */
public interface FlowController
{
	/**
	 * Runs a task under the control of this object.
	 *
	 * @param <V>  the type of value returned by the task
	 * @param task the task
	 * @return the value returned by the task
	 * @throws NullPointerException if {@code task} is null
	 * @throws Exception            if the task throws an exception, or the controller refuses to run it
	 */
	<V> V execute(Callable<V> task) throws Exception;

	/**
	 * Wraps a task that takes no arguments.
	 *
	 * @param <V>  the type of value returned by the task
	 * @param task the task
	 * @return a task that runs {@code task} under the control of this object
	 * @throws NullPointerException if {@code task} is null
	 */
	@CheckReturnValue
	default <V> Callable<V> wrap(Callable<V> task)
	{
		requireThat(task, "task").isNotNull();
		return () -> execute(task);
	}

	/**
	 * Wraps a task that takes one argument.
	 *
	 * @param <A>  the type of the argument
	 * @param <V>  the type of value returned by the task
	 * @param task the task
	 * @return a task that runs {@code task} under the control of this object
	 * @throws NullPointerException if {@code task} is null
	 */
	@CheckReturnValue
	default <A, V> Callable1<A, V> wrap(Callable1<A, V> task)
	{
		requireThat(task, "task").isNotNull();
		return argument -> execute(() -> task.call(argument));
	}

	/**
	 * Wraps a task that takes two arguments.
	 *
	 * @param <A>  the type of the first argument
	 * @param <B>  the type of the second argument
	 * @param <V>  the type of value returned by the task
	 * @param task the task
	 * @return a task that runs {@code task} under the control of this object
	 * @throws NullPointerException if {@code task} is null
	 */
	@CheckReturnValue
	default <A, B, V> Callable2<A, B, V> wrap(Callable2<A, B, V> task)
	{
		requireThat(task, "task").isNotNull();
		return (first, second) -> execute(() -> task.call(first, second));
	}
}
