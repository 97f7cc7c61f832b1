package com.github.cowwoc.flowcontrol;

/**
 * A task that accepts one argument, returns a result and may throw an exception.
 *
 * @param <A> the type of the argument
 * @param <V> the type of the result
 */
@FunctionalInterface
public interface Callable1<A, V>
{
	/**
	 * Runs the task.
	 *
	 * @param argument the argument
	 * @return the result of the task
	 * @throws Exception if the task fails
	 */
	V call(A argument) throws Exception;
}
