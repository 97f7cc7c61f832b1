package com.github.cowwoc.flowcontrol;

/**
 * A task that accepts two arguments, returns a result and may throw an exception.
 *
 * @param <A> the type of the first argument
 * @param <B> the type of the second argument
 * @param <V> the type of the result
 */
@FunctionalInterface
public interface Callable2<A, B, V>
{
	/**
	 * Runs the task.
	 *
	 * @param first  the first argument
	 * @param second the second argument
	 * @return the result of the task
	 * @throws Exception if the task fails
	 */
	V call(A first, B second) throws Exception;
}
