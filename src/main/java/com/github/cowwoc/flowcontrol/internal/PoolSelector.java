package com.github.cowwoc.flowcontrol.internal;

import java.util.List;

/**
 * Selects a pool.
 *
 * @param <T> the type of pools
 */
public interface PoolSelector<T>
{
	/**
	 * Selects the next pool to run a task.
	 *
	 * @param pools a list of pools
	 * @return the next pool to run a task
	 * @throws NullPointerException     if {@code pools} is null
	 * @throws IllegalArgumentException if {@code pools} is empty
	 */
	T nextPool(List<T> pools);
}
