package com.github.cowwoc.flowcontrol;

import com.github.cowwoc.flowcontrol.internal.PoolSelector;

import java.util.List;

import static com.github.cowwoc.requirements.DefaultRequirements.assertThat;

/**
 * Selects the pool that runs the next task.
 */
public enum SelectionPolicy
{
	/**
	 * Selects the next pool in a round-robin fashion, regardless of how busy it is.
	 *
	 * @see <a href="https://en.wikipedia.org/wiki/Round-robin_scheduling">Round robin scheduling</a>
	 */
	ROUND_ROBIN
		{
			@Override
			<T> PoolSelector<T> createSelector()
			{
				return new PoolSelector<>()
				{
					private int index = -1;

					@Override
					public T nextPool(List<T> pools)
					{
						assertThat(r -> r.requireThat(pools, "pools").isNotEmpty());
						// Wrap around end of list
						index = (index + 1) % pools.size();
						return pools.get(index);
					}
				};
			}
		};

	/**
	 * @param <T> the type of pools
	 * @return a new {@code PoolSelector} that implements this policy
	 */
	abstract <T> PoolSelector<T> createSelector();
}
