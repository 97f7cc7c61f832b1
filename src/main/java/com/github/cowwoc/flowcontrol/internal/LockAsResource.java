package com.github.cowwoc.flowcontrol.internal;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enables the use of try-with-resources with ReentrantLock.
 */
public final class LockAsResource
{
	private final ReentrantLock lock = new ReentrantLock();

	/**
	 * Creates a new lock.
	 */
	public LockAsResource()
	{
	}

	/**
	 * Acquires the lock.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock lock()
	{
		lock.lock();
		return lock::unlock;
	}

	/**
	 * Returns a new condition bound to this lock.
	 *
	 * @return a new condition
	 */
	public Condition newCondition()
	{
		return lock.newCondition();
	}
}
