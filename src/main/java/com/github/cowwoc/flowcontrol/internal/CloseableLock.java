package com.github.cowwoc.flowcontrol.internal;

/**
 * A held lock that is released by {@link #close()}, for use with try-with-resources.
 */
public interface CloseableLock extends AutoCloseable
{
	/**
	 * Releases the lock.
	 */
	@Override
	void close();
}
