package com.github.cowwoc.flowcontrol;

import java.io.Serial;
import java.util.concurrent.RejectedExecutionException;

/**
 * Thrown when a task is rejected because a controller is full.
 */
public final class CapacityExceededException extends RejectedExecutionException
{
	@Serial
	private static final long serialVersionUID = 0L;

	/**
	 * Creates a new exception.
	 *
	 * @param message an explanation of what went wrong
	 */
	public CapacityExceededException(String message)
	{
		super(message);
	}
}
