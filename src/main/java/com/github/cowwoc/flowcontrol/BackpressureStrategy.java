package com.github.cowwoc.flowcontrol;

/**
 * Determines what a {@link BackpressureController} does with a task that arrives while every execution
 * slot is busy.
 */
public enum BackpressureStrategy
{
	/**
	 * Rejects the task.
	 */
	DROP,
	/**
	 * Buffers the task. If the buffer is full, the oldest buffered task is cancelled to make room.
	 */
	DROP_OLDEST,
	/**
	 * Buffers the task. If the buffer is full, the task is rejected.
	 */
	BUFFER,
	/**
	 * Buffers a random fraction ({@code sampleRate}) of the tasks and rejects the rest.
	 */
	SAMPLE,
	/**
	 * Buffers the task. If the buffer is full, the caller blocks until there is room.
	 */
	THROTTLE,
	/**
	 * Rejects the task. Equivalent to {@link #DROP}, for callers that treat overload as an error condition.
	 */
	ERROR
}
