package com.github.cowwoc.flowcontrol;

/**
 * The order in which blocked callers are granted a resource.
 */
public enum QueueMode
{
	/**
	 * The longest-waiting caller goes first.
	 */
	FIFO,
	/**
	 * The most recent caller goes first.
	 */
	LIFO,
	/**
	 * The caller with the highest priority goes first. Callers with the same priority are served in arrival
	 * order. Callers that do not specify a priority have a priority of {@code 0}.
	 */
	PRIORITY
}
