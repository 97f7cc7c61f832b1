/**
 * Primitives that bound, sequence or admit the execution of tasks.
 * <p>
 * Synchronization primitives ({@link com.github.cowwoc.flowcontrol.Semaphore},
 * {@link com.github.cowwoc.flowcontrol.Mutex}, {@link com.github.cowwoc.flowcontrol.Monitor},
 * {@link com.github.cowwoc.flowcontrol.Barrier}, {@link com.github.cowwoc.flowcontrol.CountdownLatch},
 * {@link com.github.cowwoc.flowcontrol.ReaderWriterLock}) and controllers built on top of them
 * ({@link com.github.cowwoc.flowcontrol.Bulkhead}, {@link com.github.cowwoc.flowcontrol.RateLimiter},
 * {@link com.github.cowwoc.flowcontrol.BackpressureController},
 * {@link com.github.cowwoc.flowcontrol.PriorityQueueExecutor}, {@link com.github.cowwoc.flowcontrol.TaskQueue}).
 * <p>
 * Blocking methods accept an optional timeout. A {@code null} timeout waits indefinitely.
 * <p>
 * <b>Thread safety</b>: Controllers are thread-safe. Builders and listeners are not.
 */
package com.github.cowwoc.flowcontrol;
