/**
 * <h1>Locking policy</h1>
 * <p>
 * Every controller guards its state with a single {@link com.github.cowwoc.flowcontrol.internal.LockAsResource}.
 * Blocked threads are represented by {@link com.github.cowwoc.flowcontrol.internal.Waiter}s, each with its
 * own {@link java.util.concurrent.locks.Condition}, so that releasing a resource wakes up exactly the thread
 * that receives it.
 * <p>
 * Unless otherwise stated, public methods are responsible for acquiring locks on behalf of non-public
 * methods that they invoke.
 */
package com.github.cowwoc.flowcontrol.internal;
