package com.github.cowwoc.flowcontrol.internal;

import java.time.Duration;

/**
 * The point in time at which a blocking operation gives up.
 * <p>
 * <b>Thread safety</b>: This class is immutable.
 */
public final class Deadline
{
	private static final Deadline NEVER = new Deadline(0, true);
	private final long expiresAt;
	private final boolean infinite;

	/**
	 * @param expiresAt the value of {@link System#nanoTime()} at which the deadline expires
	 * @param infinite  true if the deadline never expires
	 */
	private Deadline(long expiresAt, boolean infinite)
	{
		this.expiresAt = expiresAt;
		this.infinite = infinite;
	}

	/**
	 * Returns a deadline that expires after {@code timeout}.
	 *
	 * @param timeout the amount of time to wait ({@code null} if the deadline never expires)
	 * @return a new deadline
	 */
	public static Deadline after(Duration timeout)
	{
		if (timeout == null)
			return NEVER;
		long nanos;
		try
		{
			nanos = timeout.toNanos();
		}
		catch (ArithmeticException e)
		{
			// The timeout is longer than 292 years
			return NEVER;
		}
		long now = System.nanoTime();
		if (nanos > 0 && now + nanos < now)
			return NEVER;
		return new Deadline(now + nanos, false);
	}

	/**
	 * @return a deadline that never expires
	 */
	public static Deadline never()
	{
		return NEVER;
	}

	/**
	 * @return true if the deadline never expires
	 */
	public boolean isInfinite()
	{
		return infinite;
	}

	/**
	 * @return the number of nanoseconds left before the deadline expires ({@code Long.MAX_VALUE} if it never
	 * expires)
	 */
	public long getNanosLeft()
	{
		if (infinite)
			return Long.MAX_VALUE;
		return expiresAt - System.nanoTime();
	}

	/**
	 * @return true if the deadline has expired
	 */
	public boolean hasExpired()
	{
		return getNanosLeft() <= 0;
	}

	@Override
	public String toString()
	{
		if (infinite)
			return "never";
		return Duration.ofNanos(getNanosLeft()).toString();
	}
}
