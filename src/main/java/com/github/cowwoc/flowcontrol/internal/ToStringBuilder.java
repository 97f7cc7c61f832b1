package com.github.cowwoc.flowcontrol.internal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.StringJoiner;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Standardizes the format of toString() return values.
 * <p>
 * Output takes the form:
 * <pre>
 * Outer.Inner
 * {
 * 	name : value,
 * 	other: value
 * }
 * </pre>
 */
public final class ToStringBuilder
{
	private final Class<?> aClass;
	private final List<String> names = new ArrayList<>();
	private final List<String> values = new ArrayList<>();

	/**
	 * Creates a new builder.
	 *
	 * @param aClass the type of object being processed
	 * @throws NullPointerException if {@code aClass} is null
	 */
	public ToStringBuilder(Class<?> aClass)
	{
		requireThat(aClass, "aClass").isNotNull();
		this.aClass = aClass;
	}

	/**
	 * Adds a property.
	 *
	 * @param name  the name of the property
	 * @param value the value of the property
	 * @return this
	 * @throws NullPointerException     if {@code name} is null
	 * @throws IllegalArgumentException if {@code name} is blank
	 */
	public ToStringBuilder add(String name, Object value)
	{
		requireThat(name, "name").isNotBlank();
		names.add(name);
		values.add(String.valueOf(value));
		return this;
	}

	/**
	 * @return the simple name of the class, prefixed by the names of any enclosing classes
	 */
	private String getQualifiedSimpleName()
	{
		Deque<String> path = new ArrayDeque<>();
		for (Class<?> current = aClass; current != null; current = current.getEnclosingClass())
			path.addFirst(current.getSimpleName());
		return String.join(".", path);
	}

	@Override
	public String toString()
	{
		int width = 0;
		for (String name : names)
			width = Math.max(width, name.length());

		StringJoiner body = new StringJoiner(",\n");
		for (int i = 0; i < names.size(); ++i)
		{
			String name = names.get(i);
			body.add(name + " ".repeat(width - name.length()) + ": " + values.get(i));
		}
		return getQualifiedSimpleName() + "\n" +
			"{\n" +
			"\t" + body.toString().replace("\n", "\n\t") + "\n" +
			"}";
	}
}
