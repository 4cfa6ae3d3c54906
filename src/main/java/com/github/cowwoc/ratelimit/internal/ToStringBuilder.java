package com.github.cowwoc.ratelimit.internal;

import com.github.cowwoc.requirements.java.DefaultJavaRequirements;
import com.github.cowwoc.requirements.java.JavaRequirements;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.StringJoiner;

/**
 * Standardizes the format of toString() return values.
 */
public final class ToStringBuilder
{
	private static final JavaRequirements REQUIREMENTS = new DefaultJavaRequirements();
	private final String name;
	private final List<Entry<String, String>> properties = new ArrayList<>();

	/**
	 * Creates a new builder.
	 *
	 * @param aClass the type of object being processed
	 * @throws NullPointerException if {@code aClass} is null
	 */
	public ToStringBuilder(Class<?> aClass)
	{
		REQUIREMENTS.requireThat(aClass, "aClass").isNotNull();
		this.name = aClass.getSimpleName();
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
		REQUIREMENTS.requireThat(name, "name").isNotBlank();
		properties.add(new SimpleImmutableEntry<>(name, String.valueOf(value)));
		return this;
	}

	/**
	 * Returns the String representation of this {@code ToStringBuilder}.
	 *
	 * @return the String representation of this {@code ToStringBuilder}
	 */
	@Override
	public String toString()
	{
		int maxKeyLength = 0;
		for (Entry<String, String> entry : properties)
			maxKeyLength = Math.max(maxKeyLength, entry.getKey().length());

		StringJoiner output = new StringJoiner(",\n\t", name + "\n{\n\t", "\n}");
		for (Entry<String, String> entry : properties)
		{
			String key = entry.getKey();
			String padding = " ".repeat(maxKeyLength - key.length());
			output.add(key + padding + ": " + entry.getValue().replace("\n", "\n\t"));
		}
		return output.toString();
	}
}
