package com.github.cowwoc.ratelimit.internal;

import com.github.cowwoc.requirements.java.DefaultJavaRequirements;
import com.github.cowwoc.requirements.java.JavaRequirements;
import org.testng.annotations.Test;

public final class ToStringBuilderTest
{
	private static final JavaRequirements REQUIREMENTS = new DefaultJavaRequirements();

	@Test
	public void alignsKeys()
	{
		String actual = new ToStringBuilder(ToStringBuilderTest.class).
			add("a", 1).
			add("longer", "value").
			toString();
		REQUIREMENTS.requireThat(actual, "actual").isEqualTo("ToStringBuilderTest\n" +
			"{\n" +
			"\ta     : 1,\n" +
			"\tlonger: value\n" +
			"}");
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void blankName()
	{
		new ToStringBuilder(ToStringBuilderTest.class).add(" ", 1);
	}
}
