package org.lokray.toybeam.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Holds the settings of one compilation: whether test-only items are compiled and which
 * features are enabled for {@code #[cfg(feature = "...")]}. Instances are immutable; the
 * {@code with*} methods return modified copies.
 */
public class CompileOptions
{
	public static final String TEST_MODE_KEY = "compile.test_mode";
	public static final String FEATURES_KEY = "compile.features";

	private final boolean testMode;
	private final Set<String> features;

	public CompileOptions(boolean testMode, Set<String> features)
	{
		this.testMode = testMode;
		this.features = Collections.unmodifiableSet(new LinkedHashSet<>(features));
	}

	/**
	 * Loads options from properties, falling back to defaults for missing keys.
	 * Features are a comma-separated list; blank entries are ignored.
	 */
	public CompileOptions(Properties props)
	{
		this(Boolean.parseBoolean(props.getProperty(TEST_MODE_KEY, "false").trim()),
				parseFeatures(props.getProperty(FEATURES_KEY, "")));
	}

	public static CompileOptions defaults()
	{
		return new CompileOptions(false, Collections.emptySet());
	}

	public static CompileOptions forTesting()
	{
		return new CompileOptions(true, Collections.emptySet());
	}

	public CompileOptions withTestMode(boolean enabled)
	{
		return new CompileOptions(enabled, features);
	}

	public CompileOptions withFeatures(String... names)
	{
		Set<String> merged = new LinkedHashSet<>(features);
		merged.addAll(Arrays.asList(names));
		return new CompileOptions(testMode, merged);
	}

	public boolean isTestMode()
	{
		return testMode;
	}

	public Set<String> getFeatures()
	{
		return features;
	}

	public boolean hasFeature(String name)
	{
		return features.contains(name);
	}

	private static Set<String> parseFeatures(String value)
	{
		return Arrays.stream(value.split(","))
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	@Override
	public String toString()
	{
		return "CompileOptions{testMode=" + testMode + ", features=" + features + "}";
	}
}
