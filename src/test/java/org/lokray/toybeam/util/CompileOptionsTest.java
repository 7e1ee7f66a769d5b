package org.lokray.toybeam.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CompileOptionsTest
{
	@Test
	void defaults()
	{
		CompileOptions options = CompileOptions.defaults();
		assertFalse(options.isTestMode());
		assertTrue(options.getFeatures().isEmpty());
		assertEquals("CompileOptions{testMode=false, features=[]}", options.toString());
	}

	@Test
	void readsProperties()
	{
		Properties props = new Properties();
		props.setProperty(CompileOptions.TEST_MODE_KEY, " true ");
		props.setProperty(CompileOptions.FEATURES_KEY, "net, tls,, ");

		CompileOptions options = new CompileOptions(props);
		assertTrue(options.isTestMode());
		assertEquals(List.of("net", "tls"), List.copyOf(options.getFeatures()));
	}

	@Test
	void missingPropertiesFallBackToDefaults()
	{
		CompileOptions options = new CompileOptions(new Properties());
		assertFalse(options.isTestMode());
		assertTrue(options.getFeatures().isEmpty());
	}

	@Test
	void withMethodsReturnCopies()
	{
		CompileOptions base = CompileOptions.defaults();
		CompileOptions changed = base.withTestMode(true).withFeatures("a").withFeatures("b", "a");

		assertFalse(base.isTestMode());
		assertFalse(base.hasFeature("a"));
		assertTrue(changed.isTestMode());
		assertEquals(Set.of("a", "b"), changed.getFeatures());
		assertTrue(changed.hasFeature("b"));
	}

	@Test
	void featuresAreUnmodifiable()
	{
		assertThrows(UnsupportedOperationException.class, () -> CompileOptions.forTesting().getFeatures().add("x"));
	}
}
