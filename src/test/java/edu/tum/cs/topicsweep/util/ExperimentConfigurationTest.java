package edu.tum.cs.topicsweep.util;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;

import org.junit.Test;

public class ExperimentConfigurationTest {

	private static ExperimentConfiguration makeConfiguration() {
		Properties props = new Properties();
		props.setProperty("numThreads", " 4 ");
		props.setProperty("ExperimentConfigurationTest.fraction", "0.25");
		props.setProperty("ExperimentConfigurationTest.candidates", "2, 3 ,5");
		props.setProperty("tags", "PUNCT,,SYM");
		props.setProperty("broken", "four");
		return new ExperimentConfiguration(ExperimentConfigurationTest.class, props);
	}

	@Test
	public void testTypedAccess() {
		ExperimentConfiguration cfg = makeConfiguration();
		assertEquals(4, cfg.getIntProperty(ExperimentConfiguration.PROP_NUM_THREADS, 1));
		assertEquals(7L, cfg.getLongProperty("missing", 7L));
		assertEquals(0.25, cfg.getLocalDoubleProperty("fraction", null), 0.0);
		assertArrayEquals(new int[] { 2, 3, 5 }, cfg.getLocalIntListProperty("candidates"));
		assertEquals(new LinkedHashSet<String>(Arrays.asList("PUNCT", "SYM")), cfg.getStringSetProperty("tags", ""));
		assertEquals("x", cfg.getLocalProperty("missing", "x"));
	}

	@Test
	public void testErrors() {
		ExperimentConfiguration cfg = makeConfiguration();
		try {
			cfg.getProperty("missing");
			fail("missing required key accepted");
		} catch (IllegalStateException ex) {
			assertTrue(ex.getMessage().contains("missing"));
		}
		try {
			cfg.getIntProperty("broken", null);
			fail("invalid number accepted");
		} catch (IllegalStateException ex) {
			assertTrue(ex.getMessage().contains("broken"));
		}
	}

	@Test
	public void testFingerprint() {
		ExperimentConfiguration cfg1 = makeConfiguration();
		ExperimentConfiguration cfg2 = makeConfiguration();
		assertEquals(cfg1.fingerprint(), cfg2.fingerprint());
		cfg2.setProperty("ExperimentConfigurationTest.fraction", "0.3");
		assertFalse(cfg1.fingerprint().equals(cfg2.fingerprint()));
	}

	@Test
	public void testClasspathConfiguration() {
		ExperimentConfiguration cfg = new ExperimentConfiguration(ExperimentConfigurationTest.class);
		assertEquals("2,3", cfg.getProperty("TopicModelSweep.candidates"));
	}

}
