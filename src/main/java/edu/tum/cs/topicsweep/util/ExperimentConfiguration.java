package edu.tum.cs.topicsweep.util;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

public class ExperimentConfiguration extends Properties {

	private static final long serialVersionUID = -3504616731915932816L;
	private static final String listSeparator = ",";

	public static final String PROP_CONFIG_FILE = "edu.tum.cs.topicsweep.config";

	// well-known global properties
	public static final String PROP_NUM_THREADS = "numThreads";
	public static final String PROP_DATA_PATH = "dataPath";
	public static final String PROP_OUTPUT_PATH = "outputPath";
	public static final String PROP_SEED = "seed";

	private final String root;

	public ExperimentConfiguration(Class<?> cls) {
		String configFileName = System.getProperty(PROP_CONFIG_FILE);
		try {
			InputStream is;
			if (configFileName != null)
				is = new FileInputStream(configFileName);
			else
				is = ExperimentConfiguration.class.getResourceAsStream("/experiment.properties");
			if (is == null)
				throw new IllegalStateException("no configuration file given and /experiment.properties not found");
			Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
			try {
				load(reader);
			} finally {
				reader.close();
			}
		} catch (IOException ex) {
			throw new RuntimeException("error reading configuration", ex);
		}
		root = cls.getSimpleName();
	}

	/** configuration backed by explicit values, mainly for tests */
	public ExperimentConfiguration(Class<?> cls, Properties values) {
		putAll(values);
		root = cls.getSimpleName();
	}

	private String makeLocal(String key) {
		return root + "." + key;
	}

	public String getProperty(String key, String defaultValue) {
		String value = super.getProperty(key);
		if (value == null) {
			value = defaultValue;
			if (value == null)
				throw new IllegalStateException("required property '" + key + "' not specified");
		}
		return value.trim();
	}

	public String getProperty(String key) {
		return getProperty(key, null);
	}

	public String getLocalProperty(String key, String defaultValue) {
		return getProperty(makeLocal(key), defaultValue);
	}

	public String getLocalProperty(String key) {
		return getLocalProperty(key, null);
	}

	public int getIntProperty(String key, Integer defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.toString() : null);
		try {
			return Integer.parseInt(rawValue);
		} catch (NumberFormatException ex) {
			throw new IllegalStateException("invalid integer '" + rawValue + "' for key '" + key + "'", ex);
		}
	}

	public int getLocalIntProperty(String key, Integer defaultValue) {
		return getIntProperty(makeLocal(key), defaultValue);
	}

	public long getLongProperty(String key, Long defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.toString() : null);
		try {
			return Long.parseLong(rawValue);
		} catch (NumberFormatException ex) {
			throw new IllegalStateException("invalid integer '" + rawValue + "' for key '" + key + "'", ex);
		}
	}

	public long getLocalLongProperty(String key, Long defaultValue) {
		return getLongProperty(makeLocal(key), defaultValue);
	}

	public double getDoubleProperty(String key, Double defaultValue) {
		String rawValue = getProperty(key, (defaultValue != null) ? defaultValue.toString() : null);
		try {
			return Double.parseDouble(rawValue);
		} catch (NumberFormatException ex) {
			throw new IllegalStateException("invalid number '" + rawValue + "' for key '" + key + "'", ex);
		}
	}

	public double getLocalDoubleProperty(String key, Double defaultValue) {
		return getDoubleProperty(makeLocal(key), defaultValue);
	}

	public int[] getIntListProperty(String key) {
		String rawValue = getProperty(key, null);
		String[] parts = rawValue.split(listSeparator);
		int[] values = new int[parts.length];
		for (int i = 0; i < parts.length; i++) {
			try {
				values[i] = Integer.parseInt(parts[i].trim());
			} catch (NumberFormatException ex) {
				throw new IllegalStateException("invalid list element '" + parts[i] + "' for key '" + key + "'", ex);
			}
		}
		return values;
	}

	public int[] getLocalIntListProperty(String key) {
		return getIntListProperty(makeLocal(key));
	}

	public Set<String> getStringSetProperty(String key, String defaultValue) {
		Set<String> values = new LinkedHashSet<String>();
		for (String part : getProperty(key, defaultValue).split(listSeparator)) {
			part = part.trim();
			if (part.length() > 0)
				values.add(part);
		}
		return values;
	}

	public Set<String> getLocalStringSetProperty(String key, String defaultValue) {
		return getStringSetProperty(makeLocal(key), defaultValue);
	}

	/**
	 * Hash over all key/value pairs in key order. Two configurations with the same fingerprint produce the same
	 * derived artifacts from the same inputs.
	 */
	public String fingerprint() {
		Hasher hasher = Hashing.sha256().newHasher();
		for (String key : new TreeSet<String>(stringPropertyNames())) {
			hasher.putString(key, StandardCharsets.UTF_8);
			hasher.putChar('=');
			hasher.putString(super.getProperty(key), StandardCharsets.UTF_8);
			hasher.putChar('\n');
		}
		return hasher.hash().toString();
	}

}
