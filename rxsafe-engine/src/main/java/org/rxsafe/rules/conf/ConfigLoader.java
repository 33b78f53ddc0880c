package org.rxsafe.rules.conf;

/*
 * This file is part of RxSafe.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * RxSafe is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * RxSafe is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with RxSafe.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import org.rxsafe.rules.util.DoseText;
import org.rxsafe.rules.util.Logger;

/**
 * Loads configuration for the rule engine from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/rxsafe.properties</code> from the
 * classpath. You can override this by setting the system property
 * <code>rxsafe.config</code> to an absolute path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>When <code>REFERENCE_DATA_PATH</code> is blank the reference CSV files are
 * read from the classpath directory {@value #DEFAULT_REFERENCE_RESOURCE}.</li>
 * <li>Directory-like values are normalized to end with a trailing slash.</li>
 * <li>Use {@link #validate()} during startup to check the configuration before
 * loading reference data.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/rxsafe.properties";

	/** Classpath directory holding the bundled reference data. */
	public static final String DEFAULT_REFERENCE_RESOURCE = "reference/";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "rxsafe.config";

	// ---- Property keys -------------------------------------------------------
	private static final String K_REFERENCE_DATA_PATH = "REFERENCE_DATA_PATH";
	private static final String K_INTERACTIONS_FILE = "INTERACTIONS_FILE";
	private static final String K_CONTRAINDICATIONS_FILE = "CONTRAINDICATIONS_FILE";
	private static final String K_CROSS_ALLERGIES_FILE = "CROSS_ALLERGIES_FILE";
	private static final String K_DRUG_CLASSES_FILE = "DRUG_CLASSES_FILE";

	private static final String K_DUPLICATE_THERAPY_CLASSES = "DUPLICATE_THERAPY_CLASSES";
	private static final String K_PARALLEL_EVALUATION = "PARALLEL_EVALUATION";
	private static final String K_CHECK_TIMEOUT_MS = "CHECK_TIMEOUT_MS";

	// ---- Defaults ------------------------------------------------------------
	public static final String DEFAULT_INTERACTIONS_FILE = "interactions.csv";
	public static final String DEFAULT_CONTRAINDICATIONS_FILE = "contraindications.csv";
	public static final String DEFAULT_CROSS_ALLERGIES_FILE = "cross_allergies.csv";
	public static final String DEFAULT_DRUG_CLASSES_FILE = "drug_classes.csv";
	public static final long DEFAULT_CHECK_TIMEOUT_MS = 250L;

	/** Class tags where two concurrent members are treated as duplicate therapy. */
	public static final List<String> DEFAULT_DUPLICATE_THERAPY_CLASSES = List.of("nsaid", "ssri", "ace_inhibitor",
			"arb", "statin", "ppi", "benzodiazepine", "anticoagulant", "sulfonylurea", "opioid", "beta_blocker");

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		// 1) explicit file via system property?
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			} else {
				Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
			}
		}
		// 2) fallback to classpath resource
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	/**
	 * Create a loader over already-populated properties (embedding callers and
	 * tests).
	 */
	public ConfigLoader(Properties props) {
		if (props != null) {
			properties.putAll(props);
		}
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Validates the configuration. This does not fail; it returns a list of
	 * human-readable issues so the caller can decide how to proceed.
	 *
	 * @return list of error strings; empty if the configuration looks usable
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		// Reference directory is optional, but when set it must hold all four files
		Optional<Path> dir = getReferenceDataPath();
		if (dir.isPresent()) {
			Path d = dir.get();
			if (!Files.isDirectory(d)) {
				issues.add(K_REFERENCE_DATA_PATH + " is not a directory: " + d);
			} else {
				requireReadable(d, getInteractionsFile(), K_INTERACTIONS_FILE, issues);
				requireReadable(d, getContraindicationsFile(), K_CONTRAINDICATIONS_FILE, issues);
				requireReadable(d, getCrossAllergiesFile(), K_CROSS_ALLERGIES_FILE, issues);
				requireReadable(d, getDrugClassesFile(), K_DRUG_CLASSES_FILE, issues);
			}
		}

		String timeout = getOptional(K_CHECK_TIMEOUT_MS, null);
		if (timeout != null) {
			try {
				if (Long.parseLong(timeout) <= 0) {
					issues.add("Warning: " + K_CHECK_TIMEOUT_MS + " must be positive: " + timeout + "; using "
							+ DEFAULT_CHECK_TIMEOUT_MS);
				}
			} catch (NumberFormatException nfe) {
				issues.add("Warning: " + K_CHECK_TIMEOUT_MS + " is not an integer: " + timeout + "; using "
						+ DEFAULT_CHECK_TIMEOUT_MS);
			}
		}

		String parallel = getOptional(K_PARALLEL_EVALUATION, null);
		if (parallel != null && !"true".equalsIgnoreCase(parallel) && !"false".equalsIgnoreCase(parallel)) {
			issues.add(K_PARALLEL_EVALUATION + " must be true or false: " + parallel);
		}

		if (getDuplicateTherapyClasses().isEmpty()) {
			issues.add("Warning: " + K_DUPLICATE_THERAPY_CLASSES + " is empty; duplicate therapy checks are disabled.");
		}
		return issues;
	}

	/**
	 * Directory holding the reference CSV files, or empty when the bundled
	 * classpath data should be used.
	 */
	public Optional<Path> getReferenceDataPath() {
		String raw = getOptional(K_REFERENCE_DATA_PATH, null);
		return raw == null ? Optional.empty() : Optional.of(Path.of(normalizedDir(raw)));
	}

	public String getInteractionsFile() {
		return getOptional(K_INTERACTIONS_FILE, DEFAULT_INTERACTIONS_FILE);
	}

	public String getContraindicationsFile() {
		return getOptional(K_CONTRAINDICATIONS_FILE, DEFAULT_CONTRAINDICATIONS_FILE);
	}

	public String getCrossAllergiesFile() {
		return getOptional(K_CROSS_ALLERGIES_FILE, DEFAULT_CROSS_ALLERGIES_FILE);
	}

	public String getDrugClassesFile() {
		return getOptional(K_DRUG_CLASSES_FILE, DEFAULT_DRUG_CLASSES_FILE);
	}

	/**
	 * Class tags that raise a duplicate-therapy alert when shared by two drugs.
	 * Comma separated; each entry is put in class-tag form ("ACE inhibitor"
	 * becomes "ace_inhibitor"). Defaults to
	 * {@link #DEFAULT_DUPLICATE_THERAPY_CLASSES} when unset.
	 */
	public Set<String> getDuplicateTherapyClasses() {
		String raw = getOptional(K_DUPLICATE_THERAPY_CLASSES, null);
		if (raw == null) {
			return new LinkedHashSet<>(DEFAULT_DUPLICATE_THERAPY_CLASSES);
		}
		Set<String> out = new LinkedHashSet<>();
		for (String part : raw.split(",")) {
			String t = DoseText.toIdentifier(part);
			if (!t.isEmpty()) {
				out.add(t);
			}
		}
		return out;
	}

	/** Run the four evaluators on a parallel stream. Defaults to false. */
	public boolean isParallelEvaluation() {
		return Boolean.parseBoolean(getOptional(K_PARALLEL_EVALUATION, "false"));
	}

	/**
	 * Time budget for a single prescription check. Defaults to
	 * {@value #DEFAULT_CHECK_TIMEOUT_MS} ms if unset or invalid.
	 */
	public long getCheckTimeoutMillis() {
		String raw = getOptional(K_CHECK_TIMEOUT_MS, null);
		if (raw != null) {
			try {
				long val = Long.parseLong(raw);
				if (val > 0)
					return val;
				Logger.warn("Non-positive value for {}: {}. Using default {}", K_CHECK_TIMEOUT_MS, raw,
						DEFAULT_CHECK_TIMEOUT_MS);
			} catch (NumberFormatException nfe) {
				Logger.warn("Invalid integer for {}: '{}'. Using default {}", K_CHECK_TIMEOUT_MS, raw,
						DEFAULT_CHECK_TIMEOUT_MS);
			}
		}
		return DEFAULT_CHECK_TIMEOUT_MS;
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = new FileInputStream(file.toFile())) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private String normalizedDir(String path) {
		if (path == null || path.isBlank())
			return path;
		String p = path.trim();
		if (!p.endsWith("/"))
			p = p + "/";
		return p;
	}

	private static void requireReadable(Path dir, String file, String key, List<String> issues) {
		Path p = dir.resolve(file);
		if (!Files.isReadable(p)) {
			issues.add("Missing reference file for " + key + ": " + p);
		}
	}
}
