package org.proclens.ip.conf;

/*
 * This file is part of ProcLens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * ProcLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ProcLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ProcLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.proclens.ip.om.RegistrySchema;
import org.proclens.ip.util.Logger;

/**
 * Loads pipeline settings from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/proclens.properties</code> from
 * the classpath. You can override this by setting the system property
 * <code>proclens.config</code> to a file path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Every key is optional; a missing or malformed value falls back to the
 * {@link PipelineConfig} default (malformed values are logged).</li>
 * <li>Use {@link #validate()} during startup to check ranges and the
 * omission watch list.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/proclens.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "proclens.config";

	// ---- Property keys --------------------------------------------------------
	static final String K_LEARNED_ENABLED = "LEARNED_EXTRACTOR_ENABLED";
	static final String K_CORRECTIVE_ENABLED = "CORRECTIVE_PASS_ENABLED";
	static final String K_PREDICTOR_ENABLED = "SECONDARY_PREDICTOR_ENABLED";

	static final String K_LEARNED_TIMEOUT_MS = "LEARNED_TIMEOUT_MS";
	static final String K_PREDICTOR_TIMEOUT_MS = "PREDICTOR_TIMEOUT_MS";
	static final String K_CORRECTIVE_TIMEOUT_MS = "CORRECTIVE_TIMEOUT_MS";

	static final String K_CORRECTIVE_MAX_CONCURRENT = "CORRECTIVE_MAX_CONCURRENT";
	static final String K_CORRECTIVE_ACQUIRE_MS = "CORRECTIVE_ACQUIRE_TIMEOUT_MS";
	static final String K_CORRECTIVE_CEILING = "CORRECTIVE_CONFIDENCE_CEILING";
	static final String K_CORRECTIVE_CACHE_SIZE = "CORRECTIVE_CACHE_SIZE";
	static final String K_CORRECTIVE_CACHE_TTL = "CORRECTIVE_CACHE_TTL_MINUTES";

	static final String K_OMISSION_THRESHOLD = "OMISSION_THRESHOLD";
	static final String K_OMISSION_WATCH_LIST = "OMISSION_WATCH_LIST";

	static final String K_GUARDRAIL_WINDOW = "GUARDRAIL_WINDOW_CHARS";

	static final String K_EBUS_HIGH_TIER = "EBUS_HIGH_TIER_MIN_STATIONS";
	static final String K_THERMOPLASTY_HIGH_TIER = "THERMOPLASTY_HIGH_TIER_MIN_LOBES";
	static final String K_SMALL_BORE_MAX_FR = "SMALL_BORE_MAX_FR";
	static final String K_SEDATION_MIN = "SEDATION_MIN_MINUTES";
	static final String K_SEDATION_INITIAL = "SEDATION_INITIAL_BLOCK_MINUTES";
	static final String K_SEDATION_UNIT = "SEDATION_ADDON_UNIT_MINUTES";
	static final String K_SEDATION_ROLES = "SEDATION_BILLABLE_ROLES";
	static final String K_SEDATION_OBSERVER = "SEDATION_REQUIRE_OBSERVER";
	static final String K_DISTINCT_SITE_MODIFIER = "DISTINCT_SITE_MODIFIER";

	static final String K_RECONCILE_LOW_CONFIDENCE = "RECONCILE_LOW_CONFIDENCE";
	static final String K_PREDICTOR_MIN_PROBABILITY = "PREDICTOR_MIN_PROBABILITY";

	static final String K_LEARNED_MODEL = "LEARNED_MODEL_PATH";
	static final String K_PREDICTOR_MODEL = "PREDICTOR_MODEL_PATH";
	static final String K_LABEL_MAP = "LABEL_MAP_RESOURCE";
	static final String K_KEYWORD_GUARD = "KEYWORD_GUARD_RESOURCE";
	static final String K_CODE_CATALOG = "CODE_CATALOG_RESOURCE";

	static final String K_WORKER_THREADS = "WORKER_THREADS";

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (StringUtils.isNotBlank(external)) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
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

	// -------------------------- Public API -------------------------------------

	/**
	 * Checks ranges and cross-field constraints. Does not fail; returns a list
	 * of human-readable issues so the caller can decide how to proceed.
	 *
	 * @return list of issues; empty if the configuration looks usable
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();
		PipelineConfig c = toPipelineConfig();

		requireUnitInterval(K_OMISSION_THRESHOLD, c.getOmissionThreshold(), issues);
		requireUnitInterval(K_RECONCILE_LOW_CONFIDENCE, c.getReconcileLowConfidence(), issues);
		requireUnitInterval(K_PREDICTOR_MIN_PROBABILITY, c.getPredictorMinProbability(), issues);
		if (c.getCorrectiveConfidenceCeiling() <= 0.0 || c.getCorrectiveConfidenceCeiling() >= 1.0) {
			issues.add(K_CORRECTIVE_CEILING + " must be strictly between 0 and 1 (corrective values are never certain).");
		}

		requirePositive(K_LEARNED_TIMEOUT_MS, c.getLearnedTimeoutMs(), issues);
		requirePositive(K_PREDICTOR_TIMEOUT_MS, c.getPredictorTimeoutMs(), issues);
		requirePositive(K_CORRECTIVE_TIMEOUT_MS, c.getCorrectiveTimeoutMs(), issues);
		requirePositive(K_CORRECTIVE_MAX_CONCURRENT, c.getCorrectiveMaxConcurrent(), issues);
		requirePositive(K_EBUS_HIGH_TIER, c.getEbusHighTierMinStations(), issues);
		requirePositive(K_SEDATION_UNIT, c.getSedationAddonUnitMinutes(), issues);

		if (c.getEbusHighTierMinStations() < 2) {
			issues.add(K_EBUS_HIGH_TIER + " must be at least 2 so the lower tier is reachable.");
		}
		for (String path : c.getOmissionWatchList()) {
			if (!RegistrySchema.isKnown(path)) {
				issues.add(K_OMISSION_WATCH_LIST + " names an unknown registry field: " + path);
			}
		}
		if (c.getSedationBillableRoles().isEmpty()) {
			issues.add("Warning: " + K_SEDATION_ROLES + " is empty; moderate sedation will never be coded.");
		}
		return issues;
	}

	/**
	 * Build the immutable pipeline settings; absent keys keep the defaults of
	 * {@link PipelineConfig}.
	 */
	public PipelineConfig toPipelineConfig() {
		PipelineConfig d = PipelineConfig.defaults();
		return PipelineConfig.builder()
				.learnedExtractorEnabled(getBoolean(K_LEARNED_ENABLED, d.isLearnedExtractorEnabled()))
				.correctivePassEnabled(getBoolean(K_CORRECTIVE_ENABLED, d.isCorrectivePassEnabled()))
				.secondaryPredictorEnabled(getBoolean(K_PREDICTOR_ENABLED, d.isSecondaryPredictorEnabled()))
				.learnedTimeoutMs(getLong(K_LEARNED_TIMEOUT_MS, d.getLearnedTimeoutMs()))
				.predictorTimeoutMs(getLong(K_PREDICTOR_TIMEOUT_MS, d.getPredictorTimeoutMs()))
				.correctiveTimeoutMs(getLong(K_CORRECTIVE_TIMEOUT_MS, d.getCorrectiveTimeoutMs()))
				.correctiveMaxConcurrent(getInt(K_CORRECTIVE_MAX_CONCURRENT, d.getCorrectiveMaxConcurrent()))
				.correctiveAcquireTimeoutMs(getLong(K_CORRECTIVE_ACQUIRE_MS, d.getCorrectiveAcquireTimeoutMs()))
				.correctiveConfidenceCeiling(getDouble(K_CORRECTIVE_CEILING, d.getCorrectiveConfidenceCeiling()))
				.correctiveCacheSize(getInt(K_CORRECTIVE_CACHE_SIZE, d.getCorrectiveCacheSize()))
				.correctiveCacheTtlMinutes(getLong(K_CORRECTIVE_CACHE_TTL, d.getCorrectiveCacheTtlMinutes()))
				.omissionThreshold(getDouble(K_OMISSION_THRESHOLD, d.getOmissionThreshold()))
				.omissionWatchList(getList(K_OMISSION_WATCH_LIST, d.getOmissionWatchList()))
				.guardrailWindowChars(getInt(K_GUARDRAIL_WINDOW, d.getGuardrailWindowChars()))
				.ebusHighTierMinStations(getInt(K_EBUS_HIGH_TIER, d.getEbusHighTierMinStations()))
				.thermoplastyHighTierMinLobes(getInt(K_THERMOPLASTY_HIGH_TIER, d.getThermoplastyHighTierMinLobes()))
				.smallBoreMaxFr(getInt(K_SMALL_BORE_MAX_FR, d.getSmallBoreMaxFr()))
				.sedationMinMinutes(getInt(K_SEDATION_MIN, d.getSedationMinMinutes()))
				.sedationInitialBlockMinutes(getInt(K_SEDATION_INITIAL, d.getSedationInitialBlockMinutes()))
				.sedationAddonUnitMinutes(getInt(K_SEDATION_UNIT, d.getSedationAddonUnitMinutes()))
				.sedationBillableRoles(getLowercaseSet(K_SEDATION_ROLES, d.getSedationBillableRoles()))
				.sedationRequireObserver(getBoolean(K_SEDATION_OBSERVER, d.isSedationRequireObserver()))
				.distinctSiteModifier(getOptional(K_DISTINCT_SITE_MODIFIER, d.getDistinctSiteModifier()))
				.reconcileLowConfidence(getDouble(K_RECONCILE_LOW_CONFIDENCE, d.getReconcileLowConfidence()))
				.predictorMinProbability(getDouble(K_PREDICTOR_MIN_PROBABILITY, d.getPredictorMinProbability()))
				.learnedModelPath(getOptional(K_LEARNED_MODEL, d.getLearnedModelPath()))
				.predictorModelPath(getOptional(K_PREDICTOR_MODEL, d.getPredictorModelPath()))
				.labelMapResource(getOptional(K_LABEL_MAP, d.getLabelMapResource()))
				.keywordGuardResource(getOptional(K_KEYWORD_GUARD, d.getKeywordGuardResource()))
				.codeCatalogResource(getOptional(K_CODE_CATALOG, d.getCodeCatalogResource()))
				.workerThreads(getWorkerThreads(d.getWorkerThreads()))
				.build();
	}

	/**
	 * Worker pool size for concurrent extraction. Never exceeds the core count.
	 */
	public int getWorkerThreads(int defaultThreads) {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int val = getInt(K_WORKER_THREADS, defaultThreads);
		if (val <= 0) {
			return Math.min(defaultThreads, cores);
		}
		return Math.max(2, Math.min(val, cores));
	}

	/** Raw value lookup, mainly for diagnostics. */
	public String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
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

	private int getInt(String key, int defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			return Integer.parseInt(raw);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private long getLong(String key, long defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			return Long.parseLong(raw);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private double getDouble(String key, double defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			return Double.parseDouble(raw);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid number for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private boolean getBoolean(String key, boolean defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		if ("true".equalsIgnoreCase(raw) || "false".equalsIgnoreCase(raw)) {
			return Boolean.parseBoolean(raw);
		}
		Logger.warn("Invalid boolean for {}: '{}'. Using default {}", key, raw, defaultVal);
		return defaultVal;
	}

	private List<String> getList(String key, List<String> defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		return Arrays.stream(raw.split(","))
				.map(String::trim)
				.filter(StringUtils::isNotEmpty)
				.collect(Collectors.toUnmodifiableList());
	}

	private Set<String> getLowercaseSet(String key, Set<String> defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		Set<String> out = new LinkedHashSet<>();
		for (String s : getList(key, List.of())) {
			out.add(s.toLowerCase(Locale.ROOT));
		}
		return Set.copyOf(out);
	}

	private static void requireUnitInterval(String key, double v, List<String> issues) {
		if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
			issues.add(key + " must be within [0,1]: " + v);
		}
	}

	private static void requirePositive(String key, long v, List<String> issues) {
		if (v <= 0) {
			issues.add(key + " must be positive: " + v);
		}
	}
}
