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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

	@TempDir
	Path tmp;

	private String priorSysProp;

	@AfterEach
	void cleanupSysProp() {
		if (priorSysProp == null) {
			System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		} else {
			System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, priorSysProp);
		}
	}

	// --- helpers -------------------------------------------------------------

	private Path writePropsFile(Properties p, String filename) throws IOException {
		Path f = tmp.resolve(filename);
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return f;
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void empty_file_keeps_builtin_defaults() throws Exception {
		Path f = writePropsFile(new Properties(), "empty.properties");

		PipelineConfig c = new ConfigLoader(f).toPipelineConfig();
		PipelineConfig d = PipelineConfig.defaults();

		assertEquals(d.getOmissionThreshold(), c.getOmissionThreshold());
		assertEquals(d.getEbusHighTierMinStations(), c.getEbusHighTierMinStations());
		assertEquals(d.getSmallBoreMaxFr(), c.getSmallBoreMaxFr());
		assertEquals(d.getDistinctSiteModifier(), c.getDistinctSiteModifier());
		assertEquals(d.getOmissionWatchList(), c.getOmissionWatchList());
		assertTrue(c.isLearnedExtractorEnabled());
	}

	@Test
	void loads_thresholds_switches_and_lists_from_file() throws Exception {
		Properties p = new Properties();
		p.setProperty(ConfigLoader.K_EBUS_HIGH_TIER, "4");
		p.setProperty(ConfigLoader.K_OMISSION_THRESHOLD, "0.65");
		p.setProperty(ConfigLoader.K_CORRECTIVE_ENABLED, "false");
		p.setProperty(ConfigLoader.K_SEDATION_ROLES, " Attending , Nurse ");
		p.setProperty(ConfigLoader.K_OMISSION_WATCH_LIST, "bal.performed, radial_ebus.performed,");
		p.setProperty(ConfigLoader.K_DISTINCT_SITE_MODIFIER, "59");
		Path f = writePropsFile(p, "conf1.properties");

		PipelineConfig c = new ConfigLoader(f).toPipelineConfig();

		assertEquals(4, c.getEbusHighTierMinStations());
		assertEquals(0.65, c.getOmissionThreshold(), 1e-9);
		assertFalse(c.isCorrectivePassEnabled());
		assertEquals(Set.of("attending", "nurse"), c.getSedationBillableRoles());
		assertEquals(List.of("bal.performed", "radial_ebus.performed"), c.getOmissionWatchList());
		assertEquals("59", c.getDistinctSiteModifier());
	}

	@Test
	void malformed_values_fall_back_to_defaults() throws Exception {
		Properties p = new Properties();
		p.setProperty(ConfigLoader.K_SMALL_BORE_MAX_FR, "sixteen");
		p.setProperty(ConfigLoader.K_RECONCILE_LOW_CONFIDENCE, "low");
		p.setProperty(ConfigLoader.K_LEARNED_ENABLED, "maybe");
		Path f = writePropsFile(p, "bad.properties");

		PipelineConfig c = new ConfigLoader(f).toPipelineConfig();
		PipelineConfig d = PipelineConfig.defaults();

		assertEquals(d.getSmallBoreMaxFr(), c.getSmallBoreMaxFr());
		assertEquals(d.getReconcileLowConfidence(), c.getReconcileLowConfidence(), 1e-9);
		assertEquals(d.isLearnedExtractorEnabled(), c.isLearnedExtractorEnabled());
	}

	@Test
	void validate_reports_out_of_range_thresholds_and_unknown_fields() throws Exception {
		Properties p = new Properties();
		p.setProperty(ConfigLoader.K_OMISSION_THRESHOLD, "1.5");
		p.setProperty(ConfigLoader.K_CORRECTIVE_CEILING, "1.0");
		p.setProperty(ConfigLoader.K_EBUS_HIGH_TIER, "1");
		p.setProperty(ConfigLoader.K_OMISSION_WATCH_LIST, "bal.performed,not_a_procedure.performed");
		Path f = writePropsFile(p, "invalid.properties");

		List<String> issues = new ConfigLoader(f).validate();

		assertTrue(issues.stream().anyMatch(s -> s.startsWith(ConfigLoader.K_OMISSION_THRESHOLD)));
		assertTrue(issues.stream().anyMatch(s -> s.startsWith(ConfigLoader.K_CORRECTIVE_CEILING)));
		assertTrue(issues.stream().anyMatch(s -> s.contains("lower tier is reachable")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("not_a_procedure.performed")));
	}

	@Test
	void bundled_classpath_configuration_is_valid() {
		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);

		ConfigLoader loader = new ConfigLoader();

		assertTrue(loader.validate().isEmpty(), () -> "Unexpected issues: " + loader.validate());
		assertEquals("catalog/cpt_codes.csv", loader.toPipelineConfig().getCodeCatalogResource());
	}

	@Test
	void system_property_override_loads_external_file() throws Exception {
		Properties p = new Properties();
		p.setProperty(ConfigLoader.K_SMALL_BORE_MAX_FR, "14");
		Path f = writePropsFile(p, "override.properties");

		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, f.toAbsolutePath().toString());

		ConfigLoader loader = new ConfigLoader();

		assertEquals(14, loader.toPipelineConfig().getSmallBoreMaxFr());
	}

	@Test
	void worker_threads_capped_at_cores() throws Exception {
		Properties p = new Properties();
		p.setProperty(ConfigLoader.K_WORKER_THREADS, "9999");
		Path f = writePropsFile(p, "threads.properties");

		int threads = new ConfigLoader(f).getWorkerThreads(4);

		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		assertEquals(Math.max(2, cores), threads);
	}

	@Test
	void unreadable_file_is_rejected() {
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(tmp.resolve("missing.properties")));
	}
}
