package org.proclens.ip.coding;

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
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.proclens.ip.RecordFixture.record;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.proclens.ip.RecordFixture;
import org.proclens.ip.conf.PipelineConfig;
import org.proclens.ip.om.Attribute;
import org.proclens.ip.om.CodeEntry;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.RegistryRecord;

class CodeDerivationEngineTest {

	private static CodeCatalog catalog;
	private static CodeDerivationEngine engine;

	@BeforeAll
	static void loadCatalog() throws Exception {
		catalog = CodeCatalog.load("catalog/cpt_codes.csv");
		engine = new CodeDerivationEngine(PipelineConfig.defaults(), catalog);
	}

	private static List<String> codes(DerivationResult r) {
		return r.getCodes().stream().map(CodeEntry::getCode).collect(Collectors.toList());
	}

	private static Optional<CodeEntry> entry(DerivationResult r, String code) {
		return r.getCodes().stream().filter(c -> c.getCode().equals(code)).findFirst();
	}

	private static RegistryRecord ebus(int stations) {
		RecordFixture f = record().performed(Procedure.LINEAR_EBUS);
		if (stations > 0) {
			List<String> list = List.of("4R", "7", "11L", "10R").subList(0, stations);
			f.set(Procedure.LINEAR_EBUS, Attribute.STATIONS, list);
		}
		return f.frozen();
	}

	// --- count tiers ---------------------------------------------------------

	@Test
	@DisplayName("Linear EBUS: 0 stations no code, 1-2 stations 31652, 3+ stations 31653")
	void linear_ebus_station_tiers() {
		DerivationResult none = engine.derive(ebus(0));
		assertTrue(none.getCodes().isEmpty());
		assertTrue(none.getWarnings().stream().anyMatch(w -> w.startsWith(PrimaryRules.LINEAR_EBUS_NO_STATIONS)));

		assertEquals(List.of("31652"), codes(engine.derive(ebus(1))));
		assertEquals(List.of("31652"), codes(engine.derive(ebus(2))));
		assertEquals(List.of("31653"), codes(engine.derive(ebus(3))));
		assertEquals(List.of("31653"), codes(engine.derive(ebus(4))));
	}

	@Test
	void ebus_high_tier_threshold_comes_from_config() {
		PipelineConfig cfg = PipelineConfig.defaults().toBuilder().ebusHighTierMinStations(4).build();
		CodeDerivationEngine strict = new CodeDerivationEngine(cfg, catalog);

		assertEquals(List.of("31652"), codes(strict.derive(ebus(3))));
		assertEquals(List.of("31653"), codes(strict.derive(ebus(4))));
	}

	@Test
	void ebus_code_cites_stations_field() {
		CodeEntry e = entry(engine.derive(ebus(3)), "31653").orElseThrow();
		assertTrue(e.getDerivedFrom().contains("linear_ebus.performed"));
		assertTrue(e.getDerivedFrom().contains("linear_ebus.stations"));
		assertFalse(e.getEvidence().isEmpty());
	}

	@Test
	void thermoplasty_lobe_tiers() {
		RegistryRecord one = record().performed(Procedure.BRONCHIAL_THERMOPLASTY)
				.sites(Procedure.BRONCHIAL_THERMOPLASTY, "RLL").frozen();
		RegistryRecord two = record().performed(Procedure.BRONCHIAL_THERMOPLASTY)
				.sites(Procedure.BRONCHIAL_THERMOPLASTY, "RLL", "LLL").frozen();

		assertEquals(List.of("31660"), codes(engine.derive(one)));
		assertEquals(List.of("31661"), codes(engine.derive(two)));
	}

	@Test
	void transbronchial_biopsy_in_three_lobes_adds_two_additional_lobe_units() {
		RegistryRecord r = record().performed(Procedure.TRANSBRONCHIAL_BIOPSY)
				.sites(Procedure.TRANSBRONCHIAL_BIOPSY, "RUL", "RML", "LUL").frozen();

		DerivationResult out = engine.derive(r);

		assertEquals(List.of("31628", "31632"), codes(out));
		assertEquals(2, entry(out, "31632").orElseThrow().getQuantity());
	}

	@Test
	@DisplayName("Central airway sites do not count as extra lobes")
	void only_lobes_count_toward_lobe_tiers() {
		RegistryRecord biopsy = record().performed(Procedure.TRANSBRONCHIAL_BIOPSY)
				.sites(Procedure.TRANSBRONCHIAL_BIOPSY, "TRACHEA", "RUL", "RMS", "BI").frozen();
		RegistryRecord thermo = record().performed(Procedure.BRONCHIAL_THERMOPLASTY)
				.sites(Procedure.BRONCHIAL_THERMOPLASTY, "RLL", "LMS", "TRACHEA").frozen();

		assertEquals(List.of("31628"), codes(engine.derive(biopsy)));
		assertEquals(List.of("31660"), codes(engine.derive(thermo)));
	}

	@Test
	void valves_in_two_lobes_add_one_additional_lobe_unit() {
		RegistryRecord r = record().performed(Procedure.BLVR_VALVE_PLACEMENT)
				.sites(Procedure.BLVR_VALVE_PLACEMENT, "LUL", "LLL")
				.set(Procedure.BLVR_VALVE_PLACEMENT, Attribute.VALVE_COUNT, 4).frozen();

		DerivationResult out = engine.derive(r);

		assertEquals(List.of("31647", "31651"), codes(out));
		assertEquals(1, entry(out, "31651").orElseThrow().getQuantity());
	}

	// --- pleural -------------------------------------------------------------

	@Test
	void thoracentesis_guidance_selects_code_and_bundles_chest_ultrasound() {
		RegistryRecord guided = record().performed(Procedure.THORACENTESIS, Procedure.CHEST_ULTRASOUND)
				.set(Procedure.THORACENTESIS, Attribute.GUIDANCE, "ULTRASOUND").frozen();
		RegistryRecord blind = record().performed(Procedure.THORACENTESIS).frozen();

		DerivationResult out = engine.derive(guided);
		assertEquals(List.of("32555"), codes(out));
		assertTrue(out.getWarnings().stream().anyMatch(w -> w.startsWith(BundlingPass.BUNDLED) && w.contains("76604")));

		assertEquals(List.of("32554"), codes(engine.derive(blind)));
	}

	@Test
	@DisplayName("Chest tube: large bore 32551, small bore 32557 with imaging, 32556 without")
	void chest_tube_size_and_guidance() {
		RegistryRecord large = record().performed(Procedure.CHEST_TUBE_INSERTION)
				.set(Procedure.CHEST_TUBE_INSERTION, Attribute.TUBE_SIZE_FR, 28).frozen();
		RegistryRecord smallGuided = record().performed(Procedure.CHEST_TUBE_INSERTION)
				.set(Procedure.CHEST_TUBE_INSERTION, Attribute.TUBE_SIZE_FR, 14)
				.set(Procedure.CHEST_TUBE_INSERTION, Attribute.GUIDANCE, "ULTRASOUND").frozen();
		RegistryRecord unknownSize = record().performed(Procedure.CHEST_TUBE_INSERTION).frozen();

		assertEquals(List.of("32551"), codes(engine.derive(large)));
		assertEquals(List.of("32557"), codes(engine.derive(smallGuided)));
		assertEquals(List.of("32556"), codes(engine.derive(unknownSize)));
	}

	@Test
	void chest_tube_removal_has_no_code() {
		RegistryRecord r = record().performed(Procedure.CHEST_TUBE_REMOVAL).frozen();
		assertTrue(engine.derive(r).getCodes().isEmpty());
	}

	// --- bundling and modifiers ----------------------------------------------

	@Test
	void dilation_at_same_site_as_ablation_is_bundled() {
		RegistryRecord r = record().performed(Procedure.THERMAL_ABLATION, Procedure.AIRWAY_DILATION)
				.sites(Procedure.THERMAL_ABLATION, "RMB")
				.sites(Procedure.AIRWAY_DILATION, "RMB").frozen();

		DerivationResult out = engine.derive(r);

		assertEquals(List.of("31641"), codes(out));
		assertTrue(out.getWarnings().stream().anyMatch(w -> w.startsWith("BUNDLED: 31630 into 31641")));
	}

	@Test
	void dilation_with_unknown_site_is_bundled() {
		RegistryRecord r = record().performed(Procedure.THERMAL_ABLATION, Procedure.AIRWAY_DILATION)
				.sites(Procedure.THERMAL_ABLATION, "RMB").frozen();

		assertEquals(List.of("31641"), codes(engine.derive(r)));
	}

	@Test
	void dilation_at_distinct_site_survives_with_modifier() {
		RegistryRecord r = record().performed(Procedure.THERMAL_ABLATION, Procedure.AIRWAY_DILATION)
				.sites(Procedure.THERMAL_ABLATION, "RMB")
				.sites(Procedure.AIRWAY_DILATION, "LMB").frozen();

		DerivationResult out = engine.derive(r);

		assertEquals(List.of("31630", "31641"), codes(out));
		assertEquals(List.of("XS"), entry(out, "31630").orElseThrow().getModifiers());
		assertTrue(entry(out, "31641").orElseThrow().getModifiers().isEmpty());
	}

	@Test
	void diagnostic_bronchoscopy_is_bundled_into_bal() {
		RegistryRecord r = record().performed(Procedure.DIAGNOSTIC_BRONCHOSCOPY, Procedure.BAL).frozen();
		assertEquals(List.of("31624"), codes(engine.derive(r)));
	}

	@Test
	void conventional_tbna_is_bundled_into_ebus_tbna() {
		for (int stations : new int[] { 2, 3 }) {
			RecordFixture f = record().performed(Procedure.LINEAR_EBUS, Procedure.TBNA_CONVENTIONAL);
			f.set(Procedure.LINEAR_EBUS, Attribute.STATIONS, List.of("4R", "7", "11L").subList(0, stations));
			String ebusCode = stations >= 3 ? "31653" : "31652";

			DerivationResult out = engine.derive(f.frozen());

			assertEquals(List.of(ebusCode), codes(out));
			assertTrue(out.getWarnings().contains(BundlingPass.BUNDLED + ": 31629 into " + ebusCode));
		}
	}

	@Test
	void tracheostomy_bundled_into_established_route() {
		RegistryRecord r = record()
				.performed(Procedure.PERCUTANEOUS_TRACHEOSTOMY, Procedure.ESTABLISHED_TRACHEOSTOMY_ROUTE).frozen();
		assertEquals(List.of("31615"), codes(engine.derive(r)));
	}

	// --- add-ons -------------------------------------------------------------

	@Test
	void add_on_without_primary_is_dropped_with_warning() {
		RegistryRecord r = record().performed(Procedure.RADIAL_EBUS).frozen();

		DerivationResult out = engine.derive(r);

		assertTrue(out.getCodes().isEmpty());
		assertTrue(out.getWarnings().contains(CodeDerivationEngine.ADDON_WITHOUT_PRIMARY + ": 31654"));
	}

	@Test
	void add_on_with_primary_is_kept() {
		RegistryRecord r = record().performed(Procedure.RADIAL_EBUS, Procedure.BAL,
				Procedure.NAVIGATIONAL_BRONCHOSCOPY).frozen();

		assertEquals(List.of("31624", "31627", "31654"), codes(engine.derive(r)));
	}

	// --- sedation ------------------------------------------------------------

	private static RecordFixture sedation(String role, boolean observer) {
		return record().performed(Procedure.MODERATE_SEDATION)
				.set(Procedure.MODERATE_SEDATION, Attribute.ADMINISTERED_BY, role)
				.set(Procedure.MODERATE_SEDATION, Attribute.OBSERVER_PRESENT, observer);
	}

	@Test
	void sedation_duration_computed_from_timestamps() {
		RegistryRecord r = sedation("proceduralist", true)
				.set(Procedure.MODERATE_SEDATION, Attribute.START_TIME, "09:00")
				.set(Procedure.MODERATE_SEDATION, Attribute.END_TIME, "09:40").frozen();

		assertEquals(Optional.of(40), SedationRules.duration(r));
		DerivationResult out = engine.derive(r);
		assertEquals(List.of("99152", "99153"), codes(out));
		assertEquals(2, entry(out, "99153").orElseThrow().getQuantity());
		assertTrue(entry(out, "99152").orElseThrow().getDerivedFrom().contains("moderate_sedation.start_time"));
	}

	@Test
	void sedation_duration_wraps_past_midnight() {
		RegistryRecord r = sedation("attending", true)
				.set(Procedure.MODERATE_SEDATION, Attribute.START_TIME, "23:50")
				.set(Procedure.MODERATE_SEDATION, Attribute.END_TIME, "00:20").frozen();

		assertEquals(Optional.of(30), SedationRules.duration(r));
		DerivationResult out = engine.derive(r);
		assertEquals(1, entry(out, "99153").orElseThrow().getQuantity());
	}

	@Test
	void short_sedation_is_not_billable() {
		RegistryRecord r = sedation("proceduralist", true)
				.set(Procedure.MODERATE_SEDATION, Attribute.DURATION_MINUTES, 10).frozen();

		DerivationResult out = engine.derive(r);

		assertTrue(out.getCodes().isEmpty());
		assertTrue(out.getWarnings().stream().anyMatch(w -> w.startsWith(SedationRules.SEDATION_NOT_BILLABLE)));
	}

	@Test
	void sedation_by_non_billable_role_or_without_observer_is_not_coded() {
		RegistryRecord nurse = sedation("nurse", true)
				.set(Procedure.MODERATE_SEDATION, Attribute.DURATION_MINUTES, 30).frozen();
		RegistryRecord noObserver = sedation("proceduralist", false)
				.set(Procedure.MODERATE_SEDATION, Attribute.DURATION_MINUTES, 30).frozen();

		assertTrue(engine.derive(nurse).getCodes().isEmpty());
		assertTrue(engine.derive(noObserver).getCodes().isEmpty());
	}

	@Test
	void sedation_at_initial_block_has_no_add_on() {
		RegistryRecord r = sedation("Proceduralist", true)
				.set(Procedure.MODERATE_SEDATION, Attribute.DURATION_MINUTES, 15).frozen();

		assertEquals(List.of("99152"), codes(engine.derive(r)));
	}

	// --- general -------------------------------------------------------------

	@Test
	void every_code_carries_evidence_and_sources() {
		RegistryRecord r = record().performed(Procedure.BAL, Procedure.ENDOBRONCHIAL_BIOPSY, Procedure.EUS_B)
				.sites(Procedure.ENDOBRONCHIAL_BIOPSY, "RUL").frozen();

		DerivationResult out = engine.derive(r);

		assertEquals(List.of("31624", "31625", "43238"), codes(out));
		for (CodeEntry e : out.getCodes()) {
			assertFalse(e.getDerivedFrom().isEmpty(), e.getCode());
			assertFalse(e.getEvidence().isEmpty(), e.getCode());
			assertFalse(e.getDescription().isEmpty(), e.getCode());
		}
	}

	@Test
	void derivation_is_repeatable() {
		RegistryRecord r = record().performed(Procedure.THERMAL_ABLATION, Procedure.AIRWAY_DILATION, Procedure.BAL)
				.sites(Procedure.THERMAL_ABLATION, "RMB")
				.sites(Procedure.AIRWAY_DILATION, "LMB").frozen();

		assertEquals(engine.derive(r).getCodes(), engine.derive(r).getCodes());
	}

	@Test
	void procedures_recorded_false_give_no_codes() {
		RegistryRecord r = record().notPerformed(Procedure.BAL).notPerformed(Procedure.AIRWAY_STENT_PLACEMENT)
				.frozen();
		assertTrue(engine.derive(r).getCodes().isEmpty());
	}
}
