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

import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable settings for one {@code ProcedureCodingPipeline}. Thresholds are
 * business rules supplied by configuration; the defaults below mirror
 * {@code config/proclens.properties}.
 */
@Value
@Builder(toBuilder = true)
public class PipelineConfig {

	// ---- Stage switches ----
	@Builder.Default
	boolean learnedExtractorEnabled = true;
	@Builder.Default
	boolean correctivePassEnabled = true;
	@Builder.Default
	boolean secondaryPredictorEnabled = true;

	// ---- Time budgets ----
	@Builder.Default
	long learnedTimeoutMs = 5_000;
	@Builder.Default
	long predictorTimeoutMs = 5_000;
	@Builder.Default
	long correctiveTimeoutMs = 10_000;

	// ---- Corrective pass ----
	@Builder.Default
	int correctiveMaxConcurrent = 2;
	@Builder.Default
	long correctiveAcquireTimeoutMs = 250;
	/** Corrective confidence is capped strictly below this value. */
	@Builder.Default
	double correctiveConfidenceCeiling = 0.9;
	@Builder.Default
	int correctiveCacheSize = 1_000;
	@Builder.Default
	long correctiveCacheTtlMinutes = 30;

	// ---- Omission scanner ----
	@Builder.Default
	double omissionThreshold = 0.8;
	@Builder.Default
	List<String> omissionWatchList = List.of(
			"bal.performed",
			"endobronchial_biopsy.performed",
			"transbronchial_biopsy.performed",
			"linear_ebus.performed",
			"radial_ebus.performed",
			"navigational_bronchoscopy.performed",
			"cryotherapy.performed",
			"thermal_ablation.performed",
			"airway_stent_placement.performed",
			"blvr_valve_placement.performed",
			"chest_tube_insertion.performed",
			"ipc_placement.performed");

	// ---- Guardrails ----
	@Builder.Default
	int guardrailWindowChars = 80;

	// ---- Code derivation ----
	@Builder.Default
	int ebusHighTierMinStations = 3;
	@Builder.Default
	int thermoplastyHighTierMinLobes = 2;
	@Builder.Default
	int smallBoreMaxFr = 16;
	@Builder.Default
	int sedationMinMinutes = 15;
	@Builder.Default
	int sedationInitialBlockMinutes = 15;
	@Builder.Default
	int sedationAddonUnitMinutes = 15;
	@Builder.Default
	Set<String> sedationBillableRoles = Set.of("proceduralist", "attending", "physician", "operator");
	@Builder.Default
	boolean sedationRequireObserver = true;
	@Builder.Default
	String distinctSiteModifier = "XS";

	// ---- Reconciliation ----
	@Builder.Default
	double reconcileLowConfidence = 0.6;
	@Builder.Default
	double predictorMinProbability = 0.3;

	// ---- Resources ----
	@Builder.Default
	String learnedModelPath = "models/registry-ner.bin";
	@Builder.Default
	String predictorModelPath = "models/cpt-doccat.bin";
	@Builder.Default
	String labelMapResource = "models/label_map.csv";
	@Builder.Default
	String keywordGuardResource = "guard/keyword_guard.csv";
	@Builder.Default
	String codeCatalogResource = "catalog/cpt_codes.csv";

	@Builder.Default
	int workerThreads = 4;

	/** Defaults only. */
	public static PipelineConfig defaults() {
		return PipelineConfig.builder().build();
	}
}
