package org.proclens.ip.processing;

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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.proclens.ip.conf.PipelineConfig;
import org.proclens.ip.om.CodeEntry;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.PipelineOptions;
import org.proclens.ip.om.PipelineResult;
import org.proclens.ip.om.PipelineStatus;
import org.proclens.ip.om.PredictedCode;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.Recommendation;
import org.proclens.ip.om.RegistryField;
import org.proclens.ip.om.SkipReason;
import org.proclens.ip.processing.audit.AdjudicationResponse;
import org.proclens.ip.processing.audit.Adjudicator;
import org.proclens.ip.processing.extract.PatternExtractors;
import org.proclens.ip.processing.learned.LabelMapping;
import org.proclens.ip.processing.learned.LearnedExtractor;
import org.proclens.ip.processing.learned.PredictedSpan;
import org.proclens.ip.processing.learned.SpanPredictor;
import org.proclens.ip.processing.support.ExtractorUnavailableException;
import org.proclens.ip.reconcile.SecondaryPredictor;

class ProcedureCodingPipelineTest {

	private static final String NOTE = String.join("\n",
			"PROCEDURES PERFORMED:",
			"1. Flexible bronchoscopy",
			"2. BAL",
			"3. EBUS-TBNA",
			"",
			"CPT codes:",
			"31624 BAL",
			"31653 EBUS",
			"",
			"The bronchoscope was introduced through the mouth.",
			"BAL was performed in the right middle lobe.",
			"Linear EBUS-TBNA was performed at stations 4R, 7 and 11L.",
			"The stent was not placed given the anatomy.",
			"");

	private static LabelMapping mapping;

	@BeforeAll
	static void loadMapping() throws Exception {
		mapping = LabelMapping.load("models/label_map.csv");
	}

	// --- helpers -------------------------------------------------------------

	private static ProcedureCodingPipeline pipeline(LearnedExtractor learned, Adjudicator adjudicator,
			SecondaryPredictor predictor) {
		return new ProcedureCodingPipeline(PipelineConfig.defaults(), PatternExtractors.defaults(), learned,
				adjudicator, predictor);
	}

	private static List<String> codes(PipelineResult r) {
		return r.getCodes().stream().map(CodeEntry::getCode).collect(Collectors.toList());
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void deterministic_run_codes_what_the_narrative_supports() {
		try (ProcedureCodingPipeline p = pipeline(null, null, null)) {
			PipelineResult r = p.process(NOTE, PipelineOptions.deterministicOnly());

			assertEquals(PipelineStatus.SUCCEEDED, r.getStatus());
			assertTrue(r.getRegistry().isFrozen());
			assertTrue(r.getRegistry().isPerformed(Procedure.BAL));
			assertTrue(r.getRegistry().isPerformed(Procedure.LINEAR_EBUS));
			assertFalse(r.getRegistry().isPerformed(Procedure.AIRWAY_STENT_PLACEMENT));
			assertEquals(List.of("31624", "31653"), codes(r));
			assertFalse(r.getReconciliation().isPredictorAvailable());
			assertEquals(Recommendation.AUTO_APPROVE, r.getReconciliation().getRecommendation());
			assertTrue(r.getCorrectiveSkips().stream().anyMatch(s -> s.getReason() == SkipReason.DISABLED));
		}
	}

	@Test
	void every_value_and_code_is_backed_by_verbatim_evidence() {
		try (ProcedureCodingPipeline p = pipeline(null, null, null)) {
			PipelineResult r = p.process(NOTE, PipelineOptions.deterministicOnly());

			for (Map.Entry<String, RegistryField> e : r.getRegistry().fields().entrySet()) {
				if (Boolean.TRUE.equals(e.getValue().getValue())) {
					assertFalse(e.getValue().getEvidence().isEmpty(), e.getKey());
				}
				for (EvidenceSpan span : e.getValue().getEvidence()) {
					assertTrue(span.isVerbatimIn(NOTE), () -> e.getKey() + " cites " + span);
				}
			}
			for (CodeEntry c : r.getCodes()) {
				assertFalse(c.getEvidence().isEmpty(), c.getCode());
				assertFalse(c.getDerivedFrom().isEmpty(), c.getCode());
			}
		}
	}

	@Test
	void deterministic_runs_are_repeatable() {
		try (ProcedureCodingPipeline p = pipeline(null, null, null)) {
			PipelineResult first = p.process(NOTE, PipelineOptions.deterministicOnly());
			PipelineResult second = p.process(NOTE, PipelineOptions.deterministicOnly());

			assertEquals(first.getRegistry().fields(), second.getRegistry().fields());
			assertEquals(first.getCodes(), second.getCodes());
			assertEquals(first.getWarnings(), second.getWarnings());
		}
	}

	@Test
	void null_note_fails_without_registry() {
		try (ProcedureCodingPipeline p = pipeline(null, null, null)) {
			PipelineResult r = p.process(null, null);

			assertEquals(PipelineStatus.FAILED, r.getStatus());
			assertNull(r.getRegistry());
			assertTrue(r.getCodes().isEmpty());
			assertTrue(r.getWarnings().get(0).startsWith(ProcedureCodingPipeline.REGISTRY_CONSTRUCTION));
		}
	}

	@Test
	void unreadable_code_catalog_fails_every_request() {
		PipelineConfig config = PipelineConfig.defaults().toBuilder().codeCatalogResource("missing/catalog.csv")
				.build();
		try (ProcedureCodingPipeline p = new ProcedureCodingPipeline(config, PatternExtractors.defaults(), null, null,
				null)) {
			PipelineResult r = p.process(NOTE, PipelineOptions.all());

			assertEquals(PipelineStatus.FAILED, r.getStatus());
			assertTrue(r.getWarnings().get(0).contains("code catalog unusable"));
		}
	}

	@Test
	void learned_failure_degrades_to_pattern_output() throws Exception {
		SpanPredictor spans = mock(SpanPredictor.class);
		when(spans.predict(anyString())).thenThrow(new ExtractorUnavailableException("model not loaded"));

		try (ProcedureCodingPipeline p = pipeline(new LearnedExtractor(spans, mapping), null, null)) {
			PipelineResult r = p.process(NOTE, PipelineOptions.all());

			assertEquals(PipelineStatus.SUCCEEDED, r.getStatus());
			assertTrue(r.getWarnings().contains(ProcedureCodingPipeline.LEARNED_UNAVAILABLE + "model not loaded"));
			assertEquals(List.of("31624", "31653"), codes(r));
		}
	}

	@Test
	void unavailable_predictor_is_reported() throws Exception {
		SecondaryPredictor predictor = mock(SecondaryPredictor.class);
		when(predictor.predict(anyString())).thenThrow(new ExtractorUnavailableException("no doccat model"));

		try (ProcedureCodingPipeline p = pipeline(null, null, predictor)) {
			PipelineResult r = p.process(NOTE, PipelineOptions.all());

			assertFalse(r.getReconciliation().isPredictorAvailable());
			assertEquals(Recommendation.AUTO_APPROVE, r.getReconciliation().getRecommendation());
			assertTrue(r.getWarnings().contains(ProcedureCodingPipeline.PREDICTOR_UNAVAILABLE + "no doccat model"));
		}
	}

	@Test
	void agreeing_predictor_auto_approves() throws Exception {
		SecondaryPredictor predictor = mock(SecondaryPredictor.class);
		when(predictor.predict(anyString()))
				.thenReturn(List.of(new PredictedCode("31624", 0.9), new PredictedCode("31653", 0.8)));

		try (ProcedureCodingPipeline p = pipeline(null, null, predictor)) {
			PipelineResult r = p.process(NOTE, PipelineOptions.all());

			assertTrue(r.getReconciliation().isPredictorAvailable());
			assertEquals(Recommendation.AUTO_APPROVE, r.getReconciliation().getRecommendation());
			assertTrue(r.getReconciliation().getPredictorOnly().isEmpty());
		}
	}

	@Test
	void negated_learned_claim_is_flagged_and_sent_for_adjudication() throws Exception {
		String note = "Flexible bronchoscopy was performed.\nNo BAL was performed.\n";
		int at = note.indexOf("BAL");
		SpanPredictor spans = mock(SpanPredictor.class);
		when(spans.predict(anyString())).thenReturn(List.of(new PredictedSpan("PROC_BAL", at, at + 3, 0.95)));
		Adjudicator adjudicator = mock(Adjudicator.class);
		when(adjudicator.adjudicate(any())).thenReturn(AdjudicationResponse.none());

		try (ProcedureCodingPipeline p = pipeline(new LearnedExtractor(spans, mapping), adjudicator, null)) {
			PipelineResult r = p.process(note, PipelineOptions.all());

			assertFalse(r.getRegistry().isPerformed(Procedure.BAL));
			assertEquals(1, r.getOmissionWarnings().size());
			assertEquals("bal.performed", r.getOmissionWarnings().get(0).getFieldPath());
			assertEquals("31624", r.getOmissionWarnings().get(0).getCodeHint());
			assertFalse(r.isCorrected());
			assertTrue(r.getCorrectiveSkips().stream().anyMatch(s -> s.getReason() == SkipReason.NO_CHANGE));
			verify(adjudicator, times(1)).adjudicate(any());
		}
	}
}
