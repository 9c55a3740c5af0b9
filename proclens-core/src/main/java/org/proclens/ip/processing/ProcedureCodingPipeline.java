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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.proclens.ip.coding.CodeCatalog;
import org.proclens.ip.coding.CodeDerivationEngine;
import org.proclens.ip.coding.DerivationResult;
import org.proclens.ip.conf.PipelineConfig;
import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.OmissionWarning;
import org.proclens.ip.om.PipelineOptions;
import org.proclens.ip.om.PipelineResult;
import org.proclens.ip.om.PipelineStatus;
import org.proclens.ip.om.PredictedCode;
import org.proclens.ip.om.ReconciliationResult;
import org.proclens.ip.om.RegistryRecord;
import org.proclens.ip.processing.audit.Adjudicator;
import org.proclens.ip.processing.audit.CorrectionOutcome;
import org.proclens.ip.processing.audit.CorrectivePass;
import org.proclens.ip.processing.audit.KeywordGuard;
import org.proclens.ip.processing.audit.OmissionScanner;
import org.proclens.ip.processing.extract.CandidateExtractor;
import org.proclens.ip.processing.extract.MenuBlockMasker;
import org.proclens.ip.processing.extract.PatternExtractors;
import org.proclens.ip.processing.guard.GuardrailFilter;
import org.proclens.ip.processing.guard.GuardrailOutcome;
import org.proclens.ip.processing.learned.LabelMapping;
import org.proclens.ip.processing.learned.LearnedExtraction;
import org.proclens.ip.processing.learned.LearnedExtractor;
import org.proclens.ip.processing.learned.OpenNlpSpanPredictor;
import org.proclens.ip.processing.merge.AssemblyResult;
import org.proclens.ip.processing.merge.RegistryAssembler;
import org.proclens.ip.processing.support.ExtractorUnavailableException;
import org.proclens.ip.processing.support.RegistryConstructionException;
import org.proclens.ip.processing.uplift.UpliftBackstops;
import org.proclens.ip.processing.uplift.UpliftOutcome;
import org.proclens.ip.reconcile.DoccatCodePredictor;
import org.proclens.ip.reconcile.Reconciler;
import org.proclens.ip.reconcile.SecondaryPredictor;
import org.proclens.ip.util.Logger;

/**
 * Turns one procedure note into a registry record, billing codes and a
 * reconciliation verdict.
 *
 * <p>Stages, in order: menu masking, pattern extraction (with the learned
 * extractor running alongside on the worker pool), evidence check against the
 * original note, guardrails, uplift backstops, assembly, omission scan,
 * corrective pass, freeze, code derivation and reconciliation with the
 * secondary predictor, which also runs on the worker pool from the start.</p>
 *
 * <p>The pipeline is safe to share between threads. Each call owns its record;
 * the corrective cache and permit gate are the only state shared between
 * calls.</p>
 */
public class ProcedureCodingPipeline implements AutoCloseable {

	public static final String LEARNED_UNAVAILABLE = "LEARNED_EXTRACTOR_UNAVAILABLE: ";
	public static final String PREDICTOR_UNAVAILABLE = "SECONDARY_PREDICTOR_UNAVAILABLE: ";
	public static final String EXTRACTOR_FAILED = "EXTRACTOR_FAILED: ";
	public static final String EVIDENCE_NOT_VERBATIM = "EVIDENCE_NOT_VERBATIM: ";
	public static final String REGISTRY_CONSTRUCTION = "REGISTRY_CONSTRUCTION: ";

	private final PipelineConfig config;
	private final List<CandidateExtractor> extractors;
	private final LearnedExtractor learned;
	private final SecondaryPredictor predictor;

	private final GuardrailFilter guardrails;
	private final UpliftBackstops uplift;
	private final RegistryAssembler assembler;
	private final OmissionScanner omissionScanner;
	private final CorrectivePass correctivePass;
	private final CodeDerivationEngine derivationEngine;
	private final Reconciler reconciler;

	private final ExecutorService exec;

	/** Set when a resource the pipeline cannot run without failed to load. */
	private final String resourceFailure;

	/**
	 * Loads the keyword guard and code catalog named in {@code config}. A
	 * resource that cannot be read does not fail construction; every request
	 * then returns a FAILED result naming it.
	 *
	 * @param learned     may be null
	 * @param adjudicator may be null, which disables the corrective pass
	 * @param predictor   may be null
	 */
	public ProcedureCodingPipeline(PipelineConfig config, List<CandidateExtractor> extractors,
			LearnedExtractor learned, Adjudicator adjudicator, SecondaryPredictor predictor) {
		this(config, extractors, learned, adjudicator, predictor, Resources.load(config));
	}

	public ProcedureCodingPipeline(PipelineConfig config, List<CandidateExtractor> extractors,
			LearnedExtractor learned, Adjudicator adjudicator, SecondaryPredictor predictor,
			KeywordGuard keywordGuard, CodeCatalog catalog) {
		this(config, extractors, learned, adjudicator, predictor, new Resources(keywordGuard, catalog, null));
	}

	private ProcedureCodingPipeline(PipelineConfig config, List<CandidateExtractor> extractors,
			LearnedExtractor learned, Adjudicator adjudicator, SecondaryPredictor predictor, Resources resources) {
		this.config = config;
		this.extractors = List.copyOf(extractors);
		this.learned = learned;
		this.predictor = predictor;
		this.resourceFailure = resources.failure;

		// ----- Worker pool -----
		final int poolSize = Math.max(2, config.getWorkerThreads());
		this.exec = Executors.newFixedThreadPool(poolSize, r -> {
			Thread t = new Thread(r, "proclens-worker");
			t.setDaemon(true);
			return t;
		});

		this.guardrails = GuardrailFilter.withDefaultRules(config.getGuardrailWindowChars());
		this.uplift = UpliftBackstops.defaults();
		this.assembler = new RegistryAssembler();
		this.omissionScanner = new OmissionScanner(config.getOmissionWatchList(), config.getOmissionThreshold());
		KeywordGuard guard = resources.keywordGuard == null ? new KeywordGuard(Map.of())
				: resources.keywordGuard;
		this.correctivePass = new CorrectivePass(config, adjudicator, guard);
		this.derivationEngine = resources.catalog == null ? null
				: new CodeDerivationEngine(config, resources.catalog);
		this.reconciler = new Reconciler(config.getReconcileLowConfidence());
	}

	/**
	 * Builds a pipeline with the default pattern extractors and the OpenNLP
	 * models named in {@code config}. A missing label map only disables the
	 * learned extractor.
	 */
	public static ProcedureCodingPipeline withDefaults(PipelineConfig config, Adjudicator adjudicator) {
		LearnedExtractor learned = null;
		try {
			LabelMapping mapping = LabelMapping.load(config.getLabelMapResource());
			learned = new LearnedExtractor(new OpenNlpSpanPredictor(config.getLearnedModelPath()), mapping);
		} catch (IOException e) {
			Logger.warn("Learned extractor disabled, label map unreadable: {}", e.getMessage());
		}
		SecondaryPredictor predictor = new DoccatCodePredictor(config.getPredictorModelPath(),
				config.getPredictorMinProbability());
		return new ProcedureCodingPipeline(config, PatternExtractors.defaults(), learned, adjudicator, predictor);
	}

	public PipelineConfig getConfig() {
		return config;
	}

	/**
	 * Processes one note. Never throws for bad input: a null note or unusable
	 * resources give a FAILED result, and every other problem is reported as a
	 * warning on a SUCCEEDED result.
	 */
	public PipelineResult process(String noteText, PipelineOptions options) {
		try {
			return run(noteText, options == null ? PipelineOptions.all() : options);
		} catch (RegistryConstructionException e) {
			Logger.error("Registry construction failed: {}", e.getMessage());
			return PipelineResult.failed(REGISTRY_CONSTRUCTION + e.getMessage());
		}
	}

	private PipelineResult run(String note, PipelineOptions options) {
		if (note == null) {
			throw new RegistryConstructionException("note text is null");
		}
		if (resourceFailure != null) {
			throw new RegistryConstructionException(resourceFailure);
		}

		final boolean learnedOn = learned != null && config.isLearnedExtractorEnabled()
				&& options.isEnableLearnedExtractor();
		final boolean predictorOn = predictor != null && config.isSecondaryPredictorEnabled()
				&& options.isEnableSecondaryPredictor();
		final boolean correctiveOn = config.isCorrectivePassEnabled() && options.isEnableCorrectivePass();

		List<String> warnings = new ArrayList<>();
		final String masked = MenuBlockMasker.mask(note);

		// ----- Submit model work -----
		Future<LearnedExtraction> learnedTask = learnedOn ? exec.submit(() -> learned.extract(masked)) : null;
		Future<List<PredictedCode>> predictorTask = predictorOn ? exec.submit(() -> predictor.predict(note)) : null;

		// ----- Pattern extraction -----
		List<CandidateDetection> candidates = new ArrayList<>();
		for (CandidateExtractor extractor : extractors) {
			try {
				candidates.addAll(extractor.detect(masked));
			} catch (RuntimeException e) {
				Logger.warn("Extractor {} failed: {}", extractor.id(), e.getMessage());
				warnings.add(EXTRACTOR_FAILED + extractor.id() + ": " + e.getMessage());
			}
		}

		LearnedExtraction learnedOut = awaitLearned(learnedTask, warnings);
		candidates.addAll(learnedOut.getCandidates());

		List<CandidateDetection> grounded = keepVerbatim(candidates, note, warnings);

		// ----- Filter, backstop, assemble -----
		GuardrailOutcome guarded = guardrails.apply(grounded, masked);
		if (!guarded.getEvents().isEmpty()) {
			Logger.debug("Guardrails acted on {} of {} candidates", guarded.getEvents().size(), grounded.size());
		}
		List<CandidateDetection> surviving = new ArrayList<>(guarded.getCandidates());
		UpliftOutcome uplifted = uplift.apply(masked, surviving);
		surviving.addAll(uplifted.getAdded());
		warnings.addAll(uplifted.getWarnings());

		AssemblyResult assembly = assembler.assemble(surviving, masked);
		warnings.addAll(assembly.getWarnings());
		RegistryRecord record = assembly.getRecord();

		// ----- Audit -----
		List<OmissionWarning> omissions = omissionScanner.scan(record, learnedOut.getRawConfidences());
		CorrectionOutcome correction = correctivePass.run(record, omissions, note, masked, correctiveOn);
		warnings.addAll(correction.getWarnings());

		record.freeze();

		// ----- Codes -----
		DerivationResult derivation = derivationEngine.derive(record);
		warnings.addAll(derivation.getWarnings());

		List<PredictedCode> predicted = awaitPredictor(predictorTask, warnings);
		ReconciliationResult reconciliation = reconciler.reconcile(derivation.getCodes(),
				predicted == null ? List.of() : predicted, predicted != null);

		return PipelineResult.builder()
				.status(PipelineStatus.SUCCEEDED)
				.registry(record)
				.codes(derivation.getCodes())
				.reconciliation(reconciliation)
				.omissionWarnings(omissions)
				.corrected(correction.isCorrected())
				.warnings(warnings)
				.correctiveSkips(correction.getSkips())
				.build();
	}

	/** Drops candidates whose evidence is missing or does not match the note text at its offsets. */
	private static List<CandidateDetection> keepVerbatim(List<CandidateDetection> candidates, String note,
			List<String> warnings) {
		List<CandidateDetection> out = new ArrayList<>(candidates.size());
		for (CandidateDetection c : candidates) {
			boolean ok = !c.getEvidence().isEmpty();
			for (EvidenceSpan e : c.getEvidence()) {
				if (!e.isVerbatimIn(note)) {
					ok = false;
					break;
				}
			}
			if (ok) {
				out.add(c);
			} else {
				Logger.debug("Dropping {} from {}: evidence not in note", c.getFieldPath(), c.getExtractorId());
				warnings.add(EVIDENCE_NOT_VERBATIM + c.getFieldPath() + " from " + c.getExtractorId());
			}
		}
		return out;
	}

	private LearnedExtraction awaitLearned(Future<LearnedExtraction> task, List<String> warnings) {
		if (task == null) {
			return LearnedExtraction.empty();
		}
		try {
			return task.get(config.getLearnedTimeoutMs(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			task.cancel(true);
			warnings.add(LEARNED_UNAVAILABLE + "timed out after " + config.getLearnedTimeoutMs() + " ms");
		} catch (ExecutionException e) {
			warnings.add(LEARNED_UNAVAILABLE + describe(e.getCause()));
		} catch (InterruptedException e) {
			task.cancel(true);
			Thread.currentThread().interrupt();
			warnings.add(LEARNED_UNAVAILABLE + "interrupted");
		}
		Logger.warn("Learned extractor unavailable, continuing with pattern output");
		return LearnedExtraction.empty();
	}

	/** @return predicted codes, or null when the predictor did not answer */
	private List<PredictedCode> awaitPredictor(Future<List<PredictedCode>> task, List<String> warnings) {
		if (task == null) {
			return null;
		}
		try {
			List<PredictedCode> codes = task.get(config.getPredictorTimeoutMs(), TimeUnit.MILLISECONDS);
			if (codes != null) {
				return codes;
			}
			warnings.add(PREDICTOR_UNAVAILABLE + "no prediction returned");
		} catch (TimeoutException e) {
			task.cancel(true);
			warnings.add(PREDICTOR_UNAVAILABLE + "timed out after " + config.getPredictorTimeoutMs() + " ms");
		} catch (ExecutionException e) {
			warnings.add(PREDICTOR_UNAVAILABLE + describe(e.getCause()));
		} catch (InterruptedException e) {
			task.cancel(true);
			Thread.currentThread().interrupt();
			warnings.add(PREDICTOR_UNAVAILABLE + "interrupted");
		}
		return null;
	}

	private static String describe(Throwable cause) {
		if (cause instanceof ExtractorUnavailableException) {
			return cause.getMessage();
		}
		return cause == null ? "unknown failure" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
	}

	@Override
	public void close() {
		exec.shutdownNow();
		correctivePass.close();
	}

	/** Resources loaded from configuration, or the reason they could not be. */
	private static final class Resources {
		final KeywordGuard keywordGuard;
		final CodeCatalog catalog;
		final String failure;

		Resources(KeywordGuard keywordGuard, CodeCatalog catalog, String failure) {
			this.keywordGuard = keywordGuard;
			this.catalog = catalog;
			this.failure = catalog == null && failure == null ? "no code catalog supplied" : failure;
		}

		static Resources load(PipelineConfig config) {
			KeywordGuard guard = null;
			CodeCatalog catalog = null;
			String failure = null;
			try {
				guard = KeywordGuard.load(config.getKeywordGuardResource());
			} catch (IOException e) {
				Logger.error("Keyword guard {} unusable: {}", config.getKeywordGuardResource(), e.getMessage());
				failure = "keyword guard unusable: " + e.getMessage();
			}
			try {
				catalog = CodeCatalog.load(config.getCodeCatalogResource());
			} catch (IOException e) {
				Logger.error("Code catalog {} unusable: {}", config.getCodeCatalogResource(), e.getMessage());
				failure = "code catalog unusable: " + e.getMessage();
			}
			return new Resources(guard, catalog, failure);
		}
	}
}
