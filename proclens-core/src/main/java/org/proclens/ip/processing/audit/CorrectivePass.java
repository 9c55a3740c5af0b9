package org.proclens.ip.processing.audit;

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

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.proclens.ip.conf.PipelineConfig;
import org.proclens.ip.om.Attribute;
import org.proclens.ip.om.CorrectiveSkip;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.ExtractorKind;
import org.proclens.ip.om.FieldType;
import org.proclens.ip.om.OmissionWarning;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.RegistryField;
import org.proclens.ip.om.RegistryRecord;
import org.proclens.ip.om.RegistrySchema;
import org.proclens.ip.om.SkipReason;
import org.proclens.ip.util.Logger;
import org.proclens.ip.util.NoteHash;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Asks an {@link Adjudicator} about fields the omission scanner flagged and
 * applies the patches that survive validation.
 *
 * <p>A field is only sent out when the keyword guard finds one of its terms in
 * the note. Calls are bounded by a permit gate and a timeout and cached per
 * (note hash, field). A patch needs at least one quote found verbatim in the
 * note, must target a leaf of the flagged procedure and must fit the field
 * type. Each accepted patch is built in full before a single write, so the
 * record never holds half of a patch.</p>
 *
 * <p>Adjudicator calls run on a pool owned by this pass. A call that outlives
 * its timeout is cancelled with an interrupt and never occupies the pipeline
 * workers.</p>
 */
public class CorrectivePass implements AutoCloseable {

	public static final String AUTO_CORRECTED = "AUTO_CORRECTED: ";
	public static final String SKIPPED = "SELF_CORRECT_SKIPPED: ";

	private final PipelineConfig config;
	private final Adjudicator adjudicator;
	private final KeywordGuard keywordGuard;
	private final PermitGate gate;
	private final ExecutorService executor;
	private final Cache<String, AdjudicationResponse> cache;

	public CorrectivePass(PipelineConfig config, Adjudicator adjudicator, KeywordGuard keywordGuard) {
		this.config = config;
		this.adjudicator = adjudicator;
		this.keywordGuard = keywordGuard;
		this.executor = Executors.newFixedThreadPool(Math.max(1, config.getCorrectiveMaxConcurrent()), r -> {
			Thread t = new Thread(r, "proclens-corrective");
			t.setDaemon(true);
			return t;
		});
		this.gate = new PermitGate(config.getCorrectiveMaxConcurrent());
		this.cache = Caffeine.newBuilder()
				.maximumSize(config.getCorrectiveCacheSize())
				.expireAfterWrite(Duration.ofMinutes(config.getCorrectiveCacheTtlMinutes()))
				.build();
	}

	/** Outcome of one adjudicator call: a response or the reason there is none. */
	private static final class Call {
		final AdjudicationResponse response;
		final SkipReason reason;
		final String detail;

		Call(AdjudicationResponse response, SkipReason reason, String detail) {
			this.response = response;
			this.reason = reason;
			this.detail = detail;
		}

		static Call of(AdjudicationResponse response) {
			return new Call(response, null, null);
		}

		static Call skip(SkipReason reason, String detail) {
			return new Call(null, reason, detail);
		}
	}

	/**
	 * @param record    assembled record, not yet frozen
	 * @param omissions flagged fields
	 * @param note      original note text, used for evidence offsets
	 * @param masked    note text with menu blocks masked, sent out and searched for quotes
	 * @param enabled   effective enable flag for this run
	 */
	public CorrectionOutcome run(RegistryRecord record, List<OmissionWarning> omissions, String note, String masked,
			boolean enabled) {
		List<CorrectiveSkip> skips = new ArrayList<>();
		List<String> warnings = new ArrayList<>();
		List<String> applied = new ArrayList<>();

		if (!enabled || adjudicator == null) {
			skips.add(new CorrectiveSkip(null, SkipReason.DISABLED, "corrective pass disabled"));
			return outcome(applied, skips, warnings);
		}
		if (omissions.isEmpty()) {
			skips.add(new CorrectiveSkip(null, SkipReason.NO_OMISSION, "no omission warnings"));
			return outcome(applied, skips, warnings);
		}

		String noteHash = NoteHash.sha256(masked);
		Set<String> seen = new LinkedHashSet<>();
		for (OmissionWarning omission : omissions) {
			String path = omission.getFieldPath();
			if (!seen.add(path)) {
				continue;
			}
			if (!keywordGuard.passes(path, masked)) {
				String detail = "keyword guard failed (" + String.join(", ", keywordGuard.terms(path)) + ")";
				skip(skips, warnings, path, SkipReason.KEYWORD_GUARD_FAILED, detail);
				continue;
			}
			AdjudicationRequest request = new AdjudicationRequest(masked, noteHash, path, omission,
					allowedPaths(path));
			Call call = lookup(request);
			if (call.reason != null) {
				skip(skips, warnings, path, call.reason, call.detail);
				if (call.reason == SkipReason.CANCELLED) {
					break;
				}
				continue;
			}
			List<FieldPatch> patches = call.response.getPatches();
			if (patches == null || patches.isEmpty()) {
				skips.add(new CorrectiveSkip(path, SkipReason.NO_CHANGE, "adjudicator proposed no patch"));
				continue;
			}
			for (FieldPatch patch : patches) {
				apply(record, patch, request.getAllowedPaths(), note, masked, applied, skips, warnings, path);
			}
		}
		return outcome(applied, skips, warnings);
	}

	// ---- Call ----

	private Call lookup(AdjudicationRequest request) {
		String key = request.getNoteHash() + "|" + request.getFieldPath();
		AdjudicationResponse cached = cache.getIfPresent(key);
		if (cached != null) {
			Logger.debug("Corrective cache hit for {}", request.getFieldPath());
			return Call.of(cached);
		}
		Call call = gate.tryWithPermit(() -> invoke(request),
				() -> Thread.currentThread().isInterrupted()
						? Call.skip(SkipReason.CANCELLED, "interrupted while waiting for a permit")
						: Call.skip(SkipReason.CONCURRENCY_LIMIT, "no permit within "
								+ config.getCorrectiveAcquireTimeoutMs() + " ms"),
				config.getCorrectiveAcquireTimeoutMs());
		if (call.response != null) {
			cache.put(key, call.response);
		}
		return call;
	}

	private Call invoke(AdjudicationRequest request) {
		Future<AdjudicationResponse> future = executor.submit(() -> adjudicator.adjudicate(request));
		try {
			AdjudicationResponse response = future.get(config.getCorrectiveTimeoutMs(), TimeUnit.MILLISECONDS);
			return Call.of(response == null ? AdjudicationResponse.none() : response);
		} catch (TimeoutException e) {
			future.cancel(true);
			return Call.skip(SkipReason.TIMEOUT, "no answer within " + config.getCorrectiveTimeoutMs() + " ms");
		} catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			return Call.skip(SkipReason.CANCELLED, "interrupted");
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			Logger.warn("Adjudicator failed for {}: {}", request.getFieldPath(), String.valueOf(cause));
			return Call.skip(SkipReason.FAILURE, String.valueOf(cause));
		}
	}

	// ---- Patch ----

	private void apply(RegistryRecord record, FieldPatch patch, Set<String> allowed, String note, String masked,
			List<String> applied, List<CorrectiveSkip> skips, List<String> warnings, String flagged) {
		String path = patch.getFieldPath();
		if (patch.getEvidenceQuotes() == null || patch.getEvidenceQuotes().isEmpty()) {
			reject(skips, warnings, flagged, SkipReason.NO_EVIDENCE, path + ": patch has no evidence");
			return;
		}
		if (path == null || !allowed.contains(path)) {
			reject(skips, warnings, flagged, SkipReason.REJECTED_PATCH, path + " is outside the flagged procedure");
			return;
		}
		FieldType type = RegistrySchema.typeOf(path).orElse(null);
		if (type == null || !type.accepts(patch.getNewValue())) {
			reject(skips, warnings, flagged, SkipReason.REJECTED_PATCH, path + ": value does not fit " + type);
			return;
		}
		Object current = record.get(path).map(RegistryField::getValue).orElse(null);
		if (Objects.equals(current, patch.getNewValue())) {
			reject(skips, warnings, flagged, SkipReason.NO_CHANGE, path + " already holds " + current);
			return;
		}
		if (!Double.isFinite(patch.getConfidence())) {
			reject(skips, warnings, flagged, SkipReason.REJECTED_PATCH,
					path + ": confidence is not a number: " + patch.getConfidence());
			return;
		}
		double confidence = Math.max(0.0,
				Math.min(patch.getConfidence(), Math.nextDown(config.getCorrectiveConfidenceCeiling())));
		List<EvidenceSpan> evidence = new ArrayList<>();
		for (String quote : patch.getEvidenceQuotes()) {
			int at = quote == null || quote.isBlank() ? -1 : masked.indexOf(quote);
			if (at < 0) {
				reject(skips, warnings, flagged, SkipReason.REJECTED_PATCH, path + ": quote not found in note: " + quote);
				return;
			}
			evidence.add(EvidenceSpan.of(note, at, at + quote.length(), ExtractorKind.CORRECTIVE.prefix(), confidence));
		}
		try {
			record.put(path, RegistryField.corrective(patch.getNewValue(), evidence, confidence));
		} catch (IllegalArgumentException | IllegalStateException e) {
			reject(skips, warnings, flagged, SkipReason.REJECTED_PATCH, path + ": " + e.getMessage());
			return;
		}
		applied.add(path);
		warnings.add(AUTO_CORRECTED + path);
		Logger.info("Corrective patch applied: {} = {}", path, patch.getNewValue());
	}

	private static Set<String> allowedPaths(String fieldPath) {
		Set<String> out = new LinkedHashSet<>();
		Procedure p = RegistrySchema.procedureOf(fieldPath).orElse(null);
		if (p == null) {
			out.add(fieldPath);
			return out;
		}
		for (Attribute a : p.attributes()) {
			out.add(p.path(a));
		}
		return out;
	}

	private static void reject(List<CorrectiveSkip> skips, List<String> warnings, String flagged, SkipReason reason,
			String detail) {
		Logger.warn("Corrective patch rejected for {}: {}", flagged, detail);
		skips.add(new CorrectiveSkip(flagged, reason, detail));
		warnings.add(SKIPPED + flagged + ": " + detail);
	}

	private static void skip(List<CorrectiveSkip> skips, List<String> warnings, String path, SkipReason reason,
			String detail) {
		skips.add(new CorrectiveSkip(path, reason, detail));
		warnings.add(SKIPPED + path + ": " + detail);
		Logger.debug("Corrective pass skipped {}: {}", path, reason);
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}

	private static CorrectionOutcome outcome(List<String> applied, List<CorrectiveSkip> skips, List<String> warnings) {
		return new CorrectionOutcome(!applied.isEmpty(), List.copyOf(applied), List.copyOf(skips),
				List.copyOf(warnings));
	}
}
