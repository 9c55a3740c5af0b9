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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.proclens.ip.conf.PipelineConfig;
import org.proclens.ip.om.CodeEntry;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.RegistryRecord;
import org.proclens.ip.util.Logger;

/**
 * Derives billing codes from a finalized registry record. Pure: the same
 * record always yields the same codes, and nothing but the record is read.
 *
 * <p>Order of work: primary rules, add-on rules, bundling, modifiers, add-on
 * eligibility, then emission with evidence.</p>
 */
public class CodeDerivationEngine {

	public static final String ADDON_WITHOUT_PRIMARY = "ADDON_WITHOUT_PRIMARY";
	public static final String DERIVATION_INVARIANT = "DERIVATION_INVARIANT";

	private static final Comparator<EvidenceSpan> BY_POSITION = Comparator.comparingInt(EvidenceSpan::getStart)
			.thenComparingInt(EvidenceSpan::getEnd).thenComparing(EvidenceSpan::getSource)
			.thenComparingDouble(EvidenceSpan::getConfidence);

	private final PipelineConfig config;
	private final CodeCatalog catalog;
	private final List<CodeRule> primaryRules = PrimaryRules.all();
	private final List<CodeRule> addOnRules = AddOnRules.all();

	public CodeDerivationEngine(PipelineConfig config, CodeCatalog catalog) {
		this.config = config;
		this.catalog = catalog;
	}

	public DerivationResult derive(RegistryRecord record) {
		DerivationContext ctx = new DerivationContext(record, config, catalog);
		for (CodeRule rule : primaryRules) {
			rule.apply(ctx);
		}
		for (CodeRule rule : addOnRules) {
			rule.apply(ctx);
		}
		Set<String> distinctSite = BundlingPass.apply(ctx);
		ModifierPass.apply(ctx, distinctSite);
		dropOrphanAddOns(ctx);

		List<CodeEntry> out = new ArrayList<>();
		for (Derivation d : ctx.codes.values()) {
			try {
				out.add(emit(d, record));
			} catch (DerivationInvariantViolation e) {
				ctx.warn(DERIVATION_INVARIANT + ": dropped " + e.getCode() + ": " + e.getMessage());
				Logger.warn("Dropped code {}: {}", e.getCode(), e.getMessage());
			}
		}
		out.sort(Comparator.comparing(CodeEntry::getCode));
		Logger.debug("Derived {} codes", out.size());
		return new DerivationResult(List.copyOf(out), List.copyOf(ctx.warnings));
	}

	private void dropOrphanAddOns(DerivationContext ctx) {
		Map<String, Derivation> codes = ctx.codes;
		for (Iterator<String> it = codes.keySet().iterator(); it.hasNext();) {
			String code = it.next();
			if (!catalog.isAddOn(code)) {
				continue;
			}
			boolean eligible = false;
			for (String primary : catalog.requires(code)) {
				if (codes.containsKey(primary) && !catalog.isAddOn(primary)) {
					eligible = true;
					break;
				}
			}
			if (!eligible) {
				it.remove();
				ctx.warn(ADDON_WITHOUT_PRIMARY + ": " + code);
			}
		}
	}

	private CodeEntry emit(Derivation d, RegistryRecord record) {
		if (d.derivedFrom().isEmpty()) {
			throw new DerivationInvariantViolation(d.code(), "no source fields");
		}
		Set<EvidenceSpan> evidence = new TreeSet<>(BY_POSITION);
		for (String path : d.derivedFrom()) {
			evidence.addAll(record.evidence(path));
		}
		if (evidence.isEmpty()) {
			throw new DerivationInvariantViolation(d.code(), "no evidence for " + d.derivedFrom());
		}
		if (!catalog.contains(d.code())) {
			Logger.warn("Code {} is missing from the catalog", d.code());
		}
		return new CodeEntry(d.code(), catalog.description(d.code()), new ArrayList<>(d.derivedFrom()),
				new ArrayList<>(evidence), new ArrayList<>(d.modifiers()), d.quantity());
	}
}
