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

import static org.proclens.ip.om.Attribute.SITES;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.proclens.ip.om.Procedure;
import org.proclens.ip.processing.support.AnatomicSites;

/**
 * Add-on code rules. They run after the primaries; eligibility against the
 * surviving primaries is checked after bundling.
 */
final class AddOnRules {

	private AddOnRules() {
	}

	static List<CodeRule> all() {
		List<CodeRule> rules = new ArrayList<>();
		rules.add(PrimaryRules.simple("31654", Procedure.RADIAL_EBUS));
		rules.add(PrimaryRules.simple("31627", Procedure.NAVIGATIONAL_BRONCHOSCOPY));
		rules.add(PrimaryRules.simple("31626", Procedure.FIDUCIAL_PLACEMENT));
		rules.add(ctx -> perAdditionalLobe(ctx, "31632", Procedure.TRANSBRONCHIAL_BIOPSY,
				Procedure.TRANSBRONCHIAL_CRYOBIOPSY));
		rules.add(ctx -> perAdditionalLobe(ctx, "31633", Procedure.TBNA_CONVENTIONAL));
		rules.add(ctx -> perAdditionalLobe(ctx, "31651", Procedure.BLVR_VALVE_PLACEMENT));
		rules.add(ctx -> perAdditionalLobe(ctx, "31649", Procedure.BLVR_VALVE_REMOVAL));
		return rules;
	}

	/** One unit per lobe beyond the first, across the given procedures. */
	private static void perAdditionalLobe(DerivationContext ctx, String code, Procedure... procedures) {
		Set<String> lobes = new TreeSet<>();
		for (Procedure p : procedures) {
			if (ctx.record.isPerformed(p)) {
				lobes.addAll(AnatomicSites.lobeTokens(ctx.record.getList(p, SITES)));
			}
		}
		if (lobes.size() < 2) {
			return;
		}
		Derivation d = ctx.add(code, procedures).quantity(lobes.size() - 1);
		for (Procedure p : procedures) {
			if (ctx.record.isPerformed(p)) {
				ctx.detail(d, p, SITES);
			}
		}
	}
}
