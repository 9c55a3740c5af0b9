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
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.proclens.ip.util.Logger;

/**
 * Removes codes that are included in another code on the same encounter.
 *
 * <p>Same-site pairs are only bundled when the two codes concern the same
 * site, or when either site is unknown; pairs on distinct sites survive and
 * are handed to the {@link ModifierPass}. Other pairs are always exclusive.</p>
 */
final class BundlingPass {

	static final String BUNDLED = "BUNDLED";

	/** {kept, suppressed} when sites overlap. */
	static final String[][] SAME_SITE_PAIRS = {
			{ "31641", "31630" },
			{ "31640", "31630" },
			{ "31636", "31630" },
			{ "31641", "31640" } };

	/** {kept, suppressed} regardless of site. */
	static final String[][] EXCLUSIVE_PAIRS = {
			{ "31653", "31652" },
			{ "32555", "32554" },
			{ "32557", "32556" },
			{ "31615", "31600" },
			{ "32555", "76604" },
			{ "32557", "76604" },
			{ "31652", "31645" },
			{ "31653", "31645" },
			{ "31653", "31629" },
			{ "31652", "31629" } };

	static final String DIAGNOSTIC_BRONCHOSCOPY = "31622";

	private BundlingPass() {
	}

	/**
	 * @return codes that survive on distinct sites and need the distinct-site modifier
	 */
	static Set<String> apply(DerivationContext ctx) {
		Map<String, Derivation> codes = ctx.codes;
		Set<String> distinct = new LinkedHashSet<>();
		Set<String> suppressed = new LinkedHashSet<>();

		for (String[] pair : SAME_SITE_PAIRS) {
			Derivation kept = codes.get(pair[0]);
			Derivation other = codes.get(pair[1]);
			if (kept == null || other == null) {
				continue;
			}
			if (kept.sites().isEmpty() || other.sites().isEmpty()
					|| !Collections.disjoint(kept.sites(), other.sites())) {
				suppressed.add(pair[1]);
				ctx.warn(BUNDLED + ": " + pair[1] + " into " + pair[0] + " (same or unknown site)");
			} else {
				distinct.add(pair[1]);
			}
		}
		for (String[] pair : EXCLUSIVE_PAIRS) {
			if (codes.containsKey(pair[0]) && codes.containsKey(pair[1])) {
				suppressed.add(pair[1]);
				ctx.warn(BUNDLED + ": " + pair[1] + " into " + pair[0]);
			}
		}
		if (codes.containsKey(DIAGNOSTIC_BRONCHOSCOPY)) {
			for (String code : codes.keySet()) {
				if (isBronchoscopicPrimary(ctx, code) && !suppressed.contains(code)) {
					suppressed.add(DIAGNOSTIC_BRONCHOSCOPY);
					ctx.warn(BUNDLED + ": " + DIAGNOSTIC_BRONCHOSCOPY + " into " + code);
					break;
				}
			}
		}

		List<String> removed = new ArrayList<>();
		for (Iterator<String> it = codes.keySet().iterator(); it.hasNext();) {
			String code = it.next();
			if (suppressed.contains(code)) {
				it.remove();
				removed.add(code);
			}
		}
		distinct.removeAll(suppressed);
		if (!removed.isEmpty()) {
			Logger.debug("Bundling removed {}", removed);
		}
		return distinct;
	}

	private static boolean isBronchoscopicPrimary(DerivationContext ctx, String code) {
		return code.startsWith("316") && !code.equals(DIAGNOSTIC_BRONCHOSCOPY) && !code.equals("31600")
				&& !ctx.catalog.isAddOn(code);
	}
}
