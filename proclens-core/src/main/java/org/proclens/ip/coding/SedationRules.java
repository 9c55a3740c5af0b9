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

import static org.proclens.ip.om.Attribute.ADMINISTERED_BY;
import static org.proclens.ip.om.Attribute.DURATION_MINUTES;
import static org.proclens.ip.om.Attribute.END_TIME;
import static org.proclens.ip.om.Attribute.OBSERVER_PRESENT;
import static org.proclens.ip.om.Attribute.START_TIME;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

import org.proclens.ip.conf.PipelineConfig;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.RegistryRecord;

/**
 * Moderate sedation: 99152 for the initial block, 99153 per further unit.
 */
final class SedationRules {

	static final String SEDATION_NOT_BILLABLE = "SEDATION_NOT_BILLABLE";

	private static final Procedure SEDATION = Procedure.MODERATE_SEDATION;

	private SedationRules() {
	}

	static void moderateSedation(DerivationContext ctx) {
		RegistryRecord r = ctx.record;
		PipelineConfig cfg = ctx.config;
		if (!r.isPerformed(SEDATION)) {
			return;
		}
		Optional<Integer> minutes = duration(r);
		if (minutes.isEmpty()) {
			ctx.warn(SEDATION_NOT_BILLABLE + ": no duration or start/end time");
			return;
		}
		int duration = minutes.get();
		if (duration < cfg.getSedationMinMinutes()) {
			ctx.warn(SEDATION_NOT_BILLABLE + ": " + duration + " min is below " + cfg.getSedationMinMinutes());
			return;
		}
		String role = r.getString(SEDATION, ADMINISTERED_BY).map(s -> s.toLowerCase(Locale.ROOT)).orElse(null);
		if (role == null || !cfg.getSedationBillableRoles().contains(role)) {
			ctx.warn(SEDATION_NOT_BILLABLE + ": administered by " + (role == null ? "unknown" : role));
			return;
		}
		boolean observer = r.getBoolean(SEDATION, OBSERVER_PRESENT).orElse(false);
		if (cfg.isSedationRequireObserver() && !observer) {
			ctx.warn(SEDATION_NOT_BILLABLE + ": no independent observer documented");
			return;
		}
		Derivation d = ctx.add("99152", SEDATION);
		provenance(ctx, d);
		int extra = duration - cfg.getSedationInitialBlockMinutes();
		if (extra > 0) {
			int units = (extra + cfg.getSedationAddonUnitMinutes() - 1) / cfg.getSedationAddonUnitMinutes();
			Derivation addOn = ctx.add("99153", SEDATION).quantity(units);
			provenance(ctx, addOn);
		}
	}

	/** Recorded minutes, else end minus start (an end before the start means past midnight). */
	static Optional<Integer> duration(RegistryRecord r) {
		Optional<Integer> recorded = r.getInt(SEDATION, DURATION_MINUTES);
		if (recorded.isPresent()) {
			return recorded;
		}
		Optional<String> start = r.getString(SEDATION, START_TIME);
		Optional<String> end = r.getString(SEDATION, END_TIME);
		if (start.isEmpty() || end.isEmpty()) {
			return Optional.empty();
		}
		try {
			long minutes = ChronoUnit.MINUTES.between(LocalTime.parse(start.get()), LocalTime.parse(end.get()));
			if (minutes < 0) {
				minutes += 24 * 60;
			}
			return Optional.of((int) minutes);
		} catch (DateTimeParseException e) {
			return Optional.empty();
		}
	}

	private static void provenance(DerivationContext ctx, Derivation d) {
		if (ctx.record.contains(SEDATION.path(DURATION_MINUTES))) {
			ctx.detail(d, SEDATION, DURATION_MINUTES);
		} else {
			ctx.detail(d, SEDATION, START_TIME);
			ctx.detail(d, SEDATION, END_TIME);
		}
		ctx.detail(d, SEDATION, ADMINISTERED_BY);
		ctx.detail(d, SEDATION, OBSERVER_PRESENT);
	}
}
