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

import static org.proclens.ip.om.Attribute.GUIDANCE;
import static org.proclens.ip.om.Attribute.SITES;
import static org.proclens.ip.om.Attribute.STATIONS;
import static org.proclens.ip.om.Attribute.TUBE_SIZE_FR;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.RegistryRecord;
import org.proclens.ip.processing.support.AnatomicSites;

/**
 * Primary code rules, one per registry procedure (or family).
 */
final class PrimaryRules {

	static final String LINEAR_EBUS_NO_STATIONS = "LINEAR_EBUS_NO_STATIONS";

	private PrimaryRules() {
	}

	static List<CodeRule> all() {
		List<CodeRule> rules = new ArrayList<>();
		rules.add(simple("31622", Procedure.DIAGNOSTIC_BRONCHOSCOPY));
		rules.add(simple("31623", Procedure.BRUSHINGS));
		rules.add(simple("31624", Procedure.BAL));
		rules.add(simple("31625", Procedure.ENDOBRONCHIAL_BIOPSY));
		rules.add(ctx -> {
			if (performed(ctx, Procedure.TRANSBRONCHIAL_BIOPSY) || performed(ctx, Procedure.TRANSBRONCHIAL_CRYOBIOPSY)) {
				Derivation d = ctx.add("31628", Procedure.TRANSBRONCHIAL_BIOPSY, Procedure.TRANSBRONCHIAL_CRYOBIOPSY);
				ctx.detail(d, Procedure.TRANSBRONCHIAL_BIOPSY, SITES);
				ctx.detail(d, Procedure.TRANSBRONCHIAL_CRYOBIOPSY, SITES);
			}
		});
		rules.add(simple("31629", Procedure.TBNA_CONVENTIONAL));
		rules.add(PrimaryRules::linearEbus);
		rules.add(simple("31645", Procedure.THERAPEUTIC_ASPIRATION));
		rules.add(simple("31635", Procedure.FOREIGN_BODY_REMOVAL));
		rules.add(simple("31630", Procedure.AIRWAY_DILATION));
		rules.add(simple("31636", Procedure.AIRWAY_STENT_PLACEMENT));
		rules.add(simple("31638", Procedure.AIRWAY_STENT_REMOVAL));
		rules.add(simple("31640", Procedure.MECHANICAL_DEBULKING));
		rules.add(ctx -> {
			// thermal and cryo destruction share one code
			if (performed(ctx, Procedure.THERMAL_ABLATION) || performed(ctx, Procedure.CRYOTHERAPY)) {
				ctx.add("31641", Procedure.THERMAL_ABLATION, Procedure.CRYOTHERAPY);
			}
		});
		rules.add(simple("31647", Procedure.BLVR_VALVE_PLACEMENT));
		rules.add(simple("31648", Procedure.BLVR_VALVE_REMOVAL));
		rules.add(PrimaryRules::thermoplasty);
		rules.add(simple("31615", Procedure.ESTABLISHED_TRACHEOSTOMY_ROUTE));
		rules.add(simple("31600", Procedure.PERCUTANEOUS_TRACHEOSTOMY));
		rules.add(simple("76536", Procedure.NECK_ULTRASOUND));
		rules.add(simple("76604", Procedure.CHEST_ULTRASOUND));
		rules.add(simple("43238", Procedure.EUS_B));
		rules.add(PrimaryRules::thoracentesis);
		rules.add(PrimaryRules::chestTube);
		rules.add(simple("32550", Procedure.IPC_PLACEMENT));
		rules.add(simple("32552", Procedure.IPC_REMOVAL));
		rules.add(simple("32601", Procedure.MEDICAL_THORACOSCOPY));
		rules.add(simple("32560", Procedure.PLEURODESIS));
		rules.add(simple("32561", Procedure.FIBRINOLYTIC_THERAPY));
		rules.add(SedationRules::moderateSedation);
		return rules;
	}

	static CodeRule simple(String code, Procedure p) {
		return ctx -> {
			if (performed(ctx, p)) {
				ctx.add(code, p);
			}
		};
	}

	static boolean performed(DerivationContext ctx, Procedure p) {
		return ctx.record.isPerformed(p);
	}

	private static void linearEbus(DerivationContext ctx) {
		RegistryRecord r = ctx.record;
		if (!r.isPerformed(Procedure.LINEAR_EBUS)) {
			return;
		}
		int stations = r.getList(Procedure.LINEAR_EBUS, STATIONS).size();
		if (stations == 0) {
			ctx.warn(LINEAR_EBUS_NO_STATIONS + ": linear EBUS performed but no sampled stations recorded");
			return;
		}
		String code = stations >= ctx.config.getEbusHighTierMinStations() ? "31653" : "31652";
		Derivation d = ctx.add(code, Procedure.LINEAR_EBUS);
		ctx.detail(d, Procedure.LINEAR_EBUS, STATIONS);
	}

	private static void thermoplasty(DerivationContext ctx) {
		if (!performed(ctx, Procedure.BRONCHIAL_THERMOPLASTY)) {
			return;
		}
		int lobes = AnatomicSites.lobeTokens(ctx.record.getList(Procedure.BRONCHIAL_THERMOPLASTY, SITES)).size();
		String code = lobes >= ctx.config.getThermoplastyHighTierMinLobes() ? "31661" : "31660";
		Derivation d = ctx.add(code, Procedure.BRONCHIAL_THERMOPLASTY);
		ctx.detail(d, Procedure.BRONCHIAL_THERMOPLASTY, SITES);
	}

	private static void thoracentesis(DerivationContext ctx) {
		if (!performed(ctx, Procedure.THORACENTESIS)) {
			return;
		}
		boolean guided = imaging(ctx.record, Procedure.THORACENTESIS);
		Derivation d = ctx.add(guided ? "32555" : "32554", Procedure.THORACENTESIS);
		if (guided) {
			ctx.detail(d, Procedure.THORACENTESIS, GUIDANCE);
		}
	}

	/** Unknown tube size counts as small bore. */
	private static void chestTube(DerivationContext ctx) {
		if (!performed(ctx, Procedure.CHEST_TUBE_INSERTION)) {
			return;
		}
		Optional<Integer> fr = ctx.record.getInt(Procedure.CHEST_TUBE_INSERTION, TUBE_SIZE_FR);
		boolean guided = imaging(ctx.record, Procedure.CHEST_TUBE_INSERTION);
		String code;
		if (fr.isPresent() && fr.get() > ctx.config.getSmallBoreMaxFr()) {
			code = "32551";
		} else {
			code = guided ? "32557" : "32556";
		}
		Derivation d = ctx.add(code, Procedure.CHEST_TUBE_INSERTION);
		ctx.detail(d, Procedure.CHEST_TUBE_INSERTION, TUBE_SIZE_FR);
		if (guided && !"32551".equals(code)) {
			ctx.detail(d, Procedure.CHEST_TUBE_INSERTION, GUIDANCE);
		}
	}

	private static boolean imaging(RegistryRecord r, Procedure p) {
		return r.getString(p, GUIDANCE).map(g -> g.equalsIgnoreCase("ULTRASOUND") || g.equalsIgnoreCase("CT"))
				.orElse(false);
	}
}
