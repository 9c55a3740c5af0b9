package org.proclens.ip.processing.guard;

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

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.processing.support.ContextWindow;

/**
 * Device status remarks ("stent in good position", "IPC in place") describe
 * hardware already there, not a placement or a removal.
 */
public class DeviceStatusRule implements GuardrailRule {

	private static final Set<Procedure> DEVICE_PROCEDURES = EnumSet.of(Procedure.AIRWAY_STENT_PLACEMENT,
			Procedure.AIRWAY_STENT_REMOVAL, Procedure.CHEST_TUBE_INSERTION, Procedure.CHEST_TUBE_REMOVAL,
			Procedure.IPC_PLACEMENT, Procedure.IPC_REMOVAL, Procedure.BLVR_VALVE_PLACEMENT,
			Procedure.BLVR_VALVE_REMOVAL, Procedure.FIDUCIAL_PLACEMENT);

	private static final Pattern STATUS = GuardTerms.ci(
			"\\b(?:in (?:good|satisfactory|appropriate|adequate) position|(?:remains?|widely|was) patent|patent|in place|in situ|no intervention|existing|already (?:in place|present)|well[- ]seated|unchanged)\\b");

	@Override
	public String name() {
		return "device_status";
	}

	@Override
	public GuardrailVerdict evaluate(CandidateDetection c, ContextWindow window, String text) {
		Procedure p = GuardTerms.procedure(c).orElse(null);
		if (p == null || !DEVICE_PROCEDURES.contains(p) || !GuardTerms.claims(c, p)) {
			return GuardrailVerdict.keep();
		}
		String w = window.full();
		if (!GuardTerms.found(STATUS, w)) {
			return GuardrailVerdict.keep();
		}
		if (GuardTerms.found(GuardTerms.PLACE_VERBS, w) || GuardTerms.found(GuardTerms.REMOVE_VERBS, w)) {
			return GuardrailVerdict.keep();
		}
		return GuardrailVerdict.drop("device status without placement or removal");
	}
}
