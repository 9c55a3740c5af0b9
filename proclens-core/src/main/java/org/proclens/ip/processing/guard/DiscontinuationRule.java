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

import java.util.EnumMap;
import java.util.Map;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.processing.support.ContextWindow;

/**
 * "Chest tube discontinued" is a removal. Insertion claims read from a
 * removal context move to the matching removal field, or are dropped when the
 * registry has none.
 */
public class DiscontinuationRule implements GuardrailRule {

	private static final Map<Procedure, Procedure> REMOVAL_OF = new EnumMap<>(Procedure.class);

	static {
		REMOVAL_OF.put(Procedure.CHEST_TUBE_INSERTION, Procedure.CHEST_TUBE_REMOVAL);
		REMOVAL_OF.put(Procedure.IPC_PLACEMENT, Procedure.IPC_REMOVAL);
		REMOVAL_OF.put(Procedure.AIRWAY_STENT_PLACEMENT, Procedure.AIRWAY_STENT_REMOVAL);
		REMOVAL_OF.put(Procedure.BLVR_VALVE_PLACEMENT, Procedure.BLVR_VALVE_REMOVAL);
		REMOVAL_OF.put(Procedure.FIDUCIAL_PLACEMENT, null);
		REMOVAL_OF.put(Procedure.PERCUTANEOUS_TRACHEOSTOMY, null);
	}

	@Override
	public String name() {
		return "discontinuation";
	}

	@Override
	public GuardrailVerdict evaluate(CandidateDetection c, ContextWindow window, String text) {
		Procedure p = GuardTerms.procedure(c).orElse(null);
		if (p == null || !REMOVAL_OF.containsKey(p)) {
			return GuardrailVerdict.keep();
		}
		if (!c.getFieldPath().equals(p.performedPath()) || !c.isAffirmative()) {
			// details follow their performed flag through the assembler
			return GuardrailVerdict.keep();
		}
		String w = window.full();
		if (!GuardTerms.found(GuardTerms.REMOVE_VERBS, w) || GuardTerms.found(GuardTerms.PLACE_VERBS, w)) {
			return GuardrailVerdict.keep();
		}
		Procedure removal = REMOVAL_OF.get(p);
		if (removal == null) {
			return GuardrailVerdict.drop("removal context for " + p.key());
		}
		return GuardrailVerdict.rewrite(removal.performedPath(), "removal context");
	}
}
