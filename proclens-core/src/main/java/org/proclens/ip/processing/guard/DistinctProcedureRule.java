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

import java.util.regex.Pattern;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.processing.support.ContextWindow;

/**
 * Look-alike procedures that carry different codes:
 * <ul>
 * <li>skin or tract dilation is not airway dilation;</li>
 * <li>needle aspiration of pleural fluid is a thoracentesis, not a tube or catheter;</li>
 * <li>bronchoscopy through an existing tracheostomy is not a new tracheostomy;</li>
 * <li>concentric or eccentric radial views are radial, not linear, EBUS.</li>
 * </ul>
 */
public class DistinctProcedureRule implements GuardrailRule {

	private static final Pattern TRACT_DILATION = GuardTerms
			.ci("\\b(?:skin|tract|subcutaneous|soft tissue|dilator|serial dilat\\w*|intercostal)\\b");
	private static final Pattern AIRWAY = GuardTerms
			.ci("\\b(?:airway|trache\\w*|bronch\\w*|stenosis|stricture|subglottic|mainstem|carina|lobe|orifice)\\b");
	private static final Pattern NEEDLE_ACCESS = GuardTerms
			.ci("\\b(?:needle|aspirat\\w*|tap|catheter over needle|syringe|(?:\\d+(?:\\.\\d+)?\\s*(?:mL|cc|L))\\s+(?:of\\s+)?(?:fluid|serous|straw|bloody))");
	private static final Pattern DRAIN = GuardTerms
			.ci("\\b(?:tube|secured|sutur\\w*|stitch\\w*|tunnel\\w*|drain(?:age)? system|pleur-?evac|water seal|cuff|guide ?wire|wire|Seldinger|pigtail)\\b");
	private static final Pattern EXISTING_TRACH = GuardTerms.ci(
			"\\b(?:existing|established|indwelling|mature|chronic|prior)\\s+(?:tracheostomy|trach)\\b|\\b(?:through|via) (?:the|an?|(?:his|her|their)) (?:tracheostomy|trach)\\b");
	private static final Pattern RADIAL_VIEW = GuardTerms
			.ci("\\b(?:concentric|eccentric|adjacent) (?:view|pattern|image|lesion)?|\\bradial\\b|\\bminiprobe\\b|\\bguide sheath\\b");
	private static final Pattern LINEAR_MARKERS = GuardTerms
			.ci("\\b(?:station|lymph node|TBNA|EBUS-TBNA|convex|linear|mediastin\\w*|hilar|\\d{1,2}[RL]\\b)");

	@Override
	public String name() {
		return "distinct_procedure";
	}

	@Override
	public GuardrailVerdict evaluate(CandidateDetection c, ContextWindow window, String text) {
		String w = window.full();
		if (GuardTerms.claims(c, Procedure.AIRWAY_DILATION)) {
			if (GuardTerms.found(TRACT_DILATION, w) && !GuardTerms.found(AIRWAY, w)) {
				return GuardrailVerdict.drop("skin or tract dilation");
			}
		} else if (GuardTerms.claims(c, Procedure.CHEST_TUBE_INSERTION) || GuardTerms.claims(c, Procedure.IPC_PLACEMENT)) {
			if (GuardTerms.found(NEEDLE_ACCESS, w) && !GuardTerms.found(DRAIN, w)) {
				return GuardrailVerdict.rewrite(Procedure.THORACENTESIS.performedPath(), "needle aspiration only");
			}
		} else if (GuardTerms.claims(c, Procedure.PERCUTANEOUS_TRACHEOSTOMY)) {
			if (GuardTerms.found(EXISTING_TRACH, w)) {
				return GuardrailVerdict.rewrite(Procedure.ESTABLISHED_TRACHEOSTOMY_ROUTE.performedPath(),
						"existing tracheostomy");
			}
		} else if (GuardTerms.claims(c, Procedure.LINEAR_EBUS)) {
			if (GuardTerms.found(RADIAL_VIEW, w) && !GuardTerms.found(LINEAR_MARKERS, w)) {
				return GuardrailVerdict.rewrite(Procedure.RADIAL_EBUS.performedPath(), "radial probe findings");
			}
		}
		return GuardrailVerdict.keep();
	}
}
