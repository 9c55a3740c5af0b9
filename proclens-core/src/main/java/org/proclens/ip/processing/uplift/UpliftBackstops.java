package org.proclens.ip.processing.uplift;

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
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.util.Logger;

/**
 * The default backstops and their runner.
 */
public class UpliftBackstops {

	public static final String WARNING_PREFIX = "DETERMINISTIC_UPLIFT: added performed=true for ";

	private final List<UpliftBackstop> backstops;

	public UpliftBackstops(List<UpliftBackstop> backstops) {
		this.backstops = List.copyOf(backstops);
	}

	public static UpliftBackstops defaults() {
		List<UpliftBackstop> b = new ArrayList<>();
		b.add(new KeywordBackstop(Procedure.BAL,
				ci("\\b(?:BAL|bronchoalveolar lavage|broncho-alveolar lavage)\\b"), null,
				ci("\\b(?:results?|cultures? (?:from|of) (?:the )?prior|pending)\\b")));
		b.add(new KeywordBackstop(Procedure.ENDOBRONCHIAL_BIOPSY,
				ci("\\b(?:endobronchial (?:forceps )?biops(?:y|ies)|EBBx)\\b"), null, null));
		b.add(new KeywordBackstop(Procedure.RADIAL_EBUS,
				ci("\\b(?:radial (?:probe )?EBUS|radial (?:endobronchial )?ultrasound|r-?EBUS|(?:concentric|eccentric) (?:view|pattern))\\b"),
				null, null));
		b.add(new KeywordBackstop(Procedure.CRYOTHERAPY,
				ci("\\b(?:cryotherapy|cryoablation|cryo-?debridement|cryospray)\\b"), ci("\\bcryo-?biops"), null));
		b.add(new KeywordBackstop(Procedure.NAVIGATIONAL_BRONCHOSCOPY,
				ci("\\b(?:electromagnetic navigation|navigational bronchoscopy|ENB|robotic bronchoscopy|Monarch|superDimension|ILLUMISITE)\\b"),
				null, null));
		b.add(new KeywordBackstop(Procedure.CHEST_TUBE_INSERTION,
				ci("\\b(?:chest tube|tube thoracostomy|pigtail catheter)\\b[^.\\n]{0,40}\\b(?:placed|inserted|secured)\\b"),
				null, ci("\\b(?:remov\\w*|discontinu\\w*|pulled|existing|in place)\\b")));
		b.add(new KeywordBackstop(Procedure.IPC_PLACEMENT,
				ci("\\b(?:indwelling pleural catheter|tunnel(?:l)?ed pleural catheter|PleurX|IPC)\\b[^.\\n]{0,40}\\b(?:placed|inserted|tunnel(?:l)?ed)\\b"),
				null, ci("\\b(?:remov\\w*|existing|in place)\\b")));
		b.add(new KeywordBackstop(Procedure.CHEST_ULTRASOUND,
				ci("\\b(?:(?:chest|thoracic|pleural) ultrasound|ultrasound of the (?:chest|hemithorax)|bedside ultrasound)\\b"),
				null, null));
		return new UpliftBackstops(b);
	}

	/**
	 * Runs every backstop against the surviving candidates. Backstops do not
	 * see each other's additions.
	 */
	public UpliftOutcome apply(String text, List<CandidateDetection> surviving) {
		List<CandidateDetection> added = new ArrayList<>();
		List<String> warnings = new ArrayList<>();
		for (UpliftBackstop backstop : backstops) {
			Optional<CandidateDetection> c = backstop.propose(text, surviving);
			if (c.isPresent()) {
				added.add(c.get());
				warnings.add(WARNING_PREFIX + backstop.procedure().key());
				Logger.debug("Uplift {} on '{}'", backstop.procedure().key(), c.get().primaryEvidence().getText());
			}
		}
		return new UpliftOutcome(Collections.unmodifiableList(added), Collections.unmodifiableList(warnings));
	}

	private static Pattern ci(String regex) {
		return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
	}
}
