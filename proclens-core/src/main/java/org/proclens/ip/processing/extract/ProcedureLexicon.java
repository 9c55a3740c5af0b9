package org.proclens.ip.processing.extract;

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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.proclens.ip.om.Procedure;

/**
 * Vocabulary per procedure: how it is named in notes, which verb must
 * accompany a narrative mention, and which sentence context rules it out.
 */
public final class ProcedureLexicon {

	/** One procedure's vocabulary. */
	public static final class Entry {
		private final Procedure procedure;
		private final Pattern mention;
		private final Pattern action;
		private final Pattern exclude;
		private final SiteKind siteKind;

		Entry(Procedure procedure, Pattern mention, Pattern action, Pattern exclude, SiteKind siteKind) {
			this.procedure = procedure;
			this.mention = mention;
			this.action = action;
			this.exclude = exclude;
			this.siteKind = siteKind;
		}

		public Procedure procedure() {
			return procedure;
		}

		/** Names of the procedure or its device. */
		public Pattern mention() {
			return mention;
		}

		/** Verb required in the same sentence for a narrative claim; null when the name is itself the action. */
		public Pattern action() {
			return action;
		}

		/** Sentence context that makes the mention belong to another procedure; may be null. */
		public Pattern exclude() {
			return exclude;
		}

		SiteKind siteKind() {
			return siteKind;
		}

		/** True when {@code sentence} describes this procedure being done. */
		public boolean describesEvent(String sentence) {
			if (exclude != null && exclude.matcher(sentence).find()) {
				return false;
			}
			return action == null || action.matcher(sentence).find();
		}
	}

	// ---- Shared verb families ----
	static final Pattern PLACE_VERBS = ci("\\b(?:plac(?:ed|ement|ing)|deploy\\w*|insert\\w*|implant\\w*|position(?:ed)? (?:in|across|at|into))\\b");
	static final Pattern REMOVE_VERBS = ci("\\b(?:remov\\w*|extract\\w*|retriev\\w*|explant\\w*|pulled|withdrawn|discontinu\\w*|d/c(?:'?d)?)\\b");
	static final Pattern SAMPLE_VERBS = ci("\\b(?:perform\\w*|obtain\\w*|sampl\\w*|aspirat\\w*|biops\\w*|instill\\w*|return\\w*|sent|collected|done|TBNA|FNA|needle|pass(?:es)?)\\b");

	private static final Map<Procedure, Entry> ENTRIES = new EnumMap<>(Procedure.class);

	static {
		Pattern stent = ci("\\b(?:(?:silicone|metal(?:lic)?|SEMS|hybrid|Dumon|Ultraflex|Aero|Bonastent|Y|covered|uncovered)[- ]?)?stents?\\b");
		Pattern valves = ci("\\b(?:endobronchial valves?|Zephyr(?: valves?)?|Spiration(?: valves?)?|EBVs?|IBVs?|valves?)\\b");
		Pattern chestTube = ci("\\b(?:chest tube|tube thoracostomy|thoracostomy tube|pigtail(?: catheter| drain)?|Wayne catheter|pleur-?evac|small[- ]bore (?:chest )?(?:tube|catheter|drain))\\b");
		Pattern ipc = ci("\\b(?:indwelling (?:tunnel(?:l)?ed )?pleural catheter|tunnel(?:l)?ed pleural catheter|PleurX|Aspira|IPC|TPC)\\b");

		add(Procedure.DIAGNOSTIC_BRONCHOSCOPY,
				ci("\\b(?:flexible |fiberoptic |video )*bronchoscop(?:y|e)\\b"),
				ci("\\b(?:introduc\\w*|insert\\w*|advanc\\w*|passed|perform\\w*|examin\\w*|inspect\\w*|airway (?:exam|survey))\\b"),
				ci("\\brigid\\b"), SiteKind.NONE);
		add(Procedure.BRUSHINGS, ci("\\b(?:bronchial |cytology )?brush(?:ings?|ed)\\b"), null, null, SiteKind.NONE);
		add(Procedure.BAL, ci("\\b(?:BAL|broncho-?alveolar lavage)\\b"),
				ci("\\b(?:perform\\w*|obtain\\w*|instill\\w*|return\\w*|sent|done|collected|lavaged)\\b"), null, SiteKind.NONE);
		add(Procedure.ENDOBRONCHIAL_BIOPSY, ci("\\b(?:endobronchial (?:forceps )?biops(?:y|ies)|EBBx?)\\b"), null, null,
				SiteKind.AIRWAYS);
		add(Procedure.TRANSBRONCHIAL_BIOPSY, ci("\\b(?:transbronchial (?:lung |forceps )?biops(?:y|ies)|TBBx|TBLB)\\b"), null,
				ci("\\bcryo"), SiteKind.LOBES);
		add(Procedure.TRANSBRONCHIAL_CRYOBIOPSY, ci("\\b(?:(?:transbronchial )?cryo-?biops(?:y|ies)|TBLC)\\b"), null, null,
				SiteKind.LOBES);
		add(Procedure.TBNA_CONVENTIONAL,
				ci("\\b(?:conventional|blind|Wang|non-EBUS)\\s+(?:needle\\s+)?(?:TBNA|transbronchial needle aspiration)\\b"),
				null, null, SiteKind.LOBES);
		add(Procedure.LINEAR_EBUS, ci("\\b(?:linear |convex(?: probe)? |CP-)?(?:EBUS(?:-TBNA)?|endobronchial ultrasound)\\b"),
				SAMPLE_VERBS, ci("\\b(?:radial|miniprobe|r-?EBUS)\\b"), SiteKind.NONE);
		add(Procedure.RADIAL_EBUS,
				ci("\\b(?:radial (?:probe )?(?:EBUS|endobronchial ultrasound|ultrasound|probe)|r-?EBUS|miniprobe)\\b"), null,
				null, SiteKind.NONE);
		add(Procedure.NAVIGATIONAL_BRONCHOSCOPY, ci(
				"\\b(?:electromagnetic navigation(?:al)?(?: bronchoscopy)?|ENB|navigational bronchoscopy|superDimension|ILLUMISITE|Monarch|robotic(?:-assisted)? bronchoscopy|shape-sensing)\\b"),
				null, null, SiteKind.NONE);
		add(Procedure.FIDUCIAL_PLACEMENT, ci("\\bfiducials?(?: markers?)?\\b"), PLACE_VERBS, null, SiteKind.NONE);

		add(Procedure.THERAPEUTIC_ASPIRATION, ci(
				"\\b(?:therapeutic aspiration|(?:aspiration|suction(?:ing)?) of (?:thick |copious |tenacious )?(?:secretions|mucus(?: plugs?)?|blood|clot)|mucus plugs? (?:was|were) (?:aspirated|suctioned|cleared))\\b"),
				null, null, SiteKind.NONE);
		add(Procedure.FOREIGN_BODY_REMOVAL, ci("\\bforeign bod(?:y|ies)\\b"),
				ci("\\b(?:remov\\w*|retriev\\w*|extract\\w*|grasp\\w*)\\b"), null, SiteKind.NONE);
		add(Procedure.AIRWAY_DILATION, ci(
				"\\b(?:balloon (?:bronchoplasty|dilat\\w*)|(?:airway|bronchial|tracheal) dilat\\w*|CRE balloon|dilat(?:ed|ion) of the (?:stenosis|stricture|airway|trachea|bronch\\w*))\\b"),
				ci("\\b(?:dilat\\w*|inflat\\w*|bronchoplasty)\\b"), null, SiteKind.AIRWAYS);
		add(Procedure.AIRWAY_STENT_PLACEMENT, stent, PLACE_VERBS, REMOVE_VERBS, SiteKind.AIRWAYS);
		add(Procedure.AIRWAY_STENT_REMOVAL, stent, ci("\\b(?:remov\\w*|extract\\w*|retriev\\w*|explant\\w*)\\b"), null,
				SiteKind.AIRWAYS);
		add(Procedure.MECHANICAL_DEBULKING, ci(
				"\\b(?:mechanical(?:ly)? debulk\\w*|debulk\\w*|cored? out|coring|microdebrider|tumor (?:excision|resection)|snare (?:resection|excision))\\b"),
				null, null, SiteKind.AIRWAYS);
		add(Procedure.THERMAL_ABLATION, ci(
				"\\b(?:APC|argon plasma coagulation|electrocautery|laser|Nd:YAG|thermal ablation|electrosurg\\w*)\\b"),
				ci("\\b(?:applied|ablat\\w*|coagulat\\w*|fulgurat\\w*|treat\\w*|vaporiz\\w*|destroy\\w*|destruction|cauteriz\\w*|used to)\\b"),
				null, SiteKind.AIRWAYS);
		add(Procedure.CRYOTHERAPY, ci(
				"\\b(?:cryotherapy|cryoablation|cryo-?debridement|cryo-?recanali[sz]ation|cryospray|spray cryo\\w*)\\b"), null,
				ci("\\bcryo-?biops"), SiteKind.AIRWAYS);
		add(Procedure.BLVR_VALVE_PLACEMENT, valves, PLACE_VERBS, REMOVE_VERBS, SiteKind.LOBES);
		add(Procedure.BLVR_VALVE_REMOVAL, valves, ci("\\b(?:remov\\w*|extract\\w*|retriev\\w*|explant\\w*)\\b"), null,
				SiteKind.LOBES);
		add(Procedure.BRONCHIAL_THERMOPLASTY, ci("\\b(?:bronchial thermoplasty|Alair)\\b"), null, null, SiteKind.LOBES);
		add(Procedure.RIGID_BRONCHOSCOPY, ci("\\brigid (?:bronchoscop\\w*|barrel|scope)\\b"), null, null, SiteKind.NONE);

		add(Procedure.ESTABLISHED_TRACHEOSTOMY_ROUTE, ci(
				"\\b(?:through|via)\\s+(?:the\\s+|an?\\s+|(?:his|her|their)\\s+)?(?:existing\\s+|established\\s+|indwelling\\s+|mature\\s+)?(?:tracheostomy|trach)(?:\\s+(?:tube|stoma))?\\b"),
				null, null, SiteKind.NONE);
		add(Procedure.PERCUTANEOUS_TRACHEOSTOMY, ci("\\b(?:percutaneous (?:dilat(?:ional|ation) )?tracheostomy|PDT|perc trach)\\b"),
				null, null, SiteKind.NONE);

		add(Procedure.NECK_ULTRASOUND, ci("\\b(?:(?:neck|cervical) (?:ultrasound|US)|ultrasound of the neck)\\b"), null, null,
				SiteKind.NONE);
		add(Procedure.CHEST_ULTRASOUND, ci(
				"\\b(?:(?:chest|thoracic|pleural) (?:ultrasound|sonography)|ultrasound (?:of|over) the (?:chest|hemithorax|pleural space)|POCUS)\\b"),
				null, null, SiteKind.NONE);
		add(Procedure.EUS_B, ci("\\b(?:EUS-?B(?:-FNA)?|transesophageal bronchoscopic ultrasound)\\b"), null, null,
				SiteKind.NONE);

		add(Procedure.THORACENTESIS, ci("\\b(?:thoracentesis|pleural (?:fluid )?(?:tap|aspiration))\\b"), null, null,
				SiteKind.SIDES);
		add(Procedure.CHEST_TUBE_INSERTION, chestTube, PLACE_VERBS, REMOVE_VERBS, SiteKind.SIDES);
		add(Procedure.CHEST_TUBE_REMOVAL, chestTube, REMOVE_VERBS, PLACE_VERBS, SiteKind.SIDES);
		add(Procedure.IPC_PLACEMENT, ipc, ci("\\b(?:plac(?:ed|ement)|insert\\w*|tunnel\\w*|introduc\\w*)\\b"), REMOVE_VERBS,
				SiteKind.SIDES);
		add(Procedure.IPC_REMOVAL, ipc, REMOVE_VERBS, PLACE_VERBS, SiteKind.SIDES);
		add(Procedure.MEDICAL_THORACOSCOPY, ci("\\b(?:(?:medical|diagnostic|semi-?rigid) )?(?:thoracoscopy|pleuroscopy)\\b"),
				null, null, SiteKind.SIDES);
		add(Procedure.PLEURODESIS, ci("\\b(?:talc (?:poudrage|slurry|pleurodesis)|pleurodesis)\\b"), null, null,
				SiteKind.NONE);
		add(Procedure.FIBRINOLYTIC_THERAPY, ci(
				"\\b(?:tPA|alteplase|DNase|dornase|fibrinolytic\\w*|intrapleural (?:lytics?|tPA|alteplase))\\b"),
				ci("\\b(?:instill\\w*|administer\\w*|given|infus\\w*|dose[ds]?)\\b"), null, SiteKind.NONE);
	}

	private ProcedureLexicon() {
	}

	public static Optional<Entry> get(Procedure procedure) {
		return Optional.ofNullable(ENTRIES.get(procedure));
	}

	/** All entries in procedure declaration order. */
	public static Map<Procedure, Entry> entries() {
		return Collections.unmodifiableMap(ENTRIES);
	}

	private static void add(Procedure p, Pattern mention, Pattern action, Pattern exclude, SiteKind sites) {
		ENTRIES.put(p, new Entry(p, mention, action, exclude, sites));
	}

	static Pattern ci(String regex) {
		return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
	}
}
