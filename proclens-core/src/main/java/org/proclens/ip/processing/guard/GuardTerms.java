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

import java.util.Optional;
import java.util.regex.Pattern;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.RegistrySchema;

/** Vocabulary and lookups shared by the rules. */
final class GuardTerms {

	static final Pattern PLACE_VERBS = ci("\\b(?:plac(?:ed|ement|ing)|deploy\\w*|insert\\w*|implant\\w*|tunnel(?:l)?ed|exchang\\w*)\\b");
	static final Pattern REMOVE_VERBS = ci("\\b(?:remov\\w*|extract\\w*|retriev\\w*|explant\\w*|pulled|withdrawn|discontinu\\w*|d/c(?:'?d)?)\\b");

	private GuardTerms() {
	}

	static Pattern ci(String regex) {
		return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
	}

	static boolean found(Pattern p, String s) {
		return s != null && p.matcher(s).find();
	}

	static Optional<Procedure> procedure(CandidateDetection c) {
		return RegistrySchema.procedureOf(c.getFieldPath());
	}

	/** True for an affirmative {@code performed} claim about {@code p}. */
	static boolean claims(CandidateDetection c, Procedure p) {
		return c.getFieldPath().equals(p.performedPath()) && c.isAffirmative();
	}
}
