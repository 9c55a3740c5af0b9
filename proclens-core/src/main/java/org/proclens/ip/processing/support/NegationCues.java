package org.proclens.ip.processing.support;

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

/**
 * Negation cues governing a mention from just before or just after it. At
 * most one plain word may sit between the cue and the mention, so "no
 * complications from the BAL" does not negate the BAL.
 */
public final class NegationCues {

	private static final Pattern BEFORE = Pattern.compile(
			"\\b(?:no|not|without|never|declined|deferred|negative for|absence of)\\s+(?:[\\w/-]+\\s+)?$",
			Pattern.CASE_INSENSITIVE);

	private static final Pattern AFTER = Pattern.compile(
			"^\\s*(?:(?:was|were|is|are)\\s+)?(?:not|never)\\s+(?:[\\w-]+\\s+)?"
					+ "(?:performed|done|obtained|placed|inserted|removed|attempted|sampled|required|indicated|pursued|given|administered|instilled)\\b"
					+ "|^\\s*(?:(?:was|were)\\s+)?(?:deferred|declined|cancell?ed)\\b",
			Pattern.CASE_INSENSITIVE);

	private NegationCues() {
	}

	/** True when the mention between {@code before} and {@code after} is negated. */
	public static boolean negates(String before, String after) {
		return (before != null && BEFORE.matcher(before).find()) || (after != null && AFTER.matcher(after).find());
	}

	public static boolean negates(ContextWindow window) {
		return negates(window.getBefore(), window.getAfter());
	}
}
