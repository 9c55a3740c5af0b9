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

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.proclens.ip.om.CandidateDetection;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.ExtractorKind;
import org.proclens.ip.om.PriorityClass;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.processing.support.ContextWindow;
import org.proclens.ip.processing.support.NegationCues;
import org.proclens.ip.processing.support.NoteLines;
import org.proclens.ip.processing.support.NoteLines.Segment;

/**
 * Keyword backstop: the first line-level match of {@code pattern} outside CPT
 * header lines and checkbox rows, unless the note or the match context vetoes
 * it.
 */
public class KeywordBackstop implements UpliftBackstop {

	public static final double CONFIDENCE = 0.75;

	private static final Pattern CHECKBOX_ROW = Pattern.compile("^\\s*(?:\\[[^\\]]?\\]|[☐☒☑□]|\\([ xX]?\\))");
	private static final Pattern HISTORY = Pattern.compile(
			"\\b(?:history of|h/o|prior(?! to)|previous(?:ly)?|s/p|status post|planned|scheduled|recommend\\w*|consider\\w*)\\b",
			Pattern.CASE_INSENSITIVE);
	private static final int WINDOW = 60;

	private final Procedure procedure;
	private final Pattern pattern;
	private final Pattern noteExclude;
	private final Pattern windowVeto;
	private final String id;

	public KeywordBackstop(Procedure procedure, Pattern pattern, Pattern noteExclude, Pattern windowVeto) {
		this.procedure = procedure;
		this.pattern = pattern;
		this.noteExclude = noteExclude;
		this.windowVeto = windowVeto;
		this.id = ExtractorKind.UPLIFT.id(procedure.key());
	}

	@Override
	public Procedure procedure() {
		return procedure;
	}

	public String id() {
		return id;
	}

	@Override
	public Optional<CandidateDetection> propose(String text, List<CandidateDetection> surviving) {
		if (text == null || isSettled(surviving)) {
			return Optional.empty();
		}
		if (noteExclude != null && noteExclude.matcher(text).find()) {
			return Optional.empty();
		}
		for (Segment line : NoteLines.lines(text)) {
			String s = line.getText();
			if (NoteLines.isCptHeaderLine(s) || CHECKBOX_ROW.matcher(s).find()) {
				continue;
			}
			Matcher m = pattern.matcher(s);
			while (m.find()) {
				ContextWindow w = ContextWindow.around(s, m.start(), m.end(), WINDOW);
				if (NegationCues.negates(w) || HISTORY.matcher(w.getBefore()).find()
						|| (windowVeto != null && windowVeto.matcher(w.full()).find())) {
					continue;
				}
				EvidenceSpan ev = EvidenceSpan.of(text, line.getStart() + m.start(), line.getStart() + m.end(), id,
						CONFIDENCE);
				return Optional.of(CandidateDetection.of(procedure.performedPath(), Boolean.TRUE, ev, id,
						PriorityClass.NARRATIVE));
			}
		}
		return Optional.empty();
	}

	/**
	 * Already claimed, explicitly negated, or contradicted at narrative tier
	 * or above.
	 */
	private boolean isSettled(List<CandidateDetection> surviving) {
		String path = procedure.performedPath();
		for (CandidateDetection c : surviving) {
			if (!c.getFieldPath().equals(path)) {
				continue;
			}
			if (c.isAffirmative() || c.getPriorityClass() == PriorityClass.EXPLICIT_NEGATION
					|| c.getPriorityClass().tier() >= PriorityClass.NARRATIVE.tier()) {
				return true;
			}
		}
		return false;
	}
}
