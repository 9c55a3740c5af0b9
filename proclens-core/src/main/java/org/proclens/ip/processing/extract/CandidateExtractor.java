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

import java.util.List;

import org.proclens.ip.om.CandidateDetection;

/**
 * Common contract of every candidate producer (pattern, learned). The
 * assembler only ever sees the candidates, never the concrete extractor.
 */
public interface CandidateExtractor {

	/** Extractor id stamped on produced candidates, e.g. {@code pattern.header}. */
	String id();

	/**
	 * @param text note text with menu blocks already masked
	 * @return candidates whose evidence is a literal substring of {@code text}
	 */
	List<CandidateDetection> detect(String text);
}
