package org.proclens.ip.om;

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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A cited piece of the source note supporting a detected fact.
 *
 * <p>The serialized shape {@code {source, text, span:[start,end], confidence}} is
 * consumed by external evidence highlighters and must stay stable.</p>
 */
@JsonPropertyOrder({ "source", "text", "span", "confidence" })
public final class EvidenceSpan {

	/** Extractor or stage that produced the span (e.g. "pattern.narrative"). */
	private final String source;

	/** Verbatim text of the note between {@link #start} and {@link #end}. */
	private final String text;

	/** Inclusive start offset into the original note. */
	private final int start;

	/** Exclusive end offset into the original note. */
	private final int end;

	/** Producer confidence in [0,1]; never recomputed downstream. */
	private final double confidence;

	private EvidenceSpan(String source, String text, int start, int end, double confidence) {
		this.source = source;
		this.text = text;
		this.start = start;
		this.end = end;
		this.confidence = confidence;
	}

	/**
	 * Cite {@code note[start, end)}. The text is sliced from the note so the span is
	 * always a verbatim substring at its offsets.
	 *
	 * @throws IllegalArgumentException if offsets fall outside the note or the
	 *                                  confidence is outside [0,1]
	 */
	public static EvidenceSpan of(String note, int start, int end, String source, double confidence) {
		if (note == null) {
			throw new IllegalArgumentException("Cannot cite evidence from a null note");
		}
		if (start < 0 || start > end || end > note.length()) {
			throw new IllegalArgumentException(
					"Span [" + start + "," + end + ") is outside a note of length " + note.length());
		}
		return new EvidenceSpan(requireSource(source), note.substring(start, end), start, end,
				requireConfidence(confidence));
	}

	/**
	 * Rebuild a span from stored data when the note itself is not at hand.
	 */
	public static EvidenceSpan restore(String source, String text, int start, int end, double confidence) {
		if (text == null || start < 0 || start > end || text.length() != end - start) {
			throw new IllegalArgumentException("Stored span [" + start + "," + end + ") does not match its text");
		}
		return new EvidenceSpan(requireSource(source), text, start, end, requireConfidence(confidence));
	}

	@JsonCreator
	static EvidenceSpan fromJson(@JsonProperty("source") String source, @JsonProperty("text") String text,
			@JsonProperty("span") int[] span, @JsonProperty("confidence") double confidence) {
		if (span == null || span.length != 2) {
			throw new IllegalArgumentException("Evidence span must be a [start,end] pair");
		}
		return restore(source, text, span[0], span[1], confidence);
	}

	/** True when this span's text sits verbatim at its offsets in {@code note}. */
	public boolean isVerbatimIn(String note) {
		return note != null && end <= note.length() && note.startsWith(text, start);
	}

	public boolean overlaps(EvidenceSpan other) {
		return other != null && start < other.end && other.start < end;
	}

	public String getSource() {
		return source;
	}

	public String getText() {
		return text;
	}

	@JsonIgnore
	public int getStart() {
		return start;
	}

	@JsonIgnore
	public int getEnd() {
		return end;
	}

	@JsonProperty("span")
	public int[] getSpan() {
		return new int[] { start, end };
	}

	public double getConfidence() {
		return confidence;
	}

	private static String requireSource(String source) {
		if (source == null || source.isBlank()) {
			throw new IllegalArgumentException("Evidence source is required");
		}
		return source;
	}

	private static double requireConfidence(double confidence) {
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("Confidence must be in [0,1]: " + confidence);
		}
		return confidence;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof EvidenceSpan))
			return false;
		EvidenceSpan other = (EvidenceSpan) o;
		return start == other.start && end == other.end && Double.compare(confidence, other.confidence) == 0
				&& source.equals(other.source) && text.equals(other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(source, text, start, end, confidence);
	}

	@Override
	public String toString() {
		return source + "[" + start + "," + end + ")'" + text + "'@" + confidence;
	}
}
