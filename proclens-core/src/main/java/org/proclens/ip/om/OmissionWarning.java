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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Value;

/**
 * A watched procedure the learned extractor was confident about but the
 * finalized record does not mark as performed.
 */
@Value
@JsonPropertyOrder({ "code_hint", "reason", "triggering_confidence", "field_path" })
public class OmissionWarning {

	@JsonProperty("field_path")
	String fieldPath;

	@JsonProperty("code_hint")
	String codeHint;

	String reason;

	@JsonProperty("triggering_confidence")
	double triggeringConfidence;
}
