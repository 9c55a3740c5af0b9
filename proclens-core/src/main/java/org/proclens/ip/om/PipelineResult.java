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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Payload returned for one processed note.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "status", "registry", "codes", "reconciliation", "omission_warnings", "corrected", "warnings",
		"corrective_skips" })
public class PipelineResult {

	PipelineStatus status;

	/** Null when {@link #status} is FAILED. */
	RegistryRecord registry;

	@Singular
	List<CodeEntry> codes;

	ReconciliationResult reconciliation;

	@Singular
	@JsonProperty("omission_warnings")
	List<OmissionWarning> omissionWarnings;

	boolean corrected;

	@Singular
	List<String> warnings;

	@Singular
	@JsonProperty("corrective_skips")
	List<CorrectiveSkip> correctiveSkips;

	/** Failed request: no registry and no codes, only the reason. */
	public static PipelineResult failed(String reason) {
		return PipelineResult.builder()
				.status(PipelineStatus.FAILED)
				.corrected(false)
				.warning(reason)
				.build();
	}

	@JsonIgnore
	public boolean isSucceeded() {
		return status == PipelineStatus.SUCCEEDED;
	}
}
