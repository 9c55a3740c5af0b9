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

import lombok.Builder;
import lombok.Value;

/**
 * Per-request switches. Each one is ANDed with the matching configuration
 * flag, so a request can turn a stage off but never force on a stage the
 * deployment disabled.
 */
@Value
@Builder
public class PipelineOptions {

	@Builder.Default
	boolean enableLearnedExtractor = true;

	@Builder.Default
	boolean enableCorrectivePass = true;

	@Builder.Default
	boolean enableSecondaryPredictor = true;

	/** Every optional stage requested. */
	public static PipelineOptions all() {
		return PipelineOptions.builder().build();
	}

	/** Pattern extraction and derivation only. */
	public static PipelineOptions deterministicOnly() {
		return PipelineOptions.builder()
				.enableLearnedExtractor(false)
				.enableCorrectivePass(false)
				.enableSecondaryPredictor(false)
				.build();
	}
}
