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

import java.util.List;

/** Default rule set. */
public final class GuardrailRules {

	private GuardrailRules() {
	}

	public static List<GuardrailRule> defaults() {
		return List.of(new ToolMentionRule(), new DeviceStatusRule(), new DiscontinuationRule(),
				new DistinctProcedureRule(), new NegationCueRule(), new HistoricalContextRule(), new TemplateLineRule());
	}
}
