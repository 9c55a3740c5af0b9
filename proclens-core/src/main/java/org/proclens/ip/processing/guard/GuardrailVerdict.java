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

import org.proclens.ip.om.PriorityClass;

import lombok.Value;

/**
 * Outcome of one rule for one candidate.
 */
@Value
public class GuardrailVerdict {

	public enum Action {
		KEEP,
		DROP,
		DOWNGRADE,
		REWRITE
	}

	private static final GuardrailVerdict KEEP = new GuardrailVerdict(Action.KEEP, null, null, null);

	Action action;

	/** Target class for {@link Action#DOWNGRADE}. */
	PriorityClass priorityClass;

	/** Target path for {@link Action#REWRITE}. */
	String fieldPath;

	String reason;

	public static GuardrailVerdict keep() {
		return KEEP;
	}

	public static GuardrailVerdict drop(String reason) {
		return new GuardrailVerdict(Action.DROP, null, null, reason);
	}

	public static GuardrailVerdict downgrade(PriorityClass to, String reason) {
		return new GuardrailVerdict(Action.DOWNGRADE, to, null, reason);
	}

	public static GuardrailVerdict rewrite(String toPath, String reason) {
		return new GuardrailVerdict(Action.REWRITE, null, toPath, reason);
	}

	public boolean isKeep() {
		return action == Action.KEEP;
	}
}
