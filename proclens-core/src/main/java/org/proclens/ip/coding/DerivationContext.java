package org.proclens.ip.coding;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.proclens.ip.conf.PipelineConfig;
import org.proclens.ip.om.Attribute;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.RegistryRecord;

/** Mutable state of one derivation run. */
final class DerivationContext {

	final RegistryRecord record;
	final PipelineConfig config;
	final CodeCatalog catalog;
	final Map<String, Derivation> codes = new TreeMap<>();
	final List<String> warnings = new ArrayList<>();

	DerivationContext(RegistryRecord record, PipelineConfig config, CodeCatalog catalog) {
		this.record = record;
		this.config = config;
		this.catalog = catalog;
	}

	/**
	 * Code {@code code} from the present fields of {@code procedures}; a
	 * second call for the same code merges into the first.
	 */
	Derivation add(String code, Procedure... procedures) {
		Derivation d = codes.computeIfAbsent(code, Derivation::new);
		for (Procedure p : procedures) {
			if (record.isPerformed(p)) {
				d.from(p.performedPath());
				if (p.has(Attribute.SITES)) {
					d.sites(record.getList(p, Attribute.SITES));
				}
			}
		}
		return d;
	}

	/** Adds a detail leaf to the code's provenance when the record holds it. */
	void detail(Derivation d, Procedure p, Attribute a) {
		if (p.has(a) && record.contains(p.path(a))) {
			d.from(p.path(a));
		}
	}

	boolean has(String code) {
		return codes.containsKey(code);
	}

	void warn(String warning) {
		warnings.add(warning);
	}
}
