package org.proclens.ip.schema;

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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.proclens.ip.om.Attribute;
import org.proclens.ip.om.EvidenceSpan;
import org.proclens.ip.om.FieldType;
import org.proclens.ip.om.Procedure;
import org.proclens.ip.om.RegistryField;
import org.proclens.ip.om.RegistryRecord;
import org.proclens.ip.om.RegistrySchema;
import org.proclens.ip.util.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes stored registry records.
 *
 * <p>Current layout (schema version 3):
 * {@code {"schema_version":"3","fields":{"bal.performed":{"value":true,"evidence":[...],...}}}}.</p>
 *
 * <p>Legacy layout (version 2) nests procedures under {@code procedures_performed}
 * and {@code pleural_procedures}, keeps evidence in a top-level map keyed by the
 * legacy dotted path with {@code {text,start,end}} spans, and uses older names:
 * {@code airway_stent}, {@code chest_tube} and {@code ipc} with an {@code action}
 * leaf, and {@code ebus} with {@code stations_sampled}. Legacy spans are restored
 * with source {@code legacy} and confidence 1.0. A legacy {@code performed=true}
 * without evidence cannot be represented and is skipped with a warning.</p>
 */
public class RegistryRecordAdapter {

	public static final String LEGACY_SOURCE = "legacy";

	private static final String[] LEGACY_GROUPS = { "procedures_performed", "pleural_procedures" };

	private final ObjectMapper mapper;

	public RegistryRecordAdapter() {
		this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
	}

	public RegistryRecordAdapter(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public String write(RegistryRecord record) throws JsonProcessingException {
		return mapper.writeValueAsString(record);
	}

	/**
	 * @throws IOException for unreadable JSON, an unknown schema version or
	 *                     fields that break the current schema
	 */
	public RegistryRecord read(String json) throws IOException {
		JsonNode root = mapper.readTree(json);
		if (root == null || !root.isObject()) {
			throw new IOException("Registry record must be a JSON object");
		}
		String version = root.path("schema_version").asText("");
		if (RegistrySchema.VERSION.equals(version)) {
			return readCurrent(root);
		}
		if ("2".equals(version) || (version.isEmpty() && hasLegacyGroups(root))) {
			return readLegacy(root);
		}
		throw new IOException("Unsupported registry schema version '" + version + "'");
	}

	// ---- Version 3 ----

	private RegistryRecord readCurrent(JsonNode root) throws IOException {
		RegistryRecord record = new RegistryRecord();
		JsonNode fields = root.path("fields");
		for (Iterator<Map.Entry<String, JsonNode>> it = fields.fields(); it.hasNext();) {
			Map.Entry<String, JsonNode> e = it.next();
			String path = e.getKey();
			JsonNode f = e.getValue();
			Object value = value(path, f.get("value"));
			List<EvidenceSpan> evidence = new ArrayList<>();
			for (JsonNode ev : f.path("evidence")) {
				evidence.add(mapper.treeToValue(ev, EvidenceSpan.class));
			}
			List<String> ids = new ArrayList<>();
			for (JsonNode id : f.path("extractor_ids")) {
				ids.add(id.asText());
			}
			RegistryField field = new RegistryField(value, evidence, ids, f.path("corrective").asBoolean(false),
					f.path("confidence").asDouble(0.0));
			put(record, path, field);
		}
		return record;
	}

	// ---- Version 2 ----

	private RegistryRecord readLegacy(JsonNode root) throws IOException {
		RegistryRecord record = new RegistryRecord();
		JsonNode evidenceMap = root.path("evidence");
		for (String group : LEGACY_GROUPS) {
			JsonNode procedures = root.path(group);
			for (Iterator<Map.Entry<String, JsonNode>> it = procedures.fields(); it.hasNext();) {
				Map.Entry<String, JsonNode> e = it.next();
				String legacyPrefix = group + "." + e.getKey();
				Procedure p = legacyProcedure(e.getKey(), e.getValue());
				if (p == null) {
					Logger.warn("Legacy record: no current procedure for {}", legacyPrefix);
					continue;
				}
				readLegacyProcedure(record, p, legacyPrefix, e.getValue(), evidenceMap);
			}
		}
		return record;
	}

	private void readLegacyProcedure(RegistryRecord record, Procedure p, String legacyPrefix, JsonNode node,
			JsonNode evidenceMap) throws IOException {
		Map<String, JsonNode> leaves = new LinkedHashMap<>();
		for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext();) {
			Map.Entry<String, JsonNode> leaf = it.next();
			if (!"action".equals(leaf.getKey())) {
				leaves.put(leaf.getKey(), leaf.getValue());
			}
		}
		JsonNode performed = leaves.remove("performed");
		if (performed == null || !performed.isBoolean()) {
			Logger.warn("Legacy record: {} has no performed flag", legacyPrefix);
			return;
		}
		List<EvidenceSpan> flagEvidence = legacyEvidence(evidenceMap, legacyPrefix + ".performed");
		if (performed.asBoolean() && flagEvidence.isEmpty()) {
			Logger.warn("Legacy record: skipping {} performed=true without evidence", legacyPrefix);
			return;
		}
		put(record, p.performedPath(), legacyField(performed.asBoolean(), flagEvidence));

		for (Map.Entry<String, JsonNode> leaf : leaves.entrySet()) {
			String key = "stations_sampled".equals(leaf.getKey()) ? Attribute.STATIONS.key() : leaf.getKey();
			Attribute a = Attribute.fromKey(key);
			if (a == null || !p.has(a)) {
				Logger.warn("Legacy record: dropping {}.{} (not in schema {})", legacyPrefix, leaf.getKey(),
						RegistrySchema.VERSION);
				continue;
			}
			String path = p.path(a);
			Object value = value(path, leaf.getValue());
			put(record, path, legacyField(value, legacyEvidence(evidenceMap, legacyPrefix + "." + leaf.getKey())));
		}
	}

	/** Current procedure for a legacy group entry; renamed entries read their {@code action}. */
	static Procedure legacyProcedure(String legacyName, JsonNode node) {
		String action = node.path("action").asText("").toLowerCase(Locale.ROOT);
		boolean removal = action.startsWith("remov");
		switch (legacyName) {
		case "airway_stent":
			return removal ? Procedure.AIRWAY_STENT_REMOVAL : Procedure.AIRWAY_STENT_PLACEMENT;
		case "chest_tube":
			return removal ? Procedure.CHEST_TUBE_REMOVAL : Procedure.CHEST_TUBE_INSERTION;
		case "ipc":
			return removal ? Procedure.IPC_REMOVAL : Procedure.IPC_PLACEMENT;
		case "blvr":
			return removal ? Procedure.BLVR_VALVE_REMOVAL : Procedure.BLVR_VALVE_PLACEMENT;
		case "ebus":
			return Procedure.LINEAR_EBUS;
		default:
			return Procedure.fromKey(legacyName).orElse(null);
		}
	}

	private List<EvidenceSpan> legacyEvidence(JsonNode evidenceMap, String legacyPath) throws IOException {
		List<EvidenceSpan> out = new ArrayList<>();
		JsonNode node = evidenceMap.get(legacyPath);
		if (node == null || node.isNull()) {
			return out;
		}
		if (node.isObject()) {
			out.add(legacySpan(node, legacyPath));
		} else {
			for (JsonNode span : node) {
				out.add(legacySpan(span, legacyPath));
			}
		}
		return out;
	}

	private static EvidenceSpan legacySpan(JsonNode span, String legacyPath) throws IOException {
		try {
			return EvidenceSpan.restore(LEGACY_SOURCE, span.path("text").asText(), span.path("start").asInt(-1),
					span.path("end").asInt(-1), 1.0);
		} catch (IllegalArgumentException e) {
			throw new IOException("Bad legacy evidence at " + legacyPath + ": " + e.getMessage(), e);
		}
	}

	private static RegistryField legacyField(Object value, List<EvidenceSpan> evidence) {
		return new RegistryField(value, evidence, List.of(LEGACY_SOURCE), false, evidence.isEmpty() ? 0.0 : 1.0);
	}

	// ---- shared ----

	private Object value(String path, JsonNode node) throws IOException {
		FieldType type = RegistrySchema.typeOf(path)
				.orElseThrow(() -> new IOException("Unknown registry field: " + path));
		if (node == null || node.isNull()) {
			throw new IOException("Field " + path + " has no value");
		}
		switch (type) {
		case BOOLEAN:
			if (node.isBoolean()) {
				return node.booleanValue();
			}
			break;
		case INTEGER:
			if (node.canConvertToInt() && node.isIntegralNumber()) {
				return node.intValue();
			}
			break;
		case STRING:
			if (node.isTextual()) {
				return node.textValue();
			}
			break;
		case STRING_LIST:
			if (node.isArray()) {
				List<String> out = new ArrayList<>();
				for (JsonNode n : node) {
					out.add(n.asText());
				}
				return out;
			}
			break;
		default:
			break;
		}
		throw new IOException("Field " + path + " expects " + type + " but holds " + node.getNodeType());
	}

	private static void put(RegistryRecord record, String path, RegistryField field) throws IOException {
		try {
			record.put(path, field);
		} catch (IllegalArgumentException e) {
			throw new IOException(e.getMessage(), e);
		}
	}

	private static boolean hasLegacyGroups(JsonNode root) {
		for (String group : LEGACY_GROUPS) {
			if (root.has(group)) {
				return true;
			}
		}
		return false;
	}
}
