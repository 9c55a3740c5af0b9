package org.proclens.ip;

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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.proclens.ip.conf.ConfigLoader;
import org.proclens.ip.conf.PipelineConfig;
import org.proclens.ip.om.PipelineOptions;
import org.proclens.ip.om.PipelineResult;
import org.proclens.ip.processing.ProcedureCodingPipeline;
import org.proclens.ip.schema.RegistryRecordAdapter;
import org.proclens.ip.util.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Command line entry point: codes one procedure note and prints the result
 * payload as JSON.
 *
 * <pre>
 * ProcLensMain &lt;note-file&gt; [--no-learned] [--no-corrective] [--no-predictor] [--registry-out &lt;file&gt;]
 * </pre>
 *
 * No adjudicator is wired here, so the corrective pass always reports
 * DISABLED.
 */
public class ProcLensMain {

	private final ConfigLoader cfg;

	public ProcLensMain() {
		this.cfg = new ConfigLoader();
	}

	/**
	 * Application entry point.
	 */
	public static void main(String[] args) {
		if (args.length == 0) {
			System.err.println(
					"Usage: ProcLensMain <note-file> [--no-learned] [--no-corrective] [--no-predictor] [--registry-out <file>]");
			System.exit(2);
		}
		ProcLensMain app = new ProcLensMain();
		int rc = app.run(args);
		System.exit(rc);
	}

	int run(String[] args) {
		Path notePath = Path.of(args[0]);
		PipelineOptions.PipelineOptionsBuilder options = PipelineOptions.builder();
		Path registryOut = null;
		for (int i = 1; i < args.length; i++) {
			switch (args[i]) {
			case "--no-learned":
				options.enableLearnedExtractor(false);
				break;
			case "--no-corrective":
				options.enableCorrectivePass(false);
				break;
			case "--no-predictor":
				options.enableSecondaryPredictor(false);
				break;
			case "--registry-out":
				if (i + 1 >= args.length) {
					Logger.error("--registry-out needs a file argument");
					return 2;
				}
				registryOut = Path.of(args[++i]);
				break;
			default:
				Logger.error("Unknown option: {}", args[i]);
				return 2;
			}
		}

		List<String> issues = cfg.validate();
		for (String issue : issues) {
			Logger.warn("Config: {}", issue);
		}
		PipelineConfig config = cfg.toPipelineConfig();

		String note;
		try {
			note = Files.readString(notePath, StandardCharsets.UTF_8);
		} catch (IOException e) {
			Logger.error("Cannot read note {}: {}", notePath, e.getMessage());
			return 1;
		}

		ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
		try (ProcedureCodingPipeline pipeline = ProcedureCodingPipeline.withDefaults(config, null)) {
			long start = System.currentTimeMillis();
			PipelineResult result = pipeline.process(note, options.build());
			Logger.info("Processed {} in {} ms: status={}, codes={}", notePath, System.currentTimeMillis() - start,
					result.getStatus(), result.getCodes().size());

			System.out.println(mapper.writeValueAsString(result));

			if (registryOut != null && result.isSucceeded()) {
				String json = new RegistryRecordAdapter(mapper).write(result.getRegistry());
				Files.writeString(registryOut, json, StandardCharsets.UTF_8);
				Logger.info("Registry written to {}", registryOut);
			}
			return result.isSucceeded() ? 0 : 1;
		} catch (IOException e) {
			Logger.error("Cannot write output: {}", e.getMessage());
			return 1;
		}
	}
}
