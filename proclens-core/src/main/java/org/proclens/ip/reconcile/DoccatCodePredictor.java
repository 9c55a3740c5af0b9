package org.proclens.ip.reconcile;

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
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

import org.proclens.ip.om.PredictedCode;
import org.proclens.ip.processing.support.ExtractorUnavailableException;
import org.proclens.ip.util.Logger;
import org.proclens.ip.util.ModelResources;

import opennlp.tools.doccat.DoccatModel;
import opennlp.tools.doccat.DocumentCategorizerME;
import opennlp.tools.tokenize.SimpleTokenizer;

/**
 * Document categorizer whose categories are codes. Every code category at or
 * above the probability floor becomes a prediction.
 */
public class DoccatCodePredictor implements SecondaryPredictor {

	private static final Pattern CODE = Pattern.compile("\\d{5}");

	private final String modelPath;
	private final double minProbability;
	private final AtomicReference<DoccatModel> model = new AtomicReference<>();
	private final ThreadLocal<DocumentCategorizerME> categorizer = new ThreadLocal<>();

	public DoccatCodePredictor(String modelPath, double minProbability) {
		this.modelPath = modelPath;
		this.minProbability = minProbability;
	}

	@Override
	public List<PredictedCode> predict(String noteText) throws ExtractorUnavailableException {
		DocumentCategorizerME cat = categorizer();
		String[] tokens = SimpleTokenizer.INSTANCE.tokenize(noteText == null ? "" : noteText);
		List<PredictedCode> out = new ArrayList<>();
		if (tokens.length == 0) {
			return out;
		}
		double[] probs;
		try {
			probs = cat.categorize(tokens);
		} catch (RuntimeException e) {
			throw new ExtractorUnavailableException("Code categorizer failed", e);
		}
		for (int i = 0; i < probs.length; i++) {
			String category = cat.getCategory(i);
			if (CODE.matcher(category).matches() && probs[i] >= minProbability) {
				out.add(new PredictedCode(category, probs[i]));
			}
		}
		return out;
	}

	private DocumentCategorizerME categorizer() throws ExtractorUnavailableException {
		DocumentCategorizerME cat = categorizer.get();
		if (cat == null) {
			cat = new DocumentCategorizerME(model());
			categorizer.set(cat);
		}
		return cat;
	}

	private DoccatModel model() throws ExtractorUnavailableException {
		DoccatModel m = model.get();
		if (m != null) {
			return m;
		}
		try (InputStream in = ModelResources.tryOpen(modelPath)) {
			if (in == null) {
				throw new ExtractorUnavailableException("Code categorizer model not found: " + modelPath);
			}
			model.compareAndSet(null, new DoccatModel(in));
			Logger.info("Loaded code categorizer model {}", modelPath);
			return model.get();
		} catch (IOException e) {
			throw new ExtractorUnavailableException("Cannot read code categorizer model " + modelPath, e);
		}
	}
}
