package org.proclens.ip.processing.learned;

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

import org.proclens.ip.processing.support.ExtractorUnavailableException;
import org.proclens.ip.processing.support.NoteLines;
import org.proclens.ip.processing.support.NoteLines.Segment;
import org.proclens.ip.util.Logger;
import org.proclens.ip.util.ModelResources;

import opennlp.tools.namefind.NameFinderME;
import opennlp.tools.namefind.TokenNameFinderModel;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.util.Span;

/**
 * OpenNLP name finder over registry entity types. The model is loaded on
 * first use and shared; the finder itself is not thread-safe, so each worker
 * thread keeps its own.
 */
public class OpenNlpSpanPredictor implements SpanPredictor {

	private final String modelPath;
	private final AtomicReference<TokenNameFinderModel> model = new AtomicReference<>();
	private final ThreadLocal<NameFinderME> finder = new ThreadLocal<>();

	public OpenNlpSpanPredictor(String modelPath) {
		this.modelPath = modelPath;
	}

	@Override
	public List<PredictedSpan> predict(String text) throws ExtractorUnavailableException {
		NameFinderME nf = finder();
		List<PredictedSpan> out = new ArrayList<>();
		try {
			for (Segment sentence : NoteLines.sentences(text)) {
				Span[] tokens = SimpleTokenizer.INSTANCE.tokenizePos(sentence.getText());
				if (tokens.length == 0) {
					continue;
				}
				String[] words = Span.spansToStrings(tokens, sentence.getText());
				for (Span name : nf.find(words)) {
					int start = sentence.getStart() + tokens[name.getStart()].getStart();
					int end = sentence.getStart() + tokens[name.getEnd() - 1].getEnd();
					out.add(new PredictedSpan(name.getType(), start, end, name.getProb()));
				}
			}
		} catch (RuntimeException e) {
			throw new ExtractorUnavailableException("Name finder failed on note", e);
		} finally {
			nf.clearAdaptiveData();
		}
		return out;
	}

	private NameFinderME finder() throws ExtractorUnavailableException {
		NameFinderME nf = finder.get();
		if (nf == null) {
			nf = new NameFinderME(model());
			finder.set(nf);
		}
		return nf;
	}

	private TokenNameFinderModel model() throws ExtractorUnavailableException {
		TokenNameFinderModel m = model.get();
		if (m != null) {
			return m;
		}
		try (InputStream in = ModelResources.tryOpen(modelPath)) {
			if (in == null) {
				throw new ExtractorUnavailableException("Name finder model not found: " + modelPath);
			}
			model.compareAndSet(null, new TokenNameFinderModel(in));
			Logger.info("Loaded name finder model {}", modelPath);
			return model.get();
		} catch (IOException e) {
			throw new ExtractorUnavailableException("Cannot read name finder model " + modelPath, e);
		}
	}
}
