package org.metricshub.aiawk.ext;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * AiAwk
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.aiawk.ext.annotations.AwkFunction;
import org.metricshub.aiawk.util.AwkLogger;
import org.slf4j.Logger;

/**
 * Natural-language text functions: sentiment, classification, translation,
 * summaries, entity and information extraction, fact checking, math word
 * problems and text generation.
 * <p>
 * Each function sends a prompt to the configured {@link TextAnalysisProvider}
 * and post-processes the answer. When the provider fails or has no answer,
 * the {@link SimulatedTextAnalysisProvider} answers instead.
 */
public class TextAnalysisExtension extends AbstractExtension {

	private static final Logger LOG = AwkLogger.getLogger(TextAnalysisExtension.class);

	private static final Pattern NUMBER = Pattern.compile("-?\\d+\\.?\\d*");
	private static final Pattern NAMED_PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

	private final TextAnalysisProvider provider;
	private final TextAnalysisProvider fallback = new SimulatedTextAnalysisProvider();

	/**
	 * Uses the simulated provider only.
	 */
	public TextAnalysisExtension() {
		this(new SimulatedTextAnalysisProvider());
	}

	/**
	 * @param provider the text service to query first
	 */
	public TextAnalysisExtension(TextAnalysisProvider provider) {
		this.provider = Objects.requireNonNull(provider, "provider");
	}

	@Override
	public String getExtensionName() {
		return "Text Analysis";
	}

	/**
	 * Asks the provider, then the fallback when the provider fails or has
	 * nothing to say.
	 */
	String ask(String prompt, int maxTokens) throws IOException {
		try {
			String answer = provider.complete(prompt, maxTokens);
			if (answer != null && !answer.isEmpty()) {
				return answer;
			}
			LOG.debug("Empty answer from {}, using the simulated provider", provider.getClass().getSimpleName());
		} catch (IOException | RuntimeException e) {
			LOG.warn("Text provider {} failed: {}. Using the simulated provider.", provider.getClass().getSimpleName(), e.getMessage());
			LOG.debug("Text provider failure", e);
		}
		String answer = fallback.complete(prompt, maxTokens);
		return answer == null ? "" : answer;
	}

	/**
	 * Sends the prompt as is.
	 *
	 * @param prompt the prompt
	 * @param maxTokens optional maximum length of the answer, 100 by default
	 * @return the answer
	 */
	@AwkFunction("ai_call")
	public String aiCall(String prompt, int... maxTokens) throws IOException {
		return ask(prompt, maxTokens.length > 0 ? maxTokens[0] : 100);
	}

	@AwkFunction("ai_sentiment")
	public String aiSentiment(String text) throws IOException {
		String answer = ask("Analyze sentiment: positive, negative, or neutral?\n\nText: " + text, 10)
				.toLowerCase(Locale.ROOT)
				.trim();
		if (answer.contains("positive")) {
			return "positive";
		}
		if (answer.contains("negative")) {
			return "negative";
		}
		return "neutral";
	}

	/**
	 * @param text the text to classify
	 * @param categories comma-separated list of categories
	 * @return the first listed category found in the answer, or the first
	 *         category
	 */
	@AwkFunction("ai_classify")
	public String aiClassify(String text, String categories) throws IOException {
		String[] categoryList = categories.split(",", -1);
		String answer = ask("Classify into: " + categories + "\n\nText: " + text, 20).toLowerCase(Locale.ROOT).trim();
		for (String category : categoryList) {
			String trimmed = category.trim();
			if (!trimmed.isEmpty() && answer.contains(trimmed.toLowerCase(Locale.ROOT))) {
				return trimmed;
			}
		}
		return categoryList[0].trim();
	}

	@AwkFunction("ai_translate")
	public String aiTranslate(String text, String targetLanguage) throws IOException {
		return ask("Translate to " + targetLanguage + ": " + text, 100);
	}

	/**
	 * @param text the text to summarize
	 * @param maxWords optional maximum length of the summary, 50 by default
	 * @return the summary
	 */
	@AwkFunction("ai_summarize")
	public String aiSummarize(String text, int... maxWords) throws IOException {
		int words = maxWords.length > 0 ? maxWords[0] : 50;
		return ask("Summarize in " + words + " words: " + text, words * 2);
	}

	@AwkFunction("ai_entity_extract")
	public String aiEntityExtract(String text, String entityType) throws IOException {
		return ask("Extract " + entityType + " entities: " + text, 100);
	}

	@AwkFunction("ai_fact_check")
	public String aiFactCheck(String statement) throws IOException {
		String answer = ask("Is this true or false? " + statement, 10);
		return answer.toLowerCase(Locale.ROOT).contains("true") ? "true" : "false";
	}

	@AwkFunction("ai_extract_info")
	public String aiExtractInfo(String text, String infoType) throws IOException {
		return ask("Extract " + infoType + ": " + text, 50);
	}

	/**
	 * @param problem the problem statement
	 * @return the first number of the answer, 0 when there is none
	 */
	@AwkFunction("ai_math_word_problem")
	public double aiMathWordProblem(String problem) throws IOException {
		Matcher matcher = NUMBER.matcher(ask("Solve (number only): " + problem, 20));
		return matcher.find() ? Double.parseDouble(matcher.group()) : 0;
	}

	/**
	 * Fills the template, then asks for a text generated from it.
	 * <code>{0}</code>, <code>{1}</code>... are replaced by the arguments of
	 * the same index, then the remaining named placeholders like
	 * <code>{name}</code> by the arguments in order.
	 */
	@AwkFunction("ai_generate")
	public String aiGenerate(String template, String... args) throws IOException {
		return ask("Generate: " + fillTemplate(template, args), 100);
	}

	static String fillTemplate(String template, String... args) {
		String text = template;
		for (int i = 0; i < args.length; i++) {
			text = text.replace("{" + i + "}", args[i]);
		}
		List<String> placeholders = new ArrayList<String>();
		Matcher matcher = NAMED_PLACEHOLDER.matcher(text);
		while (matcher.find()) {
			placeholders.add(matcher.group(1));
		}
		for (int i = 0; i < placeholders.size() && i < args.length; i++) {
			text = text.replace("{" + placeholders.get(i) + "}", args[i]);
		}
		return text;
	}
}
