package org.metricshub.aiawk.ext;

import static org.junit.Assert.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.aiawk.AwkTestSupport;

public class TextAnalysisExtensionTest {

	private final TextAnalysisExtension simulated = new TextAnalysisExtension();

	@Test
	public void testSentiment() throws IOException {
		assertEquals("positive", simulated.aiSentiment("I love this product"));
		assertEquals("negative", simulated.aiSentiment("What a terrible day"));
		assertEquals("neutral", simulated.aiSentiment("The meeting is at noon"));
	}

	@Test
	public void testClassify() throws IOException {
		assertEquals("business", simulated.aiClassify("The stock market fell", "sports, business"));
		assertEquals("sports", simulated.aiClassify("Local team wins championship", "business,sports"));
		// no listed category in the answer: the first one
		assertEquals("x", simulated.aiClassify("Nothing to see", " x , y"));
	}

	@Test
	public void testTranslate() throws IOException {
		assertEquals("hola world", simulated.aiTranslate("hello world", "Spanish"));
		assertEquals("traducción simulada", simulated.aiTranslate("cheese", "Spanish"));
	}

	@Test
	public void testSummarizeAndExtract() throws IOException {
		assertEquals("Brief summary of the content", simulated.aiSummarize("A very long story"));
		assertEquals("Brief summary of the content", simulated.aiSummarize("A very long story", 10));
		assertEquals("John Smith, Mary Jones", simulated.aiEntityExtract("John Smith met Mary Jones", "person"));
		assertEquals("none", simulated.aiEntityExtract("nobody here", "person"));
	}

	@Test
	public void testFactCheck() throws IOException {
		assertEquals("true", simulated.aiFactCheck("The Pacific Ocean is the largest ocean"));
		assertEquals("false", simulated.aiFactCheck("Cats can fly"));
		assertEquals("false", simulated.aiFactCheck("The moon is cheese"));
	}

	@Test
	public void testMathWordProblem() throws IOException {
		assertEquals(8, simulated.aiMathWordProblem("15 apples minus 7 apples"), 0);
		assertEquals(42, simulated.aiMathWordProblem("What is the answer?"), 0);
	}

	@Test
	public void testFillTemplate() {
		assertEquals("Hello Ann, you are 30", TextAnalysisExtension.fillTemplate("Hello {0}, you are {1}", "Ann", "30"));
		assertEquals("Dear Ann, order 42 shipped", TextAnalysisExtension.fillTemplate("Dear {name}, order {id} shipped", "Ann", "42"));
		assertEquals("Keep {this}", TextAnalysisExtension.fillTemplate("Keep {this}"));
	}

	@Test
	public void testGenerate() throws IOException {
		assertTrue(simulated.aiGenerate("Write about {topic}", "rivers").startsWith("AI-generated response: Generate: Write about rivers"));
	}

	@Test
	public void testProviderAnswerIsPostProcessed() throws IOException {
		List<String> prompts = new ArrayList<String>();
		TextAnalysisExtension extension = new TextAnalysisExtension((prompt, maxTokens) -> {
			prompts.add(prompt);
			return "  I would say Negative.  ";
		});
		assertEquals("negative", extension.aiSentiment("I love it"));
		assertEquals(1, prompts.size());
		assertTrue(prompts.get(0).endsWith("Text: I love it"));
	}

	@Test
	public void testFallbackWhenProviderFails() throws IOException {
		TextAnalysisExtension extension = new TextAnalysisExtension((prompt, maxTokens) -> {
			throw new IOException("connection refused");
		});
		assertEquals("positive", extension.aiSentiment("This is amazing"));
	}

	@Test
	public void testFallbackWhenProviderHasNoAnswer() throws IOException {
		TextAnalysisExtension empty = new TextAnalysisExtension((prompt, maxTokens) -> "");
		assertEquals(8, empty.aiMathWordProblem("15 minus 7"), 0);
		TextAnalysisExtension none = new TextAnalysisExtension((prompt, maxTokens) -> null);
		assertEquals("hola", none.aiTranslate("hello", "Spanish"));
	}

	@Test
	public void testCallSendsPromptAsIs() throws IOException {
		List<String> prompts = new ArrayList<String>();
		List<Integer> limits = new ArrayList<Integer>();
		TextAnalysisExtension extension = new TextAnalysisExtension((prompt, maxTokens) -> {
			prompts.add(prompt);
			limits.add(maxTokens);
			return "a haiku";
		});
		assertEquals("a haiku", extension.aiCall("Write a haiku"));
		assertEquals("a haiku", extension.aiCall("Write a haiku", 30));
		assertEquals("Write a haiku", prompts.get(0));
		assertEquals(Integer.valueOf(100), limits.get(0));
		assertEquals(Integer.valueOf(30), limits.get(1));
	}

	@Test
	public void testCallFromScriptFallsBack() throws Exception {
		AwkTestSupport
				.awkTest("ai_call falls back to the simulated provider")
				.script("BEGIN { print ai_call(\"Summarize this\"), ai_call(\"Solve 15 minus 7\", 5) }")
				.withExtensions(new TextAnalysisExtension((prompt, maxTokens) -> {
					throw new IOException("connection refused");
				}))
				.expectLines("Brief summary of the content 8")
				.runAndAssert();
	}

	@Test
	public void testFromScript() throws Exception {
		AwkTestSupport
				.awkTest("text analysis from a script")
				.script("{ print $1, ai_sentiment($0) }")
				.withExtensions(new TextAnalysisExtension())
				.stdin("1 great stuff\n2 awful weather\n3 plain facts\n")
				.expectLines("1 positive", "2 negative", "3 neutral")
				.runAndAssert();
	}
}
