package com.jobmatch.matcher.service.text;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.StringJoiner;
import java.util.regex.Pattern;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.WhitespaceTokenizer;
import org.apache.lucene.analysis.en.EnglishMinimalStemFilter;
import org.apache.lucene.analysis.fr.FrenchAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.springframework.stereotype.Service;

/**
 * Turns raw posting or profile text into the canonical token stream used for embeddings: URLs,
 * hashtags, digits and ASCII punctuation are removed, then a Lucene chain lower-cases, drops
 * French stopwords and reduces plural nouns to their singular form. Tokens the stemmer has no
 * rule for pass through unchanged. Pure and deterministic.
 */
@Service
public class TextNormalizer {

  private static final Pattern URLS =
      Pattern.compile("http\\S+|www\\S+|https\\S+", Pattern.MULTILINE);
  private static final Pattern MENTIONS_AND_HASHES = Pattern.compile("@w+|#");
  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final Pattern PUNCTUATION =
      Pattern.compile("[!\"#$%&'()*+,\\-./:;<=>?@\\[\\\\\\]^_`{|}~]");
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private static final CharArraySet STOP_WORDS = FrenchAnalyzer.getDefaultStopSet();
  private static final String FIELD = "text";

  private final Analyzer analyzer =
      new Analyzer() {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
          Tokenizer source = new WhitespaceTokenizer();
          TokenStream stream = new LowerCaseFilter(source);
          stream = new StopFilter(stream, STOP_WORDS);
          stream = new EnglishMinimalStemFilter(stream);
          return new TokenStreamComponents(source, stream);
        }
      };

  public String clean(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String cleaned = URLS.matcher(text).replaceAll("");
    cleaned = MENTIONS_AND_HASHES.matcher(cleaned).replaceAll("");
    cleaned = DIGITS.matcher(cleaned).replaceAll("");
    cleaned = PUNCTUATION.matcher(cleaned).replaceAll("");
    cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").strip();
    if (cleaned.isEmpty()) {
      return "";
    }
    return analyze(cleaned);
  }

  public boolean isStopWord(String word) {
    return word != null && STOP_WORDS.contains(word);
  }

  private String analyze(String text) {
    StringJoiner tokens = new StringJoiner(" ");
    try (TokenStream tokenStream = analyzer.tokenStream(FIELD, text)) {
      CharTermAttribute term = tokenStream.addAttribute(CharTermAttribute.class);
      tokenStream.reset();
      while (tokenStream.incrementToken()) {
        tokens.add(term.toString());
      }
      tokenStream.end();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to analyze text", e);
    }
    return tokens.toString();
  }
}
