package com.flamingo.ai.policyanalysis.service.analysis.preprocess;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

/**
 * Cleans raw bill text before it is measured and chunked.
 *
 * <p>Legislative sources often deliver bill text as HTML. Text that looks like a page (an
 * {@code <html>} or {@code <body>} tag, or at least three of the common block tags) is reduced to
 * its visible text with Jsoup. Control characters other than tab, line feed and carriage return
 * are always removed.
 */
@Component
@Slf4j
public class TextPreprocessor {

  private static final List<String> HTML_INDICATORS =
      List.of("<html", "<body", "<div", "<span", "<p", "<table");
  private static final int HTML_INDICATOR_THRESHOLD = 3;
  private static final String BLOCK_ELEMENTS =
      "p, div, h1, h2, h3, h4, h5, h6, li, tr, table, section";

  private static final Pattern CONTROL_CHARACTERS =
      Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

  public String preprocess(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String cleaned = looksLikeHtml(text) ? stripHtml(text) : text;
    return CONTROL_CHARACTERS.matcher(cleaned).replaceAll("");
  }

  boolean looksLikeHtml(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    if (lower.contains("<html") || lower.contains("<body")) {
      return true;
    }
    long indicators = HTML_INDICATORS.stream().filter(lower::contains).count();
    return indicators >= HTML_INDICATOR_THRESHOLD;
  }

  private String stripHtml(String html) {
    Document document = Jsoup.parse(html);
    document.select("script, style").remove();
    // wholeText keeps the line structure that paragraph and heading detection rely on
    for (Element lineBreak : document.select("br")) {
      lineBreak.after(new TextNode("\n"));
    }
    for (Element block : document.select(BLOCK_ELEMENTS)) {
      block.prependChild(new TextNode("\n\n"));
    }
    String text = document.body() == null ? document.text() : document.body().wholeText();
    String stripped =
        text.replaceAll("[ \\t\\x0B\\f]+", " ")
            .replaceAll(" *\\n *", "\n")
            .replaceAll("\n{3,}", "\n\n")
            .strip();
    log.info("Stripped HTML from bill text: {} -> {} chars", html.length(), stripped.length());
    return stripped;
  }
}
