package com.flamingo.ai.policyanalysis.service.analysis.preprocess;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextPreprocessor Tests")
class TextPreprocessorTest {

  private final TextPreprocessor preprocessor = new TextPreprocessor();

  @Test
  @DisplayName("should leave plain bill text untouched apart from control characters")
  void shouldKeepPlainText_whenNotHtml() {
    String text = "SECTION 1. Short title.\n\n\tThis Act may be cited\u0000 as the Act.\u0007";

    assertThat(preprocessor.preprocess(text))
        .isEqualTo("SECTION 1. Short title.\n\n\tThis Act may be cited as the Act.");
  }

  @Test
  @DisplayName("should strip markup, scripts and styles when text is an HTML page")
  void shouldStripHtml_whenTextIsHtmlPage() {
    String html =
        "<html><head><style>p { color: red; }</style></head><body>"
            + "<p>SECTION 1. Short title.</p><script>alert('x')</script>"
            + "<p>SECTION 2. Funding for <span>counties</span>.</p></body></html>";

    String text = preprocessor.preprocess(html);

    assertThat(text).doesNotContain("<", "alert", "color");
    assertThat(text).contains("SECTION 1. Short title.", "SECTION 2. Funding for counties.");
    assertThat(text).contains("\n\n");
  }

  @Test
  @DisplayName("should keep literal backslash sequences in HTML text while breaking lines at br")
  void shouldPreserveBackslashes_whenHtmlTextContainsEscapes() {
    String html =
        "<html><body><div><p>Filed at C:\\new\\notes.txt<br>"
            + "Match pattern \\n+ in rule 4.</p></div></body></html>";

    String text = preprocessor.preprocess(html);

    assertThat(text).contains("Filed at C:\\new\\notes.txt\nMatch pattern \\n+ in rule 4.");
  }

  @Test
  @DisplayName("should not treat a lone angle bracket as HTML")
  void shouldNotStrip_whenOnlyOneHtmlIndicator() {
    String text = "Fees apply when income < 200% of the poverty line. See <p> in rule 4.";

    assertThat(preprocessor.looksLikeHtml(text)).isFalse();
    assertThat(preprocessor.preprocess(text)).isEqualTo(text);
  }

  @Test
  @DisplayName("should return empty string for null input")
  void shouldReturnEmpty_whenNull() {
    assertThat(preprocessor.preprocess(null)).isEmpty();
  }
}
