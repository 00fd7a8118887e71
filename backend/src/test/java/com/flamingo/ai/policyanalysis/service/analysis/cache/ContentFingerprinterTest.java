package com.flamingo.ai.policyanalysis.service.analysis.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.policyanalysis.service.analysis.model.AnalysisContent;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContentFingerprinter Tests")
class ContentFingerprinterTest {

  private static final String MODEL = "gpt-4o";
  private static final String SCHEMA = "2025-01";

  private final ContentFingerprinter fingerprinter = new ContentFingerprinter();

  @Test
  @DisplayName("should produce a 64 character hex digest")
  void shouldProduceHexDigest_whenFingerprinting() {
    Fingerprint fingerprint =
        fingerprinter.fingerprint(AnalysisContent.ofText("SECTION 1."), MODEL, SCHEMA);

    assertThat(fingerprint.value()).hasSize(64).matches("[0-9a-f]+");
    assertThat(fingerprint.shortValue()).hasSize(12);
  }

  @Test
  @DisplayName("should ignore line ending differences")
  void shouldMatch_whenOnlyLineEndingsDiffer() {
    Fingerprint unix =
        fingerprinter.fingerprint(AnalysisContent.ofText("SEC. 1.\nText.\n"), MODEL, SCHEMA);
    Fingerprint windows =
        fingerprinter.fingerprint(AnalysisContent.ofText("SEC. 1.\r\nText.\r\n"), MODEL, SCHEMA);
    Fingerprint oldMac =
        fingerprinter.fingerprint(AnalysisContent.ofText("SEC. 1.\rText.\r"), MODEL, SCHEMA);

    assertThat(windows).isEqualTo(unix);
    assertThat(oldMac).isEqualTo(unix);
  }

  @Test
  @DisplayName("should treat composed and decomposed accents as the same text")
  void shouldMatch_whenUnicodeFormsDiffer() {
    Fingerprint composed =
        fingerprinter.fingerprint(AnalysisContent.ofText("Caf\u00e9 permits"), MODEL, SCHEMA);
    Fingerprint decomposed =
        fingerprinter.fingerprint(AnalysisContent.ofText("Cafe\u0301 permits"), MODEL, SCHEMA);

    assertThat(decomposed).isEqualTo(composed);
  }

  @Test
  @DisplayName("should ignore stray control characters but not tabs")
  void shouldStripControlCharacters_whenNormalizing() {
    assertThat(ContentFingerprinter.normalize("a\u0000b\u0007c\td")).isEqualTo("abc\td");
  }

  @Test
  @DisplayName("should change when the model, schema version or text changes")
  void shouldDiffer_whenAnyIdentityPartChanges() {
    AnalysisContent content = AnalysisContent.ofText("SECTION 1.");
    Fingerprint base = fingerprinter.fingerprint(content, MODEL, SCHEMA);

    assertThat(fingerprinter.fingerprint(content, "gpt-4.1", SCHEMA)).isNotEqualTo(base);
    assertThat(fingerprinter.fingerprint(content, MODEL, "2026-01")).isNotEqualTo(base);
    assertThat(fingerprinter.fingerprint(AnalysisContent.ofText("SECTION 2."), MODEL, SCHEMA))
        .isNotEqualTo(base);
  }

  @Test
  @DisplayName("should distinguish PDF bytes from the same bytes as text")
  void shouldDiffer_whenContentKindDiffers() {
    String raw = "%PDF-1.7 body";

    Fingerprint asText = fingerprinter.fingerprint(AnalysisContent.ofText(raw), MODEL, SCHEMA);
    Fingerprint asPdf =
        fingerprinter.fingerprint(
            AnalysisContent.ofPdf(raw.getBytes(StandardCharsets.UTF_8)), MODEL, SCHEMA);

    assertThat(asPdf).isNotEqualTo(asText);
  }

  @Test
  @DisplayName("should reject a value that is not a digest")
  void shouldThrow_whenFingerprintValueInvalid() {
    assertThatThrownBy(() -> new Fingerprint("abc")).isInstanceOf(IllegalArgumentException.class);
  }
}
