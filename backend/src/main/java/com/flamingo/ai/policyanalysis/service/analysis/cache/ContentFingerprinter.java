package com.flamingo.ai.policyanalysis.service.analysis.cache;

import com.flamingo.ai.policyanalysis.service.analysis.model.AnalysisContent;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Computes the {@link Fingerprint} of an analysis request.
 *
 * <p>Text is normalized first (Unicode NFC, CRLF and CR to LF, C0 control characters other than
 * tab and line feed removed) so that cosmetic re-encodings of the same bill hit the same cache
 * entry and are detected as unchanged. PDF bytes are hashed as they are.
 */
@Component
public class ContentFingerprinter {

  private static final byte SEPARATOR = 0;
  private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
  private static final Pattern CONTROL_CHARACTERS =
      Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F]");

  public Fingerprint fingerprint(AnalysisContent content, String modelId, String schemaVersion) {
    MessageDigest digest = sha256();
    if (content.isPdf()) {
      digest.update(content.bytes());
    } else {
      digest.update(normalize(content.text()).getBytes(StandardCharsets.UTF_8));
    }
    digest.update(SEPARATOR);
    digest.update(content.kind().name().getBytes(StandardCharsets.UTF_8));
    digest.update(SEPARATOR);
    digest.update(String.valueOf(modelId).getBytes(StandardCharsets.UTF_8));
    digest.update(SEPARATOR);
    digest.update(String.valueOf(schemaVersion).getBytes(StandardCharsets.UTF_8));
    return new Fingerprint(HexFormat.of().formatHex(digest.digest()));
  }

  static String normalize(String text) {
    String nfc = Normalizer.normalize(text, Normalizer.Form.NFC);
    String unixLines = LINE_BREAKS.matcher(nfc).replaceAll("\n");
    return CONTROL_CHARACTERS.matcher(unixLines).replaceAll("");
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
