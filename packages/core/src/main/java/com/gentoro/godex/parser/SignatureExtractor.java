package com.gentoro.godex.parser;

import com.gentoro.godex.model.FunctionRecord;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decomposes a {@code func} line into receiver, name, parameters, return clause and inline
 * description.
 *
 * <p>The inline description is a heuristic: go doc pads the signature from a trailing comment with
 * a wide run of spaces, so the text after the last run of at least {@link
 * ParserSettings#descriptionGap()} spaces is taken as the description. Signatures that contain such
 * a run themselves are split in the wrong place.
 */
public class SignatureExtractor {
  private static final Pattern FUNC_LINE =
      Pattern.compile("^func(?:\\s+\\(([^)]+)\\))?\\s+([A-Z]\\w*)\\s*(\\([^)]*\\))?\\s*(.*)$");
  private static final int RECEIVER = 1;
  private static final int NAME = 2;
  private static final int PARAMS = 3;
  private static final int TAIL = 4;

  private final Pattern descriptionGap;

  public SignatureExtractor(ParserSettings settings) {
    this.descriptionGap = Pattern.compile(" {" + settings.descriptionGap() + ",}");
  }

  public boolean matches(String line) {
    return FUNC_LINE.matcher(LineClassifier.normalize(line)).matches();
  }

  /** Extract a record from {@code line}, or empty when the line is not an exported func. */
  public Optional<FunctionRecord> extract(String line) {
    String text = LineClassifier.normalize(line);
    Matcher m = FUNC_LINE.matcher(text);
    if (!m.matches()) {
      return Optional.empty();
    }

    String receiver = m.group(RECEIVER) == null ? "" : m.group(RECEIVER).trim();
    String name = m.group(NAME);
    String params = m.group(PARAMS) == null ? "()" : m.group(PARAMS);
    String returns = m.group(TAIL).trim();
    String description = "";

    Gap gap = lastGap(text);
    if (gap != null) {
      description = text.substring(gap.end()).trim();
      int tailStart = m.group(PARAMS) != null ? m.end(PARAMS) : m.end(NAME);
      if (gap.start() >= tailStart) {
        returns = text.substring(tailStart, gap.start()).trim();
      }
    }

    return Optional.of(
        new FunctionRecord(
            name,
            canonicalSignature(receiver, name, params, returns),
            description,
            receiver,
            params,
            returns,
            ""));
  }

  public static String canonicalSignature(
      String receiver, String name, String params, String returns) {
    StringBuilder sb = new StringBuilder("func");
    if (!receiver.isEmpty()) {
      sb.append(" (").append(receiver).append(')');
    }
    sb.append(' ').append(name).append(params);
    if (!returns.isEmpty()) {
      sb.append(' ').append(returns);
    }
    return sb.toString();
  }

  private Gap lastGap(String text) {
    Matcher g = descriptionGap.matcher(text);
    Gap last = null;
    while (g.find()) {
      last = new Gap(g.start(), g.end());
    }
    return last;
  }

  private record Gap(int start, int end) {}
}
