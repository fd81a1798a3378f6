package com.gentoro.godex.parser;

import com.gentoro.godex.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * Tunables for the documentation heuristics.
 *
 * @param continuationIndent lines starting with at least this many spaces are skipped as
 *     continuation/alignment lines
 * @param descriptionGap minimum run of spaces that separates a signature from its inline
 *     description
 */
public record ParserSettings(int continuationIndent, int descriptionGap) {
  public static final int DEFAULT_CONTINUATION_INDENT = 10;
  public static final int DEFAULT_DESCRIPTION_GAP = 4;

  public ParserSettings {
    if (continuationIndent <= 0) {
      throw new ConfigException("parser.continuation-indent must be positive: " + continuationIndent);
    }
    if (descriptionGap <= 0) {
      throw new ConfigException("parser.description-gap must be positive: " + descriptionGap);
    }
  }

  public static ParserSettings defaults() {
    return new ParserSettings(DEFAULT_CONTINUATION_INDENT, DEFAULT_DESCRIPTION_GAP);
  }

  public static ParserSettings from(Configuration cfg) {
    if (cfg == null) return defaults();
    return new ParserSettings(
        cfg.getInt("parser.continuation-indent", DEFAULT_CONTINUATION_INDENT),
        cfg.getInt("parser.description-gap", DEFAULT_DESCRIPTION_GAP));
  }
}
