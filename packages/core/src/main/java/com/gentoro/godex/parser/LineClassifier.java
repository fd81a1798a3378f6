package com.gentoro.godex.parser;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides what a documentation line starts. Each declaration kind has its own named predicate;
 * function declarations are tried before type declarations and anything left over is {@link
 * LineKind#SKIP}.
 */
public class LineClassifier {
  private static final Pattern PACKAGE_LINE = Pattern.compile("^package\\s+(\\S+)");
  private static final Pattern IMPORT_COMMENT = Pattern.compile("//\\s*import\\s+\"([^\"]*)\"");
  private static final Set<String> SECTION_BANNERS = Set.of("CONSTANTS", "VARIABLES");

  private final String continuationPrefix;
  private final SignatureExtractor signatures;
  private final TypeBlockExtractor typeBlocks;

  public LineClassifier(
      ParserSettings settings, SignatureExtractor signatures, TypeBlockExtractor typeBlocks) {
    this.continuationPrefix = " ".repeat(settings.continuationIndent());
    this.signatures = signatures;
    this.typeBlocks = typeBlocks;
  }

  /** Classify {@code lines.get(index)}. Lookahead is left to the block extractor. */
  public LineKind classify(List<String> lines, int index) {
    return classify(lines.get(index));
  }

  public LineKind classify(String rawLine) {
    String line = normalize(rawLine);
    if (isPackageDeclaration(line)) return LineKind.PACKAGE_DECL;
    if (isSkippable(line)) return LineKind.SKIP;
    if (signatures.matches(line)) return LineKind.FUNCTION_DECL;
    if (typeBlocks.isTypeHeader(line)) return LineKind.TYPE_DECL;
    return LineKind.SKIP;
  }

  public boolean isPackageDeclaration(String line) {
    return PACKAGE_LINE.matcher(line).find();
  }

  public boolean isSkippable(String line) {
    return line.isEmpty()
        || line.startsWith(continuationPrefix)
        || SECTION_BANNERS.contains(line.trim());
  }

  /** Package name declared by a {@code package} line. */
  public Optional<String> packageName(String line) {
    Matcher m = PACKAGE_LINE.matcher(normalize(line));
    return m.find() ? Optional.of(m.group(1)) : Optional.empty();
  }

  /** Import path from the {@code // import "path"} comment go doc appends to package lines. */
  public Optional<String> declaredImportPath(String line) {
    Matcher m = IMPORT_COMMENT.matcher(normalize(line));
    return m.find() ? Optional.of(m.group(1)) : Optional.empty();
  }

  /** Strip trailing whitespace, including a stray carriage return. */
  static String normalize(String rawLine) {
    return rawLine == null ? "" : rawLine.stripTrailing();
  }
}
