package com.gentoro.godex.parser;

import com.gentoro.godex.model.TypeKind;
import com.gentoro.godex.model.TypeRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a {@code type Name struct|interface} declaration and the indented body that follows it.
 *
 * <p>There is no end marker to rely on: the body is every following line that begins with a space
 * or a tab, and the first line that does not is left for the caller. Tabs and spaces are treated
 * alike. Inside the body, blank and comment-only lines are ignored, {@code func} lines become
 * methods and everything else becomes a field.
 */
public class TypeBlockExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.godex.logging.LoggingService.getLogger(TypeBlockExtractor.class);

  private static final Pattern TYPE_HEADER =
      Pattern.compile("^type\\s+([A-Z]\\w*)\\s+(struct|interface)(?!\\w)");
  private static final Pattern FIELD = Pattern.compile("^(\\w+)\\s+(\\S+)(?:\\s+(.*))?$");

  /** The extracted type and the index of the first line that was not consumed. */
  public record TypeBlock(TypeRecord type, int nextIndex) {}

  public boolean isTypeHeader(String line) {
    return TYPE_HEADER.matcher(LineClassifier.normalize(line)).find();
  }

  /**
   * Extract the type declared at {@code lines.get(headerIndex)} together with its body.
   *
   * @return empty when the header line is not an exported struct or interface declaration
   */
  public Optional<TypeBlock> extract(List<String> lines, int headerIndex) {
    Matcher header = TYPE_HEADER.matcher(LineClassifier.normalize(lines.get(headerIndex)));
    if (!header.find()) {
      return Optional.empty();
    }
    String name = header.group(1);
    TypeKind kind =
        TypeKind.fromKeyword(header.group(2))
            .orElseThrow(() -> new IllegalStateException("Unexpected kind " + header.group(2)));

    TypeBody body = new TypeBody(headerIndex + 1);
    List<String> fields = new ArrayList<>();
    List<String> methods = new ArrayList<>();
    while (body.cursor < lines.size() && continuesBody(lines.get(body.cursor))) {
      String content = lines.get(body.cursor).trim();
      body.cursor++;
      if (content.isEmpty() || content.startsWith("//")) {
        continue;
      }
      if (isMethodLine(content)) {
        methods.add(content);
      } else {
        fields.add(renderField(content));
      }
    }

    log.trace(
        "type {} {}: body lines [{}, {}), {} fields, {} methods",
        name,
        kind,
        body.startLine,
        body.cursor,
        fields.size(),
        methods.size());
    return Optional.of(
        new TypeBlock(new TypeRecord(name, kind, "", fields, methods, ""), body.cursor));
  }

  /** Body lines led by the {@code func} keyword, not by an identifier such as {@code funcs}. */
  static boolean isMethodLine(String content) {
    return content.equals("func") || content.startsWith("func ") || content.startsWith("func(");
  }

  /** Whether a raw, untrimmed line still belongs to the type body. */
  static boolean continuesBody(String rawLine) {
    return !rawLine.isEmpty() && (rawLine.charAt(0) == ' ' || rawLine.charAt(0) == '\t');
  }

  /** {@code Name Type rest} becomes {@code Name Type // rest}; anything else stays verbatim. */
  static String renderField(String content) {
    Matcher m = FIELD.matcher(content);
    if (!m.matches() || m.group(3) == null) {
      return content;
    }
    String rest = m.group(3).trim();
    if (rest.startsWith("//")) {
      rest = rest.substring(2).trim();
    }
    if (rest.isEmpty()) {
      return content;
    }
    return m.group(1) + " " + m.group(2) + " // " + rest;
  }

  // Body of the type currently being read: where it started and where the cursor is.
  private static final class TypeBody {
    final int startLine;
    int cursor;

    TypeBody(int startLine) {
      this.startLine = startLine;
      this.cursor = startLine;
    }
  }
}
