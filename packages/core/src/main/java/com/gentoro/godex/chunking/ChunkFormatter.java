package com.gentoro.godex.chunking;

import com.gentoro.godex.model.FunctionRecord;
import com.gentoro.godex.model.PackageRecord;
import com.gentoro.godex.model.TypeRecord;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Renders a package's functions and types into independent chunks.
 *
 * <p>Function chunk:
 *
 * <pre>
 * Package: cache
 * Function: Get
 * Signature: func (c *Client) Get(key string) (string, error)
 * Description: returns the stored value
 * </pre>
 *
 * <p>Type chunk (the {@code Methods:} section only appears when there are methods):
 *
 * <pre>
 * Package: cache
 * Type: Config
 * Kind: struct
 * Fields:
 * Name string
 * Timeout int // seconds
 * </pre>
 *
 * Functions are emitted first, then types, each in record order. Output depends only on the input
 * record.
 */
public class ChunkFormatter {
  public static final String DEFAULT_EMPTY_FIELDS_PLACEHOLDER = "  (no exported fields)";

  private final String emptyFieldsPlaceholder;

  public ChunkFormatter() {
    this(DEFAULT_EMPTY_FIELDS_PLACEHOLDER);
  }

  public ChunkFormatter(String emptyFieldsPlaceholder) {
    this.emptyFieldsPlaceholder =
        emptyFieldsPlaceholder == null || emptyFieldsPlaceholder.isBlank()
            ? DEFAULT_EMPTY_FIELDS_PLACEHOLDER
            : emptyFieldsPlaceholder;
  }

  public static ChunkFormatter from(Configuration cfg) {
    if (cfg == null) return new ChunkFormatter();
    return new ChunkFormatter(
        cfg.getString("chunking.empty-fields-placeholder", DEFAULT_EMPTY_FIELDS_PLACEHOLDER));
  }

  public List<Chunk> format(PackageRecord pkg) {
    List<Chunk> chunks = new ArrayList<>(pkg.functions().size() + pkg.types().size());
    for (FunctionRecord fn : pkg.functions()) {
      chunks.add(
          new Chunk(
              functionId(pkg, fn), ChunkKind.FUNCTION, pkg.name(), fn.name(), render(pkg, fn)));
    }
    for (TypeRecord type : pkg.types()) {
      chunks.add(
          new Chunk(typeId(pkg, type), ChunkKind.TYPE, pkg.name(), type.name(), render(pkg, type)));
    }
    return chunks;
  }

  public String render(PackageRecord pkg, FunctionRecord fn) {
    String text =
        "Package: "
            + pkg.name()
            + "\nFunction: "
            + fn.name()
            + "\nSignature: "
            + fn.signature()
            + "\nDescription: "
            + fn.description();
    return text.strip();
  }

  public String render(PackageRecord pkg, TypeRecord type) {
    StringBuilder sb = new StringBuilder();
    sb.append("Package: ").append(pkg.name()).append('\n');
    sb.append("Type: ").append(type.name()).append('\n');
    sb.append("Kind: ").append(type.kind().keyword()).append('\n');
    sb.append("Fields:\n");
    sb.append(type.fields().isEmpty() ? emptyFieldsPlaceholder : String.join("\n", type.fields()));
    String text = sb.toString().strip();
    if (!type.methods().isEmpty()) {
      text += "\nMethods:\n" + String.join("\n", type.methods());
    }
    return text;
  }

  public static String functionId(PackageRecord pkg, FunctionRecord fn) {
    return pkg.importPath() + ":" + fn.signature();
  }

  public static String typeId(PackageRecord pkg, TypeRecord type) {
    return pkg.importPath() + ":type:" + type.name();
  }
}
