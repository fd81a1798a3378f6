package com.gentoro.godex.model;

import com.gentoro.godex.exception.MetadataUnavailableException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Package facts supplied by the toolchain rather than by the documentation text.
 *
 * @param name package name, never blank
 * @param importPath import path, never null (may be empty for ad-hoc packages)
 * @param directory source directory, possibly empty
 * @param doc package doc synopsis, possibly empty
 */
public record PackageMetadata(String name, String importPath, String directory, String doc) {

  public PackageMetadata {
    if (name == null || name.isBlank() || importPath == null) {
      Map<String, Object> context = new LinkedHashMap<>();
      context.put("name", String.valueOf(name));
      context.put("importPath", String.valueOf(importPath));
      throw new MetadataUnavailableException(
          "Package metadata requires a name and an import path", context);
    }
    name = name.trim();
    importPath = importPath.trim();
    directory = Objects.requireNonNullElse(directory, "");
    doc = Objects.requireNonNullElse(doc, "");
  }

  public static PackageMetadata of(String name, String importPath) {
    return new PackageMetadata(name, importPath, "", "");
  }
}
