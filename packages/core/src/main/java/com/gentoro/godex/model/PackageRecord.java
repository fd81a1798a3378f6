package com.gentoro.godex.model;

import com.gentoro.godex.exception.MetadataUnavailableException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One package's public interface: functions and types in documentation order.
 *
 * <p>The record owns copies of its lists; callers cannot mutate them.
 */
public record PackageRecord(
    String name,
    String importPath,
    List<FunctionRecord> functions,
    List<TypeRecord> types,
    String description) {

  public PackageRecord {
    if (name == null || name.isBlank()) {
      throw new MetadataUnavailableException(
          "Package record requires a package name",
          Map.of("importPath", String.valueOf(importPath)));
    }
    if (importPath == null) {
      throw new MetadataUnavailableException(
          "Package record requires an import path", Map.of("name", name));
    }
    functions = functions == null ? List.of() : List.copyOf(functions);
    types = types == null ? List.of() : List.copyOf(types);
    description = Objects.requireNonNullElse(description, "");
  }

  public boolean isEmpty() {
    return functions.isEmpty() && types.isEmpty();
  }
}
