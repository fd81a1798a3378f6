package com.gentoro.godex.model;

import java.util.List;
import java.util.Objects;

/**
 * A documented struct or interface with its fields and methods in documentation order.
 *
 * @param name exported identifier
 * @param kind struct or interface
 * @param description free-form description, possibly empty
 * @param fields rendered field lines
 * @param methods rendered method signatures
 * @param packageName package declared in the documentation before this record, possibly empty
 */
public record TypeRecord(
    String name,
    TypeKind kind,
    String description,
    List<String> fields,
    List<String> methods,
    String packageName) {

  public TypeRecord {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    description = Objects.requireNonNullElse(description, "");
    fields = fields == null ? List.of() : List.copyOf(fields);
    methods = methods == null ? List.of() : List.copyOf(methods);
    packageName = Objects.requireNonNullElse(packageName, "");
  }

  /** Declaration line, e.g. {@code type Config struct}. */
  public String declaration() {
    return "type " + name + " " + kind.keyword();
  }

  public TypeRecord withPackageName(String pkg) {
    return new TypeRecord(name, kind, description, fields, methods, pkg);
  }
}
