package com.gentoro.godex.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Flat catalog entry for one function, method or type of a package.
 *
 * <p>{@code receiver}, {@code params} and {@code returns} are empty for types; {@code typeKind},
 * {@code fields} and {@code methods} are empty for functions and methods.
 */
public record ApiItem(
    String itemId,
    ApiItemKind kind,
    String name,
    String signature,
    String packageName,
    String importPath,
    String receiver,
    String params,
    String returns,
    String typeKind,
    List<String> fields,
    List<String> methods,
    String sourceDescription) {

  public ApiItem {
    Objects.requireNonNull(itemId, "itemId");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(name, "name");
    signature = Objects.requireNonNullElse(signature, "");
    packageName = Objects.requireNonNullElse(packageName, "");
    importPath = Objects.requireNonNullElse(importPath, "");
    receiver = Objects.requireNonNullElse(receiver, "");
    params = Objects.requireNonNullElse(params, "");
    returns = Objects.requireNonNullElse(returns, "");
    typeKind = Objects.requireNonNullElse(typeKind, "");
    fields = fields == null ? List.of() : List.copyOf(fields);
    methods = methods == null ? List.of() : List.copyOf(methods);
    sourceDescription = Objects.requireNonNullElse(sourceDescription, "");
  }
}
