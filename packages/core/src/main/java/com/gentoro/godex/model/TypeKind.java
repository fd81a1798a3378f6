package com.gentoro.godex.model;

import java.util.Locale;
import java.util.Optional;

/** Composite type kinds recovered from documentation. No other kind is ever produced. */
public enum TypeKind {
  STRUCT("struct"),
  INTERFACE("interface");

  private final String keyword;

  TypeKind(String keyword) {
    this.keyword = keyword;
  }

  /** The Go keyword, as it appears in documentation and in rendered chunks. */
  public String keyword() {
    return keyword;
  }

  public static Optional<TypeKind> fromKeyword(String keyword) {
    if (keyword == null) return Optional.empty();
    String k = keyword.trim().toLowerCase(Locale.ROOT);
    for (TypeKind kind : values()) {
      if (kind.keyword.equals(k)) return Optional.of(kind);
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return keyword;
  }
}
