package com.gentoro.godex.parser;

/** What a single documentation line starts. */
public enum LineKind {
  PACKAGE_DECL,
  FUNCTION_DECL,
  TYPE_DECL,
  SKIP
}
