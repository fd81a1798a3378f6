package com.gentoro.godex.catalog;

public enum ApiItemKind {
  FUNCTION("function"),
  METHOD("method"),
  TYPE("type");

  private final String label;

  ApiItemKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
