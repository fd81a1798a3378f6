package com.gentoro.godex.model;

import java.util.Objects;

/**
 * A documented function or method.
 *
 * @param name exported identifier
 * @param signature canonical form: {@code func [(receiver)] Name(params) [returns]}
 * @param description inline description, possibly empty
 * @param receiver method receiver without parentheses; empty for free functions
 * @param params parenthesized parameter list, {@code "()"} when absent
 * @param returns return clause, possibly empty
 * @param packageName package declared in the documentation before this record, possibly empty
 */
public record FunctionRecord(
    String name,
    String signature,
    String description,
    String receiver,
    String params,
    String returns,
    String packageName) {

  public FunctionRecord {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(signature, "signature");
    description = Objects.requireNonNullElse(description, "");
    receiver = Objects.requireNonNullElse(receiver, "");
    params = Objects.requireNonNullElse(params, "()");
    returns = Objects.requireNonNullElse(returns, "");
    packageName = Objects.requireNonNullElse(packageName, "");
  }

  public boolean isMethod() {
    return !receiver.isEmpty();
  }

  /** Copy of this record attributed to {@code pkg}. */
  public FunctionRecord withPackageName(String pkg) {
    return new FunctionRecord(name, signature, description, receiver, params, returns, pkg);
  }
}
