package com.gentoro.godex.indexing;

import com.gentoro.godex.exception.ErrorDetails;
import com.gentoro.godex.model.PackageRecord;
import java.util.List;

/**
 * Outcome of indexing several packages.
 *
 * @param packages records of the packages that were parsed, in input order
 * @param failures one entry per package that could not be parsed, in input order
 */
public record IndexingReport(List<PackageRecord> packages, List<PackageFailure> failures) {

  public IndexingReport {
    packages = packages == null ? List.of() : List.copyOf(packages);
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  /** A package that was skipped and why. */
  public record PackageFailure(String packagePath, ErrorDetails error) {}
}
