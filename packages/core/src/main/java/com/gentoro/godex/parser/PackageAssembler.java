package com.gentoro.godex.parser;

import com.gentoro.godex.model.FunctionRecord;
import com.gentoro.godex.model.PackageMetadata;
import com.gentoro.godex.model.PackageRecord;
import com.gentoro.godex.model.TypeRecord;
import java.util.List;

/**
 * Combines toolchain metadata with the records of one documentation scan. Records that were read
 * before any {@code package} line are attributed to the metadata's package name.
 */
public class PackageAssembler {
  private static final org.slf4j.Logger log =
      com.gentoro.godex.logging.LoggingService.getLogger(PackageAssembler.class);

  public PackageRecord assemble(PackageMetadata metadata, DocScan scan) {
    if (!scan.packageName().isEmpty() && !scan.packageName().equals(metadata.name())) {
      log.debug(
          "Documentation declares package '{}' but metadata names '{}' ({})",
          scan.packageName(),
          metadata.name(),
          metadata.importPath());
    }

    List<FunctionRecord> functions =
        scan.functions().stream()
            .map(f -> f.packageName().isEmpty() ? f.withPackageName(metadata.name()) : f)
            .toList();
    List<TypeRecord> types =
        scan.types().stream()
            .map(t -> t.packageName().isEmpty() ? t.withPackageName(metadata.name()) : t)
            .toList();

    return new PackageRecord(
        metadata.name(), metadata.importPath(), functions, types, metadata.doc());
  }
}
