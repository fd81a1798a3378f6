package com.gentoro.godex.metadata;

import com.gentoro.godex.exception.MetadataUnavailableException;
import com.gentoro.godex.model.PackageMetadata;

/** Supplies name and import path for a package; backed by the Go toolchain in practice. */
@FunctionalInterface
public interface MetadataProvider {

  /**
   * @param packagePath import path or directory identifying the package
   * @throws MetadataUnavailableException when the package cannot be described
   */
  PackageMetadata resolve(String packagePath);
}
