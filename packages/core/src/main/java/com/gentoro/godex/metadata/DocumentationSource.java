package com.gentoro.godex.metadata;

import com.gentoro.godex.exception.DocumentationUnavailableException;
import com.gentoro.godex.model.PackageMetadata;

/** Supplies the raw {@code go doc -all} text for a package. */
@FunctionalInterface
public interface DocumentationSource {

  /**
   * @return documentation text, possibly empty
   * @throws DocumentationUnavailableException when the text cannot be produced
   */
  String documentation(PackageMetadata metadata);
}
