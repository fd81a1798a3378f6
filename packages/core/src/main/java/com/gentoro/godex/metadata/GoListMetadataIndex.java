package com.gentoro.godex.metadata;

import com.gentoro.godex.exception.MetadataUnavailableException;
import com.gentoro.godex.model.PackageMetadata;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** {@link MetadataProvider} over metadata already read from {@code go list -json}. */
public class GoListMetadataIndex implements MetadataProvider {
  private final Map<String, PackageMetadata> byImportPath = new LinkedHashMap<>();

  public GoListMetadataIndex(List<PackageMetadata> packages) {
    for (PackageMetadata pkg : packages) {
      byImportPath.putIfAbsent(pkg.importPath(), pkg);
    }
  }

  public static GoListMetadataIndex fromGoList(String goListOutput) {
    return new GoListMetadataIndex(new GoListMetadataReader().read(goListOutput));
  }

  /** Import paths in the order go list reported them. */
  public List<String> importPaths() {
    return Collections.unmodifiableList(new ArrayList<>(byImportPath.keySet()));
  }

  @Override
  public PackageMetadata resolve(String packagePath) {
    PackageMetadata metadata = packagePath == null ? null : byImportPath.get(packagePath.trim());
    if (metadata == null) {
      throw new MetadataUnavailableException(
          "No go list metadata for package", Map.of("package", String.valueOf(packagePath)));
    }
    return metadata;
  }
}
