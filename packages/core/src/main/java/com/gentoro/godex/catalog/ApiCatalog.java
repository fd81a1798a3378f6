package com.gentoro.godex.catalog;

import com.gentoro.godex.chunking.ChunkFormatter;
import com.gentoro.godex.model.FunctionRecord;
import com.gentoro.godex.model.PackageRecord;
import com.gentoro.godex.model.TypeRecord;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattens package records into catalog items: for each package its functions and methods first,
 * then its types. Item ids match the ids of the corresponding chunks.
 */
public class ApiCatalog {

  /** All items of {@code packages}. */
  public List<ApiItem> collect(List<PackageRecord> packages) {
    return collect(packages, 0);
  }

  /**
   * Items of {@code packages}, truncated to {@code maxItems}.
   *
   * @param maxItems upper bound on the number of items; zero or negative means no limit
   */
  public List<ApiItem> collect(List<PackageRecord> packages, int maxItems) {
    List<ApiItem> items = new ArrayList<>();
    for (PackageRecord pkg : packages) {
      for (FunctionRecord fn : pkg.functions()) {
        items.add(toItem(pkg, fn));
      }
      for (TypeRecord type : pkg.types()) {
        items.add(toItem(pkg, type));
      }
    }
    if (maxItems > 0 && items.size() > maxItems) {
      return List.copyOf(items.subList(0, maxItems));
    }
    return List.copyOf(items);
  }

  static ApiItem toItem(PackageRecord pkg, FunctionRecord fn) {
    return new ApiItem(
        ChunkFormatter.functionId(pkg, fn),
        fn.isMethod() ? ApiItemKind.METHOD : ApiItemKind.FUNCTION,
        fn.name(),
        fn.signature(),
        pkg.name(),
        pkg.importPath(),
        fn.receiver(),
        fn.params(),
        fn.returns(),
        "",
        List.of(),
        List.of(),
        fn.description());
  }

  static ApiItem toItem(PackageRecord pkg, TypeRecord type) {
    return new ApiItem(
        ChunkFormatter.typeId(pkg, type),
        ApiItemKind.TYPE,
        type.name(),
        type.declaration(),
        pkg.name(),
        pkg.importPath(),
        "",
        "",
        "",
        type.kind().keyword(),
        type.fields(),
        type.methods(),
        type.description());
  }
}
