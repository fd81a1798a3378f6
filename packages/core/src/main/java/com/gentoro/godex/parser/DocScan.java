package com.gentoro.godex.parser;

import com.gentoro.godex.model.FunctionRecord;
import com.gentoro.godex.model.TypeRecord;
import java.util.List;
import java.util.Objects;

/**
 * Everything one scan of a documentation text recovered, before package metadata is attached.
 *
 * @param packageName last package declared in the text, empty if none
 * @param declaredImportPath import path from the package line's import comment, empty if none
 * @param functions functions and methods in order of appearance
 * @param types types in order of appearance
 */
public record DocScan(
    String packageName,
    String declaredImportPath,
    List<FunctionRecord> functions,
    List<TypeRecord> types) {

  public DocScan {
    packageName = Objects.requireNonNullElse(packageName, "");
    declaredImportPath = Objects.requireNonNullElse(declaredImportPath, "");
    functions = functions == null ? List.of() : List.copyOf(functions);
    types = types == null ? List.of() : List.copyOf(types);
  }
}
