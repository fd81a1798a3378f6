package com.gentoro.godex.parser;

import com.gentoro.godex.model.FunctionRecord;
import com.gentoro.godex.model.PackageMetadata;
import com.gentoro.godex.model.PackageRecord;
import com.gentoro.godex.model.TypeRecord;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@code go doc -all} output into package records.
 *
 * <p>The text is read once, top to bottom. Each line is classified and handed to the matching
 * extractor; a type declaration consumes its indented body and scanning resumes at the first line
 * after it. The cursor never moves backwards. Lines that match no rule are skipped, so malformed
 * input never fails the scan.
 *
 * <p>Instances hold no per-scan state and can be reused across packages.
 */
public class GoDocParser {
  private static final org.slf4j.Logger log =
      com.gentoro.godex.logging.LoggingService.getLogger(GoDocParser.class);

  private final LineClassifier classifier;
  private final SignatureExtractor signatures;
  private final TypeBlockExtractor typeBlocks;
  private final PackageAssembler assembler;

  public GoDocParser() {
    this(ParserSettings.defaults());
  }

  public GoDocParser(ParserSettings settings) {
    this.signatures = new SignatureExtractor(settings);
    this.typeBlocks = new TypeBlockExtractor();
    this.classifier = new LineClassifier(settings, signatures, typeBlocks);
    this.assembler = new PackageAssembler();
  }

  /**
   * Parse one package's documentation text and attach its metadata.
   *
   * @param docText documentation text; null or empty yields a record without members
   * @param metadata package name and import path from the toolchain
   */
  public PackageRecord parse(String docText, PackageMetadata metadata) {
    return assembler.assemble(metadata, scan(docText));
  }

  /** Scan documentation text without package metadata. */
  public DocScan scan(String docText) {
    List<String> lines = splitLines(docText);
    List<FunctionRecord> functions = new ArrayList<>();
    List<TypeRecord> types = new ArrayList<>();
    String currentPackage = "";
    String declaredImportPath = "";

    int i = 0;
    while (i < lines.size()) {
      String line = lines.get(i);
      switch (classifier.classify(lines, i)) {
        case PACKAGE_DECL -> {
          // Last declaration wins.
          currentPackage = classifier.packageName(line).orElse(currentPackage);
          declaredImportPath = classifier.declaredImportPath(line).orElse(declaredImportPath);
          i++;
        }
        case FUNCTION_DECL -> {
          String pkg = currentPackage;
          signatures.extract(line).ifPresent(f -> functions.add(f.withPackageName(pkg)));
          i++;
        }
        case TYPE_DECL -> {
          TypeBlockExtractor.TypeBlock block = typeBlocks.extract(lines, i).orElse(null);
          if (block == null) {
            i++;
          } else {
            types.add(block.type().withPackageName(currentPackage));
            i = Math.max(i + 1, block.nextIndex());
          }
        }
        case SKIP -> i++;
      }
    }

    log.debug(
        "Scanned {} lines of package '{}': {} functions, {} types",
        lines.size(),
        currentPackage,
        functions.size(),
        types.size());
    return new DocScan(currentPackage, declaredImportPath, functions, types);
  }

  static List<String> splitLines(String docText) {
    if (docText == null || docText.isEmpty()) {
      return List.of();
    }
    return List.of(docText.split("\\r?\\n", -1));
  }
}
