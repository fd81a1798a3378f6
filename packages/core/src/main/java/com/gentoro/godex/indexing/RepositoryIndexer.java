package com.gentoro.godex.indexing;

import com.gentoro.godex.exception.ExceptionUtil;
import com.gentoro.godex.exception.GodexException;
import com.gentoro.godex.metadata.DocumentationSource;
import com.gentoro.godex.metadata.MetadataProvider;
import com.gentoro.godex.model.PackageMetadata;
import com.gentoro.godex.model.PackageRecord;
import com.gentoro.godex.parser.GoDocParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses many packages one after the other. Each package is independent: a failure to resolve
 * metadata, fetch documentation or parse one package is recorded in the report and the next
 * package is processed.
 */
public class RepositoryIndexer {
  private static final org.slf4j.Logger log =
      com.gentoro.godex.logging.LoggingService.getLogger(RepositoryIndexer.class);

  private final MetadataProvider metadataProvider;
  private final DocumentationSource documentationSource;
  private final GoDocParser parser;

  public RepositoryIndexer(
      MetadataProvider metadataProvider,
      DocumentationSource documentationSource,
      GoDocParser parser) {
    this.metadataProvider = Objects.requireNonNull(metadataProvider, "metadataProvider");
    this.documentationSource = Objects.requireNonNull(documentationSource, "documentationSource");
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  public IndexingReport index(List<String> packagePaths) {
    List<PackageRecord> packages = new ArrayList<>();
    List<IndexingReport.PackageFailure> failures = new ArrayList<>();

    for (String path : packagePaths) {
      try {
        packages.add(indexPackage(path));
      } catch (GodexException e) {
        log.warn("Skipping package {}: {} ({})", path, e.getMessage(), e.getCode());
        failures.add(failure(path, e));
      } catch (RuntimeException e) {
        log.error("Unexpected failure while indexing package {}", path, e);
        failures.add(failure(path, e));
      }
    }

    log.info(
        "Indexed {} of {} packages ({} failed)",
        packages.size(),
        packagePaths.size(),
        failures.size());
    return new IndexingReport(packages, failures);
  }

  /** Index a single package; failures propagate to the caller. */
  public PackageRecord indexPackage(String packagePath) {
    PackageMetadata metadata = metadataProvider.resolve(packagePath);
    String docText = documentationSource.documentation(metadata);
    PackageRecord record = parser.parse(docText, metadata);
    log.debug(
        "Package {} ({}): {} functions, {} types",
        record.name(),
        record.importPath(),
        record.functions().size(),
        record.types().size());
    return record;
  }

  private static IndexingReport.PackageFailure failure(String path, RuntimeException e) {
    return new IndexingReport.PackageFailure(
        path, ExceptionUtil.toErrorDetails(e, Map.of("package", String.valueOf(path))));
  }
}
