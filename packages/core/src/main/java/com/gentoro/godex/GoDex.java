package com.gentoro.godex;

import com.gentoro.godex.catalog.ApiCatalog;
import com.gentoro.godex.catalog.ApiItem;
import com.gentoro.godex.chunking.Chunk;
import com.gentoro.godex.chunking.ChunkFormatter;
import com.gentoro.godex.config.ConfigurationProvider;
import com.gentoro.godex.indexing.IndexingReport;
import com.gentoro.godex.indexing.RepositoryIndexer;
import com.gentoro.godex.logging.LoggingService;
import com.gentoro.godex.metadata.DocumentationSource;
import com.gentoro.godex.metadata.MetadataProvider;
import com.gentoro.godex.model.PackageMetadata;
import com.gentoro.godex.model.PackageRecord;
import com.gentoro.godex.parser.GoDocParser;
import com.gentoro.godex.parser.ParserSettings;
import com.gentoro.godex.store.DocStore;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Entry point wiring configuration, parser, chunk formatter, catalog and doc store together.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * GoDex godex = new GoDex("classpath:application.yaml");
 * PackageRecord pkg = godex.parse(goDocOutput, PackageMetadata.of("cache", "example.com/cache"));
 * List<Chunk> chunks = godex.format(pkg);
 * }</pre>
 */
public class GoDex {
  private static final org.slf4j.Logger log = LoggingService.getLogger(GoDex.class);

  private final Configuration configuration;
  private final GoDocParser parser;
  private final ChunkFormatter formatter;
  private final ApiCatalog catalog;
  private final int maxItems;

  public GoDex() {
    this(ConfigurationProvider.DEFAULT_LOCATION);
  }

  public GoDex(String configLocation) {
    this(new ConfigurationProvider(configLocation).config());
  }

  public GoDex(Configuration configuration) {
    this.configuration = configuration;
    LoggingService.applyConfiguration(configuration);
    this.parser = new GoDocParser(ParserSettings.from(configuration));
    this.formatter = ChunkFormatter.from(configuration);
    this.catalog = new ApiCatalog();
    this.maxItems = configuration.getInt("catalog.max-items", 0);
  }

  public PackageRecord parse(String docText, PackageMetadata metadata) {
    return parser.parse(docText, metadata);
  }

  public List<Chunk> format(PackageRecord pkg) {
    return formatter.format(pkg);
  }

  /** Parse every package in {@code packagePaths}; failing packages are reported, not thrown. */
  public IndexingReport indexRepository(
      List<String> packagePaths, MetadataProvider metadata, DocumentationSource docs) {
    return new RepositoryIndexer(metadata, docs, parser).index(packagePaths);
  }

  /** Catalog items of {@code packages}, limited by {@code catalog.max-items}. */
  public List<ApiItem> catalog(List<PackageRecord> packages) {
    return catalog.collect(packages, maxItems);
  }

  public DocStore docStore() {
    return DocStore.from(configuration);
  }

  /**
   * Store the chunk of every catalog item of {@code packages}.
   *
   * @param force rewrite items that already have a file
   * @return number of files written
   */
  public int store(
      DocStore store,
      String repoSlug,
      String version,
      List<PackageRecord> packages,
      boolean force) {
    Map<String, String> contentById = new HashMap<>();
    for (PackageRecord pkg : packages) {
      for (Chunk chunk : formatter.format(pkg)) {
        contentById.putIfAbsent(chunk.id(), chunk.content());
      }
    }

    int written = 0;
    for (ApiItem item : catalog(packages)) {
      if (!force && store.exists(repoSlug, version, item)) {
        log.debug("Skipping existing item {}", item.itemId());
        continue;
      }
      store.upsert(repoSlug, version, item, contentById.getOrDefault(item.itemId(), ""));
      written++;
    }
    log.info("Stored {} items for {} at version {}", written, repoSlug, version);
    return written;
  }
}
