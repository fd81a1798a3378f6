package com.gentoro.godex.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.godex.catalog.ApiItem;
import com.gentoro.godex.catalog.ApiItemKind;
import com.gentoro.godex.exception.IoException;
import com.gentoro.godex.exception.SerializationException;
import com.gentoro.godex.exception.ValidationException;
import com.gentoro.godex.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.configuration2.Configuration;

/**
 * Writes catalog items as Markdown files and keeps a per-version {@code index.json}.
 *
 * <p>Layout: {@code <baseDir>/<repo>/<version>/<package>/<kind>/<name>.md}. Every path segment is
 * slugged. Writing an item that already exists replaces both the file and its index entry.
 */
public class DocStore {
  private static final org.slf4j.Logger log =
      com.gentoro.godex.logging.LoggingService.getLogger(DocStore.class);

  public static final String DEFAULT_BASE_DIR = "docs/generated";
  public static final String DEFAULT_GENERATOR = "godex";
  private static final Pattern SLUG = Pattern.compile("[^A-Za-z0-9._-]+");

  private final Path baseDir;
  private final String generator;
  private final Clock clock;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public DocStore(Path baseDir) {
    this(baseDir, DEFAULT_GENERATOR, Clock.systemUTC());
  }

  public DocStore(Path baseDir, String generator, Clock clock) {
    this.baseDir = baseDir;
    this.generator = generator;
    this.clock = clock;
  }

  public static DocStore from(Configuration cfg) {
    return new DocStore(
        Paths.get(cfg.getString("store.base-dir", DEFAULT_BASE_DIR)),
        cfg.getString("store.generator", DEFAULT_GENERATOR),
        Clock.systemUTC());
  }

  public boolean exists(String repoSlug, String version, ApiItem item) {
    return Files.exists(docPath(repoSlug, version, item));
  }

  /**
   * Write {@code content} for {@code item} and record it in the version index.
   *
   * @return path of the Markdown file
   */
  public Path upsert(String repoSlug, String version, ApiItem item, String content) {
    Path path = docPath(repoSlug, version, item);
    String generatedAt = now();
    try {
      Files.createDirectories(path.getParent());
      Files.writeString(path, renderMarkdown(item, content, generatedAt), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to write doc file " + path, e);
    }
    updateIndex(repoSlug, version, item, path, generatedAt);
    log.debug("Stored {} {} at {}", item.kind(), item.itemId(), path);
    return path;
  }

  public Path docPath(String repoSlug, String version, ApiItem item) {
    return versionDir(repoSlug, version)
        .resolve(safeSlug(item.packageName()))
        .resolve(safeSlug(item.kind().label()))
        .resolve(safeSlug(itemFilename(item)) + ".md");
  }

  public Path indexPath(String repoSlug, String version) {
    return versionDir(repoSlug, version).resolve("index.json");
  }

  private Path versionDir(String repoSlug, String version) {
    if (repoSlug == null || repoSlug.isBlank()) {
      throw new ValidationException("Repository slug must not be blank");
    }
    if (version == null || version.isBlank()) {
      throw new ValidationException("Version key must not be blank for repository " + repoSlug);
    }
    return baseDir.resolve(safeSlug(repoSlug)).resolve(safeSlug(version));
  }

  /** Current index, or an empty one when none exists or it cannot be read. */
  public DocIndex readIndex(String repoSlug, String version) {
    Path indexPath = indexPath(repoSlug, version);
    if (Files.exists(indexPath)) {
      try {
        return mapper.readValue(indexPath.toFile(), DocIndex.class);
      } catch (IOException e) {
        log.warn("Ignoring unreadable index {}: {}", indexPath, e.getMessage());
      }
    }
    return new DocIndex(repoSlug, version, now());
  }

  private void updateIndex(
      String repoSlug, String version, ApiItem item, Path docPath, String generatedAt) {
    Path indexPath = indexPath(repoSlug, version);
    DocIndex index = readIndex(repoSlug, version);
    index.upsert(
        new DocIndex.Entry(
            item.itemId(),
            item.kind().label(),
            item.name(),
            item.packageName(),
            item.importPath(),
            item.signature(),
            baseDir.relativize(docPath).toString().replace('\\', '/'),
            generatedAt,
            generator));
    index.setUpdatedAt(now());

    String json;
    try {
      json = mapper.writeValueAsString(index);
    } catch (IOException e) {
      throw new SerializationException("Failed to serialize index " + indexPath, e);
    }
    try {
      Files.createDirectories(indexPath.getParent());
      Files.writeString(indexPath, json, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to write index " + indexPath, e);
    }
  }

  String renderMarkdown(ApiItem item, String content, String generatedAt) {
    List<String> frontMatter =
        List.of(
            "---",
            "id: " + item.itemId(),
            "kind: " + item.kind().label(),
            "name: " + item.name(),
            "package: " + item.packageName(),
            "import_path: " + item.importPath(),
            "signature: " + item.signature(),
            "generated_at: " + generatedAt,
            "generator: " + generator,
            "---",
            "");
    return String.join("\n", frontMatter) + (content == null ? "" : content.strip()) + "\n";
  }

  static String itemFilename(ApiItem item) {
    if (item.kind() == ApiItemKind.METHOD && !item.receiver().isEmpty()) {
      return item.receiver() + "_" + item.name();
    }
    return item.name();
  }

  static String safeSlug(String value) {
    if (value == null || value.isEmpty()) {
      return "unknown";
    }
    String slug = SLUG.matcher(value).replaceAll("_");
    slug = trimUnderscores(slug);
    return slug.isEmpty() ? "unknown" : slug;
  }

  private static String trimUnderscores(String s) {
    int start = 0;
    int end = s.length();
    while (start < end && s.charAt(start) == '_') start++;
    while (end > start && s.charAt(end - 1) == '_') end--;
    return s.substring(start, end);
  }

  private String now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();
  }
}
