package com.gentoro.godex.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/** Contents of a version's {@code index.json}. */
public class DocIndex {
  @JsonProperty("repo")
  private String repo;

  @JsonProperty("version")
  private String version;

  @JsonProperty("updated_at")
  private String updatedAt;

  @JsonProperty("items")
  private List<Entry> items = new ArrayList<>();

  public DocIndex() {}

  public DocIndex(String repo, String version, String updatedAt) {
    this.repo = repo;
    this.version = version;
    this.updatedAt = updatedAt;
  }

  public String getRepo() {
    return repo;
  }

  public String getVersion() {
    return version;
  }

  public String getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(String updatedAt) {
    this.updatedAt = updatedAt;
  }

  public List<Entry> getItems() {
    return items;
  }

  /** Replace the entry with the same id, or append. */
  public void upsert(Entry entry) {
    for (int i = 0; i < items.size(); i++) {
      if (items.get(i).getId().equals(entry.getId())) {
        items.set(i, entry);
        return;
      }
    }
    items.add(entry);
  }

  public static class Entry {
    @JsonProperty("id")
    private String id;

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("name")
    private String name;

    @JsonProperty("package")
    private String packageName;

    @JsonProperty("import_path")
    private String importPath;

    @JsonProperty("signature")
    private String signature;

    @JsonProperty("path")
    private String path;

    @JsonProperty("generated_at")
    private String generatedAt;

    @JsonProperty("generator")
    private String generator;

    public Entry() {}

    public Entry(
        String id,
        String kind,
        String name,
        String packageName,
        String importPath,
        String signature,
        String path,
        String generatedAt,
        String generator) {
      this.id = id;
      this.kind = kind;
      this.name = name;
      this.packageName = packageName;
      this.importPath = importPath;
      this.signature = signature;
      this.path = path;
      this.generatedAt = generatedAt;
      this.generator = generator;
    }

    public String getId() {
      return id;
    }

    public String getKind() {
      return kind;
    }

    public String getName() {
      return name;
    }

    public String getPackageName() {
      return packageName;
    }

    public String getImportPath() {
      return importPath;
    }

    public String getSignature() {
      return signature;
    }

    public String getPath() {
      return path;
    }

    public String getGeneratedAt() {
      return generatedAt;
    }

    public String getGenerator() {
      return generator;
    }
  }
}
