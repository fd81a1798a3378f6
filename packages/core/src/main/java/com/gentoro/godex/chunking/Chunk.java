package com.gentoro.godex.chunking;

import java.util.Objects;

/**
 * Self-contained text block describing one function or one type, ready for embedding.
 *
 * <p>Only plain strings are kept: a chunk never references the record it was rendered from.
 *
 * @param id stable identifier, {@code importPath:signature} or {@code importPath:type:Name}
 * @param kind what the chunk describes
 * @param packageName package the member belongs to
 * @param name function or type name
 * @param content rendered text
 */
public record Chunk(String id, ChunkKind kind, String packageName, String name, String content) {

  public Chunk {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(content, "content");
    packageName = Objects.requireNonNullElse(packageName, "");
    name = Objects.requireNonNullElse(name, "");
  }

  @Override
  public String toString() {
    return "Chunk{id='"
        + id
        + "', kind="
        + kind
        + ", contentLength="
        + content.length()
        + '}';
  }
}
