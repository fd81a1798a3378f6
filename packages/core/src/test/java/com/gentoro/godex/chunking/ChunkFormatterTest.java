package com.gentoro.godex.chunking;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.godex.model.FunctionRecord;
import com.gentoro.godex.model.PackageRecord;
import com.gentoro.godex.model.TypeKind;
import com.gentoro.godex.model.TypeRecord;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChunkFormatterTest {

  private static final FunctionRecord GET =
      new FunctionRecord(
          "Get",
          "func (c *Client) Get(key string) (string, error)",
          "returns the stored value",
          "c *Client",
          "(key string)",
          "(string, error)",
          "cache");
  private static final FunctionRecord NEW =
      new FunctionRecord("New", "func New() *Client", "", "", "()", "*Client", "cache");
  private static final TypeRecord CONFIG =
      new TypeRecord(
          "Config",
          TypeKind.STRUCT,
          "",
          List.of("Name string", "Timeout int // seconds"),
          List.of(),
          "cache");
  private static final TypeRecord STORE =
      new TypeRecord(
          "Store", TypeKind.INTERFACE, "", List.of(), List.of("func Close() error"), "cache");

  private static final PackageRecord PKG =
      new PackageRecord(
          "cache", "example.com/cache", List.of(GET, NEW), List.of(CONFIG, STORE), "");

  private final ChunkFormatter formatter = new ChunkFormatter();

  @Test
  @DisplayName("Function chunk lists package, name, signature and description on labeled lines")
  void functionChunk() {
    Chunk chunk = formatter.format(PKG).get(0);

    assertEquals(
        "Package: cache\n"
            + "Function: Get\n"
            + "Signature: func (c *Client) Get(key string) (string, error)\n"
            + "Description: returns the stored value",
        chunk.content());
    assertEquals(ChunkKind.FUNCTION, chunk.kind());
    assertEquals("example.com/cache:func (c *Client) Get(key string) (string, error)", chunk.id());
    assertEquals("cache", chunk.packageName());
    assertEquals("Get", chunk.name());
  }

  @Test
  @DisplayName("Empty description leaves a bare label")
  void functionChunkWithoutDescription() {
    assertEquals(
        "Package: cache\nFunction: New\nSignature: func New() *Client\nDescription:",
        formatter.format(PKG).get(1).content());
  }

  @Test
  @DisplayName("Type chunk lists fields and omits the methods section when there are none")
  void typeChunkWithFields() {
    Chunk chunk = formatter.format(PKG).get(2);

    assertEquals(
        "Package: cache\n"
            + "Type: Config\n"
            + "Kind: struct\n"
            + "Fields:\n"
            + "Name string\n"
            + "Timeout int // seconds",
        chunk.content());
    assertEquals(ChunkKind.TYPE, chunk.kind());
    assertEquals("example.com/cache:type:Config", chunk.id());
  }

  @Test
  @DisplayName("Type without fields gets the placeholder; methods section is appended")
  void typeChunkWithPlaceholderAndMethods() {
    assertEquals(
        "Package: cache\n"
            + "Type: Store\n"
            + "Kind: interface\n"
            + "Fields:\n"
            + "  (no exported fields)\n"
            + "Methods:\n"
            + "func Close() error",
        formatter.format(PKG).get(3).content());
  }

  @Test
  @DisplayName("Functions come first, then types, each in record order")
  void emissionOrder() {
    assertEquals(
        List.of("Get", "New", "Config", "Store"),
        formatter.format(PKG).stream().map(Chunk::name).toList());
  }

  @Test
  @DisplayName("Formatting the same record twice yields identical chunks")
  void deterministic() {
    List<Chunk> first = formatter.format(PKG);
    List<Chunk> second = formatter.format(PKG);

    assertEquals(first, second);
    for (int i = 0; i < first.size(); i++) {
      assertArrayEquals(
          first.get(i).content().getBytes(StandardCharsets.UTF_8),
          second.get(i).content().getBytes(StandardCharsets.UTF_8));
    }
  }

  @Test
  @DisplayName("Placeholder can be configured")
  void configuredPlaceholder() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("chunking.empty-fields-placeholder", "(none)");

    String content = ChunkFormatter.from(cfg).format(PKG).get(3).content();

    assertTrue(content.contains("Fields:\n(none)\nMethods:"), content);
  }

  @Test
  @DisplayName("Empty package produces no chunks")
  void emptyPackage() {
    PackageRecord empty = new PackageRecord("foo", "example.com/foo", List.of(), List.of(), "");
    assertTrue(formatter.format(empty).isEmpty());
  }
}
