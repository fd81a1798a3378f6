package com.gentoro.godex.parser;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.godex.model.FunctionRecord;
import com.gentoro.godex.model.PackageMetadata;
import com.gentoro.godex.model.PackageRecord;
import com.gentoro.godex.model.TypeKind;
import com.gentoro.godex.model.TypeRecord;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GoDocParserTest {

  static final String CACHE_DOC =
      String.join(
          "\n",
          "package cache // import \"example.com/cache\"",
          "",
          "Package cache provides a tiny key/value client.",
          "",
          "CONSTANTS",
          "",
          "const DefaultTimeout = 30",
          "",
          "VARIABLES",
          "",
          "var ErrMissing = errors.New(\"missing\")",
          "",
          "FUNCTIONS",
          "",
          "func New(cfg Config) *Client",
          "    New creates a client.",
          "",
          "func helper() int",
          "",
          "TYPES",
          "",
          "type Client struct {",
          "\t// Has unexported fields.",
          "}",
          "    Client talks to the cache.",
          "",
          "func Dial(addr string) (*Client, error)",
          "func (c *Client) Get(key string) (string, error)    returns the stored value",
          "func (c *Client) Set(key, value string) error",
          "",
          "type Config struct {",
          "\tName string",
          "\tTimeout int // seconds",
          "}",
          "",
          "type Store interface {",
          "\tGet(key string) (string, error)",
          "\tfunc Close() error",
          "}",
          "");

  private final GoDocParser parser = new GoDocParser();

  @Test
  @DisplayName("Full go doc output yields functions and types in order of appearance")
  void parsesFullDocumentation() {
    PackageRecord pkg = parser.parse(CACHE_DOC, PackageMetadata.of("cache", "example.com/cache"));

    assertEquals("cache", pkg.name());
    assertEquals("example.com/cache", pkg.importPath());
    assertEquals(
        List.of("New", "Dial", "Get", "Set"),
        pkg.functions().stream().map(FunctionRecord::name).toList());
    assertEquals(
        List.of("Client", "Config", "Store"),
        pkg.types().stream().map(TypeRecord::name).toList());

    FunctionRecord get = pkg.functions().get(2);
    assertEquals("c *Client", get.receiver());
    assertEquals("(string, error)", get.returns());
    assertEquals("returns the stored value", get.description());
    assertEquals("cache", get.packageName());

    TypeRecord client = pkg.types().get(0);
    assertTrue(client.fields().isEmpty());
    TypeRecord config = pkg.types().get(1);
    assertEquals(List.of("Name string", "Timeout int // seconds"), config.fields());
    TypeRecord store = pkg.types().get(2);
    assertEquals(TypeKind.INTERFACE, store.kind());
    assertEquals(List.of("func Close() error"), store.methods());
  }

  @Test
  @DisplayName("Empty documentation text yields an empty package record")
  void emptyDocumentation() {
    PackageRecord pkg = parser.parse("", PackageMetadata.of("foo", "example.com/foo"));

    assertEquals("foo", pkg.name());
    assertTrue(pkg.functions().isEmpty());
    assertTrue(pkg.types().isEmpty());
    assertTrue(pkg.isEmpty());

    assertTrue(parser.parse(null, PackageMetadata.of("foo", "example.com/foo")).isEmpty());
  }

  @Test
  @DisplayName("Lowercase function declarations produce no records")
  void lowercaseFunctionSkipped() {
    DocScan scan = parser.scan("func get(key string) string\nfunc Get(key string) string");

    assertEquals(1, scan.functions().size());
    assertEquals("Get", scan.functions().get(0).name());
  }

  @Test
  @DisplayName("The scan resumes at the line that ended a type body")
  void resumesAfterTypeBody() {
    String doc =
        String.join(
            "\n",
            "type Config struct {",
            "\tName string",
            "func (c Config) Validate() error",
            "type Other interface {",
            "\tfunc Run()",
            "func Last()");

    DocScan scan = parser.scan(doc);

    assertEquals(
        List.of("Validate", "Last"), scan.functions().stream().map(FunctionRecord::name).toList());
    assertEquals(
        List.of("Config", "Other"), scan.types().stream().map(TypeRecord::name).toList());
    assertEquals(List.of("func Run()"), scan.types().get(1).methods());
  }

  @Test
  @DisplayName("Repeated package lines: the last one wins for later records")
  void lastPackageDeclarationWins() {
    String doc =
        String.join(
            "\n", "func Early()", "package first", "func A()", "package second", "func B()");

    DocScan scan = parser.scan(doc);

    assertEquals("second", scan.packageName());
    assertEquals("", scan.functions().get(0).packageName());
    assertEquals("first", scan.functions().get(1).packageName());
    assertEquals("second", scan.functions().get(2).packageName());
  }

  @Test
  @DisplayName("Windows line endings are handled")
  void crlfInput() {
    String doc = "package cache\r\ntype Config struct {\r\n\tName string\r\n}\r\nfunc New() *Config\r\n";

    DocScan scan = parser.scan(doc);

    assertEquals("cache", scan.packageName());
    assertEquals(List.of("Name string"), scan.types().get(0).fields());
    assertEquals("*Config", scan.functions().get(0).returns());
  }

  @Test
  @DisplayName("Declared import path is captured from the package line")
  void declaredImportPath() {
    assertEquals("example.com/cache", parser.scan(CACHE_DOC).declaredImportPath());
    assertEquals("", parser.scan("package main").declaredImportPath());
  }

  @Test
  @DisplayName("Records cannot be modified after parsing")
  void recordsAreImmutable() {
    PackageRecord pkg = parser.parse(CACHE_DOC, PackageMetadata.of("cache", "example.com/cache"));

    assertThrows(UnsupportedOperationException.class, () -> pkg.functions().clear());
    assertThrows(UnsupportedOperationException.class, () -> pkg.types().get(1).fields().add("X"));
  }
}
