package com.gentoro.godex.catalog;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.godex.model.PackageMetadata;
import com.gentoro.godex.model.PackageRecord;
import com.gentoro.godex.parser.GoDocParser;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ApiCatalogTest {

  private static final String DOC =
      String.join(
          "\n",
          "package cache",
          "func New() *Client",
          "func (c *Client) Get(key string) (string, error)    returns the stored value",
          "type Config struct {",
          "\tName string",
          "}");

  private final ApiCatalog catalog = new ApiCatalog();
  private final PackageRecord cache =
      new GoDocParser().parse(DOC, PackageMetadata.of("cache", "example.com/cache"));
  private final PackageRecord other =
      new GoDocParser().parse("func Run()", PackageMetadata.of("other", "example.com/other"));

  @Test
  @DisplayName("Functions, methods and types become items with stable ids")
  void collectsItems() {
    List<ApiItem> items = catalog.collect(List.of(cache));

    assertEquals(3, items.size());

    ApiItem fn = items.get(0);
    assertEquals(ApiItemKind.FUNCTION, fn.kind());
    assertEquals("example.com/cache:func New() *Client", fn.itemId());

    ApiItem method = items.get(1);
    assertEquals(ApiItemKind.METHOD, method.kind());
    assertEquals("c *Client", method.receiver());
    assertEquals("returns the stored value", method.sourceDescription());

    ApiItem type = items.get(2);
    assertEquals(ApiItemKind.TYPE, type.kind());
    assertEquals("example.com/cache:type:Config", type.itemId());
    assertEquals("type Config struct", type.signature());
    assertEquals("struct", type.typeKind());
    assertEquals(List.of("Name string"), type.fields());
  }

  @Test
  @DisplayName("Packages are flattened in order and the item limit truncates")
  void limitAndOrder() {
    assertEquals(
        List.of("New", "Get", "Config", "Run"),
        catalog.collect(List.of(cache, other)).stream().map(ApiItem::name).toList());
    assertEquals(2, catalog.collect(List.of(cache, other), 2).size());
    assertEquals(4, catalog.collect(List.of(cache, other), 0).size());
    assertEquals(4, catalog.collect(List.of(cache, other), 10).size());
  }
}
