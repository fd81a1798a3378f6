package com.gentoro.godex.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.godex.exception.GodexErrorCode;
import com.gentoro.godex.exception.MetadataUnavailableException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PackageRecordTest {

  @Test
  @DisplayName("Blank package name cannot be constructed")
  void blankNameRejected() {
    MetadataUnavailableException ex =
        assertThrows(
            MetadataUnavailableException.class,
            () -> new PackageRecord(" ", "example.com/x", List.of(), List.of(), ""));
    assertEquals(GodexErrorCode.METADATA_UNAVAILABLE, ex.getCode());
    assertEquals("example.com/x", ex.getContext().get("importPath"));

    assertThrows(
        MetadataUnavailableException.class,
        () -> new PackageRecord(null, "example.com/x", List.of(), List.of(), ""));
  }

  @Test
  @DisplayName("Missing import path cannot be constructed")
  void missingImportPathRejected() {
    assertThrows(
        MetadataUnavailableException.class,
        () -> new PackageRecord("x", null, List.of(), List.of(), ""));
  }

  @Test
  @DisplayName("Record owns copies of its lists")
  void ownsItsLists() {
    List<FunctionRecord> functions = new ArrayList<>();
    functions.add(new FunctionRecord("A", "func A()", "", "", "()", "", "x"));

    PackageRecord pkg = new PackageRecord("x", "example.com/x", functions, null, null);
    functions.clear();

    assertEquals(1, pkg.functions().size());
    assertTrue(pkg.types().isEmpty());
    assertEquals("", pkg.description());
  }

  @Test
  @DisplayName("Metadata requires name and import path")
  void metadataValidation() {
    assertThrows(MetadataUnavailableException.class, () -> PackageMetadata.of("", "p"));
    assertThrows(MetadataUnavailableException.class, () -> PackageMetadata.of("x", null));

    PackageMetadata metadata = PackageMetadata.of(" x ", "");
    assertEquals("x", metadata.name());
    assertEquals("", metadata.importPath());
    assertEquals("", metadata.directory());
  }

  @Test
  @DisplayName("Type kinds map to their keywords only")
  void typeKindKeywords() {
    assertEquals(TypeKind.STRUCT, TypeKind.fromKeyword("struct").orElseThrow());
    assertEquals(TypeKind.INTERFACE, TypeKind.fromKeyword("interface").orElseThrow());
    assertTrue(TypeKind.fromKeyword("map").isEmpty());

    TypeRecord config = new TypeRecord("Config", TypeKind.STRUCT, null, null, null, null);
    assertEquals("type Config struct", config.declaration());
    assertTrue(config.fields().isEmpty());
  }
}
