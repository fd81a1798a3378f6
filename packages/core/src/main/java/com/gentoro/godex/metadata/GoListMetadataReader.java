package com.gentoro.godex.metadata;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.godex.exception.MetadataUnavailableException;
import com.gentoro.godex.exception.SerializationException;
import com.gentoro.godex.model.PackageMetadata;
import com.gentoro.godex.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the output of {@code go list -json}: a stream of JSON objects written back to back, one
 * per package. Only {@code Name}, {@code ImportPath}, {@code Dir} and {@code Doc} are kept.
 *
 * <p>Reading stops at the first malformed object; packages read up to that point are returned.
 */
public class GoListMetadataReader {
  private static final org.slf4j.Logger log =
      com.gentoro.godex.logging.LoggingService.getLogger(GoListMetadataReader.class);

  private final ObjectMapper mapper;

  public GoListMetadataReader() {
    this(JacksonUtility.getJsonMapper());
  }

  public GoListMetadataReader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public List<PackageMetadata> read(String goListOutput) {
    List<PackageMetadata> result = new ArrayList<>();
    if (goListOutput == null || goListOutput.isBlank()) {
      return result;
    }

    try (JsonParser parser = mapper.getFactory().createParser(goListOutput);
        MappingIterator<JsonNode> it = mapper.readValues(parser, JsonNode.class)) {
      while (it.hasNextValue()) {
        JsonNode node = it.nextValue();
        String importPath = text(node, "ImportPath");
        if (importPath.isEmpty()) {
          log.warn("Skipping go list entry without ImportPath");
          continue;
        }
        try {
          result.add(
              new PackageMetadata(
                  text(node, "Name"), importPath, text(node, "Dir"), text(node, "Doc")));
        } catch (MetadataUnavailableException e) {
          log.warn("Skipping go list entry {}: {}", importPath, e.getMessage());
        }
      }
    } catch (JsonProcessingException e) {
      log.warn(
          "Malformed go list output after {} packages; keeping what was read: {}",
          result.size(),
          e.getOriginalMessage());
    } catch (IOException e) {
      throw new SerializationException("Failed to read go list output", e);
    }
    return result;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || !value.isTextual() ? "" : value.asText();
  }
}
