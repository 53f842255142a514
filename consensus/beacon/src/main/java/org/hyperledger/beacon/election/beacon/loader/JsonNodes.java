package org.hyperledger.beacon.election.beacon.loader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Helpers to walk beacon API payloads, which encode every number as a decimal string. */
final class JsonNodes {

  static final ObjectMapper MAPPER = new ObjectMapper();

  private JsonNodes() {}

  static JsonNode read(final Path file) {
    final JsonNode root;
    try {
      root = MAPPER.readTree(file.toFile());
    } catch (IOException e) {
      throw new ChainDataException("Unable to read " + file, e);
    }
    if (root == null || root.isMissingNode()) {
      throw new ChainDataException(file + " is empty");
    }
    return root;
  }

  static JsonNode field(final JsonNode node, final String name) {
    final JsonNode value = node.get(name);
    if (value == null || value.isNull()) {
      throw new ChainDataException("Missing field '" + name + "'");
    }
    return value;
  }

  static JsonNode array(final JsonNode node, final String name) {
    final JsonNode value = field(node, name);
    if (!value.isArray()) {
      throw new ChainDataException("Field '" + name + "' is not an array");
    }
    return value;
  }

  /**
   * Converts the text of field {@code name} with {@code parser}, reporting any parse failure as a
   * {@link ChainDataException}.
   */
  static <T> T parse(
      final JsonNode node, final String name, final Function<String, T> parser) {
    final String text = field(node, name).asText();
    try {
      return parser.apply(text);
    } catch (IllegalArgumentException | ArithmeticException e) {
      throw new ChainDataException("Invalid value for '" + name + "': " + text, e);
    }
  }
}
