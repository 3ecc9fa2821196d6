package com.squareup.tspan;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 *   Loads rules into a {@link RuleRegistry} from JSON. Two layouts are accepted:
 * </p>
 *
 * <ol>
 *   <li>A single object mapping each key to its list of patterns:
 *     <pre>{"JS": [[{"LOWER": "javascript"}], [{"LOWER": "js"}]]}</pre></li>
 *   <li>JSON lines, one rule per line, with a single pattern or a list of them and an
 *       optional callback name:
 *     <pre>{"label": "JS", "pattern": [{"LOWER": "js"}], "on_match": "merge"}</pre></li>
 * </ol>
 *
 * <p>
 *   Callback names are bound against the map given to the constructor.
 * </p>
 */
public class PatternLoader {

  /**
   * The Logger for this class
   */
  private static final Logger log = LoggerFactory.getLogger(PatternLoader.class);

  /** The JSON reader shared by all loaders. */
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  /** A list of patterns. */
  private static final TypeReference<List<List<Map<String, Object>>>> PATTERNS =
      new TypeReference<List<List<Map<String, Object>>>>() {};

  /** A single pattern. */
  private static final TypeReference<List<Map<String, Object>>> PATTERN =
      new TypeReference<List<Map<String, Object>>>() {};

  /** The callbacks that rules can name, by name. */
  private final Map<String, ?> callbacks;

  /** Create a loader that binds no callbacks. */
  public PatternLoader() {
    this(Collections.emptyMap());
  }

  /**
   * Create a loader.
   *
   * @param callbacks The callbacks rules can name in their {@code on_match} field.
   *                  Values that are not a {@link MatchCallback} are rejected when a
   *                  rule names them.
   */
  public PatternLoader(Map<String, ?> callbacks) {
    this.callbacks = callbacks;
  }

  /**
   * Load rules from a file.
   *
   * @param registry The registry to add the rules to.
   * @param path The file to read, in UTF-8.
   *
   * @return The number of patterns added.
   *
   * @throws IOException If the file could not be read.
   * @throws InvalidPatternException If the file is not valid JSON, or holds an invalid
   *         pattern.
   * @throws CallbackTypeException If a rule names a callback we cannot bind.
   */
  public int load(RuleRegistry registry, Path path) throws IOException {
    String json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    int count = load(registry, json);
    log.info("Loaded {} pattern(s) from {}", count, path);
    return count;
  }

  /**
   * Load rules from a JSON string.
   *
   * @param registry The registry to add the rules to.
   * @param json The rules, in either layout.
   *
   * @return The number of patterns added.
   *
   * @throws InvalidPatternException If the string is not valid JSON, or holds an invalid
   *         pattern.
   * @throws CallbackTypeException If a rule names a callback we cannot bind.
   */
  public int load(RuleRegistry registry, String json) {
    int count = 0;
    try (MappingIterator<JsonNode> roots = OBJECT_MAPPER.readerFor(JsonNode.class).readValues(json)) {
      // hasNextValue() and nextValue() report malformed JSON as an IOException
      while (roots.hasNextValue()) {
        JsonNode root = roots.nextValue();
        if (!root.isObject()) {
          throw new InvalidPatternException("Expected a JSON object of rules, got: " + root);
        }
        if (root.has("pattern") || root.has("patterns")) {
          count += loadLine(registry, root);
        } else {
          Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
          while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<List<Map<String, Object>>> patterns = convert(field.getValue(), PATTERNS);
            registry.add(field.getKey(), patterns, null);
            count += patterns.size();
          }
        }
      }
    } catch (IOException | RuntimeJsonMappingException e) {
      throw new InvalidPatternException("Malformed rule JSON: " + e.getMessage(), e);
    }
    return count;
  }

  /**
   * Load a single JSON lines rule.
   */
  private int loadLine(RuleRegistry registry, JsonNode line) {
    JsonNode key = line.has("label") ? line.get("label") : line.get("key");
    if (key == null || !key.isTextual()) {
      throw new InvalidPatternException("Rule has no textual 'label' or 'key': " + line);
    }
    List<List<Map<String, Object>>> patterns = line.has("patterns")
        ? convert(line.get("patterns"), PATTERNS)
        : Collections.singletonList(convert(line.get("pattern"), PATTERN));
    JsonNode onMatch = line.get("on_match");
    MatchCallback callback = onMatch == null || onMatch.isNull() ? null : bind(onMatch.asText());
    registry.add(key.asText(), patterns, callback);
    return patterns.size();
  }

  /**
   * Bind a callback name.
   *
   * @param name The name of the callback.
   *
   * @return The bound callback.
   *
   * @throws CallbackTypeException If the name is not bound, or not bound to a
   *         {@link MatchCallback}.
   */
  MatchCallback bind(String name) {
    Object callback = callbacks.get(name);
    if (callback == null) {
      throw new CallbackTypeException(name, "No callback is bound to '" + name + "'");
    }
    if (!(callback instanceof MatchCallback)) {
      throw new CallbackTypeException(name, "Callback '" + name + "' is not a MatchCallback: "
          + callback.getClass().getName());
    }
    return (MatchCallback) callback;
  }

  /**
   * Convert a JSON tree into patterns, reporting a shape mismatch as a malformed rule.
   */
  private static <T> T convert(@Nullable JsonNode node, TypeReference<T> type) {
    if (node == null || node.isNull()) {
      throw new InvalidPatternException("Rule has no patterns");
    }
    try {
      return OBJECT_MAPPER.convertValue(node, type);
    } catch (IllegalArgumentException e) {
      throw new InvalidPatternException("Malformed patterns: " + node, e);
    }
  }
}
