package io.xrdinfo.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads command options from a YAML file laid out in sections.
 *
 * <pre>
 * common:
 *   anchor: /etc/xroad/configuration-anchor.xml
 *   tls:
 *     ca: /etc/xrdinfo/ca.pem
 * methods:
 *   client: EE/GOV/70000001/portal
 * </pre>
 *
 * <p>The {@code common} section applies to every command and the section named after the command overrides it.
 * Other sections are ignored. Nested mappings become dotted keys ({@code tls.ca}).</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Returns the options of one command.
   *
   * @param path YAML file
   * @param command command name selecting the second section
   * @return options in file order; empty for an empty document
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not YAML or a section is not a mapping of scalars
   */
  public static Map<String, String> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(command, "command");
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Invalid YAML in " + path + ": " + ex.getMessage(), ex);
    }
    Map<String, String> options = new LinkedHashMap<>();
    if (document == null) {
      return options;
    }
    if (!(document instanceof Map<?, ?> sections)) {
      throw new IllegalArgumentException(path + " must map section names to options");
    }
    for (String section : List.of(COMMON_SECTION, command.trim().toLowerCase(Locale.ROOT))) {
      Object body = sections.get(section);
      if (body != null) {
        collect(section, body, "", options);
      }
    }
    return options;
  }

  private static void collect(String section, Object node, String prefix, Map<String, String> options) {
    if (!(node instanceof Map<?, ?> entries)) {
      throw new IllegalArgumentException("Section " + section + " must be a mapping");
    }
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      String key = prefix + entry.getKey();
      Object value = entry.getValue();
      if (value instanceof Map<?, ?>) {
        collect(section, value, key + '.', options);
      } else if (value instanceof Collection<?>) {
        throw new IllegalArgumentException(section + "." + key + ": lists are not supported");
      } else {
        options.put(key, value == null ? "" : value.toString());
      }
    }
  }
}
