package io.xrdinfo.application.openapi;

import io.xrdinfo.application.json.JsonSupport;
import io.xrdinfo.domain.error.FormatException;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Parses an OpenAPI description, trying JSON first and YAML second.
 *
 * <p>Both parsers keep mapping order. YAML is loaded with the safe constructor, so only plain maps, lists and scalars
 * are produced.</p>
 *
 * @since 0.1.0
 */
public final class OpenApiDocumentLoader {
  private static final Logger log = LoggerFactory.getLogger(OpenApiDocumentLoader.class);

  private final JsonSupport json;

  public OpenApiDocumentLoader() {
    this(new JsonSupport());
  }

  public OpenApiDocumentLoader(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Parses a description.
   *
   * @param text JSON or YAML text
   * @return top-level mapping
   * @throws FormatException when the text is neither a JSON object nor a YAML mapping
   */
  public Map<?, ?> load(String text) throws FormatException {
    Objects.requireNonNull(text, "text");
    try {
      return json.parseObject(text);
    } catch (FormatException jsonFailure) {
      log.debug("OpenAPI description is not JSON ({}), trying YAML", jsonFailure.getMessage());
      Object document;
      try {
        document = new Yaml(new SafeConstructor(new LoaderOptions())).load(text);
      } catch (YAMLException ex) {
        FormatException failure = new FormatException("OpenAPI description is neither JSON nor YAML", ex);
        failure.addSuppressed(jsonFailure);
        throw failure;
      }
      if (!(document instanceof Map<?, ?> map)) {
        throw new FormatException("OpenAPI description is not a mapping");
      }
      return map;
    }
  }
}
