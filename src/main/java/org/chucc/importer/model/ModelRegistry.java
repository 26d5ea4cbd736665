package org.chucc.importer.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.chucc.importer.exception.UnknownModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Registry of the resource models an import can use, keyed by model name.
 * Populated once at startup from every {@link ModelDescriptor} bean.
 */
@Component
public class ModelRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ModelRegistry.class);

  private final Map<String, ModelDescriptor> models = new TreeMap<>();

  /**
   * Creates the registry.
   *
   * @param descriptors the model descriptors to register
   * @throws IllegalArgumentException if two descriptors share a name
   */
  public ModelRegistry(List<ModelDescriptor> descriptors) {
    for (ModelDescriptor descriptor : descriptors) {
      if (models.putIfAbsent(descriptor.name(), descriptor) != null) {
        throw new IllegalArgumentException("Duplicate model name: " + descriptor.name());
      }
    }
    logger.debug("Registered models: {}", models.keySet());
  }

  /**
   * Looks up a model by name.
   *
   * @param name the model name, e.g. {@code letter.Letter}
   * @return the model descriptor
   * @throws UnknownModelException if no model is registered under the name
   */
  public ModelDescriptor get(String name) {
    Objects.requireNonNull(name, "Model name cannot be null");
    ModelDescriptor descriptor = models.get(name);
    if (descriptor == null) {
      throw new UnknownModelException(name);
    }
    return descriptor;
  }

  public Map<String, ModelDescriptor> all() {
    return Collections.unmodifiableMap(models);
  }
}
