package org.chucc.importer.config;

import org.chucc.importer.model.BuiltInModels;
import org.chucc.importer.model.ModelDescriptor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the built-in models. Additional models are added by declaring further
 * {@link ModelDescriptor} beans.
 */
@Configuration
public class ModelConfig {

  @Bean
  public ModelDescriptor letterModel() {
    return BuiltInModels.letter();
  }

  @Bean
  public ModelDescriptor pcdmItemModel() {
    return BuiltInModels.pcdmItem();
  }
}
