package org.chucc.importer.runner;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.file.Path;
import java.util.Optional;
import org.chucc.importer.config.ImporterProperties;
import org.chucc.importer.service.ImportDriver;
import org.chucc.importer.service.ImportRequest;
import org.chucc.importer.service.ImportSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts an import when {@code importer.file} is configured.
 * The application exits with code 1 if any row failed.
 */
@Component
@ConditionalOnProperty(prefix = "importer", name = "file")
public class ImportRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger logger = LoggerFactory.getLogger(ImportRunner.class);

  private final ImportDriver importDriver;
  private final ImporterProperties properties;
  private ImportSummary summary;

  /**
   * Constructs the runner.
   *
   * @param importDriver the import driver
   * @param properties the importer properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Collaborators are Spring-managed beans and are intentionally shared")
  public ImportRunner(ImportDriver importDriver, ImporterProperties properties) {
    this.importDriver = importDriver;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (properties.getModel() == null || properties.getModel().isBlank()) {
      throw new IllegalStateException("importer.model must be set to run an import");
    }
    ImportRequest request = new ImportRequest(
        properties.getModel(),
        Path.of(properties.getFile()),
        Optional.ofNullable(properties.getLimit()));
    logger.info("Importing {} with model {}", request.file(), request.modelName());
    summary = importDriver.run(request);
  }

  @Override
  public int getExitCode() {
    return summary != null && summary.hasFailures() ? 1 : 0;
  }

  public Optional<ImportSummary> getSummary() {
    return Optional.ofNullable(summary);
  }
}
