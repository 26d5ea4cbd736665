package org.chucc.importer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the tabular import tool.
 */
@SpringBootApplication
@SuppressWarnings("PMD.UseUtilityClass") // Spring Boot requires instantiable main class
public class ImporterApplication {

  /**
   * Application entry point. Exits with the code reported by the import run.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(ImporterApplication.class, args)));
  }
}
