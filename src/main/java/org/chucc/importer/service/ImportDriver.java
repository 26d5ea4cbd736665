package org.chucc.importer.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.jena.atlas.csv.CSVParser;
import org.chucc.importer.exception.ImportException;
import org.chucc.importer.exception.ImportFileException;
import org.chucc.importer.model.ModelDescriptor;
import org.chucc.importer.model.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives an import run: reads the CSV file row by row and reconciles each row with the
 * repository through the {@link RowProcessor}.
 *
 * <p>Rows are processed sequentially. A row that fails with an {@link ImportException} is
 * logged and counted as failed; the run continues with the next row. A row whose cell count
 * differs from the header's column count fails without touching the repository. Counters are
 * updated only once a row has fully resolved.</p>
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class ImportDriver {

  private static final Logger logger = LoggerFactory.getLogger(ImportDriver.class);

  private final ModelRegistry modelRegistry;
  private final RowProcessor rowProcessor;

  /**
   * Constructs a new import driver.
   *
   * @param modelRegistry the model registry
   * @param rowProcessor the row processor
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Collaborators are Spring-managed beans and are intentionally shared")
  public ImportDriver(ModelRegistry modelRegistry, RowProcessor rowProcessor) {
    this.modelRegistry = modelRegistry;
    this.rowProcessor = rowProcessor;
  }

  /**
   * Runs an import.
   *
   * @param request the import parameters
   * @return the aggregate counts
   * @throws org.chucc.importer.exception.UnknownModelException if the model is not registered
   * @throws ImportFileException if the file cannot be read or lacks the reserved columns
   */
  public ImportSummary run(ImportRequest request) {
    ModelDescriptor model = modelRegistry.get(request.modelName());
    String fileName = request.file().toString();

    int rowCount = 0;
    int updatedCount = 0;
    int unchangedCount = 0;
    List<RowFailure> failures = new ArrayList<>();

    try (Reader reader = Files.newBufferedReader(request.file(), StandardCharsets.UTF_8)) {
      CSVParser parser = CSVParser.create(reader);
      List<String> headers = parser.parse1();
      if (headers == null) {
        throw new ImportFileException("Import file has no header row: " + fileName);
      }
      headers = stripBom(headers);
      checkHeaders(headers, model, fileName);

      int rowNumber = 0;
      List<String> cells;
      while ((cells = parser.parse1()) != null) {
        if (isBlank(cells)) {
          continue;
        }
        rowNumber++;
        if (request.limit().isPresent() && rowNumber > request.limit().get()) {
          logger.info("Stopping after {} rows", request.limit().get());
          break;
        }
        logger.debug("Processing row {} of {}", rowNumber, fileName);

        Map<String, String> row = toRow(headers, cells);
        try {
          checkCellCount(headers, cells, rowNumber);
          RowResult result = rowProcessor.process(model, row);
          if (result.outcome() == RowOutcome.UPDATED) {
            updatedCount++;
          } else {
            unchangedCount++;
          }
        } catch (ImportException e) {
          String uri = row.getOrDefault(RowProcessor.URI_COLUMN, "");
          logger.error("Row {} of {} for <{}> failed [{}]: {}",
              rowNumber, fileName, uri, e.getCode(), e.getMessage(), e);
          failures.add(new RowFailure(rowNumber, uri, e.getCode(), e.getMessage()));
        }
        rowCount++;
      }
    } catch (IOException e) {
      throw new ImportFileException("Cannot read import file " + fileName, e);
    }

    ImportSummary summary = new ImportSummary(
        rowCount, updatedCount, unchangedCount, failures.size(), failures);
    logger.info("{} of {} items remained unchanged", unchangedCount, rowCount);
    logger.info("Updated {} of {} items", updatedCount, rowCount);
    if (summary.hasFailures()) {
      logger.warn("{} of {} items failed", summary.failedCount(), rowCount);
    }
    return summary;
  }

  private static void checkHeaders(List<String> headers, ModelDescriptor model,
      String fileName) {
    for (String reserved : List.of(RowProcessor.URI_COLUMN, RowProcessor.INDEX_COLUMN)) {
      if (!headers.contains(reserved)) {
        throw new ImportFileException(
            "Import file " + fileName + " has no " + reserved + " column");
      }
    }
    model.headerMap().keySet().stream()
        .filter(header -> !headers.contains(header))
        .forEach(header -> logger.info(
            "Column '{}' of model {} is absent from {}; its values are left as they are",
            header, model.name(), fileName));
  }

  private static void checkCellCount(List<String> headers, List<String> cells, int rowNumber) {
    if (cells.size() != headers.size()) {
      throw new ImportFileException("Row " + rowNumber + " has " + cells.size()
          + " cells but the header has " + headers.size() + " columns");
    }
  }

  private static Map<String, String> toRow(List<String> headers, List<String> cells) {
    Map<String, String> row = new LinkedHashMap<>();
    for (int i = 0; i < headers.size(); i++) {
      if (i < cells.size()) {
        row.put(headers.get(i), cells.get(i));
      }
    }
    return row;
  }

  private static boolean isBlank(List<String> cells) {
    return cells.stream().allMatch(cell -> cell == null || cell.isBlank());
  }

  private static List<String> stripBom(List<String> headers) {
    if (headers.isEmpty() || !headers.get(0).startsWith("\uFEFF")) {
      return headers;
    }
    List<String> stripped = new ArrayList<>(headers);
    stripped.set(0, stripped.get(0).substring(1));
    return stripped;
  }
}
