package org.chucc.importer.util;

import java.util.Locale;
import org.apache.jena.riot.Lang;

/**
 * Utility class for RDF content type handling.
 * Maps repository media types to Jena Lang formats.
 */
public final class RdfContentTypeUtil {

  private RdfContentTypeUtil() {
    // Utility class - prevent instantiation
  }

  /**
   * Determines the Apache Jena Lang from a content type string.
   *
   * @param contentType the content type (e.g., "text/turtle; charset=utf-8")
   * @return the corresponding Lang, or null if unsupported or blank
   */
  public static Lang determineLang(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return null;
    }

    // Drop parameters such as charset
    String cleanType = contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);

    return switch (cleanType) {
      case "text/turtle", "application/x-turtle" -> Lang.TURTLE;
      case "application/n-triples" -> Lang.NTRIPLES;
      case "application/ld+json" -> Lang.JSONLD;
      case "application/rdf+xml" -> Lang.RDFXML;
      case "text/n3", "text/rdf+n3" -> Lang.N3;
      default -> null;
    };
  }

  /**
   * Checks whether a content type names an RDF syntax the importer can parse.
   *
   * @param contentType the content type
   * @return true if supported
   */
  public static boolean isSupported(String contentType) {
    return determineLang(contentType) != null;
  }
}
