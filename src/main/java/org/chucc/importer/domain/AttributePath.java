package org.chucc.importer.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Path from a resource to the property a column maps to.
 *
 * <p>A single segment ({@code title}) names a direct property of the resource. Two segments
 * ({@code part.label}) name a property of an embedded object reached through the outer
 * attribute. Deeper nesting is not supported.
 *
 * @param outer the attribute on the resource
 * @param inner the attribute on the embedded object, if any
 */
public record AttributePath(String outer, Optional<String> inner) {

  /**
   * Creates a path with validation.
   *
   * @throws IllegalArgumentException if a segment is blank
   */
  public AttributePath {
    Objects.requireNonNull(outer, "Outer attribute cannot be null");
    Objects.requireNonNull(inner, "Inner attribute cannot be null");
    if (outer.isBlank()) {
      throw new IllegalArgumentException("Outer attribute cannot be blank");
    }
    if (inner.isPresent() && inner.get().isBlank()) {
      throw new IllegalArgumentException("Inner attribute cannot be blank");
    }
  }

  /**
   * Parses dotted attribute notation.
   *
   * @param dotted the dotted path, e.g. {@code title} or {@code part.label}
   * @return the parsed path
   * @throws IllegalArgumentException if the path is blank or has more than two segments
   */
  public static AttributePath parse(String dotted) {
    Objects.requireNonNull(dotted, "Attribute path cannot be null");
    String[] segments = dotted.split("\\.", -1);
    if (segments.length > 2) {
      throw new IllegalArgumentException(
          "Attribute paths deeper than two segments are not supported: " + dotted);
    }
    if (segments.length == 2) {
      return new AttributePath(segments[0], Optional.of(segments[1]));
    }
    return new AttributePath(segments[0], Optional.empty());
  }

  /**
   * Checks whether this path addresses a property of an embedded object.
   *
   * @return true for two-segment paths
   */
  public boolean isEmbedded() {
    return inner.isPresent();
  }

  @Override
  public String toString() {
    return inner.map(i -> outer + "." + i).orElse(outer);
  }
}
