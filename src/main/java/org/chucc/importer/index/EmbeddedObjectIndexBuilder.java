package org.chucc.importer.index;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.chucc.importer.domain.EmbeddedCollection;
import org.chucc.importer.domain.EmbeddedObject;
import org.chucc.importer.domain.Resource;
import org.chucc.importer.domain.Term;
import org.chucc.importer.exception.EmbeddedObjectLookupException;
import org.chucc.importer.exception.IndexParseException;
import org.springframework.stereotype.Component;

/**
 * Builds the embedded-object index for one row from its index descriptor.
 *
 * <p>A descriptor is a semicolon-separated list of {@code name[position]=relative-ref}
 * entries, for example {@code part[0]=#part1;part[1]=#part2}. Each relative reference is
 * appended to the parent resource URI to form the embedded object's URI.
 */
@Component
public class EmbeddedObjectIndexBuilder {

  private static final Pattern KEY_PATTERN = Pattern.compile("^(\\w+)\\[(\\d+)]$");

  /**
   * Builds the index for a resource.
   *
   * @param resource the parent resource
   * @param descriptor the index descriptor; blank yields an empty index
   * @return the index
   * @throws IndexParseException if an entry is malformed
   * @throws EmbeddedObjectLookupException if an entry does not resolve to a held object
   */
  public EmbeddedObjectIndex build(Resource resource, String descriptor) {
    if (descriptor == null || descriptor.isBlank()) {
      return EmbeddedObjectIndex.empty();
    }

    EmbeddedObjectIndex index = new EmbeddedObjectIndex();
    for (String entry : descriptor.split(";")) {
      if (entry.isBlank()) {
        continue;
      }
      int separator = entry.indexOf('=');
      if (separator < 0) {
        throw new IndexParseException("Index entry is missing '=': " + entry.trim());
      }
      String key = entry.substring(0, separator).trim();
      String relativeRef = entry.substring(separator + 1).trim();

      Matcher matcher = KEY_PATTERN.matcher(key);
      if (!matcher.matches()) {
        throw new IndexParseException(
            "Index key does not match name[position]: " + key);
      }
      String attribute = matcher.group(1);
      int position;
      try {
        position = Integer.parseInt(matcher.group(2));
      } catch (NumberFormatException e) {
        throw new IndexParseException("Index position out of range: " + key, e);
      }

      index.put(attribute, position, resolve(resource, attribute, relativeRef));
    }
    return index;
  }

  private EmbeddedObject resolve(Resource resource, String attribute, String relativeRef) {
    EmbeddedCollection collection = resource.embedded(attribute)
        .orElseThrow(() -> new EmbeddedObjectLookupException(
            "Model " + resource.model().name() + " has no embedded attribute '"
                + attribute + "'"));
    Term term = new Term.Reference(resource.uri() + relativeRef);
    return collection.get(term)
        .orElseThrow(() -> new EmbeddedObjectLookupException(
            "No embedded " + attribute + " object " + term.asString()
                + " on " + resource.uri()));
  }
}
