package io.strativerse.curation.annotation;

import io.strativerse.curation.exception.ValidationException;
import java.util.Locale;

/** Entity kinds that can own tags and attachments. */
public enum EntityKind {
  PERSON,
  PUBLICATION,
  FEATURE,
  RECORD,
  PARAMETER;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Parses a kind from a path segment such as {@code "person"} or {@code "PERSON"}. */
  public static EntityKind parse(String value) {
    if (value != null) {
      for (EntityKind kind : values()) {
        if (kind.name().equalsIgnoreCase(value.trim())) {
          return kind;
        }
      }
    }
    throw new ValidationException("Unknown entity kind", "No such entity kind: " + value);
  }
}
