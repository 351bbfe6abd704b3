package io.b2mash.b2b.isolation.multitenancy;

import io.b2mash.b2b.isolation.exception.InvalidIdentifierException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a tenant-facing subdomain into a namespace token that can only ever occupy its intended
 * slot in a generated schema or bucket name. Pure: never touches the database.
 */
public final class IdentifierSanitizer {

  static final Pattern TOKEN_PATTERN = Pattern.compile("^[a-z0-9_-]+$");

  private IdentifierSanitizer() {}

  /** Sanitizes for the schema-name context. */
  public static String sanitize(String raw) {
    return sanitize(raw, IdentifierContext.SCHEMA);
  }

  /**
   * Validates and normalizes {@code raw}.
   *
   * @return a token matching {@code ^[a-z0-9_-]+$}
   * @throws InvalidIdentifierException if the input is blank, out of the context's length window,
   *     or contains any character outside {@code [a-z0-9_-]} after lower-casing, whitespace
   *     included
   */
  public static String sanitize(String raw, IdentifierContext context) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidIdentifierException("identifier must not be blank");
    }
    if (raw.length() < context.minLength()) {
      throw new InvalidIdentifierException("too short");
    }
    if (raw.length() > context.maxLength()) {
      throw new InvalidIdentifierException(
          "exceeds " + context.maxLength() + " character limit");
    }

    String lowered = raw.toLowerCase(Locale.ROOT);
    if (!TOKEN_PATTERN.matcher(lowered).matches()) {
      throw new InvalidIdentifierException(
          "only lowercase letters, digits, hyphens and underscores are allowed");
    }

    // Unquoted Postgres identifiers cannot start with a digit
    if (Character.isDigit(lowered.charAt(0))) {
      return "_" + lowered;
    }
    return lowered;
  }
}
