package io.b2mash.governance.support;

import java.util.regex.Pattern;

/**
 * Validation and quoting for table and column names that come from configuration rows rather than
 * from code. Only plain identifiers are accepted, so a quoted identifier can never break out of
 * its quotes.
 */
public final class SqlIdentifiers {

  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");

  private SqlIdentifiers() {}

  public static String quote(String identifier) {
    return "\"" + requireValid(identifier) + "\"";
  }

  public static String requireValid(String identifier) {
    if (identifier == null || identifier.isBlank()) {
      throw new IllegalArgumentException("Identifier cannot be empty");
    }
    String trimmed = identifier.trim();
    if (!IDENTIFIER.matcher(trimmed).matches()) {
      throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
    }
    return trimmed;
  }
}
