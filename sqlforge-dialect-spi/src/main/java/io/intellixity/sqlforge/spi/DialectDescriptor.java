package io.intellixity.sqlforge.spi;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Per-database table of syntax facts: identifier quote, placeholder spelling and supported features.
 *
 * <p>Plain data, so it can also be read from JSON ({@code {"id":"...","identifierQuote":"\"",
 * "placeholderStyle":"QUESTION_MARK","features":["RETURNING"]}}).</p>
 */
public record DialectDescriptor(
    String id,
    String identifierQuote,
    PlaceholderStyle placeholderStyle,
    Set<SqlFeature> features
) {
  public DialectDescriptor {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) throw new IllegalArgumentException("Dialect id must not be blank");
    id = id.trim().toLowerCase(Locale.ROOT);
    if (identifierQuote == null || identifierQuote.length() != 1) {
      throw new IllegalArgumentException("identifierQuote must be a single character for dialect: " + id);
    }
    Objects.requireNonNull(placeholderStyle, "placeholderStyle");
    features = (features == null || features.isEmpty())
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(features));
  }

  public boolean supports(SqlFeature feature) {
    return features.contains(feature);
  }

  public boolean supportsReturning() { return supports(SqlFeature.RETURNING); }
  public boolean supportsOnConflict() { return supports(SqlFeature.ON_CONFLICT); }
  public boolean supportsOnConflictConstraint() { return supports(SqlFeature.ON_CONFLICT_CONSTRAINT); }
  public boolean supportsOnDuplicateKeyUpdate() { return supports(SqlFeature.ON_DUPLICATE_KEY_UPDATE); }
  public boolean supportsInsertIgnore() { return supports(SqlFeature.INSERT_IGNORE); }
  public boolean supportsLastInsertId() { return supports(SqlFeature.LAST_INSERT_ID); }

  public char quoteChar() {
    return identifierQuote.charAt(0);
  }
}
