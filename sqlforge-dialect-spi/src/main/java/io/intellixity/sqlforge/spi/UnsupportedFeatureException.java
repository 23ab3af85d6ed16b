package io.intellixity.sqlforge.spi;

/** The tree asks for syntax the active dialect does not have (e.g. a named conflict constraint on MySQL). */
public final class UnsupportedFeatureException extends SqlCompileException {
  private final String dialectId;
  private final SqlFeature feature;

  public UnsupportedFeatureException(String dialectId, SqlFeature feature) {
    this(dialectId, feature, "'" + feature.sql() + "' is not supported by dialect: " + dialectId);
  }

  public UnsupportedFeatureException(String dialectId, SqlFeature feature, String message) {
    super(message);
    this.dialectId = dialectId;
    this.feature = feature;
  }

  public String dialectId() {
    return dialectId;
  }

  public SqlFeature feature() {
    return feature;
  }
}
