package io.intellixity.sqlgrammar.spi.sql;

/**
 * Raised when a plan needs a capability the active {@link Dialect} does not provide
 * (JSON predicates, lateral joins, upserts, ...). Fatal to the current compilation.
 */
public final class UnsupportedFeatureException extends UnsupportedOperationException {
  private final String dialectId;
  private final String feature;

  public UnsupportedFeatureException(String dialectId, String feature) {
    super("This database engine does not support " + feature + " (dialect: " + dialectId + ")");
    this.dialectId = dialectId;
    this.feature = feature;
  }

  public String dialectId() { return dialectId; }
  public String feature() { return feature; }
}
