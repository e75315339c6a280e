package io.ngxdiscover.types;

/** Matching mode of a {@code location} block. */
public enum LocationModifier {
  /** Plain prefix match. */
  NONE(""),
  /** {@code =} exact match. */
  EXACT("="),
  /** {@code ^~} prefix match that skips regex checks. */
  PREFIX_PRIORITY("^~"),
  /** {@code ~} case-sensitive regex. */
  REGEX("~"),
  /** {@code ~*} case-insensitive regex. */
  REGEX_CASE_INSENSITIVE("~*");

  private final String symbol;

  LocationModifier(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isRegex() {
    return this == REGEX || this == REGEX_CASE_INSENSITIVE;
  }

  /** Returns the modifier written as {@code symbol}, or {@link #NONE} when it is not one. */
  public static LocationModifier fromSymbol(String symbol) {
    for (LocationModifier m : values()) {
      if (m != NONE && m.symbol.equals(symbol)) {
        return m;
      }
    }
    return NONE;
  }
}
