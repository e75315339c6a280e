package io.ngxdiscover.export;

/** What a {@link Filter} selects on. */
public enum FilterType {
  /** Server blocks with a matching {@code server_name} (glob, {@code *} wildcard). */
  SERVER_NAME,
  /** Server blocks listening on the given port. */
  PORT,
  /** {@code upstream} blocks with a matching name. */
  UPSTREAM,
  /** {@code location} blocks with a matching path. */
  LOCATION,
  /** Server blocks with at least one {@code ssl} listener; the pattern is ignored. */
  SSL_ONLY,
  /** Top-level directives with the given name. */
  DIRECTIVE
}
