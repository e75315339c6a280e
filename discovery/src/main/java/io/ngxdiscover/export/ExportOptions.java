package io.ngxdiscover.export;

import java.util.Objects;
import java.util.Optional;

/** Settings of one export run. */
public final class ExportOptions {

  private final ExportFormat format;
  private final boolean pretty;
  private final boolean includeMetadata;
  private final Filter filter;

  private ExportOptions(Builder builder) {
    this.format = builder.format;
    this.pretty = builder.pretty;
    this.includeMetadata = builder.includeMetadata;
    this.filter = builder.filter;
  }

  /** JSON, pretty printed, with metadata and no filter. */
  public static ExportOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public ExportFormat format() {
    return format;
  }

  public boolean pretty() {
    return pretty;
  }

  public boolean includeMetadata() {
    return includeMetadata;
  }

  public Optional<Filter> filter() {
    return Optional.ofNullable(filter);
  }

  @Override
  public String toString() {
    return "ExportOptions{format="
        + format
        + ", pretty="
        + pretty
        + ", includeMetadata="
        + includeMetadata
        + ", filter="
        + filter
        + "}";
  }

  public static final class Builder {
    private ExportFormat format = ExportFormat.JSON;
    private boolean pretty = true;
    private boolean includeMetadata = true;
    private Filter filter;

    private Builder() {}

    public Builder format(ExportFormat format) {
      this.format = Objects.requireNonNull(format, "format");
      return this;
    }

    public Builder pretty(boolean pretty) {
      this.pretty = pretty;
      return this;
    }

    public Builder includeMetadata(boolean includeMetadata) {
      this.includeMetadata = includeMetadata;
      return this;
    }

    public Builder filter(Filter filter) {
      this.filter = filter;
      return this;
    }

    public ExportOptions build() {
      return new ExportOptions(this);
    }
  }
}
