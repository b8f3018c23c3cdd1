package net.coffeetariat.rsadigest.api;

/**
 * Enumeration of media (MIME) types served by {@link KeyApiServer}.
 */
public enum MediaTypes {
  TEXT_PLAIN("text/plain"),
  TEXT_HTML("text/html"),
  APPLICATION_OCTET_STREAM("application/octet-stream");

  private final String value;

  MediaTypes(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Whether this type carries text and takes a charset parameter. */
  public boolean isText() {
    return value.startsWith("text/");
  }

  @Override
  public String toString() {
    return value;
  }
}
