package net.coffeetariat.rsadigest;

import net.coffeetariat.rsadigest.lib.RsaKeyGenerator;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime configuration: default key length, key store location and server port.
 *
 * <p>Defaults come from {@code rsadigest.yaml} on the classpath. A file of the same
 * shape in the working directory, or one passed to {@link #load(Path)}, overrides
 * the values it names.</p>
 */
public final class Settings {

  public static final String RESOURCE = "rsadigest.yaml";

  private final int keyLength;
  private final Path keyStore;
  private final int serverPort;

  public Settings(int keyLength, Path keyStore, int serverPort) {
    this.keyLength = keyLength;
    this.keyStore = Objects.requireNonNull(keyStore, "keyStore");
    this.serverPort = serverPort;
  }

  /** Classpath defaults overlaid by {@code ./rsadigest.yaml} when present. */
  public static Settings load() throws IOException {
    return load(Path.of(RESOURCE));
  }

  /**
   * Classpath defaults overlaid by {@code overrides} when that file exists.
   *
   * @throws IOException if a configuration file cannot be read or has the wrong shape
   */
  public static Settings load(Path overrides) throws IOException {
    Settings settings = new Settings(RsaKeyGenerator.DEFAULT_KEY_LENGTH, Path.of("rsa-keys.yaml"), 8080);

    try (InputStream is = Settings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (is != null) {
        settings = settings.overlay(parse(is, "classpath:" + RESOURCE));
      }
    }
    if (overrides != null && Files.exists(overrides)) {
      try (InputStream is = Files.newInputStream(overrides)) {
        settings = settings.overlay(parse(is, overrides.toString()));
      }
    }
    return settings;
  }

  public int keyLength() {
    return keyLength;
  }

  public Path keyStore() {
    return keyStore;
  }

  public int serverPort() {
    return serverPort;
  }

  private static Map<?, ?> parse(InputStream is, String source) throws IOException {
    Object obj;
    try {
      obj = new Yaml().load(is);
    } catch (YAMLException e) {
      throw new IOException("Invalid YAML in " + source, e);
    }
    if (obj == null) return Map.of();
    if (!(obj instanceof Map)) {
      throw new IOException("Invalid configuration in " + source + ": expected a map root");
    }
    return (Map<?, ?>) obj;
  }

  private Settings overlay(Map<?, ?> root) throws IOException {
    int length = keyLength;
    Path store = keyStore;
    int port = serverPort;

    Object value = root.get("keyLength");
    if (value != null) length = asInt(value, "keyLength");

    value = root.get("keyStore");
    if (value != null) store = Path.of(value.toString());

    value = root.get("server");
    if (value instanceof Map) {
      Object p = ((Map<?, ?>) value).get("port");
      if (p != null) port = asInt(p, "server.port");
    } else if (value != null) {
      throw new IOException("Invalid configuration: 'server' must be a map");
    }
    return new Settings(length, store, port);
  }

  private static int asInt(Object value, String name) throws IOException {
    if (value instanceof Integer) return (Integer) value;
    throw new IOException("Invalid configuration: '" + name + "' must be an integer, got " + value);
  }
}
