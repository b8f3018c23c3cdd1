package net.coffeetariat.rsadigest;

import net.coffeetariat.rsadigest.lib.RsaKeyGenerator;
import net.coffeetariat.rsadigest.lib.Utilities;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * YAML-backed store of full RSA keys.
 *
 * <p>The file maps a key id to the key's bit-length and its five factors, written as hex
 * literals. Projections are derived on lookup.</p>
 *
 * <p>Example file content:</p>
 * <pre>
 * demo:
 *   keyLength: 64
 *   n: '0xc4b1...'
 *   p: '0xe3a5...'
 *   q: '0xdd91...'
 *   e: '0x10001'
 *   d: '0x5f0e...'
 * </pre>
 */
public class KeyStoreYaml {

  private static final String KEY_LENGTH = "keyLength";
  private static final String[] FACTORS = {"n", "p", "q", "e", "d"};

  private final Path yamlPath;
  private final Yaml yaml;
  private final Map<String, RsaKey> keys = new LinkedHashMap<>();

  /**
   * Creates a new store for the given YAML file path. If the file exists,
   * it is loaded immediately; otherwise, the store starts empty.
   */
  public KeyStoreYaml(Path yamlPath) throws IOException {
    this.yamlPath = Objects.requireNonNull(yamlPath, "yamlPath");

    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setPrettyFlow(true);
    this.yaml = new Yaml(options);

    load();
  }

  public Path getPath() {
    return yamlPath;
  }

  /**
   * Registers a key under {@code keyId} and persists to disk.
   * If the id already exists, its key will be overwritten.
   */
  public synchronized void register(String keyId, RsaKey key) throws IOException {
    Objects.requireNonNull(keyId, "keyId");
    Objects.requireNonNull(key, "key");
    keys.put(keyId, key);
    save();
  }

  /** Returns the registered key ids in registration order. */
  public synchronized Set<String> listKeys() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(keys.keySet()));
  }

  public synchronized Optional<RsaKey> getKey(String keyId) {
    return Optional.ofNullable(keys.get(keyId));
  }

  /**
   * Derives the public projection of a stored key.
   *
   * @return Optional.empty() if the id isn't registered or the entry lacks {@code n} or {@code d}
   */
  public synchronized Optional<RsaPublicKey> getPublicKey(String keyId) {
    RsaKey key = keys.get(keyId);
    if (key == null || key.n() == null || key.d() == null) return Optional.empty();
    return Optional.of(RsaKeyGenerator.derivePublic(key));
  }

  /**
   * Derives the private projection of a stored key.
   *
   * @return Optional.empty() if the id isn't registered or the entry lacks {@code n} or {@code e}
   */
  public synchronized Optional<RsaPrivateKey> getPrivateKey(String keyId) {
    RsaKey key = keys.get(keyId);
    if (key == null || key.n() == null || key.e() == null) return Optional.empty();
    return Optional.of(RsaKeyGenerator.derivePrivate(key));
  }

  /** Removes a key entry and persists to disk. */
  public synchronized void remove(String keyId) throws IOException {
    if (keys.remove(keyId) != null) {
      save();
    }
  }

  /**
   * Loads the YAML file from disk into memory. Missing file is treated as empty.
   *
   * @throws IOException if the file cannot be read or is not a valid key file
   */
  public synchronized void load() throws IOException {
    keys.clear();
    if (!Files.exists(yamlPath)) return;

    Object root;
    try (Reader reader = Files.newBufferedReader(yamlPath, StandardCharsets.UTF_8)) {
      root = yaml.load(reader);
    } catch (YAMLException e) {
      throw new IOException("Invalid YAML in " + yamlPath, e);
    }
    if (root == null) return;
    if (!(root instanceof Map)) {
      throw new IOException("Invalid key file " + yamlPath + ": expected a map root");
    }

    for (Map.Entry<?, ?> entry : ((Map<?, ?>) root).entrySet()) {
      String keyId = String.valueOf(entry.getKey());
      if (!(entry.getValue() instanceof Map)) {
        throw new IOException("Invalid key file " + yamlPath + ": entry '" + keyId + "' is not a map");
      }
      keys.put(keyId, toKey(keyId, (Map<?, ?>) entry.getValue()));
    }
  }

  /** Persists the in-memory keys to the YAML file, creating directories as needed. */
  public synchronized void save() throws IOException {
    if (yamlPath.getParent() != null) {
      Files.createDirectories(yamlPath.getParent());
    }

    Map<String, Object> data = new LinkedHashMap<>();
    for (Map.Entry<String, RsaKey> entry : keys.entrySet()) {
      RsaKey key = entry.getValue();
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put(KEY_LENGTH, key.keyLength());
      putHex(fields, "n", key.n());
      putHex(fields, "p", key.p());
      putHex(fields, "q", key.q());
      putHex(fields, "e", key.e());
      putHex(fields, "d", key.d());
      data.put(entry.getKey(), fields);
    }

    try (Writer writer = Files.newBufferedWriter(yamlPath, StandardCharsets.UTF_8)) {
      yaml.dump(data, writer);
    }
  }

  private static void putHex(Map<String, Object> fields, String name, BigInteger value) {
    if (value != null) {
      fields.put(name, Utilities.toHexLiteral(value));
    }
  }

  private RsaKey toKey(String keyId, Map<?, ?> fields) throws IOException {
    Object length = fields.get(KEY_LENGTH);
    if (!(length instanceof Integer)) {
      throw new IOException("Invalid key file " + yamlPath + ": entry '" + keyId + "' has no integer " + KEY_LENGTH);
    }

    BigInteger[] values = new BigInteger[FACTORS.length];
    for (int i = 0; i < FACTORS.length; i++) {
      Object raw = fields.get(FACTORS[i]);
      if (raw == null) continue;
      try {
        // unquoted 0x literals come back from SnakeYAML as numbers
        values[i] = raw instanceof Number ? new BigInteger(raw.toString()) : Utilities.parseHexLiteral(raw.toString());
      } catch (NumberFormatException e) {
        throw new IOException("Invalid key file " + yamlPath + ": '" + keyId + "." + FACTORS[i] + "' is not a hex literal", e);
      }
    }
    return new RsaKey(values[0], values[1], values[2], values[3], values[4], (Integer) length);
  }
}
