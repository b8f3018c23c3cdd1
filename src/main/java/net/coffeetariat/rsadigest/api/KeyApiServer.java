package net.coffeetariat.rsadigest.api;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import net.coffeetariat.rsadigest.KeyStoreYaml;
import net.coffeetariat.rsadigest.RsaKey;
import net.coffeetariat.rsadigest.RsaPrivateKey;
import net.coffeetariat.rsadigest.RsaPublicKey;
import net.coffeetariat.rsadigest.lib.KeyDump;
import net.coffeetariat.rsadigest.lib.KeyGenerationException;
import net.coffeetariat.rsadigest.lib.MalformedTokenException;
import net.coffeetariat.rsadigest.lib.ModularTransform;
import net.coffeetariat.rsadigest.lib.RsaKeyGenerator;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * A tiny HTTP API over a {@link KeyStoreYaml}: key creation, public projection lookup
 * and the per-byte transform.
 *
 * Endpoints:
 * - GET /health -> 200 OK with "ok"
 * - GET / -> 200 OK text/html index of stored keys
 * - GET /api/keys/{keyId}/public-key -> 200 OK text/plain (public projection dump)
 *      404 Not Found if the key is unknown
 * - POST /api/keys/{keyId}/keypair[?bits=N] -> 201 Created text/plain (private projection dump)
 *      Generates and stores a full key. 400 on an invalid or unreachable bit-length.
 * - POST /api/keys/{keyId}/encrypt -> 200 OK text/plain, one hex token per request body byte
 * - POST /api/keys/{keyId}/decrypt -> 200 OK application/octet-stream from a token body
 *      400 Bad Request on malformed tokens
 */
public class KeyApiServer {

  private static final String API_TITLE = "RSA Digest Key Server - version 0.1";

  private final HttpServer server;
  private final ExecutorService executor;
  private final KeyStoreYaml keyStore;
  private final RsaKeyGenerator generator;
  private final int defaultKeyLength;
  private final PebbleTemplate indexTemplate;

  public KeyApiServer(int port, KeyStoreYaml keyStore, RsaKeyGenerator generator, int defaultKeyLength)
      throws IOException {
    this.keyStore = Objects.requireNonNull(keyStore, "keyStore");
    this.generator = Objects.requireNonNull(generator, "generator");
    this.defaultKeyLength = defaultKeyLength;

    PebbleEngine engine = new PebbleEngine.Builder().build();
    this.indexTemplate = engine.getTemplate("templates/index.peb");

    this.server = HttpServer.create(new InetSocketAddress(port), 0);
    server.createContext("/health", this::handleHealth);
    server.createContext("/api/keys", this::handleKeys);
    server.createContext("/", this::handleIndex);

    this.executor = Executors.newCachedThreadPool();
    server.setExecutor(executor);
  }

  public void start() {
    server.start();
    System.out.println("KeyApiServer started on http://localhost:" + getPort());
  }

  public void stop() {
    server.stop(0);
    executor.shutdownNow();
  }

  /** The bound port; differs from the requested one when 0 was passed. */
  public int getPort() {
    return server.getAddress().getPort();
  }

  private void handleHealth(HttpExchange exchange) throws IOException {
    if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
      respond(exchange, 405, "method not allowed");
      return;
    }
    addNoCache(exchange.getResponseHeaders());
    respond(exchange, 200, "ok");
  }

  private void handleIndex(HttpExchange exchange) throws IOException {
    try {
      if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
        respond(exchange, 405, "method not allowed");
        return;
      }
      // Only render the index for the exact root path. Any other unknown path -> 404.
      if (!"/".equals(exchange.getRequestURI().getPath())) {
        respond(exchange, 404, "not found");
        return;
      }

      List<Map<String, Object>> keys = new ArrayList<>();
      for (String keyId : keyStore.listKeys()) {
        Optional<RsaKey> key = keyStore.getKey(keyId);
        if (key.isPresent()) {
          keys.add(Map.of("id", keyId, "bits", key.get().keyLength()));
        }
      }

      Map<String, Object> context = new HashMap<>();
      context.put("apiTitleAndVersion", API_TITLE);
      context.put("countOfKeys", keys.size());
      context.put("keys", keys);

      Writer writer = new StringWriter();
      indexTemplate.evaluate(writer, context);
      respond(exchange, 200, writer.toString().getBytes(StandardCharsets.UTF_8), MediaTypes.TEXT_HTML);
    } catch (Exception e) {
      System.err.println("request " + exchange.getRequestURI() + " failed: " + e);
      respond(exchange, 500, "internal server error");
    }
  }

  private void handleKeys(HttpExchange exchange) throws IOException {
    try {
      String method = exchange.getRequestMethod();
      String path = exchange.getRequestURI().getPath();

      String[] parts = path.split("/");
      // ["", "api", "keys", "{id}", "public-key"|"keypair"|"encrypt"|"decrypt"]
      if (parts.length == 5) {
        String keyId = URLDecoder.decode(parts[3], StandardCharsets.UTF_8);
        String action = parts[4];
        if ("GET".equalsIgnoreCase(method) && "public-key".equals(action)) {
          handleGetPublicKey(exchange, keyId);
          return;
        }
        if ("POST".equalsIgnoreCase(method) && "keypair".equals(action)) {
          handleCreateKey(exchange, keyId);
          return;
        }
        if ("POST".equalsIgnoreCase(method) && "encrypt".equals(action)) {
          handleEncrypt(exchange, keyId);
          return;
        }
        if ("POST".equalsIgnoreCase(method) && "decrypt".equals(action)) {
          handleDecrypt(exchange, keyId);
          return;
        }
      }

      // Method not allowed or not found
      if ("GET".equalsIgnoreCase(method) || "POST".equalsIgnoreCase(method)) {
        respond(exchange, 404, "not found");
      } else {
        respond(exchange, 405, "method not allowed");
      }
    } catch (Exception e) {
      System.err.println("request " + exchange.getRequestURI() + " failed: " + e);
      respond(exchange, 500, "internal server error");
    }
  }

  private void handleGetPublicKey(HttpExchange exchange, String keyId) throws IOException {
    addNoCache(exchange.getResponseHeaders());
    Optional<RsaPublicKey> maybe = keyStore.getPublicKey(keyId);
    if (maybe.isEmpty()) {
      respond(exchange, 404, "key not found");
      return;
    }
    respond(exchange, 200, KeyDump.dump(maybe.get()));
  }

  private void handleCreateKey(HttpExchange exchange, String keyId) throws IOException, KeyGenerationException {
    addNoCache(exchange.getResponseHeaders());

    int bits = defaultKeyLength;
    String rawBits = getQueryParam(exchange.getRequestURI(), "bits");
    if (rawBits != null) {
      try {
        bits = Integer.parseInt(rawBits);
      } catch (NumberFormatException e) {
        respond(exchange, 400, "bits must be an integer");
        return;
      }
    }
    if (bits > 0 && bits < RsaKeyGenerator.MIN_REACHABLE_KEY_LENGTH) {
      respond(exchange, 400, "bits must be at least " + RsaKeyGenerator.MIN_REACHABLE_KEY_LENGTH);
      return;
    }

    RsaKey key;
    try {
      key = generator.generate(bits);
    } catch (IllegalArgumentException e) {
      respond(exchange, 400, e.getMessage());
      return;
    }
    keyStore.register(keyId, key);
    respond(exchange, 201, KeyDump.dump(RsaKeyGenerator.derivePrivate(key)));
  }

  private void handleEncrypt(HttpExchange exchange, String keyId) throws IOException {
    addNoCache(exchange.getResponseHeaders());
    Optional<RsaPublicKey> maybe = keyStore.getPublicKey(keyId);
    if (maybe.isEmpty()) {
      respond(exchange, 404, "key not found");
      return;
    }

    byte[] body = exchange.getRequestBody().readAllBytes();
    ByteArrayOutputStream tokens = new ByteArrayOutputStream();
    try {
      ModularTransform.encrypt(new ByteArrayInputStream(body), tokens, maybe.get());
    } catch (IllegalArgumentException e) {
      respond(exchange, 400, e.getMessage());
      return;
    }
    respond(exchange, 200, tokens.toByteArray(), MediaTypes.TEXT_PLAIN);
  }

  private void handleDecrypt(HttpExchange exchange, String keyId) throws IOException {
    addNoCache(exchange.getResponseHeaders());
    Optional<RsaPrivateKey> maybe = keyStore.getPrivateKey(keyId);
    if (maybe.isEmpty()) {
      respond(exchange, 404, "key not found");
      return;
    }

    byte[] body = exchange.getRequestBody().readAllBytes();
    ByteArrayOutputStream plain = new ByteArrayOutputStream();
    try {
      ModularTransform.decrypt(new ByteArrayInputStream(body), plain, maybe.get());
    } catch (MalformedTokenException e) {
      respond(exchange, 400, e.getMessage());
      return;
    }
    respond(exchange, 200, plain.toByteArray(), MediaTypes.APPLICATION_OCTET_STREAM);
  }

  private static void addNoCache(Headers headers) {
    headers.add("Cache-Control", "no-store, no-cache, must-revalidate, max-age=0");
    headers.add("Pragma", "no-cache");
  }

  private static String getQueryParam(URI uri, String name) {
    String query = uri.getRawQuery();
    if (query == null || query.isEmpty()) return null;
    for (String p : query.split("&")) {
      int idx = p.indexOf('=');
      String key = idx >= 0 ? p.substring(0, idx) : p;
      String val = idx >= 0 ? p.substring(idx + 1) : "";
      if (name.equals(key)) {
        return URLDecoder.decode(val, StandardCharsets.UTF_8);
      }
    }
    return null;
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    respond(exchange, status, body.getBytes(StandardCharsets.UTF_8), MediaTypes.TEXT_PLAIN);
  }

  private static void respond(HttpExchange exchange, int status, byte[] body, MediaTypes contentType)
      throws IOException {
    Headers headers = exchange.getResponseHeaders();
    headers.set("Content-Type", contentType.isText() ? contentType.value() + "; charset=utf-8" : contentType.value());

    exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(body);
    }
  }
}
