package net.coffeetariat.rsadigest.lib;

import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import net.coffeetariat.rsadigest.RsaKey;
import net.coffeetariat.rsadigest.RsaPrivateKey;
import net.coffeetariat.rsadigest.RsaPublicKey;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders keys and projections as a labeled text block, e.g.
 * <pre>
 * === KEY FACTORS ===
 * bits: 64
 * n: 0xc3...
 * p: 0xf1...
 * ...
 * === END ===
 * </pre>
 * Members that are not set are printed as {@code (unset)}. Every line, the last one
 * included, ends with {@code \n}.
 */
public final class KeyDump {

  private static final String TEMPLATE = "templates/key-dump.peb";
  private static final String UNSET = "(unset)";

  // plain text output: nothing to escape, and every newline in the template is kept
  private static final PebbleEngine ENGINE = new PebbleEngine.Builder()
      .autoEscaping(false)
      .newLineTrimming(false)
      .build();

  private KeyDump() {
  }

  public static String dump(RsaKey key) {
    Objects.requireNonNull(key, "key");
    List<Map<String, String>> factors = new ArrayList<>();
    factors.add(factor("n", key.n()));
    factors.add(factor("p", key.p()));
    factors.add(factor("q", key.q()));
    factors.add(factor("e", key.e()));
    factors.add(factor("d", key.d()));
    return render("KEY FACTORS", key.keyLength(), factors);
  }

  public static String dump(RsaPublicKey key) {
    Objects.requireNonNull(key, "key");
    return render("PUBLIC KEY", key.keyLength(), List.of(factor("n", key.n()), factor("d", key.d())));
  }

  public static String dump(RsaPrivateKey key) {
    Objects.requireNonNull(key, "key");
    return render("PRIVATE KEY", key.keyLength(), List.of(factor("n", key.n()), factor("e", key.e())));
  }

  private static Map<String, String> factor(String label, BigInteger value) {
    return Map.of("label", label, "value", value == null ? UNSET : Utilities.toHexLiteral(value));
  }

  private static String render(String title, int bits, List<Map<String, String>> factors) {
    Map<String, Object> context = new HashMap<>();
    context.put("title", title);
    context.put("bits", bits);
    context.put("factors", factors);

    StringWriter writer = new StringWriter();
    try {
      PebbleTemplate template = ENGINE.getTemplate(TEMPLATE);
      template.evaluate(writer, context);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to render " + TEMPLATE, e);
    }
    return writer.toString();
  }
}
