package net.coffeetariat.rsadigest.cli;

import net.coffeetariat.rsadigest.KeyStoreYaml;
import net.coffeetariat.rsadigest.RsaKey;
import net.coffeetariat.rsadigest.RsaPrivateKey;
import net.coffeetariat.rsadigest.RsaPublicKey;
import net.coffeetariat.rsadigest.Settings;
import net.coffeetariat.rsadigest.api.KeyApiServer;
import net.coffeetariat.rsadigest.lib.DigestSigner;
import net.coffeetariat.rsadigest.lib.KeyDump;
import net.coffeetariat.rsadigest.lib.KeyGenerationException;
import net.coffeetariat.rsadigest.lib.ModularTransform;
import net.coffeetariat.rsadigest.lib.RsaKeyGenerator;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Optional;

/**
 * Command line entry point.
 *
 * <pre>
 * genkey &lt;id&gt; [bits]                     generate and store a key, print its factors
 * dump &lt;id&gt; [full|public|private]        print a stored key or one of its projections
 * encrypt &lt;id&gt; &lt;in&gt; &lt;out&gt;              bytes to hex tokens with the public projection
 * decrypt &lt;id&gt; &lt;in&gt; &lt;out&gt;              hex tokens to bytes with the private projection
 * sign &lt;id&gt; &lt;in&gt; &lt;sig&gt;                 SHA-512 signature with the private projection
 * verify &lt;id&gt; &lt;in&gt; &lt;sig&gt;               check a signature with the public projection
 * serve [port]                           start the HTTP API
 * </pre>
 *
 * The key store path and defaults come from {@link Settings}.
 */
public class Program {

  static final int OK = 0;
  static final int FAILURE = 1;
  static final int USAGE = 2;

  private static final String USAGE_TEXT = String.join("\n",
      "usage: rsadigest <command> [args]",
      "  genkey <id> [bits]",
      "  dump <id> [full|public|private]",
      "  encrypt <id> <in> <out>",
      "  decrypt <id> <in> <out>",
      "  sign <id> <in> <sig>",
      "  verify <id> <in> <sig>",
      "  serve [port]");

  private final Settings settings;
  private final RsaKeyGenerator generator;
  private final PrintStream out;
  private final PrintStream err;

  Program(Settings settings, RsaKeyGenerator generator, PrintStream out, PrintStream err) {
    this.settings = settings;
    this.generator = generator;
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) throws Exception {
    Program program = new Program(Settings.load(), RsaKeyGenerator.createDefault(), System.out, System.err);
    int code = program.run(args);
    // serve keeps running on the server's threads
    if (code != OK || args.length == 0 || !"serve".equals(args[0])) {
      System.exit(code);
    }
  }

  int run(String[] args) {
    if (args == null || args.length == 0) {
      err.println(USAGE_TEXT);
      return USAGE;
    }
    try {
      switch (args[0]) {
        case "genkey":
          requireArgs(args, 2, 3);
          return genkey(args[1], args.length > 2 ? parseInt(args[2], "bits") : settings.keyLength());
        case "dump":
          requireArgs(args, 2, 3);
          return dump(args[1], args.length > 2 ? args[2] : "full");
        case "encrypt":
          requireArgs(args, 4, 4);
          return encrypt(args[1], Path.of(args[2]), Path.of(args[3]));
        case "decrypt":
          requireArgs(args, 4, 4);
          return decrypt(args[1], Path.of(args[2]), Path.of(args[3]));
        case "sign":
          requireArgs(args, 4, 4);
          return sign(args[1], Path.of(args[2]), Path.of(args[3]));
        case "verify":
          requireArgs(args, 4, 4);
          return verify(args[1], Path.of(args[2]), Path.of(args[3]));
        case "serve":
          requireArgs(args, 1, 2);
          return serve(args.length > 1 ? parseInt(args[1], "port") : settings.serverPort());
        default:
          throw new UsageException("unknown command: " + args[0]);
      }
    } catch (UsageException e) {
      err.println(e.getMessage());
      err.println(USAGE_TEXT);
      return USAGE;
    } catch (IllegalArgumentException | IOException | GeneralSecurityException e) {
      err.println("error: " + e.getMessage());
      return FAILURE;
    }
  }

  private int genkey(String keyId, int bits) throws IOException, KeyGenerationException {
    if (bits > 0 && bits < RsaKeyGenerator.MIN_REACHABLE_KEY_LENGTH) {
      throw new UsageException("bits must be at least " + RsaKeyGenerator.MIN_REACHABLE_KEY_LENGTH + ": " + bits);
    }
    RsaKey key = generator.generate(bits);
    keyStore().register(keyId, key);
    out.print(KeyDump.dump(key));
    return OK;
  }

  private int dump(String keyId, String view) throws IOException {
    KeyStoreYaml store = keyStore();
    switch (view) {
      case "full":
        out.print(KeyDump.dump(require(store.getKey(keyId), keyId)));
        return OK;
      case "public":
        out.print(KeyDump.dump(require(store.getPublicKey(keyId), keyId)));
        return OK;
      case "private":
        out.print(KeyDump.dump(require(store.getPrivateKey(keyId), keyId)));
        return OK;
      default:
        throw new UsageException("unknown dump view: " + view);
    }
  }

  private int encrypt(String keyId, Path in, Path target) throws IOException {
    RsaPublicKey key = require(keyStore().getPublicKey(keyId), keyId);
    try (InputStream is = Files.newInputStream(in); OutputStream os = Files.newOutputStream(target)) {
      long units = ModularTransform.encrypt(is, os, key);
      out.println("encrypted " + units + " byte(s) to " + target);
    }
    return OK;
  }

  private int decrypt(String keyId, Path in, Path target) throws IOException {
    RsaPrivateKey key = require(keyStore().getPrivateKey(keyId), keyId);
    try (InputStream is = Files.newInputStream(in); OutputStream os = Files.newOutputStream(target)) {
      long units = ModularTransform.decrypt(is, os, key);
      out.println("decrypted " + units + " byte(s) to " + target);
    }
    return OK;
  }

  private int sign(String keyId, Path in, Path signature) throws IOException {
    RsaPrivateKey key = require(keyStore().getPrivateKey(keyId), keyId);
    try (InputStream is = Files.newInputStream(in); OutputStream os = Files.newOutputStream(signature)) {
      DigestSigner.sign(is, key, os);
    }
    out.println("signature written to " + signature);
    return OK;
  }

  private int verify(String keyId, Path in, Path signature) throws IOException {
    RsaPublicKey key = require(keyStore().getPublicKey(keyId), keyId);
    boolean valid;
    try (InputStream data = Files.newInputStream(in); InputStream sig = Files.newInputStream(signature)) {
      valid = DigestSigner.verify(data, sig, key);
    }
    out.println(valid ? "signature OK" : "signature INVALID");
    return valid ? OK : FAILURE;
  }

  private int serve(int port) throws IOException {
    KeyApiServer server = new KeyApiServer(port, keyStore(), generator, settings.keyLength());
    server.start();
    Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
    return OK;
  }

  private KeyStoreYaml keyStore() throws IOException {
    return new KeyStoreYaml(settings.keyStore());
  }

  private static <T> T require(Optional<T> maybe, String keyId) {
    return maybe.orElseThrow(() -> new IllegalArgumentException("unknown key id or incomplete key: " + keyId));
  }

  private static void requireArgs(String[] args, int min, int max) {
    if (args.length < min || args.length > max) {
      throw new UsageException("wrong number of arguments for " + args[0]);
    }
  }

  private static int parseInt(String raw, String name) {
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException e) {
      throw new UsageException(name + " must be an integer: " + raw);
    }
  }

  /** Bad command line; reported together with the usage text. */
  static final class UsageException extends IllegalArgumentException {
    UsageException(String message) {
      super(message);
    }
  }
}
