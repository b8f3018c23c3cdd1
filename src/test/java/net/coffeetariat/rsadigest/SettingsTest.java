package net.coffeetariat.rsadigest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SettingsTest {

  @TempDir
  Path dir;

  @Test
  void classpathDefaults() throws IOException {
    Settings settings = Settings.load(dir.resolve("missing.yaml"));
    assertEquals(2048, settings.keyLength());
    assertEquals(Path.of("rsa-keys.yaml"), settings.keyStore());
    assertEquals(8080, settings.serverPort());
  }

  @Test
  void overrideFileReplacesNamedValuesOnly() throws IOException {
    Path file = dir.resolve("rsadigest.yaml");
    Files.writeString(file, "keyLength: 512\nserver:\n  port: 9090\n", StandardCharsets.UTF_8);

    Settings settings = Settings.load(file);
    assertEquals(512, settings.keyLength());
    assertEquals(Path.of("rsa-keys.yaml"), settings.keyStore());
    assertEquals(9090, settings.serverPort());
  }

  @Test
  void emptyOverrideFileKeepsDefaults() throws IOException {
    Path file = dir.resolve("rsadigest.yaml");
    Files.writeString(file, "", StandardCharsets.UTF_8);
    assertEquals(2048, Settings.load(file).keyLength());
  }

  @Test
  void rejectsWronglyTypedValues() throws IOException {
    Path file = dir.resolve("rsadigest.yaml");
    Files.writeString(file, "keyLength: lots\n", StandardCharsets.UTF_8);
    assertThrows(IOException.class, () -> Settings.load(file));

    Files.writeString(file, "server: 8080\n", StandardCharsets.UTF_8);
    assertThrows(IOException.class, () -> Settings.load(file));
  }
}
