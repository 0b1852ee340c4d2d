package ca.gc.cra.xlog.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("port", "12321", "metricsExporter", "otlp");
    Map<String, String> yaml = Map.of("port", "2000", "ipPrefix", "10.1.");
    Map<String, String> cli = Map.of("port", "3000");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "send",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("3000", merged.get("port"));
    assertEquals("10.1.", merged.get("ipPrefix"));
    assertEquals("otlp", merged.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: port"), warnings);
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "serve",
        Optional.of(Map.of("host", "127.0.0.1")),
        Map.of(),
        DefaultsForMode.asFlatMap("serve"),
        warnings::add);

    assertEquals("127.0.0.1", merged.get("host"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void serveRejectsDisabledLogPathWithoutRender() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "serve",
            Optional.empty(),
            Map.of("logPath", "none"),
            DefaultsForMode.asFlatMap("serve"),
            msg -> {}));
  }

  @Test
  void serveAllowsDisabledLogPathWhenRendering() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "serve",
        Optional.of(Map.of("logPath", "")),
        Map.of("render", "yes"),
        DefaultsForMode.asFlatMap("serve"),
        msg -> {});

    assertEquals("", merged.get("logPath"));
  }
}
