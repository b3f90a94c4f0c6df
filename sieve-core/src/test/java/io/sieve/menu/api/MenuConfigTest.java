package io.sieve.menu.api;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MenuConfigTest {

  @Test
  void defaults() {
    MenuConfig config = MenuConfig.defaults();

    assertEquals(15, config.lines());
    assertEquals(1, config.columns());
    assertTrue(config.fixedNumLines());
    assertFalse(config.caseSensitive());
    assertFalse(config.levenshteinSort());
    assertFalse(config.autoSelect());
    assertEquals(ScrollMethod.PAGE, config.scrollMethod());
    assertEquals(500, config.filterChunkSize());
    assertEquals(5000, config.asciiChunkSize());
    assertEquals("Up,Control+p,ISO_Left_Tab", config.bindings().get(SemanticAction.ROW_UP));
    assertEquals(SemanticAction.values().length, config.bindings().size());
  }

  @Test
  void effectiveThreadsResolvesZero() {
    int threads = MenuConfig.defaults().effectiveThreads();

    assertTrue(threads >= 1 && threads <= MenuConfig.MAX_THREADS);
    assertEquals(3, MenuConfig.defaults().withThreads(3).effectiveThreads());
  }

  @Test
  void propertiesOverrideDefaults() {
    Properties props = new Properties();
    props.setProperty("lines", "8");
    props.setProperty("columns", "2");
    props.setProperty("case-sensitive", "yes");
    props.setProperty("auto-select", "on");
    props.setProperty("scroll-method", "continuous");
    props.setProperty("kb-accept-entry", "Return, Control+y");

    MenuConfig config = MenuConfig.fromProperties(props);

    assertEquals(8, config.lines());
    assertEquals(2, config.columns());
    assertTrue(config.caseSensitive());
    assertTrue(config.autoSelect());
    assertEquals(ScrollMethod.CONTINUOUS, config.scrollMethod());
    assertEquals("Return, Control+y", config.bindings().get(SemanticAction.ACCEPT_ENTRY));
    assertEquals(
        "Escape,Control+g,Control+bracketleft", config.bindings().get(SemanticAction.CANCEL));
  }

  @Test
  void rejectsInvalidValues() {
    Properties props = new Properties();
    props.setProperty("columns", "0");
    SieveConfigurationException e =
        assertThrows(SieveConfigurationException.class, () -> MenuConfig.fromProperties(props));
    assertEquals("columns", e.subject());
    assertEquals(SieveException.Kind.CONFIGURATION, e.kind());
    assertEquals("columns: invalid value '0'", e.getMessage());

    Properties notANumber = new Properties();
    notANumber.setProperty("threads", "many");
    assertThrows(SieveConfigurationException.class, () -> MenuConfig.fromProperties(notANumber));

    Properties badScroll = new Properties();
    badScroll.setProperty("scroll-method", "sideways");
    assertThrows(SieveConfigurationException.class, () -> MenuConfig.fromProperties(badScroll));

    Properties badFlag = new Properties();
    badFlag.setProperty("levenshtein-sort", "maybe");
    assertThrows(SieveConfigurationException.class, () -> MenuConfig.fromProperties(badFlag));
  }

  @Test
  void rejectsUnknownModifier() {
    Properties props = new Properties();
    props.setProperty("kb-cancel", "Hyper+Escape");

    SieveConfigurationException e =
        assertThrows(SieveConfigurationException.class, () -> MenuConfig.fromProperties(props));
    assertEquals("Hyper+Escape", e.subject());
  }

  @Test
  void rejectsUnknownBindingKey() {
    Properties props = new Properties();
    props.setProperty("kb-row-dwon", "Down");

    SieveConfigurationException e =
        assertThrows(SieveConfigurationException.class, () -> MenuConfig.fromProperties(props));
    assertEquals("kb-row-dwon", e.subject());
  }

  @Test
  void bindingKeysOverrideTheirAction() {
    Properties props = new Properties();
    props.setProperty("kb-row-down", "Down,Control+j");

    MenuConfig config = MenuConfig.fromProperties(props);

    assertEquals("Down,Control+j", config.bindings().get(SemanticAction.ROW_DOWN));
    assertEquals(
        SemanticAction.ROW_UP.defaultBinding(), config.bindings().get(SemanticAction.ROW_UP));
  }

  @Test
  void withBindingValidatesStrokes() {
    assertThrows(
        SieveConfigurationException.class,
        () -> MenuConfig.defaults().withBinding(SemanticAction.CANCEL, "Control+"));
  }

  @Test
  void missingFileYieldsDefaults(@TempDir Path dir) throws IOException {
    assertEquals(MenuConfig.defaults(), MenuConfig.load(dir.resolve("absent.properties")));
  }

  @Test
  void saveAndLoad(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("nested").resolve("config.properties");
    MenuConfig config =
        MenuConfig.defaults()
            .withLines(4)
            .withScrollMethod(ScrollMethod.CONTINUOUS)
            .withBinding(SemanticAction.CUSTOM_11, "Alt+q");

    config.save(file);

    assertTrue(Files.exists(file));
    assertEquals(config, MenuConfig.load(file));
  }
}
