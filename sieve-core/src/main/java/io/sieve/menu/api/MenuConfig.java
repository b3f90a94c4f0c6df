package io.sieve.menu.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Engine and layout configuration. Loads from {@code ~/.sieve/config.properties} by default;
 * missing keys keep their defaults.
 *
 * @param lines visible rows, {@code 0} to fit the available height
 * @param columns configured columns
 * @param fixedNumLines keep {@code lines} rows even when fewer entries are available
 * @param caseSensitive initial case sensitivity
 * @param levenshteinSort initial similarity ranking
 * @param autoSelect accept automatically when a query narrows the set to one entry
 * @param scrollMethod paged or continuous scrolling
 * @param threads worker count, {@code 0} for {@code min(CPUs, 128)}
 * @param filterChunkSize entries per matching task
 * @param asciiChunkSize entries per ASCII classification task
 * @param doubleClickMillis window in which a second click on an element accepts it
 * @param bindings key bindings per action, comma separated strokes
 */
public record MenuConfig(
    int lines,
    int columns,
    boolean fixedNumLines,
    boolean caseSensitive,
    boolean levenshteinSort,
    boolean autoSelect,
    ScrollMethod scrollMethod,
    int threads,
    int filterChunkSize,
    int asciiChunkSize,
    long doubleClickMillis,
    Map<SemanticAction, String> bindings) {

  public static final int MAX_THREADS = 128;

  private static final String BINDING_PREFIX = "kb-";

  public MenuConfig {
    if (lines < 0) {
      throw SieveConfigurationException.invalidValue("lines", String.valueOf(lines));
    }
    if (columns < 1) {
      throw SieveConfigurationException.invalidValue("columns", String.valueOf(columns));
    }
    if (threads < 0) {
      throw SieveConfigurationException.invalidValue("threads", String.valueOf(threads));
    }
    if (filterChunkSize < 1) {
      throw SieveConfigurationException.invalidValue(
          "filter-chunk-size", String.valueOf(filterChunkSize));
    }
    if (asciiChunkSize < 1) {
      throw SieveConfigurationException.invalidValue(
          "ascii-chunk-size", String.valueOf(asciiChunkSize));
    }
    if (scrollMethod == null) {
      scrollMethod = ScrollMethod.PAGE;
    }
    EnumMap<SemanticAction, String> copy = defaultBindings();
    if (bindings != null) {
      copy.putAll(bindings);
    }
    bindings = Collections.unmodifiableMap(copy);
  }

  /**
   * Creates the default configuration.
   *
   * @return default configuration
   */
  public static MenuConfig defaults() {
    return new MenuConfig(
        15, // rows
        1, // single column
        true,
        false,
        false,
        false,
        ScrollMethod.PAGE,
        0, // size from CPU count
        500,
        5000,
        200,
        defaultBindings());
  }

  /**
   * Loads configuration from {@code ~/.sieve/config.properties}.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static MenuConfig load() throws IOException {
    return load(getConfigPath());
  }

  /**
   * Loads configuration from the given file.
   *
   * @param configPath properties file
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static MenuConfig load(Path configPath) throws IOException {
    if (!Files.exists(configPath)) {
      return defaults();
    }

    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(configPath)) {
      props.load(reader);
    }

    return fromProperties(props);
  }

  /**
   * Saves this configuration to the given file.
   *
   * @throws IOException if the file cannot be written
   */
  public void save(Path configPath) throws IOException {
    if (configPath.getParent() != null) {
      Files.createDirectories(configPath.getParent());
    }
    try (var writer = Files.newBufferedWriter(configPath)) {
      toProperties()
          .store(
              writer,
              "sieve configuration\n"
                  + "# scroll-method: page, continuous\n"
                  + "# kb-*: comma separated Modifier+Key strokes");
    }
  }

  /**
   * Gets the default configuration file path.
   *
   * @return configuration file path
   */
  public static Path getConfigPath() {
    String home = System.getProperty("user.home");
    return Path.of(home, ".sieve", "config.properties");
  }

  /**
   * Creates configuration from properties.
   *
   * @param props the properties
   * @return the configuration
   * @throws SieveConfigurationException if a value cannot be parsed
   */
  public static MenuConfig fromProperties(Properties props) {
    MenuConfig d = defaults();

    String scrollValue = props.getProperty("scroll-method");
    ScrollMethod scrollMethod = d.scrollMethod();
    if (scrollValue != null) {
      scrollMethod = ScrollMethod.parse(scrollValue);
      if (scrollMethod == null) {
        throw SieveConfigurationException.invalidValue("scroll-method", scrollValue);
      }
    }

    EnumMap<SemanticAction, String> bindings = defaultBindings();
    for (String name : props.stringPropertyNames()) {
      if (!name.startsWith(BINDING_PREFIX)) {
        continue;
      }
      SemanticAction action = SemanticAction.fromConfigKey(name);
      if (action == null) {
        throw SieveConfigurationException.unknownAction(name);
      }
      String value = props.getProperty(name);
      // parse now so a bad binding fails at load time, not on the first key press
      KeyStroke.parseList(value);
      bindings.put(action, value.trim());
    }

    return new MenuConfig(
        intValue(props, "lines", d.lines()),
        intValue(props, "columns", d.columns()),
        boolValue(props, "fixed-num-lines", d.fixedNumLines()),
        boolValue(props, "case-sensitive", d.caseSensitive()),
        boolValue(props, "levenshtein-sort", d.levenshteinSort()),
        boolValue(props, "auto-select", d.autoSelect()),
        scrollMethod,
        intValue(props, "threads", d.threads()),
        intValue(props, "filter-chunk-size", d.filterChunkSize()),
        intValue(props, "ascii-chunk-size", d.asciiChunkSize()),
        intValue(props, "double-click-millis", (int) d.doubleClickMillis()),
        bindings);
  }

  /**
   * Converts this configuration to properties.
   *
   * @return properties representation
   */
  public Properties toProperties() {
    Properties props = new Properties();
    props.setProperty("lines", String.valueOf(lines));
    props.setProperty("columns", String.valueOf(columns));
    props.setProperty("fixed-num-lines", String.valueOf(fixedNumLines));
    props.setProperty("case-sensitive", String.valueOf(caseSensitive));
    props.setProperty("levenshtein-sort", String.valueOf(levenshteinSort));
    props.setProperty("auto-select", String.valueOf(autoSelect));
    props.setProperty("scroll-method", scrollMethod.name().toLowerCase(Locale.ROOT));
    props.setProperty("threads", String.valueOf(threads));
    props.setProperty("filter-chunk-size", String.valueOf(filterChunkSize));
    props.setProperty("ascii-chunk-size", String.valueOf(asciiChunkSize));
    props.setProperty("double-click-millis", String.valueOf(doubleClickMillis));
    for (Map.Entry<SemanticAction, String> e : bindings.entrySet()) {
      props.setProperty(e.getKey().configKey(), e.getValue());
    }
    return props;
  }

  /** Worker count after resolving {@code threads = 0} against the available processors. */
  public int effectiveThreads() {
    if (threads > 0) {
      return threads;
    }
    return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), MAX_THREADS));
  }

  public MenuConfig withLines(int value) {
    return new MenuConfig(
        value, columns, fixedNumLines, caseSensitive, levenshteinSort, autoSelect, scrollMethod,
        threads, filterChunkSize, asciiChunkSize, doubleClickMillis, bindings);
  }

  public MenuConfig withColumns(int value) {
    return new MenuConfig(
        lines, value, fixedNumLines, caseSensitive, levenshteinSort, autoSelect, scrollMethod,
        threads, filterChunkSize, asciiChunkSize, doubleClickMillis, bindings);
  }

  public MenuConfig withFixedNumLines(boolean value) {
    return new MenuConfig(
        lines, columns, value, caseSensitive, levenshteinSort, autoSelect, scrollMethod, threads,
        filterChunkSize, asciiChunkSize, doubleClickMillis, bindings);
  }

  public MenuConfig withCaseSensitive(boolean value) {
    return new MenuConfig(
        lines, columns, fixedNumLines, value, levenshteinSort, autoSelect, scrollMethod, threads,
        filterChunkSize, asciiChunkSize, doubleClickMillis, bindings);
  }

  public MenuConfig withLevenshteinSort(boolean value) {
    return new MenuConfig(
        lines, columns, fixedNumLines, caseSensitive, value, autoSelect, scrollMethod, threads,
        filterChunkSize, asciiChunkSize, doubleClickMillis, bindings);
  }

  public MenuConfig withAutoSelect(boolean value) {
    return new MenuConfig(
        lines, columns, fixedNumLines, caseSensitive, levenshteinSort, value, scrollMethod,
        threads, filterChunkSize, asciiChunkSize, doubleClickMillis, bindings);
  }

  public MenuConfig withScrollMethod(ScrollMethod value) {
    return new MenuConfig(
        lines, columns, fixedNumLines, caseSensitive, levenshteinSort, autoSelect, value, threads,
        filterChunkSize, asciiChunkSize, doubleClickMillis, bindings);
  }

  public MenuConfig withThreads(int value) {
    return new MenuConfig(
        lines, columns, fixedNumLines, caseSensitive, levenshteinSort, autoSelect, scrollMethod,
        value, filterChunkSize, asciiChunkSize, doubleClickMillis, bindings);
  }

  public MenuConfig withBinding(SemanticAction action, String strokes) {
    KeyStroke.parseList(strokes);
    EnumMap<SemanticAction, String> copy = new EnumMap<>(bindings);
    copy.put(action, strokes);
    return new MenuConfig(
        lines, columns, fixedNumLines, caseSensitive, levenshteinSort, autoSelect, scrollMethod,
        threads, filterChunkSize, asciiChunkSize, doubleClickMillis, copy);
  }

  private static EnumMap<SemanticAction, String> defaultBindings() {
    EnumMap<SemanticAction, String> map = new EnumMap<>(SemanticAction.class);
    for (SemanticAction a : SemanticAction.values()) {
      map.put(a, a.defaultBinding());
    }
    return map;
  }

  private static int intValue(Properties props, String key, int defaultValue) {
    String value = props.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw SieveConfigurationException.invalidValue(key, value);
    }
  }

  private static boolean boolValue(Properties props, String key, boolean defaultValue) {
    String value = props.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true":
      case "1":
      case "on":
      case "yes":
        return true;
      case "false":
      case "0":
      case "off":
      case "no":
        return false;
      default:
        throw SieveConfigurationException.invalidValue(key, value);
    }
  }
}
