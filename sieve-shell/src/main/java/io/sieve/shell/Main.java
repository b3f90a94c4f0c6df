package io.sieve.shell;

import io.sieve.menu.api.MatchingState;
import io.sieve.menu.api.MenuConfig;
import io.sieve.menu.api.MenuEngine;
import io.sieve.menu.api.ScrollMethod;
import io.sieve.menu.api.SieveException;
import io.sieve.menu.source.LineEntrySource;
import it.unimi.dsi.fastutil.ints.IntList;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.jline.terminal.Terminal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "sieve",
    description = "Filter a list interactively and print the selected entry",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public final class Main implements Callable<Integer> {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_ERROR = 2;
  static final int EXIT_FILTER_FAILED = 3;

  @CommandLine.Option(
      names = {"-f", "--file"},
      description = "File with one entry per line; repeat to load several modes (default: stdin)")
  private List<Path> files = new ArrayList<>();

  @CommandLine.Option(names = "--prompt", description = "Prompt text", defaultValue = ">")
  private String prompt;

  @CommandLine.Option(names = "--query", description = "Initial query", defaultValue = "")
  private String query;

  @CommandLine.Option(names = "--lines", description = "Visible rows, 0 to fit the terminal")
  private Integer lines;

  @CommandLine.Option(names = "--columns", description = "Columns")
  private Integer columns;

  @CommandLine.Option(
      names = "--fixed-lines",
      negatable = true,
      description = "Keep the configured number of rows when fewer entries match")
  private Boolean fixedLines;

  @CommandLine.Option(names = "--case-sensitive", description = "Match case-sensitively")
  private Boolean caseSensitive;

  @CommandLine.Option(names = "--sort", description = "Rank matches by edit distance")
  private Boolean sort;

  @CommandLine.Option(names = "--auto-select", description = "Accept a single remaining match")
  private Boolean autoSelect;

  @CommandLine.Option(names = "--scroll-method", description = "page or continuous")
  private String scrollMethod;

  @CommandLine.Option(names = "--threads", description = "Worker threads, 0 for one per CPU")
  private Integer threads;

  @CommandLine.Option(
      names = "--config",
      description = "Configuration file (default: ~/.sieve/config.properties)")
  private Path config;

  @CommandLine.Option(
      names = "--output",
      description = "Result format: text, index or json",
      defaultValue = "text")
  private String output;

  @CommandLine.Option(
      names = "--dump",
      description = "Print the entries matching --query and exit, without a terminal")
  private boolean dump;

  @CommandLine.Option(
      names = "--selected-row",
      description = "Row to select initially",
      defaultValue = "0")
  private int selectedRow;

  @CommandLine.Option(
      names = "--tty",
      hidden = true,
      description = "Terminal device for keys when entries come from stdin",
      defaultValue = "/dev/tty")
  private Path tty;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    PrintStream out = System.out;
    MenuConfig menuConfig;
    Modes modes;
    OutcomePrinter printer;
    try {
      menuConfig = loadConfig();
      modes = loadModes();
      printer = new OutcomePrinter(OutcomePrinter.Format.parse(output));
    } catch (SieveException e) {
      return report(e);
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return EXIT_ERROR;
    } catch (IOException e) {
      System.err.println("Error: " + e.getMessage());
      LOG.debug("Failed to load input", e);
      return EXIT_ERROR;
    }

    if (dump) {
      try (MenuEngine engine = MenuEngine.create(menuConfig)) {
        return dump(engine, modes.current().source(), out);
      } catch (SieveException e) {
        return report(e);
      }
    }

    // stdin already delivered the entries, so keys have to come from the tty
    try (ShellTerminal shell =
        files.isEmpty() ? ShellTerminal.onDevice(tty) : ShellTerminal.system()) {
      Terminal terminal = shell.terminal();
      if (menuConfig.lines() == 0) {
        menuConfig = menuConfig.withLines(TerminalMenu.availableLines(terminal, modes.size()));
      }
      MenuLoop.Result result;
      try (MenuEngine engine = MenuEngine.create(menuConfig);
          TerminalMenu menu = new TerminalMenu(terminal, prompt)) {
        result = new MenuLoop(engine, menu).run(modes, query, selectedRow);
      }
      return printer.print(result, out);
    } catch (SieveException e) {
      return report(e);
    } catch (IOException e) {
      System.err.println("Error: " + e.getMessage());
      LOG.debug("Terminal failed", e);
      return EXIT_ERROR;
    }
  }

  /** Prints an engine error and picks the exit code for its kind. */
  static int report(SieveException e) {
    switch (e.kind()) {
      case CONFIGURATION:
        System.err.println("Error: invalid configuration: " + e.getMessage());
        return EXIT_ERROR;
      case FILTER:
        System.err.println("Error: filtering failed: " + e.getMessage());
        LOG.debug("Filter pass failed", e);
        return EXIT_FILTER_FAILED;
      default:
        throw new IllegalStateException("Unknown error kind " + e.kind());
    }
  }

  private int dump(MenuEngine engine, LineEntrySource source, PrintStream out) {
    MenuConfig c = engine.config();
    IntList matches =
        engine.filter(source, query, new MatchingState(c.caseSensitive(), c.levenshteinSort()));
    for (int i = 0; i < matches.size(); i++) {
      out.println(source.displayText(matches.getInt(i)));
    }
    out.flush();
    return matches.isEmpty() ? OutcomePrinter.EXIT_CANCEL : OutcomePrinter.EXIT_OK;
  }

  private MenuConfig loadConfig() throws IOException {
    MenuConfig c = config != null ? MenuConfig.load(config) : MenuConfig.load();
    if (lines != null) {
      c = c.withLines(lines);
    }
    if (columns != null) {
      c = c.withColumns(columns);
    }
    if (fixedLines != null) {
      c = c.withFixedNumLines(fixedLines);
    }
    if (caseSensitive != null) {
      c = c.withCaseSensitive(caseSensitive);
    }
    if (sort != null) {
      c = c.withLevenshteinSort(sort);
    }
    if (autoSelect != null) {
      c = c.withAutoSelect(autoSelect);
    }
    if (scrollMethod != null) {
      ScrollMethod method = ScrollMethod.parse(scrollMethod);
      if (method == null) {
        throw new IllegalArgumentException(
            "Unknown scroll method '" + scrollMethod + "', expected page or continuous");
      }
      c = c.withScrollMethod(method);
    }
    if (threads != null) {
      c = c.withThreads(threads);
    }
    return c;
  }

  private Modes loadModes() throws IOException {
    List<Modes.Mode> modes = new ArrayList<>();
    if (files.isEmpty()) {
      BufferedReader reader =
          new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
      modes.add(new Modes.Mode("stdin", LineEntrySource.read(reader)));
    }
    for (Path file : files) {
      if (!Files.exists(file)) {
        throw new IOException("File not found: " + file);
      }
      try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
        Path name = file.getFileName();
        String modeName = name != null ? name.toString() : file.toString();
        modes.add(new Modes.Mode(modeName, LineEntrySource.read(reader)));
      }
    }
    LOG.debug("Loaded {} modes", modes.size());
    return new Modes(modes);
  }
}
