package io.sieve.shell;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import io.sieve.menu.api.Outcome;
import java.io.PrintStream;
import java.util.Locale;

/** Writes the result of a menu run to stdout and maps it to an exit code. */
final class OutcomePrinter {

  enum Format {
    TEXT,
    INDEX,
    JSON;

    static Format parse(String value) {
      try {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            "Unknown output format '" + value + "', expected text, index or json", e);
      }
    }
  }

  static final int EXIT_OK = 0;
  static final int EXIT_CANCEL = 1;
  static final int EXIT_QUICK_SWITCH = 10;

  private final Format format;
  private final Gson gson = new Gson();

  OutcomePrinter(Format format) {
    this.format = format;
  }

  /**
   * Prints the result and returns the process exit code.
   *
   * @param result final result of the menu loop
   * @param out destination
   * @return {@code 0} accepted, {@code 1} cancelled, {@code 10 + i} quick-switch to mode {@code i}
   */
  int print(MenuLoop.Result result, PrintStream out) {
    Outcome outcome = result.outcome();
    if (outcome instanceof Outcome.Cancel) {
      return EXIT_CANCEL;
    }
    String kind;
    int index;
    String text;
    boolean modified = false;
    int exitCode = EXIT_OK;
    if (outcome instanceof Outcome.Accept) {
      Outcome.Accept accept = (Outcome.Accept) outcome;
      kind = "accept";
      index = accept.entryIndex();
      text = result.mode().source().completion(index);
      modified = accept.modified();
    } else if (outcome instanceof Outcome.AcceptCustomText) {
      Outcome.AcceptCustomText custom = (Outcome.AcceptCustomText) outcome;
      kind = "custom";
      index = Outcome.NO_ENTRY;
      text = custom.text();
      modified = custom.modified();
    } else if (outcome instanceof Outcome.QuickSwitch) {
      Outcome.QuickSwitch quick = (Outcome.QuickSwitch) outcome;
      kind = "quick-switch";
      index = quick.entryIndex();
      text = quick.hasEntry() ? result.mode().source().completion(index) : "";
      exitCode = EXIT_QUICK_SWITCH + quick.modeIndex();
    } else {
      throw new IllegalStateException("Unexpected final outcome " + outcome);
    }

    switch (format) {
      case TEXT:
        out.println(text);
        break;
      case INDEX:
        out.println(index);
        break;
      case JSON:
        JsonObject json = new JsonObject();
        json.addProperty("outcome", kind);
        json.addProperty("index", index);
        json.addProperty("text", text);
        json.addProperty("modified", modified);
        json.addProperty("mode", result.mode().name());
        out.println(gson.toJson(json));
        break;
      default:
        throw new IllegalStateException("Unhandled format " + format);
    }
    out.flush();
    return exitCode;
  }
}
