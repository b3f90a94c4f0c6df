package io.sieve.shell;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jline.terminal.Size;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The terminal the menu talks to. Normally that is the process terminal. When the entries were
 * piped in on stdin, keys are read from the controlling tty device instead; JLine only emulates a
 * line discipline for terminals built on plain streams, so the device itself is switched out of
 * canonical mode with {@code stty} and switched back on close.
 */
final class ShellTerminal implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(ShellTerminal.class);

  private final Terminal terminal;
  private final Path device;
  private final String savedMode;
  private final InputStream input;
  private final OutputStream output;

  private ShellTerminal(
      Terminal terminal, Path device, String savedMode, InputStream input, OutputStream output) {
    this.terminal = terminal;
    this.device = device;
    this.savedMode = savedMode;
    this.input = input;
    this.output = output;
  }

  /** The process terminal, drawing on stderr so stdout stays free for the result. */
  static ShellTerminal system() throws IOException {
    Terminal terminal =
        TerminalBuilder.builder()
            .system(true)
            .systemOutput(TerminalBuilder.SystemOutput.SysErr)
            .build();
    return new ShellTerminal(terminal, null, null, null, null);
  }

  /**
   * A terminal on a tty device, for when stdin is already used up by the entries.
   *
   * @param device the tty, normally {@code /dev/tty}
   * @throws IOException if the device cannot be opened or configured
   */
  static ShellTerminal onDevice(Path device) throws IOException {
    if (!Files.isReadable(device) || !Files.isWritable(device)) {
      throw new IOException(
          "Entries were read from stdin and no terminal is available at " + device);
    }
    String savedMode = stty(device, "-g").trim();
    Size size = parseSize(stty(device, "size"));
    stty(device, "-icanon", "-echo", "-iexten", "-isig", "-ixon", "-icrnl", "-inlcr");
    stty(device, "min", "1", "time", "0");
    InputStream input = null;
    OutputStream output = null;
    try {
      input = new FileInputStream(device.toFile());
      output = new FileOutputStream(device.toFile());
      TerminalBuilder builder =
          TerminalBuilder.builder()
              .system(false)
              .name("sieve")
              .encoding(StandardCharsets.UTF_8)
              .streams(input, output);
      String type = System.getenv("TERM");
      if (type != null && !type.isEmpty()) {
        builder.type(type);
      }
      Terminal terminal = builder.build();
      terminal.setSize(size);
      LOG.debug("Reading keys from {} ({}x{})", device, size.getColumns(), size.getRows());
      return new ShellTerminal(terminal, device, savedMode, input, output);
    } catch (IOException | RuntimeException e) {
      closeQuietly(input, e);
      closeQuietly(output, e);
      restore(device, savedMode, e);
      throw e;
    }
  }

  Terminal terminal() {
    return terminal;
  }

  @Override
  public void close() throws IOException {
    IOException failure = null;
    try {
      terminal.close();
    } catch (IOException e) {
      failure = e;
    }
    if (device != null) {
      try {
        input.close();
        output.close();
        stty(device, savedMode);
      } catch (IOException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  /** Parses the {@code rows columns} line printed by {@code stty size}. */
  static Size parseSize(String text) throws IOException {
    String[] parts = text.trim().split("\\s+");
    if (parts.length != 2) {
      throw new IOException("Unexpected terminal size '" + text.trim() + "'");
    }
    try {
      return new Size(Integer.parseInt(parts[1]), Integer.parseInt(parts[0]));
    } catch (NumberFormatException e) {
      throw new IOException("Unexpected terminal size '" + text.trim() + "'", e);
    }
  }

  private static String stty(Path device, String... args) throws IOException {
    List<String> command = new ArrayList<>();
    command.add("stty");
    command.addAll(List.of(args));
    Process process =
        new ProcessBuilder(command)
            .redirectInput(device.toFile())
            .redirectErrorStream(true)
            .start();
    String result = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
    try {
      int status = process.waitFor();
      if (status != 0) {
        throw new IOException(
            "stty " + String.join(" ", args) + " failed with status " + status + ": "
                + result.trim());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while running stty");
    }
    return result;
  }

  private static void restore(Path device, String savedMode, Exception pending) {
    try {
      stty(device, savedMode);
    } catch (IOException e) {
      pending.addSuppressed(e);
    }
  }

  private static void closeQuietly(AutoCloseable closeable, Exception pending) {
    if (closeable == null) {
      return;
    }
    try {
      closeable.close();
    } catch (Exception e) {
      pending.addSuppressed(e);
    }
  }
}
