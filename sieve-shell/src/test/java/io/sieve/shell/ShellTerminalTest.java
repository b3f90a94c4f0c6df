package io.sieve.shell;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Path;
import org.jline.terminal.Size;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ShellTerminalTest {

  @TempDir Path dir;

  @Test
  void sizeIsRowsThenColumns() throws IOException {
    Size size = ShellTerminal.parseSize("24 80\n");

    assertEquals(24, size.getRows());
    assertEquals(80, size.getColumns());
  }

  @Test
  void malformedSizeIsRejected() {
    assertThrows(IOException.class, () -> ShellTerminal.parseSize("80"));
    assertThrows(IOException.class, () -> ShellTerminal.parseSize("rows cols"));
  }

  @Test
  void missingDeviceIsReported() {
    Path device = dir.resolve("tty0");

    IOException e = assertThrows(IOException.class, () -> ShellTerminal.onDevice(device));

    assertTrue(e.getMessage().contains(device.toString()));
  }
}
