package io.sieve.shell;

import io.sieve.menu.api.KeyStroke;
import io.sieve.menu.api.MenuEvent;
import io.sieve.menu.api.MenuSession;
import io.sieve.menu.api.Outcome;
import io.sieve.menu.api.SessionState;
import io.sieve.menu.api.VisibleWindow;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.jline.keymap.BindingReader;
import org.jline.keymap.KeyMap;
import org.jline.terminal.Attributes;
import org.jline.terminal.Cursor;
import org.jline.terminal.MouseEvent;
import org.jline.terminal.Size;
import org.jline.terminal.Terminal;
import org.jline.utils.Display;
import org.jline.utils.InfoCmp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a session from a JLine terminal in raw mode and draws it with {@link Display} below the
 * line the cursor was on at startup. The terminal is restored when the menu is closed.
 */
final class TerminalMenu implements MenuLoop.Interactor, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(TerminalMenu.class);

  private final Terminal terminal;
  private final String prompt;
  private final Attributes original;
  private final BindingReader bindingReader;
  private final KeyMap<KeyStroke> keyMap;
  private final Display display;
  private final MenuRenderer renderer = new MenuRenderer();
  private int top;

  TerminalMenu(Terminal terminal, String prompt) {
    this.terminal = terminal;
    this.prompt = prompt;
    this.original = terminal.enterRawMode();
    this.bindingReader = new BindingReader(terminal.reader());
    this.keyMap = TerminalKeys.keyMap(terminal);
    this.display = new Display(terminal, false);
    this.top = startLine(terminal);
    terminal.trackMouse(Terminal.MouseTracking.Normal);
  }

  /**
   * Line the menu starts on. Terminals that cannot report the cursor are cleared so the menu
   * starts at the top.
   */
  private static int startLine(Terminal terminal) {
    Cursor cursor = terminal.getCursorPosition(discarded -> {});
    if (cursor != null) {
      return cursor.getY();
    }
    LOG.debug("Terminal does not report the cursor position, clearing the screen");
    terminal.puts(InfoCmp.Capability.clear_screen);
    terminal.flush();
    return 0;
  }

  /** Rows available for entries, for configurations that ask to fit the terminal. */
  static int availableLines(Terminal terminal, int modeCount) {
    int reserved = 1 + (modeCount > 1 ? 1 : 0);
    return Math.max(1, terminal.getHeight() - reserved);
  }

  @Override
  public Outcome interact(MenuSession session, Modes modes) throws IOException {
    draw(session, modes);
    while (true) {
      KeyStroke stroke = bindingReader.readBinding(keyMap);
      if (stroke == null) {
        // input closed
        return new Outcome.Cancel();
      }
      Optional<MenuEvent> event = toEvent(stroke);
      if (event.isEmpty()) {
        continue;
      }
      SessionState state = session.feedEvent(event.get());
      if (state.isTerminal()) {
        return ((SessionState.Terminal) state).outcome();
      }
      draw(session, modes);
    }
  }

  private Optional<MenuEvent> toEvent(KeyStroke stroke) {
    String last = bindingReader.getLastBinding();
    if (stroke == TerminalKeys.TYPED) {
      return Optional.of(TerminalKeys.typed(last));
    }
    if (stroke == TerminalKeys.UNKNOWN) {
      LOG.debug("Ignoring unbound input sequence of length {}", last == null ? 0 : last.length());
      return Optional.empty();
    }
    if (stroke == TerminalKeys.MOUSE) {
      return mouseEvent(terminal.readMouseEvent(bindingReader::readCharacter));
    }
    boolean printable =
        stroke.modifiers().isEmpty()
            && last != null
            && last.length() == 1
            && last.charAt(0) >= ' '
            && last.charAt(0) < 0x7f;
    return Optional.of(printable ? new MenuEvent.Key(stroke, last) : MenuEvent.Key.of(stroke));
  }

  private Optional<MenuEvent> mouseEvent(MouseEvent mouse) {
    if (mouse.getType() == MouseEvent.Type.Wheel) {
      if (mouse.getButton() == MouseEvent.Button.WheelUp) {
        return Optional.of(new MenuEvent.Scroll(MenuEvent.Direction.UP));
      }
      if (mouse.getButton() == MouseEvent.Button.WheelDown) {
        return Optional.of(new MenuEvent.Scroll(MenuEvent.Direction.DOWN));
      }
      return Optional.empty();
    }
    if (mouse.getType() == MouseEvent.Type.Pressed
        && mouse.getButton() == MouseEvent.Button.Button1) {
      return renderer.hit(mouse.getX(), mouse.getY(), System.currentTimeMillis());
    }
    return Optional.empty();
  }

  private void draw(MenuSession session, Modes modes) {
    Size size = terminal.getSize();
    display.resize(size.getRows(), size.getColumns());
    VisibleWindow window = session.currentVisibleWindow();
    MenuRenderer.Screen screen =
        renderer.render(
            new MenuRenderer.Frame(
                prompt,
                session.currentQueryText(),
                session.cursorPosition(),
                session.matchingState().indicator(),
                window,
                modes.current().source(),
                modes.names(),
                modes.currentIndex()),
            size.getColumns(),
            size.getRows(),
            top);
    top = screen.top();
    display.update(screen.lines(), size.cursorPos(0, screen.cursorColumn()));
    terminal.flush();
  }

  @Override
  public void close() {
    terminal.trackMouse(Terminal.MouseTracking.Off);
    display.update(List.of(), 0);
    terminal.setAttributes(original);
    terminal.flush();
  }
}
