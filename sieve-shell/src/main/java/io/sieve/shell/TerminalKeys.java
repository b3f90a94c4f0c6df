package io.sieve.shell;

import io.sieve.menu.api.KeyStroke;
import io.sieve.menu.api.MenuEvent;
import io.sieve.menu.api.Modifier;
import java.util.Map;
import org.jline.keymap.KeyMap;
import org.jline.terminal.Terminal;
import org.jline.utils.InfoCmp.Capability;

/**
 * Translates terminal input sequences into {@link KeyStroke}s named after X11 keysyms, so the same
 * {@code kb-*} bindings work in the terminal.
 */
final class TerminalKeys {

  /** Bound to printable input that has no sequence of its own; see {@link #typed(String)}. */
  static final KeyStroke TYPED = KeyStroke.of("__typed__");

  /** Bound to the mouse report prefix. */
  static final KeyStroke MOUSE = KeyStroke.of("__mouse__");

  /** Bound to sequences nothing else claims. */
  static final KeyStroke UNKNOWN = KeyStroke.of("__unknown__");

  private static final Map<Character, String> KEYSYMS =
      Map.ofEntries(
          Map.entry(' ', "space"),
          Map.entry('!', "exclam"),
          Map.entry('"', "quotedbl"),
          Map.entry('#', "numbersign"),
          Map.entry('$', "dollar"),
          Map.entry('%', "percent"),
          Map.entry('&', "ampersand"),
          Map.entry('\'', "apostrophe"),
          Map.entry('(', "parenleft"),
          Map.entry(')', "parenright"),
          Map.entry('*', "asterisk"),
          Map.entry('+', "plus"),
          Map.entry(',', "comma"),
          Map.entry('-', "minus"),
          Map.entry('.', "period"),
          Map.entry('/', "slash"),
          Map.entry(':', "colon"),
          Map.entry(';', "semicolon"),
          Map.entry('<', "less"),
          Map.entry('=', "equal"),
          Map.entry('>', "greater"),
          Map.entry('?', "question"),
          Map.entry('@', "at"),
          Map.entry('[', "bracketleft"),
          Map.entry('\\', "backslash"),
          Map.entry(']', "bracketright"),
          Map.entry('^', "asciicircum"),
          Map.entry('_', "underscore"),
          Map.entry('`', "grave"),
          Map.entry('{', "braceleft"),
          Map.entry('|', "bar"),
          Map.entry('}', "braceright"),
          Map.entry('~', "asciitilde"));

  private TerminalKeys() {}

  /** X11 keysym name of a printable character. */
  static String keysym(char c) {
    String name = KEYSYMS.get(c);
    return name != null ? name : String.valueOf(c);
  }

  /** Key event for printable text that reached the unicode fallback binding. */
  static MenuEvent.Key typed(String text) {
    if (text.length() == 1) {
      return new MenuEvent.Key(KeyStroke.of(keysym(text.charAt(0))), text);
    }
    return new MenuEvent.Key(KeyStroke.of(text), text);
  }

  /**
   * Builds the key map for a terminal.
   *
   * @param terminal terminal whose terminfo describes the function keys
   * @return map from input sequences to strokes
   */
  static KeyMap<KeyStroke> keyMap(Terminal terminal) {
    KeyMap<KeyStroke> map = new KeyMap<>();
    map.setUnicode(TYPED);
    map.setNomatch(UNKNOWN);
    map.setAmbiguousTimeout(50);

    for (char c = ' '; c < 0x7f; c++) {
      map.bind(KeyStroke.of(keysym(c)), String.valueOf(c));
      map.bind(KeyStroke.of(keysym(c), Modifier.ALT), KeyMap.alt(c));
    }
    for (char c = 'a'; c <= 'z'; c++) {
      map.bind(KeyStroke.of(String.valueOf(c), Modifier.CONTROL), KeyMap.ctrl(c));
    }
    map.bind(KeyStroke.of("space", Modifier.CONTROL), "\u0000");
    map.bind(KeyStroke.of("Tab"), "\t");
    map.bind(KeyStroke.of("Return"), "\r");
    map.bind(KeyStroke.of("BackSpace"), KeyMap.del());
    map.bind(KeyStroke.of("Escape"), KeyMap.esc());

    bind(map, terminal, Capability.key_up, KeyStroke.of("Up"), "\033[A", "\033OA");
    bind(map, terminal, Capability.key_down, KeyStroke.of("Down"), "\033[B", "\033OB");
    bind(map, terminal, Capability.key_right, KeyStroke.of("Right"), "\033[C", "\033OC");
    bind(map, terminal, Capability.key_left, KeyStroke.of("Left"), "\033[D", "\033OD");
    bind(map, terminal, Capability.key_home, KeyStroke.of("Home"), "\033[H", "\033[1~");
    bind(map, terminal, Capability.key_end, KeyStroke.of("End"), "\033[F", "\033[4~");
    bind(map, terminal, Capability.key_ppage, KeyStroke.of("Page_Up"), "\033[5~");
    bind(map, terminal, Capability.key_npage, KeyStroke.of("Page_Down"), "\033[6~");
    bind(map, terminal, Capability.key_dc, KeyStroke.of("Delete"), "\033[3~");
    bind(map, terminal, Capability.key_btab, KeyStroke.of("ISO_Left_Tab"), "\033[Z");
    bind(map, terminal, Capability.key_sright, KeyStroke.of("Right", Modifier.SHIFT), "\033[1;2C");
    bind(map, terminal, Capability.key_sleft, KeyStroke.of("Left", Modifier.SHIFT), "\033[1;2D");
    bind(map, terminal, Capability.key_sdc, KeyStroke.of("Delete", Modifier.SHIFT), "\033[3;2~");
    // xterm modifier encodings with no terminfo capability
    map.bind(KeyStroke.of("Page_Up", Modifier.CONTROL), "\033[5;5~");
    map.bind(KeyStroke.of("Page_Down", Modifier.CONTROL), "\033[6;5~");
    map.bind(KeyStroke.of("Return", Modifier.CONTROL), "\033[13;5u");

    String mouse = KeyMap.key(terminal, Capability.key_mouse);
    if (mouse != null && !mouse.isEmpty()) {
      map.bind(MOUSE, mouse);
    }
    return map;
  }

  private static void bind(
      KeyMap<KeyStroke> map,
      Terminal terminal,
      Capability capability,
      KeyStroke stroke,
      String... fallbacks) {
    String seq = KeyMap.key(terminal, capability);
    if (seq != null && !seq.isEmpty()) {
      map.bind(stroke, seq);
    }
    for (String fallback : fallbacks) {
      map.bind(stroke, fallback);
    }
  }
}
