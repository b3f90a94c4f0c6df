package io.sieve.menu.api;

import java.util.Objects;

/** Input delivered to a {@link MenuSession}. */
public sealed interface MenuEvent
    permits MenuEvent.Key,
        MenuEvent.Paste,
        MenuEvent.Scroll,
        MenuEvent.ElementClick,
        MenuEvent.ModeClick,
        MenuEvent.ScrollbarClick {

  /** Wheel direction, X11 buttons 4 to 7. */
  enum Direction {
    UP,
    DOWN,
    LEFT,
    RIGHT
  }

  /**
   * A key press.
   *
   * @param stroke the key and its modifiers
   * @param text printable text the key produced, empty for function keys
   */
  record Key(KeyStroke stroke, String text) implements MenuEvent {
    public Key {
      Objects.requireNonNull(stroke, "stroke");
      text = text == null ? "" : text;
    }

    public static Key of(KeyStroke stroke) {
      return new Key(stroke, "");
    }

    /** A plain printable character, e.g. {@code typed("f")}. */
    public static Key typed(String text) {
      return new Key(KeyStroke.of(text), text);
    }
  }

  /** Clipboard contents inserted at the cursor. */
  record Paste(String text) implements MenuEvent {
    public Paste {
      Objects.requireNonNull(text, "text");
    }
  }

  /** Mouse wheel. */
  record Scroll(Direction direction) implements MenuEvent {
    public Scroll {
      Objects.requireNonNull(direction, "direction");
    }
  }

  /**
   * Button press on a visible element slot.
   *
   * @param slot zero-based slot within the visible window
   * @param timeMillis event timestamp, used for double-press detection
   */
  record ElementClick(int slot, long timeMillis) implements MenuEvent {}

  /** Button press on a mode switcher button. */
  record ModeClick(int modeIndex) implements MenuEvent {}

  /** Press or drag on the scrollbar, already translated to a filtered position. */
  record ScrollbarClick(int position) implements MenuEvent {}
}
