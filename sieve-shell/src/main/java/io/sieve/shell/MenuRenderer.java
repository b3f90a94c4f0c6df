package io.sieve.shell;

import io.sieve.menu.api.EntrySource;
import io.sieve.menu.api.MenuEvent;
import io.sieve.menu.api.VisibleWindow;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/**
 * Lays a frame out as terminal lines: the prompt line, the element grid with an optional
 * scrollbar column, and a mode bar when more than one mode is loaded. Remembers the geometry of
 * the last frame, including the screen line it starts on, for mouse hit testing.
 */
final class MenuRenderer {
  static final AttributedStyle NORMAL = AttributedStyle.DEFAULT;
  static final AttributedStyle ALTERNATE =
      AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN);
  static final AttributedStyle SELECTED = AttributedStyle.DEFAULT.inverse();
  static final AttributedStyle PROMPT = AttributedStyle.BOLD;

  /**
   * What to draw.
   *
   * @param prompt text left of the query
   * @param query query text
   * @param cursor cursor position in the query
   * @param indicator matching state indicator
   * @param window visible window of the session
   * @param source entries, for display text
   * @param modeNames names of the loaded modes
   * @param currentMode index of the active mode
   */
  record Frame(
      String prompt,
      String query,
      int cursor,
      String indicator,
      VisibleWindow window,
      EntrySource source,
      List<String> modeNames,
      int currentMode) {}

  /**
   * Rendered lines.
   *
   * @param lines lines to draw, the prompt line first
   * @param cursorColumn cursor column on the prompt line
   * @param top screen line the prompt ends up on
   */
  record Screen(List<AttributedString> lines, int cursorColumn, int top) {}

  private int top;
  private int width;
  private int rows;
  private int columnWidth;
  private int gridColumns;
  private boolean scrollbar;
  private int filteredCount;
  private int modeBarLine = -1;
  private final List<int[]> modeButtons = new ArrayList<>();

  /**
   * Renders a frame.
   *
   * @param frame what to draw
   * @param width terminal width
   * @param height terminal height
   * @param top screen line the menu was started on; a menu that does not fit below it pushes
   *     the terminal content up
   */
  Screen render(Frame frame, int width, int height, int top) {
    VisibleWindow window = frame.window();
    this.width = Math.max(1, width);
    this.rows = window.rows();
    this.filteredCount = window.filteredCount();
    this.gridColumns = Math.max(1, window.columns());
    this.scrollbar = window.scrollbarLength() < window.filteredCount();
    int gridWidth = this.width - (scrollbar ? 1 : 0);
    this.columnWidth = Math.max(1, gridWidth / gridColumns);

    List<AttributedString> lines = new ArrayList<>();
    AttributedStringBuilder head = new AttributedStringBuilder();
    head.style(PROMPT).append(frame.prompt()).style(NORMAL).append(' ');
    int cursorColumn =
        head.columnLength() + columnLength(frame.query().substring(0, frame.cursor()));
    head.append(frame.query());
    int pad = this.width - head.columnLength() - frame.indicator().length();
    for (int i = 0; i < pad; i++) {
      head.append(' ');
    }
    head.append(frame.indicator());
    lines.add(head.toAttributedString().columnSubSequence(0, this.width));

    for (int row = 0; row < rows; row++) {
      AttributedStringBuilder line = new AttributedStringBuilder();
      for (int col = 0; col < gridColumns; col++) {
        int slot = col * rows + row;
        if (slot < window.size()) {
          AttributedStyle style =
              window.isSelected(slot)
                  ? SELECTED
                  : window.isAlternate(slot) ? ALTERNATE : NORMAL;
          line.style(style)
              .append(fit(frame.source().displayText(window.entryAt(slot)), columnWidth));
        } else {
          line.style(NORMAL).append(fit("", columnWidth));
        }
      }
      line.style(NORMAL);
      while (line.columnLength() < gridWidth) {
        line.append(' ');
      }
      if (scrollbar) {
        line.append(scrollbarCell(window, row));
      }
      lines.add(line.toAttributedString());
    }

    modeButtons.clear();
    modeBarLine = -1;
    if (frame.modeNames().size() > 1) {
      modeBarLine = lines.size();
      AttributedStringBuilder bar = new AttributedStringBuilder();
      for (int i = 0; i < frame.modeNames().size(); i++) {
        int start = bar.columnLength();
        bar.style(i == frame.currentMode() ? SELECTED : NORMAL)
            .append(' ')
            .append(frame.modeNames().get(i))
            .append(' ');
        modeButtons.add(new int[] {start, bar.columnLength()});
        bar.style(NORMAL).append(' ');
      }
      lines.add(bar.toAttributedString().columnSubSequence(0, this.width));
    }
    this.top = Math.max(0, Math.min(top, height - lines.size()));
    return new Screen(lines, Math.min(cursorColumn, this.width - 1), this.top);
  }

  /**
   * Maps a mouse press in screen coordinates to a menu event, using the last rendered frame.
   *
   * @param x zero-based column
   * @param y zero-based screen line
   * @param timeMillis press time
   * @return the event, empty if the press hit nothing
   */
  Optional<MenuEvent> hit(int x, int y, long timeMillis) {
    int line = y - top;
    if (line == modeBarLine) {
      for (int i = 0; i < modeButtons.size(); i++) {
        int[] range = modeButtons.get(i);
        if (x >= range[0] && x < range[1]) {
          return Optional.of(new MenuEvent.ModeClick(i));
        }
      }
      return Optional.empty();
    }
    int row = line - 1;
    if (row < 0 || row >= rows) {
      return Optional.empty();
    }
    if (scrollbar && x == width - 1) {
      int position = filteredCount > 0 ? row * filteredCount / rows : 0;
      return Optional.of(new MenuEvent.ScrollbarClick(position));
    }
    int col = x / columnWidth;
    if (col >= gridColumns) {
      return Optional.empty();
    }
    return Optional.of(new MenuEvent.ElementClick(col * rows + row, timeMillis));
  }

  private AttributedString scrollbarCell(VisibleWindow window, int row) {
    // handle covers the rows whose share of the list is on screen
    int from = window.scrollbarHandle() * rows / filteredCount;
    int end = window.scrollbarHandle() + window.scrollbarLength();
    int to = Math.max(from + 1, end * rows / filteredCount);
    boolean handle = row >= from && row < to;
    return new AttributedString(handle ? "█" : "│", NORMAL);
  }

  private static String fit(String text, int width) {
    String flat = text.replace('\t', ' ').replace('\n', ' ');
    AttributedString s = new AttributedString(flat);
    if (s.columnLength() > width) {
      return s.columnSubSequence(0, width).toString();
    }
    StringBuilder sb = new StringBuilder(flat);
    for (int i = s.columnLength(); i < width; i++) {
      sb.append(' ');
    }
    return sb.toString();
  }

  private static int columnLength(String text) {
    return new AttributedString(text).columnLength();
  }
}
