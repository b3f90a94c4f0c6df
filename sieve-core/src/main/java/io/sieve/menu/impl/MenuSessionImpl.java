package io.sieve.menu.impl;

import io.sieve.menu.api.ActionResolver;
import io.sieve.menu.api.EntrySource;
import io.sieve.menu.api.KeyStroke;
import io.sieve.menu.api.MatchingState;
import io.sieve.menu.api.MenuConfig;
import io.sieve.menu.api.MenuEvent;
import io.sieve.menu.api.MenuSession;
import io.sieve.menu.api.Modifier;
import io.sieve.menu.api.Outcome;
import io.sieve.menu.api.SemanticAction;
import io.sieve.menu.api.SessionState;
import io.sieve.menu.api.VisibleWindow;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selection and event state machine of one session.
 *
 * <p>Key strokes are dispatched over {@link SemanticAction} in declaration order; the first bound
 * action that consumes the stroke wins. Unconsumed printable strokes edit the query. Any change to
 * the query, the case mode or the ranking flag triggers one synchronous filter pass before the
 * event returns.
 */
final class MenuSessionImpl implements MenuSession {
  private static final Logger log = LoggerFactory.getLogger(MenuSessionImpl.class);

  private final EntrySource source;
  private final ActionResolver resolver;
  private final FilterEngine filterEngine;
  private final MenuConfig config;
  private final boolean[] notAscii;
  private final int entryCount;
  private final Layout layout;
  private final SelectionModel selection;
  private final ScrollPolicy scroll;
  private final QueryEditor query;

  private MatchingState matching;
  private IntList filtered = IntLists.EMPTY_LIST;
  private SessionState state = SessionState.INTERACTIVE;
  private boolean refilter = false;
  private KeyStroke previousKey;
  private long lastClickMillis = -1;
  private int windowOffset = 0;

  MenuSessionImpl(
      EntrySource source,
      ActionResolver resolver,
      FilterEngine filterEngine,
      boolean[] notAscii,
      MenuConfig config,
      String initialQuery) {
    this.source = Objects.requireNonNull(source, "source");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.filterEngine = filterEngine;
    this.notAscii = notAscii;
    this.config = config;
    this.entryCount = source.count();
    this.layout =
        Layout.compute(config.lines(), config.columns(), config.fixedNumLines(), entryCount);
    this.selection = new SelectionModel(layout);
    this.scroll = ScrollPolicy.create(config.scrollMethod(), layout);
    this.query = new QueryEditor(initialQuery);
    this.matching = new MatchingState(config.caseSensitive(), config.levenshteinSort());
    log.debug("New session over {} entries, layout {}", entryCount, layout);
    refilter();
  }

  @Override
  public SessionState feedEvent(MenuEvent event) {
    Objects.requireNonNull(event, "event");
    if (state.isTerminal()) {
      return state;
    }
    if (event instanceof MenuEvent.Key) {
      onKey((MenuEvent.Key) event);
    } else if (event instanceof MenuEvent.Paste) {
      refilter |= query.insert(stripTrailingNewlines(((MenuEvent.Paste) event).text()));
    } else if (event instanceof MenuEvent.Scroll) {
      onScroll(((MenuEvent.Scroll) event).direction());
    } else if (event instanceof MenuEvent.ScrollbarClick) {
      selection.select(((MenuEvent.ScrollbarClick) event).position());
    } else if (event instanceof MenuEvent.ModeClick) {
      int modeIndex = ((MenuEvent.ModeClick) event).modeIndex();
      terminate(new Outcome.QuickSwitch(modeIndex, Outcome.NO_ENTRY));
    } else if (event instanceof MenuEvent.ElementClick) {
      onElementClick((MenuEvent.ElementClick) event);
    }
    if (refilter && !state.isTerminal()) {
      refilter();
    }
    refilter = false;
    return state;
  }

  private void onKey(MenuEvent.Key key) {
    KeyStroke stroke = key.stroke();
    boolean handled = false;
    for (SemanticAction action : SemanticAction.values()) {
      if (resolver.test(action, stroke) && dispatch(action, stroke)) {
        handled = true;
        break;
      }
    }
    if (!handled && isPrintable(key)) {
      refilter |= query.insert(key.text());
    }
    previousKey = stroke;
  }

  private static boolean isPrintable(MenuEvent.Key key) {
    KeyStroke stroke = key.stroke();
    return !key.text().isEmpty()
        && !stroke.has(Modifier.CONTROL)
        && !stroke.has(Modifier.ALT)
        && !stroke.has(Modifier.SUPER);
  }

  /** Runs an action; returns {@code false} when the action does not apply and dispatch goes on. */
  private boolean dispatch(SemanticAction action, KeyStroke stroke) {
    switch (action) {
      case CANCEL:
        terminate(new Outcome.Cancel());
        return true;
      case ROW_UP:
        selection.up();
        return true;
      case ROW_TAB:
        rowTab(stroke);
        return true;
      case ROW_DOWN:
        selection.down();
        return true;
      case ROW_LEFT:
        selection.left();
        return true;
      case ROW_RIGHT:
        selection.right();
        return true;
      case PAGE_PREV:
        selection.pagePrev();
        return true;
      case PAGE_NEXT:
        selection.pageNext();
        return true;
      case ROW_FIRST:
        selection.first();
        return true;
      case ROW_LAST:
        selection.last();
        return true;
      case ROW_SELECT:
        if (selection.hasSelection()) {
          refilter |= query.replace(source.completion(selectedEntry()));
        }
        return true;
      case MODE_NEXT:
        terminate(new Outcome.NextMode());
        return true;
      case MODE_PREVIOUS:
        terminate(new Outcome.PreviousMode());
        return true;
      case TOGGLE_SORT:
        matching = matching.toggleSort();
        refilter = true;
        return true;
      case TOGGLE_CASE_SENSITIVITY:
        matching = matching.toggleCase();
        refilter = true;
        return true;
      case DELETE_ENTRY:
        if (!selection.hasSelection()) {
          return false;
        }
        terminate(new Outcome.DeleteEntry(selectedEntry()));
        return true;
      case CUSTOM_1:
      case CUSTOM_2:
      case CUSTOM_3:
      case CUSTOM_4:
      case CUSTOM_5:
      case CUSTOM_6:
      case CUSTOM_7:
      case CUSTOM_8:
      case CUSTOM_9:
      case CUSTOM_10:
      case CUSTOM_11:
      case CUSTOM_12:
      case CUSTOM_13:
      case CUSTOM_14:
      case CUSTOM_15:
      case CUSTOM_16:
      case CUSTOM_17:
      case CUSTOM_18:
      case CUSTOM_19:
        terminate(new Outcome.QuickSwitch(action.quickSwitchIndex(), selectedEntry()));
        return true;
      case REMOVE_CHAR_BACK:
        refilter |= query.removeCharBack();
        return true;
      case REMOVE_CHAR_FORWARD:
        refilter |= query.removeCharForward();
        return true;
      case REMOVE_WORD_BACK:
        refilter |= query.removeWordBack();
        return true;
      case CLEAR_LINE:
        refilter |= query.clear();
        return true;
      case MOVE_CHAR_BACK:
        query.moveBack();
        return true;
      case MOVE_CHAR_FORWARD:
        query.moveForward();
        return true;
      case MOVE_FRONT:
        query.moveFront();
        return true;
      case MOVE_END:
        query.moveEnd();
        return true;
      case ACCEPT_ENTRY:
        accept(false);
        return true;
      case ACCEPT_CUSTOM:
        accept(true);
        return true;
      default:
        throw new IllegalStateException("Unhandled action " + action);
    }
  }

  private void rowTab(KeyStroke stroke) {
    int count = filtered.size();
    if (count == 1) {
      terminate(new Outcome.Accept(selectedEntry(), false));
    } else if (count == 0 && stroke.equals(previousKey)) {
      terminate(new Outcome.NextMode());
    } else {
      selection.down();
    }
  }

  private void accept(boolean modified) {
    if (selection.hasSelection()) {
      terminate(new Outcome.Accept(selectedEntry(), modified));
    } else {
      terminate(new Outcome.AcceptCustomText(query.text(), modified));
    }
  }

  private void onScroll(MenuEvent.Direction direction) {
    switch (direction) {
      case UP:
        selection.up();
        break;
      case DOWN:
        selection.down();
        break;
      case LEFT:
        selection.left();
        break;
      case RIGHT:
        selection.right();
        break;
      default:
        throw new IllegalStateException("Unhandled direction " + direction);
    }
  }

  private void onElementClick(MenuEvent.ElementClick click) {
    int slot = click.slot();
    if (slot < 0 || slot >= layout.maxElements()) {
      return;
    }
    int position = windowOffset + slot;
    if (position >= filtered.size()) {
      return;
    }
    selection.select(position);
    if (lastClickMillis >= 0 && click.timeMillis() - lastClickMillis < config.doubleClickMillis()) {
      terminate(new Outcome.Accept(selectedEntry(), false));
    }
    lastClickMillis = click.timeMillis();
  }

  private void refilter() {
    filtered = filterEngine.filter(source, notAscii, query.text(), matching);
    selection.refiltered(filtered.size());
    scroll.invalidate();
    if (config.autoSelect() && filtered.size() == 1 && entryCount > 1) {
      terminate(new Outcome.Accept(selectedEntry(), false));
    }
  }

  private void terminate(Outcome outcome) {
    log.debug("Session finished: {}", outcome);
    state = new SessionState.Terminal(outcome);
  }

  private static String stripTrailingNewlines(String text) {
    int end = text.length();
    while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
      end--;
    }
    return text.substring(0, end);
  }

  @Override
  public SessionState state() {
    return state;
  }

  @Override
  public VisibleWindow currentVisibleWindow() {
    int count = filtered.size();
    int rows = layout.rows();
    int offset = scroll.offset(selection.selected(), count);
    windowOffset = offset;
    boolean fullRedraw = scroll.takeFullRedraw();
    int available = Math.max(0, Math.min(count - offset, layout.maxElements()));
    int columns = Math.min(Layout.ceilDiv(available, rows), layout.columns());
    int visible = Math.min(available, rows * columns);
    IntList entries = new IntArrayList(filtered.subList(offset, offset + visible));
    int selected = selection.selected();
    int selectedSlot =
        count > 0 && selected >= offset && selected < offset + visible ? selected - offset : -1;
    return new VisibleWindow(
        offset,
        entries,
        selectedSlot,
        rows,
        columns,
        count,
        fullRedraw,
        scroll.page(),
        offset,
        columns * rows);
  }

  @Override
  public String currentQueryText() {
    return query.text();
  }

  @Override
  public int cursorPosition() {
    return query.cursor();
  }

  @Override
  public int filteredCount() {
    return filtered.size();
  }

  @Override
  public IntList filteredEntries() {
    return IntLists.unmodifiable(filtered);
  }

  @Override
  public int selectedIndex() {
    return selection.hasSelection() ? selection.selected() : -1;
  }

  @Override
  public int selectedEntry() {
    return selection.hasSelection() ? filtered.getInt(selection.selected()) : Outcome.NO_ENTRY;
  }

  @Override
  public MatchingState matchingState() {
    return matching;
  }

  @Override
  public boolean selectEntry(int entryIndex) {
    int position = filtered.indexOf(entryIndex);
    if (position < 0) {
      selection.select(0);
      return false;
    }
    selection.select(position);
    return true;
  }

  @Override
  public int nextEntryIndex() {
    if (!selection.hasSelection()) {
      return Outcome.NO_ENTRY;
    }
    int next = selection.selected() + 1;
    return filtered.getInt(next < filtered.size() ? next : selection.selected());
  }

  @Override
  public void restart() {
    state = SessionState.INTERACTIVE;
    lastClickMillis = -1;
    scroll.invalidate();
  }

  Layout layout() {
    return layout;
  }
}
