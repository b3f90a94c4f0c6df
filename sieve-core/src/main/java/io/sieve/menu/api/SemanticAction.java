package io.sieve.menu.api;

/**
 * Actions a key stroke can be bound to. Declaration order is the dispatch priority: when a stroke
 * is bound to several actions, the first one declared here wins.
 */
public enum SemanticAction {
  CANCEL("kb-cancel", "Escape,Control+g,Control+bracketleft"),

  ROW_UP("kb-row-up", "Up,Control+p,ISO_Left_Tab"),
  ROW_TAB("kb-row-tab", "Tab"),
  ROW_DOWN("kb-row-down", "Down,Control+n"),
  ROW_LEFT("kb-row-left", "Control+Page_Up"),
  ROW_RIGHT("kb-row-right", "Control+Page_Down"),
  PAGE_PREV("kb-page-prev", "Page_Up"),
  PAGE_NEXT("kb-page-next", "Page_Down"),
  ROW_FIRST("kb-row-first", "Home,KP_Home"),
  ROW_LAST("kb-row-last", "End,KP_End"),
  ROW_SELECT("kb-row-select", "Control+space"),

  MODE_NEXT("kb-mode-next", "Shift+Right,Control+Tab"),
  MODE_PREVIOUS("kb-mode-previous", "Shift+Left,Control+ISO_Left_Tab"),

  TOGGLE_SORT("kb-toggle-sort", "Alt+grave"),
  TOGGLE_CASE_SENSITIVITY("kb-toggle-case-sensitivity", "grave"),

  DELETE_ENTRY("kb-delete-entry", "Shift+Delete"),

  CUSTOM_1("kb-custom-1", "Alt+1"),
  CUSTOM_2("kb-custom-2", "Alt+2"),
  CUSTOM_3("kb-custom-3", "Alt+3"),
  CUSTOM_4("kb-custom-4", "Alt+4"),
  CUSTOM_5("kb-custom-5", "Alt+5"),
  CUSTOM_6("kb-custom-6", "Alt+6"),
  CUSTOM_7("kb-custom-7", "Alt+7"),
  CUSTOM_8("kb-custom-8", "Alt+8"),
  CUSTOM_9("kb-custom-9", "Alt+9"),
  CUSTOM_10("kb-custom-10", "Alt+0"),
  CUSTOM_11("kb-custom-11", ""),
  CUSTOM_12("kb-custom-12", ""),
  CUSTOM_13("kb-custom-13", ""),
  CUSTOM_14("kb-custom-14", ""),
  CUSTOM_15("kb-custom-15", ""),
  CUSTOM_16("kb-custom-16", ""),
  CUSTOM_17("kb-custom-17", ""),
  CUSTOM_18("kb-custom-18", ""),
  CUSTOM_19("kb-custom-19", ""),

  REMOVE_CHAR_BACK("kb-remove-char-back", "BackSpace,Control+h"),
  REMOVE_CHAR_FORWARD("kb-remove-char-forward", "Delete,Control+d"),
  REMOVE_WORD_BACK("kb-remove-word-back", "Control+w"),
  CLEAR_LINE("kb-clear-line", "Control+u"),
  MOVE_CHAR_BACK("kb-move-char-back", "Left,Control+b"),
  MOVE_CHAR_FORWARD("kb-move-char-forward", "Right,Control+f"),
  MOVE_FRONT("kb-move-front", "Control+a"),
  MOVE_END("kb-move-end", "Control+e"),

  ACCEPT_ENTRY("kb-accept-entry", "Return,KP_Enter,Control+j,Control+m"),
  ACCEPT_CUSTOM("kb-accept-custom", "Control+Return");

  private final String configKey;
  private final String defaultBinding;

  SemanticAction(String configKey, String defaultBinding) {
    this.configKey = configKey;
    this.defaultBinding = defaultBinding;
  }

  /** Property key the binding is read from, e.g. {@code kb-row-up}. */
  public String configKey() {
    return configKey;
  }

  /** Comma separated default strokes, empty when unbound. */
  public String defaultBinding() {
    return defaultBinding;
  }

  /** Whether this is one of the quick-switch actions {@code CUSTOM_1..CUSTOM_19}. */
  public boolean isQuickSwitch() {
    return ordinal() >= CUSTOM_1.ordinal() && ordinal() <= CUSTOM_19.ordinal();
  }

  /**
   * Zero-based quick-switch index.
   *
   * @throws IllegalStateException if this is not a quick-switch action
   */
  public int quickSwitchIndex() {
    if (!isQuickSwitch()) {
      throw new IllegalStateException(name() + " is not a quick-switch action");
    }
    return ordinal() - CUSTOM_1.ordinal();
  }

  /**
   * Looks up an action by its configuration key.
   *
   * @return the action, or {@code null} if no action uses that key
   */
  public static SemanticAction fromConfigKey(String key) {
    for (SemanticAction a : values()) {
      if (a.configKey.equals(key)) {
        return a;
      }
    }
    return null;
  }
}
