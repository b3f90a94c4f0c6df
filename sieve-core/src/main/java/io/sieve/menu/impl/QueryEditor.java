package io.sieve.menu.impl;

/**
 * Query text with a cursor. Positions count UTF-16 units and never split a surrogate pair.
 *
 * <p>Mutating methods return whether the text changed, so the caller knows to refilter.
 */
final class QueryEditor {
  private final StringBuilder text;
  private int cursor;

  QueryEditor(String initial) {
    this.text = new StringBuilder(initial == null ? "" : initial);
    this.cursor = text.length();
  }

  String text() {
    return text.toString();
  }

  int cursor() {
    return cursor;
  }

  boolean insert(String value) {
    if (value.isEmpty()) {
      return false;
    }
    text.insert(cursor, value);
    cursor += value.length();
    return true;
  }

  /** Replaces the whole text and moves the cursor to the end. */
  boolean replace(String value) {
    boolean changed = !text.toString().equals(value);
    text.setLength(0);
    text.append(value);
    cursor = text.length();
    return changed;
  }

  boolean removeCharBack() {
    if (cursor == 0) {
      return false;
    }
    int start = text.offsetByCodePoints(cursor, -1);
    text.delete(start, cursor);
    cursor = start;
    return true;
  }

  boolean removeCharForward() {
    if (cursor >= text.length()) {
      return false;
    }
    int end = text.offsetByCodePoints(cursor, 1);
    text.delete(cursor, end);
    return true;
  }

  /** Deletes trailing whitespace before the cursor, then the word before it. */
  boolean removeWordBack() {
    int start = cursor;
    while (start > 0 && Character.isWhitespace(text.charAt(start - 1))) {
      start--;
    }
    while (start > 0 && !Character.isWhitespace(text.charAt(start - 1))) {
      start--;
    }
    if (start == cursor) {
      return false;
    }
    text.delete(start, cursor);
    cursor = start;
    return true;
  }

  boolean clear() {
    if (text.length() == 0) {
      return false;
    }
    text.setLength(0);
    cursor = 0;
    return true;
  }

  void moveBack() {
    if (cursor > 0) {
      cursor = text.offsetByCodePoints(cursor, -1);
    }
  }

  void moveForward() {
    if (cursor < text.length()) {
      cursor = text.offsetByCodePoints(cursor, 1);
    }
  }

  void moveFront() {
    cursor = 0;
  }

  void moveEnd() {
    cursor = text.length();
  }
}
