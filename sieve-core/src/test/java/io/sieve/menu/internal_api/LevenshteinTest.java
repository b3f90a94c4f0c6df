package io.sieve.menu.internal_api;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LevenshteinTest {

  @Test
  void classicExamples() {
    assertEquals(3, Levenshtein.distance("kitten", "sitting"));
    assertEquals(3, Levenshtein.distance("", "abc"));
    assertEquals(3, Levenshtein.distance("abc", ""));
    assertEquals(0, Levenshtein.distance("abc", "abc"));
  }

  @Test
  void transpositionCostsTwo() {
    assertEquals(2, Levenshtein.distance("ab", "ba"));
  }

  @Test
  void countsCodePointsNotChars() {
    // the emoji is one code point but two UTF-16 units
    assertEquals(1, Levenshtein.distance("😀a", "a"));
    assertEquals(1, Levenshtein.distance("😀", "😁"));
  }

  @Test
  void isSymmetric() {
    assertEquals(
        Levenshtein.distance("firefox", "file-manager"),
        Levenshtein.distance("file-manager", "firefox"));
  }
}
