package io.sieve.menu.internal_api;

/** Edit distance with unit cost insertion, deletion and substitution over code points. */
public final class Levenshtein {
  private Levenshtein() {}

  public static int distance(String needle, String haystack) {
    int[] a = needle.codePoints().toArray();
    int[] b = haystack.codePoints().toArray();
    if (a.length == 0) {
      return b.length;
    }
    if (b.length == 0) {
      return a.length;
    }
    int[] prev = new int[b.length + 1];
    int[] curr = new int[b.length + 1];
    for (int j = 0; j <= b.length; j++) {
      prev[j] = j;
    }
    for (int i = 1; i <= a.length; i++) {
      curr[0] = i;
      for (int j = 1; j <= b.length; j++) {
        int cost = a[i - 1] == b[j - 1] ? 0 : 1;
        curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
      }
      int[] tmp = prev;
      prev = curr;
      curr = tmp;
    }
    return prev[b.length];
  }
}
