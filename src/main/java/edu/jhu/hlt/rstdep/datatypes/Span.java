package edu.jhu.hlt.rstdep.datatypes;

import java.io.Serializable;

/**
 * A half-open span of character offsets, [start, end).
 *
 * Unlike token spans these are not interned: character offsets in a document
 * run into the tens of thousands, so an interning table indexed by
 * [start][width] would be far too big.
 *
 * @author travis
 */
public final class Span implements Comparable<Span>, Serializable {
  private static final long serialVersionUID = 3164302865791447290L;

  public final int start;  // inclusive
  public final int end;    // non-inclusive

  public static Span getSpan(int start, int end) {
    if (start < 0 || start > end) {
      throw new IllegalArgumentException(
          "need 0 <= start <= end: start=" + start + " end=" + end);
    }
    return new Span(start, end);
  }

  private Span(int start, int end) {
    this.start = start;
    this.end = end;
  }

  public int width() { return end - start; }

  /**
   * return true if this span is to the left of
   * other with no overlap.
   */
  public boolean before(Span other) {
    return this.end <= other.start;
  }

  /**
   * return true if this span is to the right of
   * other with no overlap.
   */
  public boolean after(Span other) {
    return this.start >= other.end;
  }

  public boolean covers(Span other) {
    return this.start <= other.start && other.end <= this.end;
  }

  public boolean overlaps(Span other) {
    if(end <= other.start) return false;
    if(start >= other.end) return false;
    return true;
  }

  /** The smallest span covering both this and other (gaps included). */
  public Span merge(Span other) {
    return new Span(Math.min(start, other.start), Math.max(end, other.end));
  }

  @Override
  public String toString() {
    return String.format("<Span %d-%d>", start, end);
  }

  public String shortString() {
    return start + "-" + end;
  }

  @Override
  public int hashCode() {
    return 31 * start + (end - start);
  }

  @Override
  public boolean equals(Object other) {
    if(other instanceof Span) {
      Span s = (Span) other;
      return start == s.start && end == s.end;
    }
    return false;
  }

  /** Textual order: by start, then by end. */
  @Override
  public int compareTo(Span o) {
    int c1 = start - o.start;
    if (c1 != 0) return c1;
    return end - o.end;
  }
}
