package edu.jhu.hlt.rstdep.datatypes;

import java.io.Serializable;

/**
 * An elementary discourse unit: its position in the text (num) and the
 * characters it covers.
 */
public class Edu implements Serializable {
  private static final long serialVersionUID = -1841325537512460811L;

  private final int num;
  private final Span span;

  public Edu(int num, Span span) {
    if (span == null)
      throw new IllegalArgumentException("EDU " + num + " has no span");
    this.num = num;
    this.span = span;
  }

  public Edu(int num, int charStart, int charEnd) {
    this(num, Span.getSpan(charStart, charEnd));
  }

  public int getNum() {
    return num;
  }

  public Span getSpan() {
    return span;
  }

  @Override
  public int hashCode() {
    return num * 83 + span.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Edu) {
      Edu e = (Edu) other;
      return num == e.num && span.equals(e.span);
    }
    return false;
  }

  @Override
  public String toString() {
    return "e" + num + "[" + span.shortString() + "]";
  }
}
