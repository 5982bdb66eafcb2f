package edu.jhu.hlt.rstdep.datatypes;

import java.io.Serializable;

/**
 * Inclusive range of EDU numbers covered by a discourse (sub)tree. A leaf for
 * EDU i covers (i, i).
 */
public final class EduSpan implements Serializable {
  private static final long serialVersionUID = 5208842093391630012L;

  public final int first;  // inclusive
  public final int last;   // inclusive

  public EduSpan(int first, int last) {
    if (first > last)
      throw new IllegalArgumentException("first=" + first + " > last=" + last);
    this.first = first;
    this.last = last;
  }

  public static EduSpan single(int num) {
    return new EduSpan(num, num);
  }

  public boolean contains(int num) {
    return first <= num && num <= last;
  }

  public EduSpan union(EduSpan other) {
    return new EduSpan(Math.min(first, other.first), Math.max(last, other.last));
  }

  @Override
  public int hashCode() {
    return first * 83 + last;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof EduSpan) {
      EduSpan s = (EduSpan) other;
      return first == s.first && last == s.last;
    }
    return false;
  }

  @Override
  public String toString() {
    return "(" + first + "," + last + ")";
  }
}
