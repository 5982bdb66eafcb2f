package edu.jhu.hlt.rstdep.datatypes;

import static org.junit.Assert.*;

import org.junit.Test;

public class SpanTest {

  @Test
  public void basic() {
    for(int i=0; i<10; i++) {
      for(int j=i; j<100; j++) {
        Span s1 = Span.getSpan(i, j);
        Span s2 = Span.getSpan(i, j);
        assertTrue(s1.equals(s2));
        assertEquals(s1.hashCode(), s2.hashCode());
        assertEquals(i, s1.start);
        assertEquals(j, s1.end);
        assertEquals(j - i, s1.width());
      }
    }
  }

  @Test
  public void overlap() {
    Span s1 = Span.getSpan(0, 1);
    Span s2 = Span.getSpan(0, 2);
    Span s3 = Span.getSpan(1, 2);
    assertEquals(true, s1.overlaps(s2));
    assertEquals(false, s1.overlaps(s3));
    assertEquals(true, s2.overlaps(s3));

    // reflexivity
    Span[] spans = new Span[] { s1, s2, s3 };
    for(int i=0; i<spans.length-1; i++) {
      for(int j=i+1; j<spans.length; j++) {
        Span sa = spans[i];
        Span sb = spans[j];
        assertEquals(sa.overlaps(sb), sb.overlaps(sa));
      }
    }
  }

  @Test
  public void merge() {
    Span a = Span.getSpan(3, 7);
    Span b = Span.getSpan(12, 20);
    Span m = a.merge(b);
    assertEquals(Span.getSpan(3, 20), m);
    assertEquals(m, b.merge(a));
    assertTrue(m.covers(a));
    assertTrue(m.covers(b));
    assertTrue(a.before(b));
    assertTrue(b.after(a));
  }

  @Test
  public void textOrder() {
    assertTrue(Span.getSpan(0, 5).compareTo(Span.getSpan(5, 6)) < 0);
    assertTrue(Span.getSpan(5, 6).compareTo(Span.getSpan(0, 5)) > 0);
    assertTrue(Span.getSpan(0, 5).compareTo(Span.getSpan(0, 9)) < 0);
    assertEquals(0, Span.getSpan(2, 4).compareTo(Span.getSpan(2, 4)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void backwards() {
    Span.getSpan(5, 4);
  }
}
