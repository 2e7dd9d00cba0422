package hypersum.common.utils;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("fast")
public class ListSupportTest {
  @Test
  public void testMap() {
    final List<Integer> xs = List.of(1, 2, 3, 4);
    assertEquals(List.of(2, 4, 6, 8), ListSupport.map(xs, x -> x * 2));
    assertEquals(List.of(), ListSupport.map(List.<Integer>of(), x -> x * 2));
  }

  @Test
  public void testIterablePredicates() {
    final List<Integer> xs = List.of(1, 3, 5);
    assertTrue(IterableSupport.all(xs, x -> x % 2 == 1));
    assertFalse(IterableSupport.any(xs, x -> x > 5));
    assertTrue(IterableSupport.any(xs, x -> x == 3));
  }

  @Test
  public void testIntProperty() {
    assertEquals(7, Commons.parseIntProperty("hypersum.test.absent_property", 7));
    System.setProperty("hypersum.test.present_property", " 12 ");
    assertEquals(12, Commons.parseIntProperty("hypersum.test.present_property", 7));
    System.setProperty("hypersum.test.bad_property", "x");
    assertThrows(
        IllegalArgumentException.class,
        () -> Commons.parseIntProperty("hypersum.test.bad_property", 7));
  }
}
