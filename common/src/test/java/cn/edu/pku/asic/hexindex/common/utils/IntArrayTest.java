package cn.edu.pku.asic.hexindex.common.utils;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class IntArrayTest {

  @Test
  public void testGrowBeyondInitialCapacity() {
    IntArray array = new IntArray();
    for (int i = 0; i < 100; i++)
      array.add(i * 2);
    assertEquals(100, array.size());
    assertEquals(40, array.get(20));
    assertEquals(198, array.get(99));
  }

  @Test
  public void testAppendAndPop() {
    IntArray array = new IntArray();
    array.append(new int[] {5, 3, 9, 1}, 1, 3);
    assertArrayEquals(new int[] {3, 9, 1}, array.toArray());
    assertEquals(1, array.pop());
    assertEquals(9, array.pop());
    assertEquals(3, array.pop());
    assertTrue(array.isEmpty());
  }

  @Test
  public void testSortAndIterate() {
    IntArray array = new IntArray();
    array.append(new int[] {4, 2, 8}, 0, 3);
    assertEquals("4,2,8", array.toString());
    array.sort();
    assertEquals("2,4,8", array.toString());
    int sum = 0;
    for (int x : array)
      sum += x;
    assertEquals(14, sum);
  }

  @Test
  public void testGetOutOfBounds() {
    IntArray array = new IntArray();
    array.add(1);
    assertThrows(ArrayIndexOutOfBoundsException.class, () -> array.get(1));
  }
}
