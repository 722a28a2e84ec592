/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package hypertag.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import hypertag.common.exceptions.InvalidValueException;
import hypertag.common.exceptions.TypeMismatchException;

public class OperatorsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testArithmetic() throws Exception {
    assertEquals(5L, Operators.binary("+", 2L, 3, null));
    assertEquals(2.5, Operators.binary("+", 2L, 0.5, null));
    assertEquals(3.5, Operators.binary("/", 7L, 2L, null));
    assertEquals(-4L, Operators.binary("//", -7L, 2L, null));
    assertEquals(1L, Operators.binary("%", -7L, 2L, null));
    assertEquals(1024L, Operators.binary("**", 2L, 10L, null));
    assertEquals(0.5, Operators.binary("**", 2L, -1L, null));
    assertEquals(2L, Operators.binary("+", true, true, null));
    assertEquals(-3L, Operators.negate(3, null));
  }

  @Test
  public void testSequences() throws Exception {
    assertEquals("abab", Operators.binary("*", "ab", 2L, null));
    assertEquals("ab", Operators.binary("+", "a", "b", null));
    List<Object> list = Arrays.<Object>asList(1L);
    assertEquals(Arrays.asList(1L, 1L), Operators.binary("*", 2L, list, null));
    assertEquals(Tuple.of(1L, 2L),
                 Operators.binary("+", Tuple.of(1L), Tuple.of(2L), null));
  }

  @Test
  public void testTupleAndListDoNotAdd() throws Exception {
    exception.expect(TypeMismatchException.class);
    exception.expectMessage("unsupported operand type(s) for +");
    Operators.binary("+", Tuple.of(1L), Arrays.asList(2L), null);
  }

  @Test
  public void testDivisionByZero() throws Exception {
    exception.expect(InvalidValueException.class);
    exception.expectMessage("division by zero");
    Operators.binary("/", 1L, 0L, null);
  }

  @Test
  public void testOverflow() throws Exception {
    exception.expect(InvalidValueException.class);
    exception.expectMessage("integer overflow");
    Operators.binary("*", Long.MAX_VALUE, 2L, null);
  }

  @Test
  public void testComparison() throws Exception {
    assertTrue(Operators.equal(1L, 1.0));
    assertTrue(Operators.equal(Arrays.asList(1L, 2L), Tuple.of(1, 2)));
    assertEquals(true, Operators.binary("<", "abc", "abd", null));
    assertEquals(true, Operators.binary("<", Arrays.asList(1L),
                                        Arrays.asList(1L, 0L), null));
    assertEquals(false, Operators.binary("!=", 2, 2L, null));
  }

  @Test
  public void testIncomparable() throws Exception {
    exception.expect(TypeMismatchException.class);
    exception.expectMessage("'<' not supported between instances of " +
                            "'int' and 'str'");
    Operators.binary("<", 1L, "a", null);
  }

  @Test
  public void testMembership() throws Exception {
    assertTrue(Operators.contains("hello", "ell", null));
    assertTrue(Operators.contains(ImmutableMap.of("a", 1), "a", null));
    assertTrue(Operators.contains(Arrays.asList(1L, 2L), 2, null));
    assertFalse(Operators.contains(ImmutableSet.of("x"), "y", null));
    assertEquals(true, Operators.binary("not in", 3L, Arrays.asList(1L), null));
  }

  @Test
  public void testBitwiseAndShift() throws Exception {
    assertEquals(2L, Operators.binary("&", 6L, 3L, null));
    assertEquals(7L, Operators.binary("|", 6L, 3L, null));
    assertEquals(5L, Operators.binary("^", 6L, 3L, null));
    assertEquals(8L, Operators.binary("<<", 1L, 3L, null));
    assertEquals(-1L, Operators.binary(">>", -2L, 5L, null));
    assertEquals(ImmutableSet.of(2L),
        Operators.binary("&", ImmutableSet.of(1L, 2L), ImmutableSet.of(2L), null));
  }

  @Test
  public void testRepeatTooLong() throws Exception {
    exception.expect(InvalidValueException.class);
    exception.expectMessage("too long");
    Operators.binary("*", "a", 3000000000L, null);
  }

  @Test
  public void testRepeatedListTooLong() throws Exception {
    exception.expect(InvalidValueException.class);
    Operators.binary("*", Arrays.<Object>asList(1L, 2L, 3L),
                     Integer.MAX_VALUE / 2L, null);
  }

  @Test
  public void testSignedZeroOrdering() throws Exception {
    assertEquals(false, Operators.binary("<", -0.0, 0.0, null));
    assertEquals(true, Operators.binary("<=", 0.0, -0.0, null));
    assertEquals(true, Operators.binary(">=", -0.0, 0L, null));
    assertEquals(true, Operators.binary("==", -0.0, 0.0, null));
    assertEquals(false, Operators.binary("<", Arrays.asList(-0.0, 1L),
                                         Arrays.asList(0.0, 1L), null));
  }

  @Test
  public void testNaNOrdering() throws Exception {
    for (String op: new String[] {"<", ">", "<=", ">="}) {
      assertEquals(op, false, Operators.binary(op, Double.NaN, 1.0, null));
      assertEquals(op, false, Operators.binary(op, 1L, Double.NaN, null));
    }
    assertEquals(false, Operators.binary("==", Double.NaN, Double.NaN, null));
    assertEquals(true, Operators.binary("<", 1.0, 2L, null));
  }
}
