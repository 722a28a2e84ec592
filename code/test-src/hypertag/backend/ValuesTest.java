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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.ImmutableSet;

import hypertag.common.exceptions.NoneStringException;
import hypertag.common.exceptions.TypeMismatchException;
import hypertag.dom.HText;
import hypertag.dom.Sequence;

public class ValuesTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testTruthiness() {
    assertFalse(Values.isTruthy(null));
    assertFalse(Values.isTruthy(0));
    assertFalse(Values.isTruthy(0.0));
    assertFalse(Values.isTruthy(""));
    assertFalse(Values.isTruthy(new ArrayList<Object>()));
    assertFalse(Values.isTruthy(new Sequence()));
    assertTrue(Values.isTruthy("0"));
    assertTrue(Values.isTruthy(new Sequence(new HText("x"))));
  }

  @Test
  public void testRepr() {
    assertEquals("None", Values.repr(null));
    assertEquals("True", Values.repr(true));
    assertEquals("'a'", Values.repr("a"));
    assertEquals("\"it's\"", Values.repr("it's"));
    assertEquals("(1,)", Values.repr(Tuple.of(1)));
    assertEquals("[1, 'x']", Values.repr(Arrays.asList(1, "x")));
    assertEquals("set()", Values.repr(ImmutableSet.of()));
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put("a", 1.5);
    assertEquals("{'a': 1.5}", Values.repr(map));
    assertEquals("a", Values.str("a"));
  }

  @Test
  public void testFormatFloat() {
    assertEquals("1.0", Values.formatFloat(1.0));
    assertEquals("0.1", Values.formatFloat(0.1));
    assertEquals("1e+16", Values.formatFloat(1e16));
    assertEquals("1.5e-05", Values.formatFloat(1.5e-5));
    assertEquals("inf", Values.formatFloat(Double.POSITIVE_INFINITY));
  }

  @Test
  public void testTypeNames() {
    assertEquals("int", Values.typeName(3));
    assertEquals("float", Values.typeName(3f));
    assertEquals("tuple", Values.typeName(Tuple.of()));
    assertEquals("NoneType", Values.typeName(null));
  }

  @Test
  public void testToList() throws Exception {
    assertEquals(Arrays.asList("a", "b"), Values.toList("ab", null));
    assertEquals(Arrays.asList(1L, 2L),
                 Values.toList(new Object[] {1, 2}, null));
  }

  @Test
  public void testNotIterable() throws Exception {
    exception.expect(TypeMismatchException.class);
    exception.expectMessage("'int' object is not iterable");
    Values.toList(5L, null);
  }

  @Test
  public void testNoneAsText() throws Exception {
    exception.expect(NoneStringException.class);
    Values.toText(null, null, "None in text");
  }

  @Test
  public void testToSequence() throws Exception {
    HText text = new HText("x");
    assertEquals(1, Values.toSequence(text, null).size());
    assertEquals(2, Values.toSequence(Arrays.asList(text, new HText("y")),
                                      null).size());
    exception.expect(TypeMismatchException.class);
    Values.toSequence("x", null);
  }
}
