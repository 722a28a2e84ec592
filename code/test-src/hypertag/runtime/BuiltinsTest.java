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

package hypertag.runtime;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.ImmutableMap;

import hypertag.backend.Tuple;
import hypertag.common.exceptions.InvalidValueException;
import hypertag.common.exceptions.TypeMismatchException;
import hypertag.common.exceptions.UserException;

public class BuiltinsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Object call(String name, Object... args) throws UserException {
    return Builtins.get(name).call(Arrays.asList(args),
                                   Collections.<String, Object>emptyMap());
  }

  private static Object call(String name, List<Object> args,
                      Map<String, Object> kwargs) throws UserException {
    return Builtins.get(name).call(args, kwargs);
  }

  @Test
  public void testConversions() throws Exception {
    assertEquals(3L, call("len", "abc"));
    assertEquals(2L, call("len", ImmutableMap.of("a", 1, "b", 2)));
    assertEquals(42L, call("int", " 42"));
    assertEquals(3L, call("int", 3.9));
    assertEquals(1.5, call("float", "1.5"));
    assertEquals("[1, 2]", call("str", Arrays.asList(1, 2)));
    assertEquals("ABC", call("upper", "abc"));
    assertEquals(3L, call("abs", -3L));
  }

  @Test
  public void testSequences() throws Exception {
    assertEquals(Arrays.asList(0L, 1L, 2L), call("range", 3L));
    assertEquals(Arrays.asList(5L, 3L, 1L), call("range", 5L, 0L, -2L));
    assertEquals(Arrays.asList(Tuple.of(0L, "a"), Tuple.of(1L, "b")),
                 call("enumerate", Arrays.asList("a", "b")));
    assertEquals(Arrays.asList("a", "b"), call("list", "ab"));
    assertEquals(Arrays.asList(3L, 2L, 1L),
        call("sorted", Arrays.<Object>asList(Arrays.asList(3L, 1L, 2L)),
             ImmutableMap.<String, Object>of("reverse", true)));
    assertEquals(1L, call("min", 3L, 1L, 2L));
    assertEquals(2L, call("max", Arrays.asList(1.5, 2)));
  }

  @Test
  public void testDict() throws Exception {
    assertEquals(ImmutableMap.of("a", 1L, "b", 2L),
        call("dict", Arrays.<Object>asList(Arrays.asList(Tuple.of("a", 1L))),
             ImmutableMap.<String, Object>of("b", 2L)));
  }

  @Test
  public void testNoLength() throws Exception {
    exception.expect(TypeMismatchException.class);
    exception.expectMessage("object of type 'int' has no len()");
    call("len", 5L);
  }

  @Test
  public void testBadLiteral() throws Exception {
    exception.expect(InvalidValueException.class);
    exception.expectMessage("invalid literal for int(): 'x'");
    call("int", "x");
  }

  @Test
  public void testZeroStep() throws Exception {
    exception.expect(InvalidValueException.class);
    call("range", 1L, 2L, 0L);
  }

  @Test
  public void testUnorderable() throws Exception {
    exception.expect(TypeMismatchException.class);
    call("sorted", Arrays.asList(1L, "a"));
  }

  @Test
  public void testRangeAtIntegerLimit() throws Exception {
    assertEquals(Arrays.asList(Long.MAX_VALUE - 1),
                 call("range", Long.MAX_VALUE - 1, Long.MAX_VALUE, 5L));
    assertEquals(Arrays.asList(Long.MIN_VALUE + 1),
                 call("range", Long.MIN_VALUE + 1, Long.MIN_VALUE, -5L));
  }

  @Test
  public void testCaseConversionIgnoresLocale() throws Exception {
    Locale saved = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertEquals("TITLE", call("upper", "title"));
      assertEquals("title", call("lower", "TITLE"));
    } finally {
      Locale.setDefault(saved);
    }
  }
}
