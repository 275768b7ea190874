/*
 * Copyright 2025 The Nestedgeom Authors
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
 * limitations under the License.
 */

package org.nestedgeom.util;

import java.util.List;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Static-only class with methods for building the strings emitted by the unit renderers. */
public class StringUtil {

  private StringUtil() {}

  /**
   * Constructs a string by calling the given IntFunction for each int from 0 to size-1, calling
   * {@code String.valueOf()} on each element, separating them with {@code separator}, and adding
   * the given prefix and suffix.
   */
  public static String joinElements(
      String separator, String prefix, String suffix, int size, IntFunction<Object> elements) {
    assert size >= 0;
    return IntStream.range(0, size)
        .mapToObj(i -> String.valueOf(elements.apply(i)))
        .collect(Collectors.joining(separator, prefix, suffix));
  }

  /**
   * Applies {@code fn} to each element of {@code list} and joins the results with {@code
   * separator}, adding the given prefix and suffix.
   */
  public static <T> String joinElements(
      String separator, String prefix, String suffix, List<T> list, Function<T, String> fn) {
    return joinElements(separator, prefix, suffix, list.size(), i -> fn.apply(list.get(i)));
  }

  /** True if {@code name} can be emitted by {@link #quoted} without escaping. */
  public static boolean isQuotable(String name) {
    return !name.isEmpty() && name.indexOf('\'') < 0;
  }

  /** Returns the given name in single quotes. Names are inserted as-is, never escaped. */
  public static String quoted(String name) {
    assert isQuotable(name);
    return "'" + name + "'";
  }
}
