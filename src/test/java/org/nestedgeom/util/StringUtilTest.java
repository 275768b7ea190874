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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StringUtilTest {

  @Test
  public void joinElements() {
    assertThat(StringUtil.joinElements(", ", "[", "]", 3, i -> i * i)).isEqualTo("[0, 1, 4]");
    assertThat(StringUtil.joinElements(",", "(", ")", 0, i -> i)).isEqualTo("()");
  }

  @Test
  public void joinList() {
    ImmutableList<String> names = ImmutableList.of("a", "b");
    assertThat(StringUtil.joinElements("", "<", ">", names, s -> " " + s)).isEqualTo("< a b>");
  }

  @Test
  public void quoted() {
    assertThat(StringUtil.quoted("fuel")).isEqualTo("'fuel'");
    assertThat(StringUtil.isQuotable("fuel pin")).isTrue();
    assertThat(StringUtil.isQuotable("it's")).isFalse();
    assertThat(StringUtil.isQuotable("")).isFalse();
  }
}
