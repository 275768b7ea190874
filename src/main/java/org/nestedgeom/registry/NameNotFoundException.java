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

package org.nestedgeom.registry;

import java.util.NoSuchElementException;

/** Thrown by a {@link Registry} when asked for a name that the system does not define. */
public class NameNotFoundException extends NoSuchElementException {
  private final Registry.Kind kind;
  private final String name;

  public NameNotFoundException(Registry.Kind kind, String name) {
    super(String.format("No %s named '%s'", kind, name));
    this.kind = kind;
    this.name = name;
  }

  public Registry.Kind kind() {
    return kind;
  }

  public String name() {
    return name;
  }
}
