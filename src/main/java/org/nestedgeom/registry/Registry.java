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

/**
 * Maps the names used in tally units to the numbers that identify them in the system definition.
 * Every method throws {@link NameNotFoundException} for a name the system does not define; an
 * implementation must never substitute a default number.
 */
public interface Registry {

  /** The three namespaces a Registry looks names up in. */
  enum Kind {
    SURFACE("surface"),
    CELL("cell"),
    UNIVERSE("universe");

    private final String description;

    Kind(String description) {
      this.description = description;
    }

    @Override
    public String toString() {
      return description;
    }
  }

  int surfaceNumber(String name);

  int cellNumber(String name);

  int universeNumber(String name);

  /** Dispatches to the lookup method for {@code kind}. */
  default int number(Kind kind, String name) {
    return switch (kind) {
      case SURFACE -> surfaceNumber(name);
      case CELL -> cellNumber(name);
      case UNIVERSE -> universeNumber(name);
    };
  }
}
