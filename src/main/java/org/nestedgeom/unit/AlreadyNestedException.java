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

package org.nestedgeom.unit;

/**
 * Thrown when joining would give a unit a second outer level, or give a unit a second inner level.
 * The expression must be restructured; the units involved are left unchanged.
 */
public class AlreadyNestedException extends IllegalStateException {
  private final transient Unit unit;

  AlreadyNestedException(Unit unit, String message) {
    super(message);
    this.unit = unit;
  }

  /** The unit whose existing link prevented the join. */
  public Unit unit() {
    return unit;
  }
}
