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

/** Thrown when a lattice spec is attached to a unit that is not a {@link Unit.NestedCell}. */
public class InvalidLatticeAttachmentException extends IllegalArgumentException {
  InvalidLatticeAttachmentException(Unit unit) {
    super(
        "Lattice specs can only be attached to a NestedCell, not a "
            + unit.getClass().getSimpleName());
  }
}
