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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumMap;
import java.util.Map;

/**
 * An immutable, in-memory {@link Registry}.
 *
 * <p>Numbers are either given explicitly ({@link Builder#addCell(String, int)}) or assigned in
 * order of addition starting at 1 ({@link Builder#addCells(String...)}), the way a system
 * definition numbers its cards. Each kind has its own namespace and its own counter.
 */
public final class MapRegistry implements Registry {

  private final ImmutableMap<Kind, ImmutableMap<String, Integer>> numbers;

  private MapRegistry(ImmutableMap<Kind, ImmutableMap<String, Integer>> numbers) {
    this.numbers = numbers;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public int surfaceNumber(String name) {
    return lookup(Kind.SURFACE, name);
  }

  @Override
  public int cellNumber(String name) {
    return lookup(Kind.CELL, name);
  }

  @Override
  public int universeNumber(String name) {
    return lookup(Kind.UNIVERSE, name);
  }

  /** Returns the names registered for {@code kind}, with their numbers, in order of addition. */
  public ImmutableMap<String, Integer> entries(Kind kind) {
    return numbers.get(kind);
  }

  private int lookup(Kind kind, String name) {
    Integer result = numbers.get(kind).get(name);
    if (result == null) {
      throw new NameNotFoundException(kind, name);
    }
    return result;
  }

  @Override
  public String toString() {
    return "MapRegistry" + numbers;
  }

  /** Collects names and numbers; {@link #build} fails if a name was added twice for one kind. */
  public static final class Builder {
    private final Map<Kind, ImmutableMap.Builder<String, Integer>> builders =
        new EnumMap<>(Kind.class);
    private final Map<Kind, Long> nextNumber = new EnumMap<>(Kind.class);

    private Builder() {
      for (Kind kind : Kind.values()) {
        builders.put(kind, ImmutableMap.builder());
        nextNumber.put(kind, 1L);
      }
    }

    @CanIgnoreReturnValue
    public Builder add(Kind kind, String name, int number) {
      Preconditions.checkNotNull(name);
      Preconditions.checkArgument(number > 0, "Invalid %s number %s for '%s'", kind, number, name);
      builders.get(kind).put(name, number);
      nextNumber.merge(kind, number + 1L, Math::max);
      return this;
    }

    /** Adds each name with the next unused number for {@code kind}. */
    @CanIgnoreReturnValue
    public Builder addAll(Kind kind, String... names) {
      for (String name : names) {
        long next = nextNumber.get(kind);
        Preconditions.checkState(
            next <= Integer.MAX_VALUE, "No %s number left for '%s'", kind, name);
        add(kind, name, (int) next);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addSurface(String name, int number) {
      return add(Kind.SURFACE, name, number);
    }

    @CanIgnoreReturnValue
    public Builder addCell(String name, int number) {
      return add(Kind.CELL, name, number);
    }

    @CanIgnoreReturnValue
    public Builder addUniverse(String name, int number) {
      return add(Kind.UNIVERSE, name, number);
    }

    @CanIgnoreReturnValue
    public Builder addSurfaces(String... names) {
      return addAll(Kind.SURFACE, names);
    }

    @CanIgnoreReturnValue
    public Builder addCells(String... names) {
      return addAll(Kind.CELL, names);
    }

    @CanIgnoreReturnValue
    public Builder addUniverses(String... names) {
      return addAll(Kind.UNIVERSE, names);
    }

    /**
     * Returns the registry.
     *
     * @throws IllegalArgumentException if a name was added more than once for the same kind
     */
    public MapRegistry build() {
      ImmutableMap.Builder<Kind, ImmutableMap<String, Integer>> result = ImmutableMap.builder();
      builders.forEach((kind, builder) -> result.put(kind, builder.buildOrThrow()));
      return new MapRegistry(result.buildOrThrow());
    }
  }
}
