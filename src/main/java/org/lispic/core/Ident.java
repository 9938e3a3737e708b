/*
 * Copyright 2025 The Lispic Authors
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

package org.lispic.core;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.Immutable;

/**
 * A fully qualified identifier, represented as a path of segments (e.g. {@code {let 0}::f::x}).
 *
 * <p>Idents are produced by renaming: each binding site in a program is given an Ident derived
 * from its lexical nesting, so two Idents are equal only if they name the same variable. An
 * identifier that could not be resolved is represented by a single-segment Ident holding the raw
 * name.
 */
@Immutable
public final class Ident {

  /** The separator used when rendering (and parsing) qualified identifiers. */
  public static final String SEPARATOR = "::";

  private static final Ident EMPTY = new Ident(ImmutableList.of());

  private static final Joiner JOINER = Joiner.on(SEPARATOR);
  private static final Splitter SPLITTER = Splitter.on(SEPARATOR);

  private final ImmutableList<String> segments;

  private Ident(ImmutableList<String> segments) {
    this.segments = segments;
  }

  /** Returns the root Ident, with no segments. */
  public static Ident empty() {
    return EMPTY;
  }

  /** Returns a single-segment Ident; used for globals and compiler-generated locals. */
  public static Ident of(String name) {
    return EMPTY.extend(name);
  }

  /** Parses a rendered Ident, splitting at each {@link #SEPARATOR}. */
  public static Ident parse(String path) {
    Preconditions.checkArgument(!path.isEmpty());
    return new Ident(ImmutableList.copyOf(SPLITTER.split(path)));
  }

  /** Returns a new Ident with one more segment appended to this one. */
  public Ident extend(String segment) {
    Preconditions.checkArgument(!segment.isEmpty(), "empty segment");
    return new Ident(
        ImmutableList.<String>builderWithExpectedSize(segments.size() + 1)
            .addAll(segments)
            .add(segment)
            .build());
  }

  public ImmutableList<String> segments() {
    return segments;
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }

  /** Returns the last segment, i.e. the name as it was written in the source. */
  public String name() {
    Preconditions.checkState(!segments.isEmpty());
    return Iterables.getLast(segments);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Ident other && segments.equals(other.segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public String toString() {
    return JOINER.join(segments);
  }
}
