/*
 * Copyright 2018-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package io.plait.subst;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import javax.annotation.Nullable;

/** A variable's value: either one string or an ordered sequence of strings. */
public final class Value {

  private static final Value EMPTY_LIST = new Value(null, ImmutableList.of());

  @Nullable private final String scalar;
  @Nullable private final ImmutableList<String> list;

  private Value(@Nullable String scalar, @Nullable ImmutableList<String> list) {
    this.scalar = scalar;
    this.list = list;
  }

  public static Value of(String scalar) {
    return new Value(Preconditions.checkNotNull(scalar), null);
  }

  public static Value ofList(Iterable<String> elements) {
    ImmutableList<String> copy = ImmutableList.copyOf(elements);
    return copy.isEmpty() ? EMPTY_LIST : new Value(null, copy);
  }

  public static Value ofList(String... elements) {
    return ofList(ImmutableList.copyOf(elements));
  }

  public static Value emptyList() {
    return EMPTY_LIST;
  }

  public boolean isList() {
    return list != null;
  }

  /** @return the scalar, or the elements joined with single spaces. */
  public String asScalar() {
    return list == null ? scalar : Joiner.on(' ').join(list);
  }

  /** @return the elements, or the scalar as a one-element list. */
  public ImmutableList<String> asList() {
    return list == null ? ImmutableList.of(scalar) : list;
  }

  /** @return a value with {@code elements} appended; a scalar becomes the first element. */
  public Value append(Iterable<String> elements) {
    return ofList(ImmutableList.<String>builder().addAll(asList()).addAll(elements).build());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Value)) {
      return false;
    }
    Value that = (Value) obj;
    return Objects.equals(scalar, that.scalar) && Objects.equals(list, that.list);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scalar, list);
  }

  @Override
  public String toString() {
    return list == null ? scalar : list.toString();
  }
}
