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

package io.plait.util.immutables;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.immutables.value.Value;

/**
 * Style for code-generated Immutables value types.
 *
 * <p>Abstract types are named {@code AbstractFoo} and the generated type is the public {@code
 * Foo}. Accessors use {@code getX()}/{@code isX()} and builder setters use {@code setX()}.
 */
@Value.Style(
  typeAbstract = "Abstract*",
  typeImmutable = "*",
  get = {"is*", "get*"},
  init = "set*",
  visibility = Value.Style.ImplementationVisibility.PUBLIC
)
@Target({ElementType.PACKAGE, ElementType.TYPE})
@Retention(RetentionPolicy.SOURCE)
public @interface PlaitStyleImmutable {}
