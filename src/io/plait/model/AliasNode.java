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

package io.plait.model;

import io.plait.util.Origin;

/** A named group of nodes with no file output of its own. Its members are its explicit deps. */
public class AliasNode extends Node {

  private final String name;

  AliasNode(String name, Origin origin) {
    super(origin);
    this.name = name;
  }

  @Override
  public String getName() {
    return name;
  }
}
