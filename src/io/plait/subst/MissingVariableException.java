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

import io.plait.util.Origin;
import javax.annotation.Nullable;

/** A template referenced a variable that is not defined in any layer of the namespace. */
@SuppressWarnings("serial")
public class MissingVariableException extends SubstitutionException {

  private final String variable;

  public MissingVariableException(String variable, @Nullable Origin origin) {
    super(origin, "undefined variable: $" + variable);
    this.variable = variable;
  }

  public String getVariable() {
    return variable;
  }
}
