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

package io.plait.util.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.OutputStream;

/** Shared Jackson configuration for every JSON file the generators write. */
public class ObjectMappers {

  private static final ObjectMapper MAPPER = create();

  /** Utility class: do not instantiate. */
  private ObjectMappers() {}

  /**
   * @return a generator that writes to {@code stream} and serializes POJOs through the shared
   *     mapper, so {@link JsonGenerator#writeObject(Object)} works. Closing it does not close the
   *     stream.
   */
  public static JsonGenerator createGenerator(OutputStream stream) throws IOException {
    return MAPPER.getFactory().createGenerator(stream);
  }

  public static ObjectMapper newDefaultInstance() {
    return create();
  }

  private static ObjectMapper create() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    return mapper;
  }
}
