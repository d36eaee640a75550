/*
 * Copyright (c) Facebook, Inc. and its affiliates.
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

package com.facebook.cartesian.util.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import java.io.IOException;
import java.io.OutputStream;

/** Shared {@link ObjectMapper} configuration. */
public class ObjectMappers {

  private static final ObjectMapper mapper = create();

  private ObjectMappers() {}

  public static JsonGenerator createGenerator(OutputStream stream) throws IOException {
    return mapper.getFactory().createGenerator(stream);
  }

  private static ObjectMapper create() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new GuavaModule());
    mapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, false);
    mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    return mapper;
  }
}
