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

package com.facebook.cartesian.resolve;

import com.facebook.cartesian.model.Assignment;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replays the assignments of one path, root to leaf, into its parameter mapping.
 *
 * <p>Every call starts from an empty mapping owned by that call, so nothing assigned while
 * resolving one path can leak into another. {@code ${name}} tokens are substituted with the value
 * {@code name} has at that point of the replay, before the operator is applied.
 */
public class ParameterResolver {

  public static final Pattern REFERENCE = Pattern.compile("\\$\\{([^}]+)}");

  public ImmutableMap<String, String> resolve(Iterable<Assignment> assignments)
      throws ResolutionException {
    Map<String, String> params = new LinkedHashMap<>();
    for (Assignment assignment : assignments) {
      String value = interpolate(assignment.getKey(), assignment.getValue(), params);
      params.put(
          assignment.getKey(),
          assignment.getOperator().apply(params.get(assignment.getKey()), value));
    }
    return ImmutableMap.copyOf(params);
  }

  /** Substitutes every {@code ${name}} in {@code value} from {@code params}. */
  static String interpolate(String key, String value, Map<String, String> params)
      throws ResolutionException {
    Matcher matcher = REFERENCE.matcher(value);
    if (!matcher.find()) {
      return value;
    }
    StringBuilder result = new StringBuilder(value.length());
    int last = 0;
    do {
      String reference = matcher.group(1).trim();
      String replacement = params.get(reference);
      if (replacement == null) {
        throw new ResolutionException(key, reference);
      }
      result.append(value, last, matcher.start()).append(replacement);
      last = matcher.end();
    } while (matcher.find());
    return result.append(value, last, value.length()).toString();
  }
}
