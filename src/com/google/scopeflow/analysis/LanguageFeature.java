/*
 * Copyright 2026 The Scopeflow Authors.
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
package com.google.scopeflow.analysis;

import com.google.common.collect.ImmutableSet;
import java.util.EnumSet;

/** Optional language features that change which statement kinds the analysis recognizes. */
public enum LanguageFeature {
  /** {@code nonlocal} declarations. */
  NONLOCAL_DECLARATIONS,
  /** {@code global} declarations. */
  GLOBAL_DECLARATIONS;

  /** Every feature is enabled by default. */
  public static ImmutableSet<LanguageFeature> defaults() {
    return ImmutableSet.copyOf(EnumSet.allOf(LanguageFeature.class));
  }
}
