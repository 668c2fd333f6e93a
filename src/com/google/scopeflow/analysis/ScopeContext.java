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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;

/**
 * Caller-owned configuration of one analysis session. The passes never modify it and only read the
 * feature flags.
 */
@AutoValue
public abstract class ScopeContext {

  /** The name of the analyzed scope, for diagnostics. */
  public abstract String getScopeName();

  /** The source text of the scope. */
  public abstract String getSourceText();

  /** Identifies the unit (file, module) the scope was parsed from. */
  public abstract String getUnitId();

  public abstract ImmutableSet<LanguageFeature> getFeatures();

  public final boolean isEnabled(LanguageFeature feature) {
    return getFeatures().contains(feature);
  }

  public static ScopeContext create(
      String scopeName, String sourceText, String unitId, ImmutableSet<LanguageFeature> features) {
    return new AutoValue_ScopeContext(scopeName, sourceText, unitId, features);
  }

  /** A context with no source information and the default features. */
  public static ScopeContext forScope(String scopeName) {
    return create(scopeName, "", "<unknown>", LanguageFeature.defaults());
  }
}
