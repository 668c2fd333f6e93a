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
import com.google.scopeflow.tree.QualifiedName;

/** The symbols read and modified by a single control point. */
@AutoValue
public abstract class StatementActivity {

  private static final StatementActivity EMPTY = create(ImmutableSet.of(), ImmutableSet.of());

  public abstract ImmutableSet<QualifiedName> getRead();

  public abstract ImmutableSet<QualifiedName> getModified();

  public static StatementActivity create(
      ImmutableSet<QualifiedName> read, ImmutableSet<QualifiedName> modified) {
    return new AutoValue_StatementActivity(read, modified);
  }

  public static StatementActivity empty() {
    return EMPTY;
  }
}
