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
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.QualifiedName;

/**
 * A control point that modifies a symbol. The parameters of a function are defined by the function
 * node itself.
 */
@AutoValue
public abstract class Definition {

  public abstract QualifiedName getSymbol();

  /** The control point the symbol is modified at. Compared by identity. */
  public abstract Node getSite();

  public static Definition create(QualifiedName symbol, Node site) {
    return new AutoValue_Definition(symbol, site);
  }

  @Override
  public final String toString() {
    return getSymbol() + "@" + getSite().getId();
  }
}
