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

import com.google.scopeflow.tree.Node;
import org.jspecify.annotations.Nullable;

/** The class of exceptions thrown by the analysis passes. */
@SuppressWarnings("serial")
public abstract class AnalysisException extends RuntimeException {

  private final transient @Nullable Node node;

  AnalysisException(String details, @Nullable Node node) {
    super(details);
    this.node = node;
  }

  /** Returns the node the problem was found at, if known. */
  public final @Nullable Node getNode() {
    return node;
  }

  @Override
  public final String getMessage() {
    String details = super.getMessage();
    if (node == null || node.getLineno() < 0) {
      return details;
    }
    return details + " (line " + node.getLineno() + ')';
  }
}
