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
import com.google.scopeflow.tree.Node;
import com.google.scopeflow.tree.QualifiedName;

/** The documented annotation keys, queried by consumers of an analyzed session. */
public final class NodeAnnotations {

  /** On every NAME, ATTRIBUTE and SUBSCRIPT node. */
  public static final AnnotationKey<QualifiedName> CANONICAL_NAME =
      AnnotationKey.create(AnnotationOwner.QUALIFIED_NAMES, "canonical-name");

  /** On every scope root. */
  public static final AnnotationKey<ScopeActivity> SCOPE_ACTIVITY =
      AnnotationKey.create(AnnotationOwner.ACTIVITY, "scope-activity");

  /** On every control point of a scope other than the scope root. */
  public static final AnnotationKey<StatementActivity> STATEMENT_ACTIVITY =
      AnnotationKey.create(AnnotationOwner.ACTIVITY, "statement-activity");

  /** On the scope root. */
  public static final AnnotationKey<ControlFlowGraph<Node>> CFG =
      AnnotationKey.create(AnnotationOwner.CONTROL_FLOW, "cfg");

  public static final AnnotationKey<ImmutableSet<QualifiedName>> LIVE_IN =
      AnnotationKey.create(AnnotationOwner.LIVENESS, "live-in");

  public static final AnnotationKey<ImmutableSet<QualifiedName>> LIVE_OUT =
      AnnotationKey.create(AnnotationOwner.LIVENESS, "live-out");

  public static final AnnotationKey<ImmutableSet<Definition>> DEFS_IN =
      AnnotationKey.create(AnnotationOwner.REACHING_DEFINITIONS, "defs-in");

  static final ImmutableSet<AnnotationKey<?>> ALL_KEYS =
      ImmutableSet.of(
          CANONICAL_NAME, SCOPE_ACTIVITY, STATEMENT_ACTIVITY, CFG, LIVE_IN, LIVE_OUT, DEFS_IN);

  private NodeAnnotations() {}
}
