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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;

/**
 * A typed key into the {@link AnnotationStore}. Keys are compared by identity, so two keys with the
 * same name are still distinct.
 *
 * @param <T> the type of the values stored under this key
 */
@Immutable
public final class AnnotationKey<T> {

  private final AnnotationOwner owner;
  private final String name;

  private AnnotationKey(AnnotationOwner owner, String name) {
    this.owner = checkNotNull(owner);
    this.name = name;
  }

  public static <T> AnnotationKey<T> create(AnnotationOwner owner, String name) {
    checkArgument(!name.isEmpty(), "empty key name");
    return new AnnotationKey<>(owner, name);
  }

  /** The pass allowed to write values under this key. */
  public AnnotationOwner getOwner() {
    return owner;
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
