/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.jsformat.ast;

/**
 * The structural role a child plays within its parent, for instance the test or the consequent of
 * an {@link Token#IF}.
 */
public enum Slot {
  STATEMENT,
  DIRECTIVE,
  EXPRESSION,
  TEST,
  CONSEQUENT,
  ALTERNATE,
  BODY,
  INIT,
  UPDATE,
  LEFT,
  RIGHT,
  BLOCK,
  HANDLER,
  FINALIZER,
  DISCRIMINANT,
  CASE,
  LABEL,
  ARGUMENT,
  DECLARATOR,
  ID,
  TYPE_PARAMETERS,
  TYPE_ARGUMENTS,
  PARAM,
  RETURN_TYPE,
  DECORATOR,
  SUPER_CLASS,
  EXTENDS,
  MIXINS,
  IMPLEMENTS,
  MEMBER,
  KEY,
  VALUE,
  TYPE,
  ELEMENT,
  PROPERTY,
  OBJECT,
  CALLEE,
  QUASI,
  TAG,
  SPECIFIER,
  SOURCE,
  DECLARATION,
  IMPORTED,
  EXPORTED,
  LOCAL,
  NAME,
  CONSTRAINT,
}
