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
 * The closed set of syntax tree node kinds handed over by the parser.
 *
 * <p>The child layout of each kind is described by the {@link Slot} of its children; the comments
 * below only list the slots that matter for comment placement.
 */
public enum Token {
  SCRIPT, // STATEMENT*, DIRECTIVE*

  // Statements
  BLOCK, // STATEMENT*
  EMPTY,
  EXPR_RESULT, // EXPRESSION
  IF, // TEST, CONSEQUENT, ALTERNATE?
  WHILE, // TEST, BODY
  DO, // BODY, TEST
  FOR, // INIT?, TEST?, UPDATE?, BODY
  FOR_IN, // LEFT, RIGHT, BODY
  FOR_OF, // LEFT, RIGHT, BODY
  TRY, // BLOCK, HANDLER?, FINALIZER?
  CATCH, // PARAM?, BODY
  SWITCH, // DISCRIMINANT, CASE*
  CASE, // TEST, CONSEQUENT*
  DEFAULT_CASE, // CONSEQUENT*
  LABEL, // LABEL, BODY
  BREAK, // LABEL?
  CONTINUE, // LABEL?
  RETURN, // ARGUMENT?
  THROW, // ARGUMENT
  DEBUGGER,
  VAR, // DECLARATOR*
  LET,
  CONST,
  DECLARATOR, // ID, INIT?

  // Functions
  FUNCTION, // function declaration: ID?, TYPE_PARAMETERS?, PARAM*, RETURN_TYPE?, BODY
  FUNCTION_EXPRESSION, // same layout as FUNCTION
  ARROW_FUNCTION, // TYPE_PARAMETERS?, PARAM*, RETURN_TYPE?, BODY

  // Classes and interfaces
  CLASS, // DECORATOR*, ID?, TYPE_PARAMETERS?, SUPER_CLASS?, EXTENDS*, MIXINS*, IMPLEMENTS*, BODY
  CLASS_EXPRESSION,
  INTERFACE,
  DECLARE_CLASS, // Flow `declare class`
  DECLARE_INTERFACE, // Flow `declare interface`
  CLASS_MEMBERS, // MEMBER*
  MEMBER_FUNCTION_DEF, // DECORATOR*, KEY, VALUE (a FUNCTION_EXPRESSION)
  MEMBER_FIELD_DEF, // DECORATOR*, KEY, TYPE?, VALUE?
  ABSTRACT_METHOD, // DECORATOR*, KEY, VALUE (a FUNCTION_EXPRESSION without BODY)
  ABSTRACT_FIELD_DEF, // DECORATOR*, KEY, TYPE?
  DECLARE_METHOD, // DECORATOR*, KEY, PARAM*, RETURN_TYPE?
  DECORATOR, // EXPRESSION

  // Expressions
  NAME,
  NUMBER,
  STRINGLIT,
  REGEXP,
  NULL,
  TRUE,
  FALSE,
  THIS,
  SUPER,
  TEMPLATELIT, // QUASI*, EXPRESSION*
  TEMPLATELIT_STRING, // the literal parts of a TEMPLATELIT
  TAGGED_TEMPLATELIT, // TAG, QUASI (a TEMPLATELIT)
  ARRAYLIT, // ELEMENT*
  OBJECTLIT, // PROPERTY*
  PROPERTY, // KEY, VALUE; a SHORTHAND property with a default has only VALUE (a DEFAULT_VALUE)
  SPREAD, // ARGUMENT
  CALL, // CALLEE, TYPE_ARGUMENTS?, ARGUMENT*
  OPTCHAIN_CALL, // CALLEE, ARGUMENT*
  NEW, // CALLEE, ARGUMENT*
  DYNAMIC_IMPORT, // ARGUMENT
  GETPROP, // OBJECT, PROPERTY
  OPTCHAIN_GETPROP, // OBJECT, PROPERTY
  GETELEM, // OBJECT, PROPERTY
  HOOK, // TEST, CONSEQUENT, ALTERNATE
  ASSIGN, // LEFT, RIGHT
  DEFAULT_VALUE, // assignment pattern: LEFT, RIGHT
  ADD, // LEFT, RIGHT
  SUB,
  MUL,
  DIV,
  AND,
  OR,
  COALESCE,
  EQ,
  NE,
  SHEQ, // ===
  SHNE, // !==
  LT,
  GT,
  COMMA,
  NOT, // ARGUMENT
  TYPEOF,
  AWAIT,
  YIELD,

  // Modules
  IMPORT, // SPECIFIER*, SOURCE
  IMPORT_SPEC, // IMPORTED, LOCAL?
  EXPORT, // named export: DECLARATION? | SPECIFIER*, SOURCE?
  EXPORT_SPEC, // LOCAL, EXPORTED?

  // Types
  NAMED_TYPE,
  UNION_TYPE, // TYPE*
  TYPE_ALIAS, // ID, TYPE_PARAMETERS?, TYPE
  RECORD_TYPE, // MEMBER*
  MAPPED_TYPE, // TYPE_PARAMETERS (a TYPE_PARAMETER), TYPE?
  TYPE_PARAMETER, // NAME, CONSTRAINT?
  TYPE_PARAMETER_LIST, // PARAM*
  CONDITIONAL_TYPE, // TEST, EXTENDS, CONSEQUENT, ALTERNATE
  FUNCTION_TYPE, // TYPE_PARAMETERS?, PARAM*, RETURN_TYPE
  CONSTRUCTOR_TYPE, // TYPE_PARAMETERS?, PARAM*, RETURN_TYPE
  CALL_SIGNATURE, // PARAM*, RETURN_TYPE?
  CONSTRUCT_SIGNATURE, // PARAM*, RETURN_TYPE?
  METHOD_SIGNATURE, // KEY, PARAM*, RETURN_TYPE?
  DECLARE_FUNCTION, // ID, PARAM*, RETURN_TYPE?
  FUNCTION_TYPE_ANNOTATION, // Flow: PARAM (FUNCTION_TYPE_PARAM)*, RETURN_TYPE
  FUNCTION_TYPE_PARAM; // Flow: NAME?, TYPE

  /** Whether a node of this kind may own comments; the other kinds are looked through. */
  public boolean canAttachComment() {
    return this != EMPTY && this != TEMPLATELIT_STRING;
  }
}
