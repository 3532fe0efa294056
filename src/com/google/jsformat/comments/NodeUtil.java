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

package com.google.jsformat.comments;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.jsformat.ast.Comment;
import com.google.jsformat.ast.Node;
import com.google.jsformat.ast.Slot;
import com.google.jsformat.ast.Token;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/** Shape predicates over {@link Node}s used by the comment handlers. */
public final class NodeUtil {

  private static final ImmutableSet<Token> FUNCTION_LIKE_TOKENS =
      Sets.immutableEnumSet(
          Token.FUNCTION,
          Token.FUNCTION_EXPRESSION,
          Token.ARROW_FUNCTION,
          Token.DECLARE_FUNCTION,
          Token.DECLARE_METHOD,
          Token.CALL_SIGNATURE,
          Token.CONSTRUCT_SIGNATURE,
          Token.METHOD_SIGNATURE,
          Token.CONSTRUCTOR_TYPE,
          Token.FUNCTION_TYPE);

  private static final ImmutableSet<Token> NAMED_FUNCTION_TOKENS =
      Sets.immutableEnumSet(Token.FUNCTION, Token.FUNCTION_EXPRESSION, Token.MEMBER_FUNCTION_DEF);

  private static final ImmutableSet<Token> CLASS_LIKE_TOKENS =
      Sets.immutableEnumSet(
          Token.CLASS,
          Token.CLASS_EXPRESSION,
          Token.INTERFACE,
          Token.DECLARE_CLASS,
          Token.DECLARE_INTERFACE);

  private static final ImmutableSet<Token> CLASS_MEMBER_TOKENS =
      Sets.immutableEnumSet(
          Token.MEMBER_FUNCTION_DEF,
          Token.MEMBER_FIELD_DEF,
          Token.ABSTRACT_METHOD,
          Token.ABSTRACT_FIELD_DEF,
          Token.DECLARE_METHOD);

  private static final ImmutableSet<Token> ASSIGNMENT_LIKE_TOKENS =
      Sets.immutableEnumSet(Token.DECLARATOR, Token.ASSIGN, Token.TYPE_ALIAS);

  private static final ImmutableSet<Token> COMPLEX_EXPRESSION_TOKENS =
      Sets.immutableEnumSet(
          Token.OBJECTLIT,
          Token.ARRAYLIT,
          Token.TEMPLATELIT,
          Token.TAGGED_TEMPLATELIT,
          Token.RECORD_TYPE);

  // Closure accepts the type in braces, in parens or bare, so only the tag is looked for.
  private static final Pattern TYPE_TAG = Pattern.compile("@type\\b");

  private NodeUtil() {}

  /** Whether {@code n} declares a parameter list of its own. */
  static boolean isFunctionLike(@Nullable Node n) {
    return n != null && FUNCTION_LIKE_TOKENS.contains(n.getToken());
  }

  /** Functions and methods whose name may be followed by a comment before the parameters. */
  static boolean isNamedFunctionLike(@Nullable Node n) {
    return n != null && NAMED_FUNCTION_TOKENS.contains(n.getToken());
  }

  static ImmutableList<Node> getFunctionParameters(Node n) {
    return n.getChildren(Slot.PARAM);
  }

  static boolean isCallExpression(@Nullable Node n) {
    return n != null && (n.getToken() == Token.CALL || n.getToken() == Token.OPTCHAIN_CALL);
  }

  static boolean isCallLike(@Nullable Node n) {
    return isCallExpression(n)
        || (n != null && (n.getToken() == Token.NEW || n.getToken() == Token.DYNAMIC_IMPORT));
  }

  static ImmutableList<Node> getCallArguments(Node n) {
    return n.getChildren(Slot.ARGUMENT);
  }

  static boolean isMemberExpression(@Nullable Node n) {
    if (n == null) {
      return false;
    }
    return switch (n.getToken()) {
      case GETPROP, OPTCHAIN_GETPROP, GETELEM -> true;
      default -> false;
    };
  }

  static boolean isObjectProperty(@Nullable Node n) {
    return n != null && n.getToken() == Token.PROPERTY;
  }

  static boolean isClassLike(@Nullable Node n) {
    return n != null && CLASS_LIKE_TOKENS.contains(n.getToken());
  }

  static boolean isClassMember(@Nullable Node n) {
    return n != null && CLASS_MEMBER_TOKENS.contains(n.getToken());
  }

  static boolean isAssignmentLike(@Nullable Node n) {
    return n != null && ASSIGNMENT_LIKE_TOKENS.contains(n.getToken());
  }

  static boolean isComplexExpression(@Nullable Node n) {
    return n != null && COMPLEX_EXPRESSION_TOKENS.contains(n.getToken());
  }

  /** Returns the first child of a block-like node that is neither a directive nor empty. */
  static @Nullable Node getFirstNonEmptyChild(Node block) {
    for (Node child : block.children()) {
      if (!child.isEmpty() && child.getSlot() != Slot.DIRECTIVE) {
        return child;
      }
    }
    return null;
  }

  /** Whether the script has no statements at all (directives do not count). */
  static boolean hasNoStatements(Node script) {
    return !script.hasChild(Slot.STATEMENT);
  }

  /** Whether {@code comment} is a JSDoc block comment carrying a Closure {@code @type} tag. */
  public static boolean isTypeCastComment(Comment comment) {
    return comment.isBlockComment()
        && comment.getValue().startsWith("*")
        && TYPE_TAG.matcher(comment.getValue()).find();
  }
}
