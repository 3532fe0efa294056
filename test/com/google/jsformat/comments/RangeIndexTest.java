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

import static com.google.common.truth.Truth.assertThat;
import static com.google.jsformat.ast.Slot.ARGUMENT;
import static com.google.jsformat.ast.Slot.BODY;
import static com.google.jsformat.ast.Slot.CALLEE;
import static com.google.jsformat.ast.Slot.EXPRESSION;
import static com.google.jsformat.ast.Slot.KEY;
import static com.google.jsformat.ast.Slot.PARAM;
import static com.google.jsformat.ast.Slot.QUASI;
import static com.google.jsformat.ast.Slot.STATEMENT;
import static com.google.jsformat.ast.Slot.VALUE;
import static org.junit.Assert.assertThrows;

import com.google.jsformat.ast.Comment;
import com.google.jsformat.ast.Node;
import com.google.jsformat.ast.TestAst;
import com.google.jsformat.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RangeIndexTest {

  @Test
  public void testNeighborsBetweenArguments() {
    TestAst ast = new TestAst("f(a, b);");
    Node a = ast.name("a");
    Node b = ast.name("b");
    Node call = ast.node(Token.CALL, "f(a, b)", CALLEE, ast.name("f"), ARGUMENT, a, ARGUMENT, b);
    Node root = ast.script(ast.node(Token.EXPR_RESULT, ast.getSource(), EXPRESSION, call));
    RangeIndex index = new RangeIndex(root);
    int comma = ast.offsetOf(",");

    assertThat(index.enclosing(comma)).isSameInstanceAs(call);
    assertThat(index.preceding(comma)).isSameInstanceAs(a);
    assertThat(index.following(comma)).isSameInstanceAs(b);
  }

  @Test
  public void testEnclosingFallsBackToTheRoot() {
    TestAst ast = new TestAst("a;  b;");
    Node first = ast.node(Token.EXPR_RESULT, "a;", EXPRESSION, ast.name("a"));
    Node second = ast.node(Token.EXPR_RESULT, "b;", EXPRESSION, ast.name("b"));
    Node root = ast.script(first, second);
    RangeIndex index = new RangeIndex(root);

    assertThat(index.enclosing(3)).isSameInstanceAs(root);
    assertThat(index.preceding(3)).isSameInstanceAs(first);
    assertThat(index.following(3)).isSameInstanceAs(second);
    assertThat(index.preceding(0)).isNull();
    assertThat(index.following(ast.getSource().length())).isNull();
  }

  @Test
  public void testLocateComment() {
    TestAst ast = new TestAst("f(a /* c */);");
    Node a = ast.name("a");
    Node call = ast.node(Token.CALL, "f(a /* c */)", CALLEE, ast.name("f"), ARGUMENT, a);
    Node root = ast.script(ast.node(Token.EXPR_RESULT, ast.getSource(), EXPRESSION, call));

    NodeNeighbors neighbors = new RangeIndex(root).locate(ast.comment("/* c */"));

    assertThat(neighbors.enclosing()).isSameInstanceAs(call);
    assertThat(neighbors.preceding()).isSameInstanceAs(a);
    assertThat(neighbors.following()).isNull();
  }

  @Test
  public void testEmptyStatementsAreLookedThrough() {
    TestAst ast = new TestAst("a;;b;");
    Node first = ast.node(Token.EXPR_RESULT, "a;", EXPRESSION, ast.name("a"));
    Node empty = ast.range(Token.EMPTY, 2, 3);
    Node last = ast.node(Token.EXPR_RESULT, "b;", EXPRESSION, ast.name("b"));
    Node root = ast.script(first, empty, last);

    assertThat(new RangeIndex(root).getCommentChildNodes(root)).containsExactly(first, last);
  }

  @Test
  public void testTemplateLiteralNeighborsStayInTheirSubstitution() {
    TestAst ast = new TestAst("`x${a /* c */}y${b}`;");
    String source = ast.getSource();
    Node a = ast.name("a");
    Node b = ast.name("b");
    Node template =
        ast.range(
            Token.TEMPLATELIT,
            0,
            source.length() - 1,
            QUASI,
            ast.node(Token.TEMPLATELIT_STRING, "x"),
            EXPRESSION,
            a,
            QUASI,
            ast.node(Token.TEMPLATELIT_STRING, "y"),
            EXPRESSION,
            b,
            QUASI,
            ast.range(Token.TEMPLATELIT_STRING, source.length() - 2, source.length() - 2));
    Node root = ast.script(ast.node(Token.EXPR_RESULT, source, EXPRESSION, template));

    NodeNeighbors neighbors = new RangeIndex(root).locate(ast.comment("/* c */"));

    assertThat(neighbors.enclosing()).isSameInstanceAs(template);
    assertThat(neighbors.preceding()).isSameInstanceAs(a);
    assertThat(neighbors.following()).isNull();
  }

  @Test
  public void testParameterlessMethodExposesItsBody() {
    TestAst ast = new TestAst("class A { m() {} }");
    Node key = ast.name("m");
    Node body = ast.node(Token.BLOCK, "{}");
    Node method =
        ast.node(
            Token.MEMBER_FUNCTION_DEF,
            "m() {}",
            KEY,
            key,
            VALUE,
            ast.node(Token.FUNCTION_EXPRESSION, "() {}", BODY, body));

    assertThat(new RangeIndex(method).getCommentChildNodes(method))
        .containsExactly(key, body)
        .inOrder();
  }

  @Test
  public void testMethodWithParametersExposesItsValue() {
    TestAst ast = new TestAst("class A { m(p) {} }");
    Node key = ast.name("m");
    Node value =
        ast.node(
            Token.FUNCTION_EXPRESSION,
            "(p) {}",
            PARAM,
            ast.name("p"),
            BODY,
            ast.node(Token.BLOCK, "{}"));
    Node method = ast.node(Token.MEMBER_FUNCTION_DEF, "m(p) {}", KEY, key, VALUE, value);

    assertThat(new RangeIndex(method).getCommentChildNodes(method))
        .containsExactly(key, value)
        .inOrder();
  }

  @Test
  public void testCommentChildrenAreCached() {
    TestAst ast = new TestAst("{ a; }");
    Node block =
        ast.node(
            Token.BLOCK,
            ast.getSource(),
            STATEMENT,
            ast.node(Token.EXPR_RESULT, "a;", EXPRESSION, ast.name("a")));
    RangeIndex index = new RangeIndex(block);

    assertThat(index.getCommentChildNodes(block))
        .isSameInstanceAs(index.getCommentChildNodes(block));
  }

  @Test
  public void testCommentOverlappingANodeIsReported() {
    TestAst ast = new TestAst("f(a /* c */);");
    // Claims part of the comment.
    Node a = ast.range(Token.NAME, 2, 6);
    Node call = ast.node(Token.CALL, "f(a /* c */)", CALLEE, ast.name("f"), ARGUMENT, a);
    Node root = ast.script(ast.node(Token.EXPR_RESULT, ast.getSource(), EXPRESSION, call));
    Comment comment = ast.comment("/* c */");

    MalformedInputException e =
        assertThrows(MalformedInputException.class, () -> new RangeIndex(root).locate(comment));
    assertThat(e.getType()).isEqualTo(DiagnosticType.MALFORMED_COMMENT);
    assertThat(e).hasMessageThat().contains("/* c */");
  }
}
