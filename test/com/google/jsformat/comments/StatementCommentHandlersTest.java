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
import static com.google.jsformat.ast.Slot.ALTERNATE;
import static com.google.jsformat.ast.Slot.BODY;
import static com.google.jsformat.ast.Slot.CASE;
import static com.google.jsformat.ast.Slot.CONSEQUENT;
import static com.google.jsformat.ast.Slot.DISCRIMINANT;
import static com.google.jsformat.ast.Slot.EXPRESSION;
import static com.google.jsformat.ast.Slot.FINALIZER;
import static com.google.jsformat.ast.Slot.HANDLER;
import static com.google.jsformat.ast.Slot.LABEL;
import static com.google.jsformat.ast.Slot.LEFT;
import static com.google.jsformat.ast.Slot.PARAM;
import static com.google.jsformat.ast.Slot.RIGHT;
import static com.google.jsformat.ast.Slot.STATEMENT;
import static com.google.jsformat.ast.Slot.TEST;
import static com.google.jsformat.ast.TestAst.lines;
import static com.google.jsformat.comments.AttachmentAssertions.assertDangling;
import static com.google.jsformat.comments.AttachmentAssertions.assertLeading;
import static com.google.jsformat.comments.AttachmentAssertions.assertTrailing;
import static com.google.jsformat.comments.AttachmentAssertions.attach;

import com.google.jsformat.ast.Node;
import com.google.jsformat.ast.Slot;
import com.google.jsformat.ast.TestAst;
import com.google.jsformat.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StatementCommentHandlersTest {

  private static Node exprResult(TestAst ast, String name) {
    return ast.node(Token.EXPR_RESULT, name + ";", EXPRESSION, ast.name(name));
  }

  @Test
  public void testCommentInsideWhileConditionTrailsTheCondition() {
    TestAst ast = new TestAst("while (a /* c */) {}");
    Node a = ast.name("a");
    Node root =
        ast.script(
            ast.node(Token.WHILE, ast.getSource(), TEST, a, BODY, ast.node(Token.BLOCK, "{}")));

    assertTrailing(attach(ast, root), ast.comment("/* c */"), a);
  }

  @Test
  public void testCommentBetweenIfHeaderAndBlockMovesIntoTheBlock() {
    TestAst ast = new TestAst(lines("if (a) // c", "{", "  b;", "}"));
    Node statement = exprResult(ast, "b");
    Node root =
        ast.script(
            ast.node(
                Token.IF,
                ast.getSource(),
                TEST,
                ast.name("a"),
                CONSEQUENT,
                ast.node(Token.BLOCK, "{\n  b;\n}", STATEMENT, statement)));

    assertLeading(attach(ast, root), ast.comment("// c"), statement);
  }

  @Test
  public void testCommentBetweenIfHeaderAndEmptyBlockDanglesOnTheBlock() {
    TestAst ast = new TestAst(lines("if (a) // c", "{}"));
    Node block = ast.node(Token.BLOCK, "{}");
    Node root =
        ast.script(ast.node(Token.IF, ast.getSource(), TEST, ast.name("a"), CONSEQUENT, block));

    assertDangling(attach(ast, root), ast.comment("// c"), block);
  }

  @Test
  public void testCommentBeforeBlocklessConsequentLeadsIt() {
    TestAst ast = new TestAst("if (a) /* c */ b;");
    Node statement = exprResult(ast, "b");
    Node root =
        ast.script(
            ast.node(Token.IF, ast.getSource(), TEST, ast.name("a"), CONSEQUENT, statement));

    assertLeading(attach(ast, root), ast.comment("/* c */"), statement);
  }

  @Test
  public void testSameLineCommentOfBlocklessIfIsMarked() {
    TestAst ast = new TestAst(lines("if (a) b; // c", "else d;"));
    Node consequent = exprResult(ast, "b");
    Node root =
        ast.script(
            ast.node(
                Token.IF,
                ast.getSource(),
                TEST,
                ast.name("a"),
                CONSEQUENT,
                consequent,
                ALTERNATE,
                exprResult(ast, "d")));

    CommentAttachments attachments = attach(ast, root);

    Attachment attachment = assertDangling(attachments, ast.comment("// c"), consequent);
    assertThat(attachment.marker()).isEqualTo(CommentMarker.SAME_LINE_BLOCKLESS_IF);
    assertThat(attachments.getDangling(consequent, CommentMarker.SAME_LINE_BLOCKLESS_IF))
        .containsExactly(ast.comment("// c"));
  }

  @Test
  public void testCommentBeforeNestedIfMovesIntoItsConsequent() {
    TestAst ast = new TestAst(lines("if (a)", "  // c", "  if (b) { x; }"));
    Node statement = exprResult(ast, "x");
    Node nested =
        ast.node(
            Token.IF,
            "if (b) { x; }",
            TEST,
            ast.name("b"),
            CONSEQUENT,
            ast.node(Token.BLOCK, "{ x; }", STATEMENT, statement));
    Node root =
        ast.script(ast.node(Token.IF, ast.getSource(), TEST, ast.name("a"), CONSEQUENT, nested));

    assertLeading(attach(ast, root), ast.comment("// c"), statement);
  }

  @Test
  public void testCommentBeforeBlocklessWhileBodyLeadsIt() {
    TestAst ast = new TestAst(lines("while (a)", "  // c", "  x;"));
    Node body = exprResult(ast, "x");
    Node root =
        ast.script(ast.node(Token.WHILE, ast.getSource(), TEST, ast.name("a"), BODY, body));

    assertLeading(attach(ast, root), ast.comment("// c"), body);
  }

  @Test
  public void testCommentBeforeFinallyMovesIntoFinalizer() {
    TestAst ast = new TestAst(lines("try {", "  p;", "} // c", "finally {", "  q;", "}"));
    Node statement = exprResult(ast, "q");
    Node root =
        ast.script(
            ast.node(
                Token.TRY,
                ast.getSource(),
                Slot.BLOCK,
                ast.node(Token.BLOCK, "{\n  p;\n}", STATEMENT, exprResult(ast, "p")),
                FINALIZER,
                ast.node(Token.BLOCK, "{\n  q;\n}", STATEMENT, statement)));

    assertLeading(attach(ast, root), ast.comment("// c"), statement);
  }

  @Test
  public void testCommentAfterCatchParameterTrailsIt() {
    TestAst ast = new TestAst(lines("try {", "} catch (e // c", ") {", "}"));
    Node param = ast.name("e");
    Node handler =
        ast.node(
            Token.CATCH,
            "catch (e // c\n) {\n}",
            PARAM,
            param,
            BODY,
            ast.nodeAt(Token.BLOCK, "{\n}", 2));
    Node root =
        ast.script(
            ast.node(
                Token.TRY,
                ast.getSource(),
                Slot.BLOCK,
                ast.nodeAt(Token.BLOCK, "{\n}", 1),
                HANDLER,
                handler));

    assertTrailing(attach(ast, root), ast.comment("// c"), param);
  }

  @Test
  public void testOwnLineCommentInForInLeadsTheLoop() {
    TestAst ast = new TestAst(lines("for (x in y)", "  // c", "  {}"));
    Node loop =
        ast.node(
            Token.FOR_IN,
            ast.getSource(),
            LEFT,
            ast.name("x"),
            RIGHT,
            ast.name("y"),
            BODY,
            ast.node(Token.BLOCK, "{}"));
    Node root = ast.script(loop);

    assertLeading(attach(ast, root), ast.comment("// c"), loop);
  }

  @Test
  public void testCommentAfterLabelLeadsTheLabeledStatement() {
    TestAst ast = new TestAst(lines("foo: // c", "  x;"));
    Node label =
        ast.node(Token.LABEL, ast.getSource(), LABEL, ast.name("foo"), BODY, exprResult(ast, "x"));
    Node root = ast.script(label);

    assertLeading(attach(ast, root), ast.comment("// c"), label);
  }

  @Test
  public void testCommentInsideUnlabeledBreakTrailsTheBreak() {
    TestAst ast = new TestAst("break /* c */;");
    Node jump = ast.node(Token.BREAK, ast.getSource());
    Node root = ast.script(jump);

    assertTrailing(attach(ast, root), ast.comment("/* c */"), jump);
  }

  @Test
  public void testBlockCommentAfterEmptyDefaultDanglesOnTheCase() {
    TestAst ast = new TestAst(lines("switch (x) {", "  default: /* c */", "}"));
    Node defaultCase = ast.node(Token.DEFAULT_CASE, "default: /* c */");
    Node root =
        ast.script(
            ast.node(
                Token.SWITCH, ast.getSource(), DISCRIMINANT, ast.name("x"), CASE, defaultCase));

    assertDangling(attach(ast, root), ast.comment("/* c */"), defaultCase);
  }

  @Test
  public void testBlockCommentAfterDefaultBeforeStatementDanglesOnTheCase() {
    TestAst ast = new TestAst(lines("switch (x) {", "  default: /* c */", "    y;", "}"));
    Node defaultCase =
        ast.node(
            Token.DEFAULT_CASE, "default: /* c */\n    y;", CONSEQUENT, exprResult(ast, "y"));
    Node root =
        ast.script(
            ast.node(
                Token.SWITCH, ast.getSource(), DISCRIMINANT, ast.name("x"), CASE, defaultCase));

    assertDangling(attach(ast, root), ast.comment("/* c */"), defaultCase);
  }
}
