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
import static com.google.jsformat.ast.Slot.EXPRESSION;
import static com.google.jsformat.ast.Slot.LEFT;
import static com.google.jsformat.ast.Slot.RIGHT;
import static com.google.jsformat.ast.TestAst.lines;
import static com.google.jsformat.comments.CommentPlacement.END_OF_LINE;
import static com.google.jsformat.comments.CommentPlacement.OWN_LINE;
import static com.google.jsformat.comments.CommentPlacement.REMAINING;

import com.google.common.collect.ImmutableList;
import com.google.jsformat.ast.Comment;
import com.google.jsformat.ast.Node;
import com.google.jsformat.ast.TestAst;
import com.google.jsformat.ast.Token;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PlacementClassifierTest {

  private static ImmutableList<CommentPlacement> classify(TestAst ast, Node root) {
    RangeIndex index = new RangeIndex(root);
    List<NodeNeighbors> neighbors = new ArrayList<>();
    for (Comment comment : ast.comments()) {
      neighbors.add(index.locate(comment));
    }
    PlacementClassifier classifier =
        new PlacementClassifier(new SourceText(ast.getSource()), ast.comments(), neighbors);
    ImmutableList.Builder<CommentPlacement> placements = ImmutableList.builder();
    for (int i = 0; i < neighbors.size(); i++) {
      placements.add(classifier.classify(i));
    }
    return placements.build();
  }

  private static Node statements(TestAst ast, String... names) {
    Node[] statements = new Node[names.length];
    for (int i = 0; i < names.length; i++) {
      statements[i] =
          ast.node(Token.EXPR_RESULT, names[i] + ";", EXPRESSION, ast.name(names[i]));
    }
    return ast.script(statements);
  }

  @Test
  public void testCommentsBeforeLineEndAreEndOfLine() {
    TestAst ast = new TestAst(lines("a; /* x */ /* y */", "b;"));

    assertThat(classify(ast, statements(ast, "a", "b")))
        .containsExactly(END_OF_LINE, END_OF_LINE)
        .inOrder();
  }

  @Test
  public void testCommentsAfterLineStartAreOwnLine() {
    TestAst ast = new TestAst(lines("a;", "/* x */ /* y */ b;"));

    assertThat(classify(ast, statements(ast, "a", "b")))
        .containsExactly(OWN_LINE, OWN_LINE)
        .inOrder();
  }

  @Test
  public void testCodeAfterCommentAtLineStartStaysOwnLine() {
    TestAst ast = new TestAst(lines("a;", "/* c */ b;"));
    Node root = statements(ast, "a", "b");

    assertThat(classify(ast, root)).containsExactly(OWN_LINE);
    AttachmentAssertions.assertLeading(
        AttachmentAssertions.attach(ast, root), ast.comment("/* c */"), root.getChildAtIndex(1));
  }

  @Test
  public void testCommentBetweenTokensIsRemaining() {
    TestAst ast = new TestAst("a /* x */ + b;");
    Node sum = ast.node(Token.ADD, "a /* x */ + b", LEFT, ast.name("a"), RIGHT, ast.name("b"));
    Node root = ast.script(ast.node(Token.EXPR_RESULT, ast.getSource(), EXPRESSION, sum));

    assertThat(classify(ast, root)).containsExactly(REMAINING);
  }

  @Test
  public void testStartOfTextIsALineStart() {
    TestAst ast = new TestAst("/* x */ a;");

    assertThat(classify(ast, statements(ast, "a"))).containsExactly(OWN_LINE);
  }

  @Test
  public void testEndOfTextIsALineEnd() {
    TestAst ast = new TestAst("a; /* x */");

    assertThat(classify(ast, statements(ast, "a"))).containsExactly(END_OF_LINE);
  }

  @Test
  public void testOwnLineWinsOverEndOfLine() {
    TestAst ast = new TestAst(lines("a;", "// x", "b;"));

    assertThat(classify(ast, statements(ast, "a", "b"))).containsExactly(OWN_LINE);
  }

  @Test
  public void testLookThroughStopsAtCodeBetweenComments() {
    TestAst ast = new TestAst(lines("/* x */ a; /* y */ b;", "c;"));

    assertThat(classify(ast, statements(ast, "a", "b", "c")))
        .containsExactly(OWN_LINE, REMAINING)
        .inOrder();
  }
}
