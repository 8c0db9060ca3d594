/*
 * Copyright 2026 The PySymphony Authors.
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

package com.google.pysymphony.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {

  private static Node call(String callee, String arg) {
    return new Node(Token.CALL, Node.newName(callee), Node.newName(arg));
  }

  @Test
  public void testChildNavigation() {
    Node n = call("f", "x");
    Node callee = n.getFirstChild();
    assertThat(callee.getString()).isEqualTo("f");
    assertThat(callee.getParent()).isSameInstanceAs(n);
    assertThat(callee.getNext()).isSameInstanceAs(n.getSecondChild());
    assertThat(n.getLastChild().getNext()).isNull();
    assertThat(n.getIndexOfChild(n.getLastChild())).isEqualTo(1);
  }

  @Test
  public void testInsertions() {
    Node list = new Node(Token.LIST, Node.newName("b"));
    Node b = list.getOnlyChild();
    list.addChildToFront(Node.newName("a"));
    list.addChildAfter(Node.newName("c"), b);
    list.addChildBefore(Node.newName("a2"), b);

    assertThat(list.toStringTree())
        .isEqualTo("LIST\n  NAME a\n  NAME a2\n  NAME b\n  NAME c\n");
  }

  @Test
  public void testAttachedChildIsRejected() {
    Node n = call("f", "x");
    Node other = new Node(Token.LIST);
    assertThrows(IllegalArgumentException.class, () -> other.addChildToBack(n.getFirstChild()));
  }

  @Test
  public void testReplaceWithCopiesLocation() {
    Node n = call("f", "x");
    Node arg = n.getSecondChild();
    arg.setLocation("a.py", 3, 4);
    Node replacement = Node.newName("y");

    arg.replaceWith(replacement);

    assertThat(n.getSecondChild()).isSameInstanceAs(replacement);
    assertThat(replacement.getLineno()).isEqualTo(3);
    assertThat(replacement.getSourceFileName()).isEqualTo("a.py");
    assertThat(arg.getParent()).isNull();
  }

  @Test
  public void testDetach() {
    Node n = call("f", "x");
    Node arg = n.getSecondChild().detach();
    assertThat(arg.getParent()).isNull();
    assertThat(n.getChildCount()).isEqualTo(1);
    assertThrows(IllegalStateException.class, arg::detach);
  }

  @Test
  public void testCloneTreeIsDeepAndDetached() {
    Node n = call("f", "x");
    n.getFirstChild().putBooleanProp(Node.Prop.STORE, true).setLocation("a.py", 1, 0);
    n.getFirstChild().setAlias("g");
    Node root = new Node(Token.EXPR_STMT, n);

    Node copy = n.cloneTree();

    assertThat(copy.getParent()).isNull();
    assertThat(copy).isNotSameInstanceAs(n);
    assertThat(copy.toStringTree()).isEqualTo(n.toStringTree());
    copy.getFirstChild().setString("h");
    assertThat(n.getFirstChild().getString()).isEqualTo("f");
    assertThat(n.isDescendantOf(root)).isTrue();
    assertThat(copy.isDescendantOf(root)).isFalse();
  }

  @Test
  public void testToString() {
    Node name = Node.newName("v").putBooleanProp(Node.Prop.STORE, true).setLocation(null, 2, 5);
    name.setAlias("w");
    assertThat(name.toString()).isEqualTo("NAME v as w [STORE] 2:5");
    assertThat(Node.empty().isEmpty()).isTrue();
  }
}
