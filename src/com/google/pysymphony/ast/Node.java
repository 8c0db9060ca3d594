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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A syntax tree node. Nodes own their children and keep a pointer to their parent so that
 * rewriting passes can replace a subtree in place.
 */
public final class Node {

  /** Boolean properties. */
  public enum Prop {
    /** The expression was written inside parentheses. */
    PARENTHESIZED,
    /** {@code async def}, {@code async for}, {@code async with} or an async comprehension. */
    ASYNC,
    /** A NAME that is bound rather than read. */
    STORE,
    /** A NAME that is the target of {@code del}. */
    DELETE,
    /** An IF that is the {@code elif} arm of its parent IF. */
    ELIF,
    /** A {@code *args} parameter or a bare {@code *} separator. */
    VARARGS,
    /** A {@code **kwargs} parameter. */
    KWARGS,
    /** The {@code /} separator of positional-only parameters. */
    POSITIONAL_ONLY_MARKER,
    /** The slice was written with a second colon. */
    HAS_STEP_COLON,
  }

  private final Token token;
  private @Nullable String string;
  private @Nullable String alias;
  private int intValue;
  private final EnumSet<Prop> props = EnumSet.noneOf(Prop.class);
  private final List<Node> children = new ArrayList<>();
  private @Nullable Node parent;
  private @Nullable String sourceFileName;
  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = str;
    return n;
  }

  public static Node newName(String name) {
    return newString(Token.NAME, name);
  }

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public Token getToken() {
    return token;
  }

  public boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public boolean isName() {
    return token == Token.NAME;
  }

  public String getString() {
    checkState(string != null, "%s has no string", token);
    return string;
  }

  public @Nullable String getStringOrNull() {
    return string;
  }

  public void setString(@Nullable String string) {
    this.string = string;
  }

  /** The {@code as} name of an IMPORT_ALIAS or WITH target, if any. */
  public @Nullable String getAlias() {
    return alias;
  }

  public void setAlias(@Nullable String alias) {
    this.alias = alias;
  }

  public int getIntValue() {
    return intValue;
  }

  public void setIntValue(int intValue) {
    this.intValue = intValue;
  }

  public boolean getBooleanProp(Prop prop) {
    return props.contains(prop);
  }

  @CanIgnoreReturnValue
  public Node putBooleanProp(Prop prop, boolean value) {
    if (value) {
      props.add(prop);
    } else {
      props.remove(prop);
    }
    return this;
  }

  public boolean isParenthesized() {
    return props.contains(Prop.PARENTHESIZED);
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public int getChildCount() {
    return children.size();
  }

  public Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public @Nullable Node getSecondChild() {
    return children.size() < 2 ? null : children.get(1);
  }

  public @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  public Node getOnlyChild() {
    checkState(children.size() == 1, "%s has %s children", token, children.size());
    return children.get(0);
  }

  /** A live view of the children. Use {@link #childrenSnapshot} when the tree may change. */
  public List<Node> children() {
    return Collections.unmodifiableList(children);
  }

  public ImmutableList<Node> childrenSnapshot() {
    return ImmutableList.copyOf(children);
  }

  public int getIndexOfChild(Node child) {
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == child) {
        return i;
      }
    }
    return -1;
  }

  public @Nullable Node getParent() {
    return parent;
  }

  /** The next sibling, or null. */
  public @Nullable Node getNext() {
    if (parent == null) {
      return null;
    }
    int i = parent.getIndexOfChild(this);
    return i + 1 < parent.children.size() ? parent.children.get(i + 1) : null;
  }

  public void addChildToBack(Node child) {
    checkArgument(child.parent == null, "new child has existing parent");
    child.parent = this;
    children.add(child);
  }

  public void addChildToFront(Node child) {
    checkArgument(child.parent == null, "new child has existing parent");
    child.parent = this;
    children.add(0, child);
  }

  public void addChildAfter(Node newChild, Node existing) {
    checkArgument(newChild.parent == null, "new child has existing parent");
    int i = getIndexOfChild(existing);
    checkArgument(i >= 0, "existing is not a child");
    newChild.parent = this;
    children.add(i + 1, newChild);
  }

  public void addChildBefore(Node newChild, Node existing) {
    checkArgument(newChild.parent == null, "new child has existing parent");
    int i = getIndexOfChild(existing);
    checkArgument(i >= 0, "existing is not a child");
    newChild.parent = this;
    children.add(i, newChild);
  }

  /** Swaps {@code replacement} and its subtree into the position of this node. */
  public void replaceWith(Node replacement) {
    checkState(parent != null, "node is detached");
    checkArgument(replacement.parent == null, "replacement has existing parent");
    int i = parent.getIndexOfChild(this);
    parent.children.set(i, replacement);
    replacement.parent = parent;
    replacement.srcrefIfMissing(this);
    this.parent = null;
  }

  /** Removes this node from its parent, but retains its subtree. */
  @CanIgnoreReturnValue
  public Node detach() {
    checkState(parent != null, "node is detached");
    parent.children.remove(parent.getIndexOfChild(this));
    parent = null;
    return this;
  }

  public void removeChildren() {
    for (Node child : children) {
      child.parent = null;
    }
    children.clear();
  }

  /** Returns a deep copy of this subtree, detached from any parent. */
  public Node cloneTree() {
    Node copy = new Node(token);
    copy.string = string;
    copy.alias = alias;
    copy.intValue = intValue;
    copy.props.addAll(props);
    copy.sourceFileName = sourceFileName;
    copy.lineno = lineno;
    copy.charno = charno;
    for (Node child : children) {
      copy.addChildToBack(child.cloneTree());
    }
    return copy;
  }

  public @Nullable String getSourceFileName() {
    return sourceFileName;
  }

  public int getLineno() {
    return lineno;
  }

  public int getCharno() {
    return charno;
  }

  @CanIgnoreReturnValue
  public Node setLocation(@Nullable String sourceFileName, int lineno, int charno) {
    this.sourceFileName = sourceFileName;
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  @CanIgnoreReturnValue
  public Node srcref(Node other) {
    return setLocation(other.sourceFileName, other.lineno, other.charno);
  }

  @CanIgnoreReturnValue
  public Node srcrefIfMissing(Node other) {
    if (lineno < 0) {
      srcref(other);
    }
    return this;
  }

  /** Whether {@code this} is {@code ancestor} or lies inside its subtree. */
  public boolean isDescendantOf(Node ancestor) {
    for (Node n = this; n != null; n = n.parent) {
      if (n == ancestor) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.name());
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (alias != null) {
      sb.append(" as ").append(alias);
    }
    if (!props.isEmpty()) {
      sb.append(' ').append(props);
    }
    if (lineno >= 0) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  /** A multi-line dump of the subtree, for debugging and test failure messages. */
  public String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendTree(sb, 0);
    return sb.toString();
  }

  private void appendTree(StringBuilder sb, int depth) {
    sb.append("  ".repeat(depth)).append(this).append('\n');
    for (Node child : children) {
      child.appendTree(sb, depth + 1);
    }
  }
}
