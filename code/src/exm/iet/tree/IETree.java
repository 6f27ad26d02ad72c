/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.iet.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.log4j.Logger;

import exm.iet.common.Logging;
import exm.iet.common.Settings;
import exm.iet.common.exceptions.IETRuntimeError;
import exm.iet.common.lang.Dimension;
import exm.iet.common.lang.Equation;
import exm.iet.common.lang.Symbol;
import exm.iet.tree.Conditionals.Conditional;
import exm.iet.tree.Iterations.Iteration;
import exm.iet.visit.FindSymbols;

/**
 * Core node classes of the tree.  Nodes are immutable once built: passes
 * produce new trees rather than modifying existing ones, so untouched
 * subtrees can be shared between trees.
 */
public class IETree {

  private static final Logger logger = Logging.getIETLogger();

  public static enum NodeType {
    EXPRESSION,
    ELEMENT,
    ITERATION,
    CONDITIONAL,
    BLOCK,
    CALLABLE,
  }

  /**
   * Opaque per-instance handle of a node.  Rewrite mappings are keyed
   * on these, never on structural equality.
   */
  public static final class NodeId {
    private static final AtomicLong counter = new AtomicLong(0);

    private final long id;

    private NodeId(long id) {
      this.id = id;
    }

    static NodeId next() {
      return new NodeId(counter.incrementAndGet());
    }

    @Override
    public int hashCode() {
      return Long.hashCode(id);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof NodeId))
        return false;
      return id == ((NodeId)obj).id;
    }

    @Override
    public String toString() {
      return "#" + id;
    }
  }

  public static abstract class Node {
    private final NodeId id = NodeId.next();

    public NodeId id() {
      return id;
    }

    public abstract NodeType type();

    /**
     * @return ordered children, empty for leaves.  Not modifiable.
     */
    public abstract List<Node> getChildren();

    /**
     * Build a new node of the same kind with the same attributes,
     * but the given children
     */
    public abstract Node rebuild(List<Node> children);

    /**
     * Rebuild from one slot per existing child, where a null slot marks
     * a deleted child
     */
    public Node rebuildWith(List<Node> slots) {
      assert(slots.size() == getChildren().size());
      List<Node> children = new ArrayList<Node>(slots.size());
      for (Node n: slots) {
        if (n != null) {
          children.add(n);
        }
      }
      return rebuild(children);
    }

    public abstract void prettyPrint(StringBuilder sb, String indent);

    public boolean isLeaf() {
      return getChildren().isEmpty();
    }

    public Expression expression() {
      throw new IETRuntimeError("Not an expression: " + type());
    }

    public Iteration iteration() {
      throw new IETRuntimeError("Not an iteration: " + type());
    }

    public Conditional conditional() {
      throw new IETRuntimeError("Not a conditional: " + type());
    }

    public Block block() {
      throw new IETRuntimeError("Not a block: " + type());
    }

    @Override
    public String toString() {
      return IETUtil.printAST(this);
    }
  }

  /**
   * Shared base for nodes without children
   */
  public static abstract class LeafNode extends Node {
    @Override
    public List<Node> getChildren() {
      return Collections.emptyList();
    }

    @Override
    public Node rebuild(List<Node> children) {
      if (!children.isEmpty()) {
        throw new IETRuntimeError(type() + " can't have children: "
                                  + children.size() + " given");
      }
      return copy();
    }

    protected abstract Node copy();
  }

  /**
   * A single equation
   */
  public static class Expression extends LeafNode {
    private final Equation equation;

    public Expression(Equation equation) {
      assert(equation != null);
      this.equation = equation;
    }

    public Equation equation() {
      return equation;
    }

    @Override
    public NodeType type() {
      return NodeType.EXPRESSION;
    }

    @Override
    public Expression expression() {
      return this;
    }

    @Override
    protected Node copy() {
      return new Expression(equation);
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent);
      sb.append("<Expression ");
      sb.append(equation.toString());
      sb.append(">\n");
    }
  }

  /**
   * Opaque line of decoration, e.g. a comment inserted by a pass.
   * Printed verbatim.
   */
  public static class Element extends LeafNode {
    private final String text;

    public Element(String text) {
      assert(text != null);
      this.text = text;
    }

    public String text() {
      return text;
    }

    @Override
    public NodeType type() {
      return NodeType.ELEMENT;
    }

    @Override
    protected Node copy() {
      return new Element(text);
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent);
      sb.append(text);
      sb.append("\n");
    }
  }

  /**
   * Ordered sequence of nodes without loop semantics
   */
  public static class Block extends Node {
    private final List<Node> children;

    public Block(Node... children) {
      this(Arrays.asList(children));
    }

    public Block(List<? extends Node> children) {
      this.children = IETUtil.checkedChildren(children);
    }

    @Override
    public NodeType type() {
      return NodeType.BLOCK;
    }

    @Override
    public Block block() {
      return this;
    }

    @Override
    public List<Node> getChildren() {
      return children;
    }

    public boolean isEmpty() {
      return children.isEmpty();
    }

    @Override
    public Block rebuild(List<Node> children) {
      return new Block(children);
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      for (Node child: children) {
        child.prettyPrint(sb, indent);
      }
    }
  }

  public static enum ParamKind {
    SYMBOL,
    /** Extent of an array dimension */
    SIZE,
  }

  public static class Parameter {
    private final ParamKind kind;
    private final Symbol symbol;
    private final Dimension dimension;

    private Parameter(ParamKind kind, Symbol symbol, Dimension dimension) {
      this.kind = kind;
      this.symbol = symbol;
      this.dimension = dimension;
    }

    public static Parameter symbol(Symbol symbol) {
      assert(symbol != null);
      return new Parameter(ParamKind.SYMBOL, symbol, null);
    }

    public static Parameter size(Dimension dimension) {
      assert(dimension != null);
      return new Parameter(ParamKind.SIZE, null, dimension);
    }

    public ParamKind kind() {
      return kind;
    }

    /**
     * @return symbol for SYMBOL parameters, else null
     */
    public Symbol getSymbol() {
      return symbol;
    }

    /**
     * @return dimension for SIZE parameters, else null
     */
    public Dimension getDimension() {
      return dimension;
    }

    public String name() {
      if (kind == ParamKind.SYMBOL) {
        return symbol.name();
      } else {
        return dimension.name() + Settings.get(Settings.SIZE_PARAM_SUFFIX);
      }
    }

    @Override
    public String toString() {
      return name();
    }
  }

  /**
   * A function: name, return type tag, parameters and a body
   */
  public static class Callable extends Node {
    private final String name;
    private final Node body;
    private final String returnType;
    private final List<Parameter> parameters;

    /**
     * Create with parameters inferred from the symbols used in body
     */
    public Callable(String name, Node body, String returnType) {
      this(name, body, returnType, inferParameters(body));
      if (logger.isDebugEnabled()) {
        logger.debug("Inferred parameters of " + name + ": " + parameters);
      }
    }

    public Callable(String name, Node body, String returnType,
                    List<Parameter> parameters) {
      assert(name != null);
      assert(body != null);
      assert(parameters != null);
      this.name = name;
      this.body = body;
      this.returnType = returnType;
      this.parameters = Collections.unmodifiableList(
                                  new ArrayList<Parameter>(parameters));
    }

    /**
     * Symbols in order of first occurrence, then one size parameter for
     * each distinct dimension of the array symbols
     */
    public static List<Parameter> inferParameters(Node body) {
      List<Parameter> params = new ArrayList<Parameter>();
      Set<Dimension> sizes = new LinkedHashSet<Dimension>();
      for (Symbol s: new FindSymbols().visit(body)) {
        params.add(Parameter.symbol(s));
        sizes.addAll(s.dimensions());
      }
      for (Dimension d: sizes) {
        params.add(Parameter.size(d));
      }
      return params;
    }

    public String name() {
      return name;
    }

    public Node body() {
      return body;
    }

    public String returnType() {
      return returnType;
    }

    public List<Parameter> parameters() {
      return parameters;
    }

    @Override
    public NodeType type() {
      return NodeType.CALLABLE;
    }

    @Override
    public List<Node> getChildren() {
      return Collections.singletonList(body);
    }

    @Override
    public Callable rebuild(List<Node> children) {
      if (children.size() > 1) {
        throw new IETRuntimeError("Callable " + name + " takes one body, "
                                  + children.size() + " given");
      }
      Node newBody = children.isEmpty() ? new Block() : children.get(0);
      return new Callable(name, newBody, returnType, parameters);
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent);
      sb.append("<Callable " + name + ">\n");
      body.prettyPrint(sb, indent + IETUtil.indent);
    }
  }
}
