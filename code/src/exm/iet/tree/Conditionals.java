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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.iet.common.exceptions.IETRuntimeError;
import exm.iet.common.lang.Expr;
import exm.iet.tree.IETree.Block;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.IETree.NodeType;

public class Conditionals {

  public static class Conditional extends Node {
    private final Expr condition;
    private final Block thenBlock;
    /** Null if there is no else branch */
    private final Block elseBlock;

    public Conditional(Expr condition, Node... thenBody) {
      this(condition, new Block(thenBody), null);
    }

    public Conditional(Expr condition, List<? extends Node> thenBody,
                       List<? extends Node> elseBody) {
      this(condition, new Block(thenBody),
           elseBody == null ? null : new Block(elseBody));
    }

    private Conditional(Expr condition, Block thenBlock, Block elseBlock) {
      assert(condition != null);
      assert(thenBlock != null);
      this.condition = condition;
      this.thenBlock = thenBlock;
      // Empty else block is equivalent to no else block
      this.elseBlock = (elseBlock == null || elseBlock.isEmpty()) ?
                                                  null : elseBlock;
    }

    public Expr condition() {
      return condition;
    }

    public Block thenBody() {
      return thenBlock;
    }

    /**
     * @return else branch, or null if none
     */
    public Block elseBody() {
      return elseBlock;
    }

    public boolean hasElse() {
      return elseBlock != null;
    }

    @Override
    public NodeType type() {
      return NodeType.CONDITIONAL;
    }

    @Override
    public Conditional conditional() {
      return this;
    }

    @Override
    public List<Node> getChildren() {
      if (elseBlock == null) {
        return Collections.<Node>singletonList(thenBlock);
      } else {
        return Arrays.<Node>asList(thenBlock, elseBlock);
      }
    }

    @Override
    public Conditional rebuild(List<Node> children) {
      if (children.isEmpty() || children.size() > 2) {
        throw new IETRuntimeError("Conditional needs one or two branches, "
                                  + children.size() + " given");
      }
      Block newThen = asBlock(children.get(0));
      Block newElse = children.size() == 2 ? asBlock(children.get(1)) : null;
      return new Conditional(condition, newThen, newElse);
    }

    /**
     * Branches are positional, so a deleted then branch becomes empty
     * rather than letting the else branch take its place
     */
    @Override
    public Conditional rebuildWith(List<Node> slots) {
      assert(slots.size() == getChildren().size());
      Block newThen = slots.get(0) == null ? new Block() : asBlock(slots.get(0));
      Block newElse = null;
      if (slots.size() == 2 && slots.get(1) != null) {
        newElse = asBlock(slots.get(1));
      }
      return new Conditional(condition, newThen, newElse);
    }

    private static Block asBlock(Node n) {
      if (n.type() == NodeType.BLOCK) {
        return n.block();
      }
      return new Block(n);
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      String newIndent = indent + IETUtil.indent;
      sb.append(indent);
      sb.append("<If " + condition.toString() + ">\n");
      thenBlock.prettyPrint(sb, newIndent);
      if (elseBlock != null) {
        sb.append(indent);
        sb.append("<Else>\n");
        elseBlock.prettyPrint(sb, newIndent);
      }
    }
  }
}
