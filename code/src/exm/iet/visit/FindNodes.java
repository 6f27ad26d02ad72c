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
package exm.iet.visit;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.iet.common.Logging;
import exm.iet.tree.IETree.Expression;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.IETree.NodeType;
import exm.iet.visit.TreeWalk.TreeWalker;

/**
 * Collect all nodes of one type in pre-order
 */
public class FindNodes {

  private static final Logger logger = Logging.getIETLogger();

  private final NodeType type;

  public FindNodes(NodeType type) {
    this.type = type;
  }

  public List<Node> visit(Node root) {
    final List<Node> found = new ArrayList<Node>();
    TreeWalk.walk(logger, root, new TreeWalker() {
      @Override
      public void visit(Logger logger, Node node) {
        if (node.type() == type) {
          found.add(node);
        }
      }
    });
    return found;
  }

  public static List<Expression> expressions(Node root) {
    List<Expression> res = new ArrayList<Expression>();
    for (Node n: new FindNodes(NodeType.EXPRESSION).visit(root)) {
      res.add(n.expression());
    }
    return res;
  }
}
