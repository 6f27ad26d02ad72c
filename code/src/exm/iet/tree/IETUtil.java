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
import java.util.Collections;
import java.util.List;

import exm.iet.common.exceptions.IETRuntimeError;
import exm.iet.tree.IETree.Node;

/**
 * Miscellaneous utilities used in multiple places in the tree code
 */
public class IETUtil {

  public static final String indent = "  ";

  /**
   * Canonical text form of a tree: one line per node, nested nodes
   * indented by one unit, no trailing newline.
   */
  public static String printAST(Node node) {
    StringBuilder sb = new StringBuilder();
    node.prettyPrint(sb, "");
    return stripTrailingNewline(sb);
  }

  public static String printAST(List<? extends Node> nodes) {
    StringBuilder sb = new StringBuilder();
    for (Node n: nodes) {
      n.prettyPrint(sb, "");
    }
    return stripTrailingNewline(sb);
  }

  private static String stripTrailingNewline(StringBuilder sb) {
    int len = sb.length();
    if (len > 0 && sb.charAt(len - 1) == '\n') {
      sb.setLength(len - 1);
    }
    return sb.toString();
  }

  /**
   * Copy of a child list, rejecting nulls
   */
  static List<Node> checkedChildren(List<? extends Node> children) {
    List<Node> res = new ArrayList<Node>(children.size());
    for (Node n: children) {
      if (n == null) {
        throw new IETRuntimeError("Null child in node list: " + children);
      }
      res.add(n);
    }
    return Collections.unmodifiableList(res);
  }

  /**
   * @return number of nodes in tree, root included
   */
  public static int countNodes(Node root) {
    int count = 1;
    for (Node child: root.getChildren()) {
      count += countNodes(child);
    }
    return count;
  }
}
