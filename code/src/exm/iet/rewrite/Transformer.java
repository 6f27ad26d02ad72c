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
package exm.iet.rewrite;

import java.util.Map;

import exm.iet.rewrite.TreeRewriter.Strategy;
import exm.iet.tree.IETree.Node;

/**
 * Replace or delete nodes of a tree in a single top-down pass.
 * Only nodes of the input tree are matched, so the result doesn't depend
 * on the order of the mapping.
 */
public class Transformer {
  private final TreeRewriter rewriter;

  public Transformer(RewriteMapping mapping) {
    this.rewriter = new TreeRewriter(Strategy.SHALLOW, mapping);
  }

  /**
   * @param mapping node to replacement, null replacement to delete
   */
  public Transformer(Map<? extends Node, ? extends Node> mapping) {
    this(RewriteMapping.of(mapping));
  }

  /**
   * @return new tree, or null if root was deleted
   */
  public Node visit(Node root) {
    return rewriter.rewrite(root);
  }
}
