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
 * Like {@link Transformer}, but resolves depth-first, so a mapped node
 * and a mapped node inside it can both be rewritten in one pass.
 * E.g. mapping a loop to a new loop around its old body, and an
 * expression in that body to another expression, gives the new loop
 * around the rewritten body.
 */
public class NestedTransformer {
  private final TreeRewriter rewriter;

  public NestedTransformer(RewriteMapping mapping) {
    this.rewriter = new TreeRewriter(Strategy.NESTED, mapping);
  }

  public NestedTransformer(Map<? extends Node, ? extends Node> mapping) {
    this(RewriteMapping.of(mapping));
  }

  public Node visit(Node root) {
    return rewriter.rewrite(root);
  }
}
