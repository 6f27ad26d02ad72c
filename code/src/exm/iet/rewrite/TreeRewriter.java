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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.iet.common.Logging;
import exm.iet.common.Settings;
import exm.iet.tree.IETUtil;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.IETree.NodeId;

/**
 * Builds a new tree from an old one and a rewrite mapping.  Mapped nodes
 * are replaced or removed, ancestors of changed nodes are rebuilt, and
 * everything else is shared with the input tree.
 *
 * The strategy decides how mapped nodes nested inside other mapped nodes
 * interact:
 * <ul>
 * <li>SHALLOW: top-down.  The outermost mapped node on a path wins and
 *   its replacement is spliced as given; nothing below it is looked at.</li>
 * <li>NESTED: bottom-up.  A node's children are resolved first.  When a
 *   mapped node is replaced, any of its original descendants that occur
 *   inside the replacement are swapped for their resolved forms, so inner
 *   and outer substitutions both show in the result.</li>
 * </ul>
 * In neither case is a replacement matched against the mapping again.
 */
public class TreeRewriter {

  private static final Logger logger = Logging.getIETLogger();

  public static enum Strategy {
    SHALLOW,
    NESTED,
  }

  private final Strategy strategy;
  private final RewriteMapping mapping;

  /**
   * @throws exm.iet.common.exceptions.MalformedMappingException if
   *         the mapping is cyclic
   */
  public TreeRewriter(Strategy strategy, RewriteMapping mapping) {
    assert(strategy != null);
    assert(mapping != null);
    // Snapshot: later changes to the caller's mapping are not seen
    this.mapping = mapping.copy();
    this.mapping.validate();
    this.strategy = strategy;
  }

  /**
   * @param root
   * @return the rewritten tree, root itself if nothing changed, or null
   *         if the root was deleted
   */
  public Node rewrite(Node root) {
    boolean dumpTrees = logger.isDebugEnabled() &&
                    Settings.getBooleanUnchecked(Settings.COMPILER_DEBUG);
    if (dumpTrees) {
      logger.debug(strategy + " rewrite with " + mapping + " of:\n"
                   + IETUtil.printAST(root));
    }

    Node result;
    if (strategy == Strategy.SHALLOW) {
      result = rewriteShallow(root);
    } else {
      result = rewriteNested(root, new HashMap<NodeId, Node>());
    }

    if (dumpTrees) {
      logger.debug("Rewrite result:\n" +
                   (result == null ? "<deleted>" : IETUtil.printAST(result)));
    }
    return result;
  }

  private Node rewriteShallow(Node node) {
    if (mapping.containsKey(node.id())) {
      Node replacement = mapping.get(node.id());
      logApplied(node, replacement);
      return replacement;
    }

    List<Node> children = node.getChildren();
    List<Node> slots = new ArrayList<Node>(children.size());
    boolean changed = false;
    for (Node child: children) {
      Node newChild = rewriteShallow(child);
      slots.add(newChild);
      changed = changed || newChild != child;
    }
    return changed ? node.rebuildWith(slots) : node;
  }

  /**
   * @param node
   * @param resolved filled in with original id -> result for every node in
   *        this subtree whose result differs from the original (null
   *        result for deletion)
   */
  private Node rewriteNested(Node node, Map<NodeId, Node> resolved) {
    Map<NodeId, Node> resolvedBelow = new HashMap<NodeId, Node>();
    List<Node> children = node.getChildren();
    List<Node> slots = new ArrayList<Node>(children.size());
    boolean changed = false;
    for (Node child: children) {
      Node newChild = rewriteNested(child, resolvedBelow);
      slots.add(newChild);
      changed = changed || newChild != child;
    }

    Node result;
    if (mapping.containsKey(node.id())) {
      Node replacement = mapping.get(node.id());
      result = replacement == null ? null : graft(replacement, resolvedBelow);
      logApplied(node, result);
    } else if (changed) {
      result = node.rebuildWith(slots);
    } else {
      result = node;
    }

    resolved.putAll(resolvedBelow);
    if (result != node) {
      resolved.put(node.id(), result);
    }
    return result;
  }

  /**
   * Substitute resolved forms of original nodes inside a replacement.
   * Resolved forms are not descended into.
   */
  private Node graft(Node node, Map<NodeId, Node> resolved) {
    if (resolved.containsKey(node.id())) {
      return resolved.get(node.id());
    }
    List<Node> children = node.getChildren();
    List<Node> slots = new ArrayList<Node>(children.size());
    boolean changed = false;
    for (Node child: children) {
      Node newChild = graft(child, resolved);
      slots.add(newChild);
      changed = changed || newChild != child;
    }
    return changed ? node.rebuildWith(slots) : node;
  }

  private void logApplied(Node original, Node result) {
    if (logger.isTraceEnabled()) {
      if (result == null) {
        logger.trace("Deleting " + original.type() + original.id());
      } else {
        logger.trace("Replacing " + original.type() + original.id() +
                     " with " + result.type() + result.id());
      }
    }
  }
}
