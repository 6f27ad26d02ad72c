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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import exm.iet.common.exceptions.MalformedMappingException;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.IETree.NodeId;

/**
 * Set of node -> replacement pairs driving a rewrite.  Keys are node
 * handles, so only the exact node instances added here match.
 * A null replacement means the node is deleted.
 */
public class RewriteMapping {

  /** Key id -> key node, in insertion order */
  private final Map<NodeId, Node> keys = new LinkedHashMap<NodeId, Node>();
  /** Key id -> replacement, null for deletion */
  private final Map<NodeId, Node> replacements = new HashMap<NodeId, Node>();

  public static RewriteMapping of(Map<? extends Node, ? extends Node> map) {
    RewriteMapping mapping = new RewriteMapping();
    for (Entry<? extends Node, ? extends Node> e: map.entrySet()) {
      if (e.getValue() == null) {
        mapping.delete(e.getKey());
      } else {
        mapping.replace(e.getKey(), e.getValue());
      }
    }
    return mapping;
  }

  public RewriteMapping replace(Node key, Node replacement) {
    assert(key != null);
    assert(replacement != null);
    keys.put(key.id(), key);
    replacements.put(key.id(), replacement);
    return this;
  }

  public RewriteMapping delete(Node key) {
    assert(key != null);
    keys.put(key.id(), key);
    replacements.put(key.id(), null);
    return this;
  }

  /**
   * @return independent copy; later changes to either side don't show
   *         in the other
   */
  RewriteMapping copy() {
    RewriteMapping res = new RewriteMapping();
    res.keys.putAll(keys);
    res.replacements.putAll(replacements);
    return res;
  }

  public boolean containsKey(NodeId id) {
    return keys.containsKey(id);
  }

  public boolean isDeletion(NodeId id) {
    return keys.containsKey(id) && replacements.get(id) == null;
  }

  /**
   * @return replacement for key, or null if deleted or not a key
   */
  public Node get(NodeId id) {
    return replacements.get(id);
  }

  public Collection<Node> keys() {
    return Collections.unmodifiableCollection(keys.values());
  }

  public int size() {
    return keys.size();
  }

  public boolean isEmpty() {
    return keys.isEmpty();
  }

  /**
   * Check that no chain of replacements leads back to its start.
   * Key K depends on key K2 if K's replacement contains K2.  A
   * replacement containing its own key wraps the key and is fine, since
   * replacements are spliced without further substitution.
   * @throws MalformedMappingException
   */
  public void validate() {
    Map<NodeId, Set<NodeId>> deps = new HashMap<NodeId, Set<NodeId>>();
    for (NodeId key: keys.keySet()) {
      Set<NodeId> contained = new LinkedHashSet<NodeId>();
      Node replacement = replacements.get(key);
      if (replacement != null) {
        findKeys(replacement, contained);
      }
      contained.remove(key);
      deps.put(key, contained);
    }

    Set<NodeId> done = new HashSet<NodeId>();
    for (NodeId key: keys.keySet()) {
      checkCycles(key, deps, new ArrayList<NodeId>(), done);
    }
  }

  private void findKeys(Node n, Set<NodeId> found) {
    if (keys.containsKey(n.id())) {
      found.add(n.id());
    }
    for (Node child: n.getChildren()) {
      findKeys(child, found);
    }
  }

  private void checkCycles(NodeId key, Map<NodeId, Set<NodeId>> deps,
                           List<NodeId> path, Set<NodeId> done) {
    if (done.contains(key)) {
      return;
    }
    int pos = path.indexOf(key);
    if (pos >= 0) {
      List<String> cycle = new ArrayList<String>();
      for (NodeId id: path.subList(pos, path.size())) {
        cycle.add(describe(id));
      }
      cycle.add(describe(key));
      throw new MalformedMappingException(cycle);
    }
    path.add(key);
    for (NodeId dep: deps.get(key)) {
      checkCycles(dep, deps, path, done);
    }
    path.remove(path.size() - 1);
    done.add(key);
  }

  private String describe(NodeId id) {
    return keys.get(id).type().toString().toLowerCase() + id;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (Entry<NodeId, Node> e: keys.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(describe(e.getKey()));
      sb.append(" -> ");
      Node replacement = replacements.get(e.getKey());
      if (replacement == null) {
        sb.append("<deleted>");
      } else {
        sb.append(replacement.type().toString().toLowerCase() + replacement.id());
      }
    }
    sb.append("}");
    return sb.toString();
  }
}
