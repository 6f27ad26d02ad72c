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
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.iet.common.exceptions.IETRuntimeError;
import exm.iet.common.lang.Dimension;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.IETree.NodeType;

public class Iterations {

  /**
   * Loop over one dimension from start to end inclusive.
   * Property tags are carried through passes without being interpreted.
   */
  public static class Iteration extends Node {
    private final Dimension dim;
    private final int start;
    private final int end;
    private final int step;
    /** Extra points read below and above the bounds */
    private final int lowerOffset;
    private final int upperOffset;
    private final List<String> properties;
    private final List<Node> body;

    public Iteration(Dimension dim, int start, int end, int step,
                     Node... body) {
      this(dim, start, end, step, Arrays.asList(body));
    }

    public Iteration(Dimension dim, int start, int end, int step,
                     List<? extends Node> body) {
      this(dim, start, end, step, 0, 0, Collections.<String>emptyList(), body);
    }

    public Iteration(Dimension dim, int start, int end, int step,
                     int lowerOffset, int upperOffset, List<String> properties,
                     List<? extends Node> body) {
      assert(dim != null);
      if (start > end || step <= 0) {
        throw new IETRuntimeError("Invalid limits for iteration over " + dim
                        + ": (" + start + ", " + end + ", " + step + ")");
      }
      this.dim = dim;
      this.start = start;
      this.end = end;
      this.step = step;
      this.lowerOffset = lowerOffset;
      this.upperOffset = upperOffset;
      this.properties = Collections.unmodifiableList(
                                    new ArrayList<String>(properties));
      this.body = IETUtil.checkedChildren(body);
    }

    public Dimension dim() {
      return dim;
    }

    public int start() {
      return start;
    }

    public int end() {
      return end;
    }

    public int step() {
      return step;
    }

    public int lowerOffset() {
      return lowerOffset;
    }

    public int upperOffset() {
      return upperOffset;
    }

    public List<String> properties() {
      return properties;
    }

    @Override
    public NodeType type() {
      return NodeType.ITERATION;
    }

    @Override
    public Iteration iteration() {
      return this;
    }

    @Override
    public List<Node> getChildren() {
      return body;
    }

    @Override
    public Iteration rebuild(List<Node> children) {
      return new Iteration(dim, start, end, step, lowerOffset, upperOffset,
                           properties, children);
    }

    @Override
    public void prettyPrint(StringBuilder sb, String indent) {
      sb.append(indent);
      sb.append("<");
      if (!properties.isEmpty()) {
        sb.append("[" + StringUtils.join(properties, ",") + "] ");
      }
      sb.append("Iteration ");
      sb.append(dim.name() + "::" + dim.indexName());
      sb.append("::(" + start + ", " + end + ", " + step + ")");
      sb.append("::(" + lowerOffset + ", " + upperOffset + ")");
      sb.append(">\n");
      String newIndent = indent + IETUtil.indent;
      for (Node n: body) {
        n.prettyPrint(sb, newIndent);
      }
    }
  }
}
