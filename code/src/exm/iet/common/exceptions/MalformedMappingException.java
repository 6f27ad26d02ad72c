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
package exm.iet.common.exceptions;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Rewrite mapping where replacements refer back to each other's keys
 * in a cycle.
 */
public class MalformedMappingException extends IETRuntimeError {

  private final List<String> cycle;

  public MalformedMappingException(List<String> cycle) {
    super("Cyclic rewrite mapping: " + StringUtils.join(cycle, " -> "));
    this.cycle = cycle;
  }

  /**
   * @return the keys forming the cycle, first key repeated at the end
   */
  public List<String> getCycle() {
    return cycle;
  }

  private static final long serialVersionUID = 1L;
}
