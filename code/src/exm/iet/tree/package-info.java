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
/**
 * This package contains the definitions for the loop nest tree.
 * Pretty-printing is implemented in the node classes themselves; the
 * canonical printed form is what tests compare trees by.
 * Analyses live in {@link exm.iet.visit} and rewriting in
 * {@link exm.iet.rewrite}.
 */
package exm.iet.tree;
