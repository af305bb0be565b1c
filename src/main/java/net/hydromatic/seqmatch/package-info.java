/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */

/**
 * Matching of quantified sequences.
 *
 * <p>A destination sequence and a source sequence of
 * {@link net.hydromatic.seqmatch.QuantifiedItem}s are aligned by a
 * depth-first backtracking search; each item may occur between
 * {@code minMatches} and {@code maxMatches} times.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.seqmatch.SequenceMatching} - Static entry
 *       points: existence, grouping and common sequence.
 *   <li>{@link net.hydromatic.seqmatch.SequenceMatcher} - Configurable
 *       search engine; memoization, step limit and tracing.
 *   <li>{@link net.hydromatic.seqmatch.SequenceAccumulator} - Persistent
 *       state folded over each pairing of the walk.
 *   <li>{@link net.hydromatic.seqmatch.MatchProp} - Configuration
 *       properties.
 * </ul>
 */
package net.hydromatic.seqmatch;

// End package-info.java
