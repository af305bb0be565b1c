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
package net.hydromatic.seqmatch;

/**
 * Thrown when a traversal takes more steps than allowed by {@link
 * MatchProp#STEP_LIMIT}.
 */
public class StepLimitExceededException extends RuntimeException {
  private final int stepLimit;

  public StepLimitExceededException(int stepLimit) {
    super("sequence match exceeded step limit " + stepLimit);
    this.stepLimit = stepLimit;
  }

  /** Returns the limit that was exceeded. */
  public int stepLimit() {
    return stepLimit;
  }
}

// End StepLimitExceededException.java
