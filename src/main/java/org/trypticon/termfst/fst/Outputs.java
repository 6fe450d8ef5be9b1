/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.trypticon.termfst.fst;

import java.io.IOException;

import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;

/**
 * Represents the outputs for an FST, providing the basic
 * algebra required for building and traversing the FST.
 *
 * <p>Note that any operation that returns NO_OUTPUT must
 * return the same singleton object from {@link #getNoOutput}.</p>
 *
 * @param <T> the output type.
 */
public abstract class Outputs<T> {

  /** Eg common("foobar", "food") -&gt; "foo". */
  public abstract T common(T output1, T output2);

  /** Eg subtract("foobar", "foo") -&gt; "bar". */
  public abstract T subtract(T output, T inc);

  /** Eg add("foo", "bar") -&gt; "foobar". */
  public abstract T add(T prefix, T output);

  public abstract void write(T output, DataOutput out) throws IOException;

  /** Encodes the output of a final arc; defaults to {@link #write}. */
  public void writeFinalOutput(T output, DataOutput out) throws IOException {
    write(output, out);
  }

  public abstract T read(DataInput in) throws IOException;

  /** Skips the output previously written with {@link #write}; must consume exactly what {@link #read} would. */
  public void skipOutput(DataInput in) throws IOException {
    read(in);
  }

  public T readFinalOutput(DataInput in) throws IOException {
    return read(in);
  }

  public void skipFinalOutput(DataInput in) throws IOException {
    skipOutput(in);
  }

  /** NOTE: this output is compared with == so you must ensure that all methods return the single object if it's really no output. */
  public abstract T getNoOutput();

  public abstract String outputToString(T output);

  /** Whether {@link #merge} is supported, ie keys may be added more than once. */
  public boolean canMerge() {
    return false;
  }

  /** Combines the outputs of a key that was added twice in a row. */
  public T merge(T first, T second) {
    throw new UnsupportedOperationException("outputs " + this + " cannot merge duplicate keys");
  }

  /** Approximate heap used by one output instance. */
  public abstract long ramBytesUsed(T output);
}
