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
package net.hydromatic.defeasible.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.defeasible.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An error occurred during compilation.
 *
 * <p>Carries one or more spans; each is a position in the source, optionally
 * with a label that says what is at that position.
 */
public class CompileException extends RuntimeException {
  public final ImmutableList<Span> spans;

  public CompileException(String message, List<Span> spans) {
    super(message);
    this.spans = ImmutableList.copyOf(spans);
    checkArgument(!this.spans.isEmpty(), "no position");
  }

  public CompileException(String message, Pos pos) {
    this(message, ImmutableList.of(new Span(null, pos)));
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos();
  }

  /** Returns the position of the first span. */
  public Pos pos() {
    return spans.get(0).pos;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Error: ").append(getMessage());
    for (Span span : spans) {
      buf.append('\n');
      if (span.label != null) {
        buf.append(span.label).append(' ');
      }
      span.pos.describeTo(buf);
    }
    return buf;
  }

  /** Position in the source, and what is there. */
  public static class Span {
    public final @Nullable String label;
    public final Pos pos;

    public Span(@Nullable String label, Pos pos) {
      this.label = label;
      this.pos = requireNonNull(pos);
    }

    @Override
    public String toString() {
      return label == null ? pos.toString() : label + " " + pos;
    }
  }
}

// End CompileException.java
