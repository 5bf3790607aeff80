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

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.defeasible.ast.Desugared;
import net.hydromatic.defeasible.ast.Scopelang;
import net.hydromatic.defeasible.ast.Uid;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the rule trees of
   * each definition, then calls the underlying tracer. */
  public static Tracer withOnRuleTree(Tracer tracer,
      BiConsumer<Desugared.ScopeDefKey, List<RuleTree>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRuleTree(Desugared.ScopeDefKey key,
          List<RuleTree> forest) {
        consumer.accept(key, forest);
        super.onRuleTree(key, forest);
      }
    };
  }

  /** Returns a tracer that performs the given action on the execution order
   * of each scope, then calls the underlying tracer. */
  public static Tracer withOnOrder(Tracer tracer,
      BiConsumer<Uid.ScopeName, List<ScopeDependencies.Vertex>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onOrder(Uid.ScopeName scope,
          List<ScopeDependencies.Vertex> vertices) {
        consumer.accept(scope, vertices);
        super.onOrder(scope, vertices);
      }
    };
  }

  /** Returns a tracer that performs the given action on each lowered scope,
   * then calls the underlying tracer. */
  public static Tracer withOnScopeDecl(Tracer tracer,
      Consumer<Scopelang.ScopeDecl> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onScopeDecl(Scopelang.ScopeDecl decl) {
        consumer.accept(decl);
        super.onScopeDecl(decl);
      }
    };
  }

  /** Returns a tracer that handles compile exceptions by passing them to
   * the given action. */
  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(@Nullable CompileException e) {
        if (e != null) {
          consumer.accept(e);
        }
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onRuleTree(Desugared.ScopeDefKey key,
        List<RuleTree> forest) {
    }

    @Override
    public void onOrder(Uid.ScopeName scope,
        List<ScopeDependencies.Vertex> vertices) {
    }

    @Override
    public void onScopeDecl(Scopelang.ScopeDecl decl) {
    }

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onRuleTree(Desugared.ScopeDefKey key,
        List<RuleTree> forest) {
      tracer.onRuleTree(key, forest);
    }

    @Override
    public void onOrder(Uid.ScopeName scope,
        List<ScopeDependencies.Vertex> vertices) {
      tracer.onOrder(scope, vertices);
    }

    @Override
    public void onScopeDecl(Scopelang.ScopeDecl decl) {
      tracer.onScopeDecl(decl);
    }

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
