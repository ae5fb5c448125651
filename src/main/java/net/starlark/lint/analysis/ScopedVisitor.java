// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.starlark.lint.analysis;

import java.util.List;
import javax.annotation.Nullable;
import net.starlark.lint.syntax.AssignmentStatement;
import net.starlark.lint.syntax.Comprehension;
import net.starlark.lint.syntax.DefStatement;
import net.starlark.lint.syntax.Expression;
import net.starlark.lint.syntax.ForStatement;
import net.starlark.lint.syntax.Identifier;
import net.starlark.lint.syntax.IfStatement;
import net.starlark.lint.syntax.LambdaExpression;
import net.starlark.lint.syntax.ListExpression;
import net.starlark.lint.syntax.NodeVisitor;
import net.starlark.lint.syntax.Parameter;
import net.starlark.lint.syntax.StarlarkFile;
import net.starlark.lint.syntax.Statement;

/**
 * A {@link NodeVisitor} that keeps a {@link Scope} in step with the tree.
 *
 * <p>A frame is entered for each function or lambda body, for each branch of an {@code if}, for
 * the body (and {@code else} clause) of a {@code for} loop, and for each comprehension. Loop and
 * comprehension variables are bound in the new frame; assignment targets are bound in the current
 * one. Frames are popped even if visiting the block throws.
 *
 * <p>Subclasses that override a block-introducing {@code visit} overload must call through to
 * this class to keep the scope consistent. To react to a name being bound by an assignment,
 * override {@link #onAssign}.
 */
public class ScopedVisitor extends NodeVisitor {

  protected final Scope scope = new Scope();

  public final Scope getScope() {
    return scope;
  }

  /**
   * Called after {@code target} is bound by an assignment.
   *
   * @param value the expression assigned to {@code target}, if it is known. For a destructuring
   *     assignment from a literal sequence this is the corresponding element; from anything else
   *     it is null.
   */
  protected void onAssign(Identifier target, @Nullable Expression value) {}

  @Override
  public void visit(StarlarkFile file) {
    // Module-level names are visible in function bodies regardless of definition order.
    for (Statement stmt : file.getStatements()) {
      if (stmt instanceof DefStatement def) {
        scope.bind(def.getName());
      } else if (stmt instanceof AssignmentStatement assign) {
        for (Identifier id : Identifier.boundIdentifiers(assign.getLHS())) {
          scope.bind(id.getName());
        }
      }
    }
    super.visit(file);
  }

  @Override
  public void visit(AssignmentStatement node) {
    visit(node.getRHS());
    if (node.isAugmented()) {
      // x += y rebinds x to an unknown value
      if (node.getLHS() instanceof Identifier id) {
        scope.bindValue(id.getName(), SymbolicValue.UNKNOWN);
      } else {
        visit(node.getLHS());
      }
      return;
    }
    assign(node.getLHS(), node.getRHS());
  }

  private void assign(Expression lhs, Expression rhs) {
    if (lhs instanceof Identifier id) {
      scope.bindValue(id.getName(), SymbolicValue.of(rhs));
      onAssign(id, rhs);
    } else if (lhs instanceof ListExpression targets) {
      List<Expression> elements = targets.getElements();
      List<Expression> values =
          rhs instanceof ListExpression literal ? literal.getElements() : List.of();
      for (int i = 0; i < elements.size(); i++) {
        Expression target = elements.get(i);
        if (i < values.size()) {
          assign(target, values.get(i));
        } else {
          assignPositional(target, rhs, i);
        }
      }
    } else {
      // x[i] = ..., x.f = ...
      visit(lhs);
    }
  }

  private void assignPositional(Expression target, Expression source, int index) {
    for (Identifier id : Identifier.boundIdentifiers(target)) {
      scope.bindValue(id.getName(), new SymbolicValue.PositionalElement(source, index));
      onAssign(id, null);
    }
  }

  @Override
  public void visit(DefStatement node) {
    scope.bind(node.getName());
    visitDefaults(node.getParameters());
    scope.enter();
    try {
      bindParameters(node.getParameters());
      visitBlock(node.getBody());
    } finally {
      scope.exit();
    }
  }

  @Override
  public void visit(LambdaExpression node) {
    visitDefaults(node.getParameters());
    scope.enter();
    try {
      bindParameters(node.getParameters());
      visit(node.getBody());
    } finally {
      scope.exit();
    }
  }

  // Default values are evaluated in the scope enclosing the function.
  private void visitDefaults(List<Parameter> params) {
    for (Parameter param : params) {
      if (param.getDefaultValue() != null) {
        visit(param.getDefaultValue());
      }
    }
  }

  private void bindParameters(List<Parameter> params) {
    for (Parameter param : params) {
      if (param.getName() != null) {
        scope.bind(param.getName());
      }
    }
  }

  @Override
  public void visit(IfStatement node) {
    visit(node.getCondition());
    visitInFrame(node.getThenBlock());
    if (node.getElseBlock() != null) {
      visitInFrame(node.getElseBlock());
    }
  }

  private void visitInFrame(List<Statement> block) {
    scope.enter();
    try {
      visitBlock(block);
    } finally {
      scope.exit();
    }
  }

  @Override
  public void visit(ForStatement node) {
    visit(node.getIterable());
    scope.enter();
    try {
      bindTargets(node.getVars());
      visitBlock(node.getBody());
      visitBlock(node.getElseBlock());
    } finally {
      scope.exit();
    }
  }

  @Override
  public void visit(Comprehension node) {
    // The first iterable is evaluated in the enclosing scope; everything else sees the loop
    // variables.
    List<Comprehension.Clause> clauses = node.getClauses();
    if (!clauses.isEmpty() && clauses.get(0) instanceof Comprehension.For first) {
      visit(first.getIterable());
    }
    scope.enter();
    try {
      for (int i = 0; i < clauses.size(); i++) {
        Comprehension.Clause clause = clauses.get(i);
        if (clause instanceof Comprehension.For forClause) {
          if (i > 0) {
            visit(forClause.getIterable());
          }
          bindTargets(forClause.getVars());
        } else {
          visit(((Comprehension.If) clause).getCondition());
        }
      }
      visit(node.getBody());
    } finally {
      scope.exit();
    }
  }

  private void bindTargets(Expression vars) {
    for (Identifier id : Identifier.boundIdentifiers(vars)) {
      scope.bind(id.getName());
    }
  }
}
