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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.FormatMethod;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import net.starlark.lint.syntax.Argument;
import net.starlark.lint.syntax.AssignmentStatement;
import net.starlark.lint.syntax.CallExpression;
import net.starlark.lint.syntax.DefStatement;
import net.starlark.lint.syntax.DictExpression;
import net.starlark.lint.syntax.DotExpression;
import net.starlark.lint.syntax.Expression;
import net.starlark.lint.syntax.Identifier;
import net.starlark.lint.syntax.ListExpression;
import net.starlark.lint.syntax.StarlarkFile;
import net.starlark.lint.syntax.Statement;

/**
 * Collects the function signatures of a file, checks its calls against the signatures known to
 * the {@link AnalysisState}, and records references to functions of other files.
 *
 * <p>A bare call {@code f()} resolves to, in order: a builtin (not checked), a function defined in
 * this file, nothing (if {@code f} is some other variable in scope), or the unique analyzed file
 * defining a top-level {@code f}. A qualified call {@code m.f()} resolves through the import that
 * {@code m} denotes, following aliases.
 *
 * <p>Resolution and reference recording always happen; {@code checkCalls} only controls whether
 * call problems are reported.
 */
public final class FunctionVisitor extends ScopedVisitor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final Path file;
  private final ImportTable imports;
  private final AnalysisState state;
  private final boolean checkCalls;

  // Top-level functions; these are visible to other files.
  private final Map<String, FunctionSignature> signatures = new LinkedHashMap<>();
  // Functions defined in blocks, innermost enclosing function first.
  private final Deque<Map<String, FunctionSignature>> localSignatures = new ArrayDeque<>();

  private final List<Violation> violations = new ArrayList<>();

  public FunctionVisitor(Path file, ImportTable imports, AnalysisState state, boolean checkCalls) {
    this.file = file;
    this.imports = imports;
    this.state = state;
    this.checkCalls = checkCalls;
    localSignatures.push(new HashMap<>());
  }

  /** Returns the top-level function signatures, in definition order. */
  public ImmutableMap<String, FunctionSignature> getSignatures() {
    return ImmutableMap.copyOf(signatures);
  }

  /** Returns summaries of the top-level functions, in definition order. */
  public ImmutableList<FunctionSummary> getSummaries() {
    return signatures.values().stream()
        .map(FunctionSignature::summary)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Violation> getViolations() {
    return ImmutableList.copyOf(violations);
  }

  @Override
  public void visit(StarlarkFile node) {
    // Calls may precede the definition of their callee.
    for (Statement stmt : node.getStatements()) {
      if (stmt instanceof DefStatement def) {
        signatures.put(def.getName(), FunctionSignature.of(def, file));
      }
    }
    super.visit(node);
  }

  @Override
  public void visit(DefStatement node) {
    if (!scope.isGlobal()) {
      localSignatures.peek().put(node.getName(), FunctionSignature.of(node, file));
    }
    localSignatures.push(new HashMap<>());
    try {
      super.visit(node);
    } finally {
      localSignatures.pop();
    }
  }

  @Override
  public void visit(CallExpression node) {
    Expression fn = node.getFunction();
    if (fn instanceof Identifier id) {
      checkCall(node, id.getName());
    } else if (fn instanceof DotExpression dot && dot.getObject() instanceof Identifier object) {
      checkQualifiedCall(node, object.getName(), dot.getField().getName());
    } else {
      // e.g. get_config().get(...)
      visit(fn);
    }

    for (Argument arg : node.getArguments()) {
      recordReference(arg.getValue());
      visit(arg);
    }
  }

  @Override
  public void visit(AssignmentStatement node) {
    if (!node.isAugmented()) {
      recordReference(node.getRHS());
    }
    super.visit(node);
  }

  @Override
  public void visit(ListExpression node) {
    for (Expression element : node.getElements()) {
      recordReference(element);
    }
    super.visit(node);
  }

  @Override
  public void visit(DictExpression node) {
    for (DictExpression.Entry entry : node.getEntries()) {
      recordReference(entry.getValue());
    }
    super.visit(node);
  }

  private void checkCall(CallExpression call, String name) {
    if (Builtins.isFunction(name)) {
      return;
    }
    FunctionSignature local = lookupLocal(name);
    if (local != null) {
      report(call, CallChecker.check(call, local, name));
      return;
    }
    if (scope.isBound(name)) {
      // A parameter or variable; its value is not known.
      return;
    }

    List<Path> candidates = new ArrayList<>(state.filesDefining(name));
    candidates.remove(file);
    if (candidates.size() == 1) {
      Path target = candidates.get(0);
      FunctionSignature signature = state.signaturesOf(target).get(name);
      report(call, CallChecker.check(call, signature, displayName(target, name)));
      state.addReference(target, name);
    } else if (candidates.size() > 1) {
      // Ambiguous: not checked, but still counts as a use of one definition.
      logger.atFine().log(
          "%s: '%s' is defined in %d files, not checking the call", file, name, candidates.size());
      state.addReference(candidates.get(0), name);
    }
  }

  @Nullable
  private FunctionSignature lookupLocal(String name) {
    for (Map<String, FunctionSignature> frame : localSignatures) {
      FunctionSignature signature = frame.get(name);
      if (signature != null) {
        return signature;
      }
    }
    return signatures.get(name);
  }

  private void checkQualifiedCall(CallExpression call, String object, String name) {
    if (Builtins.isModule(object)) {
      return;
    }
    ImportBinding binding = imports.resolve(object);
    if (binding == null) {
      if (!scope.isBound(object)) {
        report(
            call,
            "Invalid object '%s' in call to '%s.%s': object is not defined",
            object,
            object,
            name);
      }
      return;
    }
    if (binding.isExternal()) {
      logger.atFine().log("%s: not checking call into package %s", file, binding.packageId());
      return;
    }

    Path target = state.moduleIndex().resolve(binding);
    if (target == null) {
      report(
          call, "Could not resolve module '%s' for call to '%s.%s'", object, object, name);
      return;
    }
    ImmutableMap<String, FunctionSignature> targetSignatures = state.signaturesOf(target);
    if (targetSignatures == null) {
      report(
          call,
          "Module '%s' has not been analyzed for call to '%s.%s'",
          object,
          object,
          name);
      return;
    }
    FunctionSignature signature = targetSignatures.get(name);
    if (signature == null) {
      report(call, "Call to non-existent function '%s' in module '%s'", name, object);
      return;
    }
    report(call, CallChecker.check(call, signature, displayName(target, name)));
    if (!target.equals(file)) {
      state.addReference(target, name);
    }
  }

  // Records m.f used as a value, where m denotes an import of another file defining f.
  private void recordReference(Expression value) {
    if (!(value instanceof DotExpression dot && dot.getObject() instanceof Identifier object)) {
      return;
    }
    ImportBinding binding = imports.resolve(object.getName());
    if (binding == null) {
      return;
    }
    Path target = state.moduleIndex().resolve(binding);
    if (target == null || target.equals(file)) {
      return;
    }
    ImmutableMap<String, FunctionSignature> targetSignatures = state.signaturesOf(target);
    String name = dot.getField().getName();
    if (targetSignatures != null && targetSignatures.containsKey(name)) {
      logger.atFine().log("%s: reference to %s:%s", value.getStartLocation(), target, name);
      state.addReference(target, name);
    }
  }

  private String displayName(Path target, String name) {
    return target.equals(file) ? name : target.getFileName() + ":" + name;
  }

  private void report(CallExpression call, List<String> messages) {
    if (checkCalls) {
      for (String message : messages) {
        violations.add(Violation.create(file, call.getLine(), message));
      }
    }
  }

  @FormatMethod
  private void report(CallExpression call, String format, Object... args) {
    report(call, ImmutableList.of(String.format(format, args)));
  }
}
