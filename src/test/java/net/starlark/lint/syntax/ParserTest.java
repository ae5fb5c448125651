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
package net.starlark.lint.syntax;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of parser. */
@RunWith(JUnit4.class)
public final class ParserTest {

  private final List<SyntaxError> events = new ArrayList<>();

  private SyntaxError assertContainsError(String expectedMessage) {
    return LexerTest.assertContainsError(events, expectedMessage);
  }

  // Joins the lines, parses, and returns a file. Errors are thrown.
  private static StarlarkFile parseFile(String... lines) throws SyntaxError.Exception {
    StarlarkFile file = StarlarkFile.parse(ParserInput.fromLines(lines));
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors());
    }
    return file;
  }

  // Joins the lines, parses, and records the errors in this.events.
  private void parseFileWithErrors(String... lines) {
    StarlarkFile file = StarlarkFile.parse(ParserInput.fromLines(lines));
    assertThat(file.ok()).isFalse();
    events.addAll(file.errors());
  }

  private static Statement parseStatement(String... lines) throws SyntaxError.Exception {
    return Iterables.getOnlyElement(parseFile(lines).getStatements());
  }

  private static Expression parseExpression(String src) throws SyntaxError.Exception {
    return ((ExpressionStatement) parseStatement(src)).getExpression();
  }

  // Parses the source and returns its canonical form.
  private static String reformat(String... lines) throws SyntaxError.Exception {
    return parseFile(lines).prettyPrint();
  }

  @Test
  public void testAssignment() throws Exception {
    AssignmentStatement stmt = (AssignmentStatement) parseStatement("x = 1");
    assertThat(stmt.isAugmented()).isFalse();
    assertThat(((Identifier) stmt.getLHS()).getName()).isEqualTo("x");
    assertThat(((IntLiteral) stmt.getRHS()).getValue()).isEqualTo(1);
  }

  @Test
  public void testAugmentedAssignment() throws Exception {
    AssignmentStatement stmt = (AssignmentStatement) parseStatement("x += 1");
    assertThat(stmt.isAugmented()).isTrue();
    assertThat(stmt.getOperator()).isEqualTo(TokenKind.PLUS);
    assertThat(stmt.prettyPrint()).isEqualTo("x += 1\n");
  }

  @Test
  public void testTupleAssignment() throws Exception {
    AssignmentStatement stmt = (AssignmentStatement) parseStatement("a, b = 1, 2");
    assertThat(((ListExpression) stmt.getLHS()).isTuple()).isTrue();
    assertThat(stmt.prettyPrint()).isEqualTo("(a, b) = (1, 2)\n");
  }

  @Test
  public void testPrecedence() throws Exception {
    assertThat(parseExpression("a + b * c").prettyPrint()).isEqualTo("(a + (b * c))");
    assertThat(parseExpression("a or b and not c").prettyPrint())
        .isEqualTo("(a or (b and not c))");
    assertThat(parseExpression("a not in b").prettyPrint()).isEqualTo("(a not in b)");
    assertThat(parseExpression("-x.y").prettyPrint()).isEqualTo("-x.y");
  }

  @Test
  public void testAdjacentStringsAreConcatenated() throws Exception {
    StringLiteral str = (StringLiteral) parseExpression("'abc' \"def\"");
    assertThat(str.getValue()).isEqualTo("abcdef");
  }

  @Test
  public void testCallArguments() throws Exception {
    CallExpression call = (CallExpression) parseExpression("f(1, a=2, *b, **c)");
    assertThat(call.getNumPositionalArguments()).isEqualTo(1);
    assertThat(call.hasStarArgument()).isTrue();
    assertThat(call.hasStarStarArgument()).isTrue();
    assertThat(call.getArguments().get(1).getName()).isEqualTo("a");
    assertThat(call.prettyPrint()).isEqualTo("f(1, a=2, *b, **c)");
  }

  @Test
  public void testTrailingCommaInCall() throws Exception {
    CallExpression call = (CallExpression) parseExpression("f(\n  1,\n  2,\n)");
    assertThat(call.getArguments()).hasSize(2);
  }

  @Test
  public void testDefStatement() throws Exception {
    DefStatement def =
        (DefStatement) parseStatement("def f(a, b=1, *args, c, d=2, **kw):", "  pass");
    assertThat(def.getName()).isEqualTo("f");
    ImmutableList<Parameter> params = def.getParameters();
    assertThat(params).hasSize(6);
    assertThat(params.get(0)).isInstanceOf(Parameter.Mandatory.class);
    assertThat(params.get(1)).isInstanceOf(Parameter.Optional.class);
    assertThat(params.get(2)).isInstanceOf(Parameter.Star.class);
    assertThat(params.get(2).getName()).isEqualTo("args");
    assertThat(params.get(5)).isInstanceOf(Parameter.StarStar.class);
    assertThat(def.prettyPrint()).isEqualTo("def f(a, b=1, *args, c, d=2, **kw):\n  pass\n");
  }

  @Test
  public void testBareStarParameter() throws Exception {
    DefStatement def = (DefStatement) parseStatement("def f(a, *, b):", "  pass");
    assertThat(def.getParameters().get(1).getName()).isNull();
    assertThat(def.prettyPrint()).isEqualTo("def f(a, *, b):\n  pass\n");
  }

  @Test
  public void testDefAnnotations() throws Exception {
    DefStatement def =
        (DefStatement)
            parseStatement("def f(a: int, b: str = 'x') -> bool:", "  return True");
    assertThat(def.getParameters().get(0).getType().prettyPrint()).isEqualTo("int");
    assertThat(def.getParameters().get(1).getDefaultValue().prettyPrint()).isEqualTo("\"x\"");
    assertThat(def.getReturnType().prettyPrint()).isEqualTo("bool");
    assertThat(def.prettyPrint())
        .isEqualTo("def f(a: int, b: str=\"x\") -> bool:\n  return True\n");
  }

  @Test
  public void testDocString() throws Exception {
    DefStatement documented =
        (DefStatement) parseStatement("def f():", "  \"\"\"Does f.", "", "  More.\"\"\"", "  pass");
    assertThat(documented.hasDocString()).isTrue();

    DefStatement undocumented = (DefStatement) parseStatement("def g():", "  x = 'no'");
    assertThat(undocumented.hasDocString()).isFalse();
  }

  @Test
  public void testIfElifElse() throws Exception {
    String src = "if a:\n  x\nelif b:\n  y\nelse:\n  z\n";
    IfStatement stmt = (IfStatement) parseStatement(src);
    assertThat(stmt.isElif()).isFalse();
    IfStatement elif = (IfStatement) Iterables.getOnlyElement(stmt.getElseBlock());
    assertThat(elif.isElif()).isTrue();
    assertThat(elif.getElseBlock()).hasSize(1);
    assertThat(reformat(src)).isEqualTo(src);
  }

  @Test
  public void testForElse() throws Exception {
    ForStatement stmt =
        (ForStatement) parseStatement("for k, v in d.items():", "  pass", "else:", "  x = 1");
    assertThat(Identifier.boundIdentifiers(stmt.getVars())).hasSize(2);
    assertThat(stmt.getElseBlock()).hasSize(1);
  }

  @Test
  public void testComprehensions() throws Exception {
    assertThat(parseExpression("[x for x in y if x]").prettyPrint())
        .isEqualTo("[x for x in y if x]");
    Comprehension comp = (Comprehension) parseExpression("{k: v for k, v in d.items()}");
    assertThat(comp.isDict()).isTrue();
    assertThat(comp.getClauses()).hasSize(1);
  }

  @Test
  public void testOtherExpressions() throws Exception {
    assertThat(reformat("d = {'a': x[1:2], 'b': y.z}"))
        .isEqualTo("d = {\"a\": x[1:2], \"b\": y.z}\n");
    assertThat(reformat("x = a if b else c")).isEqualTo("x = a if b else c\n");
    assertThat(reformat("f = lambda x, y=1: x")).isEqualTo("f = lambda x, y=1: x\n");
    assertThat(reformat("t = (1,)")).isEqualTo("t = (1,)\n");
  }

  @Test
  public void testStatementLines() throws Exception {
    ImmutableList<Statement> stmts = parseFile("a = 1", "", "# comment", "def f():", "  pass")
        .getStatements();
    assertThat(stmts.get(0).getLine()).isEqualTo(1);
    assertThat(stmts.get(1).getLine()).isEqualTo(4);
  }

  @Test
  public void testSemicolons() throws Exception {
    assertThat(parseFile("a = 1; b = 2;").getStatements()).hasSize(2);
  }

  @Test
  public void testChainedAssignmentIsAnError() {
    parseFileWithErrors("a = b = c");
    assertContainsError("chained assignment is not supported");
  }

  @Test
  public void testForbiddenKeywords() {
    parseFileWithErrors("while x:", "  pass");
    assertContainsError("'while' not supported, use 'for' instead");
    events.clear();
    parseFileWithErrors("import foo");
    assertContainsError("'import' not supported, use 'import_module' instead");
    events.clear();
    parseFileWithErrors("from foo import bar");
    assertContainsError("'from' not supported, use 'import_module' instead");
  }

  @Test
  public void testGeneratorExpressionsAreNotSupported() {
    parseFileWithErrors("f(x for x in y)");
    assertContainsError("generator expressions are not supported");
  }

  @Test
  public void testMissingIndentedBlock() {
    parseFileWithErrors("def f():", "x = 1");
    assertContainsError("expected an indented block");
  }

  @Test
  public void testErrorLocation() {
    SyntaxError.Exception ex = assertThrows(SyntaxError.Exception.class, () -> parseFile("x = *"));
    assertThat(ex.errors().get(0).toString())
        .isEqualTo(":1:5: syntax error at '*': expected expression");
  }

  @Test
  public void testParsingContinuesAfterAnError() {
    StarlarkFile file = StarlarkFile.parse(ParserInput.fromLines("x = 1 2", "y = 1"));
    assertThat(file.errors().get(0).message())
        .isEqualTo("syntax error at '2': expected newline");
    assertThat(Iterables.getLast(file.getStatements()).prettyPrint()).isEqualTo("y = 1\n");
  }
}
