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

import java.util.List;

/** A pretty-printer for syntax trees. */
final class NodePrinter {

  private final StringBuilder buf;
  private final int indent;

  NodePrinter(StringBuilder buf) {
    this(buf, 0);
  }

  NodePrinter(StringBuilder buf, int indent) {
    this.buf = buf;
    this.indent = indent;
  }

  void printNode(Node n) {
    if (n instanceof Expression expr) {
      printExpr(expr);
    } else if (n instanceof Statement stmt) {
      printStmt(stmt, indent);
    } else if (n instanceof StarlarkFile file) {
      for (Statement stmt : file.getStatements()) {
        printStmt(stmt, indent);
      }
    } else if (n instanceof Comprehension.Clause clause) {
      printClause(clause);
    } else if (n instanceof DictExpression.Entry entry) {
      printDictEntry(entry);
    } else if (n instanceof Parameter param) {
      printParameter(param);
    } else if (n instanceof Argument arg) {
      printArgument(arg);
    } else {
      throw new IllegalArgumentException("unexpected node: " + n.getClass().getSimpleName());
    }
  }

  private void printSuite(List<Statement> statements, int indent) {
    // A suite is non-empty; pass statements are explicit.
    for (Statement stmt : statements) {
      printStmt(stmt, indent);
    }
  }

  private void printIndent(int indent) {
    for (int i = 0; i < indent; i++) {
      buf.append("  ");
    }
  }

  private void printDictEntry(DictExpression.Entry e) {
    printExpr(e.getKey());
    buf.append(": ");
    printExpr(e.getValue());
  }

  private void printParameter(Parameter param) {
    if (param instanceof Parameter.Star) {
      buf.append('*');
    } else if (param instanceof Parameter.StarStar) {
      buf.append("**");
    }
    if (param.getName() != null) {
      buf.append(param.getName());
    }
    if (param.getType() != null) {
      buf.append(": ");
      printExpr(param.getType());
    }
    if (param.getDefaultValue() != null) {
      buf.append('=');
      printExpr(param.getDefaultValue());
    }
  }

  private void printArgument(Argument arg) {
    if (arg instanceof Argument.Star) {
      buf.append('*');
    } else if (arg instanceof Argument.StarStar) {
      buf.append("**");
    } else if (arg instanceof Argument.Keyword) {
      buf.append(arg.getName()).append('=');
    }
    printExpr(arg.getValue());
  }

  private void printClause(Comprehension.Clause clause) {
    if (clause instanceof Comprehension.For forClause) {
      buf.append("for ");
      printExpr(forClause.getVars());
      buf.append(" in ");
      printExpr(forClause.getIterable());
    } else {
      buf.append("if ");
      printExpr(((Comprehension.If) clause).getCondition());
    }
  }

  // Appends "def f(a, ..., z):" to the buffer.
  void printDefSignature(DefStatement def) {
    buf.append("def ");
    buf.append(def.getName());
    buf.append('(');
    String sep = "";
    for (Parameter param : def.getParameters()) {
      buf.append(sep);
      printParameter(param);
      sep = ", ";
    }
    buf.append(')');
    if (def.getReturnType() != null) {
      buf.append(" -> ");
      printExpr(def.getReturnType());
    }
    buf.append(':');
  }

  private void printStmt(Statement s, int indent) {
    printIndent(indent);

    switch (s.kind()) {
      case ASSIGNMENT:
        {
          AssignmentStatement stmt = (AssignmentStatement) s;
          printExpr(stmt.getLHS());
          buf.append(' ');
          if (stmt.isAugmented()) {
            buf.append(stmt.getOperator());
          }
          buf.append("= ");
          printExpr(stmt.getRHS());
          buf.append('\n');
          break;
        }

      case EXPRESSION:
        printExpr(((ExpressionStatement) s).getExpression());
        buf.append('\n');
        break;

      case FLOW:
        buf.append(((FlowStatement) s).getFlowKind()).append('\n');
        break;

      case FOR:
        {
          ForStatement stmt = (ForStatement) s;
          buf.append("for ");
          printExpr(stmt.getVars());
          buf.append(" in ");
          printExpr(stmt.getIterable());
          buf.append(":\n");
          printSuite(stmt.getBody(), indent + 1);
          if (!stmt.getElseBlock().isEmpty()) {
            printIndent(indent);
            buf.append("else:\n");
            printSuite(stmt.getElseBlock(), indent + 1);
          }
          break;
        }

      case DEF:
        {
          DefStatement stmt = (DefStatement) s;
          printDefSignature(stmt);
          buf.append('\n');
          printSuite(stmt.getBody(), indent + 1);
          break;
        }

      case IF:
        {
          IfStatement stmt = (IfStatement) s;
          buf.append(stmt.isElif() ? "elif " : "if ");
          printExpr(stmt.getCondition());
          buf.append(":\n");
          printSuite(stmt.getThenBlock(), indent + 1);
          List<Statement> elseBlock = stmt.getElseBlock();
          if (elseBlock != null) {
            if (elseBlock.size() == 1
                && elseBlock.get(0) instanceof IfStatement elif
                && elif.isElif()) {
              printStmt(elif, indent);
            } else {
              printIndent(indent);
              buf.append("else:\n");
              printSuite(elseBlock, indent + 1);
            }
          }
          break;
        }

      case RETURN:
        {
          ReturnStatement stmt = (ReturnStatement) s;
          buf.append("return");
          if (stmt.getResult() != null) {
            buf.append(' ');
            printExpr(stmt.getResult());
          }
          buf.append('\n');
          break;
        }
    }
  }

  private void printExpr(Expression expr) {
    switch (expr.kind()) {
      case BINARY_OPERATOR:
        {
          BinaryOperatorExpression binop = (BinaryOperatorExpression) expr;
          // TODO: omit parens when the precedence of the operands makes them redundant.
          buf.append('(');
          printExpr(binop.getX());
          buf.append(' ').append(binop.getOperator()).append(' ');
          printExpr(binop.getY());
          buf.append(')');
          break;
        }

      case COMPREHENSION:
        {
          Comprehension comp = (Comprehension) expr;
          buf.append(comp.isDict() ? '{' : '[');
          printNode(comp.getBody());
          for (Comprehension.Clause clause : comp.getClauses()) {
            buf.append(' ');
            printClause(clause);
          }
          buf.append(comp.isDict() ? '}' : ']');
          break;
        }

      case CONDITIONAL:
        {
          ConditionalExpression cond = (ConditionalExpression) expr;
          printExpr(cond.getThenCase());
          buf.append(" if ");
          printExpr(cond.getCondition());
          buf.append(" else ");
          printExpr(cond.getElseCase());
          break;
        }

      case DICT_EXPR:
        {
          DictExpression dict = (DictExpression) expr;
          buf.append('{');
          String sep = "";
          for (DictExpression.Entry entry : dict.getEntries()) {
            buf.append(sep);
            printDictEntry(entry);
            sep = ", ";
          }
          buf.append('}');
          break;
        }

      case DOT:
        {
          DotExpression dot = (DotExpression) expr;
          printExpr(dot.getObject());
          buf.append('.');
          buf.append(dot.getField().getName());
          break;
        }

      case CALL:
        {
          CallExpression call = (CallExpression) expr;
          printExpr(call.getFunction());
          buf.append('(');
          String sep = "";
          for (Argument arg : call.getArguments()) {
            buf.append(sep);
            printArgument(arg);
            sep = ", ";
          }
          buf.append(')');
          break;
        }

      case IDENTIFIER:
        buf.append(((Identifier) expr).getName());
        break;

      case INDEX:
        {
          IndexExpression index = (IndexExpression) expr;
          printExpr(index.getObject());
          buf.append('[');
          printExpr(index.getKey());
          buf.append(']');
          break;
        }

      case INT_LITERAL:
        buf.append(((IntLiteral) expr).getRaw());
        break;

      case FLOAT_LITERAL:
        buf.append(((FloatLiteral) expr).getRaw());
        break;

      case LAMBDA:
        {
          LambdaExpression lambda = (LambdaExpression) expr;
          buf.append("lambda");
          String sep = " ";
          for (Parameter param : lambda.getParameters()) {
            buf.append(sep);
            printParameter(param);
            sep = ", ";
          }
          buf.append(": ");
          printExpr(lambda.getBody());
          break;
        }

      case LIST_EXPR:
        {
          ListExpression list = (ListExpression) expr;
          buf.append(list.isTuple() ? '(' : '[');
          String sep = "";
          for (Expression e : list.getElements()) {
            buf.append(sep);
            printExpr(e);
            sep = ", ";
          }
          if (list.isTuple() && list.getElements().size() == 1) {
            buf.append(',');
          }
          buf.append(list.isTuple() ? ')' : ']');
          break;
        }

      case SLICE:
        {
          SliceExpression slice = (SliceExpression) expr;
          printExpr(slice.getObject());
          buf.append('[');
          if (slice.getStart() != null) {
            printExpr(slice.getStart());
          }
          buf.append(':');
          if (slice.getStop() != null) {
            printExpr(slice.getStop());
          }
          if (slice.getStep() != null) {
            buf.append(':');
            printExpr(slice.getStep());
          }
          buf.append(']');
          break;
        }

      case STRING_LITERAL:
        quote(((StringLiteral) expr).getValue());
        break;

      case UNARY_OPERATOR:
        {
          UnaryOperatorExpression unop = (UnaryOperatorExpression) expr;
          buf.append(unop.getOperator());
          if (unop.getOperator() == TokenKind.NOT) {
            buf.append(' ');
          }
          printExpr(unop.getX());
          break;
        }
    }
  }

  private void quote(String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"' -> buf.append("\\\"");
        case '\\' -> buf.append("\\\\");
        case '\n' -> buf.append("\\n");
        case '\r' -> buf.append("\\r");
        case '\t' -> buf.append("\\t");
        default -> buf.append(c);
      }
    }
    buf.append('"');
  }
}
