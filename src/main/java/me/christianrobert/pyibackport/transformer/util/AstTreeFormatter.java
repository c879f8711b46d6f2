package me.christianrobert.pyibackport.transformer.util;

import me.christianrobert.pyibackport.antlr.PyStubParser;
import me.christianrobert.pyibackport.transformer.collect.CollectionResult;
import me.christianrobert.pyibackport.transformer.collect.GenericDeclaration;
import me.christianrobert.pyibackport.transformer.model.TypeParameter;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats ANTLR parse trees into human-readable, indented text representation.
 *
 * <p>Useful for debugging and understanding how a stub is parsed by the grammar.</p>
 *
 * <p>Example output (with collection information):</p>
 * <pre>
 * Module
 *   Statement
 *     CompoundStatement
 *       FunctionDef [LOWERED: T]
 *         "def" (DEF)
 *         Name [spam]
 *           "spam" (NAME)
 *         TypeParams
 *           "[" (OPEN_BRACK)
 * </pre>
 */
public class AstTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a parse tree into human-readable text.
   *
   * @param tree Root of the parse tree
   * @return Formatted string representation
   */
  public static String format(ParseTree tree) {
    return format(tree, null);
  }

  /**
   * Formats a parse tree, marking generic declarations with what the collector decided for them:
   * {@code [LOWERED: T, U]} or {@code [KEPT: T]}.
   *
   * @param tree Root of the parse tree
   * @param collection Optional collector output, may be null
   * @return Formatted string representation
   */
  public static String format(ParseTree tree, CollectionResult collection) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb, collection);
    return sb.toString();
  }

  private static void formatNode(ParseTree tree, int depth, StringBuilder sb, CollectionResult collection) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }

    if (tree instanceof TerminalNode) {
      TerminalNode terminal = (TerminalNode) tree;
      sb.append("\"").append(escapeAndTruncate(terminal.getText())).append("\"");
      String tokenName = getTokenName(terminal);
      if (!tokenName.isEmpty()) {
        sb.append(" (").append(tokenName).append(")");
      }
      sb.append("\n");

    } else if (tree instanceof ParserRuleContext) {
      ParserRuleContext ctx = (ParserRuleContext) tree;
      sb.append(getRuleName(ctx));

      // Text snippet for small nodes
      if (ctx.getChildCount() <= 2) {
        String text = ctx.getText();
        if (text.length() <= 30) {
          sb.append(" [").append(escapeAndTruncate(text)).append("]");
        }
      }

      if (collection != null) {
        GenericDeclaration declaration = collection.getDeclaration(ctx);
        if (declaration != null) {
          sb.append(declaration.isLowered() ? " [LOWERED: " : " [KEPT: ")
            .append(parameterNames(declaration))
            .append("]");
        }
      }

      sb.append("\n");

      for (int i = 0; i < ctx.getChildCount(); i++) {
        formatNode(ctx.getChild(i), depth + 1, sb, collection);
      }

    } else {
      sb.append("(unknown: ").append(tree.getClass().getSimpleName()).append(")\n");
    }
  }

  private static String parameterNames(GenericDeclaration declaration) {
    List<String> names = new ArrayList<>();
    for (TypeParameter parameter : declaration.getParameters()) {
      names.add(parameter.getName());
    }
    return String.join(", ", names);
  }

  /**
   * Gets the rule name from a parser rule context, without the "Context" suffix.
   */
  private static String getRuleName(ParserRuleContext ctx) {
    String className = ctx.getClass().getSimpleName();
    if (className.endsWith("Context")) {
      className = className.substring(0, className.length() - "Context".length());
    }
    return className;
  }

  private static String getTokenName(TerminalNode terminal) {
    int type = terminal.getSymbol().getType();
    if (type == Token.EOF) {
      return "EOF";
    }
    String name = PyStubParser.VOCABULARY.getSymbolicName(type);
    return name != null ? name : "";
  }

  /**
   * Escapes and truncates text for display.
   */
  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }

    return text;
  }
}
