package io.matchscan.condition;

import io.matchscan.model.ConditionExpr;
import io.matchscan.model.ConditionExpr.Call;
import io.matchscan.model.ConditionExpr.Equals;
import io.matchscan.model.ConditionExpr.Literal;
import io.matchscan.model.ConditionExpr.Not;
import io.matchscan.model.ConditionExpr.Path;
import io.matchscan.model.ConditionExpr.TypeTest;
import io.matchscan.model.MatchBranch;
import io.matchscan.model.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the branch syntax of the interchange format into {@link MatchBranch} values.
 * <p>
 * Branch forms:
 * <pre>
 *   else
 *   else if &lt;guard&gt;
 *   &lt;head&gt;[, &lt;head&gt;...] [if &lt;guard&gt;]     (construct with a subject)
 *   &lt;guard&gt;                              (construct without a subject)
 * </pre>
 * Heads are {@code is T}, {@code !is T}, {@code in X} or a constant. Guards use
 * {@code && || ! == != is !is}, parentheses, dotted names, literals and calls.
 */
public class ConditionParser {

    private enum TokenType {
        IDENT, NUMBER, STRING, AND, OR, NOT, EQ, NE, LPAREN, RPAREN, COMMA, EOF
    }

    private record Token(TokenType type, String text, int position) {}

    private final String input;
    private final List<Token> tokens;
    private int pos;

    private ConditionParser(String input) {
        this.input = input;
        this.tokens = tokenize(input);
        this.pos = 0;
    }

    /**
     * Parses one branch.
     *
     * @param text    Branch text, e.g. "is Error if status.problem == CONNECTION"
     * @param subject Subject of the construct, or null for a subject-less construct
     * @throws ConditionSyntaxException on malformed input
     */
    public static MatchBranch parseBranch(String text, Reference subject) {
        if (text == null || text.isBlank()) {
            throw new ConditionSyntaxException("Empty branch", text, 0);
        }
        ConditionParser parser = new ConditionParser(text.trim());
        MatchBranch branch = parser.branch(subject);
        parser.expect(TokenType.EOF);
        return branch.withSource(text.trim());
    }

    /**
     * Parses a standalone boolean condition.
     */
    public static ConditionExpr parseCondition(String text) {
        if (text == null || text.isBlank()) {
            throw new ConditionSyntaxException("Empty condition", text, 0);
        }
        ConditionParser parser = new ConditionParser(text.trim());
        ConditionExpr expr = parser.disjunction();
        parser.expect(TokenType.EOF);
        return expr;
    }

    private MatchBranch branch(Reference subject) {
        if (peekKeyword("else")) {
            advance();
            if (peekKeyword("if")) {
                advance();
                return MatchBranch.otherwiseIf(disjunction());
            }
            return MatchBranch.otherwise();
        }
        if (subject == null) {
            return MatchBranch.when(disjunction());
        }

        List<ConditionExpr> heads = new ArrayList<>();
        heads.add(head(subject));
        while (peek().type() == TokenType.COMMA) {
            advance();
            heads.add(head(subject));
        }
        ConditionExpr guard = null;
        if (peekKeyword("if")) {
            advance();
            guard = disjunction();
        }
        return new MatchBranch(heads, guard, false, null);
    }

    private ConditionExpr head(Reference subject) {
        Path subjectPath = new Path(subject);
        if (peek().type() == TokenType.NOT && peekKeywordAt(pos + 1, "is")) {
            advance();
            advance();
            return new TypeTest(subjectPath, typeName(), true);
        }
        if (peekKeyword("is")) {
            advance();
            return new TypeTest(subjectPath, typeName(), false);
        }
        if (peekKeyword("in")) {
            advance();
            return new Call("in", List.of(subjectPath, primary()));
        }
        return new Equals(subjectPath, primary(), false);
    }

    private ConditionExpr disjunction() {
        List<ConditionExpr> operands = new ArrayList<>();
        operands.add(conjunction());
        while (peek().type() == TokenType.OR) {
            advance();
            operands.add(conjunction());
        }
        return operands.size() == 1 ? operands.get(0) : new ConditionExpr.Or(operands);
    }

    private ConditionExpr conjunction() {
        List<ConditionExpr> operands = new ArrayList<>();
        operands.add(unary());
        while (peek().type() == TokenType.AND) {
            advance();
            operands.add(unary());
        }
        return operands.size() == 1 ? operands.get(0) : new ConditionExpr.And(operands);
    }

    private ConditionExpr unary() {
        if (peek().type() == TokenType.NOT) {
            advance();
            return new Not(unary());
        }
        return comparison();
    }

    private ConditionExpr comparison() {
        ConditionExpr left = primary();
        Token next = peek();
        switch (next.type()) {
            case EQ:
                advance();
                return new Equals(left, primary(), false);
            case NE:
                advance();
                return new Equals(left, primary(), true);
            case NOT:
                if (peekKeywordAt(pos + 1, "is")) {
                    advance();
                    advance();
                    return new TypeTest(left, typeName(), true);
                }
                return left;
            default:
                if (peekKeyword("is")) {
                    advance();
                    return new TypeTest(left, typeName(), false);
                }
                return left;
        }
    }

    private ConditionExpr primary() {
        Token token = advance();
        switch (token.type()) {
            case LPAREN: {
                ConditionExpr inner = disjunction();
                expect(TokenType.RPAREN);
                return inner;
            }
            case NUMBER:
                return Literal.number(token.text());
            case STRING:
                return Literal.string(token.text());
            case IDENT: {
                switch (token.text()) {
                    case "null":
                        return Literal.NULL;
                    case "true":
                        return Literal.TRUE;
                    case "false":
                        return Literal.FALSE;
                    default:
                        break;
                }
                if (peek().type() == TokenType.LPAREN) {
                    advance();
                    List<ConditionExpr> arguments = new ArrayList<>();
                    if (peek().type() != TokenType.RPAREN) {
                        arguments.add(disjunction());
                        while (peek().type() == TokenType.COMMA) {
                            advance();
                            arguments.add(disjunction());
                        }
                    }
                    expect(TokenType.RPAREN);
                    return new Call(token.text(), arguments);
                }
                return new Path(Reference.of(token.text()));
            }
            default:
                throw error("Unexpected " + describe(token), token);
        }
    }

    private String typeName() {
        Token token = expect(TokenType.IDENT);
        return token.text();
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private boolean peekKeyword(String keyword) {
        return peekKeywordAt(pos, keyword);
    }

    private boolean peekKeywordAt(int index, String keyword) {
        if (index >= tokens.size()) {
            return false;
        }
        Token token = tokens.get(index);
        return token.type() == TokenType.IDENT && token.text().equals(keyword);
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (token.type() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    private Token expect(TokenType type) {
        Token token = peek();
        if (token.type() != type) {
            throw error("Expected " + type.name().toLowerCase() + " but found " + describe(token), token);
        }
        return advance();
    }

    private ConditionSyntaxException error(String message, Token token) {
        return new ConditionSyntaxException(message, input, token.position());
    }

    private static String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of input" : "'" + token.text() + "'";
    }

    private static List<Token> tokenize(String input) {
        List<Token> result = new ArrayList<>();
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            if (Character.isJavaIdentifierStart(c)) {
                // Dotted names are one token: status.problem
                while (i < input.length()
                        && (Character.isJavaIdentifierPart(input.charAt(i))
                        || (input.charAt(i) == '.' && i + 1 < input.length()
                        && Character.isJavaIdentifierStart(input.charAt(i + 1))))) {
                    i++;
                }
                result.add(new Token(TokenType.IDENT, input.substring(start, i), start));
                continue;
            }
            if (Character.isDigit(c) || (c == '-' && i + 1 < input.length() && Character.isDigit(input.charAt(i + 1)))) {
                i++;
                while (i < input.length() && (Character.isDigit(input.charAt(i)) || input.charAt(i) == '.')) {
                    i++;
                }
                result.add(new Token(TokenType.NUMBER, input.substring(start, i), start));
                continue;
            }
            if (c == '"') {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < input.length() && input.charAt(i) != '"') {
                    if (input.charAt(i) == '\\' && i + 1 < input.length()) {
                        i++;
                    }
                    sb.append(input.charAt(i));
                    i++;
                }
                if (i >= input.length()) {
                    throw new ConditionSyntaxException("Unterminated string literal", input, start);
                }
                i++;
                result.add(new Token(TokenType.STRING, sb.toString(), start));
                continue;
            }
            String two = i + 1 < input.length() ? input.substring(i, i + 2) : "";
            switch (two) {
                case "&&" -> result.add(new Token(TokenType.AND, two, start));
                case "||" -> result.add(new Token(TokenType.OR, two, start));
                case "==" -> result.add(new Token(TokenType.EQ, two, start));
                case "!=" -> result.add(new Token(TokenType.NE, two, start));
                default -> {
                    TokenType single = switch (c) {
                        case '!' -> TokenType.NOT;
                        case '(' -> TokenType.LPAREN;
                        case ')' -> TokenType.RPAREN;
                        case ',' -> TokenType.COMMA;
                        default -> throw new ConditionSyntaxException("Unexpected character '" + c + "'", input, start);
                    };
                    result.add(new Token(single, String.valueOf(c), start));
                    i++;
                    continue;
                }
            }
            i += 2;
        }
        result.add(new Token(TokenType.EOF, "", input.length()));
        return result;
    }
}
