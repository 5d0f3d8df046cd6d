package io.matchscan.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Condition expression tree as handed over by the front end.
 * <p>
 * The tree is syntactic only: a {@link Path} may name a reference or an enum entry /
 * singleton variant, and it is the normalizer that decides which.
 */
public sealed interface ConditionExpr
        permits ConditionExpr.Path, ConditionExpr.Literal, ConditionExpr.Equals, ConditionExpr.TypeTest,
                ConditionExpr.Not, ConditionExpr.And, ConditionExpr.Or, ConditionExpr.Call {

    /**
     * A dotted name: a reference, or a constant resolved against the other operand's type.
     */
    record Path(Reference reference) implements ConditionExpr {
        public static Path of(String dotted) {
            return new Path(Reference.of(dotted));
        }

        @Override
        public String toString() {
            return reference.path();
        }
    }

    /**
     * A literal constant.
     */
    record Literal(Kind kind, String text) implements ConditionExpr {
        public enum Kind { NULL, BOOLEAN, NUMBER, STRING }

        public static final Literal NULL = new Literal(Kind.NULL, "null");
        public static final Literal TRUE = new Literal(Kind.BOOLEAN, "true");
        public static final Literal FALSE = new Literal(Kind.BOOLEAN, "false");

        public static Literal number(String text) {
            return new Literal(Kind.NUMBER, text);
        }

        public static Literal string(String text) {
            return new Literal(Kind.STRING, text);
        }

        @Override
        public String toString() {
            return kind == Kind.STRING ? "\"" + text + "\"" : text;
        }
    }

    /**
     * {@code left == right}, or {@code left != right} when negated.
     */
    record Equals(ConditionExpr left, ConditionExpr right, boolean negated) implements ConditionExpr {
        @Override
        public String toString() {
            return left + (negated ? " != " : " == ") + right;
        }
    }

    /**
     * {@code operand is TypeName}, or {@code !is} when negated.
     */
    record TypeTest(ConditionExpr operand, String typeName, boolean negated) implements ConditionExpr {
        @Override
        public String toString() {
            return operand + (negated ? " !is " : " is ") + typeName;
        }
    }

    record Not(ConditionExpr operand) implements ConditionExpr {
        @Override
        public String toString() {
            return "!(" + operand + ")";
        }
    }

    record And(List<ConditionExpr> operands) implements ConditionExpr {
        public And {
            operands = List.copyOf(operands);
        }

        @Override
        public String toString() {
            return operands.stream().map(Object::toString).collect(Collectors.joining(" && "));
        }
    }

    record Or(List<ConditionExpr> operands) implements ConditionExpr {
        public Or {
            operands = List.copyOf(operands);
        }

        @Override
        public String toString() {
            return "(" + operands.stream().map(Object::toString).collect(Collectors.joining(" || ")) + ")";
        }
    }

    /**
     * A function or method call; never analyzable.
     */
    record Call(String name, List<ConditionExpr> arguments) implements ConditionExpr {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String toString() {
            return name + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
        }
    }

    static ConditionExpr and(ConditionExpr... operands) {
        return new And(List.of(operands));
    }

    static ConditionExpr eq(String path, ConditionExpr right) {
        return new Equals(Path.of(path), right, false);
    }

    static ConditionExpr eq(String path, String constant) {
        return new Equals(Path.of(path), Path.of(constant), false);
    }

    static ConditionExpr ne(String path, ConditionExpr right) {
        return new Equals(Path.of(path), right, true);
    }

    static ConditionExpr is(String path, String typeName) {
        return new TypeTest(Path.of(path), typeName, false);
    }
}
