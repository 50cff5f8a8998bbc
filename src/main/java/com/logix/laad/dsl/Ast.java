package com.logix.laad.dsl;

import java.util.List;
import java.util.Map;

/**
 * Abstract syntax tree of one LaaD compilation unit.
 *
 * <p>
 * The tree is built once by the {@link Parser} and discarded after graph building.
 */
public final class Ast {
    private Ast() {
    }

    /** A whole source file: statements in source order. */
    public record Program(List<Statement> statements) {
    }

    // ── Statements ──────────────────────────────────────────────────

    public interface Statement {
        SourceSpan span();
    }

    public record Comment(String text, SourceSpan span) implements Statement {
    }

    /** {@code import logix.io.display} or {@code import logix.io.display as show}. */
    public record Import(List<String> path, String alias, SourceSpan span) implements Statement {
        public String boundName() {
            return alias != null ? alias : path.get(path.size() - 1);
        }

        public String dotted() {
            return String.join(".", path);
        }
    }

    /** {@code name (: type)? = binding}, with any attributes written above it. */
    public record NodeDef(String name, TypeName annotation, List<AttributeDecl> attributes, Binding binding,
            SourceSpan span) implements Statement {
    }

    /** A bare connection such as {@code "Hello" -> display}. */
    public record ConnectionStatement(Expression expression, SourceSpan span) implements Statement {
    }

    /** {@code #[key]} or {@code #[key(name = literal, ...)]}. */
    public record AttributeDecl(String key, Map<String, Object> args, SourceSpan span) {
    }

    // ── Bindings ────────────────────────────────────────────────────

    /** Right-hand side of a node definition. */
    public interface Binding {
        SourceSpan span();
    }

    /** A dotted template path making up the whole right-hand side. */
    public record NodePath(List<String> segments, SourceSpan span) implements Binding {
        public String dotted() {
            return String.join(".", segments);
        }
    }

    /** An inline node class: {@code class my.Widget { in a: int, out done: impulse }}. */
    public record ClassDef(String className, List<PortDecl> ports, SourceSpan span) implements Binding {
    }

    public record PortDecl(boolean input, String name, TypeName type, SourceSpan span) {
    }

    /** Syntactic type: {@code int}, {@code Slot}, {@code ref<int>}. */
    public record TypeName(String name, TypeName argument, SourceSpan span) {
        @Override
        public String toString() {
            return argument == null ? name : name + "<" + argument + ">";
        }
    }

    // ── Expressions ─────────────────────────────────────────────────

    public interface Expression extends Binding {
    }

    public enum LiteralKind {
        INT, FLOAT, STRING, BOOL, NULL
    }

    public record Literal(LiteralKind kind, Object value, SourceSpan span) implements Expression {
    }

    /** {@code a}, {@code a.port} or {@code logix.io.display}. */
    public record NodeRef(List<String> path, SourceSpan span) implements Expression {
        public String dotted() {
            return String.join(".", path);
        }
    }

    public record Cast(Expression value, TypeName target, SourceSpan span) implements Expression {
    }

    public record BinaryOp(BinaryOperator operator, Expression left, Expression right, SourceSpan span)
            implements Expression {
    }

    public record UnaryOp(UnaryOperator operator, Expression operand, SourceSpan span) implements Expression {
    }

    /** {@code a -> b -> c}; always two or more elements. */
    public record Connection(List<Expression> chain, SourceSpan span) implements Expression {
    }

    /**
     * {@code if c0 then b0 elseif c1 then b1 else e end}. {@code conditions} and
     * {@code branches} are parallel; {@code elseBranch} is {@code null} when absent.
     */
    public record IfExpr(List<Expression> conditions, List<Expression> branches, Expression elseBranch,
            boolean terminated, SourceSpan span) implements Expression {
    }

    public record Block(List<Statement> statements, SourceSpan span) {
    }

    public record WhileLoop(Expression condition, Block body, SourceSpan span) implements Expression {
    }

    /** {@code for (i in from..to) { body }}, exclusive of {@code to}. */
    public record RangeFor(String variable, Expression from, Expression to, Block body, SourceSpan span)
            implements Expression {
    }

    /** {@code for (start, condition, step) { body }}. */
    public record GenericFor(Expression start, Expression condition, Expression step, Block body, SourceSpan span)
            implements Expression {
    }
}
