package com.logix.laad.node;

import com.logix.laad.dsl.BinaryOperator;
import com.logix.laad.dsl.UnaryOperator;
import com.logix.laad.types.DummyType;
import com.logix.laad.types.ObjectRefType;
import com.logix.laad.types.PrimitiveType;
import com.logix.laad.types.RefIdType;
import com.logix.laad.types.Type;
import com.logix.laad.types.TypeClass;
import com.logix.laad.types.TypeParam;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry mapping dotted template paths to {@link NodeTemplate}s.
 *
 * <p>
 * A new registry already holds the built-in node set; hosts add their own kinds with
 * {@link #register(NodeTemplate)} before compiling.
 */
public final class TemplateRegistry {
    public static final String LITERAL = "logix.literal.value";
    public static final String CAST = "logix.cast";
    public static final String CONDITIONAL = "logix.operators.conditional";
    public static final String FLOW_IF = "logix.flow.if";
    public static final String FLOW_WHILE = "logix.flow.while";
    public static final String FLOW_SEQUENCE = "logix.flow.sequence";
    public static final String VARIABLE = "logix.data.variable";
    public static final String WRITE = "logix.actions.write";

    private static final Type BOOL = PrimitiveType.BOOL;

    private final Map<String, NodeTemplate> registry = new LinkedHashMap<>();

    public TemplateRegistry() {
        registerBuiltIns();
    }

    public void register(NodeTemplate template) {
        if (template.path().startsWith("sugar."))
            throw new IllegalArgumentException("The 'sugar.' namespace is reserved: " + template.path());
        if (registry.putIfAbsent(template.path(), template) != null)
            throw new IllegalArgumentException("Template already registered: " + template.path());
    }

    /** Returns the template registered under {@code path}, or {@code null}. */
    public NodeTemplate lookup(String path) {
        return registry.get(path);
    }

    public NodeTemplate require(String path) {
        NodeTemplate t = registry.get(path);
        if (t == null)
            throw new IllegalArgumentException("Unknown template: " + path);
        return t;
    }

    public boolean contains(String path) {
        return registry.containsKey(path);
    }

    // ── Built-in templates ──────────────────────────────────────────

    private void registerBuiltIns() {
        TypeParam any = new TypeParam("T", TypeClass.ANY);

        // --- Values ---
        register(NodeTemplate.builder(LITERAL).out("value", any).build());
        register(NodeTemplate.builder(CAST)
                .in("value", new TypeParam("S", TypeClass.ANY))
                .out("result", new TypeParam("R", TypeClass.ANY))
                .build());
        register(NodeTemplate.builder(VARIABLE)
                .out("value", any)
                .out("ref", new RefIdType(any))
                .build());

        // --- Operators ---
        registerBinary(BinaryOperator.OR, null, BOOL);
        registerBinary(BinaryOperator.AND, null, BOOL);
        registerBinary(BinaryOperator.BIT_OR, TypeClass.BOOLEAN_OR_INTEGRAL, null);
        registerBinary(BinaryOperator.BIT_XOR, TypeClass.BOOLEAN_OR_INTEGRAL, null);
        registerBinary(BinaryOperator.BIT_AND, TypeClass.BOOLEAN_OR_INTEGRAL, null);
        registerBinary(BinaryOperator.EQ, TypeClass.ANY, BOOL);
        registerBinary(BinaryOperator.NE, TypeClass.ANY, BOOL);
        registerBinary(BinaryOperator.LT, TypeClass.COMPARABLE, BOOL);
        registerBinary(BinaryOperator.LE, TypeClass.COMPARABLE, BOOL);
        registerBinary(BinaryOperator.GT, TypeClass.COMPARABLE, BOOL);
        registerBinary(BinaryOperator.GE, TypeClass.COMPARABLE, BOOL);
        registerBinary(BinaryOperator.CMP, TypeClass.COMPARABLE, PrimitiveType.INT);
        registerBinary(BinaryOperator.SHL, TypeClass.INTEGRAL, null);
        registerBinary(BinaryOperator.SHR, TypeClass.INTEGRAL, null);
        registerBinary(BinaryOperator.ADD, TypeClass.ADDABLE, null);
        registerBinary(BinaryOperator.SUB, TypeClass.NUMERIC, null);
        registerBinary(BinaryOperator.MUL, TypeClass.NUMERIC, null);
        registerBinary(BinaryOperator.DIV, TypeClass.NUMERIC, null);
        registerBinary(BinaryOperator.MOD, TypeClass.NUMERIC, null);
        registerUnary(UnaryOperator.NEGATE, TypeClass.NUMERIC);
        registerUnary(UnaryOperator.NOT, TypeClass.BOOLEAN);
        registerUnary(UnaryOperator.BIT_NOT, TypeClass.INTEGRAL);
        register(NodeTemplate.builder(CONDITIONAL)
                .in("condition", BOOL)
                .in("onTrue", any)
                .in("onFalse", any)
                .out("result", any)
                .build());

        // --- Flow ---
        register(NodeTemplate.builder(FLOW_IF)
                .impulseIn("trigger").in("condition", BOOL)
                .impulseOut("onTrue").impulseOut("onFalse")
                .build());
        register(NodeTemplate.builder(FLOW_WHILE)
                .impulseIn("trigger").in("condition", BOOL)
                .impulseOut("loopIteration").impulseOut("loopEnd")
                .build());
        register(NodeTemplate.builder(FLOW_SEQUENCE)
                .impulseIn("trigger")
                .impulseOut("first").impulseOut("then")
                .build());
        register(NodeTemplate.builder(WRITE)
                .impulseIn("trigger")
                .in("value", any)
                .in("target", new RefIdType(any))
                .impulseOut("onDone")
                .build());

        // --- Inputs and outputs ---
        register(NodeTemplate.builder("logix.input.button").impulseOut("pressed").build());
        register(NodeTemplate.builder("logix.input.update").impulseOut("pulse").build());
        register(NodeTemplate.builder("logix.io.display").in("value", DummyType.INSTANCE).build());
        register(NodeTemplate.builder("logix.io.log")
                .impulseIn("trigger")
                .in("message", DummyType.INSTANCE)
                .impulseOut("onDone")
                .build());

        // --- World ---
        ObjectRefType slot = new ObjectRefType("Slot");
        register(NodeTemplate.builder("logix.world.root_slot").out("slot", slot).build());
        register(NodeTemplate.builder("logix.world.local_user").out("user", new ObjectRefType("User")).build());
        register(NodeTemplate.builder("logix.world.slot_name")
                .in("slot", slot)
                .out("name", PrimitiveType.STRING)
                .build());
    }

    // ── Helpers to keep operator registration short ─────────────────

    /**
     * Registers {@code a, b -> result}. A {@code null} class means both operands are
     * {@code bool}; a {@code null} result type means the result has the operand type.
     */
    private void registerBinary(BinaryOperator op, TypeClass operands, Type result) {
        Type operand = operands == null ? BOOL : new TypeParam("T", operands);
        register(NodeTemplate.builder(op.templatePath())
                .in("a", operand)
                .in("b", operand)
                .out("result", result != null ? result : operand)
                .build());
    }

    private void registerUnary(UnaryOperator op, TypeClass operand) {
        Type t = operand == TypeClass.BOOLEAN ? BOOL : new TypeParam("T", operand);
        register(NodeTemplate.builder(op.templatePath())
                .in("value", t)
                .out("result", t)
                .build());
    }
}
