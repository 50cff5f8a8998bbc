package com.logix.laad.node;

import com.logix.laad.graph.IfSite;
import com.logix.laad.types.PrimitiveType;
import com.logix.laad.types.TypeClass;
import com.logix.laad.types.TypeParam;

/**
 * Shapes of the transient {@code sugar.*} vertices created for control-flow syntax.
 * They exist only between graph building and desugaring and are never registered.
 */
public final class SugarTemplates {
    public static final String IF = "sugar.if";
    public static final String WHILE = "sugar.while";
    public static final String RANGE_FOR = "sugar.for";
    public static final String GENERIC_FOR = "sugar.generic_for";

    private SugarTemplates() {
    }

    public static NodeTemplate conditional(int levels, boolean hasElse) {
        NodeTemplate.Builder b = NodeTemplate.builder(IF).impulseIn("trigger");
        for (int i = 0; i < levels; i++)
            b.in(IfSite.conditionPort(i), PrimitiveType.BOOL);
        for (int i = 0; i < levels; i++)
            b.optionalIn(IfSite.branchPort(i), new TypeParam("B" + i, TypeClass.ANY));
        if (hasElse)
            b.optionalIn("else", new TypeParam("E", TypeClass.ANY));
        return b.impulseOut("after")
                .out("result", new TypeParam("R", TypeClass.ANY))
                .build();
    }

    public static NodeTemplate whileLoop() {
        return NodeTemplate.builder(WHILE)
                .impulseIn("trigger").in("condition", PrimitiveType.BOOL)
                .impulseOut("after")
                .build();
    }

    public static NodeTemplate rangeFor() {
        TypeParam t = new TypeParam("T", TypeClass.INTEGRAL);
        return NodeTemplate.builder(RANGE_FOR)
                .impulseIn("trigger").in("from", t).in("to", t)
                .impulseOut("after")
                .build();
    }

    public static NodeTemplate genericFor() {
        return NodeTemplate.builder(GENERIC_FOR)
                .impulseIn("trigger").in("condition", PrimitiveType.BOOL)
                .impulseOut("after")
                .build();
    }
}
