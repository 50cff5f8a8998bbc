package com.logix.laad.dsl;

import com.logix.laad.dsl.Ast.*;
import com.logix.laad.error.SyntaxException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class ParserTest {

    private static Statement single(String source) {
        List<Statement> statements = Parser.parse(source).statements();
        assertEquals(1, statements.size());
        return statements.get(0);
    }

    private static Expression rhs(String source) {
        return (Expression) ((NodeDef) single(source)).binding();
    }

    @Test
    public void testHelloWorld() {
        ConnectionStatement s = (ConnectionStatement) single("\"Hello, World!\" -> display");
        Connection c = (Connection) s.expression();
        assertEquals(2, c.chain().size());
        Literal lit = (Literal) c.chain().get(0);
        assertEquals(LiteralKind.STRING, lit.kind());
        assertEquals("Hello, World!", lit.value());
        assertEquals(List.of("display"), ((NodeRef) c.chain().get(1)).path());
    }

    @Test
    public void testChainKeepsOrder() {
        Connection c = (Connection) ((ConnectionStatement) single("a -> b.x -> c")).expression();
        assertEquals(3, c.chain().size());
        assertEquals("b.x", ((NodeRef) c.chain().get(1)).dotted());
    }

    @Test
    public void testChainContinuesOnNextLine() {
        Connection c = (Connection) ((ConnectionStatement) single("a\n  -> b\n  -> c")).expression();
        assertEquals(3, c.chain().size());
    }

    @Test
    public void testBinaryOperatorsAreLeftAssociative() {
        BinaryOp outer = (BinaryOp) rhs("x = a - b - c");
        assertEquals(BinaryOperator.SUB, outer.operator());
        assertTrue(outer.left() instanceof BinaryOp);
        assertEquals("c", ((NodeRef) outer.right()).dotted());
    }

    @Test
    public void testPrecedence() {
        BinaryOp add = (BinaryOp) rhs("x = 1 + 2 * 3");
        assertEquals(BinaryOperator.ADD, add.operator());
        assertEquals(BinaryOperator.MUL, ((BinaryOp) add.right()).operator());

        BinaryOp or = (BinaryOp) rhs("y = a < b || c == d && e");
        assertEquals(BinaryOperator.OR, or.operator());
        assertEquals(BinaryOperator.AND, ((BinaryOp) or.right()).operator());
    }

    @Test
    public void testCastsChainToTheLeft() {
        Cast outer = (Cast) rhs("x = 1 as short as int");
        assertEquals("int", outer.target().name());
        Cast inner = (Cast) outer.value();
        assertEquals("short", inner.target().name());
    }

    @Test
    public void testNegativeLiteralIsFolded() {
        Literal lit = (Literal) rhs("x = -5");
        assertEquals(-5L, lit.value());
        assertTrue(rhs("y = -z") instanceof UnaryOp);
    }

    @Test
    public void testNodePathAndAnnotation() {
        NodeDef def = (NodeDef) single("d: int = logix.data.variable");
        assertEquals("d", def.name());
        assertEquals("int", def.annotation().name());
        assertEquals(List.of("logix", "data", "variable"), ((NodePath) def.binding()).segments());
    }

    @Test
    public void testRefTypeWithNestedArgument() {
        NodeDef def = (NodeDef) single("c = class { in target: ref<ref<int>>, out done: impulse }");
        ClassDef cd = (ClassDef) def.binding();
        assertEquals(2, cd.ports().size());
        TypeName t = cd.ports().get(0).type();
        assertEquals("ref", t.name());
        assertEquals("ref", t.argument().name());
        assertEquals("int", t.argument().argument().name());
        assertFalse(cd.ports().get(1).input());
    }

    @Test
    public void testAttributes() {
        NodeDef def = (NodeDef) single("#[no_remove]\n#[meta(label = \"x\", weight = -2)]\nd = logix.io.display");
        assertEquals(2, def.attributes().size());
        assertEquals("no_remove", def.attributes().get(0).key());
        assertEquals("x", def.attributes().get(1).args().get("label"));
        assertEquals(-2L, def.attributes().get(1).args().get("weight"));
    }

    @Test
    public void testImportWithAlias() {
        Import imp = (Import) single("import logix.io.display as show");
        assertEquals("show", imp.boundName());
        assertEquals("logix.io.display", imp.dotted());
    }

    @Test
    public void testSingleLineConditionalNeedsNoTerminator() {
        IfExpr ife = (IfExpr) rhs("x = if c then 1 elseif d then 2 else 3");
        assertEquals(2, ife.conditions().size());
        assertNotNull(ife.elseBranch());
        assertFalse(ife.terminated());
    }

    @Test(expected = SyntaxException.class)
    public void testMultiLineConditionalWithoutEndFails() {
        Parser.parse("x = if c then 1\nelse 2\nx -> display");
    }

    @Test
    public void testMultiLineConditionalWithEndParses() {
        Program p = Parser.parse("x = if c then 1\nelse 2\nend\nx -> display");
        assertEquals(2, p.statements().size());
        assertTrue(((IfExpr) ((NodeDef) p.statements().get(0)).binding()).terminated());
    }

    @Test
    public void testRangeFor() {
        ConnectionStatement s = (ConnectionStatement) single("b -> for (i in 0..5) {\n  i -> log.message\n}");
        RangeFor f = (RangeFor) ((Connection) s.expression()).chain().get(1);
        assertEquals("i", f.variable());
        assertEquals(0L, ((Literal) f.from()).value());
        assertEquals(5L, ((Literal) f.to()).value());
        assertEquals(1, f.body().statements().size());
    }

    @Test
    public void testGenericForAndWhile() {
        Program p = Parser.parse("b -> for (init, i < 3, step) { tick -> work }\nb -> while (go) { tick -> work }");
        Connection first = (Connection) ((ConnectionStatement) p.statements().get(0)).expression();
        assertTrue(first.chain().get(1) instanceof GenericFor);
        Connection second = (Connection) ((ConnectionStatement) p.statements().get(1)).expression();
        assertTrue(second.chain().get(1) instanceof WhileLoop);
    }

    @Test
    public void testCommentStatement() {
        Program p = Parser.parse("// header\na -> b // trailing\n");
        assertTrue(p.statements().get(0) instanceof Comment);
        assertTrue(p.statements().get(1) instanceof ConnectionStatement);
        assertTrue(p.statements().get(2) instanceof Comment);
    }

    @Test(expected = SyntaxException.class)
    public void testBareExpressionRejected() {
        Parser.parse("a + b");
    }

    @Test(expected = SyntaxException.class)
    public void testMatchIsReserved() {
        Parser.parse("x = match");
    }

    @Test(expected = SyntaxException.class)
    public void testImportInsideBlockRejected() {
        Parser.parse("b -> while (go) {\n import logix.io.display\n}");
    }

    @Test(expected = SyntaxException.class)
    public void testEmptyClassRejected() {
        Parser.parse("c = class { }");
    }
}
