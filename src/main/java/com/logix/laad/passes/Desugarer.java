package com.logix.laad.passes;

import com.logix.laad.dsl.Ast.LiteralKind;
import com.logix.laad.dsl.BinaryOperator;
import com.logix.laad.graph.Edge;
import com.logix.laad.graph.Endpoint;
import com.logix.laad.graph.Fragment;
import com.logix.laad.graph.Graph;
import com.logix.laad.graph.IfSite;
import com.logix.laad.graph.LiteralValue;
import com.logix.laad.graph.Port;
import com.logix.laad.graph.SugarSite;
import com.logix.laad.graph.SugarSite.GenericForSite;
import com.logix.laad.graph.SugarSite.RangeForSite;
import com.logix.laad.graph.SugarSite.WhileSite;
import com.logix.laad.graph.Vertex;
import com.logix.laad.node.NodeTemplate;
import com.logix.laad.node.TemplateRegistry;
import com.logix.laad.types.DummyType;
import com.logix.laad.types.Type;
import com.logix.laad.types.Types;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Replaces every {@code sugar.*} vertex by primitive flow wiring.
 *
 * <p>
 * Edges crossing the boundary of a sugar vertex are moved, not recreated, so whatever
 * flowed in and out of the construct keeps its source, target and type. New vertices
 * get concrete port types taken from the already inferred graph.
 *
 * <ul>
 * <li>conditional statement: one {@code logix.flow.if} per level, each
 * {@code onFalse} triggering the next level or the {@code else} branch;</li>
 * <li>conditional expression: nested {@code logix.operators.conditional}, with a
 * {@code logix.cast} on every branch narrower than the common type;</li>
 * <li>{@code while}: a {@code logix.flow.while} whose body re-triggers it;</li>
 * <li>range {@code for}: initializing write, {@code i < to} condition and an
 * increment write-back run after the body;</li>
 * <li>generic {@code for}: start, condition, body and step wired the same way.</li>
 * </ul>
 * A body with an impulse input but no impulse output runs under a
 * {@code logix.flow.sequence} so the loop can continue once it has been started.
 */
@Log4j2
public final class Desugarer {
    private final TemplateRegistry registry;
    private Graph graph;

    public Desugarer(TemplateRegistry registry) {
        this.registry = registry;
    }

    public void desugar(Graph target) {
        this.graph = target;
        int before = graph.vertexCount();
        List<SugarSite> order = outerFirst(graph.sugarSites());
        for (SugarSite site : order) {
            if (site instanceof IfSite s)
                lowerIf(s);
            else if (site instanceof WhileSite s)
                lowerWhile(s);
            else if (site instanceof RangeForSite s)
                lowerRangeFor(s);
            else if (site instanceof GenericForSite s)
                lowerGenericFor(s);
            else
                throw new IllegalStateException("Unknown sugar site: " + site);
            graph.removeVertex(site.vertex());
        }
        graph.pruneSideTables();
        log.debug("Desugared {} sites in '{}': {} -> {} vertices", order.size(), graph.name(), before,
                graph.vertexCount());
    }

    /**
     * A site whose fragments point at another sugar vertex must be lowered while that
     * vertex still exists, so sites referenced by others come later.
     */
    private static List<SugarSite> outerFirst(List<SugarSite> sites) {
        List<SugarSite> remaining = new ArrayList<>(sites);
        List<SugarSite> out = new ArrayList<>(sites.size());
        while (!remaining.isEmpty()) {
            SugarSite next = null;
            for (SugarSite candidate : remaining) {
                boolean referenced = false;
                for (SugarSite other : remaining)
                    if (other != candidate && references(other, candidate.vertex()))
                        referenced = true;
                if (!referenced) {
                    next = candidate;
                    break;
                }
            }
            if (next == null)
                throw new IllegalStateException("Sugar sites reference each other cyclically");
            remaining.remove(next);
            out.add(next);
        }
        return out;
    }

    private static boolean references(SugarSite site, int vertex) {
        List<Fragment> fragments = new ArrayList<>();
        if (site instanceof IfSite s) {
            fragments.addAll(s.branches());
            fragments.add(s.elseBranch());
        } else if (site instanceof WhileSite s) {
            fragments.add(s.body());
        } else if (site instanceof RangeForSite s) {
            fragments.add(s.body());
        } else if (site instanceof GenericForSite s) {
            fragments.add(s.start());
            fragments.add(s.step());
            fragments.add(s.body());
        }
        for (Fragment f : fragments)
            if (f != null && (touches(f.entry(), vertex) || touches(f.impulseOut(), vertex)))
                return true;
        return false;
    }

    private static boolean touches(Endpoint e, int vertex) {
        return e != null && e.vertex() == vertex;
    }

    // ── Conditionals ────────────────────────────────────────────────

    private void lowerIf(IfSite site) {
        switch (site.mode()) {
            case STATEMENT -> lowerIfStatement(site);
            case EXPRESSION -> lowerIfExpression(site);
            default -> throw new IllegalStateException("Conditional was never classified: " + site.vertex());
        }
    }

    private void lowerIfStatement(IfSite site) {
        Vertex sugar = graph.vertex(site.vertex());
        List<Vertex> levels = new ArrayList<>();
        for (int i = 0; i < site.levels(); i++)
            levels.add(add(TemplateRegistry.FLOW_IF, "if", sugar, null));

        Endpoint firstTrigger = in(levels.get(0), "trigger");
        if (graph.outgoing(out(sugar, "after")).isEmpty()) {
            graph.moveIncoming(in(sugar, "trigger"), firstTrigger);
        } else {
            Vertex seq = add(TemplateRegistry.FLOW_SEQUENCE, "seq", sugar, null);
            graph.moveIncoming(in(sugar, "trigger"), in(seq, "trigger"));
            connect(out(seq, "first"), firstTrigger);
            graph.moveOutgoing(out(sugar, "after"), out(seq, "then"));
        }

        for (int i = 0; i < site.levels(); i++) {
            Vertex level = levels.get(i);
            graph.moveIncoming(in(sugar, IfSite.conditionPort(i)), in(level, "condition"));
            runBranch(out(level, "onTrue"), site.branches().get(i));
            if (i + 1 < site.levels())
                connect(out(level, "onFalse"), in(levels.get(i + 1), "trigger"));
            else if (site.elseBranch() != null)
                runBranch(out(level, "onFalse"), site.elseBranch());
        }
    }

    /** A branch without an impulse input has nothing to run and stays unwired. */
    private void runBranch(Endpoint impulse, Fragment branch) {
        if (branch.entry() != null)
            connect(impulse, branch.entry());
        else
            log.debug("Conditional branch at vertex {} has no impulse input", branch.vertex());
    }

    private void lowerIfExpression(IfSite site) {
        Vertex sugar = graph.vertex(site.vertex());
        Type common = sugar.requirePort("result").type();

        Endpoint falseValue = branchValue(sugar, "else", common);
        Vertex outer = null;
        for (int i = site.levels() - 1; i >= 0; i--) {
            outer = add(TemplateRegistry.CONDITIONAL, "cond", sugar, common);
            graph.moveIncoming(in(sugar, IfSite.conditionPort(i)), in(outer, "condition"));
            connect(branchValue(sugar, IfSite.branchPort(i), common), in(outer, "onTrue"));
            connect(falseValue, in(outer, "onFalse"));
            falseValue = out(outer, "result");
        }
        graph.moveOutgoing(out(sugar, "result"), falseValue);

        // an expression has no effect of its own: impulses just pass through
        for (Edge incoming : graph.incoming(in(sugar, "trigger")))
            for (Edge outgoing : graph.outgoing(out(sugar, "after")))
                connect(incoming.source(), outgoing.target());

        if (!sugar.isSynthetic())
            outer.adoptName(sugar.name());
        sugar.attributes().forEach(outer::addAttribute);
    }

    /** Source of a branch value, routed through a cast when narrower than {@code common}. */
    private Endpoint branchValue(Vertex sugar, String port, Type common) {
        List<Edge> edges = graph.incoming(in(sugar, port));
        if (edges.size() != 1)
            throw new IllegalStateException("Branch port " + port + " of " + sugar + " has " + edges.size()
                    + " edges");
        Edge edge = edges.get(0);
        Type branchType = sugar.requirePort(port).type();
        if (common.equals(branchType))
            return edge.source();
        Vertex cast = add(TemplateRegistry.CAST, "cast", sugar, null);
        cast.requirePort("value").setType(branchType);
        cast.requirePort("result").setDeclaredType(common);
        cast.requirePort("result").setType(common);
        connect(edge.source(), in(cast, "value"));
        return out(cast, "result");
    }

    // ── Loops ───────────────────────────────────────────────────────

    private void lowerWhile(WhileSite site) {
        Vertex sugar = graph.vertex(site.vertex());
        Vertex loop = add(TemplateRegistry.FLOW_WHILE, "while", sugar, null);
        graph.moveIncoming(in(sugar, "trigger"), in(loop, "trigger"));
        graph.moveIncoming(in(sugar, "condition"), in(loop, "condition"));
        connect(runThrough(out(loop, "loopIteration"), site.body(), sugar), in(loop, "trigger"));
        graph.moveOutgoing(out(sugar, "after"), out(loop, "loopEnd"));
    }

    private void lowerRangeFor(RangeForSite site) {
        Vertex sugar = graph.vertex(site.vertex());
        Vertex counter = graph.vertex(site.variable());
        Type t = counter.requirePort("value").type();

        Vertex loop = add(TemplateRegistry.FLOW_WHILE, "while", sugar, null);

        Vertex init = add(TemplateRegistry.WRITE, "init", sugar, t);
        graph.moveIncoming(in(sugar, "trigger"), in(init, "trigger"));
        graph.moveIncoming(in(sugar, "from"), in(init, "value"));
        connect(out(counter, "ref"), in(init, "target"));
        connect(out(init, "onDone"), in(loop, "trigger"));

        Vertex less = add(BinaryOperator.LT.templatePath(), "less", sugar, t);
        connect(out(counter, "value"), in(less, "a"));
        graph.moveIncoming(in(sugar, "to"), in(less, "b"));
        connect(out(less, "result"), in(loop, "condition"));

        Vertex one = add(TemplateRegistry.LITERAL, "one", sugar, t);
        one.setLiteral(new LiteralValue(LiteralKind.INT, 1L));
        Vertex add = add(BinaryOperator.ADD.templatePath(), "inc", sugar, t);
        connect(out(counter, "value"), in(add, "a"));
        connect(out(one, "value"), in(add, "b"));
        Vertex step = add(TemplateRegistry.WRITE, "step", sugar, t);
        connect(out(add, "result"), in(step, "value"));
        connect(out(counter, "ref"), in(step, "target"));
        connect(out(step, "onDone"), in(loop, "trigger"));

        connect(runThrough(out(loop, "loopIteration"), site.body(), sugar), in(step, "trigger"));
        graph.moveOutgoing(out(sugar, "after"), out(loop, "loopEnd"));
    }

    private void lowerGenericFor(GenericForSite site) {
        Vertex sugar = graph.vertex(site.vertex());
        Vertex loop = add(TemplateRegistry.FLOW_WHILE, "while", sugar, null);

        Fragment start = site.start();
        if (start.entry() == null) {
            graph.moveIncoming(in(sugar, "trigger"), in(loop, "trigger"));
        } else if (start.impulseOut() != null) {
            graph.moveIncoming(in(sugar, "trigger"), start.entry());
            connect(start.impulseOut(), in(loop, "trigger"));
        } else {
            Vertex seq = add(TemplateRegistry.FLOW_SEQUENCE, "seq", sugar, null);
            graph.moveIncoming(in(sugar, "trigger"), in(seq, "trigger"));
            connect(out(seq, "first"), start.entry());
            connect(out(seq, "then"), in(loop, "trigger"));
        }
        graph.moveIncoming(in(sugar, "condition"), in(loop, "condition"));

        Endpoint afterBody = runThrough(out(loop, "loopIteration"), site.body(), sugar);
        connect(runThrough(afterBody, site.step(), sugar), in(loop, "trigger"));
        graph.moveOutgoing(out(sugar, "after"), out(loop, "loopEnd"));
    }

    /**
     * Runs {@code stage} when {@code source} fires and returns the impulse that fires
     * once it is done. A stage without an entry is skipped.
     */
    private Endpoint runThrough(Endpoint source, Fragment stage, Vertex sugar) {
        if (stage == null || stage.entry() == null)
            return source;
        if (stage.impulseOut() != null) {
            connect(source, stage.entry());
            return stage.impulseOut();
        }
        Vertex seq = add(TemplateRegistry.FLOW_SEQUENCE, "seq", sugar, null);
        connect(source, in(seq, "trigger"));
        connect(out(seq, "first"), stage.entry());
        return out(seq, "then");
    }

    // ── Plumbing ────────────────────────────────────────────────────

    /** Adds a synthetic vertex whose template parameter {@code T}, if any, is bound to {@code t}. */
    private Vertex add(String template, String kind, Vertex origin, Type t) {
        NodeTemplate nt = registry.require(template);
        Vertex v = graph.addVertex("__" + kind + graph.capacity(), template, nt.instantiate(), origin.span(), true);
        Map<String, Type> bindings = t == null ? Map.of() : Map.of("T", t);
        for (Port p : v.ports()) {
            if (p.isImpulse())
                continue;
            if (p.isDummy())
                p.setType(DummyType.INSTANCE);
            else
                p.setType(Types.substitute(p.declaredType(), bindings));
        }
        return v;
    }

    private void connect(Endpoint from, Endpoint to) {
        Edge e = graph.connect(from, to);
        Port src = graph.port(from);
        if (!src.isImpulse())
            e.setType(src.type());
    }

    private static Endpoint in(Vertex v, String port) {
        if (!v.requirePort(port).isInput())
            throw new IllegalArgumentException(port + " is not an input of " + v);
        return new Endpoint(v.id(), port);
    }

    private static Endpoint out(Vertex v, String port) {
        if (v.requirePort(port).isInput())
            throw new IllegalArgumentException(port + " is not an output of " + v);
        return new Endpoint(v.id(), port);
    }
}
