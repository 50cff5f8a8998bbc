package com.logix.laad.types;

import com.logix.laad.dsl.Ast.LiteralKind;
import com.logix.laad.dsl.SourceSpan;
import com.logix.laad.error.TypeCheckException;
import com.logix.laad.graph.Edge;
import com.logix.laad.graph.Endpoint;
import com.logix.laad.graph.Graph;
import com.logix.laad.graph.IfSite;
import com.logix.laad.graph.PortAnnotation;
import com.logix.laad.graph.PortEquation;
import com.logix.laad.graph.SugarSite;
import com.logix.laad.graph.Vertex;
import com.logix.laad.node.TemplateRegistry;
import com.logix.laad.passes.AttributeRegistry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Solves the unification problem of one connected component.
 *
 * <p>
 * Order of work:
 * <ol>
 * <li>unify both ends of every data edge, then equations and annotations;</li>
 * <li>decide every pending conditional, against the type its consumer expects when
 * that is already known, otherwise by the least upper bound of its branches,
 * repeating until no decision changes anything;</li>
 * <li>bind the remaining defaulted variables to their fallbacks;</li>
 * <li>check integer literal ranges, casts and {@code null} flows against the now
 * concrete types.</li>
 * </ol>
 * Only the variables of this component are touched, so solvers of different
 * components may run at the same time. The graph itself is only read.
 */
final class ComponentSolver implements Callable<Void> {
    private final Graph graph;
    private final TermTable terms;
    private final AttributeRegistry attributes;
    private final List<Integer> vertices;
    private final List<Integer> edges;
    private final List<PortEquation> equations;
    private final List<PortAnnotation> annotations;

    ComponentSolver(Graph graph, TermTable terms, AttributeRegistry attributes, List<Integer> vertices,
            List<Integer> edges, List<PortEquation> equations, List<PortAnnotation> annotations) {
        this.graph = graph;
        this.terms = terms;
        this.attributes = attributes;
        this.vertices = vertices;
        this.edges = edges;
        this.equations = equations;
        this.annotations = annotations;
    }

    @Override
    public Void call() {
        unifyEdges();
        unifyEquations();
        decideConditionals();
        applyFallbacks();
        checkLiterals();
        checkCasts();
        checkNullFlows();
        return null;
    }

    private void unifyEdges() {
        for (int i : edges) {
            Type src = terms.edgeSource(i);
            if (src == null)
                continue;
            Edge e = terms.edges().get(i);
            try {
                Unifier.unify(src, terms.edgeTarget(i));
            } catch (UnificationException ex) {
                throw mismatch(ex, site(e), graph.vertex(e.dstVertex()).span(), src, terms.edgeTarget(i));
            }
        }
    }

    private void unifyEquations() {
        for (PortEquation eq : equations) {
            Type l = terms.port(eq.left());
            Type r = terms.port(eq.right());
            try {
                Unifier.unify(l, r);
            } catch (UnificationException ex) {
                throw mismatch(ex, name(eq.left()) + " = " + name(eq.right()), eq.span(), l, r);
            }
        }
        for (PortAnnotation a : annotations) {
            Type t = terms.port(a.port());
            try {
                Unifier.unify(t, a.type());
            } catch (UnificationException ex) {
                throw mismatch(ex, name(a.port()) + ": " + a.type(), a.span(), t, a.type());
            }
        }
    }

    // ── Conditionals ────────────────────────────────────────────────

    private void decideConditionals() {
        List<IfSite> pending = new ArrayList<>();
        for (int v : vertices) {
            SugarSite s = graph.sugarSite(v);
            if (s instanceof IfSite site && site.mode() == IfSite.Mode.UNDECIDED) {
                if (usedOnlyForEffect(site))
                    site.setMode(IfSite.Mode.STATEMENT);
                else
                    pending.add(site);
            }
        }

        boolean progress = true;
        while (progress && !pending.isEmpty()) {
            progress = false;
            for (int i = 0; i < pending.size(); i++) {
                IfSite site = pending.get(i);
                Type expected = Types.resolve(terms.port(site.vertex(), "result"));
                if (Types.isGround(expected))
                    pushExpected(site, expected);
                List<Type> branchTypes = branchTypes(site);
                if (branchTypes == null)
                    continue;
                Type lub = TypeLattice.lub(branchTypes);
                if (Types.isGround(expected)) {
                    for (int b = 0; b < branchTypes.size(); b++)
                        if (!TypeLattice.isSubtype(branchTypes.get(b), expected))
                            throw new TypeCheckException(name(branchPorts(site).get(b)) + ": branch of type "
                                    + branchTypes.get(b) + " does not widen to " + expected,
                                    graph.vertex(site.vertex()).span(), name(branchPorts(site).get(b)),
                                    branchTypes.get(b).toString(), expected.toString());
                    site.setMode(IfSite.Mode.EXPRESSION);
                } else if (lub == TopType.INSTANCE) {
                    site.setMode(IfSite.Mode.STATEMENT);
                } else {
                    Type result = terms.port(site.vertex(), "result");
                    try {
                        Unifier.unify(result, lub);
                    } catch (UnificationException ex) {
                        throw mismatch(ex, name(new Endpoint(site.vertex(), "result")),
                                graph.vertex(site.vertex()).span(), result, lub);
                    }
                    site.setMode(IfSite.Mode.EXPRESSION);
                }
                pending.remove(i--);
                progress = true;
            }
        }
        for (IfSite site : pending)
            site.setMode(IfSite.Mode.STATEMENT);

        for (int v : vertices)
            if (graph.sugarSite(v) instanceof IfSite site && site.mode() == IfSite.Mode.STATEMENT
                    && !graph.outgoing(new Endpoint(v, "result")).isEmpty())
                throw new TypeCheckException("Conditional is used as a value but its branches have no common type "
                        + describeBranches(site), graph.vertex(v).span());
    }

    /**
     * Binds still open branch variables to the type the consumer expects, so literal
     * branches take it instead of their defaults. A branch whose class rejects it is
     * left for the widening check.
     */
    private void pushExpected(IfSite site, Type expected) {
        for (Endpoint e : branchPorts(site)) {
            Type t = Types.deref(terms.port(e));
            if (!(t instanceof TypeVar v) || !v.constraint().admits(expected))
                continue;
            try {
                Unifier.unify(v, expected);
            } catch (UnificationException ex) {
                throw mismatch(ex, name(e), graph.vertex(site.vertex()).span(), v, expected);
            }
        }
    }

    /** Triggered by an impulse while nothing reads its result. */
    private boolean usedOnlyForEffect(IfSite site) {
        return graph.isBound(new Endpoint(site.vertex(), "trigger"))
                && graph.outgoing(new Endpoint(site.vertex(), "result")).isEmpty();
    }

    /**
     * Concrete branch types after defaulting, or {@code null} while some branch is
     * still an unresolved variable without a fallback.
     */
    private List<Type> branchTypes(IfSite site) {
        List<Type> out = new ArrayList<>();
        for (Endpoint e : branchPorts(site)) {
            Type t = terms.port(e);
            try {
                Unifier.applyFallback(t);
            } catch (UnificationException ex) {
                throw mismatch(ex, name(e), graph.vertex(site.vertex()).span(), t, t);
            }
            if (!Types.isGround(t))
                return null;
            out.add(Types.resolve(t));
        }
        return out;
    }

    private static List<Endpoint> branchPorts(IfSite site) {
        List<Endpoint> out = new ArrayList<>();
        for (int i = 0; i < site.levels(); i++)
            out.add(new Endpoint(site.vertex(), IfSite.branchPort(i)));
        out.add(new Endpoint(site.vertex(), "else"));
        return out;
    }

    private String describeBranches(IfSite site) {
        if (!site.isValueCandidate())
            return "(a branch produces no value)";
        List<String> types = new ArrayList<>();
        for (Endpoint e : branchPorts(site))
            types.add(render(terms.port(e)));
        return "(" + String.join(", ", types) + ")";
    }

    // ── Defaults and checks ─────────────────────────────────────────

    private void applyFallbacks() {
        for (int v : vertices)
            for (var p : graph.vertex(v).ports()) {
                Type t = terms.port(v, p.name());
                if (t != null)
                    fallback(t, new Endpoint(v, p.name()));
            }
        for (int i : edges) {
            Edge e = terms.edges().get(i);
            if (terms.edgeSource(i) != null) {
                fallback(terms.edgeSource(i), e.source());
                fallback(terms.edgeTarget(i), e.target());
            }
        }
    }

    private void fallback(Type t, Endpoint at) {
        t = Types.deref(t);
        try {
            if (t instanceof RefIdType r)
                Unifier.applyFallback(r.target());
            else
                Unifier.applyFallback(t);
        } catch (UnificationException ex) {
            throw mismatch(ex, name(at), graph.vertex(at.vertex()).span(), t, t);
        }
    }

    private void checkLiterals() {
        for (int v : vertices) {
            Vertex vx = graph.vertex(v);
            if (vx.literal() == null || vx.literal().kind() != LiteralKind.INT)
                continue;
            long value = ((Number) vx.literal().value()).longValue();
            Type t = Types.resolve(terms.port(v, "value"));
            if (t instanceof PrimitiveType p && !p.fits(value))
                throw new TypeCheckException("Literal " + value + " is out of range for " + p, vx.span(),
                        vx.name(), Long.toString(value), p.toString());
        }
    }

    private void checkCasts() {
        for (int v : vertices) {
            Vertex vx = graph.vertex(v);
            if (!vx.template().equals(TemplateRegistry.CAST))
                continue;
            Type from = Types.resolve(terms.port(v, "value"));
            Type to = Types.resolve(terms.port(v, "result"));
            if (Types.isGround(from) && Types.isGround(to) && !Coercions.canCast(from, to))
                throw new TypeCheckException("Cannot cast " + from + " to " + to, vx.span(), vx.name(),
                        from.toString(), to.toString());
        }
    }

    /**
     * Follows every {@code null} literal through casts and conditionals to the vertices
     * that consume it. Each consumer must accept {@code null}; other synthetic vertices
     * end the walk.
     */
    private void checkNullFlows() {
        Deque<Endpoint> work = new ArrayDeque<>();
        Set<Endpoint> seen = new HashSet<>();
        for (int v : vertices) {
            Vertex vx = graph.vertex(v);
            if (vx.literal() != null && vx.literal().kind() == LiteralKind.NULL)
                work.add(new Endpoint(v, "value"));
        }
        while (!work.isEmpty()) {
            Endpoint out = work.poll();
            if (!seen.add(out))
                continue;
            for (Edge e : graph.outgoing(out)) {
                Vertex dst = graph.vertex(e.dstVertex());
                if (attributes.acceptsNull(dst))
                    continue;
                if (forwardsValue(dst))
                    work.add(new Endpoint(dst.id(), "result"));
                else if (!dst.isSynthetic())
                    throw new TypeCheckException("null flows into " + dst.name() + "." + e.dstPort()
                            + ", which is not marked #[" + AttributeRegistry.NULLABLE + "]", dst.span(), site(e),
                            "null", render(targetType(e)));
            }
        }
    }

    /** Casts and conditional expressions hand an incoming value on to {@code result}. */
    private boolean forwardsValue(Vertex v) {
        return v.template().equals(TemplateRegistry.CAST) || graph.sugarSite(v.id()) instanceof IfSite;
    }

    private Type targetType(Edge e) {
        int i = terms.edges().indexOf(e);
        Type t = i >= 0 ? terms.edgeTarget(i) : null;
        return t != null ? t : terms.port(e.target());
    }

    // ── Diagnostics ─────────────────────────────────────────────────

    private TypeCheckException mismatch(UnificationException ex, String site, SourceSpan span, Type left,
            Type right) {
        String l = render(left);
        String r = render(right);
        return new TypeCheckException(site + ": " + ex.getMessage() + " (" + l + " vs " + r + ")", span, site, l, r);
    }

    private String site(Edge e) {
        return name(e.source()) + " -> " + name(e.target());
    }

    private String name(Endpoint e) {
        return graph.vertex(e.vertex()).name() + "." + e.port();
    }

    /** Resolved type, with an unbound variable shown by its class when it has one. */
    static String render(Type t) {
        t = Types.resolve(t);
        if (t instanceof TypeVar v && v.constraint() != TypeClass.ANY)
            return v.constraint() + " " + v;
        return String.valueOf(t);
    }
}
