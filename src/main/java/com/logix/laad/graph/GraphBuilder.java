package com.logix.laad.graph;

import com.logix.laad.dsl.Ast.*;
import com.logix.laad.dsl.SourceSpan;
import com.logix.laad.error.PortBindingException;
import com.logix.laad.error.ScopeException;
import com.logix.laad.error.Stage;
import com.logix.laad.error.TypeCheckException;
import com.logix.laad.node.NodeTemplate;
import com.logix.laad.node.SugarTemplates;
import com.logix.laad.node.TemplateRegistry;
import com.logix.laad.types.DummyType;
import com.logix.laad.types.Type;
import com.logix.laad.types.Types;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers a parsed {@link Program} into the initial {@link Graph}.
 *
 * <p>
 * Node definitions bound to a template path or an inline class create one vertex
 * each, unless the path starts with a name in scope: {@code x = s.slot} makes
 * {@code x} stand for that port. Expressions expand into literal, operator and cast
 * vertices. Control-flow syntax becomes a {@code sugar.*} vertex plus a
 * {@link SugarSite} entry that the desugaring pass consumes.
 *
 * <p>
 * A chain {@code a -> b -> c} connects each neighbouring pair. The port used on each
 * side is picked in this order:
 * <ol>
 * <li>a port named explicitly ({@code node.port});</li>
 * <li>an impulse edge when the source exposes an impulse output and the target an
 * impulse input;</li>
 * <li>a data edge from the source's value output to the first unbound data input of
 * the target, falling back to a dummy input.</li>
 * </ol>
 * Failing all three is a {@link PortBindingException}.
 *
 * <p>
 * Inside a {@code { }} block every statement whose impulse input is still free at the
 * end of the block is chained to the previous one in source order. A statement that
 * merely mentions an earlier one ({@code x -> l.message}) shares its entry and is
 * chained only once.
 */
public final class GraphBuilder {
    private static final Logger log = LogManager.getLogger(GraphBuilder.class);

    private final TemplateRegistry registry;
    private final Map<String, NodeTemplate> localClasses = new HashMap<>();
    private final Map<String, String> imports = new HashMap<>();
    private Graph graph;
    private Scope scope;
    private int synthetic;

    public GraphBuilder(TemplateRegistry registry) {
        this.registry = registry;
    }

    public Graph build(Program program, String unitName) {
        graph = new Graph(unitName);
        scope = new Scope(null);
        localClasses.clear();
        imports.clear();
        synthetic = 0;
        for (Statement s : program.statements())
            buildStatement(s);
        log.debug("Built graph '{}': {} vertices, {} edges, {} sugar sites", unitName, graph.vertexCount(),
                graph.edges().size(), graph.sugarSites().size());
        return graph;
    }

    // ── Statements ──────────────────────────────────────────────────

    /** Returns the fragment a statement produced, or {@code null} for comments and imports. */
    private Fragment buildStatement(Statement s) {
        if (s instanceof Comment)
            return null;
        if (s instanceof Import imp) {
            declareImport(imp);
            return null;
        }
        if (s instanceof NodeDef def)
            return buildNodeDef(def);
        if (s instanceof ConnectionStatement cs)
            return buildExpression(cs.expression());
        throw new IllegalArgumentException("Unknown statement: " + s);
    }

    private void declareImport(Import imp) {
        String path = imp.dotted();
        if (findTemplate(path) == null)
            throw new ScopeException("Unknown node template '" + path + "'", imp.span());
        String alias = imp.boundName();
        if (imports.containsKey(alias) || scope.lookup(alias) != null)
            throw new ScopeException("'" + alias + "' is already defined", imp.span());
        imports.put(alias, path);
    }

    private Fragment buildNodeDef(NodeDef def) {
        if (scope.isLocal(def.name()) || imports.containsKey(def.name()))
            throw new ScopeException("Duplicate definition of '" + def.name() + "'", def.span());

        Fragment fragment;
        Binding binding = def.binding();
        if (binding instanceof NodePath np && scope.lookup(np.segments().get(0)) != null) {
            fragment = asFragment(resolveRef(new NodeRef(np.segments(), np.span())));
        } else if (binding instanceof NodePath np) {
            NodeTemplate t = findTemplate(np.dotted());
            if (t == null)
                throw new ScopeException("Unknown node template '" + np.dotted() + "'", np.span());
            fragment = fragmentOf(instantiate(t, def.name(), def.span(), false));
        } else if (binding instanceof ClassDef cd) {
            fragment = fragmentOf(instantiate(declareClass(def.name(), cd), def.name(), def.span(), false));
        } else {
            fragment = buildExpression((Expression) binding);
            Vertex v = graph.vertex(fragment.vertex());
            if (v.isSynthetic())
                v.adoptName(def.name());
        }

        Vertex target = graph.vertex(fragment.vertex());
        for (AttributeDecl a : def.attributes())
            target.addAttribute(new Attribute(a.key(), a.args()));

        if (def.annotation() != null) {
            Type t = resolveType(def.annotation(), false);
            if (fragment.valueOut() == null)
                throw new TypeCheckException(Stage.BUILD, "'" + def.name() + "' has no value to annotate",
                        def.annotation().span());
            graph.addAnnotation(new PortAnnotation(fragment.valueOut(), t, def.annotation().span()));
        }

        scope.define(def.name(), fragment);
        return fragment;
    }

    private NodeTemplate declareClass(String defName, ClassDef cd) {
        String path = cd.className() != null ? cd.className() : defName;
        if (cd.className() != null && (localClasses.containsKey(path) || registry.contains(path)))
            throw new ScopeException("Class '" + path + "' is already defined", cd.span());
        NodeTemplate.Builder b = NodeTemplate.builder(path);
        for (PortDecl p : cd.ports()) {
            boolean impulse = p.type().name().equals("impulse") && p.type().argument() == null;
            try {
                if (impulse && p.input())
                    b.impulseIn(p.name());
                else if (impulse)
                    b.impulseOut(p.name());
                else if (p.input())
                    b.in(p.name(), resolveType(p.type(), true));
                else
                    b.out(p.name(), resolveType(p.type(), true));
            } catch (IllegalArgumentException e) {
                throw new ScopeException("Duplicate port '" + p.name() + "'", p.span());
            }
        }
        NodeTemplate t = b.build();
        if (cd.className() != null)
            localClasses.put(path, t);
        return t;
    }

    private Fragment buildBlock(Block block, Scope inner) {
        Scope outer = scope;
        scope = inner;
        try {
            List<Fragment> fragments = new ArrayList<>();
            List<SourceSpan> spans = new ArrayList<>();
            for (Statement s : block.statements()) {
                Fragment f = buildStatement(s);
                if (f != null) {
                    fragments.add(f);
                    spans.add(s.span());
                }
            }

            Fragment first = null;
            Fragment previous = null;
            SourceSpan previousSpan = null;
            Set<Endpoint> chained = new HashSet<>();
            for (int i = 0; i < fragments.size(); i++) {
                Fragment f = fragments.get(i);
                if (f.entry() == null || graph.isBound(f.entry()) || !chained.add(f.entry()))
                    continue;
                if (previous == null) {
                    first = f;
                } else {
                    if (previous.impulseOut() == null)
                        throw new PortBindingException(Stage.BUILD,
                                "Statement has no impulse output for the statement after it to run on",
                                previousSpan);
                    graph.connect(previous.impulseOut(), f.entry());
                }
                previous = f;
                previousSpan = spans.get(i);
            }
            if (first == null)
                return new Fragment(-1, null, null, null);
            return new Fragment(first.vertex(), first.entry(), previous.impulseOut(), null);
        } finally {
            scope = outer;
        }
    }

    // ── Expressions ─────────────────────────────────────────────────

    private Fragment buildExpression(Expression e) {
        if (e instanceof Literal lit)
            return buildLiteral(lit);
        if (e instanceof NodeRef ref)
            return asFragment(resolveRef(ref));
        if (e instanceof Cast c)
            return buildCast(c);
        if (e instanceof BinaryOp op)
            return buildBinary(op);
        if (e instanceof UnaryOp op)
            return buildUnary(op);
        if (e instanceof Connection c)
            return buildConnection(c);
        if (e instanceof IfExpr ife)
            return buildIf(ife);
        if (e instanceof WhileLoop w)
            return buildWhile(w);
        if (e instanceof RangeFor f)
            return buildRangeFor(f);
        if (e instanceof GenericFor f)
            return buildGenericFor(f);
        throw new IllegalArgumentException("Unknown expression: " + e);
    }

    private Fragment buildLiteral(Literal lit) {
        Vertex v = instantiate(registry.require(TemplateRegistry.LITERAL), nextName("lit"), lit.span(), true);
        v.setLiteral(new LiteralValue(lit.kind(), lit.value()));
        return fragmentOf(v);
    }

    private Fragment buildCast(Cast c) {
        Endpoint value = valueOf(c.value());
        Vertex v = instantiate(registry.require(TemplateRegistry.CAST), nextName("cast"), c.span(), true);
        v.requirePort("result").setDeclaredType(resolveType(c.target(), false));
        graph.connect(value, new Endpoint(v.id(), "value"));
        return fragmentOf(v);
    }

    private Fragment buildBinary(BinaryOp op) {
        Endpoint left = valueOf(op.left());
        Endpoint right = valueOf(op.right());
        Vertex v = instantiate(registry.require(op.operator().templatePath()),
                nextName(op.operator().name().toLowerCase()), op.span(), true);
        graph.connect(left, new Endpoint(v.id(), "a"));
        graph.connect(right, new Endpoint(v.id(), "b"));
        return fragmentOf(v);
    }

    private Fragment buildUnary(UnaryOp op) {
        Endpoint operand = valueOf(op.operand());
        Vertex v = instantiate(registry.require(op.operator().templatePath()),
                nextName(op.operator().name().toLowerCase()), op.span(), true);
        graph.connect(operand, new Endpoint(v.id(), "value"));
        return fragmentOf(v);
    }

    private Fragment buildConnection(Connection c) {
        List<Element> elements = new ArrayList<>();
        for (Expression e : c.chain())
            elements.add(e instanceof NodeRef ref ? resolveRef(ref) : new Element(buildExpression(e), null, e.span()));
        for (int i = 0; i + 1 < elements.size(); i++)
            connect(elements.get(i), elements.get(i + 1));

        Fragment head = asFragment(elements.get(0));
        Fragment tail = asFragment(elements.get(elements.size() - 1));
        return new Fragment(head.vertex(), head.entry(), tail.impulseOut(), tail.valueOut());
    }

    private Fragment buildIf(IfExpr ife) {
        int levels = ife.conditions().size();
        List<Endpoint> conditions = new ArrayList<>();
        for (Expression c : ife.conditions())
            conditions.add(valueOf(c));
        List<Fragment> branches = new ArrayList<>();
        for (Expression b : ife.branches())
            branches.add(buildExpression(b));
        Fragment elseBranch = ife.elseBranch() != null ? buildExpression(ife.elseBranch()) : null;

        boolean valueCandidate = elseBranch != null && elseBranch.valueOut() != null;
        for (Fragment b : branches)
            valueCandidate &= b.valueOut() != null;

        Vertex v = instantiate(SugarTemplates.conditional(levels, elseBranch != null), nextName("if"), ife.span(),
                true);
        for (int i = 0; i < levels; i++)
            graph.connect(conditions.get(i), new Endpoint(v.id(), IfSite.conditionPort(i)));
        if (valueCandidate) {
            for (int i = 0; i < levels; i++)
                graph.connect(branches.get(i).valueOut(), new Endpoint(v.id(), IfSite.branchPort(i)));
            graph.connect(elseBranch.valueOut(), new Endpoint(v.id(), "else"));
        }
        graph.addSugarSite(new IfSite(v.id(), branches, elseBranch, valueCandidate));
        return new Fragment(v.id(), new Endpoint(v.id(), "trigger"), new Endpoint(v.id(), "after"),
                valueCandidate ? new Endpoint(v.id(), "result") : null);
    }

    private Fragment buildWhile(WhileLoop w) {
        Endpoint condition = valueOf(w.condition());
        Vertex v = instantiate(SugarTemplates.whileLoop(), nextName("while"), w.span(), true);
        graph.connect(condition, new Endpoint(v.id(), "condition"));
        Fragment body = buildBlock(w.body(), new Scope(scope));
        graph.addSugarSite(new SugarSite.WhileSite(v.id(), body));
        return loopFragment(v);
    }

    private Fragment buildRangeFor(RangeFor f) {
        Endpoint from = valueOf(f.from());
        Endpoint to = valueOf(f.to());
        Vertex v = instantiate(SugarTemplates.rangeFor(), nextName("for"), f.span(), true);
        graph.connect(from, new Endpoint(v.id(), "from"));
        graph.connect(to, new Endpoint(v.id(), "to"));

        Vertex counter = instantiate(registry.require(TemplateRegistry.VARIABLE), f.variable(), f.span(), false);
        graph.addEquation(new PortEquation(new Endpoint(v.id(), "from"), new Endpoint(counter.id(), "value"),
                f.span()));

        Scope bodyScope = new Scope(scope);
        bodyScope.define(f.variable(), fragmentOf(counter));
        Fragment body = buildBlock(f.body(), bodyScope);
        graph.addSugarSite(new SugarSite.RangeForSite(v.id(), counter.id(), body));
        return loopFragment(v);
    }

    private Fragment buildGenericFor(GenericFor f) {
        Fragment start = buildExpression(f.start());
        Endpoint condition = valueOf(f.condition());
        Fragment step = buildExpression(f.step());
        Vertex v = instantiate(SugarTemplates.genericFor(), nextName("gfor"), f.span(), true);
        graph.connect(condition, new Endpoint(v.id(), "condition"));
        Fragment body = buildBlock(f.body(), new Scope(scope));
        graph.addSugarSite(new SugarSite.GenericForSite(v.id(), start, step, body));
        return loopFragment(v);
    }

    private static Fragment loopFragment(Vertex v) {
        return new Fragment(v.id(), new Endpoint(v.id(), "trigger"), new Endpoint(v.id(), "after"), null);
    }

    /** Builds {@code e} and returns its value output, which must exist. */
    private Endpoint valueOf(Expression e) {
        Fragment f = buildExpression(e);
        if (f.valueOut() == null)
            throw new PortBindingException(Stage.BUILD, "Expression produces no value", e.span());
        return f.valueOut();
    }

    // ── Names ───────────────────────────────────────────────────────

    /** A chain element: a fragment, plus the port when one was named explicitly. */
    private record Element(Fragment fragment, Endpoint port, SourceSpan span) {
    }

    private Element resolveRef(NodeRef ref) {
        List<String> path = ref.path();
        String head = path.get(0);
        Fragment local = scope.lookup(head);

        if (path.size() == 1) {
            if (local != null)
                return new Element(local, null, ref.span());
            String imported = imports.get(head);
            if (imported != null)
                return new Element(fragmentOf(instantiate(findTemplate(imported), head, ref.span(), false)), null,
                        ref.span());
            throw new ScopeException("Undeclared identifier '" + head + "'", ref.span());
        }

        if (local != null) {
            if (path.size() != 2 || local.vertex() < 0)
                throw new ScopeException("Cannot resolve '" + ref.dotted() + "'", ref.span());
            Vertex v = graph.vertex(local.vertex());
            if (v.port(path.get(1)) == null)
                throw new ScopeException("'" + head + "' has no port '" + path.get(1) + "'", ref.span());
            return new Element(local, new Endpoint(v.id(), path.get(1)), ref.span());
        }

        NodeTemplate t = findTemplate(ref.dotted());
        if (t == null)
            throw new ScopeException("Unknown node template '" + ref.dotted() + "'", ref.span());
        return new Element(fragmentOf(instantiate(t, path.get(path.size() - 1), ref.span(), false)), null,
                ref.span());
    }

    private NodeTemplate findTemplate(String path) {
        NodeTemplate local = localClasses.get(path);
        return local != null ? local : registry.lookup(path);
    }

    private Type resolveType(TypeName name, boolean portDeclaration) {
        Type argument = null;
        if (name.argument() != null)
            argument = resolveType(name.argument(), false);
        Type t = Types.fromName(name.name(), argument);
        if (t == null)
            throw new TypeCheckException(Stage.BUILD, "Unknown type '" + name + "'", name.span());
        if (t == DummyType.INSTANCE && !portDeclaration)
            throw new TypeCheckException(Stage.BUILD, "'dummy' is only allowed on port declarations", name.span());
        return t;
    }

    private String nextName(String kind) {
        return "__" + kind + synthetic++;
    }

    // ── Vertices and connections ────────────────────────────────────

    private Vertex instantiate(NodeTemplate t, String name, SourceSpan span, boolean isSynthetic) {
        return graph.addVertex(name, t.path(), t.instantiate(), span, isSynthetic);
    }

    private static Fragment fragmentOf(Vertex v) {
        Endpoint entry = null;
        Endpoint impulseOut = null;
        Endpoint valueOut = null;
        for (Port p : v.ports()) {
            Endpoint e = new Endpoint(v.id(), p.name());
            if (p.isInput() && p.isImpulse() && entry == null)
                entry = e;
            else if (!p.isInput() && p.isImpulse() && impulseOut == null)
                impulseOut = e;
            else if (!p.isInput() && !p.isImpulse() && valueOut == null)
                valueOut = e;
        }
        return new Fragment(v.id(), entry, impulseOut, valueOut);
    }

    private Fragment asFragment(Element el) {
        if (el.port() == null)
            return el.fragment();
        Port p = graph.port(el.port());
        int v = el.port().vertex();
        if (p.isInput())
            return p.isImpulse() ? new Fragment(v, el.port(), null, null) : new Fragment(v, null, null, null);
        return p.isImpulse() ? new Fragment(v, null, el.port(), null) : new Fragment(v, null, null, el.port());
    }

    private void connect(Element src, Element dst) {
        Endpoint from;
        Endpoint to;
        if (src.port() != null && graph.port(src.port()).isInput())
            throw new PortBindingException(Stage.BUILD, "Port '" + src.port().port() + "' is an input", src.span());
        if (dst.port() != null && !graph.port(dst.port()).isInput())
            throw new PortBindingException(Stage.BUILD, "Port '" + dst.port().port() + "' is an output", dst.span());

        if (dst.port() != null) {
            to = dst.port();
            from = src.port() != null ? src.port() : sourceFor(src.fragment(), graph.port(to).isImpulse());
        } else if (src.port() != null) {
            from = src.port();
            to = graph.port(from).isImpulse() ? dst.fragment().entry() : freeDataInput(dst.fragment().vertex());
        } else if (src.fragment().impulseOut() != null && dst.fragment().entry() != null) {
            from = src.fragment().impulseOut();
            to = dst.fragment().entry();
        } else {
            from = src.fragment().valueOut();
            to = from == null ? null : freeDataInput(dst.fragment().vertex());
        }

        if (from == null || to == null)
            throw new PortBindingException(Stage.BUILD, "No port to connect " + describe(src) + " to " + describe(dst),
                    src.span().to(dst.span()));
        Port target = graph.port(to);
        if (graph.port(from).kind() != target.kind())
            throw new PortBindingException(Stage.BUILD, "Cannot connect " + graph.port(from).kind().label()
                    + " output to " + target.kind().label() + " input '" + to.port() + "'", dst.span());
        if (!target.acceptsManyEdges() && graph.isBound(to))
            throw new PortBindingException(Stage.BUILD, "Input '" + to.port() + "' of "
                    + graph.vertex(to.vertex()).name() + " is already connected", dst.span());
        graph.connect(from, to);
    }

    private static Endpoint sourceFor(Fragment f, boolean impulse) {
        return impulse ? f.impulseOut() : f.valueOut();
    }

    /** First unbound ordinary data input, else the first dummy input, else {@code null}. */
    private Endpoint freeDataInput(int vertex) {
        if (vertex < 0)
            return null;
        Vertex v = graph.vertex(vertex);
        Endpoint dummy = null;
        for (Port p : v.ports()) {
            if (!p.isInput() || p.isImpulse())
                continue;
            Endpoint e = new Endpoint(vertex, p.name());
            if (p.isDummy()) {
                if (dummy == null)
                    dummy = e;
            } else if (!graph.isBound(e)) {
                return e;
            }
        }
        return dummy;
    }

    private String describe(Element el) {
        if (el.fragment().vertex() < 0)
            return "empty block";
        String name = graph.vertex(el.fragment().vertex()).name();
        return el.port() == null ? name : name + "." + el.port().port();
    }

    /** Lexical scope: a name table chained to its enclosing scope. */
    private static final class Scope {
        private final Scope parent;
        private final Map<String, Fragment> names = new HashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }

        Fragment lookup(String name) {
            for (Scope s = this; s != null; s = s.parent) {
                Fragment f = s.names.get(name);
                if (f != null)
                    return f;
            }
            return null;
        }

        boolean isLocal(String name) {
            return names.containsKey(name);
        }

        void define(String name, Fragment fragment) {
            names.put(name, fragment);
        }
    }
}
