package com.logix.laad.types;

import com.logix.laad.error.CompilationException;
import com.logix.laad.graph.Edge;
import com.logix.laad.graph.Endpoint;
import com.logix.laad.graph.Graph;
import com.logix.laad.graph.Port;
import com.logix.laad.graph.PortAnnotation;
import com.logix.laad.graph.PortEquation;
import com.logix.laad.graph.PortKind;
import com.logix.laad.graph.Vertex;
import com.logix.laad.passes.AttributeRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Assigns a type to every data port and edge of a graph.
 *
 * <p>
 * Unification is bidirectional: an edge equates the types at both of its ends, so a
 * generic sink learns its type from a concrete source reached by walking backwards,
 * and a generic source from a concrete sink. Each connected component (by data and
 * impulse edges) is an independent problem; with {@code parallelism > 1} components
 * are solved on a pool. Results are written back to the graph only after every
 * component has finished, in vertex and edge order, so the outcome does not depend on
 * scheduling. When several components fail the one holding the lowest vertex id is
 * reported.
 *
 * <p>
 * Variables left unresolved with no fallback stay generic and are emitted as
 * {@code 't<n>}.
 */
public final class TypeInferenceEngine {
    private static final Logger log = LogManager.getLogger(TypeInferenceEngine.class);

    private final AttributeRegistry attributes;
    private final int parallelism;

    public TypeInferenceEngine(AttributeRegistry attributes, int parallelism) {
        if (parallelism < 1)
            throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        this.attributes = attributes;
        this.parallelism = parallelism;
    }

    public void infer(Graph graph) {
        TermTable terms = new TermTable(graph);
        List<ComponentSolver> components = partition(graph, terms);
        log.debug("Inferring '{}': {} variables in {} components", graph.name(), terms.variableCount(),
                components.size());

        if (parallelism == 1 || components.size() < 2) {
            for (ComponentSolver c : components)
                c.call();
        } else {
            solveConcurrently(components);
        }
        writeBack(graph, terms);
    }

    private void solveConcurrently(List<ComponentSolver> components) {
        int threads = Math.min(parallelism, components.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, namedThreads());
        try {
            List<Future<Void>> results = pool.invokeAll(components);
            for (Future<Void> f : results) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof CompilationException ce)
                        throw ce;
                    throw new IllegalStateException("Type inference failed", e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while solving types", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "laad-infer-" + n.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    // ── Components ──────────────────────────────────────────────────

    private List<ComponentSolver> partition(Graph graph, TermTable terms) {
        int[] parent = new int[graph.capacity()];
        for (int i = 0; i < parent.length; i++)
            parent[i] = i;
        for (Edge e : terms.edges())
            union(parent, e.srcVertex(), e.dstVertex());
        for (PortEquation eq : graph.equations())
            union(parent, eq.left().vertex(), eq.right().vertex());

        // keyed by root; roots are visited in vertex order so components come out sorted by smallest id
        Map<Integer, Integer> index = new TreeMap<>();
        List<List<Integer>> vertices = new ArrayList<>();
        List<List<Integer>> edges = new ArrayList<>();
        List<List<PortEquation>> equations = new ArrayList<>();
        List<List<PortAnnotation>> annotations = new ArrayList<>();
        for (Vertex v : graph.vertices()) {
            int root = find(parent, v.id());
            Integer c = index.get(root);
            if (c == null) {
                c = vertices.size();
                index.put(root, c);
                vertices.add(new ArrayList<>());
                edges.add(new ArrayList<>());
                equations.add(new ArrayList<>());
                annotations.add(new ArrayList<>());
            }
            vertices.get(c).add(v.id());
        }
        for (int i = 0; i < terms.edges().size(); i++)
            edges.get(index.get(find(parent, terms.edges().get(i).srcVertex()))).add(i);
        for (PortEquation eq : graph.equations())
            equations.get(index.get(find(parent, eq.left().vertex()))).add(eq);
        for (PortAnnotation a : graph.annotations())
            annotations.get(index.get(find(parent, a.port().vertex()))).add(a);

        List<ComponentSolver> out = new ArrayList<>(vertices.size());
        for (int c = 0; c < vertices.size(); c++)
            out.add(new ComponentSolver(graph, terms, attributes, vertices.get(c), edges.get(c), equations.get(c),
                    annotations.get(c)));
        return out;
    }

    private static int find(int[] parent, int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb)
            parent[Math.max(ra, rb)] = Math.min(ra, rb);
    }

    // ── Write-back ──────────────────────────────────────────────────

    private static void writeBack(Graph graph, TermTable terms) {
        for (Vertex v : graph.vertices()) {
            for (Port p : v.ports()) {
                if (p.isImpulse())
                    p.setType(null);
                else if (p.isDummy())
                    p.setType(DummyType.INSTANCE);
                else
                    p.setType(Types.resolve(terms.port(new Endpoint(v.id(), p.name()))));
            }
        }
        for (int i = 0; i < terms.edges().size(); i++) {
            Edge e = terms.edges().get(i);
            e.setType(e.kind() == PortKind.DATA ? Types.resolve(terms.edgeSource(i)) : null);
        }
    }
}
