package com.logix.laad;

import com.logix.laad.dsl.Ast.Program;
import com.logix.laad.dsl.Parser;
import com.logix.laad.graph.Graph;
import com.logix.laad.graph.GraphBuilder;
import com.logix.laad.io.LnjDocument;
import com.logix.laad.io.LnjEmitter;
import com.logix.laad.passes.Desugarer;
import com.logix.laad.passes.ReachabilityPass;
import com.logix.laad.types.TypeInferenceEngine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles LaaD source into an LNJ graph.
 *
 * <p>
 * Stages run strictly in order: parse, build, infer, desugar, reachability, emit.
 * The first {@link com.logix.laad.error.CompilationException} aborts the unit and
 * nothing is emitted.
 *
 * <pre>{@code
 * CompiledUnit unit = new LaadCompiler(CompilerOptions.defaults())
 *         .compile("\"Hello, World!\" -> logix.io.display", "hello");
 * String json = unit.lnj();
 * }</pre>
 */
@Log4j2
public final class LaadCompiler {
    private final CompilerOptions options;

    public LaadCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions options() {
        return options;
    }

    public CompiledUnit compile(String source) {
        return compile(source, options.getUnitName());
    }

    public CompiledUnit compile(String source, String unitName) {
        long start = System.nanoTime();
        Graph graph = lower(parse(source), unitName);

        LnjEmitter emitter = new LnjEmitter(options.isPrettyPrint());
        LnjDocument doc = emitter.toDocument(graph);
        String lnj = emitter.render(doc);
        log.debug("Compiled '{}' in {} us: {} vertices, {} edges", unitName, (System.nanoTime() - start) / 1_000,
                graph.vertexCount(), graph.edges().size());
        return new CompiledUnit(unitName, graph, doc, lnj);
    }

    public CompiledUnit compileFile(Path source) throws IOException {
        String text = Files.readString(source, StandardCharsets.UTF_8);
        return compile(text, unitName(source));
    }

    public Program parse(String source) {
        Program program = Parser.parse(source);
        log.debug("Parsed {} statements", program.statements().size());
        return program;
    }

    /** Runs every stage up to, but not including, emission. */
    public Graph lower(Program program, String unitName) {
        Graph graph = new GraphBuilder(options.getTemplateRegistry()).build(program, unitName);
        new TypeInferenceEngine(options.getAttributeRegistry(), options.getParallelism()).infer(graph);
        new Desugarer(options.getTemplateRegistry()).desugar(graph);
        new ReachabilityPass(options.getAttributeRegistry()).sweep(graph);
        return graph;
    }

    /** File name without its extension. */
    static String unitName(Path source) {
        String file = source.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
