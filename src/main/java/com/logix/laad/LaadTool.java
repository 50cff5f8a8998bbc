package com.logix.laad;

import com.fasterxml.jackson.databind.JsonNode;
import com.logix.laad.dsl.Ast.Program;
import com.logix.laad.dsl.Ast.Statement;
import com.logix.laad.error.CompilationException;
import com.logix.laad.io.LnjReader;
import com.logix.laad.io.LzbsContainer;
import com.logix.laad.util.GraphExplain;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.FileAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.layout.PatternLayout;

import lombok.extern.log4j.Log4j2;

/**
 * Command-line entry point.
 *
 * <pre>
 * laad compile    foo.laad  [-o foo.lnj] [-p threads] [--compact]
 * laad compress   foo.lnj   [-o foo.lzbs]
 * laad decompress foo.lzbs  [-o foo.lnj]
 * laad dump-ast   foo.laad
 * laad dump-json  foo.lnj | foo.lzbs
 * laad explain    foo.laad
 * </pre>
 *
 * {@code --log-level off|error|warning|info|debug|trace} sets the compiler's log level and
 * {@code --log-file path} copies its log output to a file for the duration of the run.
 * Exit codes: 0 on success, 1 on a compilation error, 2 on an I/O error, 64 on bad usage.
 */
@Log4j2
public final class LaadTool {
    static final int OK = 0;
    static final int COMPILE_ERROR = 1;
    static final int IO_ERROR = 2;
    static final int USAGE = 64;

    private static final String LOGGER = "com.logix.laad";
    private static final String FILE_APPENDER = "laad-file";
    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%logger{1}] %-5level %msg%n";

    private static final Options options = new Options();

    static {
        options.addOption("o", "output", true, "Output file");
        options.addOption("p", "parallelism", true, "Threads used for type inference");
        options.addOption(null, "compact", false, "Write LNJ without indentation");
        options.addOption(null, "log-level", true, "off, error, warning, info, debug or trace");
        options.addOption(null, "log-file", true, "Also write log output to this file");
        options.addOption("h", "help", false, "Print this help");
    }

    private final PrintStream out;

    LaadTool(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new LaadTool(System.out).run(args));
    }

    int run(String[] args) {
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            log.error("Bad arguments: {}", e.getMessage());
            usage();
            return USAGE;
        }
        List<String> rest = cmd.getArgList();
        if (cmd.hasOption("help") || rest.size() != 2) {
            usage();
            return cmd.hasOption("help") ? OK : USAGE;
        }

        String command = rest.get(0);
        Path input = Path.of(rest.get(1));
        FileAppender fileLog = null;
        try {
            if (cmd.hasOption("log-level"))
                setLogLevel(cmd.getOptionValue("log-level"));
            if (cmd.hasOption("log-file"))
                fileLog = attachLogFile(cmd.getOptionValue("log-file"));
            switch (command) {
                case "compile" -> compile(input, cmd);
                case "compress" -> compress(input, cmd);
                case "decompress" -> decompress(input, cmd);
                case "dump-ast" -> dumpAst(input, cmd);
                case "dump-json" -> dumpJson(input);
                case "explain" -> explain(input, cmd);
                default -> {
                    log.error("Unknown command '{}'", command);
                    usage();
                    return USAGE;
                }
            }
            return OK;
        } catch (CompilationException e) {
            log.error("{}: {} error at {}", input, e.getStage(), e.getMessage());
            return COMPILE_ERROR;
        } catch (IOException e) {
            log.error("{}: {}", input, e.toString());
            return IO_ERROR;
        } catch (IllegalArgumentException e) {
            log.error("{}: {}", input, e.getMessage());
            return USAGE;
        } finally {
            if (fileLog != null)
                detachLogFile(fileLog);
        }
    }

    // ── Commands ────────────────────────────────────────────────────

    private void compile(Path input, CommandLine cmd) throws IOException {
        CompiledUnit unit = compiler(cmd).compileFile(input);
        Path output = output(cmd, input, ".lnj");
        Files.writeString(output, unit.lnj(), StandardCharsets.UTF_8);
        log.info("Compiled {} -> {} ({} vertices, {} edges)", input, output, unit.graph().vertexCount(),
                unit.graph().edges().size());
    }

    private void compress(Path input, CommandLine cmd) throws IOException {
        JsonNode lnj = LnjReader.tree(Files.readString(input, StandardCharsets.UTF_8));
        byte[] container = LzbsContainer.encode(lnj);
        Path output = output(cmd, input, ".lzbs");
        Files.write(output, container);
        log.info("Compressed {} -> {} ({} bytes)", input, output, container.length);
    }

    private void decompress(Path input, CommandLine cmd) throws IOException {
        JsonNode lnj = LzbsContainer.decode(Files.readAllBytes(input));
        Path output = output(cmd, input, ".lnj");
        Files.writeString(output, LnjReader.write(lnj, !cmd.hasOption("compact")), StandardCharsets.UTF_8);
        log.info("Decompressed {} -> {}", input, output);
    }

    private void dumpAst(Path input, CommandLine cmd) throws IOException {
        Program program = compiler(cmd).parse(Files.readString(input, StandardCharsets.UTF_8));
        for (Statement s : program.statements())
            out.println(s);
    }

    private void dumpJson(Path input) throws IOException {
        JsonNode lnj = input.toString().endsWith(".lzbs")
                ? LzbsContainer.decode(Files.readAllBytes(input))
                : LnjReader.tree(Files.readString(input, StandardCharsets.UTF_8));
        out.println(LnjReader.write(lnj, true));
    }

    private void explain(Path input, CommandLine cmd) throws IOException {
        CompiledUnit unit = compiler(cmd).compileFile(input);
        GraphExplain explain = new GraphExplain(unit.graph());
        out.println(explain.dumpTopology());
        out.println(explain.toMermaid());
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private static LaadCompiler compiler(CommandLine cmd) {
        CompilerOptions.CompilerOptionsBuilder b = CompilerOptions.fromProperties().toBuilder();
        if (cmd.hasOption("parallelism")) {
            int n;
            try {
                n = Integer.parseInt(cmd.getOptionValue("parallelism"));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--parallelism must be a number: " + cmd.getOptionValue("parallelism"));
            }
            if (n < 1)
                throw new IllegalArgumentException("--parallelism must be >= 1: " + n);
            b.parallelism(n);
        }
        if (cmd.hasOption("compact"))
            b.prettyPrint(false);
        return new LaadCompiler(b.build());
    }

    static void setLogLevel(String name) {
        String key = name.toUpperCase(Locale.ROOT);
        Level level = Level.getLevel(key.equals("WARNING") ? "WARN" : key);
        if (level == null)
            throw new IllegalArgumentException("Unknown log level '" + name + "'");
        Configurator.setLevel(LOGGER, level);
    }

    private static FileAppender attachLogFile(String file) {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        Configuration config = ctx.getConfiguration();
        PatternLayout layout = PatternLayout.newBuilder()
                .withConfiguration(config)
                .withPattern(FILE_PATTERN)
                .build();
        FileAppender appender = FileAppender.newBuilder()
                .setName(FILE_APPENDER)
                .withFileName(file)
                .setLayout(layout)
                .setConfiguration(config)
                .build();
        appender.start();
        config.addAppender(appender);
        config.getLoggerConfig(LOGGER).addAppender(appender, null, null);
        ctx.updateLoggers();
        return appender;
    }

    private static void detachLogFile(FileAppender appender) {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        Configuration config = ctx.getConfiguration();
        config.getLoggerConfig(LOGGER).removeAppender(appender.getName());
        ctx.updateLoggers();
        appender.stop();
    }

    private static Path output(CommandLine cmd, Path input, String extension) {
        if (cmd.hasOption("output"))
            return Path.of(cmd.getOptionValue("output"));
        String name = LaadCompiler.unitName(input) + extension;
        Path parent = input.toAbsolutePath().getParent();
        return parent == null ? Path.of(name) : parent.resolve(name);
    }

    private static void usage() {
        new HelpFormatter().printHelp(
                "laad [--log-level level] [--log-file file] <compile|compress|decompress|dump-ast|dump-json|explain> <file>",
                options);
    }
}
