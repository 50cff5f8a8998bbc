package com.logix.laad;

import com.logix.laad.node.TemplateRegistry;
import com.logix.laad.passes.AttributeRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import lombok.Builder;
import lombok.Getter;

/**
 * Settings of one {@link LaadCompiler}.
 *
 * <p>
 * {@link #fromProperties()} starts from {@code laad.properties} on the classpath:
 * <ul>
 * <li>{@code laad.unit.name}: unit name used when the caller gives none</li>
 * <li>{@code laad.infer.parallelism}: threads solving type components</li>
 * <li>{@code laad.lnj.pretty}: indent the emitted LNJ</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
public final class CompilerOptions {
    public static final String RESOURCE = "laad.properties";

    @Builder.Default
    private final String unitName = "main";
    @Builder.Default
    private final int parallelism = 1;
    @Builder.Default
    private final boolean prettyPrint = true;
    @Builder.Default
    private final TemplateRegistry templateRegistry = new TemplateRegistry();
    @Builder.Default
    private final AttributeRegistry attributeRegistry = AttributeRegistry.standard();

    public static CompilerOptions defaults() {
        return builder().build();
    }

    /** Defaults overridden by {@value #RESOURCE}, when present. */
    public static CompilerOptions fromProperties() {
        Properties props = new Properties();
        try (InputStream in = CompilerOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null)
                props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return fromProperties(props);
    }

    public static CompilerOptions fromProperties(Properties props) {
        CompilerOptionsBuilder b = builder();
        String name = props.getProperty("laad.unit.name");
        if (name != null && !name.isBlank())
            b.unitName(name.trim());
        String parallelism = props.getProperty("laad.infer.parallelism");
        if (parallelism != null) {
            int n = Integer.parseInt(parallelism.trim());
            if (n < 1)
                throw new IllegalArgumentException("laad.infer.parallelism must be >= 1: " + n);
            b.parallelism(n);
        }
        String pretty = props.getProperty("laad.lnj.pretty");
        if (pretty != null)
            b.prettyPrint(Boolean.parseBoolean(pretty.trim()));
        return b.build();
    }
}
