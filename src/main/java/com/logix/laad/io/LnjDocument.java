package com.logix.laad.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of an LNJ document, the JSON form of a compiled graph.
 *
 * <p>
 * Vertex ids are dense and start at 0. Types are written as their printed form
 * ({@code int}, {@code ref<int>}, {@code Slot}, {@code 't3}).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LnjDocument {
    private UnitInfo lnj;

    /** One compilation unit. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class UnitInfo {
        private String version, name;
        private List<VertexDef> vertices;
        private List<EdgeDef> edges;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class VertexDef {
        private int id;
        private String name, template;
        private boolean synthetic;
        private List<PortDef> ports;
        /** Literal kind ({@code int}, {@code float}, {@code string}, {@code bool}, {@code null}). */
        private String literal;
        private Object value;
        private List<AttributeDef> attributes;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class PortDef {
        private String name, direction, kind, type;
        private boolean required;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class AttributeDef {
        private String key;
        private Map<String, Object> args;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class EdgeDef {
        private int from, to;
        private String fromPort, toPort, kind, type;
    }
}
