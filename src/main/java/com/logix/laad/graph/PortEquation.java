package com.logix.laad.graph;

import com.logix.laad.dsl.SourceSpan;

/** Two ports that must carry the same type without being connected by an edge. */
public record PortEquation(Endpoint left, Endpoint right, SourceSpan span) {
}
