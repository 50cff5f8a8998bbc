package com.logix.laad.graph;

import com.logix.laad.dsl.SourceSpan;
import com.logix.laad.types.Type;

/** A written annotation {@code x: T = ...} fixing the type of one port. */
public record PortAnnotation(Endpoint port, Type type, SourceSpan span) {
}
