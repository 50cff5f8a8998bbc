package com.logix.laad;

import com.logix.laad.graph.Graph;
import com.logix.laad.io.LnjDocument;

/** Result of compiling one source file: the frozen graph and its LNJ form. */
public record CompiledUnit(String name, Graph graph, LnjDocument document, String lnj) {
}
