package com.logix.laad.graph;

import com.logix.laad.dsl.Ast.LiteralKind;

/** Constant carried by a literal vertex. {@code value} is {@code null} only for {@code null}. */
public record LiteralValue(LiteralKind kind, Object value) {
}
