package com.logix.laad.error;

import com.logix.laad.dsl.SourceSpan;

/** Reference to an undeclared identifier or duplicate definition within one scope. */
public class ScopeException extends CompilationException {

    public ScopeException(String detail, SourceSpan span) {
        super(Stage.BUILD, detail, span);
    }
}
