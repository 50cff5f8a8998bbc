package com.logix.laad.error;

import com.logix.laad.dsl.SourceSpan;

/** A required input port is left unbound, or a connection finds no port to bind. */
public class PortBindingException extends CompilationException {

    public PortBindingException(Stage stage, String detail, SourceSpan span) {
        super(stage, detail, span);
    }
}
