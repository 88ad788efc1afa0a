package org.hwir.util;

/** An {@link IndentStream} which accumulates its output in memory. */
public class IndentStreamBuilder extends IndentStream {
    public IndentStreamBuilder() {
        super(new StringBuilder());
    }
}
