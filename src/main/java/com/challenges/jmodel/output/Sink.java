package com.challenges.jmodel.output;

/**
 * Incremental text output. Implementations either buffer text or wrap another sink and
 * decorate whatever is written through them.
 */
public interface Sink {
    void write(String text);

    void newline();

    /** Everything written so far. */
    String snapshot();
}
