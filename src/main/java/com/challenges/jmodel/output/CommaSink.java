package com.challenges.jmodel.output;

/**
 * Separates fragments with a comma. One instance covers one member list: the first-write
 * state is never reset.
 */
public class CommaSink implements Sink {
    private final Sink sink;
    private boolean first = true;

    public CommaSink(Sink sink) {
        this.sink = sink;
    }

    @Override
    public void write(String text) {
        if (!first) {
            sink.write(",");
        }
        first = false;
        sink.write(text);
    }

    @Override
    public void newline() {
        sink.newline();
    }

    @Override
    public String snapshot() {
        return sink.snapshot();
    }
}
