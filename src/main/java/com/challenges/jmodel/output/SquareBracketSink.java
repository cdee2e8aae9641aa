package com.challenges.jmodel.output;

public class SquareBracketSink implements Sink {
    private final Sink sink;

    public SquareBracketSink(Sink sink) {
        this.sink = sink;
    }

    @Override
    public void write(String text) {
        sink.write("[" + text + "]");
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
