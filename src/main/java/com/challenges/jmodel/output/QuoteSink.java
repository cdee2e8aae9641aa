package com.challenges.jmodel.output;

/** Wraps every fragment in double quotes. The fragment itself is written as given. */
public class QuoteSink implements Sink {
    private final Sink sink;

    public QuoteSink(Sink sink) {
        this.sink = sink;
    }

    @Override
    public void write(String text) {
        sink.write("\"" + text + "\"");
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
