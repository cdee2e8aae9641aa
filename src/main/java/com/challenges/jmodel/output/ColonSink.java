package com.challenges.jmodel.output;

/**
 * Writes one object member: {@link #writeKey(String)} emits the quoted key and a colon, and the
 * value is then written through this sink unchanged.
 */
public class ColonSink implements Sink {
    private final Sink sink;

    public ColonSink(Sink sink) {
        this.sink = sink;
    }

    public void writeKey(String key) {
        new QuoteSink(sink).write(key);
        sink.write(":");
    }

    @Override
    public void write(String text) {
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
