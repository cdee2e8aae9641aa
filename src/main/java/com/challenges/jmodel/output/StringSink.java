package com.challenges.jmodel.output;

public class StringSink implements Sink {
    private final StringBuilder builder = new StringBuilder(64);

    @Override
    public void write(String text) {
        builder.append(text);
    }

    @Override
    public void newline() {
        builder.append('\n');
    }

    @Override
    public String snapshot() {
        return builder.toString();
    }

    @Override
    public String toString() {
        return snapshot();
    }
}
