package com.challenges.jmodel.output;

import com.challenges.jmodel.json.JsonNode;

/**
 * Renders documents as compact JSON text by composing {@link Sink} wrappers. No whitespace is
 * emitted and documents are not validated first.
 * <p>
 * Only {@code "} is escaped inside strings. Backslashes and control characters are written
 * verbatim, so such strings produce text a strict JSON parser will reject. Object keys are
 * written without any escaping.
 */
public class JsonStringifier {

    public String stringify(JsonNode node) {
        return stringify(node, new StringSink());
    }

    public String stringify(JsonNode node, Sink sink) {
        write(node, sink);
        return sink.snapshot();
    }

    private void write(JsonNode node, Sink sink) {
        switch (node.kind()) {
            case NULL -> sink.write("null");
            case BOOLEAN -> sink.write(Boolean.toString(((JsonNode.JsonBoolean) node).value()));
            case NUMBER -> sink.write(((JsonNode.JsonNumber) node).toJsonString());
            case STRING -> new QuoteSink(sink).write(escapeString(((JsonNode.JsonString) node).value()));
            case ARRAY -> writeArray((JsonNode.JsonArray) node, sink);
            case OBJECT -> writeObject((JsonNode.JsonObject) node, sink);
        }
    }

    private void writeArray(JsonNode.JsonArray array, Sink sink) {
        StringSink inner = new StringSink();
        CommaSink elements = new CommaSink(inner);
        for (JsonNode element : array.elements()) {
            // each element brings its own brackets or quotes before the comma logic sees it
            write(element, elements);
        }
        new SquareBracketSink(sink).write(inner.snapshot());
    }

    private void writeObject(JsonNode.JsonObject object, Sink sink) {
        StringSink inner = new StringSink();
        CommaSink members = new CommaSink(inner);
        for (var entry : object.fields().keyValuesView()) {
            ColonSink member = new ColonSink(new StringSink());
            member.writeKey(entry.getOne());
            write(entry.getTwo(), member);
            members.write(member.snapshot());
        }
        new CurlyBracketSink(sink).write(inner.snapshot());
    }

    private String escapeString(String s) {
        // Fast path: nothing to escape
        if (s.indexOf('"') < 0) {
            return s;
        }
        return s.replace("\"", "\\\"");
    }
}
