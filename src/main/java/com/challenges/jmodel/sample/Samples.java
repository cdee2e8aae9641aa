package com.challenges.jmodel.sample;

import com.challenges.jmodel.convert.JsonConverter;
import com.challenges.jmodel.json.JsonNode;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/** Documents the command line can print. */
public enum Samples {
    /** The course record graph, converted reflectively. */
    COURSE {
        @Override
        public JsonNode document(JsonConverter converter) {
            return converter.convert(course());
        }
    },
    /** A student object assembled by hand from document nodes. */
    STUDENT {
        @Override
        public JsonNode document(JsonConverter converter) {
            return student();
        }
    },
    /** Grades with a missing entry. Mixing null with numbers fails validation. */
    GRADES {
        @Override
        public JsonNode document(JsonConverter converter) {
            return converter.convert(Arrays.asList(17, null, 18));
        }
    };

    public abstract JsonNode document(JsonConverter converter);

    public static Course course() {
        return new Course("PA", 6, Lists.mutable.of(
                new EvalItem("quizzes", 0.2, false, null),
                new EvalItem("project", 0.8, true, EvalType.PROJECT)));
    }

    public static JsonNode.JsonObject student() {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        fields.put("name", new JsonNode.JsonString("Catarina"));
        fields.put("age", JsonNode.JsonNumber.of(37));
        fields.put("isStudent", new JsonNode.JsonBoolean(true));
        fields.put("scores", JsonNode.JsonArray.of(
                JsonNode.JsonNumber.of(17), JsonNode.JsonNumber.of(15), JsonNode.JsonNumber.of(18)));
        return JsonNode.JsonObject.of(fields);
    }
}
