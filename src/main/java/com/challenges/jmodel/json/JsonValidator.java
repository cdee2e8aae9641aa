package com.challenges.jmodel.json;

import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Checks the two structural invariants of a document:
 * <ul>
 *     <li>every object has unique member keys, checked per object node;</li>
 *     <li>every non-empty array holds elements of a single {@link JsonNode.Kind}.</li>
 * </ul>
 * Sibling objects are checked independently and may share keys. The whole tree is visited
 * even after a violation has been found.
 */
public class JsonValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonValidator.class);

    public boolean validate(JsonNode document) {
        return allNodes(document, node -> {
            boolean uniqueKeys = nodeHasUniqueKeys(node);
            boolean homogeneous = nodeIsHomogeneous(node);
            return uniqueKeys && homogeneous;
        });
    }

    public boolean hasUniqueKeys(JsonNode document) {
        return allNodes(document, this::nodeHasUniqueKeys);
    }

    public boolean isHomogeneous(JsonNode document) {
        return allNodes(document, this::nodeIsHomogeneous);
    }

    // visits the whole tree even after the first failing node
    private boolean allNodes(JsonNode document, Predicate<JsonNode> check) {
        boolean[] valid = {true};
        document.accept(node -> {
            if (!check.test(node)) {
                valid[0] = false;
            }
        });
        return valid[0];
    }

    private boolean nodeHasUniqueKeys(JsonNode node) {
        if (!(node instanceof JsonNode.JsonObject object)) {
            return true;
        }
        MutableSet<String> seen = Sets.mutable.empty();
        for (String key : object.fields().keySet()) {
            if (!seen.add(key)) {
                LOGGER.debug("Duplicate key {} in object with keys {}", key, object.fields().keySet());
                return false;
            }
        }
        return true;
    }

    private boolean nodeIsHomogeneous(JsonNode node) {
        if (!(node instanceof JsonNode.JsonArray array) || array.isEmpty()) {
            return true;
        }
        JsonNode.Kind first = array.elements().getFirst().kind();
        if (array.elements().allSatisfy(element -> element.kind() == first)) {
            return true;
        }
        LOGGER.debug("Array mixes element kinds {}", array.elements().collect(JsonNode::kind).distinct());
        return false;
    }
}
