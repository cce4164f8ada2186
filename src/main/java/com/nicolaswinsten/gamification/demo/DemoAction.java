package com.nicolaswinsten.gamification.demo;

import java.io.IOException;
import java.math.BigInteger;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/demo/award}. Points default to {@code 0} when omitted and are
 * otherwise unconstrained in sign and size.
 */
@JsonDeserialize(using = DemoAction.Deserializer.class)
public record DemoAction(@NotNull String action, BigInteger points) {

    public DemoAction {
        if (points == null) {
            points = BigInteger.ZERO;
        }
    }

    public DemoAction(String action, long points) {
        this(action, BigInteger.valueOf(points));
    }

    /**
     * Reads the body without Jackson's scalar coercions: {@code action} must be a JSON string
     * and {@code points}, when present, a JSON integer. A missing {@code action} is left to
     * bean validation.
     */
    public static class Deserializer extends JsonDeserializer<DemoAction> {

        @Override
        public DemoAction deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (!node.isObject()) {
                return ctxt.reportInputMismatch(DemoAction.class, "Expected a JSON object, got %s", node.getNodeType());
            }

            String action = null;
            JsonNode actionNode = node.get("action");
            if (actionNode != null && !actionNode.isNull()) {
                if (!actionNode.isTextual()) {
                    return ctxt.reportInputMismatch(DemoAction.class,
                        "Field 'action' must be a string, got %s", actionNode.getNodeType());
                }
                action = actionNode.textValue();
            }

            BigInteger points = BigInteger.ZERO;
            JsonNode pointsNode = node.get("points");
            if (pointsNode != null) {
                if (!pointsNode.isIntegralNumber()) {
                    return ctxt.reportInputMismatch(DemoAction.class,
                        "Field 'points' must be an integer, got %s", pointsNode.getNodeType());
                }
                points = pointsNode.bigIntegerValue();
            }
            return new DemoAction(action, points);
        }
    }
}
