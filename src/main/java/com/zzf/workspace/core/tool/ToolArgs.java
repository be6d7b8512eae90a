package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.workspace.core.workspace.error.InvalidToolArgumentsException;

/**
 * Typed access to tool arguments with the validation errors agents can act on.
 */
final class ToolArgs {

    private ToolArgs() {
    }

    static String requireText(JsonNode args, String name) {
        JsonNode node = args == null ? null : args.get(name);
        if (node == null || node.isNull() || !node.isTextual()) {
            throw new InvalidToolArgumentsException(name + " is required");
        }
        return node.asText();
    }

    static String requireNonBlank(JsonNode args, String name) {
        String value = requireText(args, name);
        if (value.isBlank()) {
            throw new InvalidToolArgumentsException(name + " must not be blank");
        }
        return value;
    }

    static String optText(JsonNode args, String name, String fallback) {
        JsonNode node = args == null ? null : args.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isTextual()) {
            throw new InvalidToolArgumentsException(name + " must be a string");
        }
        return node.asText();
    }

    static boolean optBool(JsonNode args, String name, boolean fallback) {
        JsonNode node = args == null ? null : args.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isBoolean()) {
            throw new InvalidToolArgumentsException(name + " must be a boolean");
        }
        return node.asBoolean();
    }

    static int optInt(JsonNode args, String name, int fallback, int min, int max) {
        JsonNode node = args == null ? null : args.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber()) {
            throw new InvalidToolArgumentsException(name + " must be an integer");
        }
        long value = node.asLong();
        if (value < min || value > max) {
            throw new InvalidToolArgumentsException(name + " must be within [" + min + ", " + max + "]");
        }
        return (int) value;
    }

    static double optDouble(JsonNode args, String name, double fallback, double min, double max) {
        JsonNode node = args == null ? null : args.get(name);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isNumber()) {
            throw new InvalidToolArgumentsException(name + " must be a number");
        }
        double value = node.asDouble();
        if (value < min || value > max) {
            throw new InvalidToolArgumentsException(name + " must be within [" + min + ", " + max + "]");
        }
        return value;
    }
}
