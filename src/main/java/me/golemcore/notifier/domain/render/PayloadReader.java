/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.notifier.domain.render;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Typed, fail-closed access to webhook payload fields by dot-separated path.
 *
 * <p>
 * Every {@code require*} method throws {@link MalformedPayloadException} when
 * the field is absent, {@code null}, or of a different JSON type. Numbers are
 * never coerced from strings and vice versa.
 */
public final class PayloadReader {

    private PayloadReader() {
    }

    public static String requireText(JsonNode root, String path) {
        JsonNode node = require(root, path);
        if (!node.isTextual()) {
            throw new MalformedPayloadException(path, "is not a string");
        }
        return node.textValue();
    }

    public static long requireLong(JsonNode root, String path) {
        JsonNode node = require(root, path);
        if (!node.isIntegralNumber()) {
            throw new MalformedPayloadException(path, "is not an integer");
        }
        return node.longValue();
    }

    public static boolean requireBoolean(JsonNode root, String path) {
        JsonNode node = require(root, path);
        if (!node.isBoolean()) {
            throw new MalformedPayloadException(path, "is not a boolean");
        }
        return node.booleanValue();
    }

    public static JsonNode requireArray(JsonNode root, String path) {
        JsonNode node = require(root, path);
        if (!node.isArray()) {
            throw new MalformedPayloadException(path, "is not an array");
        }
        return node;
    }

    /**
     * Returns the string at {@code path} if present and textual.
     */
    public static Optional<String> optionalText(JsonNode root, String path) {
        JsonNode node = resolve(root, path);
        return node != null && node.isTextual() ? Optional.of(node.textValue()) : Optional.empty();
    }

    private static JsonNode require(JsonNode root, String path) {
        JsonNode node = resolve(root, path);
        if (node == null) {
            throw new MalformedPayloadException(path, "is missing");
        }
        return node;
    }

    private static JsonNode resolve(JsonNode root, String path) {
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        if (current == null || current.isNull() || current.isMissingNode()) {
            return null;
        }
        return current;
    }
}
