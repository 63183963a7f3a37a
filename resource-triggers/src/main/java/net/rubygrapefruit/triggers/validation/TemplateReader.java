/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package net.rubygrapefruit.triggers.validation;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;

/**
 * Reads a YAML or JSON template into a tree. Short form intrinsic function tags are expanded into their long form,
 * so {@code !Ref Api} reads as {@code {"Ref": "Api"}} and {@code !GetAtt Fn.Arn} as {@code {"Fn::GetAtt": ["Fn", "Arn"]}}.
 */
class TemplateReader {
    private static final YAMLFactory YAML = new YAMLFactory();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final String FUNCTION_PREFIX = "Fn::";

    private TemplateReader() {
    }

    /**
     * @return the first document of the file, or {@code null} when the file holds no document.
     */
    @Nullable
    static JsonNode read(File file) throws IOException {
        JsonParser parser = YAML.createParser(file);
        try {
            if (parser.nextToken() == null) {
                return null;
            }
            return readValue(parser);
        } finally {
            parser.close();
        }
    }

    private static JsonNode readValue(JsonParser parser) throws IOException {
        // Read before descending, the parser only reports the tag of the current token
        String tag = (String) parser.getTypeId();
        JsonToken token = parser.currentToken();
        JsonNode value;
        switch (token) {
            case START_OBJECT:
                ObjectNode object = NODES.objectNode();
                while (parser.nextToken() == JsonToken.FIELD_NAME) {
                    String name = parser.currentName();
                    parser.nextToken();
                    object.set(name, readValue(parser));
                }
                value = object;
                break;
            case START_ARRAY:
                ArrayNode array = NODES.arrayNode();
                while (parser.nextToken() != JsonToken.END_ARRAY) {
                    array.add(readValue(parser));
                }
                value = array;
                break;
            case VALUE_STRING:
                value = NODES.textNode(parser.getText());
                break;
            case VALUE_NUMBER_INT:
                value = NODES.numberNode(parser.getBigIntegerValue());
                break;
            case VALUE_NUMBER_FLOAT:
                value = NODES.numberNode(parser.getDoubleValue());
                break;
            case VALUE_TRUE:
            case VALUE_FALSE:
                value = NODES.booleanNode(parser.getBooleanValue());
                break;
            case VALUE_NULL:
                value = NODES.nullNode();
                break;
            case VALUE_EMBEDDED_OBJECT:
                value = NODES.binaryNode(parser.getBinaryValue());
                break;
            default:
                throw new JsonParseException(parser, "Unexpected token " + token);
        }
        return isIntrinsicFunction(tag) ? expand(tag, value) : value;
    }

    // Local tags only, core schema tags such as !!str arrive as "tag:yaml.org,2002:str"
    private static boolean isIntrinsicFunction(@Nullable String tag) {
        return tag != null && !tag.isEmpty() && tag.indexOf(':') < 0;
    }

    private static JsonNode expand(String tag, JsonNode value) {
        String name = tag.equals("Ref") || tag.equals("Condition") ? tag : FUNCTION_PREFIX + tag;
        JsonNode argument = value;
        if (tag.equals("GetAtt") && value.isTextual()) {
            String text = value.textValue();
            int separator = text.indexOf('.');
            ArrayNode parts = NODES.arrayNode();
            if (separator < 0) {
                parts.add(text);
            } else {
                parts.add(text.substring(0, separator));
                parts.add(text.substring(separator + 1));
            }
            argument = parts;
        }
        ObjectNode function = NODES.objectNode();
        function.set(name, argument);
        return function;
    }
}
