/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */


package io.docvalue.values;

import static io.docvalue.util.CheckNull.requireNonNull;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.json.JsonReadFeature;

import io.docvalue.JsonParseException;

/**
 * Builds a {@link FieldValue} tree from JSON text using a streaming
 * parser. Objects keep their field order and a repeated field name
 * overwrites the earlier value in place. Integers that fit in a long
 * become {@link IntegerValue}, every other number a {@link DoubleValue}.
 * The non-numeric tokens NaN, Infinity and -Infinity are accepted so that
 * any rendered document reads back.
 */
final class JsonValueParser {

    private static final JsonFactory factory = new JsonFactoryBuilder()
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .build();

    private JsonValueParser() {
    }

    static FieldValue parse(String json) {
        requireNonNull(json, "FieldValue.fromJson: json must be non-null");
        try (JsonParser jp = factory.createParser(json)) {
            FieldValue value = readValue(jp, jp.nextToken());
            if (jp.nextToken() != null) {
                throw parseError("Unexpected content after the JSON value",
                                 jp);
            }
            return value;
        } catch (JsonProcessingException jpe) {
            throw new JsonParseException(jpe.getOriginalMessage(),
                                         jpe.getLocation());
        } catch (IOException ioe) {
            throw new JsonParseException(
                "Failed to read JSON: " + ioe.getMessage(), null);
        }
    }

    private static FieldValue readValue(JsonParser jp, JsonToken token)
        throws IOException {

        if (token == null) {
            throw parseError("Unexpected end of JSON input", jp);
        }
        switch (token) {
        case START_OBJECT:
            return readMap(jp);
        case START_ARRAY:
            return readArray(jp);
        case VALUE_STRING:
            return new StringValue(jp.getText());
        case VALUE_NUMBER_INT:
            if (jp.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
                return new DoubleValue(jp.getDoubleValue());
            }
            return new IntegerValue(jp.getLongValue());
        case VALUE_NUMBER_FLOAT:
            return new DoubleValue(jp.getDoubleValue());
        case VALUE_TRUE:
            return BooleanValue.TRUE;
        case VALUE_FALSE:
            return BooleanValue.FALSE;
        case VALUE_NULL:
            return NullValue.getInstance();
        default:
            throw parseError("Unexpected JSON token " + token, jp);
        }
    }

    private static MapValue readMap(JsonParser jp) throws IOException {
        MapValue map = new MapValue();
        String name;
        /* null once the closing brace is reached */
        while ((name = jp.nextFieldName()) != null) {
            map.put(name, readValue(jp, jp.nextToken()));
        }
        return map;
    }

    private static ArrayValue readArray(JsonParser jp) throws IOException {
        ArrayValue array = new ArrayValue();
        JsonToken token;
        while ((token = jp.nextToken()) != JsonToken.END_ARRAY) {
            array.add(readValue(jp, token));
        }
        return array;
    }

    private static JsonParseException parseError(String msg, JsonParser jp) {
        return new JsonParseException(msg, jp.currentLocation());
    }
}
