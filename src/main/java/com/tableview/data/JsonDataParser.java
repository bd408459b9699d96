package com.tableview.data;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.io.InputStream;

public class JsonDataParser {
    private final JsonFactory factory = new JsonFactory();

    public DataValue parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new IOException("No JSON content");
            }
            return parseValue(parser, token);
        }
    }

    public DataValue parse(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new IOException("No JSON content");
            }
            return parseValue(parser, token);
        }
    }

    private DataValue parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> new DataValue.Text(parser.getText());
            case VALUE_NUMBER_INT -> new DataValue.Number(parser.getNumberValue());
            case VALUE_NUMBER_FLOAT -> new DataValue.Number(parser.getDoubleValue());
            case VALUE_TRUE -> new DataValue.Bool(true);
            case VALUE_FALSE -> new DataValue.Bool(false);
            case VALUE_NULL -> new DataValue.Null();
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private DataValue.Mapping parseObject(JsonParser parser) throws IOException {
        DataValue.Mapping mapping = DataValue.Mapping.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            mapping.with(fieldName, parseValue(parser, parser.nextToken()));
        }

        return mapping;
    }

    private DataValue.Sequence parseArray(JsonParser parser) throws IOException {
        DataValue.Sequence sequence = DataValue.Sequence.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            sequence.with(parseValue(parser, token));
        }

        return sequence;
    }
}
