package com.tableview.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.tableview.data.DataValue;
import org.eclipse.collections.api.tuple.Pair;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Writes a {@link DataValue} as JSON text, pretty or compact. Binary values become base64
 * strings; anything without a JSON form is written as its display string.
 */
public class JsonFormatter {
    private static final JsonFactory FACTORY = new JsonFactory();
    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    private final boolean prettyPrint;
    private final boolean sortKeys;

    public JsonFormatter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    public String format(DataValue value) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = FACTORY.createGenerator(out)) {
            if (prettyPrint) {
                // printers keep nesting state, one per document
                generator.setPrettyPrinter(new DefaultPrettyPrinter()
                    .withObjectIndenter(INDENTER)
                    .withArrayIndenter(INDENTER));
            }
            write(value, generator);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private void write(DataValue value, JsonGenerator generator) throws IOException {
        if (value instanceof DataValue.Mapping mapping) {
            generator.writeStartObject();
            var entries = sortKeys
                ? mapping.entries().keyValuesView().toSortedListBy(Pair::getOne)
                : mapping.entries().keyValuesView().toList();
            for (var entry : entries) {
                generator.writeFieldName(entry.getOne());
                write(entry.getTwo(), generator);
            }
            generator.writeEndObject();
        } else if (value instanceof DataValue.Sequence sequence) {
            generator.writeStartArray();
            for (DataValue element : sequence.elements()) {
                write(element, generator);
            }
            generator.writeEndArray();
        } else if (value instanceof DataValue.Text text) {
            generator.writeString(text.value());
        } else if (value instanceof DataValue.Number number) {
            writeNumber(number.value(), generator);
        } else if (value instanceof DataValue.Bool bool) {
            generator.writeBoolean(bool.value());
        } else if (value instanceof DataValue.Binary binary) {
            generator.writeBinary(binary.bytes());
        } else if (value instanceof DataValue.Other other) {
            generator.writeString(other.display());
        } else {
            generator.writeNull();
        }
    }

    /** Non-finite doubles come out quoted, so the output stays valid JSON. */
    private static void writeNumber(Number number, JsonGenerator generator) throws IOException {
        if (number instanceof BigInteger big) {
            generator.writeNumber(big);
        } else if (number instanceof BigDecimal decimal) {
            generator.writeNumber(decimal);
        } else if (number instanceof Double || number instanceof Float) {
            generator.writeNumber(number.doubleValue());
        } else {
            generator.writeNumber(number.longValue());
        }
    }
}
