package com.spreadsheet.formula.models;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes a FormulaValue the way the grid expects to display it:
 * errors as their token ("#DIV/0!"), booleans as "TRUE"/"FALSE",
 * integral numbers as JSON integers, empty cells as null.
 */
public class FormulaValueSerializer extends StdSerializer<FormulaValue> {

    public FormulaValueSerializer() {
        super(FormulaValue.class);
    }

    @Override
    public void serialize(FormulaValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        switch (value.getType()) {
            case NUMBER:
                double number = value.getNumber();
                if (number == Math.rint(number) && Math.abs(number) < 1e15) {
                    gen.writeNumber((long) number);
                } else {
                    gen.writeNumber(number);
                }
                break;
            case STRING:
                gen.writeString(value.getText());
                break;
            case BOOLEAN:
            case ERROR:
                gen.writeString(value.toDisplayString());
                break;
            case EMPTY:
                gen.writeNull();
                break;
            default:
                // a range never reaches a cell, so there is nothing sensible to show
                gen.writeString(ErrorKind.REF.getToken());
        }
    }
}
