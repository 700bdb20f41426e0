package org.daag.deid.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * writes amounts as plain decimals, never in scientific notation: 10000000.0, not 1.0E7
 *
 * shortest form that reads back as same double, with at least one fractional digit.
 */
public class PlainDecimalSerializer extends StdSerializer<Double> {

    private static final long serialVersionUID = 1L;

    public PlainDecimalSerializer() {
        super(Double.class);
    }

    @Override
    public void serialize(Double value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (value.isNaN() || value.isInfinite()) {
            gen.writeNumber(value);
        } else {
            gen.writeNumber(plain(value));
        }
    }

    static String plain(double value) {
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }
}
