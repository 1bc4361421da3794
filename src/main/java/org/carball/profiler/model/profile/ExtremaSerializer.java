package org.carball.profiler.model.profile;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes integral min/max values as JSON integers, so a column of {@code 1} and {@code 2}
 * reports {@code 1} rather than {@code 1.0}.
 */
public class ExtremaSerializer extends StdSerializer<Double> {

    private static final double MAX_EXACT_LONG = 1e15;

    public ExtremaSerializer() {
        super(Double.class);
    }

    @Override
    public void serialize(Double value, JsonGenerator generator, SerializerProvider provider) throws IOException {
        double d = value;
        if (d == Math.rint(d) && Math.abs(d) < MAX_EXACT_LONG) {
            generator.writeNumber((long) d);
        } else {
            generator.writeNumber(d);
        }
    }
}
