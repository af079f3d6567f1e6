package com.fdb.serde;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fdb.core.TypedRow;

import java.io.IOException;
import java.util.Map;

/**
 * Writes a typed row as a JSON object: declared field names, declaration order, absent optional values as
 * explicit nulls.
 */
public class TypedRowSerializer extends StdSerializer<TypedRow<?, ?>> {

    public TypedRowSerializer() {
        super(TypedRow.class, false);
    }

    @Override
    public void serialize(TypedRow<?, ?> row, JsonGenerator gen, SerializerProvider provider) throws IOException {
        Map<String, Object> fields = row.toMap();
        gen.writeStartObject(row, fields.size());
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            gen.writeFieldName(entry.getKey());
            var value = entry.getValue();
            if (value == null) {
                gen.writeNull();
            } else {
                provider.defaultSerializeValue(value, gen);
            }
        }
        gen.writeEndObject();
    }
}
