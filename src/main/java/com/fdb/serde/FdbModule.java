package com.fdb.serde;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fdb.core.TypedRow;
import com.fdb.types.Latin1Str;

import java.io.IOException;

/**
 * Jackson module for typed rows and Latin-1 text views.
 */
public class FdbModule extends SimpleModule {

    public FdbModule() {
        super("FdbModule");
        addSerializer(new TypedRowSerializer());
        addSerializer(Latin1Str.class, new Latin1StrSerializer());
    }

    static class Latin1StrSerializer extends StdSerializer<Latin1Str> {

        Latin1StrSerializer() {
            super(Latin1Str.class);
        }

        @Override
        public void serialize(Latin1Str value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.decode());
        }
    }
}
