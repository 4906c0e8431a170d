package com.ureca.mimus.transaction.dto;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

public class QueryEntryJsonSerializer extends StdSerializer<QueryEntry> {

    public QueryEntryJsonSerializer() {
        super(QueryEntry.class);
    }

    @Override
    public void serialize(QueryEntry entry, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartArray();
        gen.writeString(entry.statement());
        gen.writeString(entry.resultKey());

        // 파라미터 없으면 2원소 형식 유지
        if (!entry.parameters().isEmpty()) {
            gen.writeStartArray();
            for (Object parameter : entry.parameters()) {
                provider.defaultSerializeValue(parameter, gen);
            }
            gen.writeEndArray();
        }

        gen.writeEndArray();
    }
}
