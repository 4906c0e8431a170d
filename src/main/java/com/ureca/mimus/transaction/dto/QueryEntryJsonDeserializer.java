package com.ureca.mimus.transaction.dto;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class QueryEntryJsonDeserializer extends StdDeserializer<QueryEntry> {

    public QueryEntryJsonDeserializer() {
        super(QueryEntry.class);
    }

    @Override
    public QueryEntry deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();

        if (node == null || !node.isArray() || node.size() < 2 || node.size() > 3) {
            throw JsonMappingException.from(p, "쿼리 항목은 [statement, resultKey(, params)] 배열이어야 합니다: " + node);
        }
        if (!node.get(0).isTextual() || !node.get(1).isTextual()) {
            throw JsonMappingException.from(p, "statement 와 resultKey 는 문자열이어야 합니다: " + node);
        }

        List<Object> parameters = new ArrayList<>();
        if (node.size() == 3) {
            JsonNode params = node.get(2);
            if (!params.isArray()) {
                throw JsonMappingException.from(p, "params 는 배열이어야 합니다: " + node);
            }
            for (JsonNode param : params) {
                parameters.add(toValue(p, param));
            }
        }

        return new QueryEntry(node.get(0).textValue(), node.get(1).textValue(), parameters);
    }

    private static Object toValue(JsonParser p, JsonNode param) throws JsonMappingException {
        if (param.isNull()) {
            return null;
        }
        if (param.isIntegralNumber()) {
            return param.bigIntegerValue().bitLength() < Long.SIZE ? (Object) param.longValue() : param.bigIntegerValue();
        }
        if (param.isNumber()) {
            return param.decimalValue();
        }
        if (param.isTextual()) {
            return param.textValue();
        }
        if (param.isBoolean()) {
            return param.booleanValue();
        }
        throw JsonMappingException.from(p, "지원하지 않는 파라미터 타입: " + param);
    }
}
