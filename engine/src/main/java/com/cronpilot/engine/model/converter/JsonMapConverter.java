package com.cronpilot.engine.model.converter;

import com.cronpilot.engine.util.Jsons;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class JsonMapConverter extends JsonColumnConverter<Map<String, Object>> {

    public JsonMapConverter() {
        super(Jsons.mapper().getTypeFactory()
                .constructMapType(LinkedHashMap.class, String.class, Object.class));
    }

    @Override
    protected Map<String, Object> emptyValue() {
        return null;
    }
}
