package com.cronpilot.engine.model.converter;

import com.cronpilot.engine.util.Jsons;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class StringMapConverter extends JsonColumnConverter<Map<String, String>> {

    public StringMapConverter() {
        super(Jsons.mapper().getTypeFactory()
                .constructMapType(LinkedHashMap.class, String.class, String.class));
    }

    @Override
    protected Map<String, String> emptyValue() {
        return new LinkedHashMap<>();
    }
}
