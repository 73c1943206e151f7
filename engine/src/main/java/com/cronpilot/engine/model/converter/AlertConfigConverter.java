package com.cronpilot.engine.model.converter;

import com.cronpilot.engine.model.AlertConfig;
import com.cronpilot.engine.util.Jsons;
import jakarta.persistence.Converter;

@Converter
public class AlertConfigConverter extends JsonColumnConverter<AlertConfig> {

    public AlertConfigConverter() {
        super(Jsons.mapper().constructType(AlertConfig.class));
    }

    @Override
    protected AlertConfig emptyValue() {
        return AlertConfig.none();
    }
}
