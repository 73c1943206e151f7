package com.cronpilot.engine.model.converter;

import com.cronpilot.engine.model.ResourceLimits;
import com.cronpilot.engine.util.Jsons;
import jakarta.persistence.Converter;

@Converter
public class ResourceLimitsConverter extends JsonColumnConverter<ResourceLimits> {

    public ResourceLimitsConverter() {
        super(Jsons.mapper().constructType(ResourceLimits.class));
    }

    @Override
    protected ResourceLimits emptyValue() {
        return ResourceLimits.defaults();
    }
}
