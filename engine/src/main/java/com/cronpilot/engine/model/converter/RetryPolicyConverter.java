package com.cronpilot.engine.model.converter;

import com.cronpilot.engine.model.RetryPolicy;
import com.cronpilot.engine.util.Jsons;
import jakarta.persistence.Converter;

@Converter
public class RetryPolicyConverter extends JsonColumnConverter<RetryPolicy> {

    public RetryPolicyConverter() {
        super(Jsons.mapper().constructType(RetryPolicy.class));
    }

    @Override
    protected RetryPolicy emptyValue() {
        return RetryPolicy.defaults();
    }
}
