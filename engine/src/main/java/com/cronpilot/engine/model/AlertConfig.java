package com.cronpilot.engine.model;

public record AlertConfig(boolean onSuccess, boolean onFailure, boolean onMaterialChange) {

    public static AlertConfig none() {
        return new AlertConfig(false, false, false);
    }
}
