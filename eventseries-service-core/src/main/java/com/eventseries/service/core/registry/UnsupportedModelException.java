package com.eventseries.service.core.registry;

import com.eventseries.service.core.model.TsdbModel;

public class UnsupportedModelException extends IllegalArgumentException {
    private final TsdbModel model;

    public UnsupportedModelException(TsdbModel model) {
        super("Unsupported TSDB model: " + model);
        this.model = model;
    }

    public TsdbModel model() {
        return model;
    }
}
