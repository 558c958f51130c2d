package com.lanewatch.backend.model.vehicle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Vehicle vocabulary emitted by the upstream tracker.
 */
public enum VehicleClass {
    CAR("car"),
    BUS("bus"),
    TRUCK("truck"),
    MOTORBIKE("motorbike");

    private final String label;

    VehicleClass(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static VehicleClass fromLabel(String label) {
        if (label != null) {
            for (VehicleClass c : values()) {
                if (c.label.equalsIgnoreCase(label.trim())) {
                    return c;
                }
            }
        }
        throw new IllegalArgumentException("Unknown vehicle class: " + label);
    }
}
