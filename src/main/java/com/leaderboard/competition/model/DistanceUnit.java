package com.leaderboard.competition.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DistanceUnit {
    KILOMETERS("km", 1.0),
    MILES("miles", 1.609344);

    private final String wireValue;
    private final double kilometersPerUnit;

    DistanceUnit(String wireValue, double kilometersPerUnit) {
        this.wireValue = wireValue;
        this.kilometersPerUnit = kilometersPerUnit;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public double toKilometers(double distance) {
        return distance * kilometersPerUnit;
    }

    @JsonCreator
    public static DistanceUnit fromValue(String value) {
        if (value == null || value.isBlank()) {
            return KILOMETERS;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "km":
            case "kilometers":
            case "kilometres":
                return KILOMETERS;
            case "mi":
            case "mile":
            case "miles":
                return MILES;
            default:
                throw new IllegalArgumentException("Unknown distance unit: " + value);
        }
    }
}
