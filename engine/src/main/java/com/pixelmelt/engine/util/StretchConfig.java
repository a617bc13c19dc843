package com.pixelmelt.engine.util;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StretchConfig {
    public int defaultIntensity = 13;
    public String defaultDirection = "right";
    // fraction of the shorter side used as the default starting pixel
    public double startingPixelFraction = 0.5;

    public StretchConfig() {
    }

    public StretchConfig(int defaultIntensity, String defaultDirection, double startingPixelFraction) {
        this.defaultIntensity = defaultIntensity;
        this.defaultDirection = defaultDirection;
        this.startingPixelFraction = startingPixelFraction;
    }

    public static StretchConfig defaults() {
        return new StretchConfig(13, "right", 0.5);
    }

    public StretchConfig copy() {
        return new StretchConfig(this.defaultIntensity, this.defaultDirection, this.startingPixelFraction);
    }
}
