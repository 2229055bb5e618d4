package com.majordome.weather;

/**
 * Kinds of weather advisories.
 */
public enum AlertCode {
    FROST,
    WIND,
    HEAVY_RAIN,
    HEAT
}
