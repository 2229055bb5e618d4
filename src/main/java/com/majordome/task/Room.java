package com.majordome.task;

/**
 * A room of the household. Descriptive only; rooms play no part in scoring.
 *
 * @param id        Room identifier
 * @param name      Unique room name
 * @param areaM2    Floor area in square metres, may be null
 * @param floor     Floor label, may be null
 * @param exposure  Sun exposure, may be null
 * @param floorType Floor covering, may be null
 */
public record Room(
        long id,
        String name,
        Integer areaM2,
        String floor,
        String exposure,
        String floorType
) {
}
