package com.majordome.task;

/**
 * A household member who can perform tasks.
 *
 * @param id     Member identifier
 * @param name   Unique display name
 * @param active Whether the member still takes part in the household
 */
public record Member(
        long id,
        String name,
        boolean active
) {
}
