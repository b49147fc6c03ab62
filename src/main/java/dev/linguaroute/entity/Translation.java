package dev.linguaroute.entity;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One row of a satellite translation table: the localized fields of an entity in one locale.
 * Immutable, so a cached or shared instance is never observed half-written.
 */
@Value
@Builder(toBuilder = true)
public class Translation {
    Long entityId;
    String locale;
    String name;
    String slug;
    String content;
    LocalDateTime updatedAt;
}
