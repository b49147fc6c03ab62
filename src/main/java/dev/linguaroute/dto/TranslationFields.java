package dev.linguaroute.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Localized fields written for one (entity, locale) pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslationFields {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    @NotBlank(message = "Slug is required")
    @Size(max = 255, message = "Slug must be at most 255 characters")
    @Pattern(regexp = "^[a-z0-9]+(?:-[a-z0-9]+)*$", message = "Slug must be lowercase words separated by hyphens")
    private String slug;

    private String content;

    public static TranslationFields of(String name, String slug) {
        return new TranslationFields(name, slug, null);
    }

    public static TranslationFields of(String name, String slug, String content) {
        return new TranslationFields(name, slug, content);
    }
}
