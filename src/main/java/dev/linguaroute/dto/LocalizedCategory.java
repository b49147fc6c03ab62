package dev.linguaroute.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Category with its fields in the served locale. Localized fields are null when
 * the category has no translation anywhere along the fallback chain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocalizedCategory {
    private Long id;
    private String locale;
    private boolean fallback;
    private String name;
    private String slug;
    private String originalLocale;
}
