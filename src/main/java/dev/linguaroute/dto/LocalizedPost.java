package dev.linguaroute.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocalizedPost {
    private Long id;
    private Long categoryId;
    private String locale;
    private boolean fallback;
    private String title;
    private String slug;
    private String content;
    private String originalLocale;
    private LocalDateTime publishedAt;
}
