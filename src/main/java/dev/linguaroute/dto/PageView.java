package dev.linguaroute.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response for static localized pages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageView {
    private String route;
    private String locale;
    private String path;
    private Map<String, String> alternates;
}
