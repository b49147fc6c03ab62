package dev.linguaroute.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostView {
    private String route;
    private String locale;
    private LocalizedPost post;
    private LocalizedCategory category;
    private Map<String, String> alternates;
}
