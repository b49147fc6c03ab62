package dev.linguaroute.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryView {
    private String route;
    private String locale;
    private LocalizedCategory category;
    private List<LocalizedPost> posts;
    private Map<String, String> alternates;
}
