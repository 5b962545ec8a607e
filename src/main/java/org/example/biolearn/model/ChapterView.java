package org.example.biolearn.model;

import java.util.List;
import java.util.Map;

public record ChapterView(
        String id,
        String slug,
        String title,
        String summary,
        List<String> objectives,
        List<Map<String, String>> sections
) {
}
