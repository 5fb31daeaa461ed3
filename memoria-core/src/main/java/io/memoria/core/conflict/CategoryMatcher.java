package io.memoria.core.conflict;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decides whether a memory belongs to one of the conflict-prone categories, either by its
 * type or by keywords in its content.
 */
public final class CategoryMatcher {
    private static final Map<String, List<String>> CATEGORY_KEYWORDS = buildKeywords();

    private CategoryMatcher() {
    }

    public static boolean matches(String type, String content, List<String> categories) {
        String lowerType = type == null ? "" : type.toLowerCase(Locale.ROOT);
        String lowerContent = content == null ? "" : content.toLowerCase(Locale.ROOT);

        if (categories.contains(lowerType)) {
            return true;
        }
        for (String category : categories) {
            for (String keyword : CATEGORY_KEYWORDS.getOrDefault(category, List.of())) {
                if (lowerContent.contains(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Map<String, List<String>> buildKeywords() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("location", List.of("live", "lives", "living", "moved", "from", "city", "country", "address", "home"));
        keywords.put("job", List.of("work", "works", "job", "career", "company", "employed", "position", "role", "occupation"));
        keywords.put("relationship", List.of(
            "married", "wife", "husband", "partner", "girlfriend", "boyfriend", "dating", "single", "divorced"
        ));
        keywords.put("name", List.of("name", "called", "known as", "nickname"));
        keywords.put("preference", List.of("like", "love", "hate", "prefer", "favorite", "dislike", "enjoy"));
        keywords.put("personal_info", List.of("age", "birthday", "born", "years old", "height", "weight"));
        return Map.copyOf(keywords);
    }
}
