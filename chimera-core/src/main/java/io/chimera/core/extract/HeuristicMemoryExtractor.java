package io.chimera.core.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import static java.util.Map.entry;

public final class HeuristicMemoryExtractor implements MemoryExtractor {
    private static final List<String> SAVE_KEYWORDS = List.of("remember", "save", "store", "keep", "note");

    private static final List<String> HIGH_KEYWORDS = List.of(
        "prefer", "like", "love", "hate", "dislike", "always", "never",
        "important", "critical", "must", "required", "need", "want",
        "remember", "note", "save", "store", "keep in mind"
    );

    private static final List<String> MEDIUM_KEYWORDS = List.of(
        "usually", "often", "sometimes", "typically", "generally",
        "working on", "building", "creating", "developing",
        "use", "using", "utilize", "employ"
    );

    private static final List<String> SCORE_BOOST_KEYWORDS = List.of("remember", "save", "important");

    // unanchored: "Kiwi is great" matches through its trailing "i"
    private static final List<Pattern> FACT_PATTERNS = List.of(
        Pattern.compile("(?:I|we|user|team)\\s+(?:am|is|are)\\s+(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?:I|we|user|team)\\s+(?:prefer|like|love|use|need)\\s+(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?:my|our|the)\\s+(?:name|email|phone|address|company)\\s+(?:is|are)\\s+(.+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?:I|we)\\s+(?:work|working|build|building|develop|developing)\\s+(?:on|with|in)\\s+(.+)", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Map.Entry<String, List<String>>> TAG_RULES = List.of(
        entry("preference", List.of("prefer", "like", "love", "favorite")),
        entry("project", List.of("building", "working", "developing", "creating")),
        entry("programming", List.of("python", "javascript", "java", "code", "programming")),
        entry("design", List.of("design", "ui", "ux", "interface", "layout")),
        entry("backend", List.of("api", "backend", "server", "database")),
        entry("frontend", List.of("frontend", "react", "vue", "angular")),
        entry("team", List.of("team", "colleague", "member", "collaborate")),
        entry("important", List.of("important", "critical", "must", "required"))
    );

    private static final String DEFAULT_TAG = "general";
    private static final int MIN_FACT_LENGTH = 10;
    private static final double BASE_SCORE = 0.5;
    private static final double KEYWORD_INCREMENT = 0.1;
    private static final double SAVE_BONUS = 0.2;
    private static final double PATTERN_BONUS = 0.1;
    private static final double LONG_TEXT_BONUS = 0.1;
    private static final double MEDIUM_TEXT_BONUS = 0.05;

    @Override
    public Importance classify(String userMessage) {
        String input = userMessage == null ? "" : userMessage;
        String lowered = input.toLowerCase(Locale.ROOT);

        if (containsAny(lowered, SAVE_KEYWORDS) || containsAny(lowered, HIGH_KEYWORDS)) {
            return Importance.HIGH;
        }
        if (containsAny(lowered, MEDIUM_KEYWORDS) || matchesAnyPattern(input)) {
            return Importance.MEDIUM;
        }

        int words = wordCount(input);
        if (words > 10) {
            return Importance.MEDIUM;
        }
        if (words > 3) {
            return Importance.LOW;
        }
        return Importance.NONE;
    }

    @Override
    public List<ExtractionCandidate> extractFacts(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<ExtractionCandidate> candidates = new ArrayList<>();
        for (Pattern pattern : FACT_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String fact = matcher.group().trim();
                if (fact.length() > MIN_FACT_LENGTH) {
                    candidates.add(new ExtractionCandidate(fact, Confidence.MEDIUM, Provenance.PATTERN));
                }
            }
        }

        for (String part : text.split("\\.")) {
            String sentence = part.trim();
            if (sentence.isEmpty()) {
                continue;
            }
            if (containsAny(sentence.toLowerCase(Locale.ROOT), HIGH_KEYWORDS)) {
                candidates.add(new ExtractionCandidate(sentence, Confidence.HIGH, Provenance.KEYWORD));
            }
        }
        return List.copyOf(candidates);
    }

    @Override
    public List<String> generateTags(String text) {
        String lowered = text == null ? "" : text.toLowerCase(Locale.ROOT);
        List<String> tags = new ArrayList<>();
        for (Map.Entry<String, List<String>> rule : TAG_RULES) {
            if (containsAny(lowered, rule.getValue())) {
                tags.add(rule.getKey());
            }
        }
        if (tags.isEmpty()) {
            tags.add(DEFAULT_TAG);
        }
        return List.copyOf(tags);
    }

    @Override
    public double importanceScore(String text) {
        String input = text == null ? "" : text;
        String lowered = input.toLowerCase(Locale.ROOT);

        double score = BASE_SCORE;
        for (String keyword : HIGH_KEYWORDS) {
            if (lowered.contains(keyword)) {
                score += KEYWORD_INCREMENT;
            }
        }
        if (containsAny(lowered, SCORE_BOOST_KEYWORDS)) {
            score += SAVE_BONUS;
        }
        if (matchesAnyPattern(input)) {
            score += PATTERN_BONUS;
        }

        int words = wordCount(input);
        if (words > 50) {
            score += LONG_TEXT_BONUS;
        } else if (words > 20) {
            score += MEDIUM_TEXT_BONUS;
        }
        return Math.min(score, 1.0);
    }

    private boolean containsAny(String lowered, List<String> keywords) {
        for (String keyword : keywords) {
            if (lowered.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesAnyPattern(String input) {
        for (Pattern pattern : FACT_PATTERNS) {
            if (pattern.matcher(input).find()) {
                return true;
            }
        }
        return false;
    }

    private int wordCount(String input) {
        String trimmed = input.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return trimmed.split("\\s+").length;
    }
}
