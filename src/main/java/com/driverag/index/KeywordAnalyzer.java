package com.driverag.index;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

public final class KeywordAnalyzer {
    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "by", "do", "does", "for", "from", "has", "have", "how",
            "i", "in", "is", "it", "its", "of", "on", "or", "our", "that", "the", "their", "this", "to", "was",
            "we", "what", "when", "where", "which", "who", "why", "will", "with", "you", "your");

    private KeywordAnalyzer() {
    }

    public static Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> frequencies = new TreeMap<>();
        for (String term : SPLIT.split(text == null ? "" : text.toLowerCase(Locale.ROOT))) {
            String normalized = normalize(term);
            if (normalized != null) {
                frequencies.merge(normalized, 1, Integer::sum);
            }
        }
        return frequencies;
    }

    public static Set<String> queryTerms(String query) {
        Set<String> terms = new LinkedHashSet<>();
        for (String term : SPLIT.split(query == null ? "" : query.toLowerCase(Locale.ROOT))) {
            String normalized = normalize(term);
            if (normalized != null) {
                terms.add(normalized);
            }
        }
        return terms;
    }

    // sum of 1 + ln(tf) over the distinct query terms present
    public static double score(Set<String> queryTerms, Map<String, Integer> frequencies) {
        double score = 0.0;
        for (String term : queryTerms) {
            Integer tf = frequencies.get(term);
            if (tf != null && tf > 0) {
                score += 1.0 + Math.log(tf);
            }
        }
        return score;
    }

    private static String normalize(String term) {
        if (term.isEmpty() || STOP_WORDS.contains(term)) {
            return null;
        }
        if (term.length() == 1 && !Character.isDigit(term.charAt(0))) {
            return null;
        }
        return stem(term);
    }

    static String stem(String term) {
        if (term.length() > 4 && term.endsWith("ies")) {
            return term.substring(0, term.length() - 3) + "y";
        }
        if (term.length() > 5 && term.endsWith("ing")) {
            return term.substring(0, term.length() - 3);
        }
        if (term.length() > 4 && term.endsWith("ed")) {
            return term.substring(0, term.length() - 2);
        }
        if (term.length() > 4 && (term.endsWith("ches") || term.endsWith("shes") || term.endsWith("sses")
                || term.endsWith("xes"))) {
            return term.substring(0, term.length() - 2);
        }
        if (term.length() > 3 && term.endsWith("s") && !term.endsWith("ss") && !term.endsWith("us")) {
            return term.substring(0, term.length() - 1);
        }
        return term;
    }
}
