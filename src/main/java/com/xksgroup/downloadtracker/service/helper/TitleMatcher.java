package com.xksgroup.downloadtracker.service.helper;

import com.xksgroup.downloadtracker.model.library.LibraryCandidate;
import com.xksgroup.downloadtracker.model.library.ParsedRelease;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Title similarity scoring between a parsed release and library entries.
 * Scores range from 0 to 100.
 */
public final class TitleMatcher {

    private static final Set<String> STOP_WORDS = Set.of("the", "a", "an", "of", "and", "or", "in", "to", "for");

    private static final Map<String, String> ABBREVIATIONS = new LinkedHashMap<>();
    private static final Map<String, String> ROMAN_NUMERALS = new LinkedHashMap<>();

    static {
        ABBREVIATIONS.put("dr", "doctor");
        ABBREVIATIONS.put("mr", "mister");
        ABBREVIATIONS.put("mrs", "missus");
        ABBREVIATIONS.put("st", "saint");

        ROMAN_NUMERALS.put("i", "1");
        ROMAN_NUMERALS.put("ii", "2");
        ROMAN_NUMERALS.put("iii", "3");
        ROMAN_NUMERALS.put("iv", "4");
        ROMAN_NUMERALS.put("v", "5");
        ROMAN_NUMERALS.put("vi", "6");
        ROMAN_NUMERALS.put("vii", "7");
        ROMAN_NUMERALS.put("viii", "8");
        ROMAN_NUMERALS.put("ix", "9");
        ROMAN_NUMERALS.put("x", "10");
    }

    public record ScoredCandidate(LibraryCandidate candidate, int score) {
    }

    private TitleMatcher() {
    }

    /**
     * Highest scoring candidate at or above {@code minScore}. Ties keep the earlier candidate.
     */
    public static Optional<ScoredCandidate> selectBest(ParsedRelease release, List<LibraryCandidate> candidates, int minScore) {
        String wanted = clean(release.title());
        ScoredCandidate best = null;
        for (LibraryCandidate candidate : candidates) {
            int score = score(wanted, clean(candidate.getTitle()), release.year(), candidate.getYear());
            if (score > 0 && (best == null || score > best.score())) {
                best = new ScoredCandidate(candidate, score);
            }
        }
        if (best == null || best.score() < minScore) {
            return Optional.empty();
        }
        return Optional.of(best);
    }

    /**
     * Scores two cleaned titles. Exact match is 100, otherwise word overlap counts
     * for up to 70 with a 20 point bonus when every library word is present.
     * Years adjust the result: same year +30, one apart +10, further apart -50.
     */
    public static int score(String releaseTitle, String libraryTitle, Integer releaseYear, Integer libraryYear) {
        if (releaseTitle == null || libraryTitle == null || releaseTitle.isEmpty() || libraryTitle.isEmpty()) {
            return 0;
        }

        int score;
        if (releaseTitle.equals(libraryTitle)) {
            score = 100;
        } else {
            Set<String> releaseWords = words(releaseTitle);
            Set<String> libraryWords = words(libraryTitle);
            if (releaseWords.isEmpty() || libraryWords.isEmpty()) {
                return 0;
            }

            long common = releaseWords.stream().filter(libraryWords::contains).count();
            double overlap = (double) common / Math.max(releaseWords.size(), libraryWords.size());
            if (overlap < 0.5) {
                return 0;
            }

            score = (int) (overlap * 70);
            if (releaseWords.containsAll(libraryWords)) {
                score += 20;
            }
        }

        if (releaseYear != null && libraryYear != null) {
            int distance = Math.abs(releaseYear - libraryYear);
            if (distance == 0) {
                score += 30;
            } else if (distance == 1) {
                score += 10;
            } else {
                score -= 50;
            }
        }

        return Math.max(0, Math.min(100, score));
    }

    /**
     * Lower-cased, punctuation-free form with common abbreviations and roman numerals expanded.
     */
    public static String clean(String title) {
        if (title == null) {
            return "";
        }
        String cleaned = title.replaceAll("[._-]", " ")
                .replaceAll("[^\\p{L}\\p{N}\\s]", "")
                .replaceAll("\\s+", " ")
                .trim()
                .toLowerCase(Locale.ROOT);
        if (cleaned.isEmpty()) {
            return cleaned;
        }
        return Arrays.stream(cleaned.split(" "))
                .map(word -> ABBREVIATIONS.getOrDefault(word, word))
                .map(word -> ROMAN_NUMERALS.getOrDefault(word, word))
                .collect(Collectors.joining(" "));
    }

    private static Set<String> words(String title) {
        return Arrays.stream(title.split(" "))
                .filter(word -> !word.isEmpty() && !STOP_WORDS.contains(word))
                .collect(Collectors.toSet());
    }
}
