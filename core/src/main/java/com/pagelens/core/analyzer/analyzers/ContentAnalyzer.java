package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.Severity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * 본문 품질 점검: 분량(thin content), 가독성(Flesch-Kincaid 학년 수준),
 * 키워드 밀도 상한/하한, 문단 길이, 문장 중복.
 *
 * <p>밀도는 0~1 비율로 받는다(meta 분석기와 같은 단위).
 */
public final class ContentAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "content";

    private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}']+");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final int MIN_WORDS_FOR_DENSITY = 50;
    private static final int MIN_SENTENCES_FOR_DUPLICATES = 5;

    static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "if", "then", "of", "at", "by", "for", "with", "about",
            "to", "from", "in", "on", "into", "over", "under", "is", "are", "was", "were", "be", "been",
            "being", "have", "has", "had", "do", "does", "did", "this", "that", "these", "those", "it",
            "its", "as", "not", "no", "so", "than", "too", "very", "can", "will", "just", "you", "your",
            "we", "our", "they", "their", "he", "she", "his", "her", "them", "what", "which", "who",
            "when", "where", "how", "all", "any", "each", "more", "most", "some", "such", "only", "own",
            "same", "other", "also", "there", "here");

    private final int minWordCount;
    private final double minKeywordDensity;
    private final double maxKeywordDensity;
    private final double minGradeLevel;
    private final double maxGradeLevel;
    private final int maxParagraphWords;
    private final double maxDuplicateRatio;
    private final List<String> targetKeywords;
    private final Set<String> stopWords;

    public ContentAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.minWordCount = config.getInt("min_word_count", 300);
        this.minKeywordDensity = config.getDouble("min_keyword_density", 0.005);
        this.maxKeywordDensity = config.getDouble("max_keyword_density", 0.025);
        this.minGradeLevel = config.getDouble("min_grade_level", 6.0);
        this.maxGradeLevel = config.getDouble("max_grade_level", 12.0);
        this.maxParagraphWords = config.getInt("max_paragraph_words", 150);
        this.maxDuplicateRatio = config.getDouble("max_duplicate_ratio", 0.2);
        this.targetKeywords = config.getStringList("target_keywords", List.of());
        Set<String> sw = new HashSet<>(STOP_WORDS);
        for (String w : config.getStringList("stop_words", List.of())) sw.add(w.trim().toLowerCase(Locale.ROOT));
        this.stopWords = Set.copyOf(sw);

        if (minWordCount < 0) throw new IllegalArgumentException("min_word_count must be >= 0");
        if (minKeywordDensity < 0 || maxKeywordDensity <= 0 || maxKeywordDensity > 1) {
            throw new IllegalArgumentException("keyword densities must be in [0, 1]");
        }
        if (minKeywordDensity > maxKeywordDensity) {
            throw new IllegalArgumentException("min_keyword_density must be <= max_keyword_density");
        }
        if (minGradeLevel > maxGradeLevel) throw new IllegalArgumentException("min_grade_level must be <= max_grade_level");
        if (maxParagraphWords <= 0) throw new IllegalArgumentException("max_paragraph_words must be > 0");
        if (maxDuplicateRatio < 0 || maxDuplicateRatio > 1) throw new IllegalArgumentException("max_duplicate_ratio must be in [0, 1]");
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        List<String> words = words(doc.getText());
        if (words.isEmpty()) {
            out.add("CONTENT_EMPTY", Severity.HIGH, "Page has no readable text content",
                    "Add meaningful body text describing the page topic.");
            return;
        }
        if (words.size() < minWordCount) {
            out.add("THIN_CONTENT", Severity.MEDIUM,
                    "Content has " + words.size() + " words (minimum " + minWordCount + ")",
                    "Expand the page to at least " + minWordCount + " words of useful content.");
        }

        List<String> sentences = sentences(doc);
        readability(sentences, words, out);
        keywordStuffing(words, out);
        targetKeywords(words, out);
        paragraphs(doc.getParagraphs(), out);
        duplicates(sentences, out);
    }

    private void readability(List<String> sentences, List<String> words, Findings out) {
        if (sentences.isEmpty()) return;
        double grade = gradeLevel(sentences.size(), words);
        if (grade > maxGradeLevel) {
            out.add("READABILITY", Severity.LOW,
                    String.format(Locale.ROOT, "Reading grade level %.1f is above %.1f", grade, maxGradeLevel),
                    "Use shorter sentences and simpler words.");
        } else if (grade < minGradeLevel && words.size() >= minWordCount) {
            out.add("READABILITY", Severity.INFO,
                    String.format(Locale.ROOT, "Reading grade level %.1f is below %.1f", grade, minGradeLevel),
                    "Add more depth while keeping the text clear.");
        }
    }

    private void keywordStuffing(List<String> words, Findings out) {
        if (words.size() < MIN_WORDS_FOR_DENSITY) return; // 본문이 짧으면 밀도가 무의미
        Map<String, Integer> freq = new HashMap<>();
        int total = 0;
        for (String w : words) {
            if (stopWords.contains(w)) continue;
            total++;
            if (w.length() > 3) freq.merge(w, 1, Integer::sum);
        }
        if (total == 0) return;
        // 밀도 내림차순, 같으면 단어순
        Map<String, Double> stuffed = new TreeMap<>();
        for (Map.Entry<String, Integer> e : freq.entrySet()) {
            double density = (double) e.getValue() / total;
            if (e.getValue() > 1 && density > maxKeywordDensity) stuffed.put(e.getKey(), density);
        }
        stuffed.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .forEach(e -> out.add("KEYWORD_DENSITY", Severity.MEDIUM,
                        String.format(Locale.ROOT, "Word '%s' density %.1f%% exceeds %.1f%%",
                                e.getKey(), e.getValue() * 100, maxKeywordDensity * 100),
                        "Use synonyms and write naturally to avoid keyword stuffing."));
    }

    private void targetKeywords(List<String> words, Findings out) {
        if (targetKeywords.isEmpty()) return;
        String joined = " " + String.join(" ", words) + " ";
        List<String> missing = new ArrayList<>();
        Map<String, Double> sparse = new LinkedHashMap<>();
        for (String k : targetKeywords) {
            String needle = " " + String.join(" ", words(k)) + " ";
            if (needle.isBlank()) continue;
            int count = 0;
            for (int i = joined.indexOf(needle); i >= 0; i = joined.indexOf(needle, i + 1)) count++;
            double density = (double) count / words.size();
            if (count == 0) missing.add(k);
            else if (density < minKeywordDensity) sparse.put(k, density);
        }
        if (!missing.isEmpty()) {
            out.add("KEYWORD_MISSING", Severity.MEDIUM, "Target keywords not found in content",
                    String.join(", ", missing), "Mention each target keyword in the body text.");
        }
        for (Map.Entry<String, Double> e : sparse.entrySet()) {
            out.add("KEYWORD_DENSITY", Severity.LOW,
                    String.format(Locale.ROOT, "Keyword '%s' density %.2f%% is below %.2f%%",
                            e.getKey(), e.getValue() * 100, minKeywordDensity * 100),
                    "Use the keyword a few more times where it fits.");
        }
    }

    private void paragraphs(List<String> paragraphs, Findings out) {
        int longOnes = 0;
        String first = null;
        for (String p : paragraphs) {
            if (words(p).size() > maxParagraphWords) {
                longOnes++;
                if (first == null) first = p;
            }
        }
        if (longOnes > 0) {
            out.add("PARAGRAPH_LENGTH", Severity.LOW,
                    longOnes + " paragraph(s) longer than " + maxParagraphWords + " words", elide(first, 80),
                    "Break long paragraphs into shorter ones.");
        }
    }

    private void duplicates(List<String> sentences, Findings out) {
        if (sentences.size() < MIN_SENTENCES_FOR_DUPLICATES) return;
        Map<String, Integer> counts = new HashMap<>();
        for (String s : sentences) counts.merge(s.toLowerCase(Locale.ROOT), 1, Integer::sum);
        int dup = 0;
        for (int c : counts.values()) if (c > 1) dup += c - 1;
        double ratio = (double) dup / sentences.size();
        if (ratio > maxDuplicateRatio) {
            out.add("DUPLICATE_CONTENT", Severity.LOW,
                    String.format(Locale.ROOT, "%.0f%% of sentences are repeated", ratio * 100),
                    "Remove repeated boilerplate sentences.");
        }
    }

    private List<String> sentences(ParsedDocument doc) {
        List<String> blocks = doc.getParagraphs().isEmpty() ? List.of(doc.getText()) : doc.getParagraphs();
        List<String> result = new ArrayList<>();
        for (String b : blocks) {
            for (String s : SENTENCE_END.split(b.trim())) {
                if (!words(s).isEmpty()) result.add(s.trim());
            }
        }
        return result;
    }

    /** 소문자 단어 목록(한 글자 제외) */
    static List<String> words(String text) {
        List<String> result = new ArrayList<>();
        if (text == null) return result;
        for (String w : WORD_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            String t = w.replaceAll("^'+|'+$", "");
            if (t.length() > 1) result.add(t);
        }
        return result;
    }

    /** Flesch-Kincaid 학년 수준 */
    static double gradeLevel(int sentences, List<String> words) {
        if (sentences == 0 || words.isEmpty()) return 0.0;
        int syllables = 0;
        for (String w : words) syllables += syllables(w);
        double g = 0.39 * ((double) words.size() / sentences) + 11.8 * ((double) syllables / words.size()) - 15.59;
        return Math.round(g * 100) / 100.0;
    }

    static int syllables(String word) {
        String w = word.toLowerCase(Locale.ROOT);
        int count = 0;
        boolean onVowel = false;
        for (int i = 0; i < w.length(); i++) {
            boolean vowel = "aeiouy".indexOf(w.charAt(i)) >= 0;
            if (vowel && !onVowel) count++;
            onVowel = vowel;
        }
        if (w.endsWith("e")) count--;
        if (w.endsWith("le") && w.length() > 2) count++;
        return Math.max(count, 1);
    }
}
