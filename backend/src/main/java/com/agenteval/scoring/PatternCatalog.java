package com.agenteval.scoring;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Frequency analysis of inline style declarations across a set of markup files.
 * <p>
 * An instance carries scratch state for a single {@link #analyze(Map)} call and is not thread-safe; callers
 * create a fresh catalog per analysis.
 */
public final class PatternCatalog {

    static final String VALUE_PLACEHOLDER = "value";

    private static final Set<String> INJECTED_ELEMENT_IDS = Set.of(
            "globalHeader",
            "metricsPanel",
            "metricsContent",
            "styleToggle",
            "metricsToggle"
    );
    private static final Set<String> INJECTED_ANCESTOR_IDS = Set.of("globalHeader", "metricsPanel");

    // Substring terms: "right" also matches text-align: right, "bottom" matches border-bottom.
    private static final List<String> POSITIONING_TERMS = List.of(
            "position",
            "top",
            "left",
            "right",
            "bottom",
            "margin",
            "padding",
            "float",
            "clear",
            "transform",
            "z-index"
    );

    private static final Pattern NUMERIC_TEXT = Pattern.compile("-?\\$?\\d+\\.?\\d*");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern IE_STAR_HACK = Pattern.compile("\\*[a-zA-Z]");
    private static final Pattern IE_UNDERSCORE_HACK = Pattern.compile("_[a-zA-Z]");

    private final Map<String, List<StyleOccurrence>> styleFrequency = new LinkedHashMap<>();

    public StyleAnalysis analyze(Map<String, String> files) {
        styleFrequency.clear();

        int totalInlineStyles = 0;
        int ieHacks = 0;
        int fontTags = 0;
        int styleBlocks = 0;
        Map<String, FileAnalysis> fileResults = new LinkedHashMap<>();

        if (files != null) {
            for (Map.Entry<String, String> file : files.entrySet()) {
                if (!isMarkupFile(file.getKey())) {
                    continue;
                }
                FileAnalysis fileAnalysis = analyzeMarkup(file.getValue());
                fileResults.put(file.getKey(), fileAnalysis);
                totalInlineStyles += fileAnalysis.totalInlineStyles();
                ieHacks += fileAnalysis.ieHacks();
                fontTags += fileAnalysis.fontTags();
                styleBlocks += fileAnalysis.styleBlocks();
            }
        }

        Map<PatternCategory, Integer> counts = new EnumMap<>(PatternCategory.class);
        Map<PatternCategory, List<PatternGroup>> groups = new EnumMap<>(PatternCategory.class);
        for (PatternCategory category : PatternCategory.values()) {
            counts.put(category, 0);
            groups.put(category, new ArrayList<>());
        }

        for (Map.Entry<String, List<StyleOccurrence>> entry : styleFrequency.entrySet()) {
            List<StyleOccurrence> occurrences = entry.getValue();
            StyleOccurrence first = occurrences.get(0);
            PatternCategory category = classify(first, occurrences.size());
            // Unique signatures count once; every other category counts each occurrence.
            int weight = category == PatternCategory.UNIQUE ? 1 : occurrences.size();
            counts.merge(category, weight, Integer::sum);
            groups.get(category).add(new PatternGroup(entry.getKey(), occurrences.size(), first.style()));
        }

        Map<String, List<PatternGroup>> patterns = new LinkedHashMap<>();
        for (Map.Entry<PatternCategory, List<PatternGroup>> entry : groups.entrySet()) {
            List<PatternGroup> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(Comparator.comparingInt(PatternGroup::count).reversed());
            patterns.put(entry.getKey().jsonName(), Collections.unmodifiableList(sorted));
        }

        return new StyleAnalysis(
                totalInlineStyles,
                counts.get(PatternCategory.REPETITIVE),
                counts.get(PatternCategory.DATA_DRIVEN),
                counts.get(PatternCategory.POSITIONING),
                counts.get(PatternCategory.UNIQUE),
                ieHacks,
                fontTags,
                styleBlocks,
                Collections.unmodifiableMap(patterns),
                Collections.unmodifiableMap(fileResults)
        );
    }

    private FileAnalysis analyzeMarkup(String content) {
        Document document = Jsoup.parse(content == null ? "" : content);

        int inlineStyles = 0;
        int ieHacks = 0;
        for (Element element : document.select("[style]")) {
            if (isInjectedElement(element)) {
                continue;
            }
            String style = element.attr("style");
            inlineStyles++;
            if (isIeHack(style)) {
                ieHacks++;
            }
            String signature = normalize(style);
            styleFrequency.computeIfAbsent(signature, ignored -> new ArrayList<>())
                    .add(occurrenceOf(element, signature, style));
        }

        return new FileAnalysis(
                inlineStyles,
                ieHacks,
                document.select("font").size(),
                document.select("style").size()
        );
    }

    static PatternCategory classify(StyleOccurrence first, int occurrenceCount) {
        if (isDataDriven(first.text())) {
            return PatternCategory.DATA_DRIVEN;
        }
        if (isPositioning(first.style())) {
            return PatternCategory.POSITIONING;
        }
        return occurrenceCount > 1 ? PatternCategory.REPETITIVE : PatternCategory.UNIQUE;
    }

    /**
     * Reduces a style attribute to its property skeleton: {@code "color: red;font-size:12px"} becomes
     * {@code "color: value; font-size: value"}.
     */
    public static String normalize(String styleText) {
        if (styleText == null) {
            return "";
        }
        List<String> declarations = new ArrayList<>();
        for (String declaration : styleText.split(";")) {
            String trimmed = declaration.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int separator = trimmed.indexOf(':');
            if (separator < 0) {
                declarations.add(trimmed);
            } else {
                declarations.add(trimmed.substring(0, separator).trim() + ": " + VALUE_PLACEHOLDER);
            }
        }
        return String.join("; ", declarations).trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isIeHack(String styleText) {
        if (styleText == null || styleText.isEmpty()) {
            return false;
        }
        return styleText.contains("filter:")
                || styleText.contains("zoom:")
                || IE_STAR_HACK.matcher(styleText).find()
                || IE_UNDERSCORE_HACK.matcher(styleText).find();
    }

    public static boolean isDataDriven(String text) {
        String trimmed = text == null ? "" : text.trim();
        return NUMERIC_TEXT.matcher(trimmed).find() || trimmed.startsWith("-") || trimmed.startsWith("+");
    }

    public static boolean isPositioning(String styleText) {
        if (styleText == null) {
            return false;
        }
        String lower = styleText.toLowerCase(Locale.ROOT);
        for (String term : POSITIONING_TERMS) {
            if (lower.contains(term)) {
                return true;
            }
        }
        return false;
    }

    static boolean isMarkupFile(String path) {
        if (path == null) {
            return false;
        }
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.endsWith(".html") || lower.endsWith(".htm");
    }

    private static boolean isInjectedElement(Element element) {
        if (INJECTED_ELEMENT_IDS.contains(element.id())) {
            return true;
        }
        for (Element ancestor : element.parents()) {
            if (INJECTED_ANCESTOR_IDS.contains(ancestor.id())) {
                return true;
            }
        }
        return false;
    }

    private static StyleOccurrence occurrenceOf(Element element, String signature, String style) {
        Element parent = element.parent();
        String text = element.text().trim();
        String parentTag = parent == null ? null : parent.normalName();
        return new StyleOccurrence(
                signature,
                element.normalName(),
                style,
                text,
                "td".equals(parentTag) || "th".equals(parentTag),
                DIGIT.matcher(text).find(),
                parentTag
        );
    }
}
