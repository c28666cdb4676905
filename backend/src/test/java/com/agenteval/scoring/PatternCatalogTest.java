package com.agenteval.scoring;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternCatalogTest {

    @Test
    void normalizeGroupsDeclarationsThatDifferOnlyInValues() {
        String first = PatternCatalog.normalize("color: red; font-size: 12px");
        String second = PatternCatalog.normalize("color: blue; font-size: 14px");

        assertEquals(first, second);
        assertEquals("color: value; font-size: value", first);
    }

    @Test
    void normalizeIgnoresWhitespaceTrailingSeparatorAndCase() {
        assertEquals(
                "color: value; font-size: value",
                PatternCatalog.normalize("  COLOR:red;font-size :  12px ; ")
        );
        assertEquals("", PatternCatalog.normalize(null));
    }

    @Test
    void ieHackDetectionCoversFilterZoomAndPropertyPrefixes() {
        assertTrue(PatternCatalog.isIeHack("filter: alpha(opacity=50)"));
        assertTrue(PatternCatalog.isIeHack("zoom: 1"));
        assertTrue(PatternCatalog.isIeHack("*display: inline"));
        assertTrue(PatternCatalog.isIeHack("_height: 1px"));
        assertFalse(PatternCatalog.isIeHack("color: red"));
        assertFalse(PatternCatalog.isIeHack(""));
    }

    @Test
    void dataDrivenTextIsNumericOrSigned() {
        assertTrue(PatternCatalog.isDataDriven("-84.20"));
        assertTrue(PatternCatalog.isDataDriven("$1250"));
        assertTrue(PatternCatalog.isDataDriven("+ gain"));
        assertTrue(PatternCatalog.isDataDriven("Total 42"));
        assertFalse(PatternCatalog.isDataDriven("Account summary"));
        assertFalse(PatternCatalog.isDataDriven(null));
    }

    @Test
    void positioningMatchesLayoutTermsAnywhereInTheStyle() {
        assertTrue(PatternCatalog.isPositioning("position: absolute; top: 4px"));
        assertTrue(PatternCatalog.isPositioning("margin-left: 8px"));
        assertTrue(PatternCatalog.isPositioning("Z-INDEX: 10"));
        assertTrue(PatternCatalog.isPositioning("color: red; border-top: 1px solid"));
        assertTrue(PatternCatalog.isPositioning("text-align: right"));
        assertFalse(PatternCatalog.isPositioning("color: red; font-weight: bold"));
        assertFalse(PatternCatalog.isPositioning(null));
    }

    @Test
    void repeatedRightAlignedStylesAreClassifiedAsPositioning() {
        String markup = """
                <html><body>
                <div style="text-align: right; color: red">x</div>
                <div style="text-align: right; color: red">x</div>
                <div style="text-align: right; color: red">x</div>
                </body></html>
                """;

        StyleAnalysis analysis = new PatternCatalog().analyze(Map.of("index.html", markup));

        assertEquals(3, analysis.positioning());
        assertEquals(0, analysis.repetitive());
    }

    @Test
    void analyzeClassifiesRepetitiveDataDrivenPositioningAndUniqueStyles() {
        String markup = """
                <html><body>
                <div style="border: 1px solid #ccc">Alpha</div>
                <div style="border: 2px dashed #000">Beta</div>
                <div style="border: 3px dotted #fff">Gamma</div>
                <span style="color: red">-84.20</span>
                <p style="position: absolute; top: 12px">Footer</p>
                <p style="font-weight: bold">Only once</p>
                </body></html>
                """;

        StyleAnalysis analysis = new PatternCatalog().analyze(Map.of("index.html", markup));

        assertEquals(6, analysis.totalInlineStyles());
        assertEquals(3, analysis.repetitive());
        assertEquals(1, analysis.dataDriven());
        assertEquals(1, analysis.positioning());
        assertEquals(1, analysis.unique());

        List<PatternGroup> repetitive = analysis.patternsFor(PatternCategory.REPETITIVE);
        assertEquals(1, repetitive.size());
        assertEquals("border: value", repetitive.get(0).signature());
        assertEquals(3, repetitive.get(0).count());
        assertEquals("border: 1px solid #ccc", repetitive.get(0).example());
    }

    @Test
    void analyzeCountsFontTagsStyleBlocksAndIeHacks() {
        String markup = """
                <html><head><style>body { margin: 0; }</style><style>.a { color: red; }</style></head>
                <body>
                <font color="red">Old</font>
                <div style="zoom: 1; color: blue">Hack</div>
                </body></html>
                """;

        StyleAnalysis analysis = new PatternCatalog().analyze(Map.of("page.htm", markup));

        assertEquals(1, analysis.fontTags());
        assertEquals(2, analysis.styleBlocks());
        assertEquals(1, analysis.ieHacks());
        assertEquals(1, analysis.fileResults().get("page.htm").totalInlineStyles());
    }

    @Test
    void analyzeSkipsInjectedElementsAndNonMarkupFiles() {
        String markup = """
                <html><body>
                <div id="globalHeader" style="color: white"><span style="color: red">inside</span></div>
                <div id="metricsPanel"><p style="margin: 0">metrics</p></div>
                <button id="styleToggle" style="display: none">toggle</button>
                <div style="color: green">kept</div>
                </body></html>
                """;
        Map<String, String> files = new LinkedHashMap<>();
        files.put("index.html", markup);
        files.put("styles.css", "div { color: red; }");
        files.put("notes.txt", "<div style=\"color: red\">ignored</div>");

        StyleAnalysis analysis = new PatternCatalog().analyze(files);

        assertEquals(1, analysis.totalInlineStyles());
        assertEquals(1, analysis.unique());
        assertEquals(1, analysis.fileResults().size());
    }

    @Test
    void analyzeAggregatesSignaturesAcrossFiles() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("a.html", "<div style=\"color: red\">One</div>");
        files.put("b.html", "<div style=\"color: blue\">Two</div>");

        StyleAnalysis analysis = new PatternCatalog().analyze(files);

        assertEquals(2, analysis.repetitive());
        assertEquals(0, analysis.unique());
    }

    @Test
    void analyzeOfEmptyInputIsAllZero() {
        StyleAnalysis analysis = new PatternCatalog().analyze(Map.of());

        assertEquals(0, analysis.totalInlineStyles());
        assertEquals(0, analysis.repetitive());
        assertTrue(analysis.patternsFor(PatternCategory.UNIQUE).isEmpty());
    }

    @Test
    void classifyPrefersDataDrivenOverPositioning() {
        StyleOccurrence occurrence = new StyleOccurrence(
                "position: value", "td", "position: relative", "-12.5", true, true, "tr"
        );

        assertEquals(PatternCategory.DATA_DRIVEN, PatternCatalog.classify(occurrence, 5));
    }
}
