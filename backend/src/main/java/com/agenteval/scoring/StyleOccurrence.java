package com.agenteval.scoring;

/**
 * One inline style attribute seen during a single analysis.
 */
public record StyleOccurrence(
        String signature,
        String tag,
        String style,
        String text,
        boolean inTable,
        boolean numericContent,
        String parentTag
) {
    public StyleOccurrence {
        style = style == null ? "" : style;
        text = text == null ? "" : text;
    }
}
