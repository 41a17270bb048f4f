package com.example.compliance.model;

import java.util.List;

/**
 * Normalized document text with a map back to the source text.
 * Character {@code i} of {@code text} comes from source range
 * {@code [sourceStarts[i], sourceEnds[i])}.
 */
public record NormDoc(
        RawDoc source,
        String text,
        int[] sourceStarts,
        int[] sourceEnds,
        List<Section> sections
) {

    /** A detected heading and the normalized offset it starts at. */
    public record Section(String title, int offset) {
    }

    public NormDoc {
        if (sourceStarts.length != text.length() || sourceEnds.length != text.length()) {
            throw new IllegalArgumentException("Offset map does not match normalized text length");
        }
        sections = List.copyOf(sections);
    }

    /** Source offset of the normalized character at {@code index}. */
    public int sourceStart(int index) {
        return sourceStarts[index];
    }

    /** Source offset just after the normalized character at {@code index}. */
    public int sourceEnd(int index) {
        return sourceEnds[index];
    }

    /** Title of the last section starting at or before {@code offset}, or null. */
    public String sectionAt(int offset) {
        String title = null;
        for (Section s : sections) {
            if (s.offset() > offset) break;
            title = s.title();
        }
        return title;
    }
}
