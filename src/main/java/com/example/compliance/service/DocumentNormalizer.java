package com.example.compliance.service;

import com.example.compliance.model.NormDoc;
import com.example.compliance.model.RawDoc;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips formatting noise from a procedure document while keeping a character-level map back
 * to the source text, so chunks can be cited by source offset.
 * <p>
 * Rules, applied line by line:
 * <ul>
 *   <li>CRLF, CR and LF are all line breaks</li>
 *   <li>Unicode NFC per base character and its combining marks</li>
 *   <li>invisible format and control characters (soft hyphen, zero-width, BOM) are dropped</li>
 *   <li>runs of spaces and tabs collapse to one space; lines are trimmed</li>
 *   <li>leading list numbering ({@code 1.}, {@code a)}, bullets) is removed; an undotted section
 *       number ({@code 4.2}) only on a short heading line, so a leading quantity stays</li>
 *   <li>blank-line runs become a single paragraph break ({@code "\n\n"})</li>
 *   <li>headings (Markdown {@code #}, ALL CAPS lines, Chapter/Section/Part/Article lines)
 *       become their own paragraph and are recorded as sections</li>
 * </ul>
 */
@Service
public class DocumentNormalizer {

    private static final Pattern MARKDOWN_HEADING = Pattern.compile("#{1,6}\\s+");
    private static final Pattern NUMBERING = Pattern.compile(
            "(?:\\(?(?:\\d{1,3}(?:\\.\\d{1,3})*|[A-Za-z]|[IVXLC]{1,5})[.)]|[-*•·▪◦–])\\s+");
    // "4.2 Escalation" is a section number only on a heading line; "2.5 hours are allowed." is a quantity
    private static final Pattern SECTION_NUMBER = Pattern.compile("\\d{1,3}(?:\\.\\d{1,3})+\\s+(?=\\p{Lu})");
    private static final Pattern KEYWORD_HEADING = Pattern.compile(
            "(?i)(?:chapter|section|part|article|annex|appendix)\\s+[\\w.]+.*");
    private static final int MAX_HEADING_LENGTH = 80;

    public NormDoc normalize(RawDoc doc) {
        String src = doc.text();
        Output out = new Output();
        List<NormDoc.Section> sections = new ArrayList<>();

        boolean pendingBreak = false;
        boolean previousHeading = false;
        int n = src.length();
        int lineStart = 0;
        while (true) {
            int lineEnd = lineStart;
            while (lineEnd < n && src.charAt(lineEnd) != '\n' && src.charAt(lineEnd) != '\r') {
                lineEnd++;
            }

            Output line = cleanLine(src, lineStart, lineEnd);
            if (line.length() == 0) {
                pendingBreak = true;
            } else {
                String lineText = line.text.toString();
                int skip = 0;
                boolean heading = false;
                Matcher md = MARKDOWN_HEADING.matcher(lineText);
                if (md.lookingAt()) {
                    skip = md.end();
                    heading = true;
                }
                Matcher num = NUMBERING.matcher(lineText).region(skip, lineText.length());
                Matcher section = SECTION_NUMBER.matcher(lineText).region(skip, lineText.length());
                if (num.lookingAt()) {
                    skip = num.end();
                } else if (section.lookingAt() && isHeadingShaped(lineText.substring(section.end()))) {
                    skip = section.end();
                    heading = true;
                }
                String content = lineText.substring(skip);
                if (!content.isEmpty()) {
                    heading = heading || looksLikeHeading(content);
                    if (out.length() > 0) {
                        String separator = (pendingBreak || heading || previousHeading) ? "\n\n" : "\n";
                        int at = line.starts.get(skip);
                        for (int k = 0; k < separator.length(); k++) {
                            out.append(separator.charAt(k), at, at);
                        }
                    }
                    if (heading) {
                        sections.add(new NormDoc.Section(content, out.length()));
                    }
                    for (int k = skip; k < line.length(); k++) {
                        out.append(lineText.charAt(k), line.starts.get(k), line.ends.get(k));
                    }
                    pendingBreak = false;
                    previousHeading = heading;
                }
            }

            if (lineEnd >= n) break;
            boolean crlf = src.charAt(lineEnd) == '\r' && lineEnd + 1 < n && src.charAt(lineEnd + 1) == '\n';
            lineStart = lineEnd + (crlf ? 2 : 1);
        }

        return new NormDoc(doc, out.text.toString(), out.starts.toArray(), out.ends.toArray(), sections);
    }

    /** Short line without closing sentence punctuation. */
    private static boolean isHeadingShaped(String content) {
        if (content.isEmpty() || content.length() > MAX_HEADING_LENGTH) return false;
        char last = content.charAt(content.length() - 1);
        return ".!?;:,".indexOf(last) < 0;
    }

    private Output cleanLine(String src, int start, int end) {
        Output line = new Output();
        boolean lastSpace = true;
        int i = start;
        while (i < end) {
            int cp = src.codePointAt(i);
            int len = Character.charCount(cp);
            if (isSpace(cp)) {
                if (!lastSpace) {
                    line.append(' ', i, i + len);
                    lastSpace = true;
                }
                i += len;
                continue;
            }
            if (isNoise(cp)) {
                i += len;
                continue;
            }
            int j = i + len;
            while (j < end) {
                int next = src.codePointAt(j);
                if (!isCombiningMark(next)) break;
                j += Character.charCount(next);
            }
            String composed = Normalizer.normalize(src.substring(i, j), Normalizer.Form.NFC);
            for (int k = 0; k < composed.length(); k++) {
                line.append(composed.charAt(k), i, j);
            }
            lastSpace = false;
            i = j;
        }
        if (line.length() > 0 && line.text.charAt(line.length() - 1) == ' ') {
            line.truncate(line.length() - 1);
        }
        return line;
    }

    static boolean looksLikeHeading(String content) {
        if (content.length() > MAX_HEADING_LENGTH) return false;
        char last = content.charAt(content.length() - 1);
        if (last == '.' || last == ';' || last == ',') return false;
        if (KEYWORD_HEADING.matcher(content).matches()) return true;
        int upper = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (Character.isLowerCase(c)) return false;
            if (Character.isUpperCase(c)) upper++;
        }
        return upper >= 3;
    }

    private static boolean isSpace(int cp) {
        return cp == ' ' || cp == '\t' || Character.isSpaceChar(cp);
    }

    private static boolean isNoise(int cp) {
        int type = Character.getType(cp);
        return cp == 0x00AD || cp == 0xFEFF || (cp >= 0x200B && cp <= 0x200D) || cp == 0x2060
                || type == Character.CONTROL || type == Character.FORMAT;
    }

    private static boolean isCombiningMark(int cp) {
        int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK || type == Character.COMBINING_SPACING_MARK
                || type == Character.ENCLOSING_MARK;
    }

    /** Text under construction with the source range of every character. */
    private static final class Output {
        final StringBuilder text = new StringBuilder();
        final IntBuffer starts = new IntBuffer();
        final IntBuffer ends = new IntBuffer();

        void append(char c, int sourceStart, int sourceEnd) {
            text.append(c);
            starts.add(sourceStart);
            ends.add(sourceEnd);
        }

        int length() {
            return text.length();
        }

        void truncate(int length) {
            text.setLength(length);
            starts.size = length;
            ends.size = length;
        }
    }

    private static final class IntBuffer {
        int[] values = new int[64];
        int size;

        void add(int v) {
            if (size == values.length) {
                values = Arrays.copyOf(values, size * 2);
            }
            values[size++] = v;
        }

        int get(int index) {
            return values[index];
        }

        int[] toArray() {
            return Arrays.copyOf(values, size);
        }
    }
}
