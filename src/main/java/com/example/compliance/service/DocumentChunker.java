package com.example.compliance.service;

import com.example.compliance.model.NormDoc;
import com.example.compliance.model.ProcedureChunk;
import org.springframework.ai.tokenizer.JTokkitTokenCountEstimator;
import org.springframework.ai.tokenizer.TokenCountEstimator;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a normalized document into retrievable chunks of at most {@code maxTokens} tokens.
 * <p>
 * Paragraphs are packed greedily; a paragraph over budget is split into sentences, a sentence
 * over budget into words, and a single word over budget into character windows. A chunk never
 * spans a section heading, so each chunk carries one section label.
 */
@Service
public class DocumentChunker {

    private final TokenCountEstimator tokenCounter;

    public DocumentChunker() {
        this(new JTokkitTokenCountEstimator());
    }

    public DocumentChunker(TokenCountEstimator tokenCounter) {
        this.tokenCounter = tokenCounter;
    }

    /**
     * @param firstOrdinal corpus ordinal of the first chunk produced
     */
    public List<ProcedureChunk> chunk(NormDoc doc, int maxTokens, int firstOrdinal) {
        String text = doc.text();
        Set<Integer> sectionStarts = new HashSet<>();
        doc.sections().forEach(s -> sectionStarts.add(s.offset()));

        List<Span> units = new ArrayList<>();
        for (Span paragraph : paragraphs(text)) {
            if (tokens(text, paragraph) <= maxTokens) {
                units.add(paragraph);
                continue;
            }
            for (Span sentence : sentences(text, paragraph)) {
                if (tokens(text, sentence) <= maxTokens) {
                    units.add(sentence);
                } else {
                    units.addAll(hardSplit(text, sentence, maxTokens));
                }
            }
        }

        List<Span> packed = new ArrayList<>();
        Span current = null;
        for (Span unit : units) {
            if (current == null) {
                current = unit;
                continue;
            }
            Span merged = new Span(current.start, unit.end);
            if (!sectionStarts.contains(unit.start) && tokens(text, merged) <= maxTokens) {
                current = merged;
            } else {
                packed.add(current);
                current = unit;
            }
        }
        if (current != null) {
            packed.add(current);
        }

        String idPrefix = Hashes.sha256(doc.source().path() + "\u001f" + doc.source().contentHash()).substring(0, 16);
        List<ProcedureChunk> chunks = new ArrayList<>(packed.size());
        for (int i = 0; i < packed.size(); i++) {
            Span span = packed.get(i);
            String chunkText = text.substring(span.start, span.end);
            chunks.add(new ProcedureChunk(
                    "%s-%04d".formatted(idPrefix, i),
                    firstOrdinal + i,
                    doc.source().path(),
                    doc.source().contentHash(),
                    chunkText,
                    Hashes.sha256(chunkText),
                    doc.sourceStart(span.start),
                    doc.sourceEnd(span.end - 1),
                    doc.sectionAt(span.start),
                    tokenCounter.estimate(chunkText)));
        }
        return chunks;
    }

    int tokens(String text, Span span) {
        return tokenCounter.estimate(text.substring(span.start, span.end));
    }

    private static List<Span> paragraphs(String text) {
        List<Span> spans = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int br = text.indexOf("\n\n", start);
            int end = br < 0 ? text.length() : br;
            addTrimmed(spans, text, start, end);
            start = br < 0 ? text.length() : br + 2;
        }
        return spans;
    }

    private static List<Span> sentences(String text, Span paragraph) {
        List<Span> spans = new ArrayList<>();
        int start = paragraph.start;
        for (int i = paragraph.start; i < paragraph.end; i++) {
            char c = text.charAt(i);
            boolean boundary = c == '\n'
                    || c == '。' || c == '！' || c == '？'
                    || ((c == '.' || c == '!' || c == '?')
                    && (i + 1 == paragraph.end || Character.isWhitespace(text.charAt(i + 1))));
            if (boundary) {
                addTrimmed(spans, text, start, i + 1);
                start = i + 1;
            }
        }
        addTrimmed(spans, text, start, paragraph.end);
        return spans;
    }

    private List<Span> hardSplit(String text, Span sentence, int maxTokens) {
        List<Span> words = new ArrayList<>();
        int start = sentence.start;
        for (int i = sentence.start; i <= sentence.end; i++) {
            if (i == sentence.end || Character.isWhitespace(text.charAt(i))) {
                addTrimmed(words, text, start, i);
                start = i + 1;
            }
        }

        List<Span> pieces = new ArrayList<>();
        Span current = null;
        for (Span word : words) {
            if (tokens(text, word) > maxTokens) {
                if (current != null) {
                    pieces.add(current);
                    current = null;
                }
                pieces.addAll(cutWord(text, word, maxTokens));
                continue;
            }
            if (current == null) {
                current = word;
            } else if (tokens(text, new Span(current.start, word.end)) <= maxTokens) {
                current = new Span(current.start, word.end);
            } else {
                pieces.add(current);
                current = word;
            }
        }
        if (current != null) {
            pieces.add(current);
        }
        return pieces;
    }

    private List<Span> cutWord(String text, Span word, int maxTokens) {
        List<Span> pieces = new ArrayList<>();
        int start = word.start;
        while (start < word.end) {
            int window = Math.max(1, maxTokens);
            int end = advance(text, start, word.end, window);
            while (end - start > 1 && tokens(text, new Span(start, end)) > maxTokens) {
                window = Math.max(1, window / 2);
                end = advance(text, start, word.end, window);
            }
            pieces.add(new Span(start, end));
            start = end;
        }
        return pieces;
    }

    /** Index after {@code codePoints} code points from {@code start}, bounded by {@code limit}. */
    private static int advance(String text, int start, int limit, int codePoints) {
        int i = start;
        for (int k = 0; k < codePoints && i < limit; k++) {
            i += Character.charCount(text.codePointAt(i));
        }
        return Math.min(i, limit);
    }

    private static void addTrimmed(List<Span> spans, String text, int start, int end) {
        while (start < end && Character.isWhitespace(text.charAt(start))) start++;
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
        if (start < end) {
            spans.add(new Span(start, end));
        }
    }

    record Span(int start, int end) {
    }
}
