package com.eyelevel.documenttranslator.service.translation;

import com.eyelevel.documenttranslator.config.TranslationProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits page text into chunks of at most {@code chunkSize} characters for translation.
 * <p>
 * Paragraphs (separated by a blank line) are packed together while they fit. A paragraph longer than the
 * limit is split on sentence endings ({@code . ! ?} followed by whitespace, or the full-width
 * {@code 。！？}), and a single sentence that still does not fit is cut at the limit.
 */
@Component
public class TextChunker {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final int chunkSize;

    @Autowired
    public TextChunker(TranslationProperties translationProperties) {
        this(translationProperties.getChunkSize());
    }

    public TextChunker(int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    public List<String> split(String text) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }

        StringBuilder current = new StringBuilder();
        for (String rawParagraph : PARAGRAPH_BREAK.split(text)) {
            String paragraph = rawParagraph.strip();
            if (paragraph.isEmpty()) {
                continue;
            }
            if (paragraph.length() > chunkSize) {
                flush(current, chunks);
                chunks.addAll(splitSentences(paragraph));
                continue;
            }
            int separator = current.length() == 0 ? 0 : PARAGRAPH_SEPARATOR.length();
            if (current.length() + separator + paragraph.length() > chunkSize) {
                flush(current, chunks);
            }
            if (current.length() > 0) {
                current.append(PARAGRAPH_SEPARATOR);
            }
            current.append(paragraph);
        }
        flush(current, chunks);
        return chunks;
    }

    private List<String> splitSentences(String paragraph) {
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String sentence : sentences(paragraph)) {
            if (current.length() + sentence.length() > chunkSize) {
                flush(current, chunks);
            }
            if (sentence.strip().length() > chunkSize) {
                chunks.addAll(hardSplit(sentence.strip()));
                continue;
            }
            current.append(sentence);
        }
        flush(current, chunks);
        return chunks;
    }

    /**
     * Cuts text at the chunk size, moving a cut back by one char so a surrogate pair is never separated.
     */
    private List<String> hardSplit(String text) {
        List<String> pieces = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(text.length(), start + chunkSize);
            if (end < text.length() && end - start > 1 && Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            pieces.add(text.substring(start, end));
            start = end;
        }
        return pieces;
    }

    /**
     * Cuts the paragraph after each sentence ending, keeping trailing whitespace with its sentence so that
     * concatenating the pieces restores the paragraph.
     */
    private static List<String> sentences(String paragraph) {
        List<String> sentences = new ArrayList<>();
        int start = 0;
        int length = paragraph.length();
        for (int i = 0; i < length; i++) {
            char c = paragraph.charAt(i);
            boolean fullWidthEnd = c == '。' || c == '！' || c == '？';
            boolean asciiEnd = (c == '.' || c == '!' || c == '?')
                    && (i + 1 == length || Character.isWhitespace(paragraph.charAt(i + 1)));
            if (fullWidthEnd || asciiEnd) {
                int end = i + 1;
                while (end < length && Character.isWhitespace(paragraph.charAt(end))) {
                    end++;
                }
                sentences.add(paragraph.substring(start, end));
                start = end;
                i = end - 1;
            }
        }
        if (start < length) {
            sentences.add(paragraph.substring(start));
        }
        return sentences;
    }

    private static void flush(StringBuilder current, List<String> chunks) {
        String chunk = current.toString().strip();
        if (!chunk.isEmpty()) {
            chunks.add(chunk);
        }
        current.setLength(0);
    }
}
