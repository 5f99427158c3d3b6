package com.ragingest.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class TextChunker {
    public static final String DEFAULT_SEPARATOR = "\n\n";
    private static final List<String> SENTENCE_TERMINATORS = List.of(". ", "! ", "? ", "\n");

    private final int chunkSize;
    private final int overlap;
    private final String separator;

    public TextChunker(int chunkSize, int overlap) {
        this(chunkSize, overlap, DEFAULT_SEPARATOR);
    }

    public TextChunker(int chunkSize, int overlap, String separator) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must be >= 0");
        }
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator must not be empty");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        this.separator = separator;
    }

    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String trimmed = text.strip();
        if (trimmed.length() <= chunkSize) {
            return List.of(trimmed);
        }

        List<String> chunks = new ArrayList<>();
        String current = "";
        for (String rawParagraph : trimmed.split(Pattern.quote(separator))) {
            String paragraph = rawParagraph.strip();
            if (paragraph.isEmpty()) {
                continue;
            }
            if (current.isEmpty()) {
                current = startChunk(paragraph, chunks);
                continue;
            }
            if (current.length() + separator.length() + paragraph.length() <= chunkSize) {
                current = current + separator + paragraph;
                continue;
            }

            chunks.add(current);
            String seed = overlapSeed(current);
            if (!seed.isEmpty() && seed.length() + separator.length() + paragraph.length() <= chunkSize) {
                current = seed + separator + paragraph;
            } else {
                current = startChunk(paragraph, chunks);
            }
        }
        if (!current.isBlank()) {
            chunks.add(current);
        }

        return chunks.stream()
                .map(String::strip)
                .filter(chunk -> !chunk.isEmpty())
                .toList();
    }

    List<String> splitLongText(String text) {
        List<String> pieces = new ArrayList<>();
        int length = text.length();
        int start = 0;
        while (start < length) {
            int end = start + chunkSize;
            end = end < length ? breakPoint(text, start, end) : length;
            String piece = text.substring(start, end).strip();
            if (!piece.isEmpty()) {
                pieces.add(piece);
            }
            if (end >= length) {
                break;
            }
            start = Math.max(start + 1, end - overlap);
        }
        return pieces;
    }

    private String startChunk(String paragraph, List<String> chunks) {
        if (paragraph.length() <= chunkSize) {
            return paragraph;
        }
        List<String> pieces = splitLongText(paragraph);
        if (pieces.isEmpty()) {
            return "";
        }
        chunks.addAll(pieces.subList(0, pieces.size() - 1));
        return pieces.get(pieces.size() - 1);
    }

    private String overlapSeed(String current) {
        if (overlap == 0 || current.length() <= overlap) {
            return "";
        }
        return current.substring(current.length() - overlap);
    }

    private static int breakPoint(String text, int start, int limit) {
        int best = -1;
        for (String terminator : SENTENCE_TERMINATORS) {
            int index = text.lastIndexOf(terminator, limit - terminator.length());
            if (index >= start) {
                best = Math.max(best, index + terminator.length());
            }
        }
        if (best > start) {
            return best;
        }
        int space = text.lastIndexOf(' ', limit - 1);
        if (space > start) {
            return space + 1;
        }
        return limit;
    }
}
