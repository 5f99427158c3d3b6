package com.ragingest.ingest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragingest.source.Document;

public class DocumentProcessor {
    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);

    private final TextChunker chunker;
    private final DocumentFormat format;

    public DocumentProcessor(int chunkSize, int overlap) {
        this(new TextChunker(chunkSize, overlap), DocumentFormat.AUTO);
    }

    public DocumentProcessor(TextChunker chunker, DocumentFormat format) {
        this.chunker = chunker;
        this.format = format;
    }

    public List<Chunk> process(List<Document> documents) {
        List<Chunk> chunks = new ArrayList<>();
        for (Document document : documents) {
            DocumentFormat effectiveFormat = format.resolve(document);
            String text = TextNormalizer.normalize(document.text(), effectiveFormat);
            if (text.isEmpty()) {
                log.warn("Skipping document={} with no text content after normalization format={}", document.id(), effectiveFormat);
                continue;
            }

            List<String> pieces = chunker.chunk(text);
            for (int i = 0; i < pieces.size(); i++) {
                Map<String, Object> metadata = new LinkedHashMap<>(document.metadata());
                metadata.put("chunk_index", i);
                metadata.put("total_chunks", pieces.size());
                chunks.add(new Chunk(Chunk.idFor(document.id(), i), document.id(), i, pieces.size(), pieces.get(i), metadata));
            }
            log.debug("Chunked document={} format={} chunks={}", document.id(), effectiveFormat, pieces.size());
        }
        log.info("Processed {} documents into {} chunks", documents.size(), chunks.size());
        return chunks;
    }
}
