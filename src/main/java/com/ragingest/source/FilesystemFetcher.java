package com.ragingest.source;

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FilesystemFetcher implements DocumentFetcher {
    private static final Logger log = LoggerFactory.getLogger(FilesystemFetcher.class);

    private final List<String> extensions;

    public FilesystemFetcher() {
        this(SourceFiles.SUPPORTED_EXTENSIONS);
    }

    public FilesystemFetcher(List<String> extensions) {
        this.extensions = List.copyOf(extensions);
    }

    @Override
    public List<Document> fetch(String uri) throws SourceException {
        return fetchPath(resolvePath(uri));
    }

    public List<Document> fetchPath(Path root) throws SourceException {
        if (Files.isRegularFile(root)) {
            List<Document> documents = new ArrayList<>();
            readDocument(root, root.getFileName(), documents);
            return requireDocuments(documents, root);
        }
        if (!Files.isDirectory(root)) {
            throw new SourceException(SourceException.Kind.SOURCE_NOT_FOUND, "Path not found: " + root);
        }

        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    Path name = dir.getFileName();
                    if (!dir.equals(root) && name != null && name.toString().equals(".git")) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && SourceFiles.isSupported(file.getFileName().toString(), extensions)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Skipping unreadable path={} cause={}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.SOURCE_UNREACHABLE, "Failed to scan " + root + ": " + e.getMessage(), e);
        }

        files.sort(Comparator.comparing(file -> relativeName(root.relativize(file))));
        List<Document> documents = new ArrayList<>();
        for (Path file : files) {
            readDocument(file, root.relativize(file), documents);
        }
        log.info("Fetched {} documents from path={}", documents.size(), root);
        return requireDocuments(documents, root);
    }

    static Path resolvePath(String uri) {
        if (uri.startsWith("pvc://")) {
            String rest = uri.substring("pvc://".length());
            int slash = rest.indexOf('/');
            return Path.of(slash < 0 ? "/" : rest.substring(slash));
        }
        if (uri.startsWith("local://")) {
            return Path.of(uri.substring("local://".length()));
        }
        if (uri.startsWith("file:")) {
            return Path.of(URI.create(uri));
        }
        return Path.of(uri);
    }

    private void readDocument(Path file, Path relative, List<Document> documents) {
        try {
            String text = SourceFiles.decode(Files.readAllBytes(file));
            String relativePath = relativeName(relative);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("source", file.toAbsolutePath().normalize().toString());
            metadata.put("filename", file.getFileName().toString());
            metadata.put("extension", SourceFiles.extensionOf(file.getFileName().toString()));
            metadata.put("relative_path", relativePath);
            documents.add(new Document(relativePath, text, metadata));
        } catch (IOException e) {
            log.warn("Skipping file={} cause={}", file, e.getMessage());
        }
    }

    private static String relativeName(Path relative) {
        return relative.toString().replace('\\', '/');
    }

    private static List<Document> requireDocuments(List<Document> documents, Path root) throws SourceException {
        if (documents.isEmpty()) {
            throw new SourceException(SourceException.Kind.SOURCE_NOT_FOUND, "No supported documents found under " + root);
        }
        return documents;
    }
}
