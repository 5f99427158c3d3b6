package com.ragingest.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GitFetcher implements DocumentFetcher {
    private static final Logger log = LoggerFactory.getLogger(GitFetcher.class);

    private final GitCommandRunner gitCommandRunner;
    private final FilesystemFetcher filesystemFetcher;
    private final Path workDirectory;

    public GitFetcher(Duration cloneTimeout, Path workDirectory) {
        this(new GitCommandRunner(cloneTimeout), new FilesystemFetcher(), workDirectory);
    }

    GitFetcher(GitCommandRunner gitCommandRunner, FilesystemFetcher filesystemFetcher, Path workDirectory) {
        this.gitCommandRunner = gitCommandRunner;
        this.filesystemFetcher = filesystemFetcher;
        this.workDirectory = workDirectory;
    }

    @Override
    public List<Document> fetch(String uri) throws SourceException {
        String repositoryUrl = repositoryUrl(uri);
        Path checkout = createCheckoutDirectory();
        try {
            log.info("Cloning repository={} into {}", repositoryUrl, checkout);
            GitCommandResult clone = gitCommandRunner.run(null,
                    "git", "clone", "--depth", "1", repositoryUrl, checkout.toString());
            if (!clone.isSuccess()) {
                throw new SourceException(SourceException.Kind.SOURCE_UNREACHABLE,
                        "Failed to clone " + repositoryUrl + ": " + clone.describeFailure());
            }

            GitCommandResult head = gitCommandRunner.run(checkout, "git", "rev-parse", "HEAD");
            String commit = head.isSuccess() ? head.stdout().trim() : "";
            if (!head.isSuccess()) {
                log.warn("Could not resolve HEAD for repository={} cause={}", repositoryUrl, head.describeFailure());
            }

            return filesystemFetcher.fetchPath(checkout).stream()
                    .map(document -> document
                            .withMetadata("git_repo", repositoryUrl)
                            .withMetadata("commit", commit))
                    .toList();
        } finally {
            deleteRecursively(checkout);
        }
    }

    static String repositoryUrl(String uri) {
        return uri.startsWith("git+") ? uri.substring("git+".length()) : uri;
    }

    private Path createCheckoutDirectory() throws SourceException {
        try {
            Files.createDirectories(workDirectory);
            return Files.createTempDirectory(workDirectory, "rag-git-");
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.SOURCE_UNREACHABLE,
                    "Cannot create clone directory under " + workDirectory + ": " + e.getMessage(), e);
        }
    }

    private static void deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Failed to remove clone directory={} cause={}", root, e.getMessage());
        }
    }
}
