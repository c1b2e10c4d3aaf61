package cssmin.tool;

import static lombok.AccessLevel.PRIVATE;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import cssmin.minifier.Minifier;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps minified copies of stylesheets in a directory, one {@code <key>.css}
 * file per distinct source. The key covers the file name, its content and its
 * modification time, so an edited file is minified again.
 */
@Slf4j
@RequiredArgsConstructor(access = PRIVATE)
public final class StylesheetCache {

    static final long MAX_FILE_SIZE = 1024 * 1024;

    private static final String EXTENSION = ".css";
    private static final String MINIFIED_SUFFIX = ".min.css";

    @Getter
    private final @NonNull Path directory;
    private final @NonNull Minifier minifier;
    private final @NonNull List<PathMatcher> excluded;

    public static StylesheetCache open(
            @NonNull Path directory,
            @NonNull Minifier minifier,
            @NonNull List<String> excludedPatterns) throws IOException {
        Files.createDirectories(directory);
        var fileSystem = FileSystems.getDefault();
        var matchers = excludedPatterns.stream()
            .map(pattern -> fileSystem.getPathMatcher("glob:" + pattern))
            .collect(Collectors.toList());
        return new StylesheetCache(directory, minifier, matchers);
    }

    public boolean isWritable() {
        return Files.isDirectory(directory) && Files.isWritable(directory);
    }

    /**
     * @return the minified copy of {@code source}, or empty if the file should
     *         be served as it is
     */
    public Optional<Path> minify(@NonNull Path source) throws IOException {
        if (!shouldProcess(source)) {
            return Optional.empty();
        }

        var content = Files.readString(source, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            log.debug("Skipping blank stylesheet {}", source);
            return Optional.empty();
        }

        var modified = Files.getLastModifiedTime(source).toMillis();
        var key = cacheKey(source.getFileName() + content + modified);
        var file = cacheFile(key);
        if (Files.exists(file)) {
            log.debug("Cache hit for {}: {}", source, file);
            return Optional.of(file);
        }

        log.debug("Cache miss for {}, minifying", source);
        put(key, minifier.minify(content));
        return Files.exists(file) ? Optional.of(file) : Optional.empty();
    }

    boolean shouldProcess(Path source) throws IOException {
        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            log.debug("Skipping unreadable stylesheet {}", source);
            return false;
        }
        var name = source.getFileName().toString();
        if (name.endsWith(MINIFIED_SUFFIX)) {
            log.debug("Skipping already minified stylesheet {}", source);
            return false;
        }
        if (isExcluded(source)) {
            log.debug("Skipping excluded stylesheet {}", source);
            return false;
        }
        if (Files.size(source) > MAX_FILE_SIZE) {
            log.debug("Skipping oversized stylesheet {}", source);
            return false;
        }
        return true;
    }

    private boolean isExcluded(Path source) {
        var fileName = source.getFileName();
        for (var matcher : excluded) {
            if (matcher.matches(source) || matcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }

    public Optional<String> get(@NonNull String key) throws IOException {
        var file = cacheFile(key);
        if (!Files.isReadable(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Stores {@code css} under {@code key}. Blank values are not stored.
     */
    public void put(@NonNull String key, @NonNull String css) throws IOException {
        if (css.isBlank()) {
            return;
        }
        var temp = Files.createTempFile(directory, "cssmin_", ".tmp");
        try {
            Files.writeString(temp, css, StandardCharsets.UTF_8);
            move(temp, cacheFile(key));
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move unsupported for {}, falling back to replace", to);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public void delete(@NonNull String key) throws IOException {
        Files.deleteIfExists(cacheFile(key));
    }

    /**
     * Removes every cached stylesheet. Files that cannot be removed are logged
     * and left behind.
     *
     * @return the number of files removed
     */
    public int clear() throws IOException {
        List<Path> files;
        try (var listing = Files.list(directory)) {
            files = listing
                .filter(file -> file.getFileName().toString().endsWith(EXTENSION))
                .filter(Files::isRegularFile)
                .collect(Collectors.toList());
        }

        var removed = 0;
        for (var file : files) {
            try {
                Files.delete(file);
                removed++;
            } catch (IOException ex) {
                log.warn("Failed to delete cached stylesheet {}: {}", file, ex.getMessage());
            }
        }
        return removed;
    }

    Path cacheFile(String key) {
        return directory.resolve(key + EXTENSION);
    }

    static String cacheKey(String seed) {
        try {
            var digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(seed.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            // every JRE ships MD5
            throw new IllegalStateException(ex);
        }
    }
}
