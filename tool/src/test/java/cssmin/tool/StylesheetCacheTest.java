package cssmin.tool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Optional;

import cssmin.minifier.Minifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class StylesheetCacheTest {

    @TempDir
    Path root;

    Path sources;
    StylesheetCache cache;

    @BeforeEach
    void setUp() throws IOException {
        sources = Files.createDirectories(root.resolve("src"));
        cache = StylesheetCache.open(root.resolve("cache"), new Minifier(), List.of("vendor-*.css"));
    }

    private Path stylesheet(String name, String css) throws IOException {
        return Files.writeString(sources.resolve(name), css);
    }

    private long cachedFiles() throws IOException {
        try (var listing = Files.list(cache.getDirectory())) {
            return listing.count();
        }
    }

    @Test
    void opensDirectory() {
        assertTrue(Files.isDirectory(cache.getDirectory()));
        assertTrue(cache.isWritable());
    }

    @Test
    void minifiesOnMiss() throws IOException {
        var source = stylesheet("site.css", "a { color: red; }\n");

        var cached = cache.minify(source);

        assertTrue(cached.isPresent());
        assertEquals("a{color:red}", Files.readString(cached.get()));
        assertTrue(cached.get().getFileName().toString().matches("[0-9a-f]{32}\\.css"));
    }

    @Test
    void reusesOnHit() throws IOException {
        var source = stylesheet("site.css", "a { color: red; }");
        var first = cache.minify(source).orElseThrow();
        Files.writeString(first, "marker");

        var second = cache.minify(source).orElseThrow();

        assertEquals(first, second);
        assertEquals("marker", Files.readString(second));
        assertEquals(1, cachedFiles());
    }

    @Test
    void changedSourceGetsNewEntry() throws IOException {
        var source = stylesheet("site.css", "a { color: red; }");
        var first = cache.minify(source).orElseThrow();

        Files.writeString(source, "a { color: blue; }");
        Files.setLastModifiedTime(source, FileTime.fromMillis(Files.getLastModifiedTime(source).toMillis() + 5000));
        var second = cache.minify(source).orElseThrow();

        assertNotEquals(first, second);
        assertEquals("a{color:blue}", Files.readString(second));
    }

    @Test
    void skipsMinifiedFiles() throws IOException {
        var source = stylesheet("lib.min.css", "a{color:red}");
        assertEquals(Optional.empty(), cache.minify(source));
        assertEquals(0, cachedFiles());
    }

    @Test
    void skipsExcludedFiles() throws IOException {
        var source = stylesheet("vendor-grid.css", "a { color: red; }");
        assertEquals(Optional.empty(), cache.minify(source));
    }

    @Test
    void skipsBlankFiles() throws IOException {
        var source = stylesheet("empty.css", " \n ");
        assertEquals(Optional.empty(), cache.minify(source));
    }

    @Test
    void skipsMissingFiles() throws IOException {
        assertEquals(Optional.empty(), cache.minify(sources.resolve("missing.css")));
    }

    @Test
    void skipsOversizedFiles() throws IOException {
        var css = "a{color:red}\n".repeat((int) (StylesheetCache.MAX_FILE_SIZE / 13) + 1);
        var source = stylesheet("huge.css", css);
        assertEquals(Optional.empty(), cache.minify(source));
    }

    @Test
    void commentOnlyFileIsNotStored() throws IOException {
        var source = stylesheet("notes.css", "/* nothing here */");
        assertEquals(Optional.empty(), cache.minify(source));
        assertEquals(0, cachedFiles());
    }

    @Test
    void putGetDelete() throws IOException {
        assertEquals(Optional.empty(), cache.get("abc"));

        cache.put("abc", "a{color:red}");
        assertEquals(Optional.of("a{color:red}"), cache.get("abc"));

        cache.put("abc", "b{color:red}");
        assertEquals(Optional.of("b{color:red}"), cache.get("abc"));

        cache.delete("abc");
        assertEquals(Optional.empty(), cache.get("abc"));
        cache.delete("abc");
    }

    @Test
    void blankValuesAreNotStored() throws IOException {
        cache.put("abc", "  ");
        assertEquals(Optional.empty(), cache.get("abc"));
        assertEquals(0, cachedFiles());
    }

    @Test
    void clearRemovesStylesheetsOnly() throws IOException {
        cache.put("one", "a{}");
        cache.put("two", "b{}");
        Files.writeString(cache.getDirectory().resolve("keep.txt"), "x");

        assertEquals(2, cache.clear());
        assertEquals(Optional.empty(), cache.get("one"));
        assertTrue(Files.exists(cache.getDirectory().resolve("keep.txt")));
        assertEquals(0, cache.clear());
    }

    @Test
    void cacheKeyIsMd5Hex() {
        assertEquals("d41d8cd98f00b204e9800998ecf8427e", StylesheetCache.cacheKey(""));
        assertEquals(StylesheetCache.cacheKey("a.css"), StylesheetCache.cacheKey("a.css"));
    }
}
