package org.stianloader.picocache.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picocache.archive.SafeArchiveExtractor;
import org.stianloader.picocache.archive.UnsafeArchiveException;

public class SafeArchiveExtractorTest {

    private final SafeArchiveExtractor extractor = new SafeArchiveExtractor(new RecordingLoggingAdapter(), "main.tex");

    private static Path archive(Path dir, byte[] data) throws IOException {
        Path archive = dir.resolve("source.archive");
        Files.write(archive, data);
        return archive;
    }

    private static long countFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile).count();
        }
    }

    @Test
    public void testExtractTarGz(@TempDir Path dir) throws IOException {
        byte[] data = TestArchives.tarGz()
                .file("main.tex", TestArchives.DOCUMENT)
                .directory("sections")
                .file("sections/intro.tex", "\\section{Intro}")
                .file("./figures/plot.pdf", "%PDF")
                .build();
        Path dest = Files.createDirectory(dir.resolve("out"));

        assertEquals(3, this.extractor.extract(SafeArchiveExtractorTest.archive(dir, data), dest));
        assertEquals(TestArchives.DOCUMENT, new String(Files.readAllBytes(dest.resolve("main.tex")), StandardCharsets.UTF_8));
        assertTrue(Files.isRegularFile(dest.resolve("sections/intro.tex")));
        assertTrue(Files.isRegularFile(dest.resolve("figures/plot.pdf")));
    }

    @Test
    public void testExtractPlainTar(@TempDir Path dir) throws IOException {
        byte[] data = TestArchives.tar().file("paper.tex", TestArchives.DOCUMENT).build();
        Path dest = Files.createDirectory(dir.resolve("out"));

        assertEquals(1, this.extractor.extract(SafeArchiveExtractorTest.archive(dir, data), dest));
        assertTrue(Files.isRegularFile(dest.resolve("paper.tex")));
    }

    @Test
    public void testExtractV7Tar(@TempDir Path dir) throws IOException {
        Path dest = Files.createDirectory(dir.resolve("out"));

        assertEquals(1, this.extractor.extract(SafeArchiveExtractorTest.archive(dir, TestArchives.v7Tar("paper.tex", TestArchives.DOCUMENT)), dest));
        assertEquals(TestArchives.DOCUMENT, new String(Files.readAllBytes(dest.resolve("paper.tex")), StandardCharsets.UTF_8));
    }

    @Test
    public void testExtractGzipCompressedV7Tar(@TempDir Path dir) throws IOException {
        byte[] data = TestArchives.gzip(TestArchives.v7Tar("paper.tex", TestArchives.DOCUMENT));
        Path dest = Files.createDirectory(dir.resolve("out"));

        assertEquals(1, this.extractor.extract(SafeArchiveExtractorTest.archive(dir, data), dest));
        assertEquals(TestArchives.DOCUMENT, new String(Files.readAllBytes(dest.resolve("paper.tex")), StandardCharsets.UTF_8));
        assertFalse(Files.exists(dest.resolve("main.tex")));
    }

    @Test
    public void testSingleGzipFile(@TempDir Path dir) throws IOException {
        Path dest = Files.createDirectory(dir.resolve("out"));

        assertEquals(1, this.extractor.extract(SafeArchiveExtractorTest.archive(dir, TestArchives.gzip(TestArchives.DOCUMENT)), dest));
        assertEquals(TestArchives.DOCUMENT, new String(Files.readAllBytes(dest.resolve("main.tex")), StandardCharsets.UTF_8));
    }

    @Test
    public void testRejectsTraversal(@TempDir Path dir) throws IOException {
        byte[] data = TestArchives.tarGz()
                .file("main.tex", TestArchives.DOCUMENT)
                .file("sub/../../evil.tex", "pwned")
                .build();
        Path dest = Files.createDirectory(dir.resolve("out"));

        UnsafeArchiveException e = assertThrows(UnsafeArchiveException.class, () -> this.extractor.extract(SafeArchiveExtractorTest.archive(dir, data), dest));
        assertEquals("sub/../../evil.tex", e.getEntryName());
        // The pre-scan rejects before anything is written
        assertEquals(0L, SafeArchiveExtractorTest.countFiles(dest));
        assertFalse(Files.exists(dir.resolve("evil.tex")));
    }

    @Test
    public void testRejectsAbsolutePath(@TempDir Path dir) throws IOException {
        byte[] data = TestArchives.tarGz().file("/tmp/evil.tex", "pwned").build();
        Path dest = Files.createDirectory(dir.resolve("out"));

        assertThrows(UnsafeArchiveException.class, () -> this.extractor.extract(SafeArchiveExtractorTest.archive(dir, data), dest));
        assertEquals(0L, SafeArchiveExtractorTest.countFiles(dest));
    }

    @Test
    public void testRejectsSymlink(@TempDir Path dir) throws IOException {
        byte[] data = TestArchives.tarGz()
                .file("main.tex", TestArchives.DOCUMENT)
                .symlink("link.tex", "/etc/passwd")
                .build();
        Path dest = Files.createDirectory(dir.resolve("out"));

        assertThrows(UnsafeArchiveException.class, () -> this.extractor.extract(SafeArchiveExtractorTest.archive(dir, data), dest));
        assertEquals(0L, SafeArchiveExtractorTest.countFiles(dest));
        assertFalse(Files.exists(dest.resolve("link.tex"), java.nio.file.LinkOption.NOFOLLOW_LINKS));
    }

    @Test
    public void testRejectsHardlink(@TempDir Path dir) throws IOException {
        byte[] data = TestArchives.tarGz()
                .file("main.tex", TestArchives.DOCUMENT)
                .hardlink("copy.tex", "main.tex")
                .build();
        Path dest = Files.createDirectory(dir.resolve("out"));

        assertThrows(UnsafeArchiveException.class, () -> this.extractor.extract(SafeArchiveExtractorTest.archive(dir, data), dest));
        assertEquals(0L, SafeArchiveExtractorTest.countFiles(dest));
    }

    @Test
    public void testGarbageIsNotUnsafe(@TempDir Path dir) throws IOException {
        Path dest = Files.createDirectory(dir.resolve("out"));
        Path archive = SafeArchiveExtractorTest.archive(dir, "<html>Not found</html>".getBytes(StandardCharsets.UTF_8));

        IOException e = assertThrows(IOException.class, () -> this.extractor.extract(archive, dest));
        assertFalse(e instanceof UnsafeArchiveException);
    }
}
