package com.repo.readiness.scan;

import com.repo.readiness.core.ReadinessConfig;
import com.repo.readiness.core.SourceFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceFileCollectorTest {

    @TempDir
    Path repo;

    @BeforeEach
    void setUp() throws IOException {
        write("src/Main.java", "public class Main {}");
        write("src/Alpha.java", "public class Alpha {}");
        write("src/util/helper.py", "def help():\n    pass\n");
        write("web/app.js", "function run() {}");
        write("web/app.min.js", "function r(){}");
        write("node_modules/lib/index.js", "module.exports = {};");
        write("build/Generated.java", "class Generated {}");
        write(".git/hooks/check.py", "print('x')");
        write("README.md", "# readme");
    }

    private void write(String relative, String content) throws IOException {
        Path file = repo.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private List<String> relativePaths(List<SourceFile> files) {
        return files.stream().map(SourceFile::relativePath).toList();
    }

    @Test
    void testCollectsByExtensionOrderThenPath() {
        List<SourceFile> files = new SourceFileCollector(ReadinessConfig.defaults()).collect(repo);

        assertEquals(List.of("web/app.js", "src/util/helper.py", "src/Alpha.java", "src/Main.java"),
                relativePaths(files));
    }

    @Test
    void testSkipsDependencyAndBuildDirectoriesAndMinifiedFiles() {
        List<String> paths = relativePaths(new SourceFileCollector(ReadinessConfig.defaults()).collect(repo));

        assertFalse(paths.contains("node_modules/lib/index.js"));
        assertFalse(paths.contains("build/Generated.java"));
        assertFalse(paths.contains(".git/hooks/check.py"));
        assertFalse(paths.contains("web/app.min.js"));
        assertFalse(paths.contains("README.md"));
    }

    @Test
    void testRespectsConfiguredExtensions() throws IOException {
        write(ReadinessConfig.CONFIG_FILE_NAME, "extensions: [\".py\"]\n");
        ReadinessConfig config = ReadinessConfig.load(repo);

        List<SourceFile> files = new SourceFileCollector(config).collect(repo);

        assertEquals(List.of("src/util/helper.py"), relativePaths(files));
    }

    @Test
    void testStableAcrossRuns() {
        SourceFileCollector collector = new SourceFileCollector(ReadinessConfig.defaults());

        assertEquals(collector.collect(repo), collector.collect(repo));
    }

    @Test
    void testMissingRootYieldsNothing() {
        List<SourceFile> files = new SourceFileCollector(ReadinessConfig.defaults())
                .collect(repo.resolve("does-not-exist"));

        assertTrue(files.isEmpty());
    }
}
