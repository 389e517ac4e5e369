package com.repo.readiness.graph;

import com.repo.readiness.complexity.ImportCounter;
import com.repo.readiness.core.LanguageRegistry;
import com.repo.readiness.core.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    @TempDir
    Path repo;

    private final DependencyGraphBuilder builder =
            new DependencyGraphBuilder(new ImportCounter(LanguageRegistry.defaults()), false);

    private SourceFile write(String relative, String content) throws IOException {
        Path file = repo.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return SourceFile.of(repo, file);
    }

    @Test
    void testMutualImportsProduceBothEdges() throws IOException {
        SourceFile alpha = write("demo/Alpha.java", "package demo;\nimport demo.Beta;\npublic class Alpha {}\n");
        SourceFile beta = write("demo/Beta.java", "package demo;\nimport demo.Alpha;\npublic class Beta {}\n");

        DependencyGraph graph = builder.build(List.of(alpha, beta));

        assertEquals(Map.of("Alpha", List.of("Beta"), "Beta", List.of("Alpha")), graph.asMap());
    }

    @Test
    void testThirdPartyImportIsDropped() throws IOException {
        SourceFile main = write("Main.java", "import java.util.List;\npublic class Main {}\n");

        DependencyGraph graph = builder.build(List.of(main));

        assertEquals(1, graph.size());
        assertTrue(graph.contains("Main"));
        assertTrue(graph.targetsOf("Main").isEmpty());
    }

    @Test
    void testFileWithoutImportsIsANodeWithoutEdges() throws IOException {
        SourceFile plain = write("plain.py", "x = 1\n");
        SourceFile other = write("other.py", "import plain\n");

        DependencyGraph graph = builder.build(List.of(plain, other));

        assertEquals(List.of(), graph.targetsOf("plain"));
        assertEquals(List.of("plain"), graph.targetsOf("other"));
    }

    @Test
    void testEdgesFollowImportOrder() throws IOException {
        SourceFile app = write("app.py", "import zeta\nfrom beta import thing\n");
        SourceFile beta = write("beta.py", "");
        SourceFile zeta = write("zeta.py", "");

        DependencyGraph graph = builder.build(List.of(app, beta, zeta));

        assertEquals(List.of("zeta", "beta"), graph.targetsOf("app"));
    }

    @Test
    void testRelativeScriptImportResolvesByPath() throws IOException {
        SourceFile index = write("web/index.js", "import { load } from './lib/loader';\n");
        SourceFile loader = write("web/lib/loader.js", "export function load() {}\n");

        DependencyGraph graph = builder.build(List.of(index, loader));

        assertEquals(List.of("loader"), graph.targetsOf("index"));
    }

    @Test
    void testSubstringMatchingIsPermissive() throws IOException {
        SourceFile utils = write("StringUtils.py", "");
        SourceFile app = write("app.py", "import Util\n");

        DependencyGraph graph = builder.build(List.of(utils, app));

        assertEquals(List.of("StringUtils"), graph.targetsOf("app"));
        assertEquals("StringUtils", DependencyGraphBuilder.resolve("Util", List.of(utils, app)).orElseThrow().stem());
        assertTrue(DependencyGraphBuilder.resolve("Utility", List.of(utils, app)).isEmpty());
    }

    @Test
    void testUnreadableFileStaysAsEmptyNode() throws IOException {
        Path bad = repo.resolve("Bad.java");
        Files.write(bad, new byte[] { (byte) 0xC3, (byte) 0x28 });
        SourceFile good = write("Good.java", "import Bad;\npublic class Good {}\n");

        DependencyGraph graph = builder.build(List.of(SourceFile.of(repo, bad), good));

        assertEquals(List.of(), graph.targetsOf("Bad"));
        assertEquals(List.of("Bad"), graph.targetsOf("Good"));
    }
}
