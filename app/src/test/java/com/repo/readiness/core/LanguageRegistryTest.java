package com.repo.readiness.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LanguageRegistryTest {

    private final LanguageRegistry registry = LanguageRegistry.defaults();

    @ParameterizedTest
    @CsvSource({
            ".java, java",
            ".cs, csharp",
            ".js, javascript",
            ".TSX, javascript",
            ".py, python",
            ".go, go",
            ".cpp, generic",
            ".h, generic",
            ".rs, generic"
    })
    void testRoutesByExtension(String extension, String expectedLanguage) {
        assertEquals(expectedLanguage, registry.getProfile(extension).getLanguageId());
    }

    @Test
    void testUnknownExtensionFallsBack() {
        assertSame(registry.getFallbackProfile(), registry.getProfile(""));
        assertSame(registry.getFallbackProfile(), registry.getProfile(".kt"));
    }

    @Test
    void testRoutesSourceFile() {
        SourceFile file = SourceFile.of(Path.of("/repo"), Path.of("/repo/lib/tool.py"));
        assertEquals("python", registry.getProfile(file).getLanguageId());
    }

    @Test
    void testSupportedExtensions() {
        assertTrue(registry.getSupportedExtensions().contains(".py"));
        assertTrue(registry.getSupportedExtensions().contains(".jsx"));
        assertFalse(registry.getSupportedExtensions().contains(".c"), "C is handled by the fallback");
    }
}
