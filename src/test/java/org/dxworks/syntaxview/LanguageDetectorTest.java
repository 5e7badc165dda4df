package org.dxworks.syntaxview;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class LanguageDetectorTest {

    @Test
    void detects_by_extension_ignoring_case() {
        assertEquals(Optional.of(Language.JAVA), LanguageDetector.detectLanguage(Paths.get("src/Foo.java")));
        assertEquals(Optional.of(Language.CSHARP), LanguageDetector.detectLanguage(Paths.get("Program.CS")));
    }

    @Test
    void unknown_extensions_are_not_detected() {
        assertEquals(Optional.empty(), LanguageDetector.detectLanguage(Paths.get("notes.txt")));
        assertEquals(Optional.empty(), LanguageDetector.detectLanguage(Paths.get("Makefile")));
    }
}
