package org.dxworks.syntaxview;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<Language> detectLanguage(Path filePath) {
        if (filePath == null || filePath.getFileName() == null) {
            return Optional.empty();
        }
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        for (Language language : Language.values()) {
            if (language.matchesFileName(fileName)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
