package org.dxworks.syntaxview;

import java.util.List;

public enum Language {
    JAVA("java", List.of(".java")),
    CSHARP("csharp", List.of(".cs"));

    private final String name;
    private final List<String> extensions;

    Language(String name, List<String> extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean matchesFileName(String fileName) {
        for (String extension : extensions) {
            if (fileName.endsWith(extension)) return true;
        }
        return false;
    }
}
