package org.dxworks.syntaxview.parser;

import java.util.Locale;

final class SyntaxNames {

    private SyntaxNames() {
        // utility class
    }

    /**
     * {@code class_declaration} becomes {@code ClassDeclarationSyntax}, {@code ERROR} becomes {@code ErrorSyntax}.
     */
    static String toTypeName(String kind) {
        StringBuilder sb = new StringBuilder();
        if (kind != null) {
            for (String part : kind.split("[^A-Za-z0-9]+")) {
                if (part.isEmpty()) continue;
                String rest = part.substring(1);
                if (part.equals(part.toUpperCase(Locale.ROOT))) {
                    rest = rest.toLowerCase(Locale.ROOT);
                }
                sb.append(Character.toUpperCase(part.charAt(0))).append(rest);
            }
        }
        if (sb.length() == 0) {
            sb.append("Unnamed");
        }
        return sb.append("Syntax").toString();
    }
}
