package org.dxworks.syntaxview.tree;

public enum Classification {
    NODE,
    TOKEN
}
