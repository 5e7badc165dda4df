package org.dxworks.syntaxview.model;

import java.util.AbstractList;
import java.util.List;

public final class TriviaList extends AbstractList<Trivia> {
    public static final TriviaList EMPTY = new TriviaList(List.of());

    private final List<Trivia> items;

    private TriviaList(List<Trivia> items) {
        this.items = items;
    }

    public static TriviaList of(List<Trivia> items) {
        if (items == null || items.isEmpty()) return EMPTY;
        return new TriviaList(List.copyOf(items));
    }

    public static TriviaList of(Trivia... items) {
        return of(List.of(items));
    }

    @Override
    public Trivia get(int index) {
        return items.get(index);
    }

    @Override
    public int size() {
        return items.size();
    }

    public int getFullWidth() {
        int width = 0;
        for (Trivia trivia : items) {
            width += trivia.getText().length();
        }
        return width;
    }

    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (Trivia trivia : items) {
            sb.append(trivia.getText());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getText();
    }
}
