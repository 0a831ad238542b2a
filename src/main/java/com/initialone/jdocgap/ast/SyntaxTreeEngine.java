package com.initialone.jdocgap.ast;

import com.initialone.jdocgap.lang.LanguageProfile;
import com.initialone.jdocgap.model.SymbolKind;
import com.initialone.jdocgap.model.SymbolRecord;
import com.initialone.jdocgap.scan.DocPresence;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Walks a parsed arena depth-first, pre-order, with an explicit stack. Enclosing definitions
 * are reported before the ones nested in them.
 *
 * <p>A definition preceded by decorator siblings ({@code @Dec() run() {}} in a TS class body)
 * is anchored at its first decorator, so the comment check and the insertion point sit above
 * the decorators.
 */
public class SyntaxTreeEngine {

    public List<SymbolRecord> analyze(Path file, String content, LanguageProfile profile, Grammar grammar)
            throws SyntaxParseException {
        SyntaxArena arena = grammar.parse(content);
        return collect(file, content, profile, grammar.kinds(), arena);
    }

    List<SymbolRecord> collect(Path file, String content, LanguageProfile profile, NodeKinds kinds, SyntaxArena arena) {
        List<SymbolRecord> out = new ArrayList<>();
        if (arena.isEmpty()) return out;

        LineIndex lines = new LineIndex(content);
        int[] anchor = new int[arena.size()];
        Arrays.fill(anchor, -1);
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(0);
        while (!stack.isEmpty()) {
            int node = stack.pop();

            SymbolKind kind = kinds.definitionKind(arena.kind(node));
            if (kind != null) {
                String name = nameOf(arena, node, kinds, content);
                int start = anchor[node] >= 0 ? anchor[node] : arena.start(node);
                if (name != null && !DocPresence.isDocumented(content, start, profile)) {
                    out.add(new SymbolRecord(name, kind, file, lines.lineOf(start), start, profile.language()));
                }
            }

            markDecorated(arena, node, kinds, anchor);
            for (int i = arena.childCount(node) - 1; i >= 0; i--) {
                stack.push(arena.child(node, i));
            }
        }
        return out;
    }

    /** Records, for each child run of decorators, the first decorator's start on the child after it. */
    private static void markDecorated(SyntaxArena arena, int node, NodeKinds kinds, int[] anchor) {
        int runStart = -1;
        for (int i = 0; i < arena.childCount(node); i++) {
            int c = arena.child(node, i);
            if (kinds.isDecorator(arena.kind(c))) {
                if (runStart < 0) runStart = arena.start(c);
                continue;
            }
            if (runStart >= 0 && kinds.definitionKind(arena.kind(c)) != null) {
                anchor[c] = runStart;
            }
            runStart = -1;
        }
    }

    /** Text of the first direct identifier child, or null (the node is then skipped). */
    static String nameOf(SyntaxArena arena, int node, NodeKinds kinds, String content) {
        for (int i = 0; i < arena.childCount(node); i++) {
            int c = arena.child(node, i);
            if (kinds.isIdentifier(arena.kind(c))) {
                String text = arena.text(c, content).strip();
                return text.isEmpty() ? null : text;
            }
        }
        return null;
    }
}
