package com.initialone.jdocgap.ast;

import com.initialone.jdocgap.lang.Language;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Grammar backed by a native tree-sitter language. Only named nodes are copied into the arena;
 * tree-sitter reports UTF-8 byte offsets, which are converted to character offsets.
 */
public class TreeSitterGrammar implements Grammar {

    private final Language language;
    private final NodeKinds kinds;
    private final TSLanguage tsLanguage;

    TreeSitterGrammar(Language language, NodeKinds kinds, TSLanguage tsLanguage) {
        this.language = language;
        this.kinds = kinds;
        this.tsLanguage = tsLanguage;
    }

    /**
     * Loads the native language and parses an empty document once. Native load failures surface
     * as {@link LinkageError}s, which is why they are caught here and turned into a slot.
     */
    static GrammarSlot load(Language language, NodeKinds kinds, Supplier<TSLanguage> factory) {
        try {
            TreeSitterGrammar g = new TreeSitterGrammar(language, kinds, factory.get());
            g.parse("");
            return GrammarSlot.parsed(g);
        } catch (Exception | LinkageError e) {
            return GrammarSlot.unavailable("tree-sitter " + language + ": " + e);
        }
    }

    @Override
    public Language language() {
        return language;
    }

    @Override
    public NodeKinds kinds() {
        return kinds;
    }

    @Override
    public SyntaxArena parse(String content) throws SyntaxParseException {
        // TSParser is not thread-safe; one per call keeps the grammar shareable
        TSParser parser = new TSParser();
        if (!parser.setLanguage(tsLanguage)) {
            throw new SyntaxParseException("cannot set tree-sitter language " + language);
        }
        TSTree tree = parser.parseString(null, content);
        if (tree == null) {
            throw new SyntaxParseException("tree-sitter returned no tree for " + language);
        }
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new SyntaxParseException("empty tree-sitter root for " + language);
        }

        int[] byteToChar = byteToCharMap(content);
        SyntaxArena arena = new SyntaxArena();
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, SyntaxArena.NO_PARENT));
        while (!stack.isEmpty()) {
            Pending p = stack.pop();
            TSNode n = p.node;
            int idx = arena.add(n.getType(),
                    toChar(byteToChar, n.getStartByte()),
                    toChar(byteToChar, n.getEndByte()),
                    p.parent);
            for (int i = n.getNamedChildCount() - 1; i >= 0; i--) {
                TSNode c = n.getNamedChild(i);
                if (c != null && !c.isNull()) {
                    stack.push(new Pending(c, idx));
                }
            }
        }
        return arena;
    }

    private static int toChar(int[] map, int byteOffset) {
        if (byteOffset <= 0) return 0;
        if (byteOffset >= map.length) return map[map.length - 1];
        return map[byteOffset];
    }

    /** map[b] = index of the char that contains UTF-8 byte b; map[len] = content length. */
    static int[] byteToCharMap(String s) {
        int bytes = 0;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            bytes += utf8Length(cp);
            i += Character.charCount(cp);
        }
        int[] map = new int[bytes + 1];
        int b = 0;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            int len = utf8Length(cp);
            for (int k = 0; k < len; k++) map[b + k] = i;
            b += len;
            i += Character.charCount(cp);
        }
        map[bytes] = s.length();
        return map;
    }

    private static int utf8Length(int cp) {
        if (cp < 0x80) return 1;
        if (cp < 0x800) return 2;
        if (cp < 0x10000) return 3;
        return 4;
    }

    private static final class Pending {
        final TSNode node;
        final int parent;

        Pending(TSNode node, int parent) {
            this.node = node;
            this.parent = parent;
        }
    }
}
