package com.initialone.jdocgap.ast;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.initialone.jdocgap.lang.Language;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Java grammar on top of JavaParser. Node kinds are the JavaParser node class names
 * ({@code MethodDeclaration}, {@code SimpleName}, ...). Comment nodes are left out.
 */
public class JavaParserGrammar implements Grammar {

    private final ParserConfiguration config;

    public JavaParserGrammar() {
        this.config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false);
    }

    static GrammarSlot load() {
        try {
            JavaParserGrammar g = new JavaParserGrammar();
            g.parse("class Probe {}");
            return GrammarSlot.parsed(g);
        } catch (Exception | LinkageError e) {
            return GrammarSlot.unavailable("javaparser: " + e);
        }
    }

    @Override
    public Language language() {
        return Language.JAVA;
    }

    @Override
    public NodeKinds kinds() {
        return NodeKinds.JAVA;
    }

    @Override
    public SyntaxArena parse(String content) throws SyntaxParseException {
        // JavaParser is not thread-safe either, so one instance per call
        JavaParser parser = new JavaParser(config);
        ParseResult<CompilationUnit> res = parser.parse(content);
        if (!res.isSuccessful() || res.getResult().isEmpty()) {
            String why = res.getProblems().isEmpty() ? "no result" : res.getProblem(0).getVerboseMessage();
            throw new SyntaxParseException("javaparser: " + why);
        }
        CompilationUnit cu = res.getResult().get();
        LineIndex lines = new LineIndex(content);

        SyntaxArena arena = new SyntaxArena();
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(cu, SyntaxArena.NO_PARENT));
        while (!stack.isEmpty()) {
            Pending top = stack.pop();
            Node n = top.node;
            int parent = top.parent;

            int start = 0;
            int end = content.length();
            Optional<Range> r = n.getRange();
            if (r.isPresent()) {
                start = toOffset(lines, r.get().begin);
                end = Math.min(content.length(), toOffset(lines, r.get().end) + 1);
            }
            int idx = arena.add(n.getClass().getSimpleName(), start, end, parent);

            List<Node> kids = new ArrayList<>();
            for (Node c : n.getChildNodes()) {
                if (!(c instanceof Comment)) kids.add(c);
            }
            // getChildNodes() is not guaranteed to be in source order
            kids.sort(Comparator.comparing(
                    (Node c) -> c.getBegin().orElse(Position.HOME)));
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(new Pending(kids.get(i), idx));
            }
        }
        return arena;
    }

    private static int toOffset(LineIndex lines, Position p) {
        return lines.offsetOf(p.line, p.column);
    }

    private static final class Pending {
        final Node node;
        final int parent;

        Pending(Node node, int parent) {
            this.node = node;
            this.parent = parent;
        }
    }
}
