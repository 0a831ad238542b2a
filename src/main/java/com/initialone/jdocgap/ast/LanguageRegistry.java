package com.initialone.jdocgap.ast;

import com.initialone.jdocgap.lang.Language;
import com.initialone.jdocgap.lang.LanguageProfile;
import com.initialone.jdocgap.lang.LanguageProfiles;
import org.treesitter.TreeSitterGo;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterTypescript;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * language -> {profile, grammar slot, regex rules}.
 *
 * <p>The shared instance from {@link #shared()} is built once per process, when first used, and
 * is read-only afterwards. Grammars that fail to load are reported once here and their
 * language falls back to the regex rules.
 */
public final class LanguageRegistry {

    private final Map<Language, Entry> entries;

    public LanguageRegistry(Map<Language, GrammarSlot> grammars) {
        Map<Language, Entry> m = new EnumMap<>(Language.class);
        for (Language l : Language.values()) {
            GrammarSlot slot = grammars.getOrDefault(l, GrammarSlot.none());
            m.put(l, new Entry(LanguageProfiles.of(l), slot, RegexRuleTables.forLanguage(l)));
        }
        this.entries = Collections.unmodifiableMap(m);
    }

    /** Registry without any grammar: every language goes through the regex rules. */
    public static LanguageRegistry regexOnly() {
        return new LanguageRegistry(Map.of());
    }

    public static LanguageRegistry shared() {
        return Holder.INSTANCE;
    }

    /** Loads every built-in grammar, reporting those that are unavailable. */
    static LanguageRegistry loadDefault() {
        Map<Language, GrammarSlot> g = new EnumMap<>(Language.class);
        g.put(Language.PYTHON, TreeSitterGrammar.load(Language.PYTHON, NodeKinds.PYTHON, () -> new TreeSitterPython()));
        g.put(Language.JAVASCRIPT, TreeSitterGrammar.load(Language.JAVASCRIPT, NodeKinds.JAVASCRIPT, () -> new TreeSitterJavascript()));
        g.put(Language.TYPESCRIPT, TreeSitterGrammar.load(Language.TYPESCRIPT, NodeKinds.TYPESCRIPT, () -> new TreeSitterTypescript()));
        g.put(Language.GO, TreeSitterGrammar.load(Language.GO, NodeKinds.GO, () -> new TreeSitterGo()));
        g.put(Language.JAVA, JavaParserGrammar.load());

        for (Map.Entry<Language, GrammarSlot> e : g.entrySet()) {
            if (!e.getValue().isAvailable()) {
                System.err.println("[registry] grammar unavailable for " + e.getKey()
                        + ", using regex rules -> " + e.getValue().reason());
            }
        }
        return new LanguageRegistry(g);
    }

    public Entry entry(Language language) {
        return entries.get(language);
    }

    public LanguageProfile profile(Language language) {
        return entries.get(language).profile();
    }

    public GrammarSlot grammar(Language language) {
        return entries.get(language).grammar();
    }

    public List<RegexRule> rules(Language language) {
        return entries.get(language).rules();
    }

    /** What the analyzer needs for one language. */
    public static final class Entry {
        private final LanguageProfile profile;
        private final GrammarSlot grammar;
        private final List<RegexRule> rules;

        Entry(LanguageProfile profile, GrammarSlot grammar, List<RegexRule> rules) {
            this.profile = profile;
            this.grammar = grammar;
            this.rules = List.copyOf(rules);
        }

        public LanguageProfile profile() { return profile; }
        public GrammarSlot grammar()     { return grammar; }
        public List<RegexRule> rules()   { return rules; }
    }

    private static final class Holder {
        static final LanguageRegistry INSTANCE = loadDefault();
    }
}
