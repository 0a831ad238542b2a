package com.initialone.jdocgap.ast;

import com.initialone.jdocgap.lang.LanguageProfile;
import com.initialone.jdocgap.model.SymbolRecord;
import com.initialone.jdocgap.scan.DocPresence;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Fallback analysis: every rule of the language runs over the whole text on its own.
 * A region matched by one rule can be matched again by a later rule, so two records for the
 * same position (different kind) are possible and are kept.
 */
public class RegexEngine {

    public List<SymbolRecord> analyze(Path file, String content, LanguageProfile profile, List<RegexRule> rules) {
        List<SymbolRecord> out = new ArrayList<>();
        if (content == null || content.isEmpty() || rules.isEmpty()) return out;

        for (RegexRule rule : rules) {
            Matcher m = rule.pattern().matcher(content);
            while (m.find()) {
                String name = m.groupCount() >= 1 ? m.group(1) : null;
                if (name == null || name.isEmpty()) continue;

                int offset = m.start();
                if (DocPresence.isDocumented(content, offset, profile)) continue;

                out.add(new SymbolRecord(name, rule.kind(), file,
                        LineIndex.lineAt(content, offset), offset, profile.language()));
            }
        }
        return out;
    }
}
