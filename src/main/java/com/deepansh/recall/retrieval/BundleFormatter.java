package com.deepansh.recall.retrieval;

import com.deepansh.recall.config.MemoryProperties;
import com.deepansh.recall.fact.Fact;
import org.springframework.stereotype.Component;

/**
 * Renders a bundle into the text block injected into the reply prompt.
 *
 * Profile lines first, then recent context, each section in the bundle's own order.
 * Lines are added until the next one would exceed the character budget
 * (roughly 4 characters per token).
 */
@Component
public class BundleFormatter {

    static final String EMPTY = "No relevant memory found.";
    static final String PROFILE_HEADER = "## User Profile";
    static final String CONTEXT_HEADER = "## Recent Context";

    private final int charBudget;

    public BundleFormatter(MemoryProperties properties) {
        this.charBudget = properties.getRetrieval().getCharBudget();
    }

    public String format(ContextBundle bundle) {
        StringBuilder out = new StringBuilder();

        if (!bundle.profile().isEmpty()) {
            appendLine(out, PROFILE_HEADER);
            for (Fact fact : bundle.profile()) {
                if (!appendLine(out, "- " + fact.getKey() + ": " + fact.getValue())) break;
            }
        }

        if (!bundle.recentContext().isEmpty() && fits(out, CONTEXT_HEADER)) {
            if (out.length() > 0) appendLine(out, "");
            appendLine(out, CONTEXT_HEADER);
            for (EpisodeSnippet snippet : bundle.recentContext()) {
                if (!appendLine(out, "- " + snippet.turnRange() + ": " + snippet.preview())) break;
            }
        }

        String formatted = out.toString().strip();
        return formatted.isEmpty() ? EMPTY : formatted;
    }

    private boolean appendLine(StringBuilder out, String line) {
        if (!fits(out, line)) return false;
        out.append(line).append('\n');
        return true;
    }

    private boolean fits(StringBuilder out, String line) {
        return out.length() + line.length() + 1 <= charBudget;
    }
}
