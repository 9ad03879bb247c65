package com.deepansh.recall.retrieval;

import com.deepansh.recall.fact.Fact;

import java.util.List;

/**
 * Result of one retrieval: profile facts (importance-descending) and recent-context
 * episodes (distance-ascending). The two sections are never merged into one ranking.
 *
 * profileTimedOut is set when the fact lookup missed the retrieval deadline, so an
 * empty profile can be told apart from a user with no facts.
 */
public record ContextBundle(List<Fact> profile,
                            List<EpisodeSnippet> recentContext,
                            SemanticStatus semanticStatus,
                            boolean profileTimedOut) {

    public ContextBundle {
        profile = List.copyOf(profile);
        recentContext = List.copyOf(recentContext);
    }

    public ContextBundle(List<Fact> profile, List<EpisodeSnippet> recentContext, SemanticStatus semanticStatus) {
        this(profile, recentContext, semanticStatus, false);
    }

    /** Bundle for a turn on which retrieval did not run */
    public static ContextBundle disabled() {
        return new ContextBundle(List.of(), List.of(), SemanticStatus.DISABLED);
    }

    public boolean isEmpty() {
        return profile.isEmpty() && recentContext.isEmpty();
    }
}
