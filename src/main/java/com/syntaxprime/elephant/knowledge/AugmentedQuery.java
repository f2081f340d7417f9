package com.syntaxprime.elephant.knowledge;

import java.util.List;

/**
 * The caller's query plus up to three context keywords OR'ed alongside it. Context nudges
 * retrieval toward the conversation; it never replaces the explicit query.
 */
public record AugmentedQuery(String text, List<String> contextTerms) {
    static final int MAX_CONTEXT_TERMS = 3;

    public AugmentedQuery {
        contextTerms = contextTerms == null ? List.of() : List.copyOf(contextTerms);
    }

    public static AugmentedQuery of(String query, List<String> contextKeywords) {
        List<String> terms = contextKeywords == null
                ? List.of()
                : contextKeywords.stream().limit(MAX_CONTEXT_TERMS).toList();
        return new AugmentedQuery(query, terms);
    }

    /**
     * Text form, e.g. {@code marketing email (launch OR budget OR review)}.
     */
    public String render() {
        if (this.contextTerms.isEmpty()) {
            return this.text;
        }
        return this.text + " (" + String.join(" OR ", this.contextTerms) + ")";
    }
}
