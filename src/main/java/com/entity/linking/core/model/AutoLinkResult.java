package com.entity.linking.core.model;

import java.util.List;

/**
 * Summary of one auto-link run. Transient.
 */
public record AutoLinkResult(int linksCreated, Matches matches) {

    private static final AutoLinkResult EMPTY = new AutoLinkResult(0, new Matches(List.of(), List.of(), List.of()));

    public AutoLinkResult {
        matches = matches != null ? matches : EMPTY.matches;
    }

    public static AutoLinkResult empty() {
        return EMPTY;
    }

    /**
     * Builds a result whose link count is the number of matched ids.
     */
    public static AutoLinkResult of(List<String> contacts, List<String> projects, List<String> todos) {
        Matches matches = new Matches(contacts, projects, todos);
        return new AutoLinkResult(matches.total(), matches);
    }

    /**
     * Ids of the entities that were linked, per type.
     */
    public record Matches(List<String> contacts, List<String> projects, List<String> todos) {

        public Matches {
            contacts = contacts != null ? List.copyOf(contacts) : List.of();
            projects = projects != null ? List.copyOf(projects) : List.of();
            todos = todos != null ? List.copyOf(todos) : List.of();
        }

        public int total() {
            return contacts.size() + projects.size() + todos.size();
        }
    }
}
