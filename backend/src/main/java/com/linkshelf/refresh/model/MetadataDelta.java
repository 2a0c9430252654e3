package com.linkshelf.refresh.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Metadata fields that changed during a refresh. A null field means "leave the stored value alone".
 */
public record MetadataDelta(
    String title,
    String description,
    String logo,
    Integer githubStars,
    Boolean githubArchived,
    Instant githubLastCommit
) {
    private static final MetadataDelta EMPTY = new MetadataDelta(null, null, null, null, null, null);

    public static MetadataDelta empty() {
        return EMPTY;
    }

    public static MetadataDelta between(Link link, PageMetadata page, RepoMetadata repo) {
        String description = page == null ? null : page.description();
        if (repo != null && repo.description() != null && !repo.description().isBlank()) {
            description = repo.description();
        }
        return new MetadataDelta(
            changed(link.title(), page == null ? null : page.title()),
            changed(link.description(), description),
            changed(link.logo(), page == null ? null : page.logo()),
            repo == null ? null : changed(link.githubStars(), repo.stars()),
            repo == null ? null : changed(link.githubArchived(), repo.archived()),
            repo == null ? null : changed(link.githubLastCommit(), repo.lastCommit())
        );
    }

    public boolean isEmpty() {
        return title == null
            && description == null
            && logo == null
            && githubStars == null
            && githubArchived == null
            && githubLastCommit == null;
    }

    public List<String> changedFields() {
        List<String> fields = new ArrayList<>();
        if (title != null) {
            fields.add("title");
        }
        if (description != null) {
            fields.add("description");
        }
        if (logo != null) {
            fields.add("logo");
        }
        if (githubStars != null) {
            fields.add("github_stars");
        }
        if (githubArchived != null) {
            fields.add("github_archived");
        }
        if (githubLastCommit != null) {
            fields.add("github_last_commit");
        }
        return fields;
    }

    private static String changed(String current, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String trimmed = candidate.trim();
        return trimmed.equals(current) ? null : trimmed;
    }

    private static <T> T changed(T current, T candidate) {
        if (candidate == null || Objects.equals(current, candidate)) {
            return null;
        }
        return candidate;
    }
}
