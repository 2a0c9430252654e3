package com.linkshelf.refresh.util;

import com.linkshelf.refresh.github.GitHubRepoRef;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class GitHubRepoUrls {
    // https://github.com/owner/repo[.git][/path|?query|#fragment] or git@github.com:owner/repo.git
    private static final Pattern REPO_URL = Pattern.compile(
        "^(?:https?://(?:www\\.)?github\\.com/|git@github\\.com:)([^/\\s?#]+)/([^/\\s?#]+?)(?:\\.git)?(?:[/?#].*)?$",
        Pattern.CASE_INSENSITIVE
    );

    private GitHubRepoUrls() {}

    public static GitHubRepoRef parse(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        Matcher matcher = REPO_URL.matcher(url.trim());
        if (!matcher.matches()) {
            return null;
        }
        String owner = matcher.group(1);
        String repo = matcher.group(2);
        if (owner.isEmpty() || repo.isEmpty()) {
            return null;
        }
        return new GitHubRepoRef(owner, repo);
    }
}
