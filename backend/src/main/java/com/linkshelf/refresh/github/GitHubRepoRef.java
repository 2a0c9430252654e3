package com.linkshelf.refresh.github;

public record GitHubRepoRef(
    String owner,
    String repo
) {
    public String fullName() {
        return owner + "/" + repo;
    }
}
