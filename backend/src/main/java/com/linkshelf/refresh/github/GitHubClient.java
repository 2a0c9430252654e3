package com.linkshelf.refresh.github;

import com.linkshelf.refresh.model.RepoMetadata;

import java.time.Duration;

public interface GitHubClient {
    RepoMetadata fetchRepo(String owner, String repo, Duration timeout) throws GitHubException;
}
