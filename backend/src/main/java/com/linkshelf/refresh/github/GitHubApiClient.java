package com.linkshelf.refresh.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkshelf.config.RefreshProperties;
import com.linkshelf.refresh.model.RepoMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

@Service
public class GitHubApiClient implements GitHubClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);

    private final RefreshProperties properties;
    private final HttpClient client;
    private final ObjectMapper objectMapper;

    public GitHubApiClient(
        RefreshProperties properties,
        @Qualifier("githubHttpClient") HttpClient client,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public RepoMetadata fetchRepo(String owner, String repo, Duration timeout) throws GitHubException {
        URI uri = repoUri(owner, repo);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", "application/vnd.github+json")
            .header("X-GitHub-Api-Version", "2022-11-28");
        if (properties.getGithub().hasToken()) {
            builder.header("Authorization", "Bearer " + properties.getGithub().getToken().trim());
        }

        HttpResponse<String> response;
        try {
            response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new GitHubException(GitHubErrorKind.TIMEOUT, 0, "timeout: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new GitHubException(GitHubErrorKind.OTHER, 0, "io_error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubException(GitHubErrorKind.OTHER, 0, "interrupted", e);
        }

        int status = response.statusCode();
        if (status == 404 || status == 410 || status == 451) {
            log.warn("GitHub repository {}/{} not found (status={})", owner, repo, status);
            throw new GitHubException(GitHubErrorKind.NOT_FOUND, status, "repository_not_found");
        }
        if (isRateLimited(response)) {
            log.warn("GitHub API rate limit hit while fetching {}/{}", owner, repo);
            throw new GitHubException(GitHubErrorKind.RATE_LIMITED, status, "rate_limited");
        }
        if (status < 200 || status >= 300) {
            throw new GitHubException(GitHubErrorKind.OTHER, status, "http_" + status);
        }

        RepoPayload payload;
        try {
            payload = objectMapper.readValue(response.body(), RepoPayload.class);
        } catch (IOException e) {
            throw new GitHubException(GitHubErrorKind.OTHER, status, "invalid_payload: " + e.getMessage(), e);
        }
        log.debug("Fetched GitHub metadata for {}/{}: stars={}, archived={}", owner, repo, payload.stars(), payload.archived());
        return new RepoMetadata(
            payload.stars() == null ? 0 : payload.stars(),
            payload.description(),
            Boolean.TRUE.equals(payload.archived()),
            payload.pushedAt()
        );
    }

    private boolean isRateLimited(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429) {
            return true;
        }
        if (status != 403) {
            return false;
        }
        String remaining = response.headers().firstValue("x-ratelimit-remaining").orElse(null);
        return "0".equals(remaining) || response.headers().firstValue("retry-after").isPresent();
    }

    private URI repoUri(String owner, String repo) {
        String base = properties.getGithub().getApiBaseUrl();
        if (base == null || base.isBlank()) {
            base = "https://api.github.com";
        }
        String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return URI.create(trimmed + "/repos/" + encode(owner) + "/" + encode(repo));
    }

    private String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RepoPayload(
        @JsonProperty("stargazers_count") Integer stars,
        @JsonProperty("description") String description,
        @JsonProperty("archived") Boolean archived,
        @JsonProperty("pushed_at") Instant pushedAt
    ) {
    }
}
