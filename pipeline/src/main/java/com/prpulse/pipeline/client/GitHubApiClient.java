package com.prpulse.pipeline.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.prpulse.pipeline.model.GitHubOrganization;
import com.prpulse.pipeline.model.GitHubPullRequest;
import com.prpulse.pipeline.model.GitHubRepository;
import com.prpulse.pipeline.model.GitHubReview;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub REST API client returning one page per call and translating HTTP
 * failures into the {@link SourceException} hierarchy.
 *
 * <p>Retrying is the caller's business: this class makes exactly one request per
 * call. Thread-safe: the underlying {@link OkHttpClient} and {@link ObjectMapper}
 * are both thread-safe, and this class holds no mutable per-request state.</p>
 */
public class GitHubApiClient implements SourceClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubApiClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.github.com";
    static final int PER_PAGE = 100;
    static final Duration DEFAULT_RATE_LIMIT_WAIT = Duration.ofSeconds(60);

    static final Pattern LINK_NEXT_PATTERN =
            Pattern.compile("<([^>]+)>;\\s*rel=\"next\"");

    private static final TypeReference<List<GitHubOrganization>> ORGANIZATIONS = new TypeReference<>() {};
    private static final TypeReference<List<GitHubRepository>> REPOSITORIES = new TypeReference<>() {};
    private static final TypeReference<List<GitHubPullRequest>> PULL_REQUESTS = new TypeReference<>() {};
    private static final TypeReference<List<GitHubReview>> REVIEWS = new TypeReference<>() {};

    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GitHubApiClient(String baseUrl, Duration callTimeout) {
        this(baseUrl, defaultHttpClient(callTimeout), Clock.systemUTC());
    }

    public GitHubApiClient(String baseUrl, OkHttpClient httpClient, Clock clock) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.httpClient = httpClient;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * The call timeout bounds the whole exchange; a call that exceeds it surfaces
     * as an {@link java.io.InterruptedIOException} and becomes a {@link TransientException}.
     */
    private static OkHttpClient defaultHttpClient(Duration callTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .callTimeout(callTimeout)
                .build();
    }

    // -------------------------------------------------------------------------
    // SourceClient endpoints
    // -------------------------------------------------------------------------

    /**
     * Endpoint: GET /user/orgs?per_page=100
     */
    @Override
    public Page<GitHubOrganization> listOrganizations(String token, String cursor) throws SourceException {
        String url = cursor != null ? cursor : baseUrl + "/user/orgs?per_page=" + PER_PAGE;
        return fetchPage(token, url, ORGANIZATIONS);
    }

    /**
     * Endpoint: GET /orgs/{org}/repos?type=all&sort=updated&direction=desc&per_page=100
     */
    @Override
    public Page<GitHubRepository> listRepositories(String token, String organizationLogin, String cursor)
            throws SourceException {
        String url = cursor != null ? cursor : baseUrl + "/orgs/" + organizationLogin
                + "/repos?type=all&sort=updated&direction=desc&per_page=" + PER_PAGE;
        return fetchPage(token, url, REPOSITORIES);
    }

    /**
     * Endpoint: GET /repos/{owner}/{repo}/pulls?state=all&sort=updated&direction=desc&per_page=100
     */
    @Override
    public Page<GitHubPullRequest> listPullRequests(String token, String repositoryFullName, String cursor)
            throws SourceException {
        String url = cursor != null ? cursor : baseUrl + "/repos/" + repositoryFullName
                + "/pulls?state=all&sort=updated&direction=desc&per_page=" + PER_PAGE;
        return fetchPage(token, url, PULL_REQUESTS);
    }

    /**
     * Endpoint: GET /repos/{owner}/{repo}/pulls/{number}/reviews?per_page=100
     */
    @Override
    public Page<GitHubReview> listReviews(String token, String repositoryFullName, int number, String cursor)
            throws SourceException {
        String url = cursor != null ? cursor : baseUrl + "/repos/" + repositoryFullName + "/pulls/" + number
                + "/reviews?per_page=" + PER_PAGE;
        return fetchPage(token, url, REVIEWS);
    }

    // -------------------------------------------------------------------------
    // Single-page execution
    // -------------------------------------------------------------------------

    <T> Page<T> fetchPage(String token, String url, TypeReference<List<T>> typeRef) throws SourceException {
        Request request = buildRequest(url, token);

        try (Response response = httpClient.newCall(request).execute()) {
            logResponse(url, response);
            checkStatus(response, url);

            ResponseBody body = response.body();
            String json = body != null ? body.string() : "";
            List<T> items = json.isBlank() ? List.of() : objectMapper.readValue(json, typeRef);
            if (items == null || items.contains(null)) {
                throw new MalformedPayloadException("Response from " + url + " is not a list of objects");
            }
            String nextUrl = parseNextPageUrl(response.header("Link"));
            logger.debug("Fetched page with {} items from {}", items.size(), url);
            return new Page<>(items, nextUrl);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Undecodable response from " + url + ": "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            // Covers connection failures and call timeouts (InterruptedIOException).
            throw new TransientException("Request to " + url + " failed: " + e.getMessage(), e);
        }
    }

    Request buildRequest(String url, String token) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28")
                .build();
    }

    /**
     * Maps a non-2xx response onto the failure taxonomy. GitHub signals an
     * exhausted primary rate limit with 403 and a zero remaining count, and a
     * secondary limit with 403 plus Retry-After.
     */
    void checkStatus(Response response, String url) throws SourceException {
        int statusCode = response.code();
        if (statusCode >= 200 && statusCode < 300) {
            return;
        }

        if (statusCode == 401) {
            throw new UnauthorizedException("GitHub rejected the credential (401) for " + url);
        }
        if (statusCode == 429 || (statusCode == 403 && isRateLimited(response))) {
            Duration wait = getRetryAfter(response);
            throw new RateLimitedException("GitHub rate limit hit (" + statusCode + ") for " + url
                    + ", retry after " + wait.toSeconds() + "s", wait);
        }
        if (statusCode == 403) {
            throw new UnauthorizedException("GitHub denied access (403) to " + url);
        }
        if (statusCode == 404 || statusCode == 410) {
            throw new NotFoundException("GitHub resource not found (" + statusCode + "): " + url);
        }
        if (statusCode >= 500) {
            throw new TransientException("GitHub API error: " + statusCode + " for " + url);
        }
        throw new MalformedPayloadException("GitHub API rejected request: " + statusCode + " for " + url);
    }

    private static boolean isRateLimited(Response response) {
        return "0".equals(response.header("X-RateLimit-Remaining"))
                || response.header("Retry-After") != null;
    }

    // -------------------------------------------------------------------------
    // Rate limit hints
    // -------------------------------------------------------------------------

    /**
     * Uses Retry-After (seconds) when present, otherwise the distance to
     * X-RateLimit-Reset, otherwise a fixed default.
     */
    Duration getRetryAfter(Response response) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                return Duration.ofSeconds(Math.max(Long.parseLong(retryAfter.trim()), 0));
            } catch (NumberFormatException ignored) {
                // HTTP-date form; fall through to the reset header
            }
        }

        String resetHeader = response.header("X-RateLimit-Reset");
        if (resetHeader != null) {
            try {
                long resetEpoch = Long.parseLong(resetHeader.trim());
                long nowEpoch = clock.instant().getEpochSecond();
                return Duration.ofSeconds(Math.max(resetEpoch - nowEpoch + 1, 1));
            } catch (NumberFormatException ignored) {
                // fall through to default
            }
        }
        return DEFAULT_RATE_LIMIT_WAIT;
    }

    // -------------------------------------------------------------------------
    // Pagination parsing
    // -------------------------------------------------------------------------

    /**
     * Parses the "next" URL from the GitHub Link header.
     *
     * <p>Example header:
     * {@code <https://api.github.com/orgs/acme/repos?page=2>; rel="next", <...>; rel="last"}
     *
     * @return the next page URL, or {@code null} if there is no next page
     */
    static String parseNextPageUrl(String linkHeader) {
        if (linkHeader == null || linkHeader.isEmpty()) {
            return null;
        }
        Matcher matcher = LINK_NEXT_PATTERN.matcher(linkHeader);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private void logResponse(String url, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.debug("GitHub API {} {} | rate-limit-remaining: {}",
                response.code(), url, remaining != null ? remaining : "n/a");
    }
}
