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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link SourceClient} backed by JSON files laid out like the GitHub endpoints:
 *
 * <pre>
 *   organizations.json
 *   repositories/{org}.json
 *   pulls/{owner}/{repo}.json
 *   reviews/{owner}/{repo}/{number}.json
 * </pre>
 *
 * Each file holds the full collection as a single page. Tokens are ignored.
 */
public class FixtureSourceClient implements SourceClient {

    private static final Logger logger = LoggerFactory.getLogger(FixtureSourceClient.class);

    private final Path root;
    private final ObjectMapper objectMapper;

    public FixtureSourceClient(Path root) {
        this.root = root;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public Page<GitHubOrganization> listOrganizations(String token, String cursor) throws SourceException {
        return read(root.resolve("organizations.json"), new TypeReference<>() {});
    }

    @Override
    public Page<GitHubRepository> listRepositories(String token, String organizationLogin, String cursor)
            throws SourceException {
        return read(root.resolve("repositories").resolve(organizationLogin + ".json"), new TypeReference<>() {});
    }

    @Override
    public Page<GitHubPullRequest> listPullRequests(String token, String repositoryFullName, String cursor)
            throws SourceException {
        return read(root.resolve("pulls").resolve(repositoryFullName + ".json"), new TypeReference<>() {});
    }

    @Override
    public Page<GitHubReview> listReviews(String token, String repositoryFullName, int number, String cursor)
            throws SourceException {
        Path file = root.resolve("reviews").resolve(repositoryFullName).resolve(number + ".json");
        if (!Files.exists(file)) {
            // A pull request without a reviews file simply has none.
            return Page.last(List.of());
        }
        return read(file, new TypeReference<>() {});
    }

    private <T> Page<T> read(Path file, TypeReference<List<T>> typeRef) throws SourceException {
        if (!Files.isRegularFile(file)) {
            throw new NotFoundException("Fixture not found: " + file);
        }
        try {
            List<T> items = objectMapper.readValue(file.toFile(), typeRef);
            if (items == null || items.contains(null)) {
                throw new MalformedPayloadException("Fixture " + file + " is not a list of objects");
            }
            logger.debug("Loaded {} items from fixture {}", items.size(), file);
            return Page.last(items);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Malformed fixture " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new TransientException("Could not read fixture " + file, e);
        }
    }
}
