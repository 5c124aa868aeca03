package com.prpulse.pipeline.sync;

import com.prpulse.pipeline.domain.Organization;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolves installation tokens from a fixed table, typically parsed from
 * configuration as {@code installationId=token,installationId=token}.
 * An organization with an installation but no table entry falls back to the
 * default token when one is configured.
 */
public class StaticCredentialProvider implements CredentialProvider {

    private final Map<String, String> tokensByInstallation;
    private final String fallbackToken;

    public StaticCredentialProvider(Map<String, String> tokensByInstallation, String fallbackToken) {
        this.tokensByInstallation = Map.copyOf(tokensByInstallation);
        this.fallbackToken = fallbackToken;
    }

    @Override
    public String tokenFor(Organization organization) throws MissingAuthorizationException {
        String installationId = organization.installationId();
        if (installationId == null || installationId.isBlank()) {
            throw new MissingAuthorizationException(
                    "Organization " + organization.login() + " has no installation linked");
        }
        String token = tokensByInstallation.getOrDefault(installationId, fallbackToken);
        if (token == null || token.isBlank()) {
            throw new MissingAuthorizationException(
                    "No token available for installation " + installationId + " of " + organization.login());
        }
        return token;
    }

    /**
     * Parses {@code id=token} pairs separated by commas. Blank input yields an empty map.
     *
     * @throws IllegalArgumentException on an entry without {@code =}
     */
    public static Map<String, String> parseTokens(String pairs) {
        Map<String, String> tokens = new HashMap<>();
        if (pairs == null || pairs.isBlank()) {
            return tokens;
        }
        for (String entry : pairs.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0 || eq == trimmed.length() - 1) {
                throw new IllegalArgumentException("Malformed installation token entry: " + trimmed);
            }
            tokens.put(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1).trim());
        }
        return tokens;
    }
}
