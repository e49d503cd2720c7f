package com.example.commitnotifier.domain;

import com.example.commitnotifier.exception.InvalidRepositoryException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Owner, name and optional branch of a GitHub repository.
 * <p>
 * The canonical string form is {@code owner/repo} or {@code owner/repo:branch}.
 * {@link #parse(String)} also accepts GitHub URLs, with or without a
 * {@code /tree/branch} suffix and a {@code .git} suffix.
 */
@Getter
@EqualsAndHashCode
public final class RepositoryCoordinates {

    private static final Pattern URL_WITH_BRANCH =
            Pattern.compile("^https?://github\\.com/([^/]+)/([^/\\s]+)/tree/([^/\\s]+)", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> URL_PATTERNS = List.of(
            Pattern.compile("^https?://github\\.com/([^/]+)/([^/\\s]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^github\\.com/([^/]+)/([^/\\s]+)", Pattern.CASE_INSENSITIVE));

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_.-]+");

    private final String owner;
    private final String repo;
    private final String branch;

    public RepositoryCoordinates(String owner, String repo, String branch) {
        if (owner == null || !NAME.matcher(owner).matches() || repo == null || !NAME.matcher(repo).matches()) {
            throw new InvalidRepositoryException(owner + "/" + repo);
        }
        this.owner = owner;
        this.repo = repo;
        this.branch = branch != null && !branch.isBlank() ? branch : null;
    }

    public static RepositoryCoordinates parse(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidRepositoryException(String.valueOf(input));
        }
        var normalized = normalize(input);

        String path = normalized;
        String branch = null;
        var colon = normalized.indexOf(':');
        if (colon >= 0) {
            path = normalized.substring(0, colon);
            branch = normalized.substring(colon + 1);
            if (branch.isBlank()) {
                throw new InvalidRepositoryException(input);
            }
        }

        var parts = path.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new InvalidRepositoryException(input);
        }
        try {
            return new RepositoryCoordinates(parts[0], parts[1], branch);
        } catch (InvalidRepositoryException e) {
            throw new InvalidRepositoryException(input);
        }
    }

    /**
     * Reduce the accepted URL forms to {@code owner/repo[:branch]}
     */
    static String normalize(String input) {
        var normalized = input.trim().replace("\"", "").replace("'", "");

        var withBranch = URL_WITH_BRANCH.matcher(normalized);
        if (withBranch.find()) {
            return withBranch.group(1) + "/" + stripGitSuffix(withBranch.group(2)) + ":" + withBranch.group(3);
        }

        for (var pattern : URL_PATTERNS) {
            var matcher = pattern.matcher(normalized);
            if (matcher.find()) {
                return matcher.group(1) + "/" + stripGitSuffix(matcher.group(2));
            }
        }

        return normalized;
    }

    private static String stripGitSuffix(String repo) {
        return repo.endsWith(".git") ? repo.substring(0, repo.length() - 4) : repo;
    }

    public String fullName() {
        return owner + "/" + repo;
    }

    public boolean hasBranch() {
        return branch != null;
    }

    public String toRepoString() {
        return hasBranch() ? fullName() + ":" + branch : fullName();
    }

    @Override
    public String toString() {
        return toRepoString();
    }
}
