package com.initialone.jdocgap.vcs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jdocgap.config.DocGapConfig;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Commits the modified files on a fresh branch, pushes it to {@code origin} and opens a
 * GitHub pull request against the configured base branch.
 */
public class GitHubChangePublisher implements ChangePublisher {

    private static final Pattern GITHUB_REMOTE =
            Pattern.compile("github\\.com[:/]([^/]+)/([^/]+?)(?:\\.git)?/?$");
    private static final MediaType JSON = MediaType.parse("application/json");

    private final Path workDir;
    private final DocGapConfig.GitHub cfg;
    private final String token;
    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();

    public GitHubChangePublisher(Path workDir, DocGapConfig.GitHub cfg) {
        this(workDir, cfg, System.getenv(cfg.tokenEnv));
    }

    GitHubChangePublisher(Path workDir, DocGapConfig.GitHub cfg, String token) {
        this.workDir = workDir;
        this.cfg = cfg;
        this.token = token;
        this.http = new OkHttpClient.Builder()
                .callTimeout(60, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public Optional<String> createDocumentationChange(List<Path> filesModified, int symbolCount) {
        if (filesModified == null || filesModified.isEmpty()) {
            System.out.println("[vcs] no files were modified, skipping pull request");
            return Optional.empty();
        }
        if (token == null || token.isBlank()) {
            System.err.println("[vcs] " + cfg.tokenEnv + " is not set, skipping pull request");
            return Optional.empty();
        }

        FileRepositoryBuilder builder = new FileRepositoryBuilder().findGitDir(workDir.toAbsolutePath().toFile());
        if (builder.getGitDir() == null) {
            System.err.println("[vcs] not a git repository: " + workDir.toAbsolutePath());
            return Optional.empty();
        }

        try (Repository repository = builder.build(); Git git = new Git(repository)) {
            String slug = cfg.repository;
            if (slug == null || slug.isBlank()) {
                String remote = repository.getConfig().getString("remote", "origin", "url");
                slug = ownerAndRepo(remote).orElse(null);
            }
            if (slug == null) {
                System.err.println("[vcs] could not determine the GitHub repository from the origin remote");
                return Optional.empty();
            }

            String branch = "docgap-auto-docs-" + Instant.now().getEpochSecond();
            System.out.println("[vcs] creating branch " + branch);
            git.checkout().setCreateBranch(true).setName(branch).call();

            Path top = repository.getWorkTree().toPath().toAbsolutePath().normalize();
            for (Path f : filesModified) {
                String rel = top.relativize(f.toAbsolutePath().normalize()).toString().replace('\\', '/');
                git.add().addFilepattern(rel).call();
            }
            git.commit().setMessage(commitMessage(filesModified, symbolCount)).call();

            System.out.println("[vcs] pushing " + branch + " to origin");
            git.push()
                    .setRemote("origin")
                    .setRefSpecs(new RefSpec("refs/heads/" + branch + ":refs/heads/" + branch))
                    .setCredentialsProvider(new UsernamePasswordCredentialsProvider("x-access-token", token))
                    .call();

            String url = openPullRequest(slug, branch, filesModified, symbolCount);
            System.out.println("[vcs] created pull request: " + url);
            return Optional.of(url);
        } catch (Exception e) {
            System.err.println("[vcs] pull request failed: " + e.getMessage());
            return Optional.empty();
        }
    }

    private String openPullRequest(String slug, String branch, List<Path> files, int symbolCount) throws Exception {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", cfg.prTitlePrefix.strip() + " Auto-generate documentation for "
                + symbolCount + " functions/classes");
        payload.put("head", branch);
        payload.put("base", cfg.baseBranch);
        payload.put("body", prBody(cfg.prBodyTemplate, files, symbolCount));

        String apiBase = cfg.apiBase.endsWith("/") ? cfg.apiBase.substring(0, cfg.apiBase.length() - 1) : cfg.apiBase;
        Request req = new Request.Builder()
                .url(apiBase + "/repos/" + slug + "/pulls")
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/vnd.github+json")
                .post(RequestBody.create(om.writeValueAsString(payload), JSON))
                .build();

        try (Response resp = http.newCall(req).execute()) {
            String body = resp.body() == null ? "" : resp.body().string();
            if (!resp.isSuccessful()) {
                throw new IllegalStateException("GitHub API error " + resp.code() + ": " + body);
            }
            JsonNode root = om.readTree(body);
            String url = root.path("html_url").asText("");
            if (url.isEmpty()) throw new IllegalStateException("no html_url in GitHub response");
            return url;
        }
    }

    /** "owner/repo" from an HTTPS or SSH GitHub remote. */
    static Optional<String> ownerAndRepo(String remoteUrl) {
        if (remoteUrl == null) return Optional.empty();
        Matcher m = GITHUB_REMOTE.matcher(remoteUrl.trim());
        if (!m.find()) return Optional.empty();
        return Optional.of(m.group(1) + "/" + m.group(2));
    }

    static String commitMessage(List<Path> files, int symbolCount) {
        return "docs: Auto-generate documentation for " + symbolCount + " functions/classes\n\n"
                + "Files modified: " + files.stream().map(Path::toString).collect(Collectors.joining(", "));
    }

    static String prBody(String template, List<Path> files, int symbolCount) {
        String list = files.stream().map(f -> "- " + f).collect(Collectors.joining("\n"));
        return template
                .replace("{files_modified}", list)
                .replace("{files}", String.valueOf(files.size()))
                .replace("{symbols}", String.valueOf(symbolCount));
    }
}
