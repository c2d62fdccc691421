package com.tenacy.aiops.remediation;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenacy.aiops.config.DetectorProperties;
import com.tenacy.aiops.domain.IssueCreationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * GitHub REST API 이슈 생성.
 */
@Slf4j
@Component
public class GitHubIssueTracker implements IssueTracker {

    private final RestTemplate restTemplate;
    private final DetectorProperties.Github github;

    public GitHubIssueTracker(@Qualifier("githubRestTemplate") RestTemplate restTemplate,
                              DetectorProperties properties) {
        this.restTemplate = restTemplate;
        this.github = properties.getRemediation().getGithub();
    }

    @Override
    public boolean isConfigured() {
        return github.isConfigured();
    }

    @Override
    public IssueCreationResult createIssue(String title, String body) {
        if (!isConfigured()) {
            return IssueCreationResult.failed("GitHub token or repository not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "token " + github.getToken());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        Map<String, String> payload = Map.of("title", title, "body", body);

        try {
            JsonNode issue = restTemplate.postForObject(
                    "/repos/{repository}/issues",
                    new HttpEntity<>(payload, headers),
                    JsonNode.class,
                    Map.of("repository", github.getRepository()));

            String url = issue != null ? issue.path("html_url").asText(null) : null;
            log.info("Created GitHub issue: {}", url);
            return IssueCreationResult.created(url);
        } catch (Exception e) {
            log.error("Failed to create GitHub issue: {}", e.getMessage(), e);
            return IssueCreationResult.failed(e.getMessage());
        }
    }
}
