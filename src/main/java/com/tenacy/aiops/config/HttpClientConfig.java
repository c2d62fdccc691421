package com.tenacy.aiops.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * 외부 연동(Loki, Slack, GitHub)별 RestTemplate. 모든 호출에 연결/읽기 타임아웃을 건다.
 */
@Configuration
public class HttpClientConfig {

    @Bean(name = "lokiRestTemplate")
    public RestTemplate lokiRestTemplate(RestTemplateBuilder builder, DetectorProperties properties) {
        return builder
                .setConnectTimeout(properties.getLoki().getTimeout())
                .setReadTimeout(properties.getLoki().getTimeout())
                .build();
    }

    @Bean(name = "slackRestTemplate")
    public RestTemplate slackRestTemplate(RestTemplateBuilder builder, DetectorProperties properties) {
        return builder
                .setConnectTimeout(properties.getAlert().getSlack().getTimeout())
                .setReadTimeout(properties.getAlert().getSlack().getTimeout())
                .build();
    }

    @Bean(name = "githubRestTemplate")
    public RestTemplate githubRestTemplate(RestTemplateBuilder builder, DetectorProperties properties) {
        return builder
                .rootUri(properties.getRemediation().getGithub().getApiUrl())
                .setConnectTimeout(properties.getRemediation().getGithub().getTimeout())
                .setReadTimeout(properties.getRemediation().getGithub().getTimeout())
                .build();
    }
}
