package com.example.deal_bot.publish;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.RequiredArgsConstructor;

@Component
@Profile("real")
@RequiredArgsConstructor
public class TwitterPublisher implements Publisher {

    private static final Logger log = LoggerFactory.getLogger(TwitterPublisher.class);

    private final TwitterProperties config;
    private final WebClient.Builder webClientBuilder;

    @Override
    public String publish(String text) {
        log.info("POST /2/tweets ({} chars)", text.length());

        try {
            JsonNode response = webClient()
                    .post()
                    .uri(config.getApiBase() + "/2/tweets")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getBearerToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("text", text))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(config.getRequestTimeout());

            String id = response == null ? null : response.path("data").path("id").asText(null);
            if (id == null || id.isBlank()) {
                throw new PublishException("POST /2/tweets: no id in response", true);
            }
            log.info("POST /2/tweets success id={}", id);
            return id;

        } catch (WebClientResponseException e) {
            boolean retryable = e.getStatusCode() == HttpStatus.TOO_MANY_REQUESTS || e.getStatusCode().is5xxServerError();
            log.error("POST /2/tweets failed status={} body={}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new PublishException("publish failed: " + e.getStatusCode(), retryable, e);
        } catch (PublishException e) {
            throw e;
        } catch (Exception e) {
            log.error("POST /2/tweets error", e);
            throw new PublishException("publish error: " + e.getMessage(), true, e);
        }
    }

    private WebClient webClient() {
        return webClientBuilder
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
