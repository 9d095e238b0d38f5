package app.skyscraper.scraper.service;

import app.skyscraper.scraper.domain.job.ScrapeJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts the terminal job record to the caller's webhook. One attempt; failures are logged
 * and never change the job.
 */
@Component
public class WebhookNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private final RestClient restClient;
    private final ScrapeJobResponseMapper responseMapper;

    public WebhookNotifier(@Qualifier("webhookRestClient") RestClient restClient,
                           ScrapeJobResponseMapper responseMapper) {
        this.restClient = restClient;
        this.responseMapper = responseMapper;
    }

    public boolean deliver(ScrapeJob job) {
        if (job == null || !job.status().isTerminal() || !job.input().hasWebhook()) {
            return false;
        }
        String target = job.input().webhookUrl();
        try {
            restClient.post()
                    .uri(target)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(responseMapper.toResponse(job))
                    .retrieve()
                    .toBodilessEntity();
            log.info("Webhook delivered jobId={} status={} target={}", job.jobId(), job.status(), target);
            return true;
        } catch (RestClientException | IllegalArgumentException ex) {
            log.warn("Webhook delivery failed jobId={} target={} error={}",
                    job.jobId(), target, ScrapePipeline.summarizeError(ex));
            return false;
        }
    }
}
