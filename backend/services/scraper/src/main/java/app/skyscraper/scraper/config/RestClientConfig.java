package app.skyscraper.scraper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    static final Duration DEFAULT_WEBHOOK_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    public RestClient webhookRestClient(RestClient.Builder builder, ScraperJobProps props) {
        Duration timeout = props.webhookTimeout() == null ? DEFAULT_WEBHOOK_TIMEOUT : props.webhookTimeout();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return builder.clone()
                .requestFactory(requestFactory)
                .build();
    }
}
