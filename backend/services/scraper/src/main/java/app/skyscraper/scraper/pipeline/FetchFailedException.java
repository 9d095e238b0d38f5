package app.skyscraper.scraper.pipeline;

import app.skyscraper.scraper.domain.type.PipelineStage;

public class FetchFailedException extends PipelineStageException {

    private final Integer httpStatus;

    public FetchFailedException(String message, Integer httpStatus, Throwable cause) {
        super(PipelineStage.fetch, message, cause);
        this.httpStatus = httpStatus;
    }

    public FetchFailedException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * HTTP status returned by the server, or {@code null} when no response was received.
     */
    public Integer getHttpStatus() {
        return httpStatus;
    }
}
