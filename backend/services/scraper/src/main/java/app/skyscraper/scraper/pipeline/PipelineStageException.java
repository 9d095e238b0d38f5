package app.skyscraper.scraper.pipeline;

import app.skyscraper.scraper.domain.type.PipelineStage;

/**
 * Failure that aborts a scrape job. The stage is recorded on the failed job together
 * with the message.
 */
public abstract class PipelineStageException extends RuntimeException {

    private final PipelineStage stage;

    protected PipelineStageException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
