package app.skyscraper.scraper.pipeline;

import app.skyscraper.scraper.domain.type.PipelineStage;

/**
 * Unexpected error raised inside a stage, recorded against that stage.
 */
public class StageFailedException extends PipelineStageException {

    public StageFailedException(PipelineStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }
}
