package app.skyscraper.scraper.pipeline;

import app.skyscraper.scraper.domain.type.PipelineStage;

public class ExtractionFailedException extends PipelineStageException {

    public ExtractionFailedException(String message, Throwable cause) {
        super(PipelineStage.extract, message, cause);
    }
}
