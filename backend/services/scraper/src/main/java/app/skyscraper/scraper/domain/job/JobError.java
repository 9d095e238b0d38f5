package app.skyscraper.scraper.domain.job;

import app.skyscraper.scraper.domain.type.PipelineStage;

public record JobError(PipelineStage stage, String reason) {
}
