package app.skyscraper.scraper.pipeline;

import app.skyscraper.scraper.compliance.ComplianceVerdict;
import app.skyscraper.scraper.domain.type.PipelineStage;

public class ComplianceDeniedException extends PipelineStageException {

    private final ComplianceVerdict verdict;

    public ComplianceDeniedException(ComplianceVerdict verdict) {
        super(PipelineStage.compliance, verdict.reason(), null);
        this.verdict = verdict;
    }

    public ComplianceVerdict getVerdict() {
        return verdict;
    }
}
