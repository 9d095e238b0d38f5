package app.skyscraper.scraper.compliance;

public record ComplianceVerdict(
        boolean allowed,
        String reason,
        String policySource
) {

    public static ComplianceVerdict allow(String reason, String policySource) {
        return new ComplianceVerdict(true, reason, policySource);
    }

    public static ComplianceVerdict deny(String reason, String policySource) {
        return new ComplianceVerdict(false, reason, policySource);
    }
}
