package app.skyscraper.scraper.domain.type;

public enum JobStatus {
    queued,
    running,
    completed,
    failed;

    public boolean isTerminal() {
        return this == completed || this == failed;
    }

    public boolean canMoveTo(JobStatus next) {
        return switch (this) {
            case queued -> next == running;
            case running -> next == completed || next == failed;
            case completed, failed -> false;
        };
    }
}
