package monops.batchengine.exception;

import monops.batchengine.dto.batch.PreflightReport;

/**
 * Exception thrown when an invalid batch is created without forcing execution
 */
public class BatchRejectedException extends RuntimeException {

    private final transient PreflightReport report;

    public BatchRejectedException(String message, PreflightReport report) {
        super(message);
        this.report = report;
    }

    public PreflightReport getReport() {
        return report;
    }
}
