package monops.batchengine.exception;

public class BatchCancelledException extends FatalBatchException {

    public static final String REASON = "cancelled";

    public BatchCancelledException() {
        super(REASON);
    }
}
