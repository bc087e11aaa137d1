package idmapper.processing.track_post_processing;

/**
 * Outcome of {@link TrackSplitter#split}. When the status is not {@link Status#OK} the store was not modified.
 */
public class SplitResult {
    public enum Status {OK, UNKNOWN_TRACK_ID, SPLIT_AT_START, OUT_OF_BOUNDS}
    final Status status;
    final int newId;
    final int newSegmentLength;
    final String message;

    SplitResult(Status status, int newId, int newSegmentLength, String message) {
        this.status = status;
        this.newId = newId;
        this.newSegmentLength = newSegmentLength;
        this.message = message;
    }

    static SplitResult failure(Status status, String message) {
        return new SplitResult(status, -1, 0, message);
    }

    public boolean isSuccess() {
        return status == Status.OK;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return identifier allocated for the detached segment, -1 on failure
     */
    public int getNewId() {
        return newId;
    }

    /**
     * @return number of detections of the segment moved to the new identifier
     */
    public int getNewSegmentLength() {
        return newSegmentLength;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return status+": "+message;
    }
}
