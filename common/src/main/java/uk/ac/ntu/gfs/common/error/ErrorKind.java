package uk.ac.ntu.gfs.common.error;

public enum ErrorKind {
    NOT_FOUND(404),
    CONFLICT(409),
    UNAVAILABLE(503),
    BAD_REQUEST(400),
    TRANSPORT_FAILURE(502),
    PERSISTENCE_FAILURE(500);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() { return httpStatus; }

    public static ErrorKind fromStatus(int status) {
        return switch (status) {
            case 400 -> BAD_REQUEST;
            case 404 -> NOT_FOUND;
            case 409 -> CONFLICT;
            case 503 -> UNAVAILABLE;
            default -> TRANSPORT_FAILURE;
        };
    }
}
