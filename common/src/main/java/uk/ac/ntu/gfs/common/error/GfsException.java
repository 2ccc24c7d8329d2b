package uk.ac.ntu.gfs.common.error;

public class GfsException extends Exception {
    private final ErrorKind kind;

    public GfsException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GfsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }

    public static GfsException notFound(String message) {
        return new GfsException(ErrorKind.NOT_FOUND, message);
    }

    public static GfsException conflict(String message) {
        return new GfsException(ErrorKind.CONFLICT, message);
    }

    public static GfsException unavailable(String message) {
        return new GfsException(ErrorKind.UNAVAILABLE, message);
    }

    public static GfsException badRequest(String message) {
        return new GfsException(ErrorKind.BAD_REQUEST, message);
    }
}
