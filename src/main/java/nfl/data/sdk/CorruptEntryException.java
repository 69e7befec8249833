package nfl.data.sdk;

/**
 * Файл кэша есть, но не разбирается в корректный конверт набора данных.
 */
public class CorruptEntryException extends NflDataException {
    public CorruptEntryException(String message) {
        super(message);
    }

    public CorruptEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
