package nfl.data.sdk;

/**
 * Базовое исключение для ошибок SDK.
 */
public class NflDataException extends Exception {
    public NflDataException(String message) {
        super(message);
    }

    public NflDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
