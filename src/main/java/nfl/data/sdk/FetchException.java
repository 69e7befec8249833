package nfl.data.sdk;

/**
 * Удалённый источник не смог отдать данные: сеть, код ответа, некорректный ответ
 * или недопустимый диапазон сезонов.
 */
public class FetchException extends NflDataException {
    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
