package nfl.data.sdk;

/**
 * Ошибка ввода-вывода при записи, удалении или очистке файлов кэша.
 */
public class StorageException extends NflDataException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
