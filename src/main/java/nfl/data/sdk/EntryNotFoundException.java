package nfl.data.sdk;

/**
 * Для запрошенного ключа нет файла кэша.
 */
public class EntryNotFoundException extends NflDataException {
    public EntryNotFoundException(String key) {
        super("Нет записи кэша для ключа " + key);
    }
}
