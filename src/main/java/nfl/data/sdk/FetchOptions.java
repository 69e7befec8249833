package nfl.data.sdk;

import java.util.List;

/**
 * Параметры запроса данных, которые применяются к результату фасадом.
 */
public class FetchOptions {
    private static final FetchOptions NONE = new FetchOptions(null);

    /** Оставляемые колонки по порядку; {@code null} — все колонки. */
    public final List<String> columns;

    private FetchOptions(List<String> columns) {
        this.columns = columns == null ? null : List.copyOf(columns);
    }

    public static FetchOptions none() {
        return NONE;
    }

    public static FetchOptions columns(List<String> columns) {
        return columns == null || columns.isEmpty() ? NONE : new FetchOptions(columns);
    }
}
