package nfl.data.sdk;

import java.util.regex.Pattern;

/**
 * Типы ячеек колонки {@link Dataset}.
 */
public enum ColumnType {
    STRING,
    LONG,
    DOUBLE,
    BOOLEAN;

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d{1,18}");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    /**
     * Приводит ячейку к Java-представлению этого типа.
     *
     * @throws IllegalArgumentException если значение не представимо
     */
    public Object coerce(Object value) {
        if (value == null) {
            return null;
        }
        switch (this) {
            case LONG:
                if (value instanceof Long) {
                    return value;
                }
                if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                    return ((Number) value).longValue();
                }
                break;
            case DOUBLE:
                if (value instanceof Number) {
                    return ((Number) value).doubleValue();
                }
                break;
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                break;
            default:
                if (value instanceof String) {
                    return value;
                }
        }
        throw new IllegalArgumentException("Значение " + value + " (" + value.getClass().getSimpleName()
                + ") не является " + this);
    }

    /**
     * Разбирает текст из CSV. Пустые ячейки и {@code NA} дают null.
     */
    public Object parse(String raw) {
        if (isMissing(raw)) {
            return null;
        }
        String text = raw.trim();
        switch (this) {
            case LONG:
                return Long.parseLong(text.startsWith("+") ? text.substring(1) : text);
            case DOUBLE:
                return Double.parseDouble(text);
            case BOOLEAN:
                return Boolean.parseBoolean(text);
            default:
                return raw;
        }
    }

    /**
     * Выбирает самый узкий тип, в который помещаются все непустые значения.
     */
    public static ColumnType infer(Iterable<String> rawValues) {
        boolean allLong = true;
        boolean allDouble = true;
        boolean allBoolean = true;
        boolean any = false;
        for (String raw : rawValues) {
            if (isMissing(raw)) {
                continue;
            }
            any = true;
            String text = raw.trim();
            allLong = allLong && INTEGER.matcher(text).matches();
            allDouble = allDouble && DECIMAL.matcher(text).matches();
            allBoolean = allBoolean && (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false"));
            if (!allLong && !allDouble && !allBoolean) {
                return STRING;
            }
        }
        if (!any) {
            return STRING;
        }
        if (allLong) {
            return LONG;
        }
        if (allDouble) {
            return DOUBLE;
        }
        return allBoolean ? BOOLEAN : STRING;
    }

    static boolean isMissing(String raw) {
        return raw == null || raw.trim().isEmpty() || raw.trim().equals("NA");
    }
}
