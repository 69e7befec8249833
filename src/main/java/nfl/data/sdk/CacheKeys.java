package nfl.data.sdk;

import java.util.Collection;
import java.util.Collections;

/**
 * Строит ключи кэша вида {@code weekly_2023} или {@code weekly_2020-2024}.
 *
 * <p>В ключ попадают только минимальный и максимальный период, поэтому
 * {@code [2020, 2024]} и {@code [2020, 2022, 2024]} делят одну запись. Данные всегда
 * запрашиваются за непрерывный диапазон сезонов.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static <T extends Comparable<? super T>> String buildKey(String kind, Collection<T> periods) {
        if (kind == null || kind.trim().isEmpty()) {
            throw new IllegalArgumentException("Тип данных не может быть пустым");
        }
        if (periods == null || periods.isEmpty()) {
            throw new IllegalArgumentException("Нужен хотя бы один период");
        }
        if (periods.size() == 1) {
            return kind + "_" + periods.iterator().next();
        }
        return kind + "_" + Collections.min(periods) + "-" + Collections.max(periods);
    }

    public static String buildKey(DatasetKind kind, Collection<Integer> seasons) {
        return buildKey(kind.cacheName(), seasons);
    }
}
