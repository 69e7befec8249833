package nfl.data.sdk;

import java.util.List;

/**
 * Источник наборов данных, которые слишком дорого скачивать при каждом вызове.
 * Таймауты и отмена — забота реализации.
 */
public interface RemoteFetcher {

    /**
     * @return полный набор колонок, без проекции
     */
    Dataset fetch(DatasetKind kind, List<Integer> seasons) throws FetchException;
}
