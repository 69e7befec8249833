package nfl.data.sdk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Загружает наборы данных из CSV-файлов релизов nflverse.
 */
public class NflverseFetcher implements RemoteFetcher, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NflverseFetcher.class);

    private static final String WEEKLY_URL = "%s/player_stats/player_stats_%d.csv";
    private static final String PBP_URL = "%s/pbp/play_by_play_%d.csv";
    private static final String DRAFT_URL = "%s/draft_picks/draft_picks.csv";

    private final String baseUrl;
    private final OkHttpClient client;
    private final CsvMapper csv = new CsvMapper();

    public NflverseFetcher(String baseUrl, Duration readTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.client = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .followRedirects(true)
                .build();
    }

    @Override
    public Dataset fetch(DatasetKind kind, List<Integer> seasons) throws FetchException {
        Set<Integer> wanted = validate(kind, seasons);
        List<RawTable> tables = new ArrayList<>();
        if (kind == DatasetKind.DRAFT) {
            tables.add(filterSeasons(download(String.format(DRAFT_URL, baseUrl)), wanted));
        } else {
            String template = kind == DatasetKind.WEEKLY ? WEEKLY_URL : PBP_URL;
            for (int season : wanted) {
                tables.add(download(String.format(template, baseUrl, season)));
            }
        }
        Dataset dataset = merge(tables);
        log.debug("Получено {} строк {} за сезоны {}", dataset.rowCount(), kind.cacheName(), wanted);
        return dataset;
    }

    private static Set<Integer> validate(DatasetKind kind, List<Integer> seasons) throws FetchException {
        if (seasons == null || seasons.isEmpty()) {
            throw new FetchException("Нужен хотя бы один сезон");
        }
        Set<Integer> wanted = new LinkedHashSet<>();
        for (Integer season : seasons) {
            if (season == null || season < kind.firstSeason()) {
                throw new FetchException("Сезон " + season + " недоступен для данных " + kind.cacheName()
                        + " (первый сезон " + kind.firstSeason() + ")");
            }
            wanted.add(season);
        }
        return wanted;
    }

    private RawTable download(String url) throws FetchException {
        Request request = new Request.Builder().url(url).build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new FetchException("Ошибка запроса к nflverse [" + response.code() + "]: " + url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new FetchException("Пустое тело ответа от " + url);
            }
            return parse(body, url);
        } catch (JsonProcessingException e) {
            throw new FetchException("Некорректный CSV от " + url + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FetchException("Ошибка сети при загрузке " + url + ": " + e.getMessage(), e);
        }
    }

    private RawTable parse(ResponseBody body, String url) throws IOException, FetchException {
        try (MappingIterator<String[]> lines = csv.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(body.charStream())) {
            if (!lines.hasNextValue()) {
                throw new FetchException("Пустой CSV от " + url);
            }
            String[] header = lines.nextValue();
            List<String[]> rows = new ArrayList<>();
            while (lines.hasNextValue()) {
                String[] row = lines.nextValue();
                if (row.length != header.length) {
                    throw new FetchException("Некорректный CSV от " + url + ": в строке " + (rows.size() + 2)
                            + " полей " + row.length + ", в заголовке " + header.length);
                }
                rows.add(row);
            }
            return new RawTable(header, rows);
        }
    }

    private static RawTable filterSeasons(RawTable table, Set<Integer> seasons) throws FetchException {
        int index = table.indexOf("season");
        if (index < 0) {
            throw new FetchException("В данных драфта нет колонки season");
        }
        List<String[]> kept = new ArrayList<>();
        for (String[] row : table.rows) {
            Object season = ColumnType.isMissing(row[index]) ? null : parseSeason(row[index]);
            if (season != null && seasons.contains(season)) {
                kept.add(row);
            }
        }
        return new RawTable(table.header, kept);
    }

    private static Integer parseSeason(String raw) throws FetchException {
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new FetchException("Некорректное значение сезона в данных драфта: " + raw, e);
        }
    }

    /**
     * Склеивает таблицы по именам колонок; отсутствующие ячейки становятся null.
     */
    static Dataset merge(List<RawTable> tables) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (RawTable table : tables) {
            for (String name : table.header) {
                positions.putIfAbsent(name, positions.size());
            }
        }
        List<String[]> aligned = new ArrayList<>();
        for (RawTable table : tables) {
            int[] target = new int[table.header.length];
            for (int i = 0; i < target.length; i++) {
                target[i] = positions.get(table.header[i]);
            }
            for (String[] row : table.rows) {
                String[] cells = new String[positions.size()];
                for (int i = 0; i < row.length; i++) {
                    cells[target[i]] = row[i];
                }
                aligned.add(cells);
            }
        }

        List<Dataset.Column> columns = new ArrayList<>(positions.size());
        for (Map.Entry<String, Integer> entry : positions.entrySet()) {
            int index = entry.getValue();
            List<String> values = new ArrayList<>(aligned.size());
            for (String[] cells : aligned) {
                values.add(cells[index]);
            }
            columns.add(new Dataset.Column(entry.getKey(), ColumnType.infer(values)));
        }

        List<List<Object>> rows = new ArrayList<>(aligned.size());
        for (String[] cells : aligned) {
            List<Object> row = new ArrayList<>(cells.length);
            for (int i = 0; i < cells.length; i++) {
                row.add(columns.get(i).type.parse(cells[i]));
            }
            rows.add(row);
        }
        return new Dataset(columns, rows);
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        try {
            if (!client.dispatcher().executorService().awaitTermination(1, TimeUnit.SECONDS)) {
                client.dispatcher().executorService().shutdownNow();
            }
        } catch (InterruptedException e) {
            client.dispatcher().executorService().shutdownNow();
            Thread.currentThread().interrupt();
        }
        client.connectionPool().evictAll();
    }

    static final class RawTable {
        final String[] header;
        final List<String[]> rows;

        RawTable(String[] header, List<String[]> rows) {
            this.header = header;
            this.rows = rows;
        }

        int indexOf(String name) {
            for (int i = 0; i < header.length; i++) {
                if (header[i].equals(name)) {
                    return i;
                }
            }
            return -1;
        }
    }
}
