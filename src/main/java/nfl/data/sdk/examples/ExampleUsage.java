package nfl.data.sdk.examples;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import nfl.data.sdk.CacheConfig;
import nfl.data.sdk.Dataset;
import nfl.data.sdk.NflDataException;
import nfl.data.sdk.NflDataSDK;

import java.util.List;

/**
 * Пример использования NflDataSDK: загружает статистику квотербеков через кэш.
 * С аргументом {@code clear} очищает кэш.
 */
public class ExampleUsage {
    private static final Logger log = LoggerFactory.getLogger(ExampleUsage.class);

    private static final List<Integer> SEASONS = List.of(2020, 2021, 2022, 2023, 2024);
    private static final List<String> QB_COLUMNS = List.of(
            "season", "week", "player_id", "player_name", "position", "recent_team",
            "completions", "attempts", "passing_yards", "passing_tds", "interceptions",
            "passing_epa");

    public static void main(String[] args) {
        CacheConfig config = CacheConfig.load();

        try (NflDataSDK sdk = NflDataSDK.getInstance(config)) {
            if (args.length > 0 && args[0].equals("clear")) {
                sdk.clearCache(true);
                return;
            }

            sdk.listCachedEntries();

            log.info("Получение данных по QB для анализа...");
            Dataset weekly = sdk.getWeeklyData(SEASONS, false, QB_COLUMNS);
            Dataset quarterbacks = weekly.filter("position", "QB");
            log.info("Получено {} записей QB за {}-{}", quarterbacks.rowCount(),
                    SEASONS.get(0), SEASONS.get(SEASONS.size() - 1));

            sdk.listCachedEntries();
            log.info("Следующий запуск возьмёт данные из кэша, пока запись моложе {} дней",
                    config.maxAge.toDays());
        } catch (NflDataException e) {
            log.error("Ошибка при получении данных NFL: {}", e.getMessage(), e);
        }
    }
}
