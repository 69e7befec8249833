package nfl.data.sdk;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipException;

/**
 * Сжатый gzip JSON-конверт для закэшированных наборов:
 * <pre>
 * {"format":"nfl-data-cache","version":1,
 *  "columns":[{"name":"season","type":"LONG"}],
 *  "rows":[[2023]]}
 * </pre>
 */
final class DatasetCodec {
    static final String FORMAT = "nfl-data-cache";
    static final int VERSION = 1;

    private static final JsonFactory JSON = new JsonFactory();

    private DatasetCodec() {
    }

    static void encode(Dataset dataset, OutputStream out) throws IOException {
        GZIPOutputStream gzip = new GZIPOutputStream(out);
        try (JsonGenerator gen = JSON.createGenerator(gzip)) {
            gen.writeStartObject();
            gen.writeStringField("format", FORMAT);
            gen.writeNumberField("version", VERSION);
            gen.writeArrayFieldStart("columns");
            for (Dataset.Column column : dataset.columns()) {
                gen.writeStartObject();
                gen.writeStringField("name", column.name);
                gen.writeStringField("type", column.type.name());
                gen.writeEndObject();
            }
            gen.writeEndArray();
            gen.writeArrayFieldStart("rows");
            for (List<Object> row : dataset.rows()) {
                gen.writeStartArray();
                for (Object cell : row) {
                    writeCell(gen, cell);
                }
                gen.writeEndArray();
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
    }

    private static void writeCell(JsonGenerator gen, Object cell) throws IOException {
        if (cell == null) {
            gen.writeNull();
        } else if (cell instanceof Long) {
            gen.writeNumber((Long) cell);
        } else if (cell instanceof Double) {
            double value = (Double) cell;
            // в JSON нет литералов NaN/Infinity
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                gen.writeString(Double.toString(value));
            } else {
                gen.writeNumber(value);
            }
        } else if (cell instanceof Boolean) {
            gen.writeBoolean((Boolean) cell);
        } else {
            gen.writeString(cell.toString());
        }
    }

    /**
     * @throws CorruptEntryException если поток не является полным корректным конвертом
     * @throws IOException           при прочих ошибках чтения
     */
    static Dataset decode(InputStream in) throws IOException, CorruptEntryException {
        try (JsonParser parser = JSON.createParser(new GZIPInputStream(in))) {
            expect(parser.nextToken(), JsonToken.START_OBJECT, "envelope");
            String format = null;
            Integer version = null;
            List<Dataset.Column> columns = null;
            List<List<Object>> rows = null;
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.currentName();
                JsonToken value = parser.nextToken();
                switch (field) {
                    case "format":
                        expect(value, JsonToken.VALUE_STRING, "format");
                        format = parser.getText();
                        break;
                    case "version":
                        expect(value, JsonToken.VALUE_NUMBER_INT, "version");
                        version = parser.getIntValue();
                        break;
                    case "columns":
                        columns = readColumns(parser);
                        break;
                    case "rows":
                        if (columns == null) {
                            throw new CorruptEntryException("rows идут раньше columns");
                        }
                        rows = readRows(parser, columns);
                        break;
                    default:
                        parser.skipChildren();
                }
            }
            expect(parser.currentToken(), JsonToken.END_OBJECT, "envelope end");
            if (!FORMAT.equals(format)) {
                throw new CorruptEntryException("Неожиданный маркер формата: " + format);
            }
            if (version == null || version != VERSION) {
                throw new CorruptEntryException("Неподдерживаемая версия конверта: " + version);
            }
            if (columns == null || rows == null) {
                throw new CorruptEntryException("В конверте нет columns или rows");
            }
            return new Dataset(columns, rows);
        } catch (JsonProcessingException | ZipException | EOFException e) {
            throw new CorruptEntryException("Некорректный конверт кэша: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CorruptEntryException("Некорректное значение в кэше: " + e.getMessage(), e);
        }
    }

    private static List<Dataset.Column> readColumns(JsonParser parser) throws IOException, CorruptEntryException {
        expect(parser.currentToken(), JsonToken.START_ARRAY, "columns");
        List<Dataset.Column> columns = new ArrayList<>();
        while (parser.nextToken() == JsonToken.START_OBJECT) {
            String name = null;
            String type = null;
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.currentName();
                parser.nextToken();
                if ("name".equals(field)) {
                    name = parser.getValueAsString();
                } else if ("type".equals(field)) {
                    type = parser.getValueAsString();
                } else {
                    parser.skipChildren();
                }
            }
            if (name == null || type == null) {
                throw new CorruptEntryException("Колонка без имени или типа");
            }
            columns.add(new Dataset.Column(name, ColumnType.valueOf(type)));
        }
        expect(parser.currentToken(), JsonToken.END_ARRAY, "columns end");
        return columns;
    }

    private static List<List<Object>> readRows(JsonParser parser, List<Dataset.Column> columns)
            throws IOException, CorruptEntryException {
        expect(parser.currentToken(), JsonToken.START_ARRAY, "rows");
        List<List<Object>> rows = new ArrayList<>();
        while (parser.nextToken() == JsonToken.START_ARRAY) {
            List<Object> row = new ArrayList<>(columns.size());
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token == null) {
                    throw new CorruptEntryException("Обрезанная строка " + rows.size());
                }
                if (row.size() >= columns.size()) {
                    throw new CorruptEntryException("В строке " + rows.size() + " слишком много ячеек");
                }
                row.add(readCell(parser, token, columns.get(row.size()).type));
            }
            if (row.size() != columns.size()) {
                throw new CorruptEntryException("В строке " + rows.size() + " ячеек " + row.size()
                        + ", ожидалось " + columns.size());
            }
            rows.add(row);
        }
        expect(parser.currentToken(), JsonToken.END_ARRAY, "rows end");
        return rows;
    }

    private static Object readCell(JsonParser parser, JsonToken token, ColumnType type)
            throws IOException, CorruptEntryException {
        if (token == JsonToken.VALUE_NULL) {
            return null;
        }
        switch (type) {
            case LONG:
                expect(token, JsonToken.VALUE_NUMBER_INT, "LONG cell");
                return parser.getLongValue();
            case DOUBLE:
                if (token == JsonToken.VALUE_STRING) {
                    return Double.valueOf(parser.getText());
                }
                if (token != JsonToken.VALUE_NUMBER_FLOAT && token != JsonToken.VALUE_NUMBER_INT) {
                    throw new CorruptEntryException("Ожидалась ячейка DOUBLE, получено " + token);
                }
                return parser.getDoubleValue();
            case BOOLEAN:
                if (token != JsonToken.VALUE_TRUE && token != JsonToken.VALUE_FALSE) {
                    throw new CorruptEntryException("Ожидалась ячейка BOOLEAN, получено " + token);
                }
                return parser.getBooleanValue();
            default:
                expect(token, JsonToken.VALUE_STRING, "STRING cell");
                return parser.getText();
        }
    }

    private static void expect(JsonToken actual, JsonToken expected, String what) throws CorruptEntryException {
        if (actual != expected) {
            throw new CorruptEntryException("Ожидалось " + expected + " для " + what + ", получено " + actual);
        }
    }
}
