package nfl.data.sdk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Табличный набор данных с явной схемой колонок.
 *
 * <p>Ячейки приводятся к типу колонки в конструкторе, поэтому наборы с одинаковыми
 * значениями {@code equals} независимо от того, пришли они из сети или из кэша.
 */
public final class Dataset {
    private final List<Column> columns;
    private final List<List<Object>> rows;

    public Dataset(List<Column> columns, List<? extends List<?>> rows) {
        this.columns = List.copyOf(columns);
        List<List<Object>> normalized = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<?> row = rows.get(r);
            if (row.size() != this.columns.size()) {
                throw new IllegalArgumentException("В строке " + r + " ячеек " + row.size()
                        + ", ожидалось " + this.columns.size());
            }
            List<Object> cells = new ArrayList<>(row.size());
            for (int c = 0; c < row.size(); c++) {
                cells.add(this.columns.get(c).type.coerce(row.get(c)));
            }
            normalized.add(Collections.unmodifiableList(cells));
        }
        this.rows = Collections.unmodifiableList(normalized);
    }

    public static Dataset empty() {
        return new Dataset(List.of(), List.of());
    }

    public List<Column> columns() {
        return columns;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnIndex(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name.equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public Object get(int row, String column) {
        int index = columnIndex(column);
        if (index < 0) {
            throw new IllegalArgumentException("Неизвестная колонка: " + column);
        }
        return rows.get(row).get(index);
    }

    /**
     * Оставляет только указанные колонки в заданном порядке.
     */
    public Dataset select(List<String> names) {
        int[] indexes = new int[names.size()];
        List<Column> selected = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            indexes[i] = columnIndex(names.get(i));
            if (indexes[i] < 0) {
                throw new IllegalArgumentException("Неизвестная колонка: " + names.get(i));
            }
            selected.add(columns.get(indexes[i]));
        }
        List<List<Object>> projected = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> cells = new ArrayList<>(indexes.length);
            for (int index : indexes) {
                cells.add(row.get(index));
            }
            projected.add(cells);
        }
        return new Dataset(selected, projected);
    }

    public Dataset filter(Predicate<List<Object>> predicate) {
        List<List<Object>> kept = new ArrayList<>();
        for (List<Object> row : rows) {
            if (predicate.test(row)) {
                kept.add(row);
            }
        }
        return new Dataset(columns, kept);
    }

    /**
     * Строки, где {@code column} равна {@code value}. Значение приводится к типу
     * колонки, так что {@code filter("season", 2023)} находит ячейки {@code 2023L}.
     */
    public Dataset filter(String column, Object value) {
        int index = columnIndex(column);
        if (index < 0) {
            throw new IllegalArgumentException("Неизвестная колонка: " + column);
        }
        Object expected = columns.get(index).type.coerce(value);
        return filter(row -> Objects.equals(row.get(index), expected));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dataset)) {
            return false;
        }
        Dataset other = (Dataset) o;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns.size() + ", rows=" + rows.size() + "}";
    }

    public static final class Column {
        public final String name;
        public final ColumnType type;

        public Column(String name, ColumnType type) {
            this.name = Objects.requireNonNull(name, "name");
            this.type = Objects.requireNonNull(type, "type");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Column)) {
                return false;
            }
            Column other = (Column) o;
            return name.equals(other.name) && type == other.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type);
        }

        @Override
        public String toString() {
            return name + ":" + type;
        }
    }
}
