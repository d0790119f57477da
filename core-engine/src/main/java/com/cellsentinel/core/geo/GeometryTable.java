package com.cellsentinel.core.geo;

import com.cellsentinel.core.model.CellGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated, cell-id indexed view over the antenna geometry rows.
 *
 * <p>
 * Every row is checked with {@link CellGeometry#validate()} at construction,
 * so the resolver never computes bearings from malformed data. Insertion order
 * is preserved.
 * </p>
 *
 * @since 1.0.0
 */
public final class GeometryTable {

    private static final Logger LOG = LoggerFactory.getLogger(GeometryTable.class);

    private final Map<String, CellGeometry> cells;

    /**
     * @param rows geometry rows; must not be {@code null}
     * @throws IllegalStateException if any row is invalid or a cell id appears
     *                               more than once
     */
    public GeometryTable(Collection<CellGeometry> rows) {
        Objects.requireNonNull(rows, "Geometry rows must not be null");
        Map<String, CellGeometry> index = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();

        for (CellGeometry row : rows) {
            Objects.requireNonNull(row, "Geometry row must not be null");
            try {
                row.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
                continue;
            }
            if (index.putIfAbsent(row.getCellId(), row) != null) {
                errors.add("Duplicate cell_id '" + row.getCellId() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Geometry table validation failed:\n  - " + String.join("\n  - ", errors));
        }

        this.cells = Collections.unmodifiableMap(index);
        LOG.debug("Geometry table built with {} cell(s)", cells.size());
    }

    public static GeometryTable empty() {
        return new GeometryTable(List.of());
    }

    public Optional<CellGeometry> find(String cellId) {
        return Optional.ofNullable(cells.get(cellId));
    }

    public boolean contains(String cellId) {
        return cells.containsKey(cellId);
    }

    /**
     * @return unmodifiable view of all rows, in insertion order
     */
    public Collection<CellGeometry> rows() {
        return cells.values();
    }

    /**
     * Rows of the given cells, in table order. Unknown ids are ignored.
     *
     * @param cellIds cell ids to keep
     * @return new list of matching rows
     */
    public List<CellGeometry> restrictTo(Collection<String> cellIds) {
        Objects.requireNonNull(cellIds, "Cell ids must not be null");
        return cells.values().stream()
                .filter(row -> cellIds.contains(row.getCellId()))
                .toList();
    }

    public int size() {
        return cells.size();
    }

    @Override
    public String toString() {
        return "GeometryTable{cells=" + cells.size() + '}';
    }
}
