package com.datamodel.matching.core.model;

/**
 * Column of a profiled source table.
 *
 * @param name       column name
 * @param dataType   physical datatype string, may be empty
 * @param statistics profiling statistics, never null
 */
public record PhysicalColumn(String name, String dataType, ColumnStatistics statistics) {

    public PhysicalColumn {
        name = name != null ? name : "";
        dataType = dataType != null ? dataType : "";
        statistics = statistics != null ? statistics : ColumnStatistics.empty();
    }

    public PhysicalColumn(String name, String dataType) {
        this(name, dataType, ColumnStatistics.empty());
    }
}
