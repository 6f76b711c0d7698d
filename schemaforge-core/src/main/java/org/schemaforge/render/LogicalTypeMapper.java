package org.schemaforge.render;

import org.schemaforge.error.UnsupportedCapabilityException;
import org.schemaforge.model.ColumnDefinition;
import org.schemaforge.model.LogicalType;

import java.util.Map;

/**
 * Total mapping from logical types to one platform's physical types. A logical type the
 * platform cannot store is absent from the map and fails loudly.
 */
public class LogicalTypeMapper {

    private final Platform platform;
    private final Map<LogicalType, SqlType> types;

    public LogicalTypeMapper(Platform platform, Map<LogicalType, SqlType> types) {
        this.platform = platform;
        this.types = Map.copyOf(types);
    }

    public boolean supports(LogicalType type) {
        return types.containsKey(type);
    }

    public SqlType sqlType(LogicalType type) {
        SqlType sqlType = types.get(type);
        if (sqlType == null) {
            throw new UnsupportedCapabilityException(platform, "logical type " + type.token(), null);
        }
        return sqlType;
    }

    public String map(ColumnDefinition column) {
        if (!supports(column.getLogicalType())) {
            throw new UnsupportedCapabilityException(platform, "logical type " + column.getLogicalType().token(),
                    "column '" + column.getName() + "'");
        }
        return types.get(column.getLogicalType()).format(column);
    }
}
