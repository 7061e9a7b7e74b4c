/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tessera.sql.expression;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Physical layout of a row: the ordered columns an expression can be bound to.
 * Columns are identified by their unique id.
 */
public final class Schema
{
    private final List<ColumnReference> columns;
    private final Map<Long, Integer> offsets;

    public Schema(List<ColumnReference> columns)
    {
        this.columns = ImmutableList.copyOf(requireNonNull(columns, "columns is null"));
        Map<Long, Integer> offsets = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            Integer previous = offsets.put(this.columns.get(i).getUniqueId(), i);
            checkArgument(previous == null, "Duplicate column in schema: %s", this.columns.get(i));
        }
        this.offsets = ImmutableMap.copyOf(offsets);
    }

    public static Schema of(ColumnReference... columns)
    {
        return new Schema(ImmutableList.copyOf(columns));
    }

    public List<ColumnReference> getColumns()
    {
        return columns;
    }

    public int size()
    {
        return columns.size();
    }

    /**
     * @return the offset of {@code column} in this schema, or -1 if the schema does not contain it
     */
    public int getColumnIndex(ColumnReference column)
    {
        return offsets.getOrDefault(column.getUniqueId(), -1);
    }

    public boolean contains(ColumnReference column)
    {
        return offsets.containsKey(column.getUniqueId());
    }

    @Override
    public String toString()
    {
        return "Schema" + columns;
    }
}
