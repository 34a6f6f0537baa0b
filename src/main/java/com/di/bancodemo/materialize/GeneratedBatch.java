package com.di.bancodemo.materialize;

import com.di.bancodemo.exception.SchemaException;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.schemas.logicaltypes.SqlTypes;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.values.PBegin;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows generated for one materialization, each stamped with the run's execution date
 * in a trailing {@code data_execucao} column. Applied to a pipeline it becomes the
 * source of the write.
 */
public class GeneratedBatch extends PTransform<PBegin, PCollection<Row>> {

    public static final String EXECUTION_DATE_COLUMN = "data_execucao";
    public static final Schema.FieldType EXECUTION_DATE_TYPE = Schema.FieldType.logicalType(SqlTypes.DATE);

    private final Schema schema;
    private final List<Row> rows;
    private final LocalDate executionDate;

    private GeneratedBatch(Schema schema, List<Row> rows, LocalDate executionDate) {
        super("GeneratedBatch");
        this.schema = schema;
        this.rows = rows;
        this.executionDate = executionDate;
    }

    /**
     * Appends {@code data_execucao = executionDate} to every row.
     *
     * @throws SchemaException when the generator schema already has a {@code data_execucao} column
     */
    public static GeneratedBatch stamp(Schema generatorSchema, List<Row> generated, LocalDate executionDate) {
        Schema stamped = withExecutionDate(generatorSchema);
        List<Row> out = new ArrayList<>(generated.size());
        for (Row row : generated) {
            out.add(Row.withSchema(stamped)
                    .addValues(row.getValues())
                    .addValue(executionDate)
                    .build());
        }
        return new GeneratedBatch(stamped, Collections.unmodifiableList(out), executionDate);
    }

    /**
     * The generator schema plus the execution-date column.
     */
    public static Schema withExecutionDate(Schema generatorSchema) {
        if (generatorSchema.hasField(EXECUTION_DATE_COLUMN)) {
            throw new SchemaException("Schema already has a column named '" + EXECUTION_DATE_COLUMN
                    + "'; it is reserved for the execution date");
        }
        return Schema.builder()
                .addFields(generatorSchema.getFields())
                .addField(EXECUTION_DATE_COLUMN, EXECUTION_DATE_TYPE)
                .build();
    }

    @Override
    public PCollection<Row> expand(PBegin input) {
        return input.apply("CreateRows", Create.of(rows).withRowSchema(schema));
    }

    public Schema getSchema() {
        return schema;
    }

    public List<Row> getRows() {
        return rows;
    }

    public LocalDate getExecutionDate() {
        return executionDate;
    }
}
