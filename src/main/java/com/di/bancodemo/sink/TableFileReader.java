package com.di.bancodemo.sink;

import com.di.bancodemo.util.TypeConverter;
import org.apache.avro.generic.GenericRecord;
import org.apache.beam.sdk.extensions.avro.schemas.utils.AvroUtils;
import org.apache.beam.sdk.io.parquet.ParquetIO;
import org.apache.beam.sdk.schemas.Schema;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PBegin;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads every Parquet file under a table directory (partition and bucket subpaths included)
 * as rows of a known schema. A column missing from the files reads as null.
 */
public class TableFileReader extends PTransform<PBegin, PCollection<Row>> {

    private final String location;
    private final Schema schema;

    private TableFileReader(String location, Schema schema) {
        this.location = location;
        this.schema = schema;
    }

    public static TableFileReader parquet(String location, Schema schema) {
        return new TableFileReader(location.endsWith("/") ? location : location + "/", schema);
    }

    @Override
    public PCollection<Row> expand(PBegin input) {
        org.apache.avro.Schema avroSchema = AvroUtils.toAvroSchema(schema);
        return input
                .apply("ReadParquet", ParquetIO.read(avroSchema).from(location + "**"))
                .apply("ToRows", ParDo.of(new ToRowFn(schema)))
                .setRowSchema(schema);
    }

    static class ToRowFn extends DoFn<GenericRecord, Row> {
        private final Schema schema;

        ToRowFn(Schema schema) {
            this.schema = schema;
        }

        @ProcessElement
        public void process(@Element GenericRecord record, OutputReceiver<Row> out) {
            out.output(toRow(record, schema));
        }
    }

    static Row toRow(GenericRecord record, Schema schema) {
        List<Object> values = new ArrayList<>(schema.getFieldCount());
        for (Schema.Field field : schema.getFields()) {
            Object raw = record.getSchema().getField(field.getName()) == null ? null : record.get(field.getName());
            values.add(TypeConverter.convertToSchemaType(raw, field));
        }
        return Row.withSchema(schema).addValues(values).build();
    }
}
