package de.jwiegmann.trainingdata.control.processing;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import de.jwiegmann.trainingdata.entity.OutputFormat;
import de.jwiegmann.trainingdata.entity.TrainingRecord;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Rendert TrainingRecords im gewünschten Ausgabeformat (JSONL: ein Objekt pro Zeile, CSV mit Header).
 */
@Component
public class RecordFormatter {

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema csvSchema = csvMapper.schemaFor(CsvRow.class).withHeader();

    public RecordFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String format(List<TrainingRecord> records, OutputFormat format) {
        try {
            return switch (format) {
                case JSONL -> toJsonLines(records);
                case CSV -> csvMapper.writer(csvSchema).writeValueAsString(
                        records.stream().map(CsvRow::of).toList());
            };
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("could not render records as " + format.getValue(), e);
        }
    }

    private String toJsonLines(List<TrainingRecord> records) throws JsonProcessingException {
        StringBuilder out = new StringBuilder();
        for (TrainingRecord record : records) {
            out.append(objectMapper.writeValueAsString(record)).append('\n');
        }
        return out.toString();
    }

    @Value
    @JsonPropertyOrder({"sourceDocument", "chunkIndex", "classLabel", "text"})
    static class CsvRow {
        String sourceDocument;
        int chunkIndex;
        String classLabel;
        String text;

        static CsvRow of(TrainingRecord record) {
            return new CsvRow(
                    record.getSourceDocument(),
                    record.getChunkIndex(),
                    record.getMetadata().getOrDefault(TrainingRecord.CLASS_LABEL, ""),
                    record.getText());
        }
    }
}
