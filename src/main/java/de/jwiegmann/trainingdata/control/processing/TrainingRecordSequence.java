package de.jwiegmann.trainingdata.control.processing;

import de.jwiegmann.trainingdata.entity.ChunkUnit;
import de.jwiegmann.trainingdata.entity.ProcessingOptions;
import de.jwiegmann.trainingdata.entity.TrainingRecord;
import lombok.Value;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Lazy, endliche und wiederholbar iterierbare Folge von TrainingRecords über einem Text.
 * Jeder Aufruf von {@link #stream()} bzw. {@link #iterator()} beginnt von vorn; Fenster werden erst beim Konsum erzeugt.
 */
public class TrainingRecordSequence implements Iterable<TrainingRecord> {

    private static final Pattern TOKEN = Pattern.compile("\\S+");

    private final String sourceDocument;
    private final String text;
    private final ProcessingOptions options;
    private final Classifier classifier;

    TrainingRecordSequence(String sourceDocument, String text, ProcessingOptions options, Classifier classifier) {
        this.sourceDocument = sourceDocument;
        this.text = text;
        this.options = options;
        this.classifier = classifier;
    }

    @Override
    public Iterator<TrainingRecord> iterator() {
        return stream().iterator();
    }

    public Stream<TrainingRecord> stream() {
        Stream<TrainingRecord> records = windows().map(this::toRecord);

        if (options.isClassFilterActive()) {
            records = records
                    .map(this::classify)
                    .filter(r -> options.getClassFilter().equalsIgnoreCase(r.getMetadata().get(TrainingRecord.CLASS_LABEL)));
        }

        if (options.getMaxRecordsPerDocument() > 0) {
            records = records.limit(options.getMaxRecordsPerDocument());
        }
        return records;
    }

    private Stream<TextWindow> windows() {
        if (options.getChunkUnit() == ChunkUnit.TOKEN) {
            return tokenWindows();
        }
        // Fenster zählen Codepoints, Surrogatpaare werden nie getrennt
        int[] offsets = codePointOffsets(text);
        int length = offsets.length - 1;
        int count = windowCount(length, options.getChunkSize(), options.getOverlap());
        int step = options.getChunkSize() - options.getOverlap();
        return IntStream.range(0, count)
                .mapToObj(i -> {
                    int start = i * step;
                    int end = Math.min(start + options.getChunkSize(), length);
                    return new TextWindow(i, offsets[start], offsets[end]);
                });
    }

    /**
     * char-Index jedes Codepoints plus {@code text.length()} als letzter Eintrag.
     */
    static int[] codePointOffsets(String text) {
        int[] offsets = new int[text.codePointCount(0, text.length()) + 1];
        int k = 0;
        for (int i = 0; i < text.length(); i = text.offsetByCodePoints(i, 1)) {
            offsets[k++] = i;
        }
        offsets[k] = text.length();
        return offsets;
    }

    private Stream<TextWindow> tokenWindows() {
        List<int[]> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(new int[]{matcher.start(), matcher.end()});
        }

        int count = windowCount(tokens.size(), options.getChunkSize(), options.getOverlap());
        int step = options.getChunkSize() - options.getOverlap();
        return IntStream.range(0, count)
                .mapToObj(i -> {
                    int first = i * step;
                    int last = Math.min(first + options.getChunkSize(), tokens.size()) - 1;
                    return new TextWindow(i, tokens.get(first)[0], tokens.get(last)[1]);
                });
    }

    /**
     * Anzahl der Fenster, bis das letzte Fenster das Ende der Einheitenfolge erreicht.
     */
    static int windowCount(int length, int chunkSize, int overlap) {
        if (length == 0) {
            return 0;
        }
        if (length <= chunkSize) {
            return 1;
        }
        int step = chunkSize - overlap;
        return (length - chunkSize + step - 1) / step + 1;
    }

    private TrainingRecord toRecord(TextWindow window) {
        return TrainingRecord.builder()
                .text(text.substring(window.getStart(), window.getEnd()))
                .sourceDocument(sourceDocument)
                .chunkIndex(window.getIndex())
                .build();
    }

    private TrainingRecord classify(TrainingRecord record) {
        String label = classifier.classify(record.getText());
        return TrainingRecord.builder()
                .text(record.getText())
                .sourceDocument(record.getSourceDocument())
                .chunkIndex(record.getChunkIndex())
                .metadata(Map.of(TrainingRecord.CLASS_LABEL, label))
                .build();
    }

    @Value
    private static class TextWindow {
        int index;
        int start;
        int end;
    }
}
