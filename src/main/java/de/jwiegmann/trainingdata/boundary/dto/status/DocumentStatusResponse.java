package de.jwiegmann.trainingdata.boundary.dto.status;

import com.fasterxml.jackson.annotation.JsonInclude;
import de.jwiegmann.trainingdata.entity.DocumentStatus;
import de.jwiegmann.trainingdata.entity.DocumentTask;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentStatusResponse {
    private String name;
    private DocumentStatus status;
    private int recordCount;
    private String error;
    private List<String> warnings;

    public static DocumentStatusResponse of(DocumentTask task) {
        return DocumentStatusResponse.builder()
                .name(task.getName())
                .status(task.getStatus())
                .recordCount(task.getRecordCount())
                .error(task.getError())
                .warnings(task.getWarnings())
                .build();
    }
}
