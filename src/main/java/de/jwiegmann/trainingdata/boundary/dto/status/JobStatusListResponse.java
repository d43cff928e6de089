package de.jwiegmann.trainingdata.boundary.dto.status;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusListResponse {
    private int total;                          // Anzahl Jobs des Users
    private List<JobStatusResponse> items;      // neueste zuerst
}
