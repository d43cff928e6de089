package de.jwiegmann.trainingdata.boundary;

import com.jayway.jsonpath.JsonPath;
import de.jwiegmann.trainingdata.PdfFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = "auth.tokens=token-alice=alice,token-bob=bob")
@AutoConfigureMockMvc
class BatchApiIntegrationTest {

    private static final String ALICE = "Bearer token-alice";
    private static final String BOB = "Bearer token-bob";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void batch_with_one_corrupt_file_ends_in_partial_success() throws Exception {

        MockMultipartFile manual = new MockMultipartFile("files", "manual.pdf", "application/pdf",
                PdfFixtures.pdf("Operators must wear gloves"));
        MockMultipartFile broken = new MockMultipartFile("files", "broken.pdf", "application/pdf",
                "not a pdf".getBytes(StandardCharsets.US_ASCII));
        MockMultipartFile notes = new MockMultipartFile("files", "notes.txt", "text/plain",
                "Staff should rest".getBytes(StandardCharsets.UTF_8));

        // 1) Batch einreichen
        String submitResp = mockMvc.perform(multipart("/batch-process")
                        .file(manual).file(broken).file(notes)
                        .param("userId", "alice")
                        .param("projectName", "Safety")
                        .param("chunkSize", "200")
                        .param("overlap", "0")
                        .param("outputFormat", "csv")
                        .header(HttpHeaders.AUTHORIZATION, ALICE))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").exists())
                .andExpect(jsonPath("$.batchProjectId").exists())
                .andExpect(jsonPath("$.documents").value(3))
                .andReturn().getResponse().getContentAsString();

        String jobId = JsonPath.read(submitResp, "$.jobId");
        String batchProjectId = JsonPath.read(submitResp, "$.batchProjectId");

        // 2) Polling bis terminal
        await().atMost(10, TimeUnit.SECONDS).until(() -> {
            String statusResp = mockMvc.perform(get("/process-status").param("jobId", jobId)
                            .header(HttpHeaders.AUTHORIZATION, ALICE))
                    .andReturn().getResponse().getContentAsString();
            return "PARTIAL_SUCCESS".equals(JsonPath.read(statusResp, "$.status"));
        });

        String statusResp = mockMvc.perform(get("/process-status").param("jobId", jobId)
                        .header(HttpHeaders.AUTHORIZATION, ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.projectName").value("Safety"))
                .andExpect(jsonPath("$.progress").value(100))
                .andExpect(jsonPath("$.documents.length()").value(3))
                .andExpect(jsonPath("$.documents[1].name").value("broken.pdf"))
                .andExpect(jsonPath("$.documents[1].status").value("FAILED"))
                .andExpect(jsonPath("$.documents[1].error", startsWith("ExtractionError")))
                .andReturn().getResponse().getContentAsString();

        List<String> statuses = JsonPath.read(statusResp, "$.documents[*].status");
        assertThat(statuses).containsExactly("SUCCEEDED", "FAILED", "SUCCEEDED");

        // 3) Ergebnis als CSV in Einreichungsreihenfolge
        String csv = mockMvc.perform(get("/batch-process").param("batchProjectId", batchProjectId)
                        .header(HttpHeaders.AUTHORIZATION, ALICE))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andReturn().getResponse().getContentAsString();

        List<String> lines = csv.lines().toList();
        assertThat(lines.get(0)).isEqualTo("sourceDocument,chunkIndex,classLabel,text");
        assertThat(lines).hasSize(3);
        assertThat(lines.get(1)).startsWith("manual.pdf,0,");
        assertThat(lines.get(2)).startsWith("notes.txt,0,");

        // 4) Job erscheint in der Liste
        mockMvc.perform(get("/jobs").header(HttpHeaders.AUTHORIZATION, ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total", greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.items[?(@.jobId=='" + jobId + "')]").exists());

        // 5) für andere User unsichtbar
        mockMvc.perform(get("/process-status").param("jobId", jobId)
                        .header(HttpHeaders.AUTHORIZATION, BOB))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/batch-process").param("batchProjectId", batchProjectId)
                        .header(HttpHeaders.AUTHORIZATION, BOB))
                .andExpect(status().isNotFound());
    }

    @Test
    void class_filter_and_jsonl_output() throws Exception {
        MockMultipartFile rules = new MockMultipartFile("files", "rules.txt", "text/plain",
                ("Visitors must sign in. Lunch is at noon.  Doors shall stay closed.").getBytes(StandardCharsets.UTF_8));

        String submitResp = mockMvc.perform(multipart("/batch-process")
                        .file(rules)
                        .param("chunkSize", "1")
                        .param("overlap", "0")
                        .param("chunkUnit", "token")
                        .param("classFilter", "Critical")
                        .header(HttpHeaders.AUTHORIZATION, ALICE))
                .andExpect(status().isAccepted())
                .andReturn().getResponse().getContentAsString();

        String jobId = JsonPath.read(submitResp, "$.jobId");
        String batchProjectId = JsonPath.read(submitResp, "$.batchProjectId");
        awaitStatus(jobId, "SUCCEEDED");

        String jsonl = mockMvc.perform(get("/batch-process").param("batchProjectId", batchProjectId)
                        .header(HttpHeaders.AUTHORIZATION, ALICE))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        List<String> texts = jsonl.lines().map(l -> (String) JsonPath.read(l, "$.text")).toList();
        assertThat(texts).containsExactly("must", "shall");
        assertThat(jsonl.lines().map(l -> (String) JsonPath.read(l, "$.metadata.classLabel")).toList())
                .containsOnly("Critical");
    }

    @Test
    void invalid_batch_requests_are_rejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("files", "a.txt", "text/plain",
                "text".getBytes(StandardCharsets.UTF_8));

        // keine Dateien
        mockMvc.perform(multipart("/batch-process")
                        .param("projectName", "empty")
                        .header(HttpHeaders.AUTHORIZATION, ALICE))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        // ungültiges Ausgabeformat
        mockMvc.perform(multipart("/batch-process").file(file)
                        .param("outputFormat", "xml")
                        .header(HttpHeaders.AUTHORIZATION, ALICE))
                .andExpect(status().isBadRequest());

        // userId eines anderen Users
        mockMvc.perform(multipart("/batch-process").file(file)
                        .param("userId", "bob")
                        .header(HttpHeaders.AUTHORIZATION, ALICE))
                .andExpect(status().isForbidden());

        // ohne Token
        mockMvc.perform(multipart("/batch-process").file(file))
                .andExpect(status().isUnauthorized());

        // fehlender Pflichtparameter
        mockMvc.perform(get("/process-status").header(HttpHeaders.AUTHORIZATION, ALICE))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void cancel_job_checks_the_user_and_returns_the_snapshot() throws Exception {
        MockMultipartFile file = new MockMultipartFile("files", "a.txt", "text/plain",
                "some text".getBytes(StandardCharsets.UTF_8));

        String submitResp = mockMvc.perform(multipart("/batch-process").file(file)
                        .header(HttpHeaders.AUTHORIZATION, ALICE))
                .andExpect(status().isAccepted())
                .andReturn().getResponse().getContentAsString();
        String jobId = JsonPath.read(submitResp, "$.jobId");

        mockMvc.perform(post("/cancel-job")
                        .header(HttpHeaders.AUTHORIZATION, ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jobId\":\"" + jobId + "\",\"userId\":\"bob\"}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/cancel-job")
                        .header(HttpHeaders.AUTHORIZATION, BOB)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jobId\":\"" + jobId + "\",\"userId\":\"bob\"}"))
                .andExpect(status().isNotFound());

        // Ergebnis hängt vom Timing ab; der Job endet in jedem Fall terminal
        mockMvc.perform(post("/cancel-job")
                        .header(HttpHeaders.AUTHORIZATION, ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"jobId\":\"" + jobId + "\",\"userId\":\"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value(jobId));

        await().atMost(10, TimeUnit.SECONDS).until(() -> {
            String statusResp = mockMvc.perform(get("/process-status").param("jobId", jobId)
                            .header(HttpHeaders.AUTHORIZATION, ALICE))
                    .andReturn().getResponse().getContentAsString();
            String status = JsonPath.read(statusResp, "$.status");
            return "SUCCEEDED".equals(status) || "FAILED".equals(status);
        });
    }

    private void awaitStatus(String jobId, String expected) {
        await().atMost(10, TimeUnit.SECONDS).until(() -> {
            String statusResp = mockMvc.perform(get("/process-status").param("jobId", jobId)
                            .header(HttpHeaders.AUTHORIZATION, ALICE))
                    .andReturn().getResponse().getContentAsString();
            return expected.equals(JsonPath.read(statusResp, "$.status"));
        });
    }
}
