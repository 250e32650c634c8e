package com.herzen.irt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.irt.estimation.ModelEstimationClient;
import com.herzen.irt.estimation.ModelType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class ApiControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ModelEstimationClient estimationClient;

    @BeforeEach
    void setUp() {
        when(estimationClient.isAvailable()).thenReturn(true);
        when(estimationClient.fit(any(), eq(ModelType.RICH), anyLong(), anyInt())).thenReturn(TestData.richModel());
    }

    private String upload(String fileName, String content) throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", fileName, "text/csv", content.getBytes(StandardCharsets.UTF_8));
        MvcResult result = mockMvc.perform(multipart("/api/upload").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.task_id").isNotEmpty())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("session_id").asText();
    }

    private void awaitCompletion(String sessionId) throws Exception {
        for (int i = 0; i < 100; i++) {
            String body = mockMvc.perform(get("/api/status/{id}", sessionId))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();
            String status = objectMapper.readTree(body).get("status").asText();
            if (status.equals("completed")) {
                return;
            }
            assertNotEquals("error", status, body);
            Thread.sleep(50);
        }
        fail("Analysis did not complete for " + sessionId);
    }

    @Test
    void uploadAnalyzeAndFetchCurves() throws Exception {
        String sessionId = upload("responses.csv", TestData.csv(TestData.mixedRows(12)));
        awaitCompletion(sessionId);

        mockMvc.perform(get("/api/analysis/{id}", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.analysis_type").value("3PL"))
                .andExpect(jsonPath("$.data_summary.n_students").value(12))
                .andExpect(jsonPath("$.item_parameters", hasSize(TestData.ITEMS)))
                .andExpect(jsonPath("$.item_parameters[0].item_id").value("item_1"))
                .andExpect(jsonPath("$.test_information.theta", hasSize(101)));

        mockMvc.perform(get("/api/icc/{id}", sessionId).param("item_id", "item_3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.curves", hasSize(1)))
                .andExpect(jsonPath("$.curves[0].item_id").value("item_3"))
                .andExpect(jsonPath("$.curves[0].curve.values", hasSize(101)));

        mockMvc.perform(get("/api/iif/{id}", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.curves", hasSize(TestData.ITEMS)));

        mockMvc.perform(get("/api/tif/{id}", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.theta[0]").value(-4.0))
                .andExpect(jsonPath("$.information", hasSize(101)));

        mockMvc.perform(get("/api/export/csv/{id}", sessionId))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString(sessionId)))
                .andExpect(content().string(startsWith("item_id,discrimination,difficulty")))
                .andExpect(content().string(containsString("item_5,")));

        verify(estimationClient, times(1)).fit(any(), eq(ModelType.RICH), anyLong(), anyInt());
    }

    @Test
    void exportsResultAsJson() throws Exception {
        String sessionId = upload("responses.csv", TestData.csv(TestData.mixedRows(12)));
        awaitCompletion(sessionId);

        mockMvc.perform(get("/api/export/json/{id}", sessionId))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString(sessionId + ".json")))
                .andExpect(jsonPath("$.metadata.export_version").value("1.0"))
                .andExpect(jsonPath("$.metadata.software").value("IRT Analysis Platform"))
                .andExpect(jsonPath("$.metadata.export_timestamp").isNotEmpty())
                .andExpect(jsonPath("$.session_info.session_id").value(sessionId))
                .andExpect(jsonPath("$.session_info.analysis_type").value("3PL"))
                .andExpect(jsonPath("$.data_summary.n_items").value(TestData.ITEMS))
                .andExpect(jsonPath("$.model_fit.reliability").value(0.71))
                .andExpect(jsonPath("$.item_parameters", hasSize(TestData.ITEMS)))
                .andExpect(jsonPath("$.test_information.information", hasSize(101)));

        mockMvc.perform(get("/api/export/json/{id}", "missing-session"))
                .andExpect(status().isNotFound());
    }

    @Test
    void constantItemColumnIsRemovedBeforeFitting() throws Exception {
        StringBuilder csv = new StringBuilder("student_id,q1,q2,q3,q4,q5,q6\n");
        List<List<String>> rows = TestData.mixedRows(12);
        for (int i = 0; i < rows.size(); i++) {
            csv.append("s").append(i + 1).append(',').append(String.join(",", rows.get(i))).append(",1\n");
        }

        String sessionId = upload("responses.csv", csv.toString());
        awaitCompletion(sessionId);

        mockMvc.perform(get("/api/analysis/{id}", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data_summary.n_items").value(TestData.ITEMS))
                .andExpect(jsonPath("$.data_summary.item_labels", hasSize(TestData.ITEMS)))
                .andExpect(jsonPath("$.data_summary.item_labels[4]").value("q5"));
        verify(estimationClient).fit(argThat(m -> m.itemCount() == TestData.ITEMS), eq(ModelType.RICH), anyLong(), anyInt());
    }

    @Test
    void rejectsUploadWithFewerThanTwoVaryingItems() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "flat.csv", "text/csv",
                "q1,q2,q3\n1,0,1\n1,1,1\n1,0,1\n".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("SCHEMA"))
                .andExpect(jsonPath("$.error").value("Not enough valid items after removing invariant ones"));
        verify(estimationClient, never()).fit(any(), any(), anyLong(), anyInt());
    }

    @Test
    void unknownItemIdIsBadRequest() throws Exception {
        String sessionId = upload("responses.csv", TestData.csv(TestData.mixedRows(12)));
        awaitCompletion(sessionId);

        mockMvc.perform(get("/api/icc/{id}", sessionId).param("item_id", "item_42"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        mockMvc.perform(get("/api/analysis/{id}", "missing-session"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("SESSION_NOT_FOUND"));
        mockMvc.perform(get("/api/tif/{id}", "missing-session"))
                .andExpect(status().isNotFound());
    }

    @Test
    void rejectsNonCsvUpload() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "responses.xlsx", "application/octet-stream", new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/api/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Only CSV files are supported"));
    }

    @Test
    void rejectsMalformedCsv() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "broken.csv", "text/csv",
                "q1,q2,q3\n1,0\n".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("SCHEMA"));
    }
}
