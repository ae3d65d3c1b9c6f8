package com.boardwatch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.sql.Timestamp;
import java.time.Instant;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class WatchApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void statusReportsDatabaseAndSecret() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dbConnectivity").value(true))
            .andExpect(jsonPath("$.secretAccessible").value(true))
            .andExpect(jsonPath("$.counts.watch_configurations").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.counts.execution_records").value(greaterThanOrEqualTo(0)));
    }

    @Test
    void triggerAcceptsGetAndPostWithNothingDue() throws Exception {
        mockMvc.perform(get("/api/scheduler/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.message").value("No active configurations found"))
            .andExpect(jsonPath("$.error").doesNotExist())
            .andExpect(jsonPath("$.configurations_evaluated").value(0))
            .andExpect(jsonPath("$.results.length()").value(0));

        mockMvc.perform(post("/api/scheduler/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true));
    }

    @Test
    void unreachableBoardIsRecordedAsErrorAndReportedInResults() throws Exception {
        insertHourlyConfiguration("smoke-1");

        mockMvc.perform(post("/api/scheduler/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.message").value("Executed 1 jobs, 0 successful"))
            .andExpect(jsonPath("$.jobs_succeeded").value(0))
            .andExpect(jsonPath("$.total_articles_sent").value(0))
            .andExpect(jsonPath("$.results[0].config_id").value("smoke-1"))
            .andExpect(jsonPath("$.results[0].config_name").value("Smoke"))
            .andExpect(jsonPath("$.results[0].status").value("error"))
            .andExpect(jsonPath("$.results[0].error_message").value(startsWith("Board fetch error: ")));

        mockMvc.perform(get("/api/executions/smoke-1").param("limit", "500"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].status").value("error"));

        mockMvc.perform(get("/api/configurations/smoke-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.lastExecutionStatus").value("error"))
            .andExpect(jsonPath("$.scheduleType").value("hourly"))
            .andExpect(jsonPath("$.nextExecutionAt").exists());
    }

    @Test
    void configurationsListIncludesInsertedOne() throws Exception {
        insertHourlyConfiguration("smoke-2");

        mockMvc.perform(get("/api/configurations"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.id == 'smoke-2')].boardId").value("Stock"));
    }

    @Test
    void unknownConfigurationIsNotFound() throws Exception {
        mockMvc.perform(get("/api/configurations/nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("configuration_not_found"));

        mockMvc.perform(get("/api/executions/nope"))
            .andExpect(status().isNotFound());
    }

    @Test
    void previewRejectsInvalidCount() throws Exception {
        mockMvc.perform(get("/api/boards/Stock/preview").param("count", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("board_fetch_failed"));
    }

    private void insertHourlyConfiguration(String id) {
        Timestamp now = Timestamp.from(Instant.now());
        jdbc.update(
            """
                INSERT INTO watch_configurations (
                    id, name, board_id, post_count, keywords_json, chat_id, schedule_type, is_active, created_at, updated_at
                ) VALUES (
                    :id, 'Smoke', 'Stock', 5, '[]', '-100', 'hourly', TRUE, :now, :now
                )
                """,
            new MapSqlParameterSource().addValue("id", id).addValue("now", now)
        );
    }
}
