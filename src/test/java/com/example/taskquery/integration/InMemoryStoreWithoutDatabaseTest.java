package com.example.taskquery.integration;

import com.example.taskquery.domain.repository.TaskReadRepository;
import com.example.taskquery.domain.repository.memory.InMemoryTaskReadRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static com.example.taskquery.TaskFixtures.PROJECT_ID;
import static com.example.taskquery.TaskFixtures.sequentialTasks;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * The memory store runs with a datasource that points at a closed port, so any request that
 * opens a JDBC connection fails.
 */
@SpringBootTest(properties = {
        "task-query.store=memory",
        "task-query.cursor.secret=test-cursor-secret",
        "spring.datasource.url=jdbc:postgresql://127.0.0.1:1/none",
        "spring.datasource.hikari.connection-timeout=250",
        "spring.sql.init.mode=never"
})
@AutoConfigureMockMvc
@DisplayName("In-Memory Store Without Database Tests")
class InMemoryStoreWithoutDatabaseTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TaskReadRepository taskRepository;

    @BeforeEach
    void setUp() {
        var repository = (InMemoryTaskReadRepository) taskRepository;
        repository.clear();
        repository.saveAll(sequentialTasks(3));
    }

    @Test
    @DisplayName("Should serve a page without opening a database connection")
    void shouldServePageWithoutDatabase() throws Exception {
        mockMvc.perform(get("/api/v1/projects/{projectId}/tasks", PROJECT_ID).param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.tasks", hasSize(2)))
                .andExpect(jsonPath("$.data.tasks[0].id").value("task-001"))
                .andExpect(jsonPath("$.data.page.nextCursor").isNotEmpty());
    }
}
