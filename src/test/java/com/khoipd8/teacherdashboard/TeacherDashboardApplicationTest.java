package com.khoipd8.teacherdashboard;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "sheets.spreadsheet-id=")
@AutoConfigureMockMvc
class TeacherDashboardApplicationTest {

    @Autowired
    private MockMvc mvc;

    @Test
    void startsWithoutWorkbookAndReportsBanner() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(content().string("Teacher Dashboard API is running"));
    }

    @Test
    void dataEndpointFailsCleanlyWhenWorkbookIsNotConfigured() throws Exception {
        mvc.perform(get("/api/dashboard-data"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Server error fetching dashboard data"));
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        mvc.perform(get("/api/no-such-view"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void wrongMethodIsNotAllowed() throws Exception {
        mvc.perform(post("/api/dashboard-data"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void malformedLoginBodyIsBadRequest() throws Exception {
        mvc.perform(post("/api/auth").contentType(MediaType.APPLICATION_JSON).content("{\"email\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }
}
