package com.flagship.bookstore;

import com.flagship.bookstore.projection.ProjectionWorker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full application in the memory profile: HTTP write, projection, HTTP read.
 */
@SpringBootTest(properties = "bookstore.projections.daemon.enabled=false")
@AutoConfigureMockMvc
@ActiveProfiles("memory")
class BookstoreCatalogApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ProjectionWorker worker;

    @Test
    @DisplayName("A book written over HTTP is served with its ETag once projected")
    void writeProjectRead() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/admin/books")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"The Word for World Is Forest\", \"language\": \"en\"}"))
                .andExpect(status().isCreated())
                .andExpect(header().string(HttpHeaders.ETAG, "\"1\""))
                .andReturn();
        String location = created.getResponse().getHeader(HttpHeaders.LOCATION);
        assertNotNull(location);

        worker.drain();

        mockMvc.perform(get(location))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ETAG, "\"1\""))
                .andExpect(jsonPath("$.title").value("The Word for World Is Forest"));

        mockMvc.perform(put(location.replace("/api/books/", "/api/admin/books/"))
                        .header(HttpHeaders.IF_MATCH, "\"0\"")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"Vaster than Empires\", \"language\": \"en\"}"))
                .andExpect(status().isPreconditionFailed())
                .andExpect(jsonPath("$.details.currentETag").value("\"1\""));
    }

    @Test
    @DisplayName("Projection status reports the channel backlog and the catch-up checkpoint")
    void projectionStatus() throws Exception {
        mockMvc.perform(get("/api/admin/projections/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backlog").exists())
                .andExpect(jsonPath("$.checkpoint").exists());

        mockMvc.perform(post("/api/admin/projections/catch-up"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.eventsRead").isNumber())
                .andExpect(jsonPath("$.checkpoint").isNumber());
    }
}
