package com.flagship.bookstore.catalog.book;

import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.domain.DomainConflictException;
import com.flagship.bookstore.domain.DomainValidationException;
import com.flagship.bookstore.eventstore.VersionConflictException;
import com.flagship.bookstore.web.ConditionalRequestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BookAdminController.class)
@Import(ConditionalRequestSupport.class)
class BookAdminControllerTest {

    private static final String BOOK_JSON = """
            {
              "title": "A Wizard of Earthsea",
              "isbn": "9780547773742",
              "language": "en",
              "prices": {"USD": 9.99}
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BookCommandService commandService;

    private final UUID bookId = UUID.randomUUID();

    @Test
    @DisplayName("POST creates the book and returns 201 with Location and ETag")
    void createReturnsCreated() throws Exception {
        when(commandService.create(any())).thenReturn(new CommandResult(bookId, 1));

        mockMvc.perform(post("/api/admin/books").contentType(MediaType.APPLICATION_JSON).content(BOOK_JSON))
                .andExpect(status().isCreated())
                .andExpect(header().string(HttpHeaders.LOCATION, "/api/books/" + bookId))
                .andExpect(header().string(HttpHeaders.ETAG, "\"1\""));
    }

    @Test
    @DisplayName("POST without a title fails request validation")
    void createWithoutTitleIsRejected() throws Exception {
        mockMvc.perform(post("/api/admin/books").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"language\": \"en\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));

        verifyNoInteractions(commandService);
    }

    @Test
    @DisplayName("PUT passes the If-Match version and returns the new ETag")
    void updateUsesIfMatch() throws Exception {
        when(commandService.update(eq(bookId), eq(2L), any())).thenReturn(new CommandResult(bookId, 3));

        mockMvc.perform(put("/api/admin/books/{id}", bookId)
                        .header(HttpHeaders.IF_MATCH, "\"2\"")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOK_JSON))
                .andExpect(status().isNoContent())
                .andExpect(header().string(HttpHeaders.ETAG, "\"3\""));
    }

    @Test
    @DisplayName("A stale If-Match is answered with 412 and the current ETag")
    void staleIfMatchIsPreconditionFailed() throws Exception {
        when(commandService.delete(bookId, 1L)).thenThrow(new VersionConflictException(bookId, 1, 4));

        mockMvc.perform(delete("/api/admin/books/{id}", bookId).header(HttpHeaders.IF_MATCH, "\"1\""))
                .andExpect(status().isPreconditionFailed())
                .andExpect(jsonPath("$.error").value("Precondition Failed"))
                .andExpect(jsonPath("$.details.currentVersion").value("4"))
                .andExpect(jsonPath("$.details.currentETag").value("\"4\""));
    }

    @Test
    @DisplayName("Without If-Match the write is unconditional")
    void missingIfMatchIsUnconditional() throws Exception {
        when(commandService.restore(eq(bookId), isNull())).thenReturn(new CommandResult(bookId, 5));

        mockMvc.perform(post("/api/admin/books/{id}/restore", bookId))
                .andExpect(status().isNoContent())
                .andExpect(header().string(HttpHeaders.ETAG, "\"5\""));

        verify(commandService).restore(bookId, null);
    }

    @Test
    @DisplayName("Business rule violations and state conflicts map to 400 and 409")
    void domainErrorsAreMapped() throws Exception {
        when(commandService.scheduleSale(eq(bookId), isNull(), any()))
                .thenThrow(new DomainValidationException("Sale percentage must be greater than 0 and less than 100"));
        when(commandService.cancelSale(eq(bookId), isNull(), any()))
                .thenThrow(new DomainConflictException("Cannot schedule a sale for a deleted book"));

        mockMvc.perform(post("/api/admin/books/{id}/sales", bookId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"percentage\": 150, \"start\": \"2026-01-01T00:00:00Z\", \"end\": \"2026-01-02T00:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Business Rule Violation"));

        mockMvc.perform(delete("/api/admin/books/{id}/sales", bookId)
                        .param("start", Instant.parse("2026-01-01T00:00:00Z").toString()))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Conflict"));
    }

    @Test
    @DisplayName("A malformed If-Match is a 400")
    void malformedIfMatchIsBadRequest() throws Exception {
        mockMvc.perform(delete("/api/admin/books/{id}", bookId).header(HttpHeaders.IF_MATCH, "\"abc\""))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(commandService);
    }
}
