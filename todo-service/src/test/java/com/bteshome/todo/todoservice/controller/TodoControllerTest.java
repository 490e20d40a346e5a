package com.bteshome.todo.todoservice.controller;

import com.bteshome.todo.todoservice.common.CorrelationIdFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyOrNullString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Runs against the in-memory store. Tests share the application context, so each test uses its
 * own keys.
 */
@SpringBootTest
@AutoConfigureMockMvc
class TodoControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @Test
    void createdTodoCanBeReadBack() throws Exception {
        create("1", "A", "B")
                .andExpect(status().isOk())
                .andExpect(content().json("{\"message\": \"To-Do object created successfully.\"}", true));

        mockMvc.perform(get("/v1/todo/1"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().json("{\"id\": \"1\", \"title\": \"A\", \"description\": \"B\"}", true));
    }

    @Test
    void secondCreateWithSameIdFails() throws Exception {
        String id = uniqueId();

        create(id, "A", "B").andExpect(status().isOk());

        create(id, "C", "D")
                .andExpect(status().isBadRequest())
                .andExpect(content().json("{\"message\": \"There was an error while creating a new To-Do object.\"}", true));

        mockMvc.perform(get("/v1/todo/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("A"));
    }

    @Test
    void updateOfNeverCreatedIdFails() throws Exception {
        mockMvc.perform(put("/v1/todo/" + uniqueId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \"A\", \"description\": \"B\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().json("{\"error\": \"There was an error while updating the To-Do object.\"}", true));
    }

    @Test
    void updateReplacesTitleAndDescriptionButNotId() throws Exception {
        String id = uniqueId();
        create(id, "A", "B").andExpect(status().isOk());

        mockMvc.perform(put("/v1/todo/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"other\", \"title\": \"C\", \"description\": \"D\"}"))
                .andExpect(status().isOk())
                .andExpect(content().json("{\"message\": \"To-Do object updated successfully.\"}", true));

        mockMvc.perform(get("/v1/todo/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id))
                .andExpect(jsonPath("$.title").value("C"))
                .andExpect(jsonPath("$.description").value("D"));

        mockMvc.perform(get("/v1/todo/other"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void deleteOfAbsentIdFails() throws Exception {
        mockMvc.perform(delete("/v1/todo/" + uniqueId()))
                .andExpect(status().isBadRequest())
                .andExpect(content().json("{\"error\": \"There has been an error while deleting the To-Do object.\"}", true));
    }

    @Test
    void deleteRemovesTodo() throws Exception {
        String id = uniqueId();
        create(id, "A", "B").andExpect(status().isOk());

        mockMvc.perform(delete("/v1/todo/" + id))
                .andExpect(status().isOk())
                .andExpect(content().json("{\"message\": \"To-Do object deleted successfully.\"}", true));

        mockMvc.perform(get("/v1/todo/" + id))
                .andExpect(status().isBadRequest());
        mockMvc.perform(delete("/v1/todo/" + id))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getOfMissingTodoIsBadRequestWithErrorBody() throws Exception {
        mockMvc.perform(get("/v1/todo/doesnotexist"))
                .andExpect(status().isBadRequest())
                .andExpect(content().json("{\"error\": \"There was an error loading the To-Do objects.\"}", true));
    }

    @Test
    void createWithMissingFieldIsRejected() throws Exception {
        mockMvc.perform(put("/v1/todo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"" + uniqueId() + "\", \"title\": \"A\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().json("{\"message\": \"Invalid request body\"}", true));
    }

    @Test
    void whitespaceOnlyTitleIsStored() throws Exception {
        String id = uniqueId();

        create(id, " ", "B").andExpect(status().isOk());

        mockMvc.perform(get("/v1/todo/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value(" "));
    }

    @Test
    void createWithTrailingContentIsRejected() throws Exception {
        String id = uniqueId();

        mockMvc.perform(put("/v1/todo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"" + id + "\", \"title\": \"A\", \"description\": \"B\"} junk"))
                .andExpect(status().isBadRequest())
                .andExpect(content().json("{\"message\": \"Invalid request body\"}", true));

        mockMvc.perform(get("/v1/todo/" + id))
                .andExpect(status().isBadRequest());
    }

    @Test
    void listReturnsAtMostTenTodos() throws Exception {
        String prefix = uniqueId();
        for (int i = 0; i < 15; i++)
            create(prefix + "-" + i, "title " + i, "description " + i).andExpect(status().isOk());

        mockMvc.perform(get("/v1/todo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(lessThanOrEqualTo(10))))
                .andExpect(jsonPath("$[0].id").exists())
                .andExpect(jsonPath("$[0].title").exists())
                .andExpect(jsonPath("$[0].description").exists());
    }

    @Test
    void correlationIdIsEchoedOrGenerated() throws Exception {
        mockMvc.perform(get("/v1/todo/doesnotexist").header(CorrelationIdFilter.HEADER_NAME, "abc-123"))
                .andExpect(header().string(CorrelationIdFilter.HEADER_NAME, "abc-123"));

        mockMvc.perform(get("/v1/todo/doesnotexist"))
                .andExpect(header().string(CorrelationIdFilter.HEADER_NAME, not(emptyOrNullString())));
    }

    private ResultActions create(String id, String title, String description) throws Exception {
        return mockMvc.perform(put("/v1/todo")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\": \"%s\", \"title\": \"%s\", \"description\": \"%s\"}".formatted(id, title, description)));
    }

    private static String uniqueId() {
        return UUID.randomUUID().toString();
    }
}
