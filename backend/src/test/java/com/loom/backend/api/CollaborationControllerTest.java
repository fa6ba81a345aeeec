package com.loom.backend.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CollaborationControllerTest {

    @Autowired
    MockMvc mvc;

    private void join(String room, String userId, String userName) throws Exception {
        mvc.perform(post("/api/v1/collab/rooms/{roomId}/join", room)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"" + userId + "\",\"userName\":\"" + userName + "\"}"))
                .andExpect(status().isOk());
    }

    @Test
    void joinReturnsPresenceWithColor() throws Exception {
        mvc.perform(post("/api/v1/collab/rooms/{roomId}/join", "api-join")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"a\",\"userName\":\"Alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.room.roomId").value("api-join"))
                .andExpect(jsonPath("$.room.userCount").value(1))
                .andExpect(jsonPath("$.presence.userColor").value("#FF6B6B"))
                .andExpect(jsonPath("$.presence.active").value(true));
    }

    @Test
    void joinWithoutUserIdIsBadRequest() throws Exception {
        mvc.perform(post("/api/v1/collab/rooms/{roomId}/join", "api-bad")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userName\":\"Alice\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void lockConflictAndRelease() throws Exception {
        join("api-lock", "a", "Alice");
        join("api-lock", "b", "Bob");

        mvc.perform(post("/api/v1/collab/rooms/{roomId}/locks/{nodeId}", "api-lock", "n1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"a\",\"userName\":\"Alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("a"))
                .andExpect(jsonPath("$.expiresAt").exists());

        mvc.perform(post("/api/v1/collab/rooms/{roomId}/locks/{nodeId}", "api-lock", "n1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"b\",\"userName\":\"Bob\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("LOCK_CONFLICT"))
                .andExpect(jsonPath("$.holder").value("Alice"))
                .andExpect(jsonPath("$.message", containsString("Alice")));

        mvc.perform(delete("/api/v1/collab/rooms/{roomId}/locks/{nodeId}", "api-lock", "n1").param("userId", "b"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.ok").value(false));

        mvc.perform(delete("/api/v1/collab/rooms/{roomId}/locks/{nodeId}", "api-lock", "n1").param("userId", "a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));
    }

    @Test
    void lockInUnknownRoomIsNotFound() throws Exception {
        mvc.perform(post("/api/v1/collab/rooms/{roomId}/locks/{nodeId}", "api-nowhere", "n1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"a\",\"userName\":\"Alice\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void presenceReflectsCursorAndLeave() throws Exception {
        join("api-presence", "a", "Alice");
        join("api-presence", "b", "Bob");

        mvc.perform(post("/api/v1/collab/rooms/{roomId}/cursor", "api-presence")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"a\",\"x\":12.5,\"y\":7}"))
                .andExpect(status().isNoContent());
        mvc.perform(post("/api/v1/collab/rooms/{roomId}/select", "api-presence")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"b\",\"nodeId\":\"n2\"}"))
                .andExpect(status().isNoContent());

        mvc.perform(get("/api/v1/collab/rooms/{roomId}/presence", "api-presence"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.users", hasSize(2)))
                .andExpect(jsonPath("$.users[0].cursorX").value(12.5))
                .andExpect(jsonPath("$.users[1].selectedNodeId").value("n2"))
                .andExpect(jsonPath("$.locks", hasSize(0)));

        mvc.perform(post("/api/v1/collab/rooms/{roomId}/leave", "api-presence")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"a\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.closed").value(false))
                .andExpect(jsonPath("$.userCount").value(1));

        mvc.perform(post("/api/v1/collab/rooms/{roomId}/leave", "api-presence")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"b\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.closed").value(true));

        mvc.perform(get("/api/v1/collab/rooms/{roomId}/presence", "api-presence"))
                .andExpect(jsonPath("$.users", hasSize(0)));
    }

    @Test
    void joinAcceptsExtraFieldsAndWritesIsoTimestamps() throws Exception {
        mvc.perform(post("/api/v1/collab/rooms/{roomId}/join", "api-json")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"a\",\"userName\":\"Alice\",\"clientVersion\":\"2.1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.presence.joinedAt", matchesPattern("\\d{4}-\\d{2}-\\d{2}T.*Z")));
    }
}
