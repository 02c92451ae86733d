package com.missingtable.sync.controller;

import com.missingtable.sync.dto.ConflictEntryDTO;
import com.missingtable.sync.service.ConflictService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ConflictController.class)
@ActiveProfiles("test")
class ConflictControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private ConflictService conflictService;

    @Test
    void listsOpenConflictsByDefault() throws Exception {
        ConflictEntryDTO dto = new ConflictEntryDTO(1L, 7L, "LOCKED_DIVERGENCE",
                "{\"home_score\":3}", "{\"home_score\":2}", Instant.parse("2025-10-04T20:00:00Z"), false);
        when(conflictService.list(true)).thenReturn(List.of(dto));

        mockMvc.perform(get("/api/conflicts").accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].matchId", is(7)))
                .andExpect(jsonPath("$[0].reason", is("LOCKED_DIVERGENCE")));
    }

    @Test
    void unlockReportsClosedConflicts() throws Exception {
        when(conflictService.unlock(7L, "admin")).thenReturn(2);

        mockMvc.perform(post("/api/conflicts/matches/7/unlock").param("actor", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.resolvedConflicts", is(2)));
    }

    @Test
    void unlockOfUnknownMatchIs404() throws Exception {
        when(conflictService.unlock(99L, "admin")).thenThrow(new NoSuchElementException("Match not found: 99"));

        mockMvc.perform(post("/api/conflicts/matches/99/unlock").param("actor", "admin"))
                .andExpect(status().isNotFound());
    }

    @Test
    void blankActorIsRejected() throws Exception {
        mockMvc.perform(post("/api/conflicts/matches/7/unlock").param("actor", " "))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(conflictService);
    }

    @Test
    void dismissingResolvedConflictIs409() throws Exception {
        doThrow(new IllegalStateException("Conflict 3 is already resolved")).when(conflictService).dismiss(3L, "admin");

        mockMvc.perform(post("/api/conflicts/3/dismiss").param("actor", "admin"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success", is(false)));
    }
}
