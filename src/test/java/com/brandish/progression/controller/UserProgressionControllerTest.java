package com.brandish.progression.controller;

import com.brandish.progression.mapper.ProgressionResponseMapper;
import com.brandish.progression.model.UserProgression;
import com.brandish.progression.service.UserProgressionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UserProgressionController.class)
@Import(ProgressionResponseMapper.class)
class UserProgressionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private UserProgressionService userProgressionService;

    @Test
    void firstUnlockReturnsCreated() throws Exception {
        when(userProgressionService.unlockUserProgression(eq("user-1"), eq("title"), eq("veteran"), isNull()))
                .thenReturn(true);

        mockMvc.perform(post("/api/progression/users/user-1/progressions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"progressionType": "title", "progressionKey": "veteran"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.newlyUnlocked").value(true));
    }

    @Test
    void repeatUnlockReturnsOk() throws Exception {
        when(userProgressionService.unlockUserProgression(eq("user-1"), eq("title"), eq("veteran"), isNull()))
                .thenReturn(false);

        mockMvc.perform(post("/api/progression/users/user-1/progressions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"progressionType": "title", "progressionKey": "veteran"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.newlyUnlocked").value(false));
    }

    @Test
    void unlockRequiresKey() throws Exception {
        mockMvc.perform(post("/api/progression/users/user-1/progressions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"progressionType": "title"}
                                """))
                .andExpect(status().isBadRequest());

        verify(userProgressionService, never()).unlockUserProgression(anyString(), anyString(), anyString(), any());
    }

    @Test
    void listsUserProgressions() throws Exception {
        UserProgression progression = new UserProgression();
        progression.setUserId("user-1");
        progression.setProgressionType("title");
        progression.setProgressionKey("veteran");
        when(userProgressionService.getUserProgressions("user-1")).thenReturn(List.of(progression));

        mockMvc.perform(get("/api/progression/users/user-1/progressions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].progressionKey").value("veteran"));
    }

    @Test
    void checkReportsUnlockedFlag() throws Exception {
        when(userProgressionService.isUserProgressionUnlocked("user-1", "title", "veteran")).thenReturn(true);

        mockMvc.perform(get("/api/progression/users/user-1/progressions/title/veteran"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unlocked").value(true));
    }
}
