package uk.gegc.codejudge.features.user.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.codejudge.features.user.api.dto.UserLeaderboardEntryDto;
import uk.gegc.codejudge.features.user.api.dto.UserSolveStatsDto;
import uk.gegc.codejudge.features.user.application.UserStatsService;
import uk.gegc.codejudge.shared.exception.ResourceNotFoundException;
import uk.gegc.codejudge.testsupport.WebMvcSecurityTestConfig;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UserController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("UserController")
class UserControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private UserStatsService userStatsService;

    @Test
    @DisplayName("GET /leaderboard is public and honours the limit")
    void leaderboard_anonymous() throws Exception {
        when(userStatsService.getLeaderboard(2)).thenReturn(List.of(
                new UserLeaderboardEntryDto(1, "alice", 12, 5, 5, 2),
                new UserLeaderboardEntryDto(2, "bob", 7, 7, 0, 0)));

        mockMvc.perform(get("/api/v1/users/leaderboard").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].username").value("alice"))
                .andExpect(jsonPath("$[1].rank").value(2));
    }

    @Test
    @WithMockUser(username = "alice")
    @DisplayName("GET /me/stats returns the caller's breakdown")
    void myStats() throws Exception {
        when(userStatsService.getMyStats("alice")).thenReturn(new UserSolveStatsDto("alice", 12, 5, 5, 2, 3));

        mockMvc.perform(get("/api/v1/users/me/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSolved").value(12))
                .andExpect(jsonPath("$.attemptedUnsolved").value(3));
    }

    @Test
    @WithMockUser(username = "ghost")
    @DisplayName("GET /me/stats for a missing account returns 404")
    void myStats_unknownUser() throws Exception {
        when(userStatsService.getMyStats("ghost")).thenThrow(new ResourceNotFoundException("User ghost not found"));

        mockMvc.perform(get("/api/v1/users/me/stats"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /me/stats requires authentication")
    void myStats_anonymous() throws Exception {
        mockMvc.perform(get("/api/v1/users/me/stats"))
                .andExpect(status().isUnauthorized());
    }
}
