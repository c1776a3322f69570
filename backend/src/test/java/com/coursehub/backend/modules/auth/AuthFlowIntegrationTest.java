package com.coursehub.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import com.coursehub.backend.modules.auth.application.RegistrationValidator;
import com.coursehub.backend.modules.auth.domain.CourseUser;
import com.coursehub.backend.modules.auth.infrastructure.persistence.CourseUserRepository;
import com.coursehub.backend.support.AbstractPostgresIntegrationTest;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class AuthFlowIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String SESSION_COOKIE = "COURSEHUB_SESSION";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CourseUserRepository userRepository;

    @SpyBean
    private RegistrationValidator registrationValidator;

    @BeforeEach
    void setUp() {
        userRepository.deleteAll();
    }

    @Test
    void registerLoginBrowseAndLogout() throws Exception {
        register("198.51.100.1", "validUser1", "Valid@Example.com", "Passw0rd")
                .andExpect(status().isCreated());
        CourseUser stored = userRepository.findByUsername("validUser1").orElseThrow();
        assertThat(stored.getEmail()).isEqualTo("valid@example.com");
        assertThat(stored.getPasswordHash()).startsWith("{pbkdf2}");

        Cookie session = login("198.51.100.1", "valid@example.com", "Passw0rd")
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.redirectTo").value("/courses/1"))
                .andReturn().getResponse().getCookie(SESSION_COOKIE);
        assertThat(session).isNotNull();
        assertThat(userRepository.findByUsername("validUser1").orElseThrow().getLastLoginAt()).isNotNull();

        mockMvc.perform(get("/profile/me").cookie(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("validUser1"));

        mockMvc.perform(post("/auth/logout").cookie(session))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/profile/me").cookie(session))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void forgotAndResetPassword() throws Exception {
        register("198.51.100.2", "resetUser", "reset@example.com", "Passw0rd")
                .andExpect(status().isCreated());

        mockMvc.perform(post("/auth/forgot-password")
                        .header("X-Forwarded-For", "198.51.100.2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"RESET@example.com\"}"))
                .andExpect(status().isAccepted());
        String token = userRepository.findByUsername("resetUser").orElseThrow().getResetToken();
        assertThat(token).isNotBlank();

        String resetBody = """
                {"token":"%s","password":"N3wPassword","passwordConfirm":"N3wPassword"}
                """.formatted(token);
        mockMvc.perform(post("/auth/reset-password")
                        .header("X-Forwarded-For", "198.51.100.2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(resetBody))
                .andExpect(status().isOk());
        mockMvc.perform(post("/auth/reset-password")
                        .header("X-Forwarded-For", "198.51.100.2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(resetBody))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_RESET_TOKEN"));

        assertThat(userRepository.findByUsername("resetUser").orElseThrow().getResetToken()).isNull();
        login("198.51.100.2", "resetUser", "Passw0rd").andExpect(status().isUnauthorized());
        login("198.51.100.2", "resetUser", "N3wPassword").andExpect(status().isOk());
    }

    @Test
    void repeatedFailuresAreRateLimited() throws Exception {
        register("198.51.100.3", "targetUser", "target@example.com", "Passw0rd")
                .andExpect(status().isCreated());

        for (int attempt = 0; attempt < 5; attempt++) {
            login("203.0.113.99", "targetUser", "Wrong-pass1").andExpect(status().isUnauthorized());
        }

        login("203.0.113.99", "targetUser", "Passw0rd")
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "900"));
    }

    @Test
    void registrationLosingUniquenessRaceIsConflict() throws Exception {
        register("198.51.100.4", "racer", "racer@example.com", "Passw0rd")
                .andExpect(status().isCreated());
        // the existence checks pass as if the competing row had not been committed yet
        doReturn(List.of()).when(registrationValidator).validate(anyString(), anyString(), anyString(), anyString());

        register("198.51.100.4", "racer", "racer@example.com", "Passw0rd")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ACCOUNT_ALREADY_EXISTS"));

        assertThat(userRepository.count()).isEqualTo(1);
    }

    private ResultActions register(String clientIp, String username, String email, String password) throws Exception {
        String body = """
                {"username":"%s","email":"%s","password":"%s","passwordConfirm":"%s"}
                """.formatted(username, email, password, password);
        return mockMvc.perform(post("/auth/register")
                .header("X-Forwarded-For", clientIp)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private ResultActions login(String clientIp, String username, String password) throws Exception {
        String body = """
                {"username":"%s","password":"%s","rememberMe":true,"next":"/courses/1"}
                """.formatted(username, password);
        return mockMvc.perform(post("/auth/login")
                .header("X-Forwarded-For", clientIp)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }
}
