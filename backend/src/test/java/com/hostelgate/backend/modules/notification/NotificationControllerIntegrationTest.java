package com.hostelgate.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.hostelgate.backend.modules.auth.application.JwtTokenService;
import com.hostelgate.backend.modules.auth.domain.HostelRole;
import com.hostelgate.backend.modules.auth.domain.HostelUser;
import com.hostelgate.backend.modules.auth.domain.HostelUserStatus;
import com.hostelgate.backend.modules.auth.infrastructure.persistence.HostelUserRepository;
import com.hostelgate.backend.modules.notification.application.NotificationService;
import com.hostelgate.backend.modules.notification.domain.Notification;
import com.hostelgate.backend.modules.notification.domain.NotificationState;
import com.hostelgate.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.hostelgate.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class NotificationControllerIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private NotificationService notificationService;

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private HostelUserRepository hostelUserRepository;

    @Autowired
    private JwtTokenService jwtTokenService;

    private HostelUser student;
    private String studentToken;

    @BeforeEach
    void setUp() {
        student = new HostelUser();
        student.setLoginId("22A91A0501");
        student.setFullName("Ravi Kumar");
        student.setRole(HostelRole.STUDENT);
        student.setStatus(HostelUserStatus.ACTIVE);
        student.setRollNumber("22A91A0501");
        student.setCourseName("B.Tech");
        student = hostelUserRepository.save(student);
        studentToken = jwtTokenService.issueAccessToken(student.getId(), student.getLoginId(), List.of("STUDENT"));
    }

    @Test
    void listHidesExpiredAndCountsUnread() throws Exception {
        send("LEAVE_STATUS:a");
        send("LEAVE_STATUS:b");
        Notification stale = send("LEAVE_STATUS:c");
        stale.setTtlAt(OffsetDateTime.now().minusHours(1));
        notificationRepository.save(stale);

        mockMvc.perform(get("/notifications").header("Authorization", "Bearer " + studentToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.unreadCount").value(2))
                .andExpect(jsonPath("$.items[0].kindCode").value(NotificationService.KIND_LEAVE_STATUS));

        assertThat(notificationRepository.findById(stale.getId()))
                .get()
                .extracting(Notification::getState)
                .isEqualTo(NotificationState.EXPIRED);
    }

    @Test
    void markReadAndReadAll() throws Exception {
        Notification first = send("LEAVE_STATUS:a");
        send("LEAVE_STATUS:b");
        send("LEAVE_STATUS:c");

        mockMvc.perform(patch("/notifications/{id}/read", first.getId())
                        .header("Authorization", "Bearer " + studentToken))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/notifications").param("state", "unread")
                        .header("Authorization", "Bearer " + studentToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(2));

        mockMvc.perform(post("/notifications/read-all").header("Authorization", "Bearer " + studentToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updatedCount").value(2));

        mockMvc.perform(patch("/notifications/{id}/read", UUID.randomUUID())
                        .header("Authorization", "Bearer " + studentToken))
                .andExpect(status().isNotFound());
    }

    private Notification send(String dedupeKey) {
        return notificationService.sendNotification(
                student.getId(),
                NotificationService.KIND_LEAVE_STATUS,
                "Request update",
                "Your request changed status.",
                dedupeKey,
                Map.of(),
                NotificationService.DEFAULT_TTL_HOURS,
                null
        ).orElseThrow();
    }
}
