package com.hostelgate.backend.modules.leave;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hostelgate.backend.modules.auth.application.JwtTokenService;
import com.hostelgate.backend.modules.auth.domain.Gender;
import com.hostelgate.backend.modules.auth.domain.HostelRole;
import com.hostelgate.backend.modules.auth.domain.HostelUser;
import com.hostelgate.backend.modules.auth.domain.HostelUserStatus;
import com.hostelgate.backend.modules.auth.infrastructure.persistence.HostelUserRepository;
import com.hostelgate.backend.modules.leave.domain.LeaveRequest;
import com.hostelgate.backend.modules.leave.infrastructure.persistence.LeaveRequestRepository;
import com.hostelgate.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class LeaveFlowIntegrationTest extends AbstractPostgresIntegrationTest {

    // 11:30 IST on 2025-03-11
    private static final Instant NOW = Instant.parse("2025-03-11T06:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        @Primary
        Clock fixedTestClock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private HostelUserRepository hostelUserRepository;

    @Autowired
    private LeaveRequestRepository leaveRequestRepository;

    @Autowired
    private JwtTokenService jwtTokenService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private HostelUser student;
    private String studentToken;
    private String otherStudentToken;
    private String wardenToken;
    private String foreignWardenToken;
    private String principalToken;
    private String guardToken;
    private String secondGuardToken;
    private String adminToken;

    @BeforeEach
    void setUp() {
        student = saveStudent("22A91A0501", "Ravi Kumar");
        HostelUser otherStudent = saveStudent("22A91A0502", "Kiran Rao");
        HostelUser warden = saveStaff("warden.btech", HostelRole.WARDEN, Set.of("B TECH"));
        HostelUser foreignWarden = saveStaff("warden.pharmacy", HostelRole.WARDEN, Set.of("Pharmacy"));
        HostelUser principal = saveStaff("principal", HostelRole.PRINCIPAL, Set.of("B.Tech"));
        HostelUser guard = saveStaff("gate.main", HostelRole.SECURITY, Set.of());
        HostelUser secondGuard = saveStaff("gate.back", HostelRole.SECURITY, Set.of());
        HostelUser admin = saveStaff("admin", HostelRole.ADMIN, Set.of());

        studentToken = tokenFor(student);
        otherStudentToken = tokenFor(otherStudent);
        wardenToken = tokenFor(warden);
        foreignWardenToken = tokenFor(foreignWarden);
        principalToken = tokenFor(principal);
        guardToken = tokenFor(guard);
        secondGuardToken = tokenFor(secondGuard);
        adminToken = tokenFor(admin);
    }

    @Test
    void permissionRunsFromSubmissionToCompletedReturn() throws Exception {
        UUID requestId = submitPermission(studentToken);
        String otp = currentOtp(requestId);

        mockMvc.perform(post("/warden/leaves/{id}/otp/verify", requestId)
                        .header("Authorization", "Bearer " + foreignWardenToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("otp", otp))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("AUTHORIZATION_DENIED"));

        mockMvc.perform(post("/warden/leaves/{id}/otp/verify", requestId)
                        .header("Authorization", "Bearer " + wardenToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("otp", otp))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("WARDEN_VERIFIED"));

        mockMvc.perform(post("/principal/leaves/{id}/approve", requestId)
                        .header("Authorization", "Bearer " + principalToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("comment", "Approved"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.gatePass.maxVisits").value(2));

        mockMvc.perform(get("/leaves/{id}/qr", requestId)
                        .header("Authorization", "Bearer " + studentToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(true));

        mockMvc.perform(get("/security/leaves/approved")
                        .header("Authorization", "Bearer " + guardToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(requestId.toString()));

        mockMvc.perform(post("/security/leaves/{id}/visits/outgoing", requestId)
                        .header("Authorization", "Bearer " + guardToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("location", "Main gate"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.visitCount").value(1))
                .andExpect(jsonPath("$.incomingQrGenerated").value(true));

        mockMvc.perform(post("/security/leaves/{id}/visits/outgoing", requestId)
                        .header("Authorization", "Bearer " + guardToken))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_SCAN"));

        mockMvc.perform(post("/security/leaves/{id}/visits/incoming", requestId)
                        .header("Authorization", "Bearer " + secondGuardToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.visitCount").value(2))
                .andExpect(jsonPath("$.visitLocked").value(true))
                .andExpect(jsonPath("$.verificationStatus").value("COMPLETED"));

        mockMvc.perform(post("/security/leaves/{id}/visits/outgoing", requestId)
                        .header("Authorization", "Bearer " + secondGuardToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_AVAILABLE"));

        mockMvc.perform(delete("/leaves/{id}", requestId)
                        .header("Authorization", "Bearer " + studentToken))
                .andExpect(status().isConflict());
    }

    @Test
    void wrongOtpLeavesTheRequestPendingAndSecondSubmissionIsRejected() throws Exception {
        UUID requestId = submitPermission(studentToken);

        mockMvc.perform(post("/warden/leaves/{id}/otp/verify", requestId)
                        .header("Authorization", "Bearer " + wardenToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("otp", "0000"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_OTP"));

        mockMvc.perform(get("/leaves/{id}", requestId)
                        .header("Authorization", "Bearer " + studentToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING_OTP_VERIFICATION"));

        mockMvc.perform(post("/leaves")
                        .header("Authorization", "Bearer " + studentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(permissionBody()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("DAILY_LIMIT_EXCEEDED"));

        mockMvc.perform(post("/leaves/{id}/otp/resend", requestId)
                        .header("Authorization", "Bearer " + studentToken))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "300"));

        mockMvc.perform(get("/leaves/{id}", requestId)
                        .header("Authorization", "Bearer " + otherStudentToken))
                .andExpect(status().isForbidden());
    }

    @Test
    void invalidSubmissionReportsEveryField() throws Exception {
        mockMvc.perform(post("/leaves")
                        .header("Authorization", "Bearer " + studentToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "applicationType", "PERMISSION",
                                "permissionDate", "2025-03-10",
                                "outTime", "9am",
                                "inTime", "18:00"))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.errors.permissionDate").exists())
                .andExpect(jsonPath("$.errors.outTime").exists())
                .andExpect(jsonPath("$.errors.reason").exists());
    }

    @Test
    void rolesAreEnforcedPerSurface() throws Exception {
        mockMvc.perform(get("/warden/leaves").header("Authorization", "Bearer " + studentToken))
                .andExpect(status().isForbidden());
        mockMvc.perform(post("/leaves")
                        .header("Authorization", "Bearer " + guardToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(permissionBody()))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/leaves/me"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void adminCanRejectButNotApproveAndSweepKeepsTodaysRequests() throws Exception {
        UUID requestId = submitPermission(studentToken);

        mockMvc.perform(post("/principal/leaves/{id}/approve", requestId)
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/admin/leaves/expiry-sweeps")
                        .header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletedCount").value(0));

        mockMvc.perform(post("/admin/leaves/{id}/reject", requestId)
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("reason", "Hostel closed for inspection"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.rejection.comment").value("Hostel closed for inspection"));

        mockMvc.perform(post("/admin/leaves/{id}/otp/verify", requestId)
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("otp", currentOtp(requestId)))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("STATE_CONFLICT"));
    }

    @Test
    void concurrentScansFromOneTerminalRecordASingleVisit() throws Exception {
        UUID requestId = approvedPermission();

        List<MockHttpServletResponse> responses = scanOutgoingConcurrently(requestId, List.of(guardToken, guardToken, guardToken, guardToken));

        assertThat(responses).extracting(MockHttpServletResponse::getStatus).containsOnlyOnce(200);
        assertThat(responses).filteredOn(response -> response.getStatus() == 409).hasSize(3);
        LeaveRequest stored = leaveRequestRepository.findById(requestId).orElseThrow();
        assertThat(stored.getGatePass().getVisitCount()).isEqualTo(1);
    }

    @Test
    void concurrentScansFromSeveralTerminalsNeverPassTheVisitLimit() throws Exception {
        UUID requestId = approvedPermission();
        List<String> terminals = List.of(
                guardToken,
                secondGuardToken,
                tokenFor(saveStaff("gate.east", HostelRole.SECURITY, Set.of())),
                tokenFor(saveStaff("gate.west", HostelRole.SECURITY, Set.of())),
                tokenFor(saveStaff("gate.north", HostelRole.SECURITY, Set.of())));

        List<MockHttpServletResponse> responses = scanOutgoingConcurrently(requestId, terminals);

        assertThat(responses).extracting(MockHttpServletResponse::getStatus).filteredOn(code -> code == 200).hasSize(2);
        List<MockHttpServletResponse> refused = responses.stream().filter(response -> response.getStatus() != 200).toList();
        assertThat(refused).hasSize(terminals.size() - 2);
        for (MockHttpServletResponse response : refused) {
            assertThat(response.getStatus()).isEqualTo(403);
            assertThat(objectMapper.readTree(response.getContentAsString()).get("code").asText()).isEqualTo("NOT_AVAILABLE");
        }

        LeaveRequest stored = leaveRequestRepository.findById(requestId).orElseThrow();
        assertThat(stored.getGatePass().getVisitCount()).isEqualTo(2);
        assertThat(stored.getGatePass().isVisitLocked()).isTrue();
        assertThat(jdbcTemplate.queryForObject(
                "select count(*) from gate_pass_visit where leave_request_id = ?", Integer.class, requestId)).isEqualTo(2);
    }

    private List<MockHttpServletResponse> scanOutgoingConcurrently(UUID requestId, List<String> tokens) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(tokens.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<MockHttpServletResponse>> results = new ArrayList<>();
            for (String token : tokens) {
                Callable<MockHttpServletResponse> scan = () -> {
                    start.await();
                    return mockMvc.perform(post("/security/leaves/{id}/visits/outgoing", requestId)
                                    .header("Authorization", "Bearer " + token))
                            .andReturn()
                            .getResponse();
                };
                results.add(executor.submit(scan));
            }
            start.countDown();

            List<MockHttpServletResponse> responses = new ArrayList<>();
            for (Future<MockHttpServletResponse> result : results) {
                responses.add(result.get(30, TimeUnit.SECONDS));
            }
            return responses;
        } finally {
            executor.shutdownNow();
        }
    }

    private UUID approvedPermission() throws Exception {
        UUID requestId = submitPermission(studentToken);
        mockMvc.perform(post("/warden/leaves/{id}/otp/verify", requestId)
                        .header("Authorization", "Bearer " + wardenToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("otp", currentOtp(requestId)))))
                .andExpect(status().isOk());
        mockMvc.perform(post("/principal/leaves/{id}/approve", requestId)
                        .header("Authorization", "Bearer " + principalToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk());
        return requestId;
    }

    private UUID submitPermission(String token) throws Exception {
        MvcResult result = mockMvc.perform(post("/leaves")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(permissionBody()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING_OTP_VERIFICATION"))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.get("id").asText());
    }

    private String permissionBody() throws Exception {
        return json(Map.of(
                "applicationType", "PERMISSION",
                "permissionDate", "2025-03-11",
                "outTime", "14:00",
                "inTime", "18:00",
                "reason", "Bank work"));
    }

    private String currentOtp(UUID requestId) {
        return leaveRequestRepository.findById(requestId).orElseThrow().getOtp().getCode();
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    private String tokenFor(HostelUser user) {
        return jwtTokenService.issueAccessToken(user.getId(), user.getLoginId(), List.of(user.getRole().name()));
    }

    private HostelUser saveStudent(String rollNumber, String fullName) {
        HostelUser user = new HostelUser();
        user.setLoginId(rollNumber);
        user.setFullName(fullName);
        user.setRole(HostelRole.STUDENT);
        user.setStatus(HostelUserStatus.ACTIVE);
        user.setRollNumber(rollNumber);
        user.setGender(Gender.MALE);
        user.setCourseName("B.Tech");
        user.setBranchName("CSE");
        user.setParentPhone("9876543210");
        user.setParentPermissionForOuting(true);
        return hostelUserRepository.save(user);
    }

    private HostelUser saveStaff(String loginId, HostelRole role, Set<String> courses) {
        HostelUser user = new HostelUser();
        user.setLoginId(loginId);
        user.setFullName(loginId);
        user.setRole(role);
        user.setStatus(HostelUserStatus.ACTIVE);
        user.setAssignedCourses(courses);
        return hostelUserRepository.save(user);
    }
}
