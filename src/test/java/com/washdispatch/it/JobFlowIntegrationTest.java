package com.washdispatch.it;

import com.jayway.jsonpath.JsonPath;
import com.washdispatch.dto.PaymentIntentSummary;
import com.washdispatch.exception.PaymentGatewayException;
import com.washdispatch.model.*;
import com.washdispatch.service.JobLifecycleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class JobFlowIntegrationTest extends IntegrationTestSupport {

    @Autowired JobLifecycleService jobLifecycleService;

    private Cleaner marinaCleaner(String email, CleanerStatus status) {
        Cleaner c = cleaner(email, company, status);
        assignmentRepository.save(CleanerGeofenceAssignment.of(company.getId(), c.getId(), marina().getId()));
        return c;
    }

    @Test
    void customerBooksAJobAndTracksIt() throws Exception {
        when(paymentGateway.createPaymentIntent(any(), eq("AED"), anyMap()))
                .thenReturn(new PaymentIntentSummary("pi_booked", "pi_booked_secret", "requires_payment_method", Map.of()));

        String created = mvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"companyId\":" + company.getId() + ",\"customerId\":77,"
                                + "\"carPlateNumber\":\"DXB B 777\",\"latitude\":25.08,\"longitude\":55.14,"
                                + "\"address\":\"Marina Gate 1\",\"basePrice\":25.00,\"tipAmount\":0}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.clientSecret").value("pi_booked_secret"))
                .andExpect(jsonPath("$.totalAmount").value(29.40))
                .andReturn().getResponse().getContentAsString();
        Long jobId = ((Number) JsonPath.read(created, "$.jobId")).longValue();

        Job stored = jobRepository.findById(jobId).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(JobStatus.PENDING_PAYMENT);
        assertThat(stored.getPaymentReference()).isEqualTo("pi_booked");
        assertThat(stored.getCurrency()).isEqualTo("AED");

        mvc.perform(get("/api/customer/jobs").param("customerId", "77"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].status").value("pending_payment"));
    }

    @Test
    void providerFailureOnBookingLeavesNoJob() throws Exception {
        when(paymentGateway.createPaymentIntent(any(), any(), anyMap()))
                .thenThrow(new PaymentGatewayException("Your card was declined"));

        mvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"companyId\":" + company.getId() + ",\"carPlateNumber\":\"DXB C 1\","
                                + "\"latitude\":25.08,\"longitude\":55.14,\"address\":\"Marina\",\"basePrice\":25.00}"))
                .andExpect(status().isBadGateway());

        assertThat(jobRepository.count()).isZero();
    }

    @Test
    void cleanerAcceptsStartsAndCompletesAJob() throws Exception {
        Cleaner cleaner = marinaCleaner("flow@example.com", CleanerStatus.ON_DUTY);
        Job job = job(JobStatus.PAID, "pi_flow", Duration.ofMinutes(3));

        mvc.perform(post("/api/jobs/{id}/accept", job.getId()).with(user("flow@example.com").roles("CLEANER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("assigned"))
                .andExpect(jsonPath("$.cleanerId").value(cleaner.getId()));
        assertThat(jobLifecycleService.activeJobsOf(cleaner.getId())).extracting(Job::getId).containsExactly(job.getId());
        assertThat(reload(cleaner).getStatus()).isEqualTo(CleanerStatus.BUSY);

        mvc.perform(post("/api/jobs/{id}/start", job.getId()).with(user("flow@example.com").roles("CLEANER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("in_progress"));

        mvc.perform(post("/api/jobs/{id}/complete", job.getId())
                        .with(user("flow@example.com").roles("CLEANER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"proofPhotoUrl\":\"/uploads/proof-1.jpg\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"));

        assertThat(jobLifecycleService.activeJobsOf(cleaner.getId())).isEmpty();
        Cleaner after = reload(cleaner);
        assertThat(after.getStatus()).isEqualTo(CleanerStatus.ON_DUTY);
        assertThat(after.getTotalJobsCompleted()).isEqualTo(1);
        assertThat(companyRepository.findById(company.getId()).orElseThrow().getTotalJobsCompleted()).isEqualTo(1);
        assertThat(reload(job).getProofPhotoUrl()).isEqualTo("/uploads/proof-1.jpg");
    }

    @Test
    void takenJobAnswers409() throws Exception {
        Cleaner winner = marinaCleaner("winner@example.com", CleanerStatus.ON_DUTY);
        marinaCleaner("loser@example.com", CleanerStatus.ON_DUTY);
        Job job = job(JobStatus.PAID, "pi_taken", Duration.ofMinutes(3));

        mvc.perform(post("/api/jobs/{id}/accept", job.getId()).with(user("winner@example.com").roles("CLEANER")))
                .andExpect(status().isOk());
        mvc.perform(post("/api/jobs/{id}/accept", job.getId()).with(user("loser@example.com").roles("CLEANER")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Job is no longer available"));

        assertThat(reload(job).getCleanerId()).isEqualTo(winner.getId());
    }

    @Test
    void offDutyCleanerAcceptAnswers409() throws Exception {
        Cleaner cleaner = marinaCleaner("offshift@example.com", CleanerStatus.OFF_DUTY);
        Job job = job(JobStatus.PAID, "pi_offshift", Duration.ofMinutes(3));

        mvc.perform(post("/api/jobs/{id}/accept", job.getId()).with(user("offshift@example.com").roles("CLEANER")))
                .andExpect(status().isConflict());

        assertThat(reload(job).getStatus()).isEqualTo(JobStatus.PAID);
        assertThat(reload(cleaner).getStatus()).isEqualTo(CleanerStatus.OFF_DUTY);
    }

    @Test
    void cleanerOutsideTheJobGeofenceIsForbidden() throws Exception {
        marinaCleaner("far@example.com", CleanerStatus.ON_DUTY);
        Job job = job(JobStatus.PAID, "pi_far", Duration.ofMinutes(3), OUTSIDE_LAT, OUTSIDE_LON);

        mvc.perform(post("/api/jobs/{id}/accept", job.getId()).with(user("far@example.com").roles("CLEANER")))
                .andExpect(status().isForbidden());

        assertThat(reload(job).getStatus()).isEqualTo(JobStatus.PAID);
    }

    @Test
    void onlyTheAssignedCleanerCanStartTheJob() throws Exception {
        Cleaner owner = marinaCleaner("owner@example.com", CleanerStatus.BUSY);
        marinaCleaner("other@example.com", CleanerStatus.ON_DUTY);
        Job job = job(JobStatus.ASSIGNED, "pi_owned", Duration.ofMinutes(3));
        job.setCleanerId(owner.getId());
        jobRepository.save(job);

        mvc.perform(post("/api/jobs/{id}/start", job.getId()).with(user("other@example.com").roles("CLEANER")))
                .andExpect(status().isForbidden());
    }

    @Test
    void anonymousCallerCannotAccept() throws Exception {
        Job job = job(JobStatus.PAID, "pi_anon", Duration.ofMinutes(3));

        mvc.perform(post("/api/jobs/{id}/accept", job.getId()))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void availableJobsAreFilteredByGeofenceAndDuty() throws Exception {
        marinaCleaner("seer@example.com", CleanerStatus.ON_DUTY);
        Job inside = job(JobStatus.PAID, "pi_in", Duration.ofMinutes(3));
        job(JobStatus.PAID, "pi_out", Duration.ofMinutes(3), OUTSIDE_LAT, OUTSIDE_LON);
        job(JobStatus.PENDING_PAYMENT, "pi_unpaid", Duration.ofMinutes(3));

        mvc.perform(get("/api/cleaner/available-jobs").with(user("seer@example.com").roles("CLEANER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(inside.getId()));

        mvc.perform(post("/api/cleaner/status")
                        .with(user("seer@example.com").roles("CLEANER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"off_duty\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("off_duty"));

        mvc.perform(get("/api/cleaner/available-jobs").with(user("seer@example.com").roles("CLEANER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void busyCleanerCannotToggleDuty() throws Exception {
        marinaCleaner("working@example.com", CleanerStatus.BUSY);

        mvc.perform(post("/api/cleaner/status")
                        .with(user("working@example.com").roles("CLEANER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"off_duty\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void cleanerReportsLocationAndListsOwnJobs() throws Exception {
        Cleaner cleaner = marinaCleaner("mover@example.com", CleanerStatus.BUSY);
        Job held = job(JobStatus.ASSIGNED, "pi_held", Duration.ofMinutes(5));
        held.setCleanerId(cleaner.getId());
        jobRepository.save(held);

        mvc.perform(post("/api/cleaner/location")
                        .with(user("mover@example.com").roles("CLEANER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\":25.081,\"longitude\":55.141}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.latitude").value(25.081));

        mvc.perform(get("/api/cleaner/my-jobs").with(user("mover@example.com").roles("CLEANER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(held.getId()));

        assertThat(reload(cleaner).getLastLocationUpdate()).isNotNull();
    }

    // ---------------- Admin ----------------

    @Test
    void manualRefundReleasesTheCleanerAndBooksADebit() throws Exception {
        Cleaner cleaner = marinaCleaner("refunded@example.com", CleanerStatus.BUSY);
        Job job = job(JobStatus.ASSIGNED, "pi_complaint", Duration.ofMinutes(40));
        job.setCleanerId(cleaner.getId());
        job.setReceiptNumber("RCP-20261019-900001");
        job.setReceiptGeneratedAt(Instant.now());
        jobRepository.save(job);
        when(paymentGateway.refund(eq("pi_complaint"), anyString())).thenReturn("re_complaint");

        mvc.perform(post("/api/admin/jobs/{id}/refund", job.getId())
                        .with(user("ops@example.com").roles("ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"Car was not cleaned properly\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("refunded"));

        Job refunded = reload(job);
        assertThat(refunded.getRefundReference()).isEqualTo("re_complaint");
        assertThat(refunded.getCleanerId()).isEqualTo(cleaner.getId());
        assertThat(reload(cleaner).getStatus()).isEqualTo(CleanerStatus.ON_DUTY);
        assertThat(transactionRepository.findByJobIdAndDirection(job.getId(), TransactionDirection.DEBIT)).hasSize(1);
    }

    @Test
    void failedManualRefundSurfacesProviderMessage() throws Exception {
        Job job = job(JobStatus.PAID, "pi_broken", Duration.ofMinutes(5));
        job.setReceiptNumber("RCP-20261019-900002");
        jobRepository.save(job);
        when(paymentGateway.refund(eq("pi_broken"), anyString()))
                .thenThrow(new PaymentGatewayException("No such payment_intent: 'pi_broken'"));

        mvc.perform(post("/api/admin/jobs/{id}/refund", job.getId())
                        .with(user("ops@example.com").roles("ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"duplicate booking\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("No such payment_intent: 'pi_broken'"));

        assertThat(reload(job).getStatus()).isEqualTo(JobStatus.REFUNDED);
        assertThat(issueRepository.findByJobId(job.getId()))
                .extracting(ReconciliationIssue::getKind)
                .containsExactly(ReconciliationIssueKind.REFUND_FAILED);

        Long issueId = issueRepository.findByJobId(job.getId()).get(0).getId();
        mvc.perform(post("/api/admin/reconciliation-issues/{id}/resolve", issueId).with(user("ops@example.com").roles("ADMIN")))
                .andExpect(status().isOk());
        mvc.perform(get("/api/admin/reconciliation-issues").with(user("ops@example.com").roles("ADMIN")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void terminalJobCannotBeCancelled() throws Exception {
        Job job = job(JobStatus.COMPLETED, "pi_finished", Duration.ofHours(2));

        mvc.perform(post("/api/admin/jobs/{id}/cancel", job.getId())
                        .with(user("ops@example.com").roles("ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"customer asked\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void cleanerCannotReachAdminEndpoints() throws Exception {
        mvc.perform(get("/api/admin/reconciliation-issues").with(user("sneaky@example.com").roles("CLEANER")))
                .andExpect(status().isForbidden());
    }

    // ---------------- Company admin ----------------

    @Test
    void companyAdminDefinesAGeofenceAndAssignsACleaner() throws Exception {
        UserAccount admin = new UserAccount();
        admin.setEmail("boss@sparkle.example");
        admin.setPasswordHash("{noop}pw");
        admin.setRole(UserRole.COMPANY_ADMIN);
        admin.setCompanyId(company.getId());
        userAccountRepository.save(admin);
        Cleaner cleaner = cleaner("new@example.com", company, CleanerStatus.ON_DUTY);

        String created = mvc.perform(post("/api/company/geofences")
                        .with(user("boss@sparkle.example").roles("COMPANY_ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"JBR\",\"polygon\":[[25.07,55.12],[25.07,55.16],[25.10,55.16],[25.10,55.12]]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("JBR"))
                .andReturn().getResponse().getContentAsString();
        Long geofenceId = ((Number) JsonPath.read(created, "$.id")).longValue();

        mvc.perform(put("/api/company/cleaners/{id}/geofences", cleaner.getId())
                        .with(user("boss@sparkle.example").roles("COMPANY_ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assignAll\":false,\"geofenceIds\":[" + geofenceId + "]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        assertThat(assignmentRepository.findByCleanerId(cleaner.getId()))
                .extracting(CleanerGeofenceAssignment::getGeofenceId)
                .containsExactly(geofenceId);
    }

    @Test
    void polygonWithTwoVerticesIsRejected() throws Exception {
        mvc.perform(post("/api/company/geofences")
                        .with(user("boss@sparkle.example").roles("COMPANY_ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Line\",\"polygon\":[[25.07,55.12],[25.10,55.16]]}"))
                .andExpect(status().isBadRequest());
    }
}
